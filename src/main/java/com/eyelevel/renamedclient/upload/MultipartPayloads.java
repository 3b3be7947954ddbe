package com.eyelevel.renamedclient.upload;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.util.MultiValueMap;

import java.util.Map;

/**
 * Builds {@code multipart/form-data} bodies for uploads: one file part plus string-valued form fields.
 */
@Slf4j
public final class MultipartPayloads {

    public static final String FILE_PART = "file";

    private MultipartPayloads() {
    }

    /**
     * @param file   The file to attach under the {@value #FILE_PART} part.
     * @param fields Auxiliary form fields, written in iteration order. Null values are skipped.
     *
     * @return The parts, ready for {@code BodyInserters.fromMultipartData}.
     */
    public static MultiValueMap<String, HttpEntity<?>> build(FileSource file, Map<String, String> fields) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part(FILE_PART, new NamedByteArrayResource(file.content(), file.filename()))
                .filename(file.filename())
                .contentType(MediaType.parseMediaType(file.contentType()));

        fields.forEach((name, value) -> {
            if (value != null) {
                builder.part(name, value);
            }
        });
        log.trace("Built multipart payload for '{}' with fields {}", file.filename(), fields.keySet());
        return builder.build();
    }

    /**
     * A byte array resource that reports a file name, which the multipart writer needs to emit a file part.
     */
    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        private NamedByteArrayResource(byte[] content, String filename) {
            super(content);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return filename;
        }

        @Override
        public boolean equals(Object other) {
            return super.equals(other) && other instanceof NamedByteArrayResource named
                    && filename.equals(named.filename);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + filename.hashCode();
        }
    }
}
