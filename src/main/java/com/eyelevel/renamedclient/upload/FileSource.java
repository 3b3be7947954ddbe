package com.eyelevel.renamedclient.upload;

import com.eyelevel.renamedclient.exception.apiclient.ValidationException;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A file ready to be attached to a multipart upload: its name, its bytes and its content type.
 *
 * <p>Instances are built from a path, an in-memory buffer or a stream. Streams are read fully and are not
 * closed. The content array is used as-is and must not be modified while a request is in flight.
 *
 * @param filename    The name sent in the part's {@code Content-Disposition}.
 * @param content     The raw file bytes.
 * @param contentType The MIME type sent with the part.
 */
public record FileSource(String filename, byte[] content, String contentType) {

    static final String DEFAULT_FILENAME = "file";

    public FileSource {
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(contentType, "contentType must not be null");
    }

    /**
     * Reads a file from disk; the content type is inferred from its name.
     *
     * @throws ValidationException if the file cannot be read.
     */
    public static FileSource of(Path path) {
        return of(path, null);
    }

    /**
     * Reads a file from disk, optionally overriding the name sent to the server.
     *
     * @throws ValidationException if the file cannot be read.
     */
    public static FileSource of(Path path, @Nullable String filename) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            byte[] content = Files.readAllBytes(path);
            String name = filename != null ? filename : path.getFileName().toString();
            return new FileSource(name, content, MimeTypes.fromFilename(name));
        } catch (IOException e) {
            throw new ValidationException("Failed to read file: " + e.getMessage(), e);
        }
    }

    public static FileSource of(byte[] content, @Nullable String filename) {
        String name = filename == null || filename.isBlank() ? DEFAULT_FILENAME : filename;
        return new FileSource(name, content, MimeTypes.fromFilename(name));
    }

    /**
     * Reads a stream to its end. Any directory part of the name is dropped.
     *
     * @throws ValidationException if the stream cannot be read.
     */
    public static FileSource of(InputStream inputStream, @Nullable String filename) {
        Objects.requireNonNull(inputStream, "inputStream must not be null");
        try {
            byte[] content = IOUtils.toByteArray(inputStream);
            String name = filename == null || filename.isBlank() ? DEFAULT_FILENAME : FilenameUtils.getName(filename);
            return new FileSource(name, content, MimeTypes.fromFilename(name));
        } catch (IOException e) {
            throw new ValidationException("Failed to read input stream: " + e.getMessage(), e);
        }
    }

    public long size() {
        return content.length;
    }

    @Override
    public String toString() {
        return "FileSource[filename=" + filename + ", size=" + content.length + ", contentType=" + contentType + "]";
    }
}
