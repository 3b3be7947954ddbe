package com.eyelevel.renamedclient.upload;

import org.apache.commons.io.FilenameUtils;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.lang.Nullable;

import java.util.Locale;
import java.util.Map;

/**
 * Infers the content type of an upload from its file name.
 *
 * <p>The document formats the service accepts are resolved from a fixed table. Anything else falls back to
 * Spring's {@link MediaTypeFactory} and finally to {@code application/octet-stream}.
 */
public final class MimeTypes {

    public static final String DEFAULT_CONTENT_TYPE = MediaType.APPLICATION_OCTET_STREAM_VALUE;

    private static final Map<String, String> KNOWN_TYPES = Map.of(
            "pdf", MediaType.APPLICATION_PDF_VALUE,
            "jpg", MediaType.IMAGE_JPEG_VALUE,
            "jpeg", MediaType.IMAGE_JPEG_VALUE,
            "png", MediaType.IMAGE_PNG_VALUE,
            "tiff", "image/tiff",
            "tif", "image/tiff");

    private MimeTypes() {
    }

    public static String fromFilename(@Nullable String filename) {
        if (filename == null || filename.isBlank()) {
            return DEFAULT_CONTENT_TYPE;
        }
        String extension = FilenameUtils.getExtension(filename).toLowerCase(Locale.ROOT);
        String known = KNOWN_TYPES.get(extension);
        if (known != null) {
            return known;
        }
        return MediaTypeFactory.getMediaType(filename)
                .map(MediaType::toString)
                .orElse(DEFAULT_CONTENT_TYPE);
    }
}
