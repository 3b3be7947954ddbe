package com.eyelevel.renamedclient.common.diagnostics;

import org.springframework.lang.Nullable;

import java.net.URI;
import java.util.Locale;

/**
 * Formatting helpers for diagnostic output. Nothing here may reveal credentials or signed query strings.
 */
public final class DiagnosticFormats {

    private static final int SHORT_JOB_ID_LENGTH = 8;

    private DiagnosticFormats() {
    }

    /**
     * Masks an API key to its first 3 and last 4 characters, e.g. {@code rt_...wxyz}. Keys shorter than 8
     * characters are fully hidden.
     */
    public static String maskApiKey(@Nullable String apiKey) {
        if (apiKey == null || apiKey.length() < 8) {
            return "***";
        }
        return apiKey.substring(0, 3) + "..." + apiKey.substring(apiKey.length() - 4);
    }

    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f KB", bytes / 1024.0);
        }
        if (bytes < 1024L * 1024 * 1024) {
            return String.format(Locale.ROOT, "%.1f MB", bytes / (1024.0 * 1024.0));
        }
        return String.format(Locale.ROOT, "%.1f GB", bytes / (1024.0 * 1024.0 * 1024.0));
    }

    /**
     * Reduces a request URL to something safe to log: the part after the base URL when the URL belongs to the
     * service, otherwise only the URL's path. Query strings are always dropped since download links carry
     * signatures there.
     */
    public static String displayPath(String url, String baseUrl) {
        String withoutQuery = stripQuery(url);
        if (withoutQuery.startsWith(baseUrl)) {
            String remainder = withoutQuery.substring(baseUrl.length());
            return remainder.isEmpty() ? "/" : remainder;
        }
        if (withoutQuery.startsWith("http://") || withoutQuery.startsWith("https://")) {
            try {
                String path = URI.create(withoutQuery).getPath();
                return path == null || path.isEmpty() ? "/" : path;
            } catch (IllegalArgumentException e) {
                return "<invalid url>";
            }
        }
        return withoutQuery;
    }

    public static String shortJobId(@Nullable String jobId) {
        if (jobId == null) {
            return "unknown";
        }
        return jobId.length() > SHORT_JOB_ID_LENGTH ? jobId.substring(0, SHORT_JOB_ID_LENGTH) : jobId;
    }

    private static String stripQuery(String url) {
        int query = url.indexOf('?');
        return query >= 0 ? url.substring(0, query) : url;
    }
}
