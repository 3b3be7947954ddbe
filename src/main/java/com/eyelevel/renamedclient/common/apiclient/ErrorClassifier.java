package com.eyelevel.renamedclient.common.apiclient;

import com.eyelevel.renamedclient.exception.apiclient.ApiException;
import com.eyelevel.renamedclient.exception.apiclient.AuthenticationException;
import com.eyelevel.renamedclient.exception.apiclient.InsufficientCreditsException;
import com.eyelevel.renamedclient.exception.apiclient.RateLimitException;
import com.eyelevel.renamedclient.exception.apiclient.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Maps an HTTP error response to the client's exception taxonomy.
 *
 * <p>The message is the body's {@code error} field when the body is a JSON object carrying one, otherwise the
 * status reason phrase.
 */
@Slf4j
public final class ErrorClassifier {

    static final String ERROR_FIELD = "error";
    static final String RETRY_AFTER_FIELD = "retryAfter";

    private ErrorClassifier() {
    }

    /**
     * @param statusCode The HTTP status code, 400 or above.
     * @param statusText The status reason phrase, used when the body carries no message.
     * @param body       The decoded body: a {@link Map} for JSON objects, the raw text otherwise, or null.
     *
     * @return The typed exception. Never null.
     */
    public static ApiException classify(int statusCode, @Nullable String statusText, @Nullable Object body) {
        String message = extractMessage(statusCode, statusText, body);
        ApiException exception = switch (statusCode) {
            case 401 -> new AuthenticationException(message);
            case 402 -> new InsufficientCreditsException(message);
            case 400, 422 -> new ValidationException(message, statusCode, body);
            case 429 -> new RateLimitException(message, extractRetryAfter(body), body);
            default -> new ApiException(message, statusCode, body);
        };
        log.debug("Classified status {} as {}", statusCode, exception.getCode());
        return exception;
    }

    private static String extractMessage(int statusCode, @Nullable String statusText, @Nullable Object body) {
        if (body instanceof Map<?, ?> map && map.get(ERROR_FIELD) != null) {
            return String.valueOf(map.get(ERROR_FIELD));
        }
        if (statusText != null && !statusText.isBlank()) {
            return statusText;
        }
        return "HTTP " + statusCode;
    }

    @Nullable
    private static Integer extractRetryAfter(@Nullable Object body) {
        if (body instanceof Map<?, ?> map && map.get(RETRY_AFTER_FIELD) instanceof Number seconds) {
            return seconds.intValue();
        }
        return null;
    }
}
