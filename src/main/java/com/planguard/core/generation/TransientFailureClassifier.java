package com.planguard.core.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a generation failure is worth retrying.
 *
 * Malformed model output is never transient: a Jackson parse or mapping
 * error anywhere in the cause chain makes the failure permanent, even though
 * Jackson reports it as an IOException. Beyond that, typed signals win: I/O
 * and timeout exceptions, HTTP 429 and 503 anywhere in the cause chain.
 * Otherwise the lowercased messages are scanned for connection, timeout and
 * rate-limit keywords.
 */
public class TransientFailureClassifier {

    static final List<String> TRANSIENT_SIGNALS = List.of(
            "connection",
            "timeout",
            "timed out",
            "internal",
            "resourceexhausted",
            "429",
            "rate limit",
            "rate_limit",
            "quota"
    );

    public boolean isTransient(Throwable error) {
        if (hasMalformedContent(error)) return false;

        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ResourceAccessException
                    || t instanceof SocketTimeoutException
                    || t instanceof IOException
                    || t instanceof HttpClientErrorException.TooManyRequests
                    || t instanceof HttpServerErrorException.ServiceUnavailable) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return isTransientMessage(fullMessage(error));
    }

    private static boolean hasMalformedContent(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof JsonProcessingException) return true;
            if (t.getCause() == t) break;
        }
        return false;
    }

    public boolean isTransientMessage(String message) {
        if (message == null) return false;
        String lower = message.toLowerCase(Locale.ROOT);
        for (String signal : TRANSIENT_SIGNALS) {
            if (lower.contains(signal)) return true;
        }
        return false;
    }

    public GenerationFailure classify(Throwable error) {
        String message = rootMessage(error);
        return isTransient(error)
                ? GenerationFailure.transientFailure(message)
                : GenerationFailure.permanent(message);
    }

    private static String fullMessage(Throwable error) {
        StringBuilder sb = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            sb.append(t.getClass().getSimpleName()).append(": ").append(t.getMessage()).append("\n");
            if (t.getCause() == t) break;
        }
        return sb.toString();
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
