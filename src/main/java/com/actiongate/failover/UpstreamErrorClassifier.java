package com.actiongate.failover;

import com.actiongate.error.UpstreamPermanentException;
import com.actiongate.error.UpstreamTransientException;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Splits upstream failures into transient (timeouts, connection resets and refusals, DNS, HTTP 429
 * and 5xx) and permanent (everything else, including other 4xx).
 */
public class UpstreamErrorClassifier {

    private static final List<String> TRANSIENT_MARKERS = List.of(
        "timeout", "timed out", "econnreset", "connection reset", "econnrefused", "connection refused",
        "enotfound", "eai_again", "unknown host", "fetch failed", "rate limit", "too many requests",
        "gateway timeout", "service unavailable", "socket hang up"
    );

    private static final Pattern HTTP_STATUS = Pattern.compile("(status|http)[ :=]*(429|5\\d\\d)\\b");

    public ErrorClass classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            ErrorClass direct = classifyOne(t);
            if (direct != null) {
                return direct;
            }
        }
        return ErrorClass.PERMANENT;
    }

    public boolean isTransient(Throwable error) {
        return classify(error) == ErrorClass.TRANSIENT;
    }

    /**
     * True when the failure is a timeout anywhere in the cause chain, i.e. the request may have been
     * delivered even though no answer came back.
     */
    public boolean isTimeout(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private ErrorClass classifyOne(Throwable t) {
        if (t instanceof UpstreamTransientException) {
            return ErrorClass.TRANSIENT;
        }
        if (t instanceof UpstreamPermanentException) {
            return ErrorClass.PERMANENT;
        }
        if (t instanceof TimeoutException
                || t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof ConnectException
                || t instanceof UnknownHostException) {
            return ErrorClass.TRANSIENT;
        }
        if (t instanceof UpstreamStatusException status) {
            int code = status.getStatusCode();
            return code == 429 || code >= 500 ? ErrorClass.TRANSIENT : ErrorClass.PERMANENT;
        }
        String message = t.getMessage();
        if (message != null) {
            String lower = message.toLowerCase(Locale.ROOT);
            for (String marker : TRANSIENT_MARKERS) {
                if (lower.contains(marker)) {
                    return ErrorClass.TRANSIENT;
                }
            }
            if (HTTP_STATUS.matcher(lower).find()) {
                return ErrorClass.TRANSIENT;
            }
        }
        return null;
    }
}
