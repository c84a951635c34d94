package io.tick4j.resilience;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps an upstream failure to an {@link ErrorKind}.
 *
 * <p>Rules are checked in {@link ErrorKind} declaration order and the first match wins. Every
 * throwable of the cause chain is inspected: its type, an {@link UpstreamStatusException} status,
 * a status code embedded in the message (e.g. {@code "returned code 503"}), and message keywords.
 */
public class ErrorClassifier {

    private static final int MAX_CAUSE_DEPTH = 8;

    private static final Pattern STATUS_IN_MESSAGE = Pattern.compile(
            "(?i)(?:returned code|status code|status|http)\\s*[:=]?\\s*(\\d{3})\\b");

    private static final List<String> RATE_LIMIT_HINTS = List.of(
            "rate limit", "ratelimit", "too many requests", "quota", "invoked too many times");

    private static final List<String> UNAUTHORIZED_HINTS = List.of(
            "unauthorized", "unauthorised", "forbidden", "permission", "access denied",
            "invalid_grant", "authorization is required");

    private static final List<String> NETWORK_HINTS = List.of(
            "timeout", "timed out", "connection", "unavailable", "bad gateway", "gateway",
            "network", "dns");

    private static final List<String> DOMAIN_GONE_HINTS = List.of(
            "thread not found", "message not found", "mailbox not found", "label not found",
            "no longer exists", "invalid thread id", "invalid message id");

    public ErrorKind classify(Throwable error) {
        if (error == null) {
            return ErrorKind.UNKNOWN;
        }

        List<Throwable> chain = causeChain(error);
        for (Throwable t : chain) {
            if (t instanceof ClassifiedCallException c) {
                return c.getKind();
            }
        }

        if (anyMatch(chain, this::isRateLimited)) {
            return ErrorKind.RATE_LIMITED;
        }
        if (anyMatch(chain, this::isUnauthorized)) {
            return ErrorKind.UNAUTHORIZED;
        }
        if (anyMatch(chain, this::isNetworkUnavailable)) {
            return ErrorKind.NETWORK_UNAVAILABLE;
        }
        if (anyMatch(chain, this::isDomainBoundaryGone)) {
            return ErrorKind.DOMAIN_BOUNDARY_GONE;
        }
        if (anyMatch(chain, this::isGenericUpstream)) {
            return ErrorKind.GENERIC_UPSTREAM;
        }
        return ErrorKind.UNKNOWN;
    }

    private boolean isRateLimited(Throwable t) {
        return status(t) == 429 || messageContains(t, RATE_LIMIT_HINTS);
    }

    private boolean isUnauthorized(Throwable t) {
        int status = status(t);
        return status == 401 || status == 403 || messageContains(t, UNAUTHORIZED_HINTS);
    }

    private boolean isNetworkUnavailable(Throwable t) {
        if (t instanceof SocketTimeoutException
                || t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof HttpTimeoutException
                || t instanceof TimeoutException) {
            return true;
        }
        int status = status(t);
        return status == 408 || status == 502 || status == 503 || status == 504
                || messageContains(t, NETWORK_HINTS);
    }

    private boolean isDomainBoundaryGone(Throwable t) {
        if (t instanceof DomainBoundaryGoneException) {
            return true;
        }
        int status = status(t);
        return status == 404 || status == 410 || messageContains(t, DOMAIN_GONE_HINTS);
    }

    private boolean isGenericUpstream(Throwable t) {
        int status = status(t);
        return status >= 400 && status <= 599;
    }

    /**
     * Status carried by the throwable, or -1.
     */
    static int status(Throwable t) {
        if (t instanceof UpstreamStatusException u) {
            return u.getStatus();
        }
        String msg = t.getMessage();
        if (msg == null) {
            return -1;
        }
        Matcher m = STATUS_IN_MESSAGE.matcher(msg);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        return -1;
    }

    private static boolean messageContains(Throwable t, List<String> hints) {
        String msg = t.getMessage();
        if (msg == null || msg.isBlank()) {
            return false;
        }
        String lower = msg.toLowerCase(Locale.ROOT);
        for (String hint : hints) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }

    private static boolean anyMatch(List<Throwable> chain, Predicate<Throwable> rule) {
        for (Throwable t : chain) {
            if (rule.test(t)) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>(4);
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && !chain.contains(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
