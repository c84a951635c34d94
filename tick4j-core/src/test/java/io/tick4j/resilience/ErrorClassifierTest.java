package io.tick4j.resilience;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void statusCodesShouldMapToKinds() {
        assertEquals(ErrorKind.RATE_LIMITED, classifier.classify(new UpstreamStatusException(429, "slow down")));
        assertEquals(ErrorKind.UNAUTHORIZED, classifier.classify(new UpstreamStatusException(401, "nope")));
        assertEquals(ErrorKind.UNAUTHORIZED, classifier.classify(new UpstreamStatusException(403, "nope")));
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE, classifier.classify(new UpstreamStatusException(503, "down")));
        assertEquals(ErrorKind.DOMAIN_BOUNDARY_GONE, classifier.classify(new UpstreamStatusException(404, "missing")));
        assertEquals(ErrorKind.GENERIC_UPSTREAM, classifier.classify(new UpstreamStatusException(500, "oops")));
        assertEquals(ErrorKind.GENERIC_UPSTREAM, classifier.classify(new UpstreamStatusException(400, "bad")));
    }

    @Test
    void statusEmbeddedInMessageShouldBeRecognized() {
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE,
                classifier.classify(new IOException("Request failed with status code 503")));
        assertEquals(ErrorKind.GENERIC_UPSTREAM,
                classifier.classify(new IOException("Request failed: returned code 500")));
        assertEquals(ErrorKind.RATE_LIMITED,
                classifier.classify(new IOException("HTTP 429")));
    }

    @Test
    void messageHintsShouldBeRecognized() {
        assertEquals(ErrorKind.RATE_LIMITED, classifier.classify(new RuntimeException("User-rate limit exceeded")));
        assertEquals(ErrorKind.UNAUTHORIZED, classifier.classify(new RuntimeException("invalid_grant: token revoked")));
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE, classifier.classify(new RuntimeException("Connection reset by peer")));
        assertEquals(ErrorKind.DOMAIN_BOUNDARY_GONE, classifier.classify(new RuntimeException("Thread not found")));
    }

    @Test
    void networkExceptionTypesShouldBeRecognized() {
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE, classifier.classify(new SocketTimeoutException()));
        assertEquals(ErrorKind.NETWORK_UNAVAILABLE, classifier.classify(new ConnectException()));
        assertEquals(ErrorKind.DOMAIN_BOUNDARY_GONE, classifier.classify(new DomainBoundaryGoneException("gone")));
    }

    @Test
    void firstMatchingRuleShouldWin() {
        // rate limiting is checked before the network rule
        assertEquals(ErrorKind.RATE_LIMITED,
                classifier.classify(new RuntimeException("quota exceeded, connection closed")));
        assertEquals(ErrorKind.UNAUTHORIZED,
                classifier.classify(new UpstreamStatusException(403, "forbidden", new SocketTimeoutException())));
    }

    @Test
    void causeChainShouldBeInspected() {
        Exception wrapped = new IllegalStateException("listing failed", new UpstreamStatusException(410, "deleted"));
        assertEquals(ErrorKind.DOMAIN_BOUNDARY_GONE, classifier.classify(wrapped));

        Exception reclassified = new RuntimeException("outer",
                new ClassifiedCallException(ErrorKind.UNAUTHORIZED, 1, new RuntimeException("x")));
        assertEquals(ErrorKind.UNAUTHORIZED, classifier.classify(reclassified));
    }

    @Test
    void unrecognizedErrorsShouldBeUnknown() {
        assertEquals(ErrorKind.UNKNOWN, classifier.classify(new IllegalStateException("boom")));
        assertEquals(ErrorKind.UNKNOWN, classifier.classify(new NullPointerException()));
        assertEquals(ErrorKind.UNKNOWN, classifier.classify(null));
    }
}
