package com.actiongate.failover;

import com.actiongate.driver.DriverException;
import com.actiongate.error.UpstreamPermanentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class UpstreamErrorClassifierTest {

    private final UpstreamErrorClassifier classifier = new UpstreamErrorClassifier();

    @Test
    void timeoutsAreTransient() {
        assertEquals(ErrorClass.TRANSIENT, classifier.classify(new TimeoutException()));
    }

    @ParameterizedTest
    @ValueSource(ints = {429, 500, 502, 503})
    void throttlingAndServerErrorsAreTransient(int status) {
        assertTrue(classifier.isTransient(new UpstreamStatusException(status, "upstream said no")));
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 401, 404})
    void otherClientErrorsArePermanent(int status) {
        assertFalse(classifier.isTransient(new UpstreamStatusException(status, "bad request")));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "read ECONNRESET",
        "Connection reset by peer",
        "request timed out after 30s",
        "429 Too Many Requests",
        "HTTP 502 from upstream",
        "status=503"
    })
    void transientMessages(String message) {
        assertTrue(classifier.isTransient(new RuntimeException(message)));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "invalid params",
        "insufficient funds",
        "order 5000 rejected",
        "program error 0x1771"
    })
    void permanentMessages(String message) {
        assertFalse(classifier.isTransient(new RuntimeException(message)));
    }

    @Test
    @DisplayName("cause chain is inspected")
    void wrappedConnectFailureIsTransient() {
        RuntimeException wrapped = new RuntimeException("driver failed", new ConnectException("refused"));
        assertTrue(classifier.isTransient(wrapped));
    }

    @Test
    void timeoutsAnywhereInTheChainAreTimeouts() {
        assertTrue(classifier.isTimeout(new RuntimeException("send failed", new SocketTimeoutException("read"))));
        assertTrue(classifier.isTimeout(new TimeoutException()));
        assertFalse(classifier.isTimeout(new UpstreamStatusException(503, "unavailable")));
        assertFalse(classifier.isTimeout(new ConnectException("refused")));
    }

    @Test
    void driverErrorsArePermanentByDefault() {
        assertEquals(ErrorClass.PERMANENT, classifier.classify(new DriverException("BUILD_ERROR", "bad amount")));
    }

    @Test
    void alreadyClassifiedPermanentIsNotReopened() {
        UpstreamPermanentException ex = new UpstreamPermanentException("X", "bad",
            new UpstreamStatusException(503, "unavailable"));
        assertFalse(classifier.isTransient(ex));
    }
}
