package me.golemcore.artifactor.domain.resilience;

import me.golemcore.artifactor.domain.exception.ModelCallException;
import me.golemcore.artifactor.domain.model.ErrorClass;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.SocketTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    @ParameterizedTest
    @CsvSource({
            "429, TRANSIENT",
            "400, CLIENT",
            "401, CLIENT",
            "404, CLIENT",
            "500, SERVER",
            "503, SERVER",
            "302, UNKNOWN"
    })
    void shouldClassifyByStatusCode(int status, ErrorClass expected) {
        assertEquals(expected, ErrorClassifier.classify(new ModelCallException("failed", status)));
    }

    @Test
    void shouldPreferStatusOverMessage() {
        ModelCallException error = new ModelCallException("connection timed out", 401);

        assertEquals(ErrorClass.CLIENT, ErrorClassifier.classify(error));
    }

    @Test
    void shouldClassifyTimeoutTypes() {
        assertEquals(ErrorClass.TIMEOUT, ErrorClassifier.classify(new TimeoutException()));
        assertEquals(ErrorClass.TIMEOUT, ErrorClassifier.classify(new SocketTimeoutException("read")));
    }

    @Test
    void shouldLookThroughCompletionWrappers() {
        CompletionException wrapped = new CompletionException(new ModelCallException("overloaded", 503));

        assertEquals(ErrorClass.SERVER, ErrorClassifier.classify(wrapped));
        assertTrue(ErrorClassifier.isRetryable(wrapped));
    }

    @ParameterizedTest
    @CsvSource({
            "'Request timed out', TIMEOUT",
            "'rate limit exceeded', TRANSIENT",
            "'upstream returned 502', SERVER",
            "'Connection reset by peer', TRANSIENT",
            "'HTTP 403 forbidden', CLIENT",
            "'something odd', UNKNOWN"
    })
    void shouldClassifyByMessage(String message, ErrorClass expected) {
        assertEquals(expected, ErrorClassifier.classify(new RuntimeException(message)));
    }

    @Test
    void shouldTreatNullAsUnknown() {
        assertEquals(ErrorClass.UNKNOWN, ErrorClassifier.classify(null));
        assertFalse(ErrorClassifier.isRateLimit(null));
    }

    @Test
    void shouldDetectRateLimit() {
        assertTrue(ErrorClassifier.isRateLimit(new ModelCallException("slow down", 429)));
        assertTrue(ErrorClassifier.isRateLimit(new RuntimeException("rate_limit_error")));
        assertFalse(ErrorClassifier.isRateLimit(new ModelCallException("rate limit", 500)));
    }

    @Test
    void shouldNotRetryClientOrUnknown() {
        assertFalse(ErrorClass.CLIENT.isRetryable());
        assertFalse(ErrorClass.UNKNOWN.isRetryable());
        assertTrue(ErrorClass.TIMEOUT.isRetryable());
    }
}
