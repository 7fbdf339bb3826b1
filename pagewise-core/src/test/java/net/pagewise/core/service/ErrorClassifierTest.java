package net.pagewise.core.service;

import net.pagewise.core.error.RateLimitExceededException;
import net.pagewise.core.error.SchemaMismatchException;
import net.pagewise.core.error.UnsupportedJobTypeException;
import net.pagewise.core.error.UpstreamHttpException;
import net.pagewise.core.model.ErrorKind;
import net.pagewise.core.model.JobType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorClassifierTest {

    final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void rateLimitSignals() {
        Instant reset = Instant.parse("2024-05-01T01:00:00Z");

        assertEquals(ErrorKind.RATE_LIMITED, classifier.classify(new RateLimitExceededException("quota", reset)));
        assertEquals(ErrorKind.RATE_LIMITED, classifier.classify(new UpstreamHttpException(429, "slow down")));
        assertEquals(ErrorKind.RATE_LIMITED,
                classifier.classify(new UpstreamHttpException(403, "API rate limit exceeded", 0, reset)));

        assertEquals(reset, classifier.resetAt(new RateLimitExceededException("quota", reset)));
        assertEquals(reset, classifier.resetAt(new ExecutionException(new UpstreamHttpException(403, "x", 0, reset))));
    }

    @Test
    void transientSignals() {
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new TimeoutException("fetch")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new SQLTimeoutException("ORA-01013")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new SocketTimeoutException("read timed out")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new SQLTransientConnectionException("pool")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new IOException("connection reset")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new UpstreamHttpException(502, "bad gateway")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new UpstreamHttpException(408, "timeout")));
        assertEquals(ErrorKind.TRANSIENT, classifier.classify(new IllegalStateException("something odd")));
    }

    @Test
    void fatalSignals() {
        assertEquals(ErrorKind.FATAL, classifier.classify(new UpstreamHttpException(404, "Not Found")));
        assertEquals(ErrorKind.FATAL, classifier.classify(new UpstreamHttpException(401, "Bad credentials")));
        assertEquals(ErrorKind.FATAL, classifier.classify(new UpstreamHttpException(403, "forbidden", 4000, null)));
        assertEquals(ErrorKind.FATAL, classifier.classify(new SchemaMismatchException("no items field")));
        assertEquals(ErrorKind.FATAL,
                classifier.classify(new UnsupportedJobTypeException(JobType.EMBEDDING_COMPUTE, "github-rest")));
        assertEquals(ErrorKind.FATAL, classifier.classify(new IllegalStateException("Repository is archived")));
    }

    @Test
    void wrappersAreUnwrapped() {
        assertEquals(ErrorKind.FATAL,
                classifier.classify(new ExecutionException(new UpstreamHttpException(410, "gone"))));
        assertEquals(ErrorKind.RATE_LIMITED,
                classifier.classify(new CompletionException(new RateLimitExceededException("q", null))));
        assertEquals(ErrorKind.TRANSIENT,
                classifier.classify(new RuntimeException(new SQLTimeoutException("slow"))));
        assertTrue(ErrorClassifier.isTimeout(new ExecutionException(new TimeoutException())));
        assertFalse(ErrorClassifier.isTimeout(new IOException("reset")));
    }
}
