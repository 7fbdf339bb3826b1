package net.pagewise.core.service;

import net.pagewise.core.error.RateLimitExceededException;
import net.pagewise.core.error.SchemaMismatchException;
import net.pagewise.core.error.UnsupportedJobTypeException;
import net.pagewise.core.error.UpstreamHttpException;
import net.pagewise.core.model.ErrorKind;

import java.io.IOException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 잡는 예외를 transient / rateLimited / fatal 로 분류한다. 상태 없음.
 */
public final class ErrorClassifier {

    /** 재시도해도 결과가 같은 upstream 오류 메시지 */
    private static final List<String> PERMANENT_MESSAGES = List.of(
            "repository not found",
            "invalid repository format",
            "repository is private",
            "repository is archived",
            "bad credentials",
            "unauthorized",
            "resource not accessible by integration"
    );

    public ErrorKind classify(Throwable error) {
        Throwable t = unwrap(error);
        if (t == null) return ErrorKind.TRANSIENT;

        if (t instanceof RateLimitExceededException) return ErrorKind.RATE_LIMITED;
        if (t instanceof UpstreamHttpException http) return classifyHttp(http);
        if (t instanceof SchemaMismatchException || t instanceof UnsupportedJobTypeException) return ErrorKind.FATAL;

        if (isTimeout(t)) return ErrorKind.TRANSIENT;
        if (t instanceof SQLTransientException || t instanceof IOException) return ErrorKind.TRANSIENT;
        if (t instanceof InterruptedException) return ErrorKind.TRANSIENT;

        if (matchesPermanentMessage(t.getMessage())) return ErrorKind.FATAL;
        return ErrorKind.TRANSIENT;
    }

    /** rate limit 계열이면 quota 리셋 시각, 아니면 null */
    public Instant resetAt(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof RateLimitExceededException r) return r.getResetAt();
        if (t instanceof UpstreamHttpException http) return http.getResetAt();
        return null;
    }

    public static boolean isTimeout(Throwable error) {
        Throwable t = unwrap(error);
        return t instanceof TimeoutException
                || t instanceof SQLTimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private ErrorKind classifyHttp(UpstreamHttpException http) {
        int status = http.getStatus();
        if (status == 429) return ErrorKind.RATE_LIMITED;
        // GitHub 는 primary rate limit 소진을 403 + remaining=0 으로 알려준다
        if (status == 403 && http.getRateLimitRemaining() != null && http.getRateLimitRemaining() == 0) {
            return ErrorKind.RATE_LIMITED;
        }
        if (status >= 500 || status == 408) return ErrorKind.TRANSIENT;
        if (status >= 400) return ErrorKind.FATAL;
        return ErrorKind.TRANSIENT;
    }

    private static boolean matchesPermanentMessage(String message) {
        if (message == null) return false;
        String m = message.toLowerCase(Locale.ROOT);
        return PERMANENT_MESSAGES.stream().anyMatch(m::contains);
    }

    static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        // RuntimeException(cause) 로 감싼 checked 예외
        if (t != null && t.getClass() == RuntimeException.class && t.getCause() != null) {
            return unwrap(t.getCause());
        }
        return t;
    }
}
