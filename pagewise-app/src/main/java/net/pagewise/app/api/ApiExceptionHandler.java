package net.pagewise.app.api;

import net.pagewise.core.error.JobNotFoundException;
import net.pagewise.core.error.RateLimitExceededException;
import net.pagewise.core.error.RetryableSubmissionException;
import net.pagewise.core.error.SchemaMismatchException;
import net.pagewise.core.error.UnsupportedJobTypeException;
import net.pagewise.core.error.UpstreamHttpException;
import net.pagewise.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Duration;
import java.time.Instant;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final long SUBMISSION_RETRY_AFTER_SECONDS = 5;

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler({IllegalArgumentException.class, UnsupportedJobTypeException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        log.debug("bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", msg));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> unreadable(Exception e) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("bad_request", "malformed request"));
    }

    @ExceptionHandler(JobNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(JobNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("not_found", e.getMessage()));
    }

    // 허용되지 않는 상태 전이 (paused 가 아닌 잡 resume, terminal 잡 chunk-size 변경 등)
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of("conflict", e.getMessage()));
    }

    @ExceptionHandler(RetryableSubmissionException.class)
    public ResponseEntity<ErrorResponse> retryable(RetryableSubmissionException e) {
        log.warn("submission not persisted: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(SUBMISSION_RETRY_AFTER_SECONDS))
                .body(ErrorResponse.of("retry", e.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> rateLimited(RateLimitExceededException e) {
        return tooManyRequests(e.getResetAt(), e.getMessage());
    }

    @ExceptionHandler(UpstreamHttpException.class)
    public ResponseEntity<ErrorResponse> upstream(UpstreamHttpException e) {
        boolean quota = e.getStatus() == 429
                || (e.getStatus() == 403 && e.getRateLimitRemaining() != null && e.getRateLimitRemaining() == 0);
        if (quota) return tooManyRequests(e.getResetAt(), e.getMessage());
        log.warn("upstream failure on inline request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of("upstream", e.getMessage()));
    }

    // upstream 이 기대와 다른 형태로 응답: 요청 자체는 정상이므로 502
    @ExceptionHandler(SchemaMismatchException.class)
    public ResponseEntity<ErrorResponse> upstreamSchema(SchemaMismatchException e) {
        log.warn("unexpected upstream response on inline request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of("upstream", e.getMessage()));
    }

    private ResponseEntity<ErrorResponse> tooManyRequests(Instant resetAt, String message) {
        long seconds = 60;
        if (resetAt != null) {
            seconds = Math.max(1, Duration.between(clock.now(), resetAt).getSeconds());
        }
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(seconds))
                .body(ErrorResponse.of("rate_limited", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> unexpected(Exception e) {
        log.error("unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("internal", "unexpected error"));
    }
}
