package net.pagewise.core.error;

/** SLOW 레인 JobRecord 저장 실패. 호출자는 같은 요청을 재시도해야 한다 */
public class RetryableSubmissionException extends Exception {
    public RetryableSubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
