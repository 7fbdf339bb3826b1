package net.pagewise.core.model;

public enum ErrorKind {
    /** network blip, 5xx, timeout: 다음 틱에 재시도 */
    TRANSIENT,
    /** quota 소진: resetAt 까지 일시정지 */
    RATE_LIMITED,
    /** 재시도해도 소용없음: failed 로 종료 */
    FATAL,
    /** 다른 워커가 잡을 점유 중: no-op */
    LOCK_CONTENTION
}
