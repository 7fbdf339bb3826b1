package net.pagewise.core.model;

/** FAST: 요청 스레드에서 즉시 처리, SLOW: JobRecord 로 큐잉 후 스케줄러가 처리 */
public enum Lane {
    FAST, SLOW;

    public String processingMode() {
        return this == FAST ? "inline" : "queued";
    }
}
