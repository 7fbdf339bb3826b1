package net.pagewise.core.model;

public enum JobStatus {
    QUEUED, ACTIVE, PAUSED, COMPLETED, FAILED, UNKNOWN;

    public static JobStatus from(String s) {
        if (s == null) return UNKNOWN;
        try { return JobStatus.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }

    public String code() { return name().toLowerCase(); }

    /** completed/failed: 관리자 reset 외에는 변경 불가 */
    public boolean isTerminal() { return this == COMPLETED || this == FAILED; }
}
