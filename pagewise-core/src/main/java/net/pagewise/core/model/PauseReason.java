package net.pagewise.core.model;

public enum PauseReason {
    TOO_MANY_ERRORS("too_many_errors"),
    RATE_LIMITED("rate_limited"),
    MANUAL("manual");

    private final String code;

    PauseReason(String code) { this.code = code; }

    public String code() { return code; }

    public static PauseReason from(String s) {
        if (s == null) return null;
        for (PauseReason r : values()) {
            if (r.code.equalsIgnoreCase(s) || r.name().equalsIgnoreCase(s)) return r;
        }
        return null;
    }
}
