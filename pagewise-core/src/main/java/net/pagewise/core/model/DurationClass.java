package net.pagewise.core.model;

public enum DurationClass {
    SHORT, LONG, UNKNOWN;

    public static DurationClass from(String s) {
        if (s == null) return UNKNOWN;
        try { return DurationClass.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }
}
