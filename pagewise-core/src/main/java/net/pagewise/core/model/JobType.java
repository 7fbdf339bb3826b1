package net.pagewise.core.model;

public enum JobType {
    PR_SYNC("pr-sync"),
    ISSUE_SYNC("issue-sync"),
    REVIEW_SYNC("review-sync"),
    COMMENT_SYNC("comment-sync"),
    EMBEDDING_COMPUTE("embedding-compute");

    private final String code;

    JobType(String code) { this.code = code; }

    public String code() { return code; }

    /** "pr-sync" / "PR_SYNC" 둘 다 허용 */
    public static JobType from(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("jobType is required");
        for (JobType t : values()) {
            if (t.code.equalsIgnoreCase(s) || t.name().equalsIgnoreCase(s)) return t;
        }
        throw new IllegalArgumentException("Unknown jobType: " + s);
    }
}
