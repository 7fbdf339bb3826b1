package net.pagewise.core.model;

import java.util.List;

public record RawPage(
        List<UpstreamItem> items,
        String nextCursor,
        boolean hasNextPage,
        Long totalCount,        // upstream 이 알려주면, 모르면 null
        RateLimitSnapshot rateLimit
) {
    public RawPage {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
