package net.pagewise.core.model;

import java.time.Duration;
import java.util.List;

public record Chunk(
        List<UpstreamItem> items,
        String newCursor,
        RateLimitSnapshot rateLimit,
        boolean exhausted,
        Duration suggestedDelay,
        Long totalCount
) {
    public Chunk {
        items = items == null ? List.of() : List.copyOf(items);
        suggestedDelay = suggestedDelay == null ? Duration.ZERO : suggestedDelay;
    }

    public String lastItemKey() {
        return items.isEmpty() ? null : items.get(items.size() - 1).naturalKey();
    }
}
