package net.pagewise.core.model;

import java.util.Objects;

/** upstream 엔티티 하나. naturalKey 기준으로 멱등 upsert 된다 */
public record UpstreamItem(String naturalKey, String payload) {
    public UpstreamItem {
        Objects.requireNonNull(naturalKey, "naturalKey");
    }
}
