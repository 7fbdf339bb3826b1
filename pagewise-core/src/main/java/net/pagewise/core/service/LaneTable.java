package net.pagewise.core.service;

import net.pagewise.core.model.Lane;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** 이벤트 → 기본 레인 정적 테이블 */
public final class LaneTable {
    private final Map<String, Lane> lanes;

    private LaneTable(Map<String, Lane> lanes) {
        this.lanes = Map.copyOf(lanes);
    }

    public static LaneTable defaults() {
        Map<String, Lane> m = new LinkedHashMap<>();
        m.put("pull_request.edited", Lane.FAST);
        m.put("pull_request.labeled", Lane.FAST);
        m.put("issues.edited", Lane.FAST);
        m.put("issue_comment.created", Lane.FAST);
        m.put("check_run.completed", Lane.FAST);
        m.put("status", Lane.FAST);

        m.put("repository.resync", Lane.SLOW);
        m.put("installation.created", Lane.SLOW);
        m.put("workspace.repository_added", Lane.SLOW);
        m.put("backfill.requested", Lane.SLOW);
        m.put("embedding.recompute", Lane.SLOW);
        return new LaneTable(m);
    }

    public static LaneTable of(Map<String, Lane> lanes) {
        return new LaneTable(lanes);
    }

    /** 기본 테이블 위에 설정값을 덮어쓴다 */
    public LaneTable withOverrides(Map<String, Lane> overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        Map<String, Lane> m = new LinkedHashMap<>(lanes);
        m.putAll(overrides);
        return new LaneTable(m);
    }

    public Optional<Lane> lookup(String sourceEvent) {
        if (sourceEvent == null) return Optional.empty();
        return Optional.ofNullable(lanes.get(sourceEvent));
    }

    public Map<String, Lane> asMap() {
        return lanes;
    }
}
