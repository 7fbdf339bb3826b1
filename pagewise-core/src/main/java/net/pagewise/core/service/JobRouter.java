package net.pagewise.core.service;

import net.pagewise.core.model.DurationClass;
import net.pagewise.core.model.Lane;
import net.pagewise.core.model.Submission;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.spi.LaneExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 들어온 작업을 FAST(요청 안에서 처리) / SLOW(JobRecord 로 큐잉) 중 하나로 보낸다.
 * 같은 입력이면 항상 같은 레인이다.
 */
public final class JobRouter {
    private static final Logger log = LoggerFactory.getLogger(JobRouter.class);

    public static final int DEFAULT_FAN_OUT_THRESHOLD = 10;

    private final LaneTable table;
    private final int fanOutThreshold;
    private final Map<Lane, LaneExecutor> executors = new EnumMap<>(Lane.class);

    public JobRouter(LaneTable table, int fanOutThreshold, List<LaneExecutor> executors) {
        this.table = table;
        this.fanOutThreshold = fanOutThreshold;
        for (LaneExecutor e : executors) this.executors.put(e.lane(), e);
        for (Lane lane : Lane.values()) {
            if (!this.executors.containsKey(lane)) {
                throw new IllegalArgumentException("no executor for lane " + lane);
            }
        }
    }

    public Lane classify(WorkItem item) {
        DurationClass duration = item.estimatedDurationClass();
        Lane lane = table.lookup(item.sourceEvent())
                .orElse(duration == DurationClass.SHORT ? Lane.FAST : Lane.SLOW);

        if (lane == Lane.FAST && duration == DurationClass.LONG) lane = Lane.SLOW;
        // fan-out 이 크면 이벤트 종류와 상관없이 SLOW
        if (item.affectedTargetCount() > fanOutThreshold) lane = Lane.SLOW;
        return lane;
    }

    public Submission submit(WorkItem item) throws Exception {
        if (item.jobType() == null) throw new IllegalArgumentException("jobType is required");
        if (item.targetId() == null || item.targetId().isBlank()) {
            throw new IllegalArgumentException("targetId is required");
        }

        Lane lane = classify(item);
        log.debug("routing {} {} ({}, fan-out {}) → {}", item.sourceEvent(), item.targetId(),
                item.estimatedDurationClass(), item.affectedTargetCount(), lane);
        return executors.get(lane).execute(item);
    }
}
