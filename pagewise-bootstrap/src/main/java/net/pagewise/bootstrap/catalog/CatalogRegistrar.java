package net.pagewise.bootstrap.catalog;

import net.pagewise.bootstrap.props.PagewiseProperties;
import net.pagewise.core.model.DurationClass;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.Submission;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.spi.LaneExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 설정에 적힌 백필 잡을 기동 시 큐잉한다.
 * (jobType, targetId) 기준 멱등이라 재기동해도 잡이 늘지 않는다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    public static final String SOURCE_EVENT = "catalog.backfill";

    private final LaneExecutor queue;

    public CatalogRegistrar(LaneExecutor queue) {
        this.queue = queue;
    }

    public void register(PagewiseProperties.Catalog catalog) throws Exception {
        for (var b : catalog.getBackfills()) {
            register(b);
        }
    }

    private void register(PagewiseProperties.Backfill def) throws Exception {
        if (def.getJobType() == null || def.getTargetId() == null || def.getTargetId().isBlank()) {
            throw new IllegalArgumentException("backfill.jobType and backfill.targetId are required");
        }
        JobType type = JobType.from(def.getJobType());

        var item = new WorkItem(SOURCE_EVENT, type, def.getTargetId(), 1, DurationClass.LONG,
                def.getTotalEstimate(), Map.of());
        Submission s = queue.execute(item);

        log.info("Catalog registered: {} {} -> job {} ({})", type.code(), def.getTargetId(), s.jobId(), s.jobStatus());
    }
}
