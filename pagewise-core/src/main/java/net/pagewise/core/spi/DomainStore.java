package net.pagewise.core.spi;

import net.pagewise.core.model.JobType;
import net.pagewise.core.model.UpstreamItem;

import java.util.List;

/** naturalKey 기준 멱등 upsert. 반환값은 반영한 행 수 */
public interface DomainStore {
    int upsertItems(JobType jobType, String targetId, List<UpstreamItem> items) throws Exception;
}
