package net.pagewise.core.spi;

import net.pagewise.core.model.JobType;
import net.pagewise.core.model.RawPage;

/** upstream 페이지네이션 API (GitHub REST/GraphQL 등). 호출 한 번 = 페이지 한 장 */
public interface UpstreamPageSource {
    RawPage fetchPage(JobType jobType, String targetId, String cursor, int pageSize) throws Exception;
}
