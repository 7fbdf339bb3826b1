package net.pagewise.core.spi;

import net.pagewise.core.model.Lane;
import net.pagewise.core.model.Submission;
import net.pagewise.core.model.WorkItem;

/** 레인별 실행 방식 (FAST: inline 실행, SLOW: 큐잉). 런타임 토폴로지는 구현체가 결정 */
public interface LaneExecutor {
    Lane lane();

    Submission execute(WorkItem item) throws Exception;
}
