package net.pagewise.core.spi;

import net.pagewise.core.model.WorkItem;

/** FAST 레인 작업을 요청 스레드에서 처리하고 결과를 바로 돌려준다 */
@FunctionalInterface
public interface FastLaneHandler {
    Object handle(WorkItem item) throws Exception;
}
