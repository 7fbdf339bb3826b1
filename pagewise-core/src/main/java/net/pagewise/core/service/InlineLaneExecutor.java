package net.pagewise.core.service;

import net.pagewise.core.model.Lane;
import net.pagewise.core.model.Submission;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.spi.FastLaneHandler;
import net.pagewise.core.spi.LaneExecutor;

/** FAST 레인: 호출 스레드에서 바로 처리, JobRecord 없음 */
public final class InlineLaneExecutor implements LaneExecutor {
    private final FastLaneHandler handler;

    public InlineLaneExecutor(FastLaneHandler handler) {
        this.handler = handler;
    }

    @Override
    public Lane lane() {
        return Lane.FAST;
    }

    @Override
    public Submission execute(WorkItem item) throws Exception {
        return Submission.inline(handler.handle(item));
    }
}
