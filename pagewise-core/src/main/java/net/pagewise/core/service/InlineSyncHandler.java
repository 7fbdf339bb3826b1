package net.pagewise.core.service;

import net.pagewise.core.model.Chunk;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.spi.DomainStore;
import net.pagewise.core.spi.FastLaneHandler;
import net.pagewise.core.spi.TxRunner;

/**
 * 기본 FAST 레인 처리: 대상의 첫 페이지만 가져와 저장한다.
 * 에러는 그대로 호출자(HTTP)에게 올린다.
 */
public final class InlineSyncHandler implements FastLaneHandler {
    private final RateLimitedPager pager;
    private final DomainStore store;
    private final TxRunner tx;
    private final int pageSize;

    public InlineSyncHandler(RateLimitedPager pager, DomainStore store, TxRunner tx, int pageSize) {
        this.pager = pager;
        this.store = store;
        this.tx = tx;
        this.pageSize = pageSize;
    }

    @Override
    public Result handle(WorkItem item) throws Exception {
        Chunk chunk = pager.nextChunk(item.jobType(), item.targetId(), null, pageSize);
        int stored = chunk.items().isEmpty()
                ? 0
                : tx.required(() -> store.upsertItems(item.jobType(), item.targetId(), chunk.items()));
        return new Result(item.jobType().code(), item.targetId(), stored, !chunk.exhausted());
    }

    public record Result(String jobType, String targetId, int itemsStored, boolean hasMore) {}
}
