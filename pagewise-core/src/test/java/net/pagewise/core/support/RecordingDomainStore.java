package net.pagewise.core.support;

import net.pagewise.core.model.JobType;
import net.pagewise.core.model.UpstreamItem;
import net.pagewise.core.spi.DomainStore;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/** (jobType, targetId, naturalKey) 기준 멱등 저장소 */
public final class RecordingDomainStore implements DomainStore {
    private final Map<String, UpstreamItem> items = new ConcurrentHashMap<>();
    private final AtomicInteger writes = new AtomicInteger();
    private final Deque<Exception> failures = new ArrayDeque<>();

    public synchronized RecordingDomainStore failNext(Exception... errors) {
        Collections.addAll(failures, errors);
        return this;
    }

    @Override
    public int upsertItems(JobType jobType, String targetId, List<UpstreamItem> batch) throws Exception {
        Exception failure;
        synchronized (this) {
            failure = failures.poll();
        }
        if (failure != null) throw failure;

        for (UpstreamItem item : batch) {
            items.put(jobType.code() + "|" + targetId + "|" + item.naturalKey(), item);
        }
        writes.incrementAndGet();
        return batch.size();
    }

    public int count() {
        return items.size();
    }

    public int writes() {
        return writes.get();
    }
}
