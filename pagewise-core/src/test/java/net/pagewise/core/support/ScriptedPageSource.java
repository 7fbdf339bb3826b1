package net.pagewise.core.support;

import net.pagewise.core.model.JobType;
import net.pagewise.core.model.RateLimitSnapshot;
import net.pagewise.core.model.RawPage;
import net.pagewise.core.model.UpstreamItem;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.UpstreamPageSource;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * totalItems 개 아이템을 offset 커서로 나눠 주는 가짜 upstream.
 * 커서 = 다음 offset 문자열, 자연키 = "item-{offset}".
 */
public final class ScriptedPageSource implements UpstreamPageSource {
    private final int totalItems;
    private final Clock clock;
    private final Deque<Exception> failures = new ArrayDeque<>();
    private final List<String> cursorsSeen = Collections.synchronizedList(new ArrayList<>());
    private final List<Integer> pageSizesSeen = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger calls = new AtomicInteger();

    private volatile RateLimitSnapshot rateLimit;
    private volatile CountDownLatch gate;
    private volatile CountDownLatch entered;
    private volatile boolean reportTotal = true;

    public ScriptedPageSource(int totalItems, Clock clock) {
        this.totalItems = totalItems;
        this.clock = clock;
        this.rateLimit = new RateLimitSnapshot(5000, 5000, clock.now().plus(Duration.ofHours(1)));
    }

    public synchronized ScriptedPageSource failNext(Exception... errors) {
        Collections.addAll(failures, errors);
        return this;
    }

    public ScriptedPageSource rateLimit(RateLimitSnapshot snapshot) {
        this.rateLimit = snapshot;
        return this;
    }

    public ScriptedPageSource withoutTotal() {
        this.reportTotal = false;
        return this;
    }

    /** 다음 호출부터 gate 가 열릴 때까지 fetch 안에서 대기 (entered 로 진입 알림) */
    public ScriptedPageSource blockUntil(CountDownLatch gate, CountDownLatch entered) {
        this.gate = gate;
        this.entered = entered;
        return this;
    }

    public ScriptedPageSource unblock() {
        this.gate = null;
        this.entered = null;
        return this;
    }

    @Override
    public RawPage fetchPage(JobType jobType, String targetId, String cursor, int pageSize) throws Exception {
        calls.incrementAndGet();
        cursorsSeen.add(cursor);
        pageSizesSeen.add(pageSize);

        CountDownLatch g = gate;
        if (g != null) {
            if (entered != null) entered.countDown();
            g.await();
        }

        Exception failure;
        synchronized (this) {
            failure = failures.poll();
        }
        if (failure != null) throw failure;

        int offset = cursor == null ? 0 : Integer.parseInt(cursor);
        int end = Math.min(totalItems, offset + pageSize);
        List<UpstreamItem> items = new ArrayList<>();
        for (int i = offset; i < end; i++) {
            items.add(new UpstreamItem("item-" + i, "{\"n\":" + i + "}"));
        }
        boolean more = end < totalItems;
        return new RawPage(items, more ? String.valueOf(end) : null, more,
                reportTotal ? (long) totalItems : null, rateLimit);
    }

    public List<String> cursorsSeen() {
        synchronized (cursorsSeen) {
            return List.copyOf(new ArrayList<>(cursorsSeen));
        }
    }

    public List<Integer> pageSizesSeen() {
        synchronized (pageSizesSeen) {
            return new ArrayList<>(pageSizesSeen);
        }
    }

    public int calls() {
        return calls.get();
    }
}
