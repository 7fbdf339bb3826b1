package net.pagewise.core.service;

import net.pagewise.core.error.RateLimitExceededException;
import net.pagewise.core.model.Chunk;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.RateLimitSnapshot;
import net.pagewise.core.support.MutableClock;
import net.pagewise.core.support.ScriptedPageSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitedPagerTest {

    MutableClock clock;
    ScriptedPageSource source;
    RateLimitedPager pager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.fixed();
        source = new ScriptedPageSource(250, clock);
        pager = new RateLimitedPager(source, clock, PagerSettings.defaults());
    }

    @Test
    void healthyQuota_noDelay_andCursorFromPage() throws Exception {
        Chunk c = pager.nextChunk(JobType.PR_SYNC, "acme/widgets", null, 100);

        assertEquals(100, c.items().size());
        assertEquals("100", c.newCursor());
        assertFalse(c.exhausted());
        assertEquals(Duration.ZERO, c.suggestedDelay());
        assertEquals("item-99", c.lastItemKey());
        assertEquals(250L, c.totalCount());
    }

    @Test
    void lastPage_isExhausted() throws Exception {
        Chunk c = pager.nextChunk(JobType.PR_SYNC, "acme/widgets", "200", 100);

        assertEquals(50, c.items().size());
        assertTrue(c.exhausted());
        assertNull(c.newCursor());
    }

    @Test
    void oneFetchPerCall_andNoStateBetweenCalls() throws Exception {
        Chunk a = pager.nextChunk(JobType.PR_SYNC, "acme/widgets", "100", 50);
        Chunk b = pager.nextChunk(JobType.PR_SYNC, "acme/widgets", "100", 50);

        assertEquals(2, source.calls());
        assertEquals(Arrays.asList("100", "100"), source.cursorsSeen());
        assertEquals(a.newCursor(), b.newCursor());
    }

    @Test
    void pageSize_clampedToUpstreamMaximum() throws Exception {
        pager.nextChunk(JobType.ISSUE_SYNC, "acme/widgets", null, 500);
        pager.nextChunk(JobType.ISSUE_SYNC, "acme/widgets", null, 0);

        assertEquals(Arrays.asList(100, 1), source.pageSizesSeen());
    }

    @Test
    void zeroRemaining_throwsRateLimited_withResetAt() {
        Instant reset = clock.now().plus(Duration.ofMinutes(12));
        source.rateLimit(new RateLimitSnapshot(0, 5000, reset));

        RateLimitExceededException e = assertThrows(RateLimitExceededException.class,
                () -> pager.nextChunk(JobType.PR_SYNC, "acme/widgets", null, 50));
        assertEquals(reset, e.getResetAt());
    }

    @Test
    void belowLowWater_spreadsRemainingCallsUntilReset() throws Exception {
        // 100 calls left, 1000s until reset → 10s per call
        source.rateLimit(new RateLimitSnapshot(100, 5000, clock.now().plusSeconds(1000)));

        Chunk c = pager.nextChunk(JobType.PR_SYNC, "acme/widgets", null, 50);

        assertEquals(Duration.ofSeconds(10), c.suggestedDelay());
        assertEquals(50, c.items().size(), "items are still returned while throttled");
    }

    @Test
    void suggestedDelay_isClamped() {
        Instant soon = clock.now().plusSeconds(5);
        Instant late = clock.now().plus(Duration.ofHours(1));

        assertEquals(Duration.ofSeconds(1), pager.suggestDelay(new RateLimitSnapshot(400, 5000, soon)));
        assertEquals(Duration.ofSeconds(60), pager.suggestDelay(new RateLimitSnapshot(3, 5000, late)));
        assertEquals(Duration.ofSeconds(1), pager.suggestDelay(new RateLimitSnapshot(10, 5000, clock.now().minusSeconds(1))));
    }

    @Test
    void atOrAboveLowWater_noDelay() {
        Instant reset = clock.now().plusSeconds(600);

        assertEquals(Duration.ZERO, pager.suggestDelay(new RateLimitSnapshot(500, 5000, reset)));
        assertEquals(Duration.ZERO, pager.suggestDelay(null));
    }
}
