package net.pagewise.core.service;

import net.pagewise.core.error.RateLimitExceededException;
import net.pagewise.core.error.SchemaMismatchException;
import net.pagewise.core.model.Chunk;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.RateLimitSnapshot;
import net.pagewise.core.model.RawPage;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.UpstreamPageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * upstream 페이지 하나를 가져오고 rate limit 텔레메트리를 보고 다음 호출 간격을 제안한다.
 * 커서는 호출자가 넘기고 호출자가 저장한다. 이 클래스는 호출 사이에 상태가 없다.
 */
public final class RateLimitedPager {
    private static final Logger log = LoggerFactory.getLogger(RateLimitedPager.class);

    private final UpstreamPageSource source;
    private final Clock clock;
    private final PagerSettings settings;

    public RateLimitedPager(UpstreamPageSource source, Clock clock, PagerSettings settings) {
        this.source = source;
        this.clock = clock;
        this.settings = settings;
    }

    public Chunk nextChunk(JobType jobType, String targetId, String cursor, int chunkSize) throws Exception {
        int pageSize = Math.max(1, Math.min(chunkSize, settings.maxPageSize()));

        RawPage page = source.fetchPage(jobType, targetId, cursor, pageSize);
        if (page == null) {
            throw new SchemaMismatchException("upstream returned no page for " + jobType.code() + " " + targetId);
        }

        RateLimitSnapshot rl = page.rateLimit();
        if (rl != null && rl.isExhausted()) {
            throw new RateLimitExceededException(
                    "rate limit exhausted (limit=" + rl.limit() + ", resetAt=" + rl.resetAt() + ")", rl.resetAt());
        }

        Duration delay = suggestDelay(rl);
        if (!delay.isZero()) {
            log.debug("low quota for {} {}: remaining={}/{} → wait {}", jobType.code(), targetId,
                    rl.remaining(), rl.limit(), delay);
        }
        return new Chunk(page.items(), page.nextCursor(), rl, !page.hasNextPage(), delay, page.totalCount());
    }

    /** low-water 아래면 reset 까지 남은 시간을 남은 호출 수로 나눠 간격을 벌린다 */
    Duration suggestDelay(RateLimitSnapshot rl) {
        if (rl == null || !rl.isBelow(settings.lowWaterRatio())) return Duration.ZERO;

        Instant now = clock.now();
        Duration untilReset = rl.resetAt() == null || !rl.resetAt().isAfter(now)
                ? Duration.ZERO
                : Duration.between(now, rl.resetAt());
        Duration spread = untilReset.dividedBy(Math.max(1, rl.remaining()));

        if (spread.compareTo(settings.minDelay()) < 0) return settings.minDelay();
        if (spread.compareTo(settings.maxDelay()) > 0) return settings.maxDelay();
        return spread;
    }
}
