package net.pagewise.app;

import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.Lane;
import net.pagewise.core.model.RateLimitSnapshot;
import net.pagewise.core.model.RawPage;
import net.pagewise.core.model.UpstreamItem;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.service.InlineSyncHandler;
import net.pagewise.core.service.JobAdminService;
import net.pagewise.core.service.JobRouter;
import net.pagewise.core.spi.UpstreamPageSource;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.OracleContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 부팅된 앱 전체(라우터 → JobRecord → 스케줄러 틱 → 워커 → Oracle) 흐름.
 * upstream 은 500건짜리 가짜 소스로 바꿔 끼운다.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class IngestionFlowTest {

    static final int TOTAL = 500;

    @Container
    static OracleContainer oracle = new OracleContainer("gvenzl/oracle-xe:21-slim")
            .withStartupTimeout(Duration.ofMinutes(5));

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        // Boot DataSource & Flyway가 Testcontainers DB로 붙도록
        r.add("spring.datasource.url", oracle::getJdbcUrl);
        r.add("spring.datasource.username", oracle::getUsername);
        r.add("spring.datasource.password", oracle::getPassword);
        r.add("spring.flyway.locations", () -> "classpath:db/migration/oracle");
        // 빠른 틱, 청크 200 고정
        r.add("pagewise.scheduler.tick-delay-ms", () -> "200");
        r.add("pagewise.worker.default-chunk-size", () -> "200");
        r.add("pagewise.worker.max-chunk-size", () -> "200");
        r.add("pagewise.pager.max-page-size", () -> "200");
        r.add("pagewise.catalog.enabled", () -> "false");
    }

    @TestConfiguration
    static class FakeUpstream {
        @Bean
        @Primary
        FixedSizeSource fixedSizeSource() {
            return new FixedSizeSource(TOTAL);
        }
    }

    @Autowired JobRouter router;
    @Autowired JobAdminService admin;
    @Autowired JdbcTemplate jdbc;
    @Autowired FixedSizeSource source;

    @Test
    void wide_fan_out_is_queued_and_drained_in_chunks() throws Exception {
        var submission = router.submit(WorkItem.of("repository.resync", JobType.PR_SYNC, "octo/flow", 25));
        assertThat(submission.lane()).isEqualTo(Lane.SLOW);
        assertThat(submission.processingMode()).isEqualTo("queued");
        long jobId = submission.jobId();

        Awaitility.await().atMost(Duration.ofSeconds(60)).untilAsserted(() -> {
            var job = admin.get(jobId);
            assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.processedCount()).isEqualTo(TOTAL);
        });

        assertThat(source.batchSizes("octo/flow")).containsExactly(200, 200, 100);
        Integer stored = jdbc.queryForObject(
                "SELECT COUNT(*) FROM TB_SYNCED_ITEM WHERE TARGET_ID = ? AND JOB_TYPE = ?",
                Integer.class, "octo/flow", "pr-sync");
        assertThat(stored).isEqualTo(TOTAL);

        // 같은 (jobType, targetId) 재제출은 새 잡을 만들지 않는다
        var again = router.submit(WorkItem.of("repository.resync", JobType.PR_SYNC, "octo/flow", 25));
        assertThat(again.jobId()).isEqualTo(jobId);
        assertThat(again.jobStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void single_target_edit_runs_inline() throws Exception {
        var submission = router.submit(WorkItem.of("pull_request.edited", JobType.PR_SYNC, "octo/inline", 1));

        assertThat(submission.lane()).isEqualTo(Lane.FAST);
        assertThat(submission.jobId()).isNull();
        var result = (InlineSyncHandler.Result) submission.inlineResult();
        assertThat(result.itemsStored()).isEqualTo(20);
        assertThat(result.hasMore()).isTrue();
        assertThat(admin.list(null, 500)).noneMatch(j -> j.targetId().equals("octo/inline"));
    }

    /** offset 커서로 고정 건수를 내주는 upstream. 호출마다 돌려준 건수를 기록한다 */
    static final class FixedSizeSource implements UpstreamPageSource {
        private final int total;
        private final Map<String, List<Integer>> sizes = new ConcurrentHashMap<>();

        FixedSizeSource(int total) {
            this.total = total;
        }

        @Override
        public RawPage fetchPage(JobType jobType, String targetId, String cursor, int pageSize) {
            int from = cursor == null ? 0 : Integer.parseInt(cursor);
            int to = Math.min(total, from + pageSize);
            List<UpstreamItem> items = new ArrayList<>();
            for (int i = from; i < to; i++) {
                items.add(new UpstreamItem("pr-" + i, "{\"id\":" + i + "}"));
            }
            sizes.computeIfAbsent(targetId, k -> new CopyOnWriteArrayList<>()).add(items.size());
            boolean more = to < total;
            return new RawPage(items, more ? String.valueOf(to) : null, more, (long) total,
                    new RateLimitSnapshot(4000, 5000, Instant.now().plusSeconds(3600)));
        }

        List<Integer> batchSizes(String targetId) {
            return sizes.getOrDefault(targetId, List.of());
        }
    }
}
