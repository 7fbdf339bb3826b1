package net.pagewise.bootstrap.props;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import net.pagewise.core.model.Lane;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties("pagewise")
public class PagewiseProperties {
    @Valid private Scheduler scheduler = new Scheduler();
    @Valid private Router router = new Router();
    @Valid private Progress progress = new Progress();
    @Valid private Pager pager = new Pager();
    @Valid private Worker worker = new Worker();
    @Valid private Inline inline = new Inline();
    @Valid private Catalog catalog = new Catalog();

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Router getRouter() {
        return router;
    }

    public void setRouter(Router router) {
        this.router = router;
    }

    public Progress getProgress() {
        return progress;
    }

    public void setProgress(Progress progress) {
        this.progress = progress;
    }

    public Pager getPager() {
        return pager;
    }

    public void setPager(Pager pager) {
        this.pager = pager;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Inline getInline() {
        return inline;
    }

    public void setInline(Inline inline) {
        this.inline = inline;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 5000;          // @Scheduled 는 pagewise.scheduler.tick-delay-ms 를 직접 읽는다
        private long maintenanceDelayMs = 60000;
        @Min(1) private int maxJobsPerTick = 10;
        @NotNull private Duration lockLease = Duration.ofMinutes(5);
        @Min(1) private int workerThreads = 4;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public int getMaxJobsPerTick() {
            return maxJobsPerTick;
        }

        public void setMaxJobsPerTick(int maxJobsPerTick) {
            this.maxJobsPerTick = maxJobsPerTick;
        }

        public Duration getLockLease() {
            return lockLease;
        }

        public void setLockLease(Duration lockLease) {
            this.lockLease = lockLease;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }
    }

    public static class Router {
        @Min(0) private int fanOutThreshold = 10;
        // sourceEvent -> lane. 기본 테이블 위에 덮어쓴다
        private Map<String, Lane> lanes = new LinkedHashMap<>();

        public int getFanOutThreshold() {
            return fanOutThreshold;
        }

        public void setFanOutThreshold(int fanOutThreshold) {
            this.fanOutThreshold = fanOutThreshold;
        }

        public Map<String, Lane> getLanes() {
            return lanes;
        }

        public void setLanes(Map<String, Lane> lanes) {
            this.lanes = lanes;
        }
    }

    public static class Progress {
        @Min(1) private int maxConsecutiveErrors = 5;
        @NotNull private Duration rateLimitFallback = Duration.ofMinutes(15);

        public int getMaxConsecutiveErrors() {
            return maxConsecutiveErrors;
        }

        public void setMaxConsecutiveErrors(int maxConsecutiveErrors) {
            this.maxConsecutiveErrors = maxConsecutiveErrors;
        }

        public Duration getRateLimitFallback() {
            return rateLimitFallback;
        }

        public void setRateLimitFallback(Duration rateLimitFallback) {
            this.rateLimitFallback = rateLimitFallback;
        }
    }

    public static class Pager {
        @DecimalMin("0.0") @DecimalMax("1.0") private double lowWaterRatio = 0.10;
        @NotNull private Duration minDelay = Duration.ofSeconds(1);
        @NotNull private Duration maxDelay = Duration.ofSeconds(60);
        @Min(1) private int maxPageSize = 100;

        public double getLowWaterRatio() {
            return lowWaterRatio;
        }

        public void setLowWaterRatio(double lowWaterRatio) {
            this.lowWaterRatio = lowWaterRatio;
        }

        public Duration getMinDelay() {
            return minDelay;
        }

        public void setMinDelay(Duration minDelay) {
            this.minDelay = minDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }
    }

    public static class Worker {
        @NotNull private Duration fetchTimeout = Duration.ofSeconds(30);
        @NotNull private Duration storeTimeout = Duration.ofSeconds(30);
        @NotNull private Duration statementTimeout = Duration.ofSeconds(30);
        @Min(1) private int minChunkSize = 5;
        @Min(1) private int maxChunkSize = 500;
        @Min(1) private int defaultChunkSize = 100;
        @Min(1) private int growAfterCleanChunks = 3;

        public Duration getFetchTimeout() {
            return fetchTimeout;
        }

        public void setFetchTimeout(Duration fetchTimeout) {
            this.fetchTimeout = fetchTimeout;
        }

        public Duration getStoreTimeout() {
            return storeTimeout;
        }

        public void setStoreTimeout(Duration storeTimeout) {
            this.storeTimeout = storeTimeout;
        }

        public Duration getStatementTimeout() {
            return statementTimeout;
        }

        public void setStatementTimeout(Duration statementTimeout) {
            this.statementTimeout = statementTimeout;
        }

        public int getMinChunkSize() {
            return minChunkSize;
        }

        public void setMinChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
        }

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getDefaultChunkSize() {
            return defaultChunkSize;
        }

        public void setDefaultChunkSize(int defaultChunkSize) {
            this.defaultChunkSize = defaultChunkSize;
        }

        public int getGrowAfterCleanChunks() {
            return growAfterCleanChunks;
        }

        public void setGrowAfterCleanChunks(int growAfterCleanChunks) {
            this.growAfterCleanChunks = growAfterCleanChunks;
        }
    }

    public static class Inline {
        @Min(1) private int pageSize = 20;

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }
    }

    public static class Catalog {
        private boolean enabled = true;
        @Valid private List<Backfill> backfills = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<Backfill> getBackfills() {
            return backfills;
        }

        public void setBackfills(List<Backfill> backfills) {
            this.backfills = backfills;
        }
    }

    /** 기동 시 큐잉해 둘 백필 잡 */
    public static class Backfill {
        @NotBlank private String jobType;
        @NotBlank private String targetId;
        private Long totalEstimate;

        public String getJobType() {
            return jobType;
        }

        public void setJobType(String jobType) {
            this.jobType = jobType;
        }

        public String getTargetId() {
            return targetId;
        }

        public void setTargetId(String targetId) {
            this.targetId = targetId;
        }

        public Long getTotalEstimate() {
            return totalEstimate;
        }

        public void setTotalEstimate(Long totalEstimate) {
            this.totalEstimate = totalEstimate;
        }

        @Override
        public String toString() {
            return "Backfill{" +
                    "jobType='" + jobType + '\'' +
                    ", targetId='" + targetId + '\'' +
                    ", totalEstimate=" + totalEstimate +
                    '}';
        }
    }
}
