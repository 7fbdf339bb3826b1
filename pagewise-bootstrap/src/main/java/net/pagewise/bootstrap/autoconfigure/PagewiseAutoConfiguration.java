package net.pagewise.bootstrap.autoconfigure;

import net.pagewise.bootstrap.catalog.CatalogRegistrar;
import net.pagewise.bootstrap.props.PagewiseProperties;
import net.pagewise.core.maintenance.MaintenanceService;
import net.pagewise.core.service.*;
import net.pagewise.core.spi.*;
import net.pagewise.integration.spring.PagewiseSpringConfig;
import net.pagewise.integration.spring.sched.PagewiseSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(PagewiseProperties.class)
@Import(PagewiseSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class PagewiseAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(PagewiseAutoConfiguration.class);

    public static final String DISPATCH_EXECUTOR = "pagewiseDispatchExecutor";
    public static final String IO_EXECUTOR = "pagewiseIoExecutor";

    // --- 설정 → 코어 settings ---

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitedPager rateLimitedPager(UpstreamPageSource source, Clock clock, PagewiseProperties props) {
        var p = props.getPager();
        return new RateLimitedPager(source, clock,
                new PagerSettings(p.getLowWaterRatio(), p.getMinDelay(), p.getMaxDelay(), p.getMaxPageSize()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ProgressTracker progressTracker(JobRecordRepository jobs, TxRunner tx, Clock clock, PagewiseProperties props) {
        var settings = new TrackerSettings(
                props.getProgress().getMaxConsecutiveErrors(),
                props.getProgress().getRateLimitFallback(),
                props.getWorker().getMinChunkSize(),
                props.getWorker().getMaxChunkSize());
        return new ProgressTracker(jobs, tx, clock, settings);
    }

    // --- 스레드 풀: 디스패치와 fetch/store 는 반드시 다른 풀 ---

    @Bean(name = DISPATCH_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService pagewiseDispatchExecutor(PagewiseProperties props) {
        return Executors.newFixedThreadPool(props.getScheduler().getWorkerThreads(),
                new CustomizableThreadFactory("pagewise-dispatch-"));
    }

    @Bean(name = IO_EXECUTOR, destroyMethod = "shutdownNow")
    public ExecutorService pagewiseIoExecutor(PagewiseProperties props) {
        return Executors.newFixedThreadPool(props.getScheduler().getWorkerThreads() * 2,
                new CustomizableThreadFactory("pagewise-io-"));
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ChunkWorker chunkWorker(JobRecordRepository jobs,
                                   TxRunner tx,
                                   RateLimitedPager pager,
                                   DomainStore store,
                                   ProgressTracker tracker,
                                   ErrorClassifier classifier,
                                   @Qualifier(IO_EXECUTOR) ExecutorService io,
                                   PagewiseProperties props) {
        var w = props.getWorker();
        var defaults = WorkerSettings.defaults();
        var settings = new WorkerSettings(
                props.getScheduler().getLockLease(),
                w.getFetchTimeout(),
                w.getStoreTimeout(),
                w.getGrowAfterCleanChunks(),
                defaults.growthFactor(),
                defaults.ownerPrefix());
        return new ChunkWorker(jobs, tx, pager, store, tracker, classifier, settings, io);
    }

    @Bean
    @ConditionalOnMissingBean(FastLaneHandler.class)
    public InlineSyncHandler inlineSyncHandler(RateLimitedPager pager, DomainStore store, TxRunner tx,
                                               PagewiseProperties props) {
        return new InlineSyncHandler(pager, store, tx, props.getInline().getPageSize());
    }

    @Bean
    public InlineLaneExecutor inlineLaneExecutor(FastLaneHandler handler) {
        return new InlineLaneExecutor(handler);
    }

    @Bean
    public QueueLaneExecutor queueLaneExecutor(JobRecordRepository jobs, TxRunner tx, ProgressTracker tracker,
                                               PagewiseProperties props) {
        return new QueueLaneExecutor(jobs, tx, tracker, props.getWorker().getDefaultChunkSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRouter jobRouter(List<LaneExecutor> executors, PagewiseProperties props) {
        var table = LaneTable.defaults().withOverrides(props.getRouter().getLanes());
        return new JobRouter(table, props.getRouter().getFanOutThreshold(), executors);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerService schedulerService(JobRecordRepository jobs,
                                             TxRunner tx,
                                             ProgressTracker tracker,
                                             ChunkWorker worker,
                                             Clock clock,
                                             @Qualifier(DISPATCH_EXECUTOR) ExecutorService dispatch) {
        return new SchedulerService(jobs, tx, tracker, worker, clock, dispatch);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobAdminService jobAdminService(JobRecordRepository jobs, TxRunner tx, ProgressTracker tracker,
                                           ChunkWorker worker, Clock clock) {
        return new JobAdminService(jobs, tx, tracker, worker, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(JobRecordRepository jobs, ProgressTracker tracker, TxRunner tx, Clock clock) {
        return new MaintenanceService(jobs, tracker, tx, clock);
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnProperty(prefix = "pagewise.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PagewiseSchedulers pagewiseSchedulers(SchedulerService scheduler,
                                                 MaintenanceService maintenance,
                                                 PagewiseProperties props) {
        var s = new PagewiseSchedulers(scheduler, maintenance);

        // @Scheduled 딜레이는 pagewise.scheduler.tick-delay-ms / maintenance-delay-ms 에서 읽힘.
        // 나머지만 세터로 주입
        s.setMaxJobsPerTick(props.getScheduler().getMaxJobsPerTick());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(QueueLaneExecutor queue) {
        return new CatalogRegistrar(queue);
    }

    @Bean
    @ConditionalOnProperty(prefix = "pagewise.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, PagewiseProperties props) {
        log.info("catalog backfills:\n{}", props.getCatalog().getBackfills().stream()
                .map(PagewiseProperties.Backfill::toString).collect(Collectors.joining("\n")));
        return args -> registrar.register(props.getCatalog());
    }
}
