package net.pagewise.integration.spring.sched;

import net.pagewise.core.maintenance.MaintenanceService;
import net.pagewise.core.service.SchedulerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class PagewiseSchedulers {
    private static final Logger log = LoggerFactory.getLogger(PagewiseSchedulers.class);

    private final SchedulerService scheduler;
    private final MaintenanceService maintenance;

    private int maxJobsPerTick = 10;

    public PagewiseSchedulers(SchedulerService scheduler, MaintenanceService maintenance) {
        this.scheduler = scheduler;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${pagewise.scheduler.tick-delay-ms:5000}")
    public void tick() throws Exception {
        var report = scheduler.tick(maxJobsPerTick);
        if (report.failed > 0) log.info("{}", report);
    }

    @Scheduled(fixedDelayString = "${pagewise.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() throws Exception {
        var report = maintenance.runOnce();
        if (report.releasedLeases > 0) log.info("{}", report);
    }

    public void setMaxJobsPerTick(int maxJobsPerTick) {
        this.maxJobsPerTick = maxJobsPerTick;
    }
}
