package net.pagewise.core.maintenance;

import net.pagewise.core.service.ProgressTracker;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String META_LOCK_RECOVERED_AT = "lockRecoveredAt";

    private final JobRecordRepository jobs;
    private final ProgressTracker tracker;
    private final TxRunner tx;
    private final Clock clock;

    public MaintenanceService(JobRecordRepository jobs,
                              ProgressTracker tracker,
                              TxRunner tx,
                              Clock clock) {
        this.jobs = jobs;
        this.tracker = tracker;
        this.tx = tx;
        this.clock = clock;
    }

    /**
     * 주기 점검.
     * - 죽은 워커가 남긴 만료 리스 회수
     * - 회수한 잡에 lockRecoveredAt 메모
     */
    public MaintenanceReport runOnce() throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        List<Long> released = tx.required(jobs::releaseExpiredLocks);
        r.releasedLeases = released.size();
        r.jobIds = new ArrayList<>(released);

        for (Long id : released) {
            tracker.annotate(id, META_LOCK_RECOVERED_AT, now.toString());
        }
        if (!released.isEmpty()) log.warn("recovered expired leases on jobs {}", released);

        r.timestamp = now;
        return r;
    }

    /** 간단 리포트 DTO */
    public static final class MaintenanceReport {
        public Instant timestamp;
        public int releasedLeases;
        public List<Long> jobIds = List.of();

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", releasedLeases=" + releasedLeases +
                    ", jobIds=" + jobIds +
                    '}';
        }
    }
}
