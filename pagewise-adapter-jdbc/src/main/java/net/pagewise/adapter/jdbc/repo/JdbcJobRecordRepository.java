package net.pagewise.adapter.jdbc.repo;

import net.pagewise.adapter.jdbc.JdbcUtil;
import net.pagewise.adapter.jdbc.TxContext;
import net.pagewise.adapter.jdbc.json.MetadataCodec;
import net.pagewise.adapter.jdbc.mapper.RowMappers;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.JobType;
import net.pagewise.core.spi.JobRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TB_JOB_RECORD (Oracle). 락 컬럼(LOCK_OWNER/LOCK_UNTIL)은 tryLock/unlock/releaseExpiredLocks 만 건드리고,
 * 리스 만료 판단은 DB 시각(CURRENT_TIMESTAMP) 기준이다.
 */
public final class JdbcJobRecordRepository implements JobRecordRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcJobRecordRepository.class);

    private final DataSource ds;
    private final MetadataCodec codec;
    private final int statementTimeoutSeconds;

    public JdbcJobRecordRepository(DataSource ds) {
        this(ds, new MetadataCodec(), Duration.ZERO);
    }

    public JdbcJobRecordRepository(DataSource ds, MetadataCodec codec, Duration statementTimeout) {
        this.ds = ds;
        this.codec = codec;
        this.statementTimeoutSeconds = statementTimeout == null ? 0 : (int) statementTimeout.toSeconds();
    }

    @Override
    public JobRecord upsertQueued(JobType jobType, String targetId, int chunkSize, Long totalEstimate,
                                  Map<String, String> metadata) throws Exception {
        // (JOB_TYPE, TARGET_ID) 유니크. 이미 있으면 아무것도 바꾸지 않는다
        try (var ps = prepare("""
            MERGE INTO TB_JOB_RECORD d
            USING (SELECT ? JOB_TYPE, ? TARGET_ID FROM dual) s
               ON (d.JOB_TYPE = s.JOB_TYPE AND d.TARGET_ID = s.TARGET_ID)
            WHEN NOT MATCHED THEN INSERT
                 (JOB_TYPE, TARGET_ID, STATUS, PROCESSED_COUNT, CHUNK_SIZE, ERROR_COUNT,
                  CONSECUTIVE_ERROR_COUNT, TOTAL_ESTIMATE, METADATA, CREATED_AT, UPDATED_AT)
            VALUES (s.JOB_TYPE, s.TARGET_ID, 'queued', 0, ?, 0,
                    0, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
            """)) {
            int i = 1;
            ps.setString(i++, jobType.code());
            ps.setString(i++, targetId);
            ps.setInt(i++, chunkSize);
            JdbcUtil.setLong(ps, i++, totalEstimate);
            ps.setString(i, codec.write(metadata));
            ps.executeUpdate();
        } catch (SQLIntegrityConstraintViolationException race) {
            // 동시 MERGE 에서 진 쪽: 이긴 쪽이 만든 행을 읽으면 된다
            log.debug("concurrent insert of {} {}, reading winner's row", jobType.code(), targetId);
        }
        return findByTypeAndTarget(jobType, targetId)
                .orElseThrow(() -> new IllegalStateException("upsert failed to load job: " + jobType.code() + " " + targetId));
    }

    @Override
    public Optional<JobRecord> findById(long id) throws Exception {
        try (var ps = prepare("SELECT * FROM TB_JOB_RECORD WHERE ID = ?")) {
            ps.setLong(1, id);
            return single(ps);
        }
    }

    @Override
    public Optional<JobRecord> findByTypeAndTarget(JobType jobType, String targetId) throws Exception {
        try (var ps = prepare("""
            SELECT *
              FROM TB_JOB_RECORD
             WHERE JOB_TYPE = ? AND TARGET_ID = ?
            """)) {
            ps.setString(1, jobType.code());
            ps.setString(2, targetId);
            return single(ps);
        }
    }

    @Override
    public Optional<JobRecord> lockById(long id) throws Exception {
        try (var ps = prepare("SELECT * FROM TB_JOB_RECORD WHERE ID = ? FOR UPDATE")) {
            ps.setLong(1, id);
            return single(ps);
        }
    }

    @Override
    public void update(JobRecord r) throws Exception {
        try (var ps = prepare("""
            UPDATE TB_JOB_RECORD
               SET STATUS                  = ?,
                   CURSOR_TOKEN            = ?,
                   LAST_ITEM_KEY           = ?,
                   TOTAL_ESTIMATE          = ?,
                   PROCESSED_COUNT         = ?,
                   CHUNK_SIZE              = ?,
                   ERROR_COUNT             = ?,
                   CONSECUTIVE_ERROR_COUNT = ?,
                   LAST_ERROR              = ?,
                   LAST_ERROR_AT           = ?,
                   LAST_PROCESSED_AT       = ?,
                   PAUSE_REASON            = ?,
                   RESUME_AT               = ?,
                   NEXT_RUN_AT             = ?,
                   METADATA                = ?,
                   UPDATED_AT              = CURRENT_TIMESTAMP
             WHERE ID = ?
            """)) {
            int i = 1;
            ps.setString(i++, r.status().code());
            ps.setString(i++, r.cursor());
            ps.setString(i++, r.lastItemKey());
            JdbcUtil.setLong(ps, i++, r.totalEstimate());
            ps.setLong(i++, r.processedCount());
            ps.setInt(i++, r.chunkSize());
            ps.setInt(i++, r.errorCount());
            ps.setInt(i++, r.consecutiveErrorCount());
            ps.setString(i++, r.lastError());
            ps.setTimestamp(i++, JdbcUtil.ts(r.lastErrorAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(r.lastProcessedAt()));
            ps.setString(i++, r.pauseReason() == null ? null : r.pauseReason().code());
            ps.setTimestamp(i++, JdbcUtil.ts(r.resumeAt()));
            ps.setTimestamp(i++, JdbcUtil.ts(r.nextRunAt()));
            ps.setString(i++, codec.write(r.metadata()));
            ps.setLong(i, r.id());
            if (ps.executeUpdate() == 0) {
                throw new IllegalStateException("TB_JOB_RECORD not found for ID=" + r.id());
            }
        }
    }

    @Override
    public List<JobRecord> findSchedulable(Instant now, int limit) throws Exception {
        try (var ps = prepare("""
            SELECT *
              FROM TB_JOB_RECORD
             WHERE (STATUS IN ('queued', 'active')
                    OR (STATUS = 'paused' AND PAUSE_REASON = 'rate_limited' AND RESUME_AT < ?))
               AND (LOCK_UNTIL IS NULL OR LOCK_UNTIL <= CURRENT_TIMESTAMP)
               AND (NEXT_RUN_AT IS NULL OR NEXT_RUN_AT <= ?)
             ORDER BY UPDATED_AT ASC, ID ASC
             FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setTimestamp(1, JdbcUtil.ts(now));
            ps.setTimestamp(2, JdbcUtil.ts(now));
            ps.setInt(3, limit);
            return list(ps);
        }
    }

    @Override
    public List<JobRecord> findByStatus(JobStatus status, int limit) throws Exception {
        if (status == null) {
            try (var ps = prepare("SELECT * FROM TB_JOB_RECORD ORDER BY ID DESC FETCH FIRST ? ROWS ONLY")) {
                ps.setInt(1, limit);
                return list(ps);
            }
        }
        try (var ps = prepare("""
            SELECT *
              FROM TB_JOB_RECORD
             WHERE STATUS = ?
             ORDER BY ID DESC
             FETCH FIRST ? ROWS ONLY
            """)) {
            ps.setString(1, status.code());
            ps.setInt(2, limit);
            return list(ps);
        }
    }

    @Override
    public boolean tryLock(long id, String owner, Duration lease) throws Exception {
        try (var ps = prepare("""
            UPDATE TB_JOB_RECORD
               SET LOCK_OWNER = ?,
                   LOCK_UNTIL = CURRENT_TIMESTAMP + NUMTODSINTERVAL(?, 'SECOND')
             WHERE ID = ?
               AND (LOCK_UNTIL IS NULL OR LOCK_UNTIL <= CURRENT_TIMESTAMP)
            """)) {
            ps.setString(1, owner);
            ps.setLong(2, Math.max(1, lease.toSeconds()));
            ps.setLong(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void unlock(long id, String owner) throws Exception {
        try (var ps = prepare("""
            UPDATE TB_JOB_RECORD
               SET LOCK_OWNER = NULL,
                   LOCK_UNTIL = NULL
             WHERE ID = ? AND LOCK_OWNER = ?
            """)) {
            ps.setLong(1, id);
            ps.setString(2, owner);
            ps.executeUpdate();
        }
    }

    @Override
    public List<Long> releaseExpiredLocks() throws Exception {
        List<Long> ids = new ArrayList<>();
        try (var ps = prepare("""
            SELECT ID
              FROM TB_JOB_RECORD
             WHERE LOCK_OWNER IS NOT NULL
               AND LOCK_UNTIL <= CURRENT_TIMESTAMP
             FOR UPDATE SKIP LOCKED
            """); var rs = ps.executeQuery()) {
            while (rs.next()) ids.add(rs.getLong(1));
        }
        if (ids.isEmpty()) return ids;

        try (var ps = prepare("""
            UPDATE TB_JOB_RECORD
               SET LOCK_OWNER = NULL,
                   LOCK_UNTIL = NULL
             WHERE ID = ?
            """)) {
            for (Long id : ids) {
                ps.setLong(1, id);
                ps.addBatch();
            }
            ps.executeBatch();
        }
        return ids;
    }

    private PreparedStatement prepare(String sql) throws SQLException {
        Connection c = TxContext.require();
        PreparedStatement ps = c.prepareStatement(sql);
        if (statementTimeoutSeconds > 0) ps.setQueryTimeout(statementTimeoutSeconds);
        return ps;
    }

    private Optional<JobRecord> single(PreparedStatement ps) throws SQLException {
        try (ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) return Optional.empty();
            return Optional.of(RowMappers.toJobRecord(rs, codec));
        }
    }

    private List<JobRecord> list(PreparedStatement ps) throws SQLException {
        List<JobRecord> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toJobRecord(rs, codec));
        }
        return out;
    }
}
