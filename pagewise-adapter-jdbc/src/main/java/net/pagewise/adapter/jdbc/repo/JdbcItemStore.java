package net.pagewise.adapter.jdbc.repo;

import net.pagewise.adapter.jdbc.TxContext;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.UpstreamItem;
import net.pagewise.core.spi.DomainStore;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * TB_SYNCED_ITEM. (TARGET_ID, JOB_TYPE, ITEM_KEY) 기준 MERGE 라서 같은 청크를 다시 써도 행이 늘지 않는다.
 */
public final class JdbcItemStore implements DomainStore {
    private final DataSource ds;
    private final int statementTimeoutSeconds;

    public JdbcItemStore(DataSource ds) {
        this(ds, Duration.ZERO);
    }

    public JdbcItemStore(DataSource ds, Duration statementTimeout) {
        this.ds = ds;
        this.statementTimeoutSeconds = statementTimeout == null ? 0 : (int) statementTimeout.toSeconds();
    }

    @Override
    public int upsertItems(JobType jobType, String targetId, List<UpstreamItem> items) throws Exception {
        if (items.isEmpty()) return 0;
        try (var ps = prepare("""
            MERGE INTO TB_SYNCED_ITEM d
            USING (SELECT ? TARGET_ID, ? JOB_TYPE, ? ITEM_KEY FROM dual) s
               ON (d.TARGET_ID = s.TARGET_ID AND d.JOB_TYPE = s.JOB_TYPE AND d.ITEM_KEY = s.ITEM_KEY)
            WHEN MATCHED THEN UPDATE SET
                 PAYLOAD   = ?,
                 SYNCED_AT = CURRENT_TIMESTAMP
            WHEN NOT MATCHED THEN INSERT
                 (TARGET_ID, JOB_TYPE, ITEM_KEY, PAYLOAD, SYNCED_AT)
            VALUES (s.TARGET_ID, s.JOB_TYPE, s.ITEM_KEY, ?, CURRENT_TIMESTAMP)
            """)) {
            for (UpstreamItem item : items) {
                int i = 1;
                ps.setString(i++, targetId);
                ps.setString(i++, jobType.code());
                ps.setString(i++, item.naturalKey());
                ps.setString(i++, item.payload());
                ps.setString(i, item.payload());
                ps.addBatch();
            }
            ps.executeBatch();
        }
        return items.size();
    }

    /** 대상별 저장된 아이템 수 (모니터링/테스트용) */
    public long countFor(JobType jobType, String targetId) throws Exception {
        try (var ps = prepare("""
            SELECT COUNT(*)
              FROM TB_SYNCED_ITEM
             WHERE TARGET_ID = ? AND JOB_TYPE = ?
            """)) {
            ps.setString(1, targetId);
            ps.setString(2, jobType.code());
            try (var rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    private PreparedStatement prepare(String sql) throws SQLException {
        PreparedStatement ps = TxContext.require().prepareStatement(sql);
        if (statementTimeoutSeconds > 0) ps.setQueryTimeout(statementTimeoutSeconds);
        return ps;
    }
}
