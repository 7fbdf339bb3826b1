package net.pagewise.adapter.jdbc.mapper;

import net.pagewise.adapter.jdbc.JdbcUtil;
import net.pagewise.adapter.jdbc.json.MetadataCodec;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.PauseReason;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- JobRecord ---
    public static JobRecord toJobRecord(ResultSet rs, MetadataCodec codec) throws SQLException {
        return new JobRecord(
                rs.getLong("ID"),
                JobType.from(rs.getString("JOB_TYPE")),
                rs.getString("TARGET_ID"),
                JobStatus.from(rs.getString("STATUS")),
                rs.getString("CURSOR_TOKEN"),
                rs.getString("LAST_ITEM_KEY"),
                JdbcUtil.getLong(rs, "TOTAL_ESTIMATE"),
                rs.getLong("PROCESSED_COUNT"),
                rs.getInt("CHUNK_SIZE"),
                rs.getInt("ERROR_COUNT"),
                rs.getInt("CONSECUTIVE_ERROR_COUNT"),
                rs.getString("LAST_ERROR"),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_ERROR_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("LAST_PROCESSED_AT")),
                PauseReason.from(rs.getString("PAUSE_REASON")),
                JdbcUtil.toInstant(rs.getTimestamp("RESUME_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("NEXT_RUN_AT")),
                rs.getString("LOCK_OWNER"),
                JdbcUtil.toInstant(rs.getTimestamp("LOCK_UNTIL")),
                codec.read(rs.getString("METADATA")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                rs.getTimestamp("UPDATED_AT").toInstant()
        );
    }
}
