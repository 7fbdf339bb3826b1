package net.pagewise.core.spi;

import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.JobType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JobRecord 영속화. 모든 메서드는 TxRunner 트랜잭션 안에서 호출한다.
 */
public interface JobRecordRepository {

    /** (jobType, targetId) 기준 멱등 생성. 이미 있으면 기존 행을 그대로 반환 */
    JobRecord upsertQueued(JobType jobType, String targetId, int chunkSize, Long totalEstimate,
                           Map<String, String> metadata) throws Exception;

    Optional<JobRecord> findById(long id) throws Exception;

    Optional<JobRecord> findByTypeAndTarget(JobType jobType, String targetId) throws Exception;

    /** SELECT ... FOR UPDATE: 같은 잡에 대한 상태 변경을 직렬화 */
    Optional<JobRecord> lockById(long id) throws Exception;

    /** 락 컬럼을 제외한 가변 컬럼 전체를 id 기준으로 갱신 */
    void update(JobRecord record) throws Exception;

    /** queued/active, 또는 resumeAt 이 지난 rate-limit pause. 리스가 비어 있고 nextRunAt 이 지난 것만 */
    List<JobRecord> findSchedulable(Instant now, int limit) throws Exception;

    /** status == null 이면 전체 */
    List<JobRecord> findByStatus(JobStatus status, int limit) throws Exception;

    /** 잡 단위 리스 획득. 다른 owner 의 리스가 살아 있으면 false */
    boolean tryLock(long id, String owner, Duration lease) throws Exception;

    /** 같은 owner 의 리스만 해제 */
    void unlock(long id, String owner) throws Exception;

    /** 만료된 리스 회수, 회수한 잡 id 반환 */
    List<Long> releaseExpiredLocks() throws Exception;
}
