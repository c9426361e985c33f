package my.creativeaudit.app.repository;

import my.creativeaudit.app.domain.EvaluationJob;
import my.creativeaudit.app.domain.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

public interface EvaluationJobRepository extends JpaRepository<EvaluationJob, String> {
	List<EvaluationJob> findTop50ByAccountIdOrderByCreatedAtDesc(String accountId);

	@Query("""
		select j from EvaluationJob j
		where j.status in :statuses and j.createdAt <= :cutoff
		""")
	List<EvaluationJob> findStale(@Param("statuses") Collection<JobStatus> statuses,
								  @Param("cutoff") LocalDateTime cutoff);

	/**
	 * Moves a job into a terminal status only while it is still in one of {@code active}. Exactly one caller wins
	 * a race between the job runner and the stale-job reaper.
	 *
	 * @return 1 when this call finished the job, 0 when it had already finished
	 */
	@Transactional
	@Modifying(clearAutomatically = true)
	@Query("""
		update EvaluationJob j
		set j.status = :status, j.errorCode = :errorCode, j.errorMessage = :errorMessage,
			j.finishedAt = :finishedAt, j.version = j.version + 1
		where j.jobId = :jobId and j.status in :active
		""")
	int finishIfActive(@Param("jobId") String jobId,
					   @Param("status") JobStatus status,
					   @Param("errorCode") String errorCode,
					   @Param("errorMessage") String errorMessage,
					   @Param("finishedAt") LocalDateTime finishedAt,
					   @Param("active") Collection<JobStatus> active);

	@Transactional
	@Modifying(clearAutomatically = true)
	@Query("""
		update EvaluationJob j
		set j.actualCost = :actualCost, j.refundedAmount = :refundedAmount, j.version = j.version + 1
		where j.jobId = :jobId
		""")
	int recordCharges(@Param("jobId") String jobId,
					  @Param("actualCost") long actualCost,
					  @Param("refundedAmount") long refundedAmount);

	default boolean finish(String jobId, JobStatus status, String errorCode, String errorMessage, LocalDateTime finishedAt) {
		return finishIfActive(jobId, status, errorCode, errorMessage, finishedAt, JobStatus.active()) == 1;
	}
}
