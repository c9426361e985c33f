package my.creativeaudit.app.repository;

import my.creativeaudit.app.domain.CheckFeedback;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface CheckFeedbackRepository extends JpaRepository<CheckFeedback, Long> {
	/**
	 * Rows of {@code [checkId, verdict, count]}.
	 */
	@Query("""
		select f.checkId, f.verdict, count(f) from CheckFeedback f
		group by f.checkId, f.verdict
		order by f.checkId
		""")
	List<Object[]> countByCheckAndVerdict();

	List<CheckFeedback> findByJobIdOrderByFeedbackIdAsc(String jobId);
}
