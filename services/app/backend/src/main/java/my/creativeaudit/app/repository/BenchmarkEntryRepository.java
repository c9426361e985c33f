package my.creativeaudit.app.repository;

import my.creativeaudit.app.domain.BenchmarkEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface BenchmarkEntryRepository extends JpaRepository<BenchmarkEntry, Long> {
	@Query("select e from BenchmarkEntry e order by e.recordedAt desc, e.entryId desc")
	List<BenchmarkEntry> findRecent(Pageable pageable);

	boolean existsByJobId(String jobId);
}
