package my.creativeaudit.app.repository;

import my.creativeaudit.app.domain.CreditTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, Long> {
	@Query("select coalesce(sum(t.amount), 0L) from CreditTransaction t where t.accountId = :accountId")
	long sumAmountByAccountId(@Param("accountId") String accountId);

	Optional<CreditTransaction> findByIdempotencyKey(String idempotencyKey);

	@Query("""
		select t from CreditTransaction t
		where t.accountId = :accountId
		order by t.createdAt desc, t.transactionId desc
		""")
	List<CreditTransaction> findHistory(@Param("accountId") String accountId, Pageable pageable);

	List<CreditTransaction> findByJobIdOrderByTransactionIdAsc(String jobId);
}
