package my.creativeaudit.app.repository;

import my.creativeaudit.app.domain.ProcessedPaymentEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;

public interface ProcessedPaymentEventRepository extends JpaRepository<ProcessedPaymentEvent, String> {
	/**
	 * Plain insert; a duplicate event id fails on the primary key instead of merging.
	 */
	@Modifying
	@Query(value = """
		insert into processed_payment_events (event_id, session_id, account_id, amount, processed_at)
		values (:eventId, :sessionId, :accountId, :amount, :processedAt)
		""", nativeQuery = true)
	int insert(@Param("eventId") String eventId,
			   @Param("sessionId") String sessionId,
			   @Param("accountId") String accountId,
			   @Param("amount") long amount,
			   @Param("processedAt") LocalDateTime processedAt);
}
