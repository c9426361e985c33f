package my.creativeaudit.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "processed_payment_events")
public class ProcessedPaymentEvent {
	@Id
	@Column(name = "event_id")
	private String eventId;

	@Column(name = "session_id")
	private String sessionId;

	@Column(name = "account_id", nullable = false)
	private String accountId;

	@Column(name = "amount", nullable = false)
	private Long amount;

	@Column(name = "processed_at", nullable = false)
	private LocalDateTime processedAt;

	public String getEventId() {
		return eventId;
	}

	public void setEventId(String eventId) {
		this.eventId = eventId;
	}

	public String getSessionId() {
		return sessionId;
	}

	public void setSessionId(String sessionId) {
		this.sessionId = sessionId;
	}

	public String getAccountId() {
		return accountId;
	}

	public void setAccountId(String accountId) {
		this.accountId = accountId;
	}

	public Long getAmount() {
		return amount;
	}

	public void setAmount(Long amount) {
		this.amount = amount;
	}

	public LocalDateTime getProcessedAt() {
		return processedAt;
	}

	public void setProcessedAt(LocalDateTime processedAt) {
		this.processedAt = processedAt;
	}
}
