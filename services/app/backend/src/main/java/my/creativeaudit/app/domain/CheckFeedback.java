package my.creativeaudit.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * A reviewer's judgement of one check verdict in a report.
 */
@Entity
@Table(name = "check_feedback")
public class CheckFeedback {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "feedback_id")
	private Long feedbackId;

	@Column(name = "job_id", nullable = false, length = 36)
	private String jobId;

	@Column(name = "check_id", nullable = false, length = 128)
	private String checkId;

	@Column(name = "account_id", nullable = false)
	private String accountId;

	@Enumerated(EnumType.STRING)
	@Column(name = "verdict", nullable = false, length = 16)
	private FeedbackVerdict verdict;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public Long getFeedbackId() {
		return feedbackId;
	}

	public String getJobId() {
		return jobId;
	}

	public void setJobId(String jobId) {
		this.jobId = jobId;
	}

	public String getCheckId() {
		return checkId;
	}

	public void setCheckId(String checkId) {
		this.checkId = checkId;
	}

	public String getAccountId() {
		return accountId;
	}

	public void setAccountId(String accountId) {
		this.accountId = accountId;
	}

	public FeedbackVerdict getVerdict() {
		return verdict;
	}

	public void setVerdict(FeedbackVerdict verdict) {
		this.verdict = verdict;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
