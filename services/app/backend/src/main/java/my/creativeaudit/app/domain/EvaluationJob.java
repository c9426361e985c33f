package my.creativeaudit.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import java.time.LocalDateTime;

@Entity
@Table(name = "evaluation_jobs")
public class EvaluationJob {
	@Id
	@Column(name = "job_id", length = 36)
	private String jobId;

	@Column(name = "account_id", nullable = false)
	private String accountId;

	@Column(name = "media_uri", nullable = false, columnDefinition = "TEXT")
	private String mediaUri;

	@Column(name = "declared_duration_seconds")
	private Double declaredDurationSeconds;

	@Column(name = "brand_name")
	private String brandName;

	@Column(name = "check_sets", nullable = false)
	private String checkSets;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private JobStatus status;

	@Enumerated(EnumType.STRING)
	@Column(name = "phase", nullable = false)
	private JobPhase phase;

	@Column(name = "progress", nullable = false)
	private Integer progress;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "started_at")
	private LocalDateTime startedAt;

	@Column(name = "finished_at")
	private LocalDateTime finishedAt;

	@Column(name = "estimated_cost", nullable = false)
	private Long estimatedCost;

	@Column(name = "actual_cost")
	private Long actualCost;

	@Column(name = "refunded_amount", nullable = false)
	private Long refundedAmount;

	@Column(name = "measured_duration_seconds")
	private Double measuredDurationSeconds;

	@Column(name = "cache_hit", nullable = false)
	private boolean cacheHit;

	@Column(name = "fingerprint", length = 64)
	private String fingerprint;

	@Column(name = "error_code")
	private String errorCode;

	@Column(name = "error_message", columnDefinition = "TEXT")
	private String errorMessage;

	@Column(name = "report_json", columnDefinition = "TEXT")
	private String reportJson;

	@Version
	@Column(name = "version", nullable = false)
	private Long version;

	public String getJobId() {
		return jobId;
	}

	public void setJobId(String jobId) {
		this.jobId = jobId;
	}

	public String getAccountId() {
		return accountId;
	}

	public void setAccountId(String accountId) {
		this.accountId = accountId;
	}

	public String getMediaUri() {
		return mediaUri;
	}

	public void setMediaUri(String mediaUri) {
		this.mediaUri = mediaUri;
	}

	public Double getDeclaredDurationSeconds() {
		return declaredDurationSeconds;
	}

	public void setDeclaredDurationSeconds(Double declaredDurationSeconds) {
		this.declaredDurationSeconds = declaredDurationSeconds;
	}

	public String getBrandName() {
		return brandName;
	}

	public void setBrandName(String brandName) {
		this.brandName = brandName;
	}

	public String getCheckSets() {
		return checkSets;
	}

	public void setCheckSets(String checkSets) {
		this.checkSets = checkSets;
	}

	public JobStatus getStatus() {
		return status;
	}

	public void setStatus(JobStatus status) {
		this.status = status;
	}

	public JobPhase getPhase() {
		return phase;
	}

	public void setPhase(JobPhase phase) {
		this.phase = phase;
	}

	public Integer getProgress() {
		return progress;
	}

	public void setProgress(Integer progress) {
		this.progress = progress;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(LocalDateTime startedAt) {
		this.startedAt = startedAt;
	}

	public LocalDateTime getFinishedAt() {
		return finishedAt;
	}

	public void setFinishedAt(LocalDateTime finishedAt) {
		this.finishedAt = finishedAt;
	}

	public Long getEstimatedCost() {
		return estimatedCost;
	}

	public void setEstimatedCost(Long estimatedCost) {
		this.estimatedCost = estimatedCost;
	}

	public Long getActualCost() {
		return actualCost;
	}

	public void setActualCost(Long actualCost) {
		this.actualCost = actualCost;
	}

	public Long getRefundedAmount() {
		return refundedAmount;
	}

	public void setRefundedAmount(Long refundedAmount) {
		this.refundedAmount = refundedAmount;
	}

	public Double getMeasuredDurationSeconds() {
		return measuredDurationSeconds;
	}

	public void setMeasuredDurationSeconds(Double measuredDurationSeconds) {
		this.measuredDurationSeconds = measuredDurationSeconds;
	}

	public boolean isCacheHit() {
		return cacheHit;
	}

	public void setCacheHit(boolean cacheHit) {
		this.cacheHit = cacheHit;
	}

	public String getFingerprint() {
		return fingerprint;
	}

	public void setFingerprint(String fingerprint) {
		this.fingerprint = fingerprint;
	}

	public String getErrorCode() {
		return errorCode;
	}

	public void setErrorCode(String errorCode) {
		this.errorCode = errorCode;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public void setErrorMessage(String errorMessage) {
		this.errorMessage = errorMessage;
	}

	public String getReportJson() {
		return reportJson;
	}

	public void setReportJson(String reportJson) {
		this.reportJson = reportJson;
	}

	public Long getVersion() {
		return version;
	}
}
