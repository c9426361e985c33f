package my.creativeaudit.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

/**
 * Headline scores of one succeeded evaluation, kept as history for percentile benchmarks.
 */
@Entity
@Table(name = "benchmark_entries")
public class BenchmarkEntry {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "entry_id")
	private Long entryId;

	@Column(name = "job_id", nullable = false, unique = true, length = 36)
	private String jobId;

	@Column(name = "abcd_score", nullable = false)
	private Double abcdScore;

	@Column(name = "persuasion_density", nullable = false)
	private Double persuasionDensity;

	@Column(name = "performance_score", nullable = false)
	private Double performanceScore;

	@Column(name = "vertical")
	private String vertical;

	@Column(name = "recorded_at", nullable = false)
	private LocalDateTime recordedAt;

	public Long getEntryId() {
		return entryId;
	}

	public String getJobId() {
		return jobId;
	}

	public void setJobId(String jobId) {
		this.jobId = jobId;
	}

	public Double getAbcdScore() {
		return abcdScore;
	}

	public void setAbcdScore(Double abcdScore) {
		this.abcdScore = abcdScore;
	}

	public Double getPersuasionDensity() {
		return persuasionDensity;
	}

	public void setPersuasionDensity(Double persuasionDensity) {
		this.persuasionDensity = persuasionDensity;
	}

	public Double getPerformanceScore() {
		return performanceScore;
	}

	public void setPerformanceScore(Double performanceScore) {
		this.performanceScore = performanceScore;
	}

	public String getVertical() {
		return vertical;
	}

	public void setVertical(String vertical) {
		this.vertical = vertical;
	}

	public LocalDateTime getRecordedAt() {
		return recordedAt;
	}

	public void setRecordedAt(LocalDateTime recordedAt) {
		this.recordedAt = recordedAt;
	}
}
