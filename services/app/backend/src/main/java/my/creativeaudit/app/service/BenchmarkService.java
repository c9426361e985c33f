package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.BenchmarkEntry;
import my.creativeaudit.app.model.EvaluatedCheck;
import my.creativeaudit.app.repository.BenchmarkEntryRepository;
import my.creativeaudit.app.scoring.BenchmarkCalculator;
import my.creativeaudit.app.scoring.BenchmarkScores;
import my.creativeaudit.app.scoring.Benchmarks;
import my.creativeaudit.app.scoring.ScoringSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Percentile benchmarks against the most recent {@link #HISTORY_LIMIT} succeeded evaluations.
 */
@Service
public class BenchmarkService {
	private static final Logger logger = LoggerFactory.getLogger(BenchmarkService.class);
	static final int HISTORY_LIMIT = 10_000;

	private final BenchmarkEntryRepository repository;
	private final BenchmarkCalculator calculator;
	private final Clock clock;

	public BenchmarkService(BenchmarkEntryRepository repository, BenchmarkCalculator calculator, Clock clock) {
		this.repository = repository;
		this.calculator = calculator;
		this.clock = clock;
	}

	public BenchmarkScores scores(List<EvaluatedCheck> checks, ScoringSnapshot scoring, String vertical) {
		return calculator.scores(checks, scoring, vertical);
	}

	public Benchmarks benchmark(BenchmarkScores current) {
		List<BenchmarkScores> history = repository.findRecent(PageRequest.of(0, HISTORY_LIMIT)).stream()
				.map(entry -> new BenchmarkScores(entry.getAbcdScore(), entry.getPersuasionDensity(),
						entry.getPerformanceScore(), entry.getVertical()))
				.toList();
		return calculator.compute(current, history);
	}

	/**
	 * Adds a succeeded job to the history. Recording the same job twice keeps the first entry.
	 */
	public void record(String jobId, BenchmarkScores scores) {
		if (repository.existsByJobId(jobId)) {
			return;
		}
		BenchmarkEntry entry = new BenchmarkEntry();
		entry.setJobId(jobId);
		entry.setAbcdScore(scores.abcdScore());
		entry.setPersuasionDensity(scores.persuasionDensity());
		entry.setPerformanceScore(scores.performanceScore());
		entry.setVertical(scores.vertical());
		entry.setRecordedAt(LocalDateTime.now(clock));
		try {
			repository.saveAndFlush(entry);
			logger.debug("Benchmark entry recorded for job {}", jobId);
		} catch (DataIntegrityViolationException ex) {
			logger.debug("Benchmark entry for job {} already recorded", jobId);
		}
	}
}
