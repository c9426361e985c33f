package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.CheckFeedback;
import my.creativeaudit.app.domain.FeedbackVerdict;
import my.creativeaudit.app.dto.CheckFeedbackDto;
import my.creativeaudit.app.dto.CheckReliabilityDto;
import my.creativeaudit.app.dto.FeedbackRequestDto;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.repository.CheckFeedbackRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reviewer feedback on individual check verdicts and the per-check reliability derived from it.
 */
@Service
public class CalibrationService {
	private static final Logger logger = LoggerFactory.getLogger(CalibrationService.class);

	private final CheckFeedbackRepository feedbackRepository;
	private final EvaluationJobService jobService;
	private final Clock clock;

	public CalibrationService(CheckFeedbackRepository feedbackRepository, EvaluationJobService jobService, Clock clock) {
		this.feedbackRepository = feedbackRepository;
		this.jobService = jobService;
		this.clock = clock;
	}

	/**
	 * Records whether a check verdict of a succeeded report was right. Only the job's owner or an admin may judge it.
	 */
	public CheckFeedbackDto submit(String jobId, String accountId, boolean admin, FeedbackRequestDto request) {
		if (request == null || request.checkId() == null || request.checkId().isBlank()) {
			throw new IllegalArgumentException("checkId is required");
		}
		FeedbackVerdict verdict = FeedbackVerdict.parse(request.verdict());
		String checkId = request.checkId().trim();
		EvaluationReport report = jobService.report(jobId, accountId, admin);
		boolean reported = report.checkSetResults().stream()
				.flatMap(result -> result.checks().stream())
				.anyMatch(check -> check.checkId().equals(checkId));
		if (!reported) {
			throw new IllegalArgumentException("Check " + checkId + " is not part of the report of job " + jobId);
		}
		CheckFeedback feedback = new CheckFeedback();
		feedback.setJobId(jobId);
		feedback.setCheckId(checkId);
		feedback.setAccountId(accountId);
		feedback.setVerdict(verdict);
		feedback.setCreatedAt(LocalDateTime.now(clock));
		CheckFeedback saved = feedbackRepository.save(feedback);
		logger.info("Feedback {} on check {} of job {} by {}", verdict, checkId, jobId, accountId);
		return new CheckFeedbackDto(saved.getFeedbackId(), jobId, checkId, verdict, saved.getCreatedAt());
	}

	/**
	 * Accuracy and reliability level of every check that has feedback, ordered by check id.
	 */
	public List<CheckReliabilityDto> reliability() {
		Map<String, long[]> tallies = new LinkedHashMap<>();
		for (Object[] row : feedbackRepository.countByCheckAndVerdict()) {
			long[] tally = tallies.computeIfAbsent((String) row[0], key -> new long[2]);
			long count = ((Number) row[2]).longValue();
			if (row[1] == FeedbackVerdict.CORRECT) {
				tally[0] += count;
			}
			tally[1] += count;
		}
		List<CheckReliabilityDto> result = new ArrayList<>();
		tallies.forEach((checkId, tally) -> {
			double accuracy = accuracy(tally[0], tally[1]);
			result.add(new CheckReliabilityDto(checkId, accuracy, tally[1], ReliabilityLevel.of(tally[1], accuracy)));
		});
		return result;
	}

	static double accuracy(long correct, long total) {
		if (total <= 0) {
			return 0.0;
		}
		return BigDecimal.valueOf(correct).divide(BigDecimal.valueOf(total), 3, RoundingMode.HALF_EVEN).doubleValue();
	}
}
