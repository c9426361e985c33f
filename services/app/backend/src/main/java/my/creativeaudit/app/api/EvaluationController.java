package my.creativeaudit.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.creativeaudit.app.config.AppProperties;
import my.creativeaudit.app.dto.CheckFeedbackDto;
import my.creativeaudit.app.dto.EvaluationJobDto;
import my.creativeaudit.app.dto.EvaluationRequestDto;
import my.creativeaudit.app.dto.EvaluationSubmissionDto;
import my.creativeaudit.app.dto.FeedbackRequestDto;
import my.creativeaudit.app.model.EvaluationReport;
import my.creativeaudit.app.model.ProgressEvent;
import my.creativeaudit.app.service.CalibrationService;
import my.creativeaudit.app.service.EvaluationJobService;
import my.creativeaudit.app.service.ProgressBroadcaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

@RestController
@RequestMapping("/api/evaluations")
@Tag(name = "Evaluations")
public class EvaluationController {
	private static final Logger logger = LoggerFactory.getLogger(EvaluationController.class);
	private static final long STREAM_MARGIN_MILLIS = 60_000L;

	private final EvaluationJobService jobService;
	private final CalibrationService calibrationService;
	private final AppProperties properties;

	public EvaluationController(EvaluationJobService jobService,
								CalibrationService calibrationService,
								AppProperties properties) {
		this.jobService = jobService;
		this.calibrationService = calibrationService;
		this.properties = properties;
	}

	@PostMapping
	@Operation(summary = "Submit a video for evaluation")
	public ResponseEntity<EvaluationSubmissionDto> submit(@Valid @RequestBody EvaluationRequestDto request,
														  Authentication authentication) {
		EvaluationSubmissionDto submission = jobService.submit(CallerIdentity.accountId(authentication), request);
		return ResponseEntity.accepted().body(submission);
	}

	@GetMapping
	@Operation(summary = "List the caller's recent evaluations")
	public List<EvaluationJobDto> recent(Authentication authentication) {
		return jobService.recent(CallerIdentity.accountId(authentication));
	}

	@GetMapping("/{jobId}")
	@Operation(summary = "Get evaluation status")
	public EvaluationJobDto get(@PathVariable("jobId") String jobId, Authentication authentication) {
		return jobService.get(jobId, CallerIdentity.accountId(authentication), CallerIdentity.isAdmin(authentication));
	}

	@GetMapping("/{jobId}/report")
	@Operation(summary = "Get the report of a succeeded evaluation")
	public EvaluationReport report(@PathVariable("jobId") String jobId, Authentication authentication) {
		return jobService.report(jobId, CallerIdentity.accountId(authentication), CallerIdentity.isAdmin(authentication));
	}

	@PostMapping("/{jobId}/feedback")
	@Operation(summary = "Mark a check verdict of a report as correct or incorrect")
	public ResponseEntity<CheckFeedbackDto> feedback(@PathVariable("jobId") String jobId,
													 @Valid @RequestBody FeedbackRequestDto request,
													 Authentication authentication) {
		CheckFeedbackDto feedback = calibrationService.submit(jobId, CallerIdentity.accountId(authentication),
				CallerIdentity.isAdmin(authentication), request);
		return ResponseEntity.status(HttpStatus.CREATED).body(feedback);
	}

	@GetMapping(path = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
	@Operation(summary = "Stream evaluation progress")
	public SseEmitter events(@PathVariable("jobId") String jobId, Authentication authentication) {
		SseEmitter emitter = new SseEmitter(properties.evaluation().jobTimeout().toMillis() + STREAM_MARGIN_MILLIS);
		ProgressBroadcaster.Subscription subscription = jobService.subscribe(jobId,
				CallerIdentity.accountId(authentication), CallerIdentity.isAdmin(authentication),
				event -> send(emitter, event));
		emitter.onCompletion(subscription::cancel);
		emitter.onTimeout(() -> {
			subscription.cancel();
			emitter.complete();
		});
		emitter.onError(ex -> subscription.cancel());
		return emitter;
	}

	private static void send(SseEmitter emitter, ProgressEvent event) {
		try {
			emitter.send(SseEmitter.event().name(event.milestone()).data(event, MediaType.APPLICATION_JSON));
			if (event.terminal()) {
				emitter.complete();
			}
		} catch (IOException ex) {
			logger.debug("Progress stream for job {} closed: {}", event.jobId(), ex.getMessage());
			throw new UncheckedIOException(ex);
		}
	}
}
