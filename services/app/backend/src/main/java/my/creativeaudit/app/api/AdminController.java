package my.creativeaudit.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.creativeaudit.app.dto.AdminGrantRequestDto;
import my.creativeaudit.app.dto.CheckReliabilityDto;
import my.creativeaudit.app.dto.EvaluationJobDto;
import my.creativeaudit.app.dto.LedgerEntryDto;
import my.creativeaudit.app.service.CalibrationService;
import my.creativeaudit.app.service.CreditLedgerService;
import my.creativeaudit.app.service.EvaluationJobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/admin")
@Tag(name = "Admin")
public class AdminController {
	private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

	private final EvaluationJobService jobService;
	private final CreditLedgerService ledger;
	private final CalibrationService calibrationService;

	public AdminController(EvaluationJobService jobService, CreditLedgerService ledger,
						   CalibrationService calibrationService) {
		this.jobService = jobService;
		this.ledger = ledger;
		this.calibrationService = calibrationService;
	}

	@GetMapping("/calibration")
	@Operation(summary = "Per-check accuracy and reliability from reviewer feedback")
	public List<CheckReliabilityDto> calibration() {
		return calibrationService.reliability();
	}

	@PostMapping("/evaluations/{jobId}/cancel")
	@Operation(summary = "Cancel a queued or running evaluation")
	public EvaluationJobDto cancel(@PathVariable("jobId") String jobId) {
		return jobService.cancel(jobId);
	}

	@PostMapping("/evaluations/{jobId}/refund")
	@Operation(summary = "Refund what a succeeded evaluation was charged")
	public LedgerEntryDto refund(@PathVariable("jobId") String jobId) {
		return CreditController.toDto(jobService.adminRefund(jobId));
	}

	@PostMapping("/credits/grant")
	@Operation(summary = "Grant tokens to an account")
	public LedgerEntryDto grant(@Valid @RequestBody AdminGrantRequestDto request, Authentication authentication) {
		String key = request.idempotencyKey() == null || request.idempotencyKey().isBlank()
				? "admin-grant:" + UUID.randomUUID()
				: request.idempotencyKey().trim();
		String reason = request.reason() == null || request.reason().isBlank() ? "admin_grant" : request.reason().trim();
		logger.info("Admin {} grants {} tokens to {} (key={})", authentication.getName(), request.amount(),
				request.accountId(), key);
		return CreditController.toDto(ledger.grant(request.accountId(), request.amount(), reason, key));
	}
}
