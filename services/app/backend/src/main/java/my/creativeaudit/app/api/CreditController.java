package my.creativeaudit.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import my.creativeaudit.app.dto.BillingPacksDto;
import my.creativeaudit.app.dto.CheckoutRequestDto;
import my.creativeaudit.app.dto.CheckoutResponseDto;
import my.creativeaudit.app.dto.CreditBalanceDto;
import my.creativeaudit.app.dto.LedgerEntryDto;
import my.creativeaudit.app.service.BillingService;
import my.creativeaudit.app.service.CreditLedgerService;
import my.creativeaudit.app.service.LedgerEntry;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Credits")
public class CreditController {
	private final CreditLedgerService ledger;
	private final BillingService billingService;

	public CreditController(CreditLedgerService ledger, BillingService billingService) {
		this.ledger = ledger;
		this.billingService = billingService;
	}

	@GetMapping("/credits")
	@Operation(summary = "Balance and recent transactions")
	public CreditBalanceDto credits(Authentication authentication) {
		String accountId = CallerIdentity.accountId(authentication);
		List<LedgerEntryDto> transactions = ledger.history(accountId, CreditLedgerService.MAX_HISTORY).stream()
				.map(CreditController::toDto)
				.toList();
		return new CreditBalanceDto(accountId, ledger.balance(accountId), transactions);
	}

	@GetMapping("/billing/packs")
	@Operation(summary = "Token packs on sale")
	public BillingPacksDto packs(Authentication authentication) {
		return billingService.packs(CallerIdentity.accountId(authentication));
	}

	@PostMapping("/billing/checkout")
	@Operation(summary = "Start a hosted checkout for a token pack")
	public CheckoutResponseDto checkout(@Valid @RequestBody CheckoutRequestDto request, Authentication authentication) {
		return billingService.checkout(CallerIdentity.accountId(authentication), request.pack());
	}

	static LedgerEntryDto toDto(LedgerEntry entry) {
		return new LedgerEntryDto(
				entry.transactionId(),
				entry.kind(),
				entry.amount(),
				entry.reason(),
				entry.jobId(),
				entry.balanceAfter(),
				entry.createdAt(),
				entry.replayed()
		);
	}
}
