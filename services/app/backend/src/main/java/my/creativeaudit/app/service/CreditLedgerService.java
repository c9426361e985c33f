package my.creativeaudit.app.service;

import my.creativeaudit.app.domain.CreditTransaction;
import my.creativeaudit.app.domain.CreditTransactionKind;
import my.creativeaudit.app.repository.CreditTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only credit ledger. The balance is the signed sum of an account's transactions.
 * <p>
 * Mutations for one account are serialized by an in-process lock and each commits before the lock is released,
 * so a balance check and the write that depends on it cannot interleave with another mutation of the same account.
 * Every mutation carries an idempotency key; repeating a key returns the committed entry unchanged.
 */
@Service
public class CreditLedgerService {
	private static final Logger logger = LoggerFactory.getLogger(CreditLedgerService.class);
	public static final int MAX_HISTORY = 100;

	private final CreditTransactionRepository repository;
	private final TransactionTemplate transactionTemplate;
	private final Clock clock;
	private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();

	public CreditLedgerService(CreditTransactionRepository repository,
							   PlatformTransactionManager transactionManager,
							   Clock clock) {
		this.repository = repository;
		this.transactionTemplate = new TransactionTemplate(transactionManager);
		this.clock = clock;
	}

	public long balance(String accountId) {
		requireAccount(accountId);
		return repository.sumAmountByAccountId(accountId);
	}

	public LedgerEntry grant(String accountId, long amount, String reason, String idempotencyKey) {
		return apply(accountId, CreditTransactionKind.GRANT, amount, reason, null, idempotencyKey);
	}

	public LedgerEntry debit(String accountId, long amount, String reason, String jobId, String idempotencyKey) {
		return apply(accountId, CreditTransactionKind.DEBIT, amount, reason, jobId, idempotencyKey);
	}

	public LedgerEntry refund(String accountId, long amount, String reason, String jobId) {
		return refund(accountId, amount, reason, jobId, "refund:" + jobId + ":" + reason);
	}

	public LedgerEntry refund(String accountId, long amount, String reason, String jobId, String idempotencyKey) {
		return apply(accountId, CreditTransactionKind.REFUND, amount, reason, jobId, idempotencyKey);
	}

	public List<LedgerEntry> history(String accountId, int limit) {
		requireAccount(accountId);
		int size = Math.max(1, Math.min(MAX_HISTORY, limit));
		return repository.findHistory(accountId, PageRequest.of(0, size)).stream()
				.map(transaction -> LedgerEntry.of(transaction, false))
				.toList();
	}

	public Optional<LedgerEntry> findByIdempotencyKey(String idempotencyKey) {
		return repository.findByIdempotencyKey(idempotencyKey).map(transaction -> LedgerEntry.of(transaction, true));
	}

	private LedgerEntry apply(String accountId,
							  CreditTransactionKind kind,
							  long amount,
							  String reason,
							  String jobId,
							  String idempotencyKey) {
		requireAccount(accountId);
		if (amount <= 0) {
			throw new IllegalArgumentException("Ledger amount must be positive");
		}
		if (idempotencyKey == null || idempotencyKey.isBlank()) {
			throw new IllegalArgumentException("Idempotency key is required");
		}
		String normalizedReason = reason == null || reason.isBlank() ? kind.name().toLowerCase(Locale.ROOT) : reason.trim();
		long signed = kind == CreditTransactionKind.DEBIT ? -amount : amount;

		ReentrantLock lock = accountLocks.computeIfAbsent(accountId, key -> new ReentrantLock());
		lock.lock();
		try {
			return transactionTemplate.execute(status -> {
				Optional<CreditTransaction> existing = repository.findByIdempotencyKey(idempotencyKey);
				if (existing.isPresent()) {
					return replay(existing.get(), accountId, kind, signed);
				}
				long balance = repository.sumAmountByAccountId(accountId);
				long balanceAfter = balance + signed;
				if (kind == CreditTransactionKind.DEBIT && balanceAfter < 0) {
					throw new InsufficientBalanceException(accountId, balance, amount);
				}
				CreditTransaction transaction = new CreditTransaction();
				transaction.setAccountId(accountId);
				transaction.setKind(kind);
				transaction.setAmount(signed);
				transaction.setReason(normalizedReason);
				transaction.setJobId(jobId);
				transaction.setIdempotencyKey(idempotencyKey);
				transaction.setBalanceAfter(balanceAfter);
				transaction.setCreatedAt(LocalDateTime.now(clock));
				CreditTransaction saved = repository.saveAndFlush(transaction);
				logger.info("Ledger {} of {} for account {} (key={}, balanceAfter={})",
						kind, amount, accountId, idempotencyKey, balanceAfter);
				return LedgerEntry.of(saved, false);
			});
		} catch (DataIntegrityViolationException ex) {
			// the same key was committed under another account's lock
			CreditTransaction existing = repository.findByIdempotencyKey(idempotencyKey).orElseThrow(() -> ex);
			return replay(existing, accountId, kind, signed);
		} finally {
			lock.unlock();
		}
	}

	private LedgerEntry replay(CreditTransaction existing, String accountId, CreditTransactionKind kind, long signed) {
		if (!existing.getAccountId().equals(accountId)
				|| existing.getKind() != kind
				|| existing.getAmount() != signed) {
			throw new LedgerInvariantException("Idempotency key " + existing.getIdempotencyKey()
					+ " was already used for a different ledger operation");
		}
		logger.debug("Ledger replay for key {}", existing.getIdempotencyKey());
		return LedgerEntry.of(existing, true);
	}

	private static void requireAccount(String accountId) {
		if (accountId == null || accountId.isBlank()) {
			throw new IllegalArgumentException("Account id is required");
		}
	}
}
