package my.creativeaudit.app.api;

import jakarta.servlet.http.HttpServletRequest;
import my.creativeaudit.app.collaborator.CollaboratorException;
import my.creativeaudit.app.service.ConcurrencyLimitExceededException;
import my.creativeaudit.app.service.InsufficientCreditsException;
import my.creativeaudit.app.service.LedgerInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

@RestControllerAdvice
public class RestExceptionHandler {
	private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

	@ExceptionHandler(InsufficientCreditsException.class)
	public ProblemDetail handleInsufficientCredits(InsufficientCreditsException ex, HttpServletRequest request) {
		logger.info("Insufficient credits on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.PAYMENT_REQUIRED, "Insufficient credits", ex.getMessage(), request);
		detail.setProperty("required", ex.getRequired());
		detail.setProperty("available", ex.getAvailable());
		return detail;
	}

	@ExceptionHandler(ConcurrencyLimitExceededException.class)
	public ProblemDetail handleConcurrencyLimit(ConcurrencyLimitExceededException ex, HttpServletRequest request) {
		logger.info("Concurrency limit on {}: {}", request.getRequestURI(), ex.getMessage());
		ProblemDetail detail = problem(HttpStatus.TOO_MANY_REQUESTS, "Evaluation already running", ex.getMessage(), request);
		detail.setProperty("activeJobId", ex.getActiveJobId());
		return detail;
	}

	@ExceptionHandler(LedgerInvariantException.class)
	public ProblemDetail handleLedgerInvariant(LedgerInvariantException ex, HttpServletRequest request) {
		logger.warn("Ledger invariant violated on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.CONFLICT, "Conflicting ledger operation", ex.getMessage(), request);
	}

	@ExceptionHandler(CollaboratorException.class)
	public ProblemDetail handleCollaborator(CollaboratorException ex, HttpServletRequest request) {
		logger.warn("Upstream service failed on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.SERVICE_UNAVAILABLE, "Upstream service unavailable",
				"The payment service is not available right now.", request);
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ProblemDetail handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
		logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
	}

	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
		logger.warn("Unreadable request body on {}: {}", request.getRequestURI(), ex.getMessage());
		return problem(HttpStatus.BAD_REQUEST, "Bad Request", "Malformed request body.", request);
	}

	@ExceptionHandler(ResponseStatusException.class)
	public ProblemDetail handleResponseStatus(ResponseStatusException ex, HttpServletRequest request) {
		HttpStatusCode status = ex.getStatusCode();
		HttpStatus resolved = HttpStatus.resolve(status.value());
		String title = resolved == null ? "Error" : resolved.getReasonPhrase();
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		detail.setDetail(ex.getReason());
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(NoResourceFoundException.class)
	public ProblemDetail handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
		return problem(HttpStatus.NOT_FOUND, "Not Found", "Resource not found.", request);
	}

	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ProblemDetail handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
		logger.warn("Validation failed on {}", request.getRequestURI(), ex);
		ProblemDetail detail = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
		detail.setTitle("Validation failed");
		List<String> errors = ex.getBindingResult().getFieldErrors().stream()
				.map(this::formatFieldError)
				.toList();
		detail.setProperty("errors", errors);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	@ExceptionHandler(Exception.class)
	public ProblemDetail handleUnhandled(Exception ex, HttpServletRequest request) {
		logger.error("Unexpected error on {}", request.getRequestURI(), ex);
		return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "Unexpected error", request);
	}

	private static ProblemDetail problem(HttpStatus status, String title, String message, HttpServletRequest request) {
		ProblemDetail detail = ProblemDetail.forStatus(status);
		detail.setTitle(title);
		detail.setDetail(message);
		detail.setProperty("path", request.getRequestURI());
		return detail;
	}

	private String formatFieldError(FieldError error) {
		return error.getField() + ": " + error.getDefaultMessage();
	}
}
