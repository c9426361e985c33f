package my.creativeaudit.app.collaborator;

import java.util.function.Function;

/**
 * Outcome of one collaborator call: a value or a typed failure. Adapters never throw past this boundary.
 */
public sealed interface CollaboratorResult<T> permits CollaboratorResult.Success, CollaboratorResult.Failure {

	static <T> CollaboratorResult<T> success(T value) {
		return new Success<>(value);
	}

	static <T> CollaboratorResult<T> failure(CollaboratorErrorKind kind, String message) {
		return new Failure<>(kind, message);
	}

	static <T> CollaboratorResult<T> disabled(String collaborator) {
		return new Failure<>(CollaboratorErrorKind.DISABLED, collaborator + " disabled");
	}

	default boolean isSuccess() {
		return this instanceof Success<T>;
	}

	default T valueOrNull() {
		return this instanceof Success<T> success ? success.value() : null;
	}

	default <R> CollaboratorResult<R> map(Function<T, R> mapper) {
		if (this instanceof Success<T> success) {
			return new Success<>(mapper.apply(success.value()));
		}
		Failure<T> failure = (Failure<T>) this;
		return new Failure<>(failure.kind(), failure.message());
	}

	record Success<T>(T value) implements CollaboratorResult<T> {
	}

	record Failure<T>(CollaboratorErrorKind kind, String message) implements CollaboratorResult<T> {
	}
}
