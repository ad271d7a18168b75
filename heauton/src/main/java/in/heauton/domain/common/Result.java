package in.heauton.domain.common;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a fallible engine operation.
 *
 * A success carries a value (possibly null for {@code Result<Void>}).
 * A failure carries an {@link ErrorKind}, a human-readable message and
 * an optional cause. Nothing is thrown across a component boundary.
 */
public record Result<T>(
        T value,
        ErrorKind errorKind,
        String message,
        Throwable cause) {

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null, null, null);
    }

    public static Result<Void> ok() {
        return new Result<>(null, null, null, null);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Result<>(null, kind, message, null);
    }

    public static <T> Result<T> failure(ErrorKind kind, String message, Throwable cause) {
        return new Result<>(null, kind, message, cause);
    }

    public static <T> Result<T> notFound(String message) {
        return failure(ErrorKind.NOT_FOUND, message);
    }

    /**
     * Wrap a store failure, keeping the cause.
     */
    public static <T> Result<T> persistenceFailure(String message, Throwable cause) {
        String detail = cause != null && cause.getMessage() != null
                ? message + ": " + cause.getMessage()
                : message;
        return failure(ErrorKind.PERSISTENCE_FAILURE, detail, cause);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isFailure() {
        return errorKind != null;
    }

    public boolean isFailure(ErrorKind kind) {
        return errorKind == kind;
    }

    public T getOrNull() {
        return isSuccess() ? value : null;
    }

    public T getOrDefault(T defaultValue) {
        return isSuccess() ? value : defaultValue;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> transform) {
        if (isFailure()) {
            return new Result<>(null, errorKind, message, cause);
        }
        return success(transform.apply(value));
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> transform) {
        if (isFailure()) {
            return new Result<>(null, errorKind, message, cause);
        }
        return transform.apply(value);
    }

    public Result<T> onSuccess(Consumer<? super T> action) {
        if (isSuccess()) {
            action.accept(value);
        }
        return this;
    }

    public Result<T> onFailure(Consumer<Result<T>> action) {
        if (isFailure()) {
            action.accept(this);
        }
        return this;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Result.success(" + value + ")"
                : "Result.failure(" + errorKind + ", " + message + ")";
    }
}
