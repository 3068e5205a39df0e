package front.migrator.app.support;

import java.util.Objects;

/**
 * Outcome of a single remote call attempt, as classified by the calling client.
 * A retryable failure may be attempted again; a fatal failure ends the call immediately.
 */
public final class RemoteCallResult<T> {

    public enum Kind { SUCCESS, RETRYABLE, FATAL }

    private final Kind kind;
    private final T value;
    private final RuntimeException error;

    private RemoteCallResult(Kind kind, T value, RuntimeException error) {
        this.kind = kind;
        this.value = value;
        this.error = error;
    }

    public static <T> RemoteCallResult<T> success(T value) {
        return new RemoteCallResult<>(Kind.SUCCESS, value, null);
    }

    public static <T> RemoteCallResult<T> retryable(RuntimeException error) {
        return new RemoteCallResult<>(Kind.RETRYABLE, null, Objects.requireNonNull(error, "error"));
    }

    public static <T> RemoteCallResult<T> fatal(RuntimeException error) {
        return new RemoteCallResult<>(Kind.FATAL, null, Objects.requireNonNull(error, "error"));
    }

    public Kind getKind() {
        return kind;
    }

    public T getValue() {
        if (kind != Kind.SUCCESS) {
            throw new IllegalStateException("No value for a " + kind + " result", error);
        }
        return value;
    }

    public RuntimeException getError() {
        if (kind == Kind.SUCCESS) {
            throw new IllegalStateException("Successful result carries no error");
        }
        return error;
    }
}
