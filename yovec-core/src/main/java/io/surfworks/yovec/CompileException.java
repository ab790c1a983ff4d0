package io.surfworks.yovec;

/**
 * Exception thrown when a program cannot be lowered.
 *
 * <p>Every failure aborts the whole compilation. The {@link ErrorKind} tells callers
 * whether the program or the upstream tree producer is at fault.
 */
public class CompileException extends RuntimeException {

    private final ErrorKind kind;

    public CompileException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CompileException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CompileException internal(String format, Object... args) {
        return new CompileException(ErrorKind.INTERNAL_INVARIANT_VIOLATION, String.format(format, args));
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isInternal() {
        return kind.isInternal();
    }

    @Override
    public String toString() {
        return "CompileException[" + kind + "]: " + getMessage();
    }
}
