package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

import java.util.Objects;

/**
 * 任务图框架中所有错误的基类。
 * 每个错误都带有一个 {@link ErrorKind} 和一个 {@link ErrorSeverity}，
 * 在失败的操作、{@link xyz.vvrf.reactor.taskgraph.retry.RetryPolicy} 与 {@link ErrorHandler} 之间传递。
 * 直接实例化此类表示 {@link ErrorKind#GENERIC} 错误。
 */
public class TaskGraphException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final ErrorSeverity severity;

    public TaskGraphException(String message) {
        this(ErrorKind.GENERIC, message, null);
    }

    public TaskGraphException(String message, Throwable cause) {
        this(ErrorKind.GENERIC, message, cause);
    }

    protected TaskGraphException(ErrorKind kind, String message, Throwable cause) {
        this(kind, kind.getDefaultSeverity(), message, cause);
    }

    protected TaskGraphException(ErrorKind kind, ErrorSeverity severity, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "ErrorKind cannot be null");
        this.severity = Objects.requireNonNull(severity, "ErrorSeverity cannot be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    public ErrorSeverity getSeverity() {
        return severity;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + kind + "/" + severity + "]: " + getMessage();
    }
}
