package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

/**
 * 降级结果（不可变）。
 * 描述调用方应走的替代执行路径，例如缩减上下文后重试。
 */
public final class FallbackOutcome {

    /**
     * 降级后的状态。
     */
    public enum Status {
        /** 调用方应按 {@link Action} 调整后重试。*/
        RETRYING,
        /** 没有可用的降级路径，调用方应把该错误视为失败结果。*/
        ERROR
    }

    /**
     * 建议的降级动作。
     */
    public enum Action {
        REDUCE_CONTEXT,
        BACKOFF_RETRY,
        SIMPLIFY_REQUEST
    }

    @Getter private final Status status;
    private final Action action;
    @Getter private final String message;

    private FallbackOutcome(Status status, Action action, String message) {
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.action = action;
        this.message = message;
    }

    public static FallbackOutcome retrying(Action action) {
        Objects.requireNonNull(action, "Action cannot be null");
        return new FallbackOutcome(Status.RETRYING, action, null);
    }

    public static FallbackOutcome error(String message) {
        return new FallbackOutcome(Status.ERROR, null, message);
    }

    public Optional<Action> getAction() {
        return Optional.ofNullable(action);
    }

    public boolean isRetrying() {
        return status == Status.RETRYING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FallbackOutcome that = (FallbackOutcome) o;
        return status == that.status && action == that.action && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, action, message);
    }

    @Override
    public String toString() {
        return "FallbackOutcome{status=" + status
                + (action != null ? ", action=" + action : "")
                + (message != null ? ", message='" + message + '\'' : "")
                + '}';
    }
}
