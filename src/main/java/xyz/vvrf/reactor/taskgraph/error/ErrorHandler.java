package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 错误处理器注册表。
 * 维护两张表：错误分类 -> 处理动作，错误分类 -> 降级策略。
 * 分派顺序：精确分类 -> 最近的已注册父分类 -> 通用处理。
 * 注册是累加的，同一分类以最后一次注册为准。
 * <p>
 * 执行器本身从不调用此类；由任务操作的调用方决定何时把错误交给它处理。
 */
@Slf4j
public class ErrorHandler {

    private final Map<ErrorKind, ErrorHandlingAction> handlers = new ConcurrentHashMap<>();
    private final Map<ErrorKind, FallbackStrategy> fallbacks = new ConcurrentHashMap<>();
    private final AtomicReference<Throwable> lastError = new AtomicReference<>();
    private final ProcessTerminator processTerminator;

    public ErrorHandler() {
        this(ProcessTerminator.SYSTEM_EXIT);
    }

    /**
     * @param processTerminator 用户中断时用于结束进程的动作 (不能为空)
     */
    public ErrorHandler(ProcessTerminator processTerminator) {
        this.processTerminator = Objects.requireNonNull(processTerminator, "ProcessTerminator cannot be null");
        registerDefaults();
    }

    private void registerDefaults() {
        registerHandler(ErrorKind.TOKEN_LIMIT, error -> log.warn("Token limit exceeded: {}", error.getMessage()));
        registerHandler(ErrorKind.TIMEOUT, error -> log.warn("Operation timed out: {}", error.getMessage()));
        registerHandler(ErrorKind.INVALID_OUTPUT, error -> log.error("Invalid operation output: {}", error.getMessage()));
        registerHandler(ErrorKind.USER_INTERRUPT, this::handleUserInterrupt);

        registerFallback(ErrorKind.TOKEN_LIMIT, error -> {
            log.info("Using fallback for token limit error: reducing context");
            return FallbackOutcome.retrying(FallbackOutcome.Action.REDUCE_CONTEXT);
        });
        registerFallback(ErrorKind.TIMEOUT, error -> {
            log.info("Using fallback for timeout error: retrying with backoff");
            return FallbackOutcome.retrying(FallbackOutcome.Action.BACKOFF_RETRY);
        });
        registerFallback(ErrorKind.INVALID_OUTPUT, error -> {
            log.info("Using fallback for invalid output: requesting simplified response");
            return FallbackOutcome.retrying(FallbackOutcome.Action.SIMPLIFY_REQUEST);
        });
    }

    public ErrorHandler registerHandler(ErrorKind kind, ErrorHandlingAction action) {
        Objects.requireNonNull(kind, "ErrorKind cannot be null");
        Objects.requireNonNull(action, "ErrorHandlingAction cannot be null");
        if (handlers.put(kind, action) != null) {
            log.debug("Replaced error handler for kind {}", kind);
        }
        return this;
    }

    public ErrorHandler registerFallback(ErrorKind kind, FallbackStrategy strategy) {
        Objects.requireNonNull(kind, "ErrorKind cannot be null");
        Objects.requireNonNull(strategy, "FallbackStrategy cannot be null");
        if (fallbacks.put(kind, strategy) != null) {
            log.debug("Replaced fallback strategy for kind {}", kind);
        }
        return this;
    }

    /**
     * 处理一个错误：记录为最近错误，并分派给最匹配的处理动作。
     * 未匹配任何已注册分类时，使用通用处理（记录错误及堆栈，不再抛出）。
     *
     * @param error 要处理的错误 (不能为空)
     */
    public void handle(Throwable error) {
        Objects.requireNonNull(error, "Error cannot be null");
        lastError.set(error);
        ErrorKind kind = ErrorClassifier.classify(error);
        ErrorHandlingAction action = resolve(handlers, kind);
        if (action == null) {
            handleGeneric(error, kind);
            return;
        }
        try {
            action.handle(error);
        } catch (RuntimeException e) {
            log.error("Error handler for kind {} threw an exception while handling '{}'", kind, error.getMessage(), e);
        }
    }

    /**
     * 为错误产出降级结果，分派规则同 {@link #handle(Throwable)}。
     * 未匹配时返回 {@link FallbackOutcome.Status#ERROR} 状态并携带错误消息。
     *
     * @param error 要降级的错误 (不能为空)
     * @return 降级结果，永不为 null
     */
    public FallbackOutcome fallback(Throwable error) {
        Objects.requireNonNull(error, "Error cannot be null");
        ErrorKind kind = ErrorClassifier.classify(error);
        FallbackStrategy strategy = resolve(fallbacks, kind);
        if (strategy != null) {
            FallbackOutcome outcome = strategy.apply(error);
            if (outcome != null) {
                return outcome;
            }
            log.warn("Fallback strategy for kind {} returned null, using generic fallback", kind);
        }
        log.info("Using generic fallback strategy for kind {}", kind);
        return FallbackOutcome.error(String.valueOf(ErrorClassifier.unwrap(error).getMessage()));
    }

    public Optional<Throwable> getLastError() {
        return Optional.ofNullable(lastError.get());
    }

    private static <T> T resolve(Map<ErrorKind, T> registry, ErrorKind kind) {
        for (ErrorKind current = kind; current != null; current = current.getParent()) {
            T candidate = registry.get(current);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    private void handleUserInterrupt(Throwable error) {
        log.info("User interrupted: {}", error.getMessage());
        processTerminator.terminate();
    }

    private void handleGeneric(Throwable error, ErrorKind kind) {
        log.error("Unexpected error [{}/{}]: {}", kind, ErrorClassifier.severityOf(error), error.getMessage(), error);
    }
}
