package xyz.vvrf.reactor.taskgraph.retry;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;
import xyz.vvrf.reactor.taskgraph.core.TaskOperation;
import xyz.vvrf.reactor.taskgraph.error.ErrorClassifier;
import xyz.vvrf.reactor.taskgraph.error.ErrorKind;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * 带指数退避的重试策略。
 * <p>
 * 第 1 次尝试在订阅时立即执行；可重试的失败在还有剩余次数时等待
 * {@code backoffUnit × backoffFactor^(attempt-1)} (受 maxBackoff 限制) 后重新订阅；
 * 不可重试的失败立即原样传播；尝试次数耗尽后原样传播最后一次的错误。
 * <p>
 * 同一个配置同时提供响应式 ({@link #execute(Supplier)}, {@link #apply(Mono)}) 和阻塞式
 * ({@link #executeBlocking(Callable)}) 两种用法，也可以通过 {@link #toRetrySpec()} 作为 Reactor {@link Retry} 使用。
 */
@Slf4j
@Getter
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_BACKOFF_FACTOR = 1.5;
    public static final Duration DEFAULT_BACKOFF_UNIT = Duration.ofSeconds(1);

    private final int maxAttempts;
    private final double backoffFactor;
    private final Duration backoffUnit;
    private final Duration maxBackoff;
    private final Set<ErrorKind> retryableKinds;
    private final Scheduler scheduler;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.backoffFactor = builder.backoffFactor;
        this.backoffUnit = builder.backoffUnit;
        this.maxBackoff = builder.maxBackoff;
        this.retryableKinds = Collections.unmodifiableSet(builder.retryableKinds.isEmpty()
                ? EnumSet.noneOf(ErrorKind.class)
                : EnumSet.copyOf(builder.retryableKinds));
        this.scheduler = builder.scheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 默认策略：3 次尝试，退避因子 1.5，单位 1 秒，重试 TIMEOUT 和 TOKEN_LIMIT。
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * 判断错误是否应该被重试。USER_INTERRUPT、CONFIGURATION、DEPENDENCY 永远不重试。
     */
    public boolean isRetryable(Throwable error) {
        ErrorKind kind = ErrorClassifier.classify(error);
        return kind.isEverRetryable() && retryableKinds.contains(kind);
    }

    /**
     * 第 attempt 次失败之后的等待时长：{@code backoffUnit × backoffFactor^(attempt-1)}，受 maxBackoff 限制。
     *
     * @param attempt 刚失败的尝试序号，从 1 开始
     */
    public Duration backoffFor(int attempt) {
        double multiplier = Math.pow(backoffFactor, Math.max(0, attempt - 1));
        long nanos = (long) Math.min(Long.MAX_VALUE, backoffUnit.toNanos() * multiplier);
        Duration backoff = Duration.ofNanos(nanos);
        if (maxBackoff != null && backoff.compareTo(maxBackoff) > 0) {
            return maxBackoff;
        }
        return backoff;
    }

    /**
     * 将此策略表示为 Reactor {@link Retry}，可直接用于 {@code retryWhen}。
     * 放弃重试时传播原始错误，不包装为 RetryExhaustedException。
     */
    public Retry toRetrySpec() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long attempt = signal.totalRetries() + 1;
            if (!isRetryable(failure)) {
                log.debug("Attempt {} failed with non-retryable {}: {}",
                        attempt, ErrorClassifier.classify(failure), failure.getMessage());
                return Mono.<Long>error(failure);
            }
            if (attempt >= maxAttempts) {
                log.warn("Giving up after {} attempt(s): {}", attempt, failure.getMessage());
                return Mono.<Long>error(failure);
            }
            Duration backoff = backoffFor((int) attempt);
            log.warn("Retry attempt {}/{} after {}ms ({}: {})",
                    attempt + 1, maxAttempts, backoff.toMillis(), ErrorClassifier.classify(failure), failure.getMessage());
            return Mono.delay(backoff, scheduler);
        }));
    }

    /**
     * 对给定的 Mono 应用重试。每次重试都会重新订阅源 Mono，因此源必须是惰性的。
     */
    public <T> Mono<T> apply(Mono<T> source) {
        return source.retryWhen(toRetrySpec());
    }

    /**
     * 每次尝试调用一次 supplier 获取新的 Mono。
     */
    public <T> Mono<T> execute(Supplier<Mono<T>> supplier) {
        Objects.requireNonNull(supplier, "supplier 不能为空");
        return apply(Mono.defer(supplier));
    }

    /**
     * 同步代码的响应式入口：每次尝试在订阅时调用 callable。
     */
    public <T> Mono<T> executeCallable(Callable<T> callable) {
        Objects.requireNonNull(callable, "callable 不能为空");
        return apply(Mono.fromCallable(callable));
    }

    /**
     * 阻塞调用：在调用线程上等待最终结果，失败时原样抛出最后一次的错误。
     */
    public <T> T executeBlocking(Callable<T> callable) throws Exception {
        try {
            return executeCallable(callable).block();
        } catch (RuntimeException e) {
            Throwable actual = Exceptions.unwrap(e);
            if (actual instanceof Exception) {
                throw (Exception) actual;
            }
            throw e;
        }
    }

    /**
     * 用此策略包装一个任务操作。
     */
    public TaskOperation wrap(TaskOperation operation) {
        Objects.requireNonNull(operation, "operation 不能为空");
        return (args, namedInputs) -> execute(() -> operation.execute(args, namedInputs));
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", backoffFactor=" + backoffFactor
                + ", backoffUnit=" + backoffUnit + ", maxBackoff=" + maxBackoff
                + ", retryableKinds=" + retryableKinds + '}';
    }

    public static final class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private double backoffFactor = DEFAULT_BACKOFF_FACTOR;
        private Duration backoffUnit = DEFAULT_BACKOFF_UNIT;
        private Duration maxBackoff;
        private Set<ErrorKind> retryableKinds = EnumSet.of(ErrorKind.TIMEOUT, ErrorKind.TOKEN_LIMIT);
        private Scheduler scheduler = Schedulers.parallel();

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffFactor(double backoffFactor) {
            if (!(backoffFactor > 0)) {
                throw new IllegalArgumentException("backoffFactor must be positive, got " + backoffFactor);
            }
            this.backoffFactor = backoffFactor;
            return this;
        }

        public Builder backoffUnit(Duration backoffUnit) {
            Objects.requireNonNull(backoffUnit, "backoffUnit 不能为空");
            if (backoffUnit.isNegative()) {
                throw new IllegalArgumentException("backoffUnit must not be negative, got " + backoffUnit);
            }
            this.backoffUnit = backoffUnit;
            return this;
        }

        /**
         * @param maxBackoff 单次等待的上限，null 表示不限制
         */
        public Builder maxBackoff(Duration maxBackoff) {
            if (maxBackoff != null && maxBackoff.isNegative()) {
                throw new IllegalArgumentException("maxBackoff must not be negative, got " + maxBackoff);
            }
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder retryableKinds(ErrorKind... kinds) {
            return retryableKinds(Arrays.asList(kinds));
        }

        public Builder retryableKinds(Collection<ErrorKind> kinds) {
            Objects.requireNonNull(kinds, "retryableKinds 不能为空");
            Set<ErrorKind> copy = EnumSet.noneOf(ErrorKind.class);
            copy.addAll(kinds);
            this.retryableKinds = copy;
            return this;
        }

        public Builder scheduler(Scheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler 不能为空");
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }
    }
}
