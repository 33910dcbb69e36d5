package xyz.vvrf.reactor.taskgraph.test.util;

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.taskgraph.core.TaskOperation;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * 用于测试目的的可配置 TaskOperation 实现。
 * 使用 Builder 模式进行配置，记录每次调用收到的参数，并可通过 {@link ConcurrencyGauge} 统计并发度。
 */
public class TestTaskOperation implements TaskOperation {

    private final String name;
    private final Duration delay;
    private final BiFunction<List<Object>, Map<String, Object>, Mono<Object>> logic;
    private final int failuresBeforeSuccess;
    private final Supplier<? extends Throwable> failure;
    private final ConcurrencyGauge gauge;
    private final List<String> startLog;

    private final AtomicInteger invocations = new AtomicInteger(0);
    private final List<List<Object>> receivedArgs = Collections.synchronizedList(new ArrayList<>());
    private final List<Map<String, Object>> receivedInputs = Collections.synchronizedList(new ArrayList<>());

    private TestTaskOperation(Builder builder) {
        this.name = builder.name;
        this.delay = builder.delay;
        this.logic = builder.logic;
        this.failuresBeforeSuccess = builder.failuresBeforeSuccess;
        this.failure = builder.failure;
        this.gauge = builder.gauge;
        this.startLog = builder.startLog;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * 直接返回固定值的操作。
     */
    public static TestTaskOperation returning(String name, Object value) {
        return builder(name).returns(value).build();
    }

    @Override
    public Mono<Object> execute(List<Object> args, Map<String, Object> namedInputs) {
        return Mono.defer(() -> {
            int attempt = invocations.incrementAndGet();
            receivedArgs.add(args);
            receivedInputs.add(namedInputs);
            if (startLog != null) {
                startLog.add(name);
            }
            if (gauge != null) {
                gauge.enter();
            }

            Mono<Object> body = attempt <= failuresBeforeSuccess
                    ? Mono.defer(() -> Mono.error(failure.get()))
                    : Mono.defer(() -> logic.apply(args, namedInputs));
            Mono<Object> delayed = delay.isZero() ? body : Mono.delay(delay).then(body);
            return gauge == null ? delayed : delayed.doFinally(signal -> gauge.exit());
        });
    }

    public String getName() {
        return name;
    }

    public int getInvocationCount() {
        return invocations.get();
    }

    public List<Map<String, Object>> getReceivedInputs() {
        synchronized (receivedInputs) {
            return new ArrayList<>(receivedInputs);
        }
    }

    public Map<String, Object> getLastInputs() {
        List<Map<String, Object>> inputs = getReceivedInputs();
        return inputs.isEmpty() ? null : inputs.get(inputs.size() - 1);
    }

    public List<Object> getLastArgs() {
        synchronized (receivedArgs) {
            return receivedArgs.isEmpty() ? null : receivedArgs.get(receivedArgs.size() - 1);
        }
    }

    public static class Builder {
        private final String name;
        private Duration delay = Duration.ZERO;
        private BiFunction<List<Object>, Map<String, Object>, Mono<Object>> logic;
        private int failuresBeforeSuccess = 0;
        private Supplier<? extends Throwable> failure;
        private ConcurrencyGauge gauge;
        private List<String> startLog;

        Builder(String name) {
            this.name = name;
            this.logic = (args, inputs) -> Mono.just((Object) (name + "-result"));
        }

        public Builder returns(Object value) {
            this.logic = (args, inputs) -> Mono.justOrEmpty(value);
            return this;
        }

        /**
         * 设置执行逻辑。
         */
        public Builder logic(BiFunction<List<Object>, Map<String, Object>, Mono<Object>> logic) {
            this.logic = Objects.requireNonNull(logic);
            return this;
        }

        /**
         * 每次调用都以 supplier 提供的错误失败。
         */
        public Builder failsWith(Supplier<? extends Throwable> failure) {
            return failsTimes(Integer.MAX_VALUE, failure);
        }

        /**
         * 前 times 次调用以错误失败，之后执行正常逻辑。
         */
        public Builder failsTimes(int times, Supplier<? extends Throwable> failure) {
            this.failuresBeforeSuccess = times;
            this.failure = Objects.requireNonNull(failure);
            return this;
        }

        public Builder delay(Duration delay) {
            this.delay = Objects.requireNonNull(delay);
            return this;
        }

        public Builder gauge(ConcurrencyGauge gauge) {
            this.gauge = gauge;
            return this;
        }

        /**
         * 每次调用开始时把操作名称追加到共享列表中 (列表需线程安全)。
         */
        public Builder recordStartsTo(List<String> startLog) {
            this.startLog = startLog;
            return this;
        }

        public TestTaskOperation build() {
            return new TestTaskOperation(this);
        }
    }

    /**
     * 统计同时执行中的操作数及其峰值。
     */
    public static class ConcurrencyGauge {
        private final AtomicInteger current = new AtomicInteger(0);
        private final AtomicInteger peak = new AtomicInteger(0);

        void enter() {
            int now = current.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
        }

        void exit() {
            current.decrementAndGet();
        }

        public int getCurrent() {
            return current.get();
        }

        public int getPeak() {
            return peak.get();
        }
    }
}
