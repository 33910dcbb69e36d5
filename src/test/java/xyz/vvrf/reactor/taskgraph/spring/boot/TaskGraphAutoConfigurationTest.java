package xyz.vvrf.reactor.taskgraph.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.taskgraph.core.TaskGraph;
import xyz.vvrf.reactor.taskgraph.error.ErrorHandler;
import xyz.vvrf.reactor.taskgraph.error.ErrorKind;
import xyz.vvrf.reactor.taskgraph.execution.GraphExecutor;
import xyz.vvrf.reactor.taskgraph.execution.StandardGraphExecutor;
import xyz.vvrf.reactor.taskgraph.monitor.LoggingTaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.monitor.MicrometerTaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.monitor.TaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.retry.RetryPolicy;
import xyz.vvrf.reactor.taskgraph.test.util.TestTaskOperation;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TaskGraphAutoConfiguration")
class TaskGraphAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TaskGraphAutoConfiguration.class));

    @Test
    @DisplayName("默认配置下装配所有 Bean")
    void wiresDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(GraphExecutor.class);
            assertThat(context).hasSingleBean(RetryPolicy.class);
            assertThat(context).hasSingleBean(ErrorHandler.class);
            assertThat(context).hasSingleBean(LoggingTaskGraphMonitorListener.class);
            assertThat(context).doesNotHaveBean(MicrometerTaskGraphMonitorListener.class);
            assertThat(context).hasBean(TaskGraphAutoConfiguration.SCHEDULER_BEAN_NAME);

            StandardGraphExecutor executor = (StandardGraphExecutor) context.getBean(GraphExecutor.class);
            assertThat(executor.getDefaultMaxConcurrent()).isEqualTo(5);

            RetryPolicy policy = context.getBean(RetryPolicy.class);
            assertThat(policy.getMaxAttempts()).isEqualTo(3);
            assertThat(policy.getBackoffFactor()).isEqualTo(1.5);
            assertThat(policy.getRetryableKinds()).containsExactlyInAnyOrder(ErrorKind.TIMEOUT, ErrorKind.TOKEN_LIMIT);

            TaskGraph graph = new TaskGraph("boot")
                    .addTask("A", TestTaskOperation.returning("A", "a"))
                    .addTask("B", TestTaskOperation.returning("B", "b"), "A");
            Map<String, Object> results = executor.run(graph).block(Duration.ofSeconds(10));
            assertThat(results).containsEntry("A", "a").containsEntry("B", "b");
        });
    }

    @Test
    @DisplayName("属性绑定到执行器、调度器和重试策略")
    void honoursProperties() {
        contextRunner
                .withPropertyValues(
                        "taskgraph.executor.max-concurrent=2",
                        "taskgraph.scheduler.type=PARALLEL",
                        "taskgraph.scheduler.parallel.parallelism=2",
                        "taskgraph.retry.max-attempts=5",
                        "taskgraph.retry.backoff-factor=2.0",
                        "taskgraph.retry.backoff-unit=50ms",
                        "taskgraph.retry.max-backoff=1s",
                        "taskgraph.retry.retryable-kinds=TIMEOUT",
                        "taskgraph.monitor.logging-enabled=false")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    StandardGraphExecutor executor = (StandardGraphExecutor) context.getBean(GraphExecutor.class);
                    assertThat(executor.getDefaultMaxConcurrent()).isEqualTo(2);

                    RetryPolicy policy = context.getBean(RetryPolicy.class);
                    assertThat(policy.getMaxAttempts()).isEqualTo(5);
                    assertThat(policy.backoffFor(2)).isEqualTo(Duration.ofMillis(100));
                    assertThat(policy.backoffFor(10)).isEqualTo(Duration.ofSeconds(1));
                    assertThat(policy.getRetryableKinds()).containsExactly(ErrorKind.TIMEOUT);

                    assertThat(context).doesNotHaveBean(LoggingTaskGraphMonitorListener.class);
                    assertThat(context.getBean(TaskGraphAutoConfiguration.SCHEDULER_BEAN_NAME, Scheduler.class)).isNotNull();
                });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时注册 Micrometer 监听器并加入监听器列表")
    void registersMicrometerListenerWhenRegistryPresent() {
        contextRunner
                .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(MicrometerTaskGraphMonitorListener.class);
                    @SuppressWarnings("unchecked")
                    List<TaskGraphMonitorListener> listeners = (List<TaskGraphMonitorListener>)
                            context.getBean(TaskGraphAutoConfiguration.LISTENERS_BEAN_NAME, List.class);
                    assertThat(listeners).hasSize(2);
                });
    }

    @Test
    @DisplayName("用户定义的 Bean 优先")
    void userBeansTakePrecedence() {
        RetryPolicy custom = RetryPolicy.builder().maxAttempts(1).build();
        contextRunner
                .withBean(RetryPolicy.class, () -> custom)
                .run(context -> assertThat(context.getBean(RetryPolicy.class)).isSameAs(custom));
    }

    @Test
    @DisplayName("非法属性导致启动失败")
    void rejectsInvalidProperties() {
        contextRunner
                .withPropertyValues("taskgraph.executor.max-concurrent=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
