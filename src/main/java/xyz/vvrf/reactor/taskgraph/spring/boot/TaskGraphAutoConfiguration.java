package xyz.vvrf.reactor.taskgraph.spring.boot;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/14
 */

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfigureAfter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.taskgraph.error.ErrorHandler;
import xyz.vvrf.reactor.taskgraph.execution.GraphExecutor;
import xyz.vvrf.reactor.taskgraph.execution.StandardGraphExecutor;
import xyz.vvrf.reactor.taskgraph.monitor.LoggingTaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.monitor.MicrometerTaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.monitor.TaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.retry.RetryPolicy;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务图框架的 Spring Boot 自动配置类。
 * 职责:
 * 1. 启用并绑定 {@link TaskGraphProperties}。
 * 2. 提供任务执行用的 {@link Scheduler} Bean ("taskGraphExecutionScheduler")，类型由属性配置。
 * 3. 提供默认的 {@link RetryPolicy} 和 {@link ErrorHandler} Bean。
 * 4. 收集所有的 {@link TaskGraphMonitorListener} Bean 到一个列表 Bean ("taskGraphMonitorListeners")。
 * 5. 提供核心的 {@link GraphExecutor} Bean。
 * <p>
 * 以上 Bean 都可以由用户自行定义同类型 (或同名) 的 Bean 覆盖。
 */
@Configuration
@EnableConfigurationProperties(TaskGraphProperties.class)
@AutoConfigureAfter(name = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@Slf4j
public class TaskGraphAutoConfiguration {

    public static final String SCHEDULER_BEAN_NAME = "taskGraphExecutionScheduler";
    public static final String LISTENERS_BEAN_NAME = "taskGraphMonitorListeners";

    public TaskGraphAutoConfiguration() {
        log.info("任务图框架自动配置 (TaskGraphAutoConfiguration) 已加载。");
    }

    /**
     * 提供任务执行用的 Reactor Scheduler。
     * 调度器类型和参数可由 {@link TaskGraphProperties.SchedulerProps} 配置。
     */
    @Bean(name = SCHEDULER_BEAN_NAME, destroyMethod = "dispose")
    @ConditionalOnMissingBean(name = SCHEDULER_BEAN_NAME)
    public Scheduler taskGraphExecutionScheduler(TaskGraphProperties properties) {
        TaskGraphProperties.SchedulerProps schedulerProps = properties.getScheduler();
        String namePrefix = schedulerProps.getNamePrefix();

        switch (schedulerProps.getType()) {
            case PARALLEL:
                TaskGraphProperties.ParallelProps pProps = schedulerProps.getParallel();
                log.info("正在创建 '{}' (Parallel): prefix={}, parallelism={}", SCHEDULER_BEAN_NAME, namePrefix, pProps.getParallelism());
                return Schedulers.newParallel(namePrefix, pProps.getParallelism(), true);
            case SINGLE:
                log.info("正在创建 '{}' (Single): prefix={}", SCHEDULER_BEAN_NAME, namePrefix);
                return Schedulers.newSingle(namePrefix, true);
            case BOUNDED_ELASTIC:
            default:
                TaskGraphProperties.BoundedElasticProps beProps = schedulerProps.getBoundedElastic();
                log.info("正在创建 '{}' (BoundedElastic): prefix={}, cap={}, queue={}, ttl={}s",
                        SCHEDULER_BEAN_NAME, namePrefix, beProps.getThreadCap(), beProps.getQueuedTaskCap(), beProps.getTtlSeconds());
                return Schedulers.newBoundedElastic(beProps.getThreadCap(), beProps.getQueuedTaskCap(),
                        namePrefix, beProps.getTtlSeconds(), true);
        }
    }

    /**
     * 提供默认的重试策略，由 {@link TaskGraphProperties.RetryProps} 配置。
     * 执行器不会自动应用它：任务操作通过 {@link RetryPolicy#wrap} 或 {@link RetryPolicy#apply} 显式使用。
     */
    @Bean
    @ConditionalOnMissingBean(RetryPolicy.class)
    public RetryPolicy taskGraphRetryPolicy(TaskGraphProperties properties) {
        TaskGraphProperties.RetryProps retryProps = properties.getRetry();
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(retryProps.getMaxAttempts())
                .backoffFactor(retryProps.getBackoffFactor())
                .backoffUnit(retryProps.getBackoffUnit())
                .maxBackoff(retryProps.getMaxBackoff())
                .retryableKinds(retryProps.getRetryableKinds())
                .build();
        log.info("正在创建默认重试策略: {}", policy);
        return policy;
    }

    @Bean
    @ConditionalOnMissingBean(ErrorHandler.class)
    public ErrorHandler taskGraphErrorHandler() {
        return new ErrorHandler();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingTaskGraphMonitorListener.class)
    @ConditionalOnProperty(prefix = "taskgraph.monitor", name = "logging-enabled", havingValue = "true", matchIfMissing = true)
    public LoggingTaskGraphMonitorListener loggingTaskGraphMonitorListener() {
        return new LoggingTaskGraphMonitorListener();
    }

    /**
     * 收集在应用上下文中定义的所有 TaskGraphMonitorListener Bean，作为不可变列表提供。
     */
    @Bean(name = LISTENERS_BEAN_NAME)
    @ConditionalOnMissingBean(name = LISTENERS_BEAN_NAME)
    public List<TaskGraphMonitorListener> taskGraphMonitorListeners(ObjectProvider<TaskGraphMonitorListener> listenersProvider) {
        List<TaskGraphMonitorListener> listeners = listenersProvider.orderedStream().collect(Collectors.toList());
        if (listeners.isEmpty()) {
            log.info("在 Spring 上下文中未找到 TaskGraphMonitorListener Bean。");
        } else {
            log.info("收集到 {} 个 TaskGraphMonitorListener Bean: {}", listeners.size(),
                    listeners.stream().map(l -> l.getClass().getSimpleName()).collect(Collectors.joining(", ")));
        }
        return Collections.unmodifiableList(listeners);
    }

    @Bean
    @ConditionalOnMissingBean(GraphExecutor.class)
    public GraphExecutor graphExecutor(TaskGraphProperties properties,
                                       @Qualifier(SCHEDULER_BEAN_NAME) Scheduler scheduler,
                                       @Qualifier(LISTENERS_BEAN_NAME) List<TaskGraphMonitorListener> listeners) {
        log.info("正在创建 GraphExecutor Bean，配置: {}", properties);
        return new StandardGraphExecutor(properties.getExecutor().getMaxConcurrent(), scheduler, listeners);
    }

    /**
     * 存在 MeterRegistry Bean 时注册 Micrometer 监听器。
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MicrometerListenerConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(MicrometerTaskGraphMonitorListener.class)
        public MicrometerTaskGraphMonitorListener micrometerTaskGraphMonitorListener(MeterRegistry meterRegistry) {
            log.info("检测到 MeterRegistry，注册 MicrometerTaskGraphMonitorListener。");
            return new MicrometerTaskGraphMonitorListener(meterRegistry);
        }
    }
}
