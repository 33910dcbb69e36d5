package xyz.vvrf.reactor.taskgraph.spring.boot;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/14
 */

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.taskgraph.error.ErrorKind;

import javax.validation.Valid;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 任务图框架的配置属性类。
 * 绑定 'taskgraph' 前缀下的属性。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "taskgraph")
@Validated
public class TaskGraphProperties {

    @Valid
    private final Executor executor = new Executor();
    @Valid
    private final SchedulerProps scheduler = new SchedulerProps();
    @Valid
    private final RetryProps retry = new RetryProps();
    @Valid
    private final MonitorProps monitor = new MonitorProps();

    @Getter
    @Setter
    public static class Executor {
        /**
         * 同一调度轮次内允许同时执行的任务数上限。
         */
        @Min(1)
        private int maxConcurrent = 5;
    }

    @Getter
    @Setter
    public static class SchedulerProps {
        /**
         * 调度器类型。
         */
        @NotNull
        private SchedulerType type = SchedulerType.BOUNDED_ELASTIC;

        /**
         * 调度器线程名称前缀。
         */
        @NotBlank
        private String namePrefix = "taskgraph-exec";

        /**
         * BoundedElastic 调度器特定配置。
         */
        @Valid
        private final BoundedElasticProps boundedElastic = new BoundedElasticProps();

        /**
         * Parallel 调度器特定配置。
         */
        @Valid
        private final ParallelProps parallel = new ParallelProps();
    }

    public enum SchedulerType {
        BOUNDED_ELASTIC, PARALLEL, SINGLE
    }

    @Getter
    @Setter
    public static class BoundedElasticProps {
        @Min(1)
        private int threadCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE;
        @Min(1)
        private int queuedTaskCap = Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE;
        @Min(0)
        private int ttlSeconds = 60;
    }

    @Getter
    @Setter
    public static class ParallelProps {
        @Min(1)
        private int parallelism = Runtime.getRuntime().availableProcessors();
    }

    @Getter
    @Setter
    public static class RetryProps {
        /**
         * 最大总尝试次数 (1 表示不重试)。
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * 指数退避因子，第 n 次失败后等待 backoffUnit × backoffFactor^(n-1)。
         */
        @DecimalMin(value = "0.0", inclusive = false)
        private double backoffFactor = 1.5;

        /**
         * 退避时间单位。
         */
        @NotNull
        private Duration backoffUnit = Duration.ofSeconds(1);

        /**
         * 单次退避等待的上限，为空表示不限制。
         */
        private Duration maxBackoff;

        /**
         * 需要重试的错误分类。
         */
        @NotNull
        private List<ErrorKind> retryableKinds = new ArrayList<>(Arrays.asList(ErrorKind.TIMEOUT, ErrorKind.TOKEN_LIMIT));
    }

    @Getter
    @Setter
    public static class MonitorProps {
        /**
         * 是否注册日志监控监听器。
         */
        private boolean loggingEnabled = true;
    }

    @Override
    public String toString() {
        return "TaskGraphProperties{" +
                "executor={maxConcurrent=" + executor.maxConcurrent +
                "}, scheduler={type=" + scheduler.type +
                ", namePrefix='" + scheduler.namePrefix + '\'' +
                ", boundedElastic={threadCap=" + scheduler.boundedElastic.threadCap +
                ", queuedTaskCap=" + scheduler.boundedElastic.queuedTaskCap +
                ", ttlSeconds=" + scheduler.boundedElastic.ttlSeconds +
                "}, parallel={parallelism=" + scheduler.parallel.parallelism +
                "}}, retry={maxAttempts=" + retry.maxAttempts +
                ", backoffFactor=" + retry.backoffFactor +
                ", backoffUnit=" + retry.backoffUnit +
                ", maxBackoff=" + retry.maxBackoff +
                ", retryableKinds=" + retry.retryableKinds +
                "}, monitor={loggingEnabled=" + monitor.loggingEnabled +
                "}}";
    }
}
