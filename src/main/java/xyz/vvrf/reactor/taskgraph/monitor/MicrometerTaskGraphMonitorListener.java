package xyz.vvrf.reactor.taskgraph.monitor;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/9
 */

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.taskgraph.error.ErrorClassifier;
import xyz.vvrf.reactor.taskgraph.error.ErrorKind;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

@Slf4j
public class MicrometerTaskGraphMonitorListener implements TaskGraphMonitorListener {

    // 指标名称
    public static final String METRIC_TASK_EXECUTION_TIME = "taskgraph.task.execution.time";
    public static final String METRIC_TASK_EXECUTION_TOTAL = "taskgraph.task.execution.total";
    public static final String METRIC_RUN_EXECUTION_TIME = "taskgraph.run.execution.time";

    // 标签键
    public static final String TAG_GRAPH_NAME = "graph.name";
    public static final String TAG_TASK_ID = "task.id";
    public static final String TAG_STATUS = "status";
    public static final String TAG_ERROR = "error";

    // 状态标签值
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_FAILURE = "FAILURE";
    public static final String STATUS_TIMEOUT = "TIMEOUT";

    private final MeterRegistry meterRegistry;

    public MicrometerTaskGraphMonitorListener(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "MeterRegistry 不能为空");
    }

    @Override
    public void onRunStart(String runId, String graphName, int taskCount, int maxConcurrent) {
        // 只在结束时记录
    }

    @Override
    public void onRoundStart(String runId, String graphName, int round, List<String> batch) {
    }

    @Override
    public void onTaskStart(String runId, String graphName, String taskId) {
    }

    @Override
    public void onTaskSuccess(String runId, String graphName, String taskId, Duration duration) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_TASK_ID, taskId),
                Tag.of(TAG_STATUS, STATUS_SUCCESS)
        );
        recordTimer(METRIC_TASK_EXECUTION_TIME, "任务操作执行时间", tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onTaskFailure(String runId, String graphName, String taskId, Duration duration, Throwable error) {
        String errorTagValue = error != null ? ErrorClassifier.unwrap(error).getClass().getSimpleName() : "Unknown";
        String status = (error != null && ErrorClassifier.classify(error) == ErrorKind.TIMEOUT) ? STATUS_TIMEOUT : STATUS_FAILURE;

        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_TASK_ID, taskId),
                Tag.of(TAG_STATUS, status),
                Tag.of(TAG_ERROR, errorTagValue)
        );
        recordTimer(METRIC_TASK_EXECUTION_TIME, "任务操作执行时间", tags, duration);
        incrementCounter(tags);
    }

    @Override
    public void onRunComplete(String runId, String graphName, Duration totalDuration, boolean success,
                              int completedTasks, Throwable error) {
        Tags tags = Tags.of(
                Tag.of(TAG_GRAPH_NAME, graphName),
                Tag.of(TAG_STATUS, success ? STATUS_SUCCESS : STATUS_FAILURE)
        );
        recordTimer(METRIC_RUN_EXECUTION_TIME, "任务图运行总时间", tags, totalDuration);
    }

    private void recordTimer(String name, String description, Tags tags, Duration duration) {
        try {
            Timer timer = Timer.builder(name)
                    .tags(tags)
                    .description(description)
                    .register(meterRegistry);
            timer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        } catch (Exception e) {
            log.error("记录计时器指标 {} 失败: {}", name, e.getMessage(), e);
        }
    }

    private void incrementCounter(Tags tags) {
        try {
            Counter counter = Counter.builder(METRIC_TASK_EXECUTION_TOTAL)
                    .tags(tags)
                    .description("按状态统计的任务执行总数")
                    .register(meterRegistry);
            counter.increment();
        } catch (Exception e) {
            log.error("增加计数器指标失败: {}", e.getMessage(), e);
        }
    }
}
