package xyz.vvrf.reactor.taskgraph.monitor;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import xyz.vvrf.reactor.taskgraph.core.TaskGraph;
import xyz.vvrf.reactor.taskgraph.error.OperationTimeoutException;
import xyz.vvrf.reactor.taskgraph.execution.StandardGraphExecutor;
import xyz.vvrf.reactor.taskgraph.test.util.TestTaskOperation;

import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static xyz.vvrf.reactor.taskgraph.monitor.MicrometerTaskGraphMonitorListener.*;

@DisplayName("MicrometerTaskGraphMonitorListener")
class MicrometerTaskGraphMonitorListenerTest {

    private SimpleMeterRegistry registry;
    private MicrometerTaskGraphMonitorListener listener;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        listener = new MicrometerTaskGraphMonitorListener(registry);
    }

    @Test
    @DisplayName("成功的任务记录计时器和计数器")
    void recordsSuccess() {
        listener.onTaskSuccess("run-1", "graph", "summarize", Duration.ofMillis(120));

        Timer timer = registry.find(METRIC_TASK_EXECUTION_TIME)
                .tags(TAG_GRAPH_NAME, "graph", TAG_TASK_ID, "summarize", TAG_STATUS, STATUS_SUCCESS)
                .timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertEquals(120, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);

        Counter counter = registry.find(METRIC_TASK_EXECUTION_TOTAL).tag(TAG_STATUS, STATUS_SUCCESS).counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("超时失败标记为 TIMEOUT 状态并带有错误类型标签")
    void recordsTimeoutFailure() {
        listener.onTaskFailure("run-1", "graph", "call-llm", Duration.ofSeconds(2), new OperationTimeoutException("slow"));
        listener.onTaskFailure("run-1", "graph", "parse", Duration.ofMillis(5), new IllegalStateException("bad"));

        assertNotNull(registry.find(METRIC_TASK_EXECUTION_TOTAL)
                .tags(TAG_TASK_ID, "call-llm", TAG_STATUS, STATUS_TIMEOUT, TAG_ERROR, "OperationTimeoutException")
                .counter());
        assertNotNull(registry.find(METRIC_TASK_EXECUTION_TOTAL)
                .tags(TAG_TASK_ID, "parse", TAG_STATUS, STATUS_FAILURE, TAG_ERROR, "IllegalStateException")
                .counter());
    }

    @Test
    @DisplayName("与执行器集成时记录每个任务和整次运行")
    void recordsRunThroughExecutor() {
        StandardGraphExecutor executor = new StandardGraphExecutor(2, Schedulers.boundedElastic(),
                Collections.singletonList(listener));
        TaskGraph graph = new TaskGraph("metrics")
                .addTask("A", TestTaskOperation.returning("A", 1))
                .addTask("B", TestTaskOperation.returning("B", 2), "A");

        executor.run(graph).block(Duration.ofSeconds(10));

        assertEquals(2.0, registry.find(METRIC_TASK_EXECUTION_TOTAL).tag(TAG_GRAPH_NAME, "metrics").counters()
                .stream().mapToDouble(Counter::count).sum());
        Timer runTimer = registry.find(METRIC_RUN_EXECUTION_TIME).tags(TAG_GRAPH_NAME, "metrics", TAG_STATUS, STATUS_SUCCESS).timer();
        assertNotNull(runTimer);
        assertEquals(1, runTimer.count());
    }
}
