package xyz.vvrf.reactor.taskgraph.monitor;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/9
 */

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * 将任务图执行事件输出到日志的监听器。
 */
@Slf4j
public class LoggingTaskGraphMonitorListener implements TaskGraphMonitorListener {

    @Override
    public void onRunStart(String runId, String graphName, int taskCount, int maxConcurrent) {
        log.info("[MONITOR] 运行:[{}] 任务图:[{}] 开始。 任务数:[{}], 并发上限:[{}]",
                runId, graphName, taskCount, maxConcurrent);
    }

    @Override
    public void onRoundStart(String runId, String graphName, int round, List<String> batch) {
        log.info("[MONITOR] 运行:[{}] 任务图:[{}] 第 {} 轮开始。 批次:{}",
                runId, graphName, round, batch);
    }

    @Override
    public void onTaskStart(String runId, String graphName, String taskId) {
        log.info("[MONITOR] 运行:[{}] 任务图:[{}] 任务:[{}] 开始。", runId, graphName, taskId);
    }

    @Override
    public void onTaskSuccess(String runId, String graphName, String taskId, Duration duration) {
        log.info("[MONITOR] 运行:[{}] 任务图:[{}] 任务:[{}] 成功。 耗时:[{}ms]",
                runId, graphName, taskId, duration.toMillis());
    }

    @Override
    public void onTaskFailure(String runId, String graphName, String taskId, Duration duration, Throwable error) {
        log.error("[MONITOR] 运行:[{}] 任务图:[{}] 任务:[{}] 失败。 耗时:[{}ms], 错误:[{}]",
                runId, graphName, taskId, duration.toMillis(), error.getMessage());
    }

    @Override
    public void onRunComplete(String runId, String graphName, Duration totalDuration, boolean success,
                              int completedTasks, Throwable error) {
        if (success) {
            log.info("[MONITOR] 运行:[{}] 任务图:[{}] 完成。 耗时:[{}ms], 已完成任务:[{}]",
                    runId, graphName, totalDuration.toMillis(), completedTasks);
        } else {
            log.warn("[MONITOR] 运行:[{}] 任务图:[{}] 失败。 耗时:[{}ms], 已完成任务:[{}], 错误:[{}]",
                    runId, graphName, totalDuration.toMillis(), completedTasks,
                    error != null ? error.getMessage() : "unknown");
        }
    }
}
