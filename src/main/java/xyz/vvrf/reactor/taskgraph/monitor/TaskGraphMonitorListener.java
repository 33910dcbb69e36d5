package xyz.vvrf.reactor.taskgraph.monitor;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/9
 */

import java.time.Duration;
import java.util.List;

/**
 * 用于监控任务图执行事件的监听器接口。
 * 包括运行级别、轮次级别和任务级别的事件。
 * 监听器抛出的异常会被执行器记录并忽略，不会影响运行结果。
 */
public interface TaskGraphMonitorListener {

    /**
     * 运行开始时调用。
     *
     * @param runId         运行 ID
     * @param graphName     任务图名称
     * @param taskCount     任务总数
     * @param maxConcurrent 本次运行的并发上限
     */
    void onRunStart(String runId, String graphName, int taskCount, int maxConcurrent);

    /**
     * 一个调度轮次开始时调用（在本轮任务启动之前）。
     *
     * @param runId     运行 ID
     * @param graphName 任务图名称
     * @param round     轮次序号，从 1 开始
     * @param batch     本轮选中的任务 ID (启动顺序)
     */
    void onRoundStart(String runId, String graphName, int round, List<String> batch);

    void onTaskStart(String runId, String graphName, String taskId);

    /**
     * 任务成功完成时调用。
     *
     * @param duration 操作执行耗时 (含操作内部的重试)
     */
    void onTaskSuccess(String runId, String graphName, String taskId, Duration duration);

    /**
     * 任务失败时调用。
     *
     * @param duration 操作执行耗时
     * @param error    导致失败的错误
     */
    void onTaskFailure(String runId, String graphName, String taskId, Duration duration, Throwable error);

    /**
     * 运行结束时调用 (无论成功或失败)。
     *
     * @param totalDuration  运行总耗时
     * @param success        是否所有任务都已完成
     * @param completedTasks 已完成的任务数
     * @param error          失败原因；成功时为 null
     */
    void onRunComplete(String runId, String graphName, Duration totalDuration, boolean success, int completedTasks, Throwable error);
}
