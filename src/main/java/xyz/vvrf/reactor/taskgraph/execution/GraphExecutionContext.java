package xyz.vvrf.reactor.taskgraph.execution;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/8
 */

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.taskgraph.core.TaskDefinition;
import xyz.vvrf.reactor.taskgraph.core.TaskGraph;
import xyz.vvrf.reactor.taskgraph.core.TaskStatus;
import xyz.vvrf.reactor.taskgraph.error.BatchFailureException;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 封装单次任务图运行的运行时状态。
 * 每个 {@link StandardGraphExecutor#run(TaskGraph, int, String)} 调用都会创建一个此类的实例，
 * 不同运行之间不共享状态。
 * <p>
 * 任务从不直接写入这里：任务返回结果，由执行器调用 record* 方法写入，这是唯一的修改路径。
 * 已完成 ID 集合只在每轮的汇合屏障之后由 {@link #advanceCompletedIds()} 更新。
 */
@Slf4j
@Getter
public class GraphExecutionContext {

    private final String runId;
    private final String graphName;
    private final Map<String, TaskDefinition> tasks;
    private final int maxConcurrent;
    private final int totalTasks;
    private final Instant startTime;

    @Getter(AccessLevel.NONE)
    private final Map<String, TaskStatus> statuses = new ConcurrentHashMap<>();
    @Getter(AccessLevel.NONE)
    private final Map<String, Object> resultStore = new HashMap<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> completedIds = ConcurrentHashMap.newKeySet();
    @Getter(AccessLevel.NONE)
    private final Map<String, Throwable> failures = new ConcurrentHashMap<>();
    @Getter(AccessLevel.NONE)
    private final AtomicInteger roundCounter = new AtomicInteger(0);
    @Getter(AccessLevel.NONE)
    private final AtomicInteger runningCounter = new AtomicInteger(0);
    @Getter(AccessLevel.NONE)
    private final AtomicInteger peakRunning = new AtomicInteger(0);

    public GraphExecutionContext(TaskGraph graph, int maxConcurrent, String rawRunId) {
        this.tasks = graph.getTasks();
        this.graphName = graph.getName();
        this.maxConcurrent = maxConcurrent;
        this.totalTasks = tasks.size();
        this.startTime = Instant.now();
        this.runId = (rawRunId != null && !rawRunId.trim().isEmpty())
                ? rawRunId
                : "run-" + UUID.randomUUID().toString().substring(0, 8);
        for (String taskId : tasks.keySet()) {
            statuses.put(taskId, TaskStatus.PENDING);
        }
        log.debug("[RunId: {}][Graph: '{}'] 创建 GraphExecutionContext (Tasks: {}, MaxConcurrent: {})",
                runId, graphName, totalTasks, maxConcurrent);
    }

    public TaskDefinition getTask(String taskId) {
        TaskDefinition task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalStateException("Task '" + taskId + "' is not part of run " + runId);
        }
        return task;
    }

    /**
     * 计算就绪集合：未完成且所有依赖都已在已完成集合中的任务，按声明顺序。
     */
    public List<String> computeReadySet() {
        List<String> ready = new ArrayList<>();
        for (TaskDefinition task : tasks.values()) {
            if (statuses.get(task.getId()) != TaskStatus.PENDING) {
                continue;
            }
            if (completedIds.containsAll(task.getDependsOn())) {
                ready.add(task.getId());
            }
        }
        return ready;
    }

    public int nextRound() {
        return roundCounter.incrementAndGet();
    }

    public int getRoundCount() {
        return roundCounter.get();
    }

    public void markRunning(String taskId) {
        transition(taskId, TaskStatus.PENDING, TaskStatus.RUNNING);
        int running = runningCounter.incrementAndGet();
        peakRunning.accumulateAndGet(running, Math::max);
    }

    public void recordCompleted(String taskId, Object result) {
        synchronized (resultStore) {
            resultStore.put(taskId, result);
        }
        transition(taskId, TaskStatus.RUNNING, TaskStatus.COMPLETED);
        runningCounter.decrementAndGet();
    }

    public void recordFailure(String taskId, Throwable error) {
        failures.put(taskId, error);
        transition(taskId, TaskStatus.RUNNING, TaskStatus.FAILED);
        runningCounter.decrementAndGet();
    }

    private void transition(String taskId, TaskStatus expected, TaskStatus target) {
        TaskStatus previous = statuses.put(taskId, target);
        if (previous != expected) {
            log.warn("[RunId: {}][Graph: '{}'] Task '{}' moved to {} from unexpected state {}.",
                    runId, graphName, taskId, target, previous);
        }
    }

    /**
     * 汇合屏障之后调用：把所有已观察到 COMPLETED 的任务加入已完成集合。
     *
     * @return 已完成任务数
     */
    public int advanceCompletedIds() {
        statuses.forEach((taskId, status) -> {
            if (status == TaskStatus.COMPLETED) {
                completedIds.add(taskId);
            }
        });
        return completedIds.size();
    }

    public boolean isFinished() {
        return completedIds.size() >= totalTasks;
    }

    public int getCompletedCount() {
        return completedIds.size();
    }

    public TaskStatus getStatus(String taskId) {
        return statuses.get(taskId);
    }

    /**
     * 获取依赖任务的已存储结果。
     */
    public Object getResult(String taskId) {
        synchronized (resultStore) {
            return resultStore.get(taskId);
        }
    }

    /**
     * 汇总本批次中的失败。只有一个失败时原样返回；多个失败时返回新的 {@link BatchFailureException}，
     * 第一个失败 (按启动顺序) 为 cause，其余作为 suppressed。记录的异常实例本身不被修改。
     *
     * @return 本批次的失败，没有失败时为 null
     */
    public Throwable collectBatchFailure(List<String> batch) {
        List<String> failedIds = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();
        for (String taskId : batch) {
            Throwable error = failures.get(taskId);
            if (error != null) {
                failedIds.add(taskId);
                errors.add(error);
            }
        }
        if (errors.isEmpty()) {
            return null;
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        return new BatchFailureException(failedIds, errors);
    }

    /**
     * 当前处于 RUNNING 状态的操作数。
     */
    public int getRunningCount() {
        return runningCounter.get();
    }

    /**
     * 本次运行中同时处于 RUNNING 状态的操作数峰值。
     */
    public int getPeakRunning() {
        return peakRunning.get();
    }

    public List<String> getUnfinishedTaskIds() {
        List<String> unfinished = new ArrayList<>();
        for (String taskId : tasks.keySet()) {
            if (!completedIds.contains(taskId)) {
                unfinished.add(taskId);
            }
        }
        return unfinished;
    }

    /**
     * 结果存储的不可变快照，按任务声明顺序，只包含已完成的任务。
     */
    public Map<String, Object> snapshotResults() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        synchronized (resultStore) {
            for (String taskId : tasks.keySet()) {
                if (completedIds.contains(taskId) && resultStore.containsKey(taskId)) {
                    snapshot.put(taskId, resultStore.get(taskId));
                }
            }
        }
        return Collections.unmodifiableMap(snapshot);
    }
}
