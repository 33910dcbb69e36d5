package xyz.vvrf.reactor.taskgraph.execution;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/8
 */

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import xyz.vvrf.reactor.taskgraph.core.TaskDefinition;
import xyz.vvrf.reactor.taskgraph.core.TaskGraph;
import xyz.vvrf.reactor.taskgraph.error.DependencyException;
import xyz.vvrf.reactor.taskgraph.monitor.TaskGraphMonitorListener;
import xyz.vvrf.reactor.taskgraph.util.TaskGraphUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * GraphExecutor 的标准实现。
 * 以轮次驱动任务图：每轮计算就绪集合，取前 maxConcurrent 个任务并发执行，
 * 等待本轮全部任务到达终态（汇合屏障）后再推进已完成集合并进入下一轮。
 * 每个 run 调用创建一个 GraphExecutionContext 来管理其状态。
 */
@Slf4j
public class StandardGraphExecutor implements GraphExecutor {

    /**
     * 依赖结果注入命名输入时使用的键后缀："&lt;依赖ID&gt;_result"。
     */
    public static final String RESULT_KEY_SUFFIX = "_result";

    private final int defaultMaxConcurrent;
    private final Scheduler taskExecutionScheduler;
    private final List<TaskGraphMonitorListener> monitorListeners;

    /**
     * 创建 StandardGraphExecutor 实例。
     *
     * @param defaultMaxConcurrent   {@link #run(TaskGraph)} 使用的默认并发上限 (>= 1)
     * @param taskExecutionScheduler 任务操作执行的 Reactor Scheduler
     * @param monitorListeners       监控监听器列表 (可为 null)
     */
    public StandardGraphExecutor(int defaultMaxConcurrent,
                                 Scheduler taskExecutionScheduler,
                                 List<TaskGraphMonitorListener> monitorListeners) {
        if (defaultMaxConcurrent < 1) {
            throw new IllegalArgumentException("Default max concurrent must be at least 1, got " + defaultMaxConcurrent);
        }
        this.defaultMaxConcurrent = defaultMaxConcurrent;
        this.taskExecutionScheduler = Objects.requireNonNull(taskExecutionScheduler, "任务执行调度器不能为空");
        this.monitorListeners = (monitorListeners != null)
                ? Collections.unmodifiableList(new ArrayList<>(monitorListeners))
                : Collections.emptyList();
        log.info("StandardGraphExecutor initialized. Default MaxConcurrent: {}, Scheduler: {}, Listeners: {}",
                defaultMaxConcurrent, taskExecutionScheduler, this.monitorListeners.size());
    }

    public int getDefaultMaxConcurrent() {
        return defaultMaxConcurrent;
    }

    @Override
    public Mono<Map<String, Object>> run(TaskGraph graph) {
        return run(graph, defaultMaxConcurrent);
    }

    @Override
    public Mono<Map<String, Object>> run(TaskGraph graph, int maxConcurrent, String runId) {
        Objects.requireNonNull(graph, "任务图不能为空");
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }

        return Mono.defer(() -> {
            // 1. 运行开始时对任务图做快照，创建本次运行的上下文
            final GraphExecutionContext context = new GraphExecutionContext(graph, maxConcurrent, runId);
            final String actualRunId = context.getRunId();
            final String graphName = context.getGraphName();

            if (context.getTotalTasks() == 0) {
                log.info("[RunId: {}][Graph: '{}'] Graph is empty, returning empty result.", actualRunId, graphName);
                return Mono.just(Collections.<String, Object>emptyMap());
            }

            log.info("[RunId: {}][Graph: '{}'] Starting execution of {} tasks with maxConcurrent {}.",
                    actualRunId, graphName, context.getTotalTasks(), maxConcurrent);
            safeNotifyListeners(l -> l.onRunStart(actualRunId, graphName, context.getTotalTasks(), maxConcurrent));

            return executeRounds(context)
                    .then(Mono.fromCallable(context::snapshotResults))
                    .doOnSuccess(results -> {
                        logCompletion(context, null);
                        Duration total = Duration.between(context.getStartTime(), Instant.now());
                        safeNotifyListeners(l -> l.onRunComplete(actualRunId, graphName, total, true,
                                context.getCompletedCount(), null));
                    })
                    .doOnError(error -> {
                        logCompletion(context, error);
                        Duration total = Duration.between(context.getStartTime(), Instant.now());
                        safeNotifyListeners(l -> l.onRunComplete(actualRunId, graphName, total, false,
                                context.getCompletedCount(), error));
                    });
        });
    }

    /**
     * 执行一个调度轮次，并在汇合屏障之后递归进入下一轮，直到所有任务完成。
     */
    private Mono<Void> executeRounds(GraphExecutionContext context) {
        return Mono.defer(() -> {
            if (context.isFinished()) {
                return Mono.empty();
            }

            // --- 1. 计算就绪集合 ---
            List<String> ready = context.computeReadySet();
            if (ready.isEmpty()) {
                return Mono.error(createDeadlockException(context));
            }

            // --- 2. 选取前 maxConcurrent 个就绪任务 ---
            List<String> batch = ready.size() > context.getMaxConcurrent()
                    ? new ArrayList<>(ready.subList(0, context.getMaxConcurrent()))
                    : ready;
            int round = context.nextRound();
            log.debug("[RunId: {}][Graph: '{}'] Round {}: launching {} of {} ready tasks: {}",
                    context.getRunId(), context.getGraphName(), round, batch.size(), ready.size(), batch);
            safeNotifyListeners(l -> l.onRoundStart(context.getRunId(), context.getGraphName(), round, batch));

            // --- 3. 并发执行本批次，等待全部到达终态 ---
            List<Mono<Void>> launches = batch.stream()
                    .map(taskId -> executeTask(taskId, context))
                    .collect(Collectors.toList());

            return Mono.when(launches)
                    .then(Mono.defer(() -> {
                        // --- 4. 汇合屏障之后：推进已完成集合，检查失败 ---
                        int completed = context.advanceCompletedIds();
                        Throwable failure = context.collectBatchFailure(batch);
                        if (failure != null) {
                            log.error("[RunId: {}][Graph: '{}'] Round {} finished with failures. Aborting run ({}/{} tasks completed).",
                                    context.getRunId(), context.getGraphName(), round, completed, context.getTotalTasks());
                            return Mono.error(failure);
                        }
                        log.debug("[RunId: {}][Graph: '{}'] Round {} finished. Completed: {}/{}",
                                context.getRunId(), context.getGraphName(), round, completed, context.getTotalTasks());
                        return executeRounds(context);
                    }));
        });
    }

    /**
     * 执行单个任务。失败不会向上传播，而是记录为 FAILED 状态，由汇合屏障统一处理。
     */
    private Mono<Void> executeTask(String taskId, GraphExecutionContext context) {
        final String runId = context.getRunId();
        final String graphName = context.getGraphName();

        return Mono.defer(() -> {
                    TaskDefinition task = context.getTask(taskId);
                    Map<String, Object> effectiveInputs = buildEffectiveInputs(task, context);

                    context.markRunning(taskId);
                    Instant startTime = Instant.now();
                    log.debug("[RunId: {}][Graph: '{}'] Task '{}' RUNNING (inputs: {})",
                            runId, graphName, taskId, effectiveInputs.keySet());
                    safeNotifyListeners(l -> l.onTaskStart(runId, graphName, taskId));

                    return Mono.defer(() -> task.getOperation().execute(task.getArgs(), effectiveInputs))
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .doOnNext(result -> {
                                Duration duration = Duration.between(startTime, Instant.now());
                                context.recordCompleted(taskId, result.orElse(null));
                                log.debug("[RunId: {}][Graph: '{}'] Task '{}' COMPLETED in {}ms.",
                                        runId, graphName, taskId, duration.toMillis());
                                safeNotifyListeners(l -> l.onTaskSuccess(runId, graphName, taskId, duration));
                            })
                            .then()
                            .onErrorResume(error -> {
                                Duration duration = Duration.between(startTime, Instant.now());
                                context.recordFailure(taskId, error);
                                log.error("[RunId: {}][Graph: '{}'] Task '{}' FAILED after {}ms: {}",
                                        runId, graphName, taskId, duration.toMillis(), error.getMessage(), error);
                                safeNotifyListeners(l -> l.onTaskFailure(runId, graphName, taskId, duration, error));
                                return Mono.empty();
                            });
                })
                .subscribeOn(taskExecutionScheduler);
    }

    /**
     * 有效命名输入：预先声明的命名输入，加上每个依赖的 "&lt;依赖ID&gt;_result" 结果 (仅当该键未被声明时)。
     */
    private Map<String, Object> buildEffectiveInputs(TaskDefinition task, GraphExecutionContext context) {
        Map<String, Object> inputs = new LinkedHashMap<>(task.getNamedInputs());
        for (String dependency : task.getDependsOn()) {
            String key = dependency + RESULT_KEY_SUFFIX;
            if (!inputs.containsKey(key)) {
                inputs.put(key, context.getResult(dependency));
            }
        }
        return Collections.unmodifiableMap(inputs);
    }

    private DependencyException createDeadlockException(GraphExecutionContext context) {
        List<String> stuck = context.getUnfinishedTaskIds();
        Set<String> unknown = TaskGraphUtils.findUnknownDependencies(context.getTasks());
        List<String> cycle = TaskGraphUtils.findCycle(context.getTasks());

        StringBuilder message = new StringBuilder("Deadlock detected: no runnable tasks but ")
                .append(stuck.size()).append(" task(s) remain unfinished: ").append(stuck);
        if (!unknown.isEmpty()) {
            message.append("; unknown dependencies: ").append(unknown);
        }
        if (!cycle.isEmpty()) {
            message.append("; cycle: ").append(String.join(" -> ", cycle));
        }
        log.warn("[RunId: {}][Graph: '{}'] {}", context.getRunId(), context.getGraphName(), message);
        return new DependencyException(message.toString());
    }

    private void logCompletion(GraphExecutionContext context, Throwable error) {
        long totalMillis = Duration.between(context.getStartTime(), Instant.now()).toMillis();
        String finalStatus = error == null ? "SUCCESS" : "FAILED";
        log.info("[RunId: {}][Graph: '{}'] Execution finished. Final Status: {}. Completed tasks: {}/{}. Rounds: {}. Peak running: {}. Duration: {}ms",
                context.getRunId(), context.getGraphName(), finalStatus, context.getCompletedCount(),
                context.getTotalTasks(), context.getRoundCount(), context.getPeakRunning(), totalMillis);
    }

    @Override
    public String describe(TaskGraph graph) {
        Objects.requireNonNull(graph, "任务图不能为空");
        return TaskGraphUtils.renderDependencyTree(graph.getTasks());
    }

    private void safeNotifyListeners(Consumer<TaskGraphMonitorListener> notification) {
        if (monitorListeners.isEmpty()) {
            return;
        }
        for (TaskGraphMonitorListener listener : monitorListeners) {
            try {
                notification.accept(listener);
            } catch (Exception e) {
                log.error("任务图监控监听器 {} 在通知期间抛出异常: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }
}
