package xyz.vvrf.reactor.taskgraph.execution;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/8
 */

import reactor.core.publisher.Mono;
import xyz.vvrf.reactor.taskgraph.core.TaskGraph;

import java.util.Map;

/**
 * 任务图执行器接口（调度器）。
 * 按依赖顺序、在并发上限内驱动任务图执行到完成。
 */
public interface GraphExecutor {

    /**
     * 执行任务图。
     *
     * @param graph         要执行的任务图 (不能为空)
     * @param maxConcurrent 同一调度轮次内允许同时执行的任务数上限 (>= 1)
     * @param runId         可选的运行 ID，用于日志和监控。如果为 null 或空，将自动生成。
     * @return 任务 ID -> 结果 的不可变 Map，按任务声明顺序。
     *         单个任务失败时以该错误终止，同一轮多个任务失败时以
     *         {@link xyz.vvrf.reactor.taskgraph.error.BatchFailureException} 终止；死锁（循环或未声明的依赖）时以
     *         {@link xyz.vvrf.reactor.taskgraph.error.DependencyException} 终止，不返回部分结果。
     * @throws IllegalArgumentException 如果 maxConcurrent < 1
     */
    Mono<Map<String, Object>> run(TaskGraph graph, int maxConcurrent, String runId);

    /**
     * 使用执行器配置的默认并发上限执行任务图。
     */
    Mono<Map<String, Object>> run(TaskGraph graph);

    /**
     * 执行任务图，运行 ID 由执行上下文生成。
     */
    default Mono<Map<String, Object>> run(TaskGraph graph, int maxConcurrent) {
        return run(graph, maxConcurrent, null);
    }

    /**
     * 生成依赖结构的可读文本（下游视角的树）。只读，无副作用，可随时调用。
     */
    String describe(TaskGraph graph);
}
