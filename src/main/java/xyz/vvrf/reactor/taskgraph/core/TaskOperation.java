package xyz.vvrf.reactor.taskgraph.core;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/6
 */

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * 任务的实际工作（由调用方注入），例如调用一次语言模型服务。
 * 实现应该是线程安全的：同一个操作可能被多个并发运行的任务图同时调用。
 */
@FunctionalInterface
public interface TaskOperation {

    /**
     * 执行操作。
     *
     * @param args        声明任务时绑定的位置参数 (不可变)
     * @param namedInputs 有效命名输入：预声明的命名输入，加上每个依赖结果 {@code "<依赖ID>_result"} (不可变)
     * @return 结果的 Mono。空 Mono 表示结果为 null。
     *         失败应以 Mono.error 表示，异常最好是 {@link xyz.vvrf.reactor.taskgraph.error.TaskGraphException} 的子类。
     */
    Mono<Object> execute(List<Object> args, Map<String, Object> namedInputs);

    /**
     * 将同步实现适配为 TaskOperation，同步代码在订阅时执行，抛出的异常转换为 Mono.error。
     */
    static TaskOperation blocking(BlockingBody body) {
        return (args, namedInputs) -> Mono.fromCallable(() -> body.execute(args, namedInputs));
    }

    /**
     * 同步的操作体，允许抛出受检异常。
     */
    @FunctionalInterface
    interface BlockingBody {
        Object execute(List<Object> args, Map<String, Object> namedInputs) throws Exception;
    }
}
