package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 针对某一错误分类的处理动作（记录、告警、终止进程等）。
 * 处理动作不应再次抛出异常。
 */
@FunctionalInterface
public interface ErrorHandlingAction {

    void handle(Throwable error);
}
