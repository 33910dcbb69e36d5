package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 针对某一错误分类的降级策略：产出一个降级结果而不是重新抛出错误。
 */
@FunctionalInterface
public interface FallbackStrategy {

    FallbackOutcome apply(Throwable error);
}
