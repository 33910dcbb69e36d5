package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 任务图结构缺陷：死锁、依赖循环或引用了从未声明的任务 ID。
 */
public class DependencyException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    public DependencyException(String message) {
        super(ErrorKind.DEPENDENCY, message, null);
    }
}
