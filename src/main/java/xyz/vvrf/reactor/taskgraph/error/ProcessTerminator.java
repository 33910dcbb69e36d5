package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 结束整个进程的动作，由用户中断的默认处理器调用。
 * 单独抽出以便在测试或嵌入式场景中替换为不退出 JVM 的实现。
 */
@FunctionalInterface
public interface ProcessTerminator {

    /**
     * 以退出码 0 结束 JVM。
     */
    ProcessTerminator SYSTEM_EXIT = () -> System.exit(0);

    void terminate();
}
