package xyz.vvrf.reactor.taskgraph.core;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/6
 */

/**
 * 单次运行中任务的状态：PENDING -> RUNNING -> {COMPLETED, FAILED}。
 * COMPLETED 和 FAILED 是终态，同一次运行内不会再回到 RUNNING。
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
