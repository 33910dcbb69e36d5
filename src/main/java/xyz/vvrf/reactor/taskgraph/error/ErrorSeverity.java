package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 错误严重级别，从低到高排列。
 */
public enum ErrorSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(ErrorSeverity other) {
        return this.compareTo(other) >= 0;
    }
}
