package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 用户主动中断。严重级别固定为 INFO。
 */
public class UserInterruptException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    public UserInterruptException() {
        this("Operation interrupted by user");
    }

    public UserInterruptException(String message) {
        super(ErrorKind.USER_INTERRUPT, ErrorSeverity.INFO, message, null);
    }
}
