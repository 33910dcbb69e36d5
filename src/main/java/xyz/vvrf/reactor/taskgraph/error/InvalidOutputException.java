package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 操作的输出未通过下游校验（格式不符等）。
 */
public class InvalidOutputException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    public InvalidOutputException(String message) {
        super(ErrorKind.INVALID_OUTPUT, message, null);
    }

    public InvalidOutputException(String message, Throwable cause) {
        super(ErrorKind.INVALID_OUTPUT, message, cause);
    }
}
