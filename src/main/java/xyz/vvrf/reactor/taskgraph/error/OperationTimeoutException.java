package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 操作未在其自身的截止时间内完成。
 * 由注入的操作在自行执行超时控制时抛出。
 */
public class OperationTimeoutException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    public OperationTimeoutException(String message) {
        super(ErrorKind.TIMEOUT, message, null);
    }

    public OperationTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TIMEOUT, message, cause);
    }
}
