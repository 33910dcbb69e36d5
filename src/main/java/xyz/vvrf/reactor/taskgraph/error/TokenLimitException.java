package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 操作的 token/配额预算被超出。
 */
public class TokenLimitException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    public TokenLimitException(String message) {
        super(ErrorKind.TOKEN_LIMIT, message, null);
    }

    public TokenLimitException(String message, Throwable cause) {
        super(ErrorKind.TOKEN_LIMIT, message, cause);
    }
}
