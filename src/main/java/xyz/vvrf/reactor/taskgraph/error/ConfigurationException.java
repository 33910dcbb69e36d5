package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 配置或前置条件缺陷，例如缺少凭证、重复的任务 ID、任务依赖自身。
 */
public class ConfigurationException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message, null);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
