package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

/**
 * 统一的错误分类（封闭集合）。
 * 分类是扁平的：除 {@link #GENERIC} 外，所有分类的父分类都是 GENERIC，
 * {@link ErrorHandler} 按 "精确分类 -> 父分类 -> 通用处理" 的顺序分派。
 */
public enum ErrorKind {

    /**
     * 操作的资源/配额预算（例如 token 上限）被超出。默认可重试，降级建议缩减输入。
     */
    TOKEN_LIMIT(ErrorSeverity.WARNING, true),

    /**
     * 操作未在规定时间内完成。默认可重试，降级建议退避重试。
     */
    TIMEOUT(ErrorSeverity.WARNING, true),

    /**
     * 操作结果未通过下游校验。默认不重试，降级建议简化请求。
     */
    INVALID_OUTPUT(ErrorSeverity.ERROR, false),

    /**
     * 用户主动中断执行。对整个运行是终止性的，永不重试。
     */
    USER_INTERRUPT(ErrorSeverity.INFO, false),

    /**
     * 配置/前置条件缺陷（缺少凭证、重复的任务 ID 等）。致命，永不重试。
     */
    CONFIGURATION(ErrorSeverity.CRITICAL, false),

    /**
     * 任务图结构约定被破坏（死锁、循环、未声明的依赖 ID）。致命，永不重试。
     */
    DEPENDENCY(ErrorSeverity.CRITICAL, false),

    /**
     * 未分类的错误，仅记录日志。
     */
    GENERIC(ErrorSeverity.ERROR, false);

    private final ErrorSeverity defaultSeverity;
    private final boolean retryableByDefault;

    ErrorKind(ErrorSeverity defaultSeverity, boolean retryableByDefault) {
        this.defaultSeverity = defaultSeverity;
        this.retryableByDefault = retryableByDefault;
    }

    public ErrorSeverity getDefaultSeverity() {
        return defaultSeverity;
    }

    public boolean isRetryableByDefault() {
        return retryableByDefault;
    }

    /**
     * 该分类是否允许被重试策略重试。
     * 用户中断、配置错误和依赖错误即使被显式列入可重试集合也不会重试。
     */
    public boolean isEverRetryable() {
        return this != USER_INTERRUPT && this != CONFIGURATION && this != DEPENDENCY;
    }

    /**
     * @return 父分类；GENERIC 没有父分类，返回 null。
     */
    public ErrorKind getParent() {
        return this == GENERIC ? null : GENERIC;
    }
}
