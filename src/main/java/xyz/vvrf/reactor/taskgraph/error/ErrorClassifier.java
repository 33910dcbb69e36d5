package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

import reactor.core.Exceptions;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 将任意 Throwable 归类到 {@link ErrorKind}。
 * 框架自身的 {@link TaskGraphException} 直接使用其携带的分类；
 * 外部异常先剥离包装层（CompletionException、ExecutionException、Reactor 传播的受检异常），再按类型映射。
 * <p>
 * USER_INTERRUPT 只来自显式抛出的 {@link UserInterruptException}；
 * 线程中断 ({@link InterruptedException}) 归为 GENERIC，不会触发进程终止。
 */
public final class ErrorClassifier {

    private ErrorClassifier() {}

    public static ErrorKind classify(Throwable error) {
        Throwable actual = unwrap(error);
        if (actual instanceof TaskGraphException) {
            return ((TaskGraphException) actual).getKind();
        }
        if (actual instanceof TimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.GENERIC;
    }

    public static ErrorSeverity severityOf(Throwable error) {
        Throwable actual = unwrap(error);
        if (actual instanceof TaskGraphException) {
            return ((TaskGraphException) actual).getSeverity();
        }
        return classify(actual).getDefaultSeverity();
    }

    /**
     * 剥离常见的包装异常，返回最内层有意义的异常。
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = Exceptions.unwrap(error);
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null && current.getCause() != current) {
            current = Exceptions.unwrap(current.getCause());
        }
        return current;
    }
}
