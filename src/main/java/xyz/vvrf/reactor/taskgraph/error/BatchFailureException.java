package xyz.vvrf.reactor.taskgraph.error;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/12
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 同一调度轮次内多个任务失败时抛出的汇总错误。
 * 第一个失败 (按启动顺序) 作为 cause，并决定本错误的分类与严重级别；其余失败作为 suppressed 附加。
 * 任务抛出的原始异常实例不会被修改。
 */
public class BatchFailureException extends TaskGraphException {

    private static final long serialVersionUID = 1L;

    private final List<String> failedTaskIds;

    public BatchFailureException(List<String> failedTaskIds, List<Throwable> failures) {
        super(ErrorClassifier.classify(failures.get(0)),
                ErrorClassifier.severityOf(failures.get(0)),
                failures.size() + " tasks failed in the same round: " + failedTaskIds
                        + "; first failure: " + failures.get(0).getMessage(),
                failures.get(0));
        this.failedTaskIds = Collections.unmodifiableList(new ArrayList<>(failedTaskIds));
        for (int i = 1; i < failures.size(); i++) {
            addSuppressed(failures.get(i));
        }
    }

    /**
     * 失败任务的 ID，按启动顺序。
     */
    public List<String> getFailedTaskIds() {
        return failedTaskIds;
    }
}
