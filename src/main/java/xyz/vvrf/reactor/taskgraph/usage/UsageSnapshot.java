package xyz.vvrf.reactor.taskgraph.usage;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/15
 */

import lombok.Value;

import java.util.Map;

/**
 * 某一时刻的用量统计快照 (不可变)。
 */
@Value
public class UsageSnapshot {

    long requests;
    long totalTokens;
    /**
     * 来源 (例如模型服务提供方) -> 累计 token 数，按首次记录顺序
     */
    Map<String, Long> tokensBySource;

    public long getTokens(String source) {
        Long tokens = tokensBySource.get(source);
        return tokens != null ? tokens : 0L;
    }
}
