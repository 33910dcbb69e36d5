package xyz.vvrf.reactor.taskgraph.usage;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/15
 */

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 线程安全的请求/token 用量统计。
 * 由调用方持有并决定其生命周期 (每次运行一个，或整个进程一个)，通常在任务操作内部记录。
 */
@Slf4j
public class UsageTracker {

    private long requests;
    private long totalTokens;
    private final Map<String, Long> tokensBySource = new LinkedHashMap<>();

    /**
     * 记录一次请求。
     *
     * @param source 请求来源，不能为空
     * @param tokens 本次消耗的 token 数 (>= 0)，未知时传 0
     */
    public synchronized void recordRequest(String source, long tokens) {
        Objects.requireNonNull(source, "source 不能为空");
        if (tokens < 0) {
            throw new IllegalArgumentException("tokens must not be negative, got " + tokens);
        }
        requests++;
        totalTokens += tokens;
        tokensBySource.merge(source, tokens, Long::sum);
        log.trace("Usage recorded: source={}, tokens={}, totalRequests={}, totalTokens={}",
                source, tokens, requests, totalTokens);
    }

    public synchronized UsageSnapshot snapshot() {
        return new UsageSnapshot(requests, totalTokens,
                Collections.unmodifiableMap(new LinkedHashMap<>(tokensBySource)));
    }

    public synchronized void reset() {
        log.debug("Resetting usage statistics (requests={}, totalTokens={})", requests, totalTokens);
        requests = 0;
        totalTokens = 0;
        tokensBySource.clear();
    }
}
