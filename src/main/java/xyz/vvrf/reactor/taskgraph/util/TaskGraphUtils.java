package xyz.vvrf.reactor.taskgraph.util;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/7
 */

import xyz.vvrf.reactor.taskgraph.core.TaskDefinition;

import java.util.*;

/**
 * 任务图结构的诊断工具：依赖树渲染、循环查找、下游映射。
 * 所有遍历都使用显式栈，不依赖递归深度。
 */
public final class TaskGraphUtils {

    public static final String TREE_HEADER = "Dependency Graph:";
    private static final String INDENT = "  ";
    private static final String BRANCH = "└─ ";

    private static final int VISITING = 1;
    private static final int DONE = 2;

    private TaskGraphUtils() {}

    /**
     * 渲染下游视角的依赖树：以没有依赖的任务为根，向下展开依赖它的任务。
     * 每个节点只渲染一次；从任何根都无法到达的任务（通常是循环成员）列在最后一行。
     *
     * @param tasks 任务 ID -> 任务声明 (按插入顺序)
     * @return 多行文本
     */
    public static String renderDependencyTree(Map<String, TaskDefinition> tasks) {
        Map<String, List<String>> dependents = buildDependentsMap(tasks);
        StringBuilder sb = new StringBuilder(TREE_HEADER);
        Set<String> visited = new HashSet<>();

        for (TaskDefinition task : tasks.values()) {
            if (task.hasDependencies()) {
                continue;
            }
            Deque<Map.Entry<String, Integer>> stack = new ArrayDeque<>();
            stack.push(new AbstractMap.SimpleImmutableEntry<>(task.getId(), 0));
            while (!stack.isEmpty()) {
                Map.Entry<String, Integer> frame = stack.pop();
                String id = frame.getKey();
                if (!visited.add(id)) {
                    continue;
                }
                int depth = frame.getValue();
                sb.append('\n');
                for (int i = 0; i < depth; i++) {
                    sb.append(INDENT);
                }
                sb.append(BRANCH).append(id);

                // 逆序入栈，使第一个下游最先出栈，保持声明顺序
                List<String> children = dependents.getOrDefault(id, Collections.emptyList());
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new AbstractMap.SimpleImmutableEntry<>(children.get(i), depth + 1));
                }
            }
        }

        List<String> unreachable = new ArrayList<>();
        for (String id : tasks.keySet()) {
            if (!visited.contains(id)) {
                unreachable.add(id);
            }
        }
        if (!unreachable.isEmpty()) {
            sb.append('\n').append("Unreachable: ").append(unreachable);
        }
        return sb.toString();
    }

    /**
     * 沿 "依赖于" 方向查找一个循环，只考虑图中实际存在的任务。
     *
     * @return 循环路径，首尾为同一任务 (例如 [X, Y, X] 表示 X 依赖 Y，Y 依赖 X)；无循环时为空列表
     */
    public static List<String> findCycle(Map<String, TaskDefinition> tasks) {
        Map<String, Integer> state = new HashMap<>();

        for (String start : tasks.keySet()) {
            if (state.containsKey(start)) {
                continue;
            }
            Deque<String> path = new ArrayDeque<>();
            Deque<Iterator<String>> iterators = new ArrayDeque<>();
            state.put(start, VISITING);
            path.addLast(start);
            iterators.push(tasks.get(start).getDependsOn().iterator());

            while (!iterators.isEmpty()) {
                Iterator<String> it = iterators.peek();
                if (!it.hasNext()) {
                    iterators.pop();
                    state.put(path.removeLast(), DONE);
                    continue;
                }
                String next = it.next();
                TaskDefinition nextTask = tasks.get(next);
                if (nextTask == null) {
                    continue;
                }
                Integer nextState = state.get(next);
                if (nextState == null) {
                    state.put(next, VISITING);
                    path.addLast(next);
                    iterators.push(nextTask.getDependsOn().iterator());
                } else if (nextState == VISITING) {
                    List<String> cycle = new ArrayList<>();
                    boolean inCycle = false;
                    for (String id : path) {
                        inCycle = inCycle || id.equals(next);
                        if (inCycle) {
                            cycle.add(id);
                        }
                    }
                    cycle.add(next);
                    return Collections.unmodifiableList(cycle);
                }
            }
        }
        return Collections.emptyList();
    }

    /**
     * 获取被引用但从未声明的依赖 ID，按首次出现顺序。
     */
    public static Set<String> findUnknownDependencies(Map<String, TaskDefinition> tasks) {
        Set<String> unknown = new LinkedHashSet<>();
        for (TaskDefinition task : tasks.values()) {
            for (String dependency : task.getDependsOn()) {
                if (!tasks.containsKey(dependency)) {
                    unknown.add(dependency);
                }
            }
        }
        return unknown;
    }

    /**
     * 构建下游映射 (任务 ID -> 依赖它的任务 ID 列表，按插入顺序)。
     */
    public static Map<String, List<String>> buildDependentsMap(Map<String, TaskDefinition> tasks) {
        Map<String, List<String>> dependents = new HashMap<>();
        for (TaskDefinition task : tasks.values()) {
            for (String dependency : task.getDependsOn()) {
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(task.getId());
            }
        }
        return dependents;
    }
}
