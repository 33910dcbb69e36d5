package xyz.vvrf.reactor.taskgraph.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.taskgraph.core.TaskGraph;
import xyz.vvrf.reactor.taskgraph.core.TaskOperation;
import xyz.vvrf.reactor.taskgraph.test.util.TestTaskOperation;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaskGraphUtils")
class TaskGraphUtilsTest {

    private final TaskOperation noop = TestTaskOperation.returning("noop", "ok");

    @Test
    @DisplayName("菱形依赖中共享的下游只渲染一次")
    void rendersSharedDependentOnce() {
        TaskGraph graph = new TaskGraph()
                .addTask("root", noop)
                .addTask("left", noop, "root")
                .addTask("right", noop, "root")
                .addTask("join", noop, "left", "right");

        String expected = "Dependency Graph:\n"
                + "└─ root\n"
                + "  └─ left\n"
                + "    └─ join\n"
                + "  └─ right";
        assertEquals(expected, TaskGraphUtils.renderDependencyTree(graph.getTasks()));
    }

    @Test
    @DisplayName("循环成员列在 Unreachable 行")
    void listsUnreachableTasks() {
        TaskGraph graph = new TaskGraph()
                .addTask("solo", noop)
                .addTask("X", noop, "Y")
                .addTask("Y", noop, "X");

        String expected = "Dependency Graph:\n"
                + "└─ solo\n"
                + "Unreachable: [X, Y]";
        assertEquals(expected, TaskGraphUtils.renderDependencyTree(graph.getTasks()));
    }

    @Test
    @DisplayName("空图只输出标题")
    void emptyGraphRendersHeaderOnly() {
        assertEquals(TaskGraphUtils.TREE_HEADER, TaskGraphUtils.renderDependencyTree(Collections.emptyMap()));
    }

    @Test
    @DisplayName("深链不依赖递归深度")
    void rendersDeepChainIteratively() {
        TaskGraph graph = new TaskGraph().addTask("t0", noop);
        int depth = 5000;
        for (int i = 1; i < depth; i++) {
            graph.addTask("t" + i, noop, "t" + (i - 1));
        }

        String rendered = TaskGraphUtils.renderDependencyTree(graph.getTasks());
        String[] lines = rendered.split("\n");
        assertEquals(depth + 1, lines.length);
        assertTrue(lines[depth].endsWith("└─ t" + (depth - 1)));
        assertTrue(TaskGraphUtils.findCycle(graph.getTasks()).isEmpty());
    }

    @Test
    @DisplayName("沿依赖方向找到循环路径")
    void findsCyclePath() {
        TaskGraph graph = new TaskGraph()
                .addTask("A", noop)
                .addTask("B", noop, "A", "D")
                .addTask("C", noop, "B")
                .addTask("D", noop, "C");

        List<String> cycle = TaskGraphUtils.findCycle(graph.getTasks());
        assertEquals(Arrays.asList("B", "D", "C", "B"), cycle);
    }

    @Test
    @DisplayName("未知依赖不被视为循环")
    void ignoresUnknownDependenciesWhenSearchingCycles() {
        TaskGraph graph = new TaskGraph().addTask("A", noop, "missing");
        assertTrue(TaskGraphUtils.findCycle(graph.getTasks()).isEmpty());
        assertEquals(Collections.singleton("missing"), TaskGraphUtils.findUnknownDependencies(graph.getTasks()));
    }
}
