package xyz.vvrf.reactor.taskgraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.vvrf.reactor.taskgraph.error.ConfigurationException;
import xyz.vvrf.reactor.taskgraph.error.ErrorKind;
import xyz.vvrf.reactor.taskgraph.test.util.TestTaskOperation;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaskGraph")
class TaskGraphTest {

    private final TaskOperation noop = TestTaskOperation.returning("noop", "ok");

    @Test
    @DisplayName("按插入顺序保存任务，依赖 ID 可以先于声明引用")
    void keepsInsertionOrder() {
        TaskGraph graph = new TaskGraph("ordering")
                .addTask("report", noop, "fetch", "analyze")
                .addTask("fetch", noop)
                .addTask("analyze", noop, "fetch");

        assertEquals("ordering", graph.getName());
        assertEquals(Arrays.asList("report", "fetch", "analyze"), graph.getTaskIds());
        assertEquals(3, graph.size());
        assertTrue(graph.containsTask("fetch"));
        assertEquals(Arrays.asList("fetch", "analyze"), graph.getTask("report").get().getDependsOn());
        assertEquals(Arrays.asList("report", "analyze"), graph.getDependents("fetch"));
        assertTrue(graph.findUnknownDependencies().isEmpty());
    }

    @Test
    @DisplayName("默认名称与空图")
    void defaults() {
        TaskGraph graph = new TaskGraph();
        assertEquals(TaskGraph.DEFAULT_NAME, graph.getName());
        assertTrue(graph.isEmpty());
        assertFalse(graph.getTask("missing").isPresent());
    }

    @Test
    @DisplayName("重复的任务 ID 被拒绝")
    void rejectsDuplicateIds() {
        TaskGraph graph = new TaskGraph().addTask("A", noop);
        ConfigurationException error = assertThrows(ConfigurationException.class, () -> graph.addTask("A", noop));
        assertEquals(ErrorKind.CONFIGURATION, error.getKind());
        assertEquals(1, graph.size());
    }

    @Test
    @DisplayName("自依赖与空白 ID 在声明时被拒绝")
    void rejectsSelfDependencyAndBlankId() {
        assertThrows(ConfigurationException.class, () -> TaskDefinition.builder("loop", noop).dependsOn("loop").build());
        assertThrows(ConfigurationException.class, () -> TaskDefinition.builder("  ", noop).build());
        assertThrows(NullPointerException.class, () -> TaskDefinition.builder("A", null));
    }

    @Test
    @DisplayName("重复的依赖 ID 被合并，保持声明顺序")
    void collapsesDuplicateDependencies() {
        TaskDefinition task = TaskDefinition.builder("C", noop)
                .dependsOn("B", "A", "B")
                .dependsOn(Collections.singletonList("A"))
                .build();
        assertEquals(Arrays.asList("B", "A"), task.getDependsOn());
        assertTrue(task.hasDependencies());
    }

    @Test
    @DisplayName("报告未声明的依赖 ID")
    void reportsUnknownDependencies() {
        TaskGraph graph = new TaskGraph()
                .addTask("A", noop, "ghost")
                .addTask("B", noop, "A", "phantom", "ghost");
        assertEquals(new LinkedHashSet<>(Arrays.asList("ghost", "phantom")), graph.findUnknownDependencies());
    }

    @Test
    @DisplayName("声明的参数与命名输入不可修改，命名输入允许 null 值")
    void definitionIsImmutable() {
        TaskDefinition task = TaskDefinition.builder("A", noop)
                .args("prompt", 3)
                .namedInput("temperature", 0.2)
                .namedInput("system", null)
                .build();
        assertEquals(Arrays.asList("prompt", 3), task.getArgs());
        assertTrue(task.getNamedInputs().containsKey("system"));
        assertThrows(UnsupportedOperationException.class, () -> task.getArgs().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> task.getNamedInputs().put("k", "v"));
        assertThrows(UnsupportedOperationException.class, () -> new TaskGraph().addTask(task).getTasks().clear());
    }
}
