package xyz.vvrf.reactor.taskgraph.core;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/6
 */

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.reactor.taskgraph.error.ConfigurationException;
import xyz.vvrf.reactor.taskgraph.util.TaskGraphUtils;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 任务图：按插入顺序保存所有声明的任务及其依赖边。
 * 依赖 ID 在声明时不必已存在，但在执行时必须存在；
 * 循环不会在声明时校验，而是在运行时表现为死锁。
 * <p>
 * 声明方法是线程安全的；执行器在运行开始时对任务图做快照，运行期间的修改不影响该次运行。
 */
@Slf4j
public class TaskGraph {

    public static final String DEFAULT_NAME = "task-graph";

    private final String name;
    private final Map<String, TaskDefinition> tasks = new LinkedHashMap<>();

    public TaskGraph() {
        this(DEFAULT_NAME);
    }

    public TaskGraph(String name) {
        this.name = Objects.requireNonNull(name, "任务图名称不能为空");
    }

    public String getName() {
        return name;
    }

    /**
     * 添加一个任务声明。
     *
     * @throws ConfigurationException 如果任务 ID 已存在
     */
    public synchronized TaskGraph addTask(TaskDefinition task) {
        Objects.requireNonNull(task, "任务声明不能为空");
        if (tasks.containsKey(task.getId())) {
            throw new ConfigurationException(String.format("任务 ID '%s' 在任务图 '%s' 中已存在。", task.getId(), name));
        }
        tasks.put(task.getId(), task);
        log.debug("Graph '{}': added task '{}' (dependsOn: {})", name, task.getId(), task.getDependsOn());
        return this;
    }

    public TaskGraph addTask(String id, TaskOperation operation, String... dependsOn) {
        return addTask(TaskDefinition.builder(id, operation).dependsOn(dependsOn).build());
    }

    public synchronized Optional<TaskDefinition> getTask(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    public synchronized boolean containsTask(String id) {
        return tasks.containsKey(id);
    }

    /**
     * @return 所有任务 ID (不可变快照，插入顺序)
     */
    public synchronized List<String> getTaskIds() {
        return Collections.unmodifiableList(new ArrayList<>(tasks.keySet()));
    }

    /**
     * @return 任务 ID -> 任务声明 (不可变快照，插入顺序)
     */
    public synchronized Map<String, TaskDefinition> getTasks() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tasks));
    }

    public synchronized int size() {
        return tasks.size();
    }

    public synchronized boolean isEmpty() {
        return tasks.isEmpty();
    }

    /**
     * 获取直接依赖指定任务的任务（下游/消费者视角），按插入顺序。
     */
    public synchronized List<String> getDependents(String id) {
        return tasks.values().stream()
                .filter(task -> task.getDependsOn().contains(id))
                .map(TaskDefinition::getId)
                .collect(Collectors.toList());
    }

    /**
     * 获取被引用但从未声明的依赖 ID，按首次出现顺序。
     */
    public synchronized Set<String> findUnknownDependencies() {
        return TaskGraphUtils.findUnknownDependencies(tasks);
    }

    @Override
    public synchronized String toString() {
        return "TaskGraph{name='" + name + "', tasks=" + tasks.keySet() + '}';
    }
}
