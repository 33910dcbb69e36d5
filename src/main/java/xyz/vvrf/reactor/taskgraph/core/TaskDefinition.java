package xyz.vvrf.reactor.taskgraph.core;

/**
 * reactor-taskgraph
 *
 * @author ruifeng.wen
 * @date 2025/5/6
 */

import xyz.vvrf.reactor.taskgraph.error.ConfigurationException;

import java.util.*;

/**
 * 任务图中的一个任务声明（不可变数据类）。
 * 包含任务 ID、依赖的任务 ID（保持声明顺序，去重）、注入的操作以及声明时绑定的输入。
 * 运行时状态（状态、结果）不保存在这里，而是由每次运行的执行上下文持有。
 */
public final class TaskDefinition {

    private final String id;
    private final List<String> dependsOn;
    private final TaskOperation operation;
    private final List<Object> args;
    private final Map<String, Object> namedInputs;

    private TaskDefinition(Builder builder) {
        this.id = builder.id;
        this.operation = builder.operation;
        this.dependsOn = Collections.unmodifiableList(new ArrayList<>(builder.dependsOn));
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.namedInputs = Collections.unmodifiableMap(new LinkedHashMap<>(builder.namedInputs));
    }

    public static Builder builder(String id, TaskOperation operation) {
        return new Builder(id, operation);
    }

    public String getId() {
        return id;
    }

    /**
     * @return 依赖的任务 ID 列表 (不可变，按声明顺序，无重复)
     */
    public List<String> getDependsOn() {
        return dependsOn;
    }

    public TaskOperation getOperation() {
        return operation;
    }

    public List<Object> getArgs() {
        return args;
    }

    /**
     * @return 预声明的命名输入 (不可变，值可以为 null)
     */
    public Map<String, Object> getNamedInputs() {
        return namedInputs;
    }

    public boolean hasDependencies() {
        return !dependsOn.isEmpty();
    }

    @Override
    public String toString() {
        return "TaskDefinition{id='" + id + "', dependsOn=" + dependsOn
                + ", args=" + args.size() + ", namedInputs=" + namedInputs.keySet() + '}';
    }

    public static final class Builder {
        private final String id;
        private final TaskOperation operation;
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private final List<Object> args = new ArrayList<>();
        private final Map<String, Object> namedInputs = new LinkedHashMap<>();

        private Builder(String id, TaskOperation operation) {
            this.id = Objects.requireNonNull(id, "任务 ID 不能为空");
            this.operation = Objects.requireNonNull(operation, "任务 '" + id + "' 的操作不能为空");
        }

        public Builder dependsOn(String... taskIds) {
            return dependsOn(Arrays.asList(taskIds));
        }

        public Builder dependsOn(Collection<String> taskIds) {
            for (String taskId : taskIds) {
                dependsOn.add(Objects.requireNonNull(taskId, "任务 '" + id + "' 的依赖 ID 不能为空"));
            }
            return this;
        }

        public Builder args(Object... values) {
            args.addAll(Arrays.asList(values));
            return this;
        }

        public Builder args(List<?> values) {
            args.addAll(values);
            return this;
        }

        public Builder namedInput(String key, Object value) {
            namedInputs.put(Objects.requireNonNull(key, "命名输入的键不能为空"), value);
            return this;
        }

        public Builder namedInputs(Map<String, ?> values) {
            values.forEach(this::namedInput);
            return this;
        }

        /**
         * @throws ConfigurationException 如果 ID 为空白或任务依赖自身
         */
        public TaskDefinition build() {
            if (id.trim().isEmpty()) {
                throw new ConfigurationException("任务 ID 不能为空白字符串");
            }
            if (dependsOn.contains(id)) {
                throw new ConfigurationException(String.format("任务 '%s' 不能依赖自身。", id));
            }
            return new TaskDefinition(this);
        }
    }
}
