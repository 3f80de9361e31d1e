package dev.tokenbench.task;

import com.fasterxml.jackson.core.type.TypeReference;
import dev.tokenbench.config.ConfigurationException;
import dev.tokenbench.json.BenchJsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/** An ordered, immutable sequence of tasks. Catalog order is the order of the run record. */
public final class TaskCatalog implements Iterable<TaskDefinition> {
    private final List<TaskDefinition> tasks;

    private TaskCatalog(List<TaskDefinition> tasks) {
        var seen = new HashSet<String>();
        for (var task : tasks) {
            if (!seen.add(task.id())) {
                throw new ConfigurationException("duplicate task id: " + task.id());
            }
        }
        this.tasks = List.copyOf(tasks);
    }

    public static TaskCatalog of(TaskDefinition... tasks) {
        return new TaskCatalog(List.of(tasks));
    }

    public static TaskCatalog of(List<TaskDefinition> tasks) {
        return new TaskCatalog(tasks);
    }

    /** The standard spreadsheet tasks, optionally followed by the large-file tasks. */
    public static TaskCatalog builtin(boolean includeLarge) {
        var all = new ArrayList<>(BuiltinTasks.STANDARD);
        if (includeLarge) {
            all.addAll(BuiltinTasks.LARGE_FILE);
        }
        return new TaskCatalog(all);
    }

    /**
     * Load a catalog from a JSON array of {@code {id, name, description?, xl_prompt, xlsx_prompt,
     * expected_answer?}} objects.
     */
    public static TaskCatalog fromJson(@Nonnull Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Task file not found: " + path);
        }
        try {
            List<TaskDefinition> tasks =
                    BenchJsonMapper.get()
                            .readValue(path.toFile(), new TypeReference<List<TaskDefinition>>() {});
            if (tasks.contains(null)) {
                throw new ConfigurationException("Task file contains a null entry: " + path);
            }
            return new TaskCatalog(tasks);
        } catch (IOException e) {
            throw new ConfigurationException(
                    "Invalid task file %s: %s".formatted(path, e.getMessage()), e);
        }
    }

    /**
     * Restrict the catalog to a single task.
     *
     * @param taskId task to keep, or null to keep everything
     * @throws ConfigurationException if no task has the given id
     */
    public TaskCatalog select(@Nullable String taskId) {
        if (taskId == null) {
            return this;
        }
        return new TaskCatalog(
                List.of(
                        find(taskId)
                                .orElseThrow(
                                        () ->
                                                new ConfigurationException(
                                                        "Task '%s' not found".formatted(taskId)))));
    }

    public Optional<TaskDefinition> find(String taskId) {
        return tasks.stream().filter(t -> t.id().equals(taskId)).findFirst();
    }

    public List<TaskDefinition> tasks() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    @Override
    public Iterator<TaskDefinition> iterator() {
        return tasks.iterator();
    }
}
