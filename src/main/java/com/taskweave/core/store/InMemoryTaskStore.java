package com.taskweave.core.store;

import com.taskweave.core.model.Task;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link TaskStore} backed by a {@link ConcurrentHashMap}. Contents are lost when
 * the process exits.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void put(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public Optional<Task> get(String id) {
        return Optional.ofNullable(tasks.get(id));
    }

    @Override
    public List<Task> list() {
        return List.copyOf(tasks.values());
    }

    @Override
    public void delete(String id) {
        tasks.remove(id);
    }
}
