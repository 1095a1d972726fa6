package com.taskweave.core.store;

import com.taskweave.core.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Key-value persistence of {@link Task} records addressed by id.
 * <p>
 * Writes are synchronous: when {@link #put} returns the task is durable, which the
 * task manager relies on to rebuild its queues after a restart.
 * Implementations must be thread-safe.
 */
public interface TaskStore {

    /**
     * Insert or overwrite the task with the same id.
     *
     * @throws StorageException if the backing medium fails
     */
    void put(Task task);

    /**
     * @return the task, or empty when no task has that id
     * @throws StorageException if the backing medium fails
     */
    Optional<Task> get(String id);

    /**
     * Snapshot of every stored task, in no particular order.
     *
     * @throws StorageException if the backing medium fails
     */
    List<Task> list();

    /**
     * Remove a task; unknown ids are ignored.
     *
     * @throws StorageException if the backing medium fails
     */
    void delete(String id);
}
