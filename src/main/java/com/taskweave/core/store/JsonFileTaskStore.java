package com.taskweave.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskweave.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * {@link TaskStore} that keeps one JSON document per task in a directory.
 * <p>
 * Each task lives in {@code <url-encoded id>.json}. Writes go to a temporary file
 * in the same directory and are then moved over the target, so a crash never
 * leaves a half-written document behind.
 */
public class JsonFileTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskStore.class);

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public JsonFileTaskStore(Path directory) {
        this(directory, TaskJson.newMapper());
    }

    public JsonFileTaskStore(Path directory, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Cannot create task storage directory " + directory, e);
        }
        log.info("Task storage directory: {}", directory.toAbsolutePath());
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void put(Task task) {
        Path target = fileFor(task.id());
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, ".task-", ".tmp");
            objectMapper.writeValue(tmp.toFile(), task);
            moveIntoPlace(tmp, target);
            log.debug("Persisted task {} ({})", task.id(), task.state());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StorageException("Failed to persist task " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> get(String id) {
        Path file = fileFor(id);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(read(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read task " + id, e);
        }
    }

    @Override
    public List<Task> list() {
        List<Task> tasks = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files.filter(JsonFileTaskStore::isTaskDocument)::iterator) {
                try {
                    tasks.add(read(file));
                } catch (NoSuchFileException e) {
                    log.debug("Task document {} vanished while listing", file.getFileName());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list tasks in " + directory, e);
        }
        return tasks;
    }

    @Override
    public void delete(String id) {
        try {
            Files.deleteIfExists(fileFor(id));
        } catch (IOException e) {
            throw new StorageException("Failed to delete task " + id, e);
        }
    }

    private Task read(Path file) throws IOException {
        return objectMapper.readValue(file.toFile(), Task.class);
    }

    private Path fileFor(String id) {
        return directory.resolve(URLEncoder.encode(id, StandardCharsets.UTF_8) + SUFFIX);
    }

    private static boolean isTaskDocument(Path file) {
        return Files.isRegularFile(file) && file.getFileName().toString().endsWith(SUFFIX);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", file, e.getMessage());
        }
    }
}
