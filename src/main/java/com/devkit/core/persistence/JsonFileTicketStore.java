package com.devkit.core.persistence;

import com.devkit.core.model.TaskStatus;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Ticket store backed by one JSON document per parent ticket ({@code <directory>/<parentId>.json}).
 * <p>
 * Document layout:
 * <pre>
 * {
 *   "parentId": "PROJ-12",
 *   "context": "plan text",
 *   "tasks": [
 *     {"id": "PROJ-13", "title": "...", "description": "...", "label": "Feature",
 *      "dependencies": [], "status": "COMPLETED", "notes": ["..."]}
 *   ]
 * }
 * </pre>
 * Writes replace the whole document through a temporary file and an atomic move.
 */
public class JsonFileTicketStore implements TicketStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTicketStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    /** taskId -> parentId, filled as documents are read. */
    private final Map<String, String> parentIndex = new ConcurrentHashMap<>();

    public JsonFileTicketStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public record TicketDocument(String parentId, String context, List<TicketEntry> tasks) {
        public TicketDocument {
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }
    }

    public record TicketEntry(
        String id,
        String title,
        String description,
        String label,
        List<String> dependencies,
        TaskStatus status,
        List<String> notes
    ) {
        public TicketEntry {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
            notes = notes == null ? List.of() : List.copyOf(notes);
        }
    }

    @Override
    public synchronized List<TaskRecord> getChildTasks(String parentId) {
        var document = read(documentPath(parentId))
                .orElseThrow(() -> new TicketStoreException("No ticket document for parent " + parentId
                        + " in " + directory));
        return document.tasks().stream()
                .map(e -> new TaskRecord(e.id(), e.title(), e.description(), e.label(), e.dependencies(), e.status()))
                .toList();
    }

    @Override
    public synchronized void updateStatus(String taskId, TaskStatus status) {
        modifyEntry(taskId, e -> new TicketEntry(e.id(), e.title(), e.description(), e.label(),
                e.dependencies(), status, e.notes()));
    }

    @Override
    public synchronized void appendNote(String taskId, String text) {
        modifyEntry(taskId, e -> {
            var notes = new ArrayList<>(e.notes());
            notes.add(text);
            return new TicketEntry(e.id(), e.title(), e.description(), e.label(), e.dependencies(), e.status(), notes);
        });
    }

    @Override
    public synchronized String getParentContext(String parentId) {
        return read(documentPath(parentId))
                .map(TicketDocument::context)
                .orElse("");
    }

    /** Writes a complete document, replacing any existing one for the same parent. */
    public synchronized void save(TicketDocument document) {
        write(document);
    }

    private void modifyEntry(String taskId, UnaryOperator<TicketEntry> change) {
        String parentId = locateParent(taskId);
        var document = read(documentPath(parentId))
                .orElseThrow(() -> new TicketStoreException("Ticket document vanished for parent " + parentId));
        var entries = new ArrayList<TicketEntry>();
        boolean found = false;
        for (TicketEntry entry : document.tasks()) {
            if (entry.id().equals(taskId)) {
                entries.add(change.apply(entry));
                found = true;
            } else {
                entries.add(entry);
            }
        }
        if (!found) {
            throw new TicketStoreException("Unknown ticket: " + taskId);
        }
        write(new TicketDocument(document.parentId(), document.context(), entries));
    }

    private String locateParent(String taskId) {
        String parentId = parentIndex.get(taskId);
        if (parentId != null) {
            return parentId;
        }
        if (!Files.isDirectory(directory)) {
            throw new TicketStoreException("Ticket directory does not exist: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).toList()) {
                read(file);
            }
        } catch (IOException e) {
            throw new TicketStoreException("Failed to scan ticket directory " + directory, e);
        }
        parentId = parentIndex.get(taskId);
        if (parentId == null) {
            throw new TicketStoreException("Unknown ticket: " + taskId);
        }
        return parentId;
    }

    private Optional<TicketDocument> read(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            var document = objectMapper.readValue(file.toFile(), TicketDocument.class);
            for (TicketEntry entry : document.tasks()) {
                parentIndex.put(entry.id(), document.parentId());
            }
            return Optional.of(document);
        } catch (IOException e) {
            throw new TicketStoreException("Failed to read ticket document " + file, e);
        }
    }

    private void write(TicketDocument document) {
        Path target = documentPath(document.parentId());
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, document.parentId(), ".tmp");
            objectMapper.writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported in {}, falling back to plain replace", directory);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            for (TicketEntry entry : document.tasks()) {
                parentIndex.put(entry.id(), document.parentId());
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TicketStoreException("Failed to write ticket document " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    private Path documentPath(String parentId) {
        return directory.resolve(parentId + ".json");
    }
}
