package com.devkit.core.persistence;

import com.devkit.core.model.TaskStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC-backed {@link TicketStore}.
 * <p>
 * Child tickets live in {@code devkit_tickets}, ordered by {@code sort_order} within their
 * parent; dependencies are stored as a JSON array. Notes are append-only rows in
 * {@code devkit_ticket_notes}, parent context in {@code devkit_parents}. Tables are
 * created by {@link #createTables()}. The SQL sticks to what PostgreSQL and H2 both accept.
 */
public class JdbcTicketStore implements TicketStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTicketStore.class);

    private static final String TICKETS_TABLE = "devkit_tickets";
    private static final String NOTES_TABLE = "devkit_ticket_notes";
    private static final String PARENTS_TABLE = "devkit_parents";

    private static final String CREATE_PARENTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                parent_id  VARCHAR(255) PRIMARY KEY,
                context    TEXT
            )
            """.formatted(PARENTS_TABLE);

    private static final String CREATE_TICKETS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id           VARCHAR(255) PRIMARY KEY,
                parent_id    VARCHAR(255) NOT NULL,
                sort_order   INT NOT NULL,
                title        VARCHAR(1024),
                description  TEXT,
                label        VARCHAR(64),
                dependencies TEXT NOT NULL,
                status       VARCHAR(32),
                updated_at   TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(TICKETS_TABLE);

    private static final String CREATE_NOTES_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                ticket_id  VARCHAR(255) NOT NULL,
                note       TEXT NOT NULL,
                created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            )
            """.formatted(NOTES_TABLE);

    private static final String SELECT_CHILDREN_SQL = """
            SELECT id, title, description, label, dependencies, status
            FROM %s
            WHERE parent_id = ?
            ORDER BY sort_order ASC
            """.formatted(TICKETS_TABLE);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?
            """.formatted(TICKETS_TABLE);

    private static final String INSERT_NOTE_SQL = """
            INSERT INTO %s (ticket_id, note) VALUES (?, ?)
            """.formatted(NOTES_TABLE);

    private static final String SELECT_NOTES_SQL = """
            SELECT note FROM %s WHERE ticket_id = ? ORDER BY id ASC
            """.formatted(NOTES_TABLE);

    private static final String COUNT_TICKET_SQL = """
            SELECT COUNT(*) FROM %s WHERE id = ?
            """.formatted(TICKETS_TABLE);

    private static final String SELECT_CONTEXT_SQL = """
            SELECT context FROM %s WHERE parent_id = ?
            """.formatted(PARENTS_TABLE);

    private static final String DELETE_CHILDREN_SQL = """
            DELETE FROM %s WHERE parent_id = ?
            """.formatted(TICKETS_TABLE);

    private static final String DELETE_PARENT_SQL = """
            DELETE FROM %s WHERE parent_id = ?
            """.formatted(PARENTS_TABLE);

    private static final String INSERT_PARENT_SQL = """
            INSERT INTO %s (parent_id, context) VALUES (?, ?)
            """.formatted(PARENTS_TABLE);

    private static final String INSERT_TICKET_SQL = """
            INSERT INTO %s (id, parent_id, sort_order, title, description, label, dependencies, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TICKETS_TABLE);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcTicketStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the ticket tables if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_PARENTS_SQL);
            stmt.execute(CREATE_TICKETS_SQL);
            stmt.execute(CREATE_NOTES_SQL);
            log.info("Ticket tables '{}', '{}', '{}' ensured", PARENTS_TABLE, TICKETS_TABLE, NOTES_TABLE);
        }
    }

    @Override
    public List<TaskRecord> getChildTasks(String parentId) {
        var records = new ArrayList<TaskRecord>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CHILDREN_SQL)) {
            stmt.setString(1, parentId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new TicketStoreException("Failed to load child tickets of " + parentId, e);
        }
        return records;
    }

    @Override
    public void updateStatus(String taskId, TaskStatus status) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_STATUS_SQL)) {
            stmt.setString(1, status.name());
            stmt.setString(2, taskId);
            if (stmt.executeUpdate() == 0) {
                throw new TicketStoreException("Unknown ticket: " + taskId);
            }
            log.debug("Ticket {} -> {}", taskId, status);
        } catch (SQLException e) {
            throw new TicketStoreException("Failed to update status of " + taskId, e);
        }
    }

    @Override
    public void appendNote(String taskId, String text) {
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement check = conn.prepareStatement(COUNT_TICKET_SQL)) {
                check.setString(1, taskId);
                try (ResultSet rs = check.executeQuery()) {
                    if (!rs.next() || rs.getInt(1) == 0) {
                        throw new TicketStoreException("Unknown ticket: " + taskId);
                    }
                }
            }
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_NOTE_SQL)) {
                stmt.setString(1, taskId);
                stmt.setString(2, text);
                stmt.executeUpdate();
            }
        } catch (SQLException e) {
            throw new TicketStoreException("Failed to append note to " + taskId, e);
        }
    }

    @Override
    public String getParentContext(String parentId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_CONTEXT_SQL)) {
            stmt.setString(1, parentId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    String context = rs.getString("context");
                    return context == null ? "" : context;
                }
                return "";
            }
        } catch (SQLException e) {
            throw new TicketStoreException("Failed to load context of " + parentId, e);
        }
    }

    public List<String> getNotes(String taskId) {
        var notes = new ArrayList<String>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_NOTES_SQL)) {
            stmt.setString(1, taskId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    notes.add(rs.getString("note"));
                }
            }
        } catch (SQLException e) {
            throw new TicketStoreException("Failed to load notes of " + taskId, e);
        }
        return notes;
    }

    /**
     * Replaces the children of {@code parentId} in one transaction. Used to import a
     * breakdown produced elsewhere.
     */
    public void register(String parentId, String context, List<TaskRecord> children) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                try (PreparedStatement delete = conn.prepareStatement(DELETE_CHILDREN_SQL)) {
                    delete.setString(1, parentId);
                    delete.executeUpdate();
                }
                try (PreparedStatement delete = conn.prepareStatement(DELETE_PARENT_SQL)) {
                    delete.setString(1, parentId);
                    delete.executeUpdate();
                }
                try (PreparedStatement insert = conn.prepareStatement(INSERT_PARENT_SQL)) {
                    insert.setString(1, parentId);
                    insert.setString(2, context);
                    insert.executeUpdate();
                }
                try (PreparedStatement insert = conn.prepareStatement(INSERT_TICKET_SQL)) {
                    int order = 0;
                    for (TaskRecord child : children) {
                        insert.setString(1, child.id());
                        insert.setString(2, parentId);
                        insert.setInt(3, order++);
                        insert.setString(4, child.title());
                        insert.setString(5, child.description());
                        insert.setString(6, child.label());
                        insert.setString(7, objectMapper.writeValueAsString(child.dependencies()));
                        insert.setString(8, child.status() == null ? null : child.status().name());
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                conn.commit();
                log.info("Registered {} child tickets under {}", children.size(), parentId);
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                throw new TicketStoreException("Failed to register tickets under " + parentId, e);
            }
        } catch (SQLException e) {
            throw new TicketStoreException("Failed to register tickets under " + parentId, e);
        }
    }

    private TaskRecord fromResultSet(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        List<String> dependencies;
        try {
            dependencies = objectMapper.readValue(rs.getString("dependencies"), STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new TicketStoreException("Corrupt dependency list on ticket " + id, e);
        }
        String status = rs.getString("status");
        return new TaskRecord(
                id,
                rs.getString("title"),
                rs.getString("description"),
                rs.getString("label"),
                dependencies,
                status == null ? null : TaskStatus.valueOf(status));
    }
}
