package io.cronkeeper.core.job;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cronkeeper.core.model.Page;
import io.cronkeeper.core.schedule.EntryHandle;
import io.cronkeeper.core.store.SqliteDatabase;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public final class SqliteJobStore implements JobStore {
    private static final TypeReference<List<Long>> LONG_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<EntryHandle>> HANDLE_LIST = new TypeReference<>() {
    };
    private static final Map<String, String> ORDER_COLUMNS = Map.of(
        "name", "name",
        "type", "type",
        "status", "status",
        "createdAt", "created_at"
    );
    private static final String COLUMNS = """
        id, name, type, spec, status, payload_json, sources, source_account_ids, download_account_id,
        retain_copies, retry_times, timeout_seconds, ignore_err, secret, snapshot_rule, entry_handles, created_at
        """;

    private final SqliteDatabase database;
    private final ObjectMapper mapper;

    public SqliteJobStore(SqliteDatabase database) throws IOException {
        this.database = database;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        init();
    }

    @Override
    public synchronized Job insert(Job job) throws IOException {
        String sql = """
            INSERT INTO jobs (name, type, spec, status, payload_json, sources, source_account_ids, download_account_id,
                retain_copies, retry_times, timeout_seconds, ignore_err, secret, snapshot_rule, entry_handles, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(statement, job);
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IOException("No id generated for job " + job.name());
                }
                return job.withId(keys.getLong(1));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to insert job " + job.name(), e);
        }
    }

    @Override
    public synchronized void update(Job job) throws IOException {
        String sql = """
            UPDATE jobs SET name = ?, type = ?, spec = ?, status = ?, payload_json = ?, sources = ?,
                source_account_ids = ?, download_account_id = ?, retain_copies = ?, retry_times = ?,
                timeout_seconds = ?, ignore_err = ?, secret = ?, snapshot_rule = ?, entry_handles = ?, created_at = ?
            WHERE id = ?
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, job);
            statement.setLong(17, job.id());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update job " + job.id(), e);
        }
    }

    @Override
    public synchronized Optional<Job> get(long id) throws IOException {
        List<Job> jobs = query("SELECT " + COLUMNS + " FROM jobs WHERE id = ?", List.of(id));
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public synchronized Optional<Job> findByName(String name) throws IOException {
        List<Job> jobs = query("SELECT " + COLUMNS + " FROM jobs WHERE name = ?", List.of(name == null ? "" : name.trim()));
        return jobs.isEmpty() ? Optional.empty() : Optional.of(jobs.get(0));
    }

    @Override
    public synchronized List<Job> list() throws IOException {
        return query("SELECT " + COLUMNS + " FROM jobs ORDER BY id ASC", List.of());
    }

    @Override
    public synchronized List<Job> listByIds(Collection<Long> ids) throws IOException {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        String placeholders = ids.stream().map(id -> "?").collect(Collectors.joining(", "));
        return query(
            "SELECT " + COLUMNS + " FROM jobs WHERE id IN (" + placeholders + ") ORDER BY id ASC",
            new ArrayList<>(ids)
        );
    }

    @Override
    public synchronized Page<Job> page(JobQuery query) throws IOException {
        String column = ORDER_COLUMNS.getOrDefault(query.orderBy(), "created_at");
        String direction = query.ascending() ? "ASC" : "DESC";
        String like = "%" + escapeLike(query.info()) + "%";
        List<Job> items = query(
            "SELECT " + COLUMNS + " FROM jobs WHERE name LIKE ? ESCAPE '\\' ORDER BY " + column + " " + direction
                + ", id " + direction + " LIMIT ? OFFSET ?",
            List.of(like, query.pageSize(), Page.offset(query.page(), query.pageSize()))
        );
        long total;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(
                 "SELECT COUNT(*) FROM jobs WHERE name LIKE ? ESCAPE '\\'")) {
            statement.setString(1, like);
            try (ResultSet resultSet = statement.executeQuery()) {
                total = resultSet.next() ? resultSet.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to count jobs", e);
        }
        return new Page<>(items, total, query.page(), query.pageSize());
    }

    private static String escapeLike(String raw) {
        return raw.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    @Override
    public synchronized boolean delete(long id) throws IOException {
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM jobs WHERE id = ?")) {
            statement.setLong(1, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new IOException("Failed to delete job " + id, e);
        }
    }

    private List<Job> query(String sql, List<Object> params) throws IOException {
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<Job> jobs = new ArrayList<>();
                while (resultSet.next()) {
                    jobs.add(map(resultSet));
                }
                return jobs;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to query jobs", e);
        }
    }

    private void bind(PreparedStatement statement, Job job) throws SQLException, IOException {
        statement.setString(1, job.name());
        statement.setString(2, job.type().wireName());
        statement.setString(3, job.spec());
        statement.setString(4, job.status().wireName());
        statement.setString(5, mapper.writeValueAsString(job.payload()));
        statement.setString(6, job.sources().encode());
        statement.setString(7, mapper.writeValueAsString(job.sourceAccountIds()));
        statement.setLong(8, job.downloadAccountId());
        statement.setInt(9, job.retainCopies());
        statement.setInt(10, job.retryTimes());
        statement.setLong(11, job.timeoutSeconds());
        statement.setInt(12, job.ignoreErr() ? 1 : 0);
        statement.setString(13, job.secret());
        statement.setString(14, job.snapshotRule() == null ? null : mapper.writeValueAsString(job.snapshotRule()));
        statement.setString(15, mapper.writeValueAsString(job.entryHandles()));
        statement.setLong(16, job.createdAt().toEpochMilli());
    }

    private Job map(ResultSet resultSet) throws SQLException, IOException {
        String snapshotRule = resultSet.getString("snapshot_rule");
        JsonNode rule = snapshotRule == null || snapshotRule.isBlank() ? null : mapper.readTree(snapshotRule);
        return new Job(
            resultSet.getLong("id"),
            resultSet.getString("name"),
            JobType.fromWire(resultSet.getString("type")),
            resultSet.getString("spec"),
            JobStatus.fromWire(resultSet.getString("status")),
            mapper.readValue(resultSet.getString("payload_json"), JobPayload.class),
            SourceSelector.decode(resultSet.getString("sources")),
            mapper.readValue(resultSet.getString("source_account_ids"), LONG_LIST),
            resultSet.getLong("download_account_id"),
            resultSet.getInt("retain_copies"),
            resultSet.getInt("retry_times"),
            resultSet.getLong("timeout_seconds"),
            resultSet.getInt("ignore_err") != 0,
            resultSet.getString("secret"),
            rule,
            mapper.readValue(resultSet.getString("entry_handles"), HANDLE_LIST),
            Instant.ofEpochMilli(resultSet.getLong("created_at"))
        );
    }

    private void init() throws IOException {
        database.execute(
            """
            CREATE TABLE IF NOT EXISTS jobs (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                name TEXT NOT NULL UNIQUE,
                type TEXT NOT NULL,
                spec TEXT NOT NULL,
                status TEXT NOT NULL,
                payload_json TEXT NOT NULL,
                sources TEXT NOT NULL,
                source_account_ids TEXT NOT NULL,
                download_account_id INTEGER NOT NULL,
                retain_copies INTEGER NOT NULL,
                retry_times INTEGER NOT NULL,
                timeout_seconds INTEGER NOT NULL,
                ignore_err INTEGER NOT NULL,
                secret TEXT NOT NULL,
                snapshot_rule TEXT,
                entry_handles TEXT NOT NULL,
                created_at INTEGER NOT NULL
            )
            """
        );
    }
}
