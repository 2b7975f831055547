package io.cronkeeper.core.record;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronkeeper.core.model.Page;
import io.cronkeeper.core.store.SqliteDatabase;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class SqliteRecordStore implements RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(SqliteRecordStore.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String COLUMNS =
        "id, job_id, start_time, status, message, artifacts, accounts, log_path, from_local, duration_ms";

    private final SqliteDatabase database;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteRecordStore(SqliteDatabase database) throws IOException {
        this.database = database;
        init();
    }

    @Override
    public synchronized ExecutionRecord append(ExecutionRecord record) throws IOException {
        String sql = """
            INSERT INTO job_records (job_id, start_time, status, message, artifacts, accounts, log_path, from_local, duration_ms)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            bind(statement, record);
            statement.executeUpdate();
            try (ResultSet keys = statement.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IOException("No id generated for record of job " + record.jobId());
                }
                return record.withId(keys.getLong(1));
            }
        } catch (SQLException e) {
            throw new IOException("Failed to append record for job " + record.jobId(), e);
        }
    }

    @Override
    public synchronized void update(ExecutionRecord record) throws IOException {
        String sql = """
            UPDATE job_records SET job_id = ?, start_time = ?, status = ?, message = ?, artifacts = ?, accounts = ?,
                log_path = ?, from_local = ?, duration_ms = ?
            WHERE id = ?
            """;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            bind(statement, record);
            statement.setLong(10, record.id());
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to update record " + record.id(), e);
        }
    }

    @Override
    public synchronized Optional<ExecutionRecord> get(long id) throws IOException {
        List<ExecutionRecord> records = query("SELECT " + COLUMNS + " FROM job_records WHERE id = ?", List.of(id));
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    @Override
    public synchronized List<ExecutionRecord> listByJob(long jobId) throws IOException {
        return query(
            "SELECT " + COLUMNS + " FROM job_records WHERE job_id = ? ORDER BY start_time DESC, id DESC",
            List.of(jobId)
        );
    }

    @Override
    public synchronized Optional<ExecutionRecord> latest(long jobId) throws IOException {
        List<ExecutionRecord> records = query(
            "SELECT " + COLUMNS + " FROM job_records WHERE job_id = ? ORDER BY start_time DESC, id DESC LIMIT 1",
            List.of(jobId)
        );
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    @Override
    public synchronized Page<ExecutionRecord> page(RecordQuery query) throws IOException {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        List<Object> params = new ArrayList<>();
        if (query.jobId() > 0) {
            where.append(" AND job_id = ?");
            params.add(query.jobId());
        }
        if (query.status() != null) {
            where.append(" AND status = ?");
            params.add(query.status().wireName());
        }
        if (query.from() != null) {
            where.append(" AND start_time >= ?");
            params.add(query.from().toEpochMilli());
        }
        if (query.to() != null) {
            where.append(" AND start_time < ?");
            params.add(query.to().toEpochMilli());
        }

        long total;
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM job_records" + where)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                total = resultSet.next() ? resultSet.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to count records", e);
        }

        List<Object> pageParams = new ArrayList<>(params);
        pageParams.add(query.pageSize());
        pageParams.add(Page.offset(query.page(), query.pageSize()));
        List<ExecutionRecord> items = query(
            "SELECT " + COLUMNS + " FROM job_records" + where + " ORDER BY start_time DESC, id DESC LIMIT ? OFFSET ?",
            pageParams
        );
        return new Page<>(items, total, query.page(), query.pageSize());
    }

    @Override
    public synchronized void delete(long id) throws IOException {
        Optional<ExecutionRecord> record = get(id);
        if (record.isEmpty()) {
            return;
        }
        removeLogFile(record.get());
        execute("DELETE FROM job_records WHERE id = ?", id);
    }

    @Override
    public synchronized int deleteByJob(long jobId) throws IOException {
        for (ExecutionRecord record : listByJob(jobId)) {
            removeLogFile(record);
        }
        return execute("DELETE FROM job_records WHERE job_id = ?", jobId);
    }

    @Override
    public synchronized int detach(long jobId) throws IOException {
        return execute("UPDATE job_records SET job_id = " + ExecutionRecord.DETACHED + " WHERE job_id = ?", jobId);
    }

    @Override
    public synchronized String readLog(long recordId) throws IOException {
        Optional<ExecutionRecord> record = get(recordId);
        if (record.isEmpty() || record.get().logPath().isBlank()) {
            return "";
        }
        Path logFile = Path.of(record.get().logPath());
        if (!Files.exists(logFile)) {
            return "";
        }
        try {
            return Files.readString(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.warn("Failed to read log {} of record {}: {}", logFile, recordId, e.getMessage());
            return "";
        }
    }

    private void removeLogFile(ExecutionRecord record) {
        if (record.logPath().isBlank()) {
            return;
        }
        try {
            Files.deleteIfExists(Path.of(record.logPath()));
        } catch (IOException e) {
            LOG.warn("Failed to remove log file {} of record {}: {}", record.logPath(), record.id(), e.getMessage());
        }
    }

    private int execute(String sql, long param) throws IOException {
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, param);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new IOException("Failed to execute record statement", e);
        }
    }

    private List<ExecutionRecord> query(String sql, List<Object> params) throws IOException {
        try (Connection connection = database.open();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ExecutionRecord> records = new ArrayList<>();
                while (resultSet.next()) {
                    records.add(map(resultSet));
                }
                return records;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to query records", e);
        }
    }

    private void bind(PreparedStatement statement, ExecutionRecord record) throws SQLException, IOException {
        statement.setLong(1, record.jobId());
        statement.setLong(2, record.startTime().toEpochMilli());
        statement.setString(3, record.status().wireName());
        statement.setString(4, record.message());
        statement.setString(5, mapper.writeValueAsString(record.artifacts()));
        statement.setString(6, mapper.writeValueAsString(record.accounts()));
        statement.setString(7, record.logPath());
        statement.setInt(8, record.fromLocal() ? 1 : 0);
        statement.setLong(9, record.durationMillis());
    }

    private ExecutionRecord map(ResultSet resultSet) throws SQLException, IOException {
        return new ExecutionRecord(
            resultSet.getLong("id"),
            resultSet.getLong("job_id"),
            Instant.ofEpochMilli(resultSet.getLong("start_time")),
            RecordStatus.fromWire(resultSet.getString("status")),
            resultSet.getString("message"),
            mapper.readValue(resultSet.getString("artifacts"), STRING_LIST),
            mapper.readValue(resultSet.getString("accounts"), STRING_LIST),
            resultSet.getString("log_path"),
            resultSet.getInt("from_local") != 0,
            resultSet.getLong("duration_ms")
        );
    }

    private void init() throws IOException {
        database.execute(
            """
            CREATE TABLE IF NOT EXISTS job_records (
                id INTEGER PRIMARY KEY AUTOINCREMENT,
                job_id INTEGER NOT NULL,
                start_time INTEGER NOT NULL,
                status TEXT NOT NULL,
                message TEXT NOT NULL,
                artifacts TEXT NOT NULL,
                accounts TEXT NOT NULL,
                log_path TEXT NOT NULL,
                from_local INTEGER NOT NULL,
                duration_ms INTEGER NOT NULL
            )
            """,
            """
            CREATE INDEX IF NOT EXISTS idx_job_records_job_start
            ON job_records(job_id, start_time DESC)
            """
        );
    }
}
