package com.webhookinbox.storage;

import com.webhookinbox.shared.model.Message;
import com.webhookinbox.shared.model.MessageStats;
import com.webhookinbox.shared.model.SenderCount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Message table in a SQLite file. Duplicate detection relies on the primary key of
 * {@code message_id}, so two concurrent inserts of the same id report exactly one
 * {@link InsertResult#CREATED}.
 */
public class SqliteMessageStore implements MessageStore {

    private static final Logger log = LoggerFactory.getLogger(SqliteMessageStore.class);

    private static final String URL_PREFIX = "sqlite:///";
    private static final String JDBC_PREFIX = "jdbc:sqlite:";
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final int TOP_SENDERS = 10;
    private static final DateTimeFormatter CREATED_AT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS messages (
                message_id TEXT PRIMARY KEY,
                from_msisdn TEXT NOT NULL,
                to_msisdn TEXT NOT NULL,
                ts TEXT NOT NULL,
                text TEXT,
                created_at TEXT NOT NULL
            )""";
    private static final String CREATE_TS_INDEX =
            "CREATE INDEX IF NOT EXISTS idx_messages_ts ON messages (ts, message_id)";
    private static final String INSERT = """
            INSERT INTO messages (message_id, from_msisdn, to_msisdn, ts, text, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (message_id) DO NOTHING""";

    private final DataSource dataSource;
    private final Path databaseFile;
    private final Clock clock;

    public SqliteMessageStore(DataSource dataSource, Path databaseFile, Clock clock) {
        this.dataSource = dataSource;
        this.databaseFile = databaseFile;
        this.clock = clock;
    }

    /**
     * Opens the store named by a {@code DATABASE_URL} value, either {@code sqlite:///<path>}
     * or {@code jdbc:sqlite:<path>}.
     */
    public static SqliteMessageStore fromUrl(String databaseUrl, Clock clock) {
        var path = databasePath(databaseUrl);
        var config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        var dataSource = new SQLiteDataSource(config);
        dataSource.setUrl(JDBC_PREFIX + path);
        var file = ":memory:".equals(path) ? null : Path.of(path);
        return new SqliteMessageStore(dataSource, file, clock);
    }

    static String databasePath(String databaseUrl) {
        if (databaseUrl == null || databaseUrl.isBlank()) {
            throw new IllegalArgumentException("DATABASE_URL is empty");
        }
        String path;
        if (databaseUrl.startsWith(URL_PREFIX)) {
            path = databaseUrl.substring(URL_PREFIX.length());
        } else if (databaseUrl.startsWith(JDBC_PREFIX)) {
            path = databaseUrl.substring(JDBC_PREFIX.length());
            var query = path.indexOf('?');
            if (query >= 0) path = path.substring(0, query);
        } else {
            throw new IllegalArgumentException("Unsupported DATABASE_URL: " + databaseUrl);
        }
        if (path.isBlank()) {
            throw new IllegalArgumentException("DATABASE_URL has no path: " + databaseUrl);
        }
        return path;
    }

    @Override
    public void initSchema() {
        if (databaseFile != null) {
            var dir = databaseFile.toAbsolutePath().getParent();
            try {
                if (dir != null) Files.createDirectories(dir);
            } catch (IOException e) {
                throw new StorageUnavailableException("Failed to create database directory: " + dir, e);
            }
        }
        try (var conn = dataSource.getConnection();
             var st = conn.createStatement()) {
            st.executeUpdate(CREATE_TABLE);
            st.executeUpdate(CREATE_TS_INDEX);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to initialize schema", e);
        }
    }

    @Override
    public InsertResult insert(Message message) {
        var createdAt = CREATED_AT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS));
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(INSERT)) {
            ps.setString(1, message.messageId());
            ps.setString(2, message.from());
            ps.setString(3, message.to());
            ps.setString(4, message.ts());
            ps.setString(5, message.text());
            ps.setString(6, createdAt);
            return ps.executeUpdate() == 1 ? InsertResult.CREATED : InsertResult.DUPLICATE;
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to insert message: " + message.messageId(), e);
        }
    }

    @Override
    public MessageSlice query(int limit, int offset, MessageFilter filter) {
        var where = new ArrayList<String>();
        var params = new ArrayList<String>();
        if (filter.from() != null) {
            where.add("from_msisdn = ?");
            params.add(filter.from());
        }
        if (filter.since() != null) {
            where.add("ts >= ?");
            params.add(filter.since());
        }
        if (filter.textContains() != null) {
            // instr is case-sensitive and treats % and _ literally, unlike LIKE
            where.add("instr(text, ?) > 0");
            params.add(filter.textContains());
        }
        var whereSql = where.isEmpty() ? "1=1" : String.join(" AND ", where);

        try (var conn = dataSource.getConnection()) {
            long total;
            try (var ps = conn.prepareStatement("SELECT COUNT(*) FROM messages WHERE " + whereSql)) {
                bind(ps, params);
                try (var rs = ps.executeQuery()) {
                    total = rs.next() ? rs.getLong(1) : 0;
                }
            }

            var sql = "SELECT message_id, from_msisdn, to_msisdn, ts, text FROM messages WHERE " + whereSql
                    + " ORDER BY ts ASC, message_id ASC LIMIT ? OFFSET ?";
            var messages = new ArrayList<Message>();
            try (var ps = conn.prepareStatement(sql)) {
                bind(ps, params);
                ps.setInt(params.size() + 1, limit);
                ps.setInt(params.size() + 2, offset);
                try (var rs = ps.executeQuery()) {
                    while (rs.next()) {
                        messages.add(new Message(
                                rs.getString("message_id"),
                                rs.getString("from_msisdn"),
                                rs.getString("to_msisdn"),
                                rs.getString("ts"),
                                rs.getString("text")));
                    }
                }
            }
            return new MessageSlice(messages, total);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to query messages", e);
        }
    }

    @Override
    public MessageStats stats() {
        try (var conn = dataSource.getConnection()) {
            long totalMessages;
            long sendersCount;
            String firstTs;
            String lastTs;
            try (var ps = conn.prepareStatement(
                    "SELECT COUNT(*), COUNT(DISTINCT from_msisdn), MIN(ts), MAX(ts) FROM messages");
                 var rs = ps.executeQuery()) {
                rs.next();
                totalMessages = rs.getLong(1);
                sendersCount = rs.getLong(2);
                firstTs = rs.getString(3);
                lastTs = rs.getString(4);
            }
            return new MessageStats(totalMessages, sendersCount, topSenders(conn), firstTs, lastTs);
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to compute stats", e);
        }
    }

    @Override
    public boolean isReady() {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(
                     "SELECT name FROM sqlite_master WHERE type = 'table' AND name = 'messages'");
             var rs = ps.executeQuery()) {
            return rs.next();
        } catch (Exception e) {
            log.warn("Database readiness check failed: {}", e.getMessage());
            return false;
        }
    }

    private List<SenderCount> topSenders(Connection conn) throws SQLException {
        var sql = """
                SELECT from_msisdn, COUNT(*) AS cnt FROM messages
                GROUP BY from_msisdn
                ORDER BY cnt DESC, from_msisdn ASC
                LIMIT ?""";
        try (var ps = conn.prepareStatement(sql)) {
            ps.setInt(1, TOP_SENDERS);
            try (var rs = ps.executeQuery()) {
                var senders = new ArrayList<SenderCount>();
                while (rs.next()) {
                    senders.add(new SenderCount(rs.getString(1), rs.getLong(2)));
                }
                return senders;
            }
        }
    }

    private static void bind(PreparedStatement ps, List<String> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            ps.setString(i + 1, params.get(i));
        }
    }
}
