package qrelay.core.store;

import qrelay.config.QueueConfig;
import qrelay.core.exceptions.StoreException;
import qrelay.core.model.DeliveryMode;
import qrelay.core.model.Message;
import qrelay.core.model.MessageState;
import qrelay.core.model.Queue;
import qrelay.core.model.QueueDiscipline;

import java.io.File;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Message store backed by a single SQLite connection.
 * <p>
 * Message rows live in {@code messages}; attributes in {@code message_attributes}, one row
 * per attribute. Queue definitions live in {@code queues} so a reopened store can hand them
 * back together with their messages. All access goes through the one connection, so every
 * public method is synchronized.
 */
public class SqliteMessageStore implements MessageStore {
    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(SqliteMessageStore.class);

    private static final String MESSAGE_COLUMNS = "message_id, queue_id, body, priority, state, delivery_count, "
            + "first_delivered_at, last_delivered_at, visible_at, created_at, expires_at, dedup_id, group_id, sequence";

    private static final String QUEUE_COLUMNS = "queue_id, name, discipline, max_size, ttl_seconds, "
            + "visibility_timeout_seconds, max_retries, delivery_mode, delay_seconds, dlq_id, origin_queue_id, created_at";

    private final Connection conn;
    private final String dbPath;

    public SqliteMessageStore(String dbPath, int cacheSize) {
        this.dbPath = dbPath;
        try {
            if (!dbPath.equals(":memory:")) {
                File parent = new File(dbPath).getAbsoluteFile().getParentFile();
                if (parent != null && !parent.exists()) {
                    parent.mkdirs();
                }
            }
            this.conn = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            init(cacheSize);
        } catch (SQLException e) {
            throw new StoreException("Failed to open SQLite message store at " + dbPath, e);
        }
    }

    /***************************************************************
     Read methods
     ****************************************************************/

    @Override
    public synchronized Optional<Message> get(String messageId) {
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE message_id = ?";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, messageId);
            List<Message> found = readMessages(pstmt);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw new StoreException("Error reading message " + messageId, e);
        }
    }

    @Override
    public synchronized List<Message> scanByVisibleAt(String queueId, long visibleAtOrBefore) {
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE queue_id = ? AND visible_at <= ? ORDER BY visible_at, sequence";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, queueId);
            pstmt.setLong(2, visibleAtOrBefore);
            return readMessages(pstmt);
        } catch (SQLException e) {
            throw new StoreException("Error scanning queue " + queueId, e);
        }
    }

    @Override
    public synchronized List<Message> findByQueue(String queueId) {
        String sql = "SELECT " + MESSAGE_COLUMNS + " FROM messages WHERE queue_id = ? ORDER BY sequence";
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setString(1, queueId);
            return readMessages(pstmt);
        } catch (SQLException e) {
            throw new StoreException("Error listing queue " + queueId, e);
        }
    }

    @Override
    public synchronized long maxSequence() {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COALESCE(MAX(sequence), 0) FROM messages")) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            throw new StoreException("Error reading max sequence", e);
        }
    }

    @Override
    public synchronized List<Queue> loadQueues() {
        String sql = "SELECT " + QUEUE_COLUMNS + " FROM queues ORDER BY created_at, name";
        List<Queue> queues = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                QueueConfig config = new QueueConfig.Builder()
                        .MaxSize(rs.getInt("max_size"))
                        .TtlSeconds(rs.getInt("ttl_seconds"))
                        .VisibilityTimeoutSeconds(rs.getInt("visibility_timeout_seconds"))
                        .MaxRetries(rs.getInt("max_retries"))
                        .DeliveryMode(DeliveryMode.fromValue(rs.getString("delivery_mode")))
                        .DelaySeconds(rs.getInt("delay_seconds"))
                        .build();
                queues.add(new Queue(
                        rs.getString("queue_id"),
                        rs.getString("name"),
                        QueueDiscipline.fromValue(rs.getString("discipline")),
                        config,
                        rs.getString("dlq_id"),
                        rs.getString("origin_queue_id"),
                        rs.getLong("created_at")));
            }
        } catch (SQLException e) {
            throw new StoreException("Error loading queue definitions", e);
        }
        return queues;
    }

    private List<Message> readMessages(PreparedStatement ps) throws SQLException {
        List<Message> messages = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String messageId = rs.getString("message_id");
                messages.add(new Message(
                        messageId,
                        rs.getString("queue_id"),
                        rs.getString("body"),
                        readAttributes(messageId),
                        rs.getInt("priority"),
                        MessageState.fromValue(rs.getInt("state")),
                        rs.getInt("delivery_count"),
                        resultSetGetLong(rs, "first_delivered_at"),
                        resultSetGetLong(rs, "last_delivered_at"),
                        rs.getLong("visible_at"),
                        rs.getLong("created_at"),
                        rs.getLong("expires_at"),
                        rs.getString("dedup_id"),
                        rs.getString("group_id"),
                        rs.getLong("sequence")));
            }
        }
        return messages;
    }

    private Map<String, String> readAttributes(String messageId) throws SQLException {
        Map<String, String> attributes = new HashMap<>();
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT name, value FROM message_attributes WHERE message_id = ?")) {
            pstmt.setString(1, messageId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    attributes.put(rs.getString("name"), rs.getString("value"));
                }
            }
        }
        return attributes;
    }

    private static Long resultSetGetLong(ResultSet rs, String fieldName) throws SQLException {
        final long x = rs.getLong(fieldName);
        if (rs.wasNull()) return null;
        return x;
    }

    /***************************************************************
     Write methods
     ****************************************************************/

    @Override
    public synchronized void put(Message message) {
        inTransaction("put " + message.messageId(), () -> {
            String sql = "INSERT OR REPLACE INTO messages (" + MESSAGE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                pstmt.setString(1, message.messageId());
                pstmt.setString(2, message.queueId());
                pstmt.setString(3, message.body());
                pstmt.setInt(4, message.priority());
                pstmt.setInt(5, message.state().getValue());
                pstmt.setInt(6, message.deliveryCount());
                setNullableLong(pstmt, 7, message.firstDeliveredAt());
                setNullableLong(pstmt, 8, message.lastDeliveredAt());
                pstmt.setLong(9, message.visibleAt());
                pstmt.setLong(10, message.createdAt());
                pstmt.setLong(11, message.expiresAt());
                pstmt.setString(12, message.dedupId());
                pstmt.setString(13, message.groupId());
                pstmt.setLong(14, message.sequence());
                pstmt.executeUpdate();
            }

            deleteAttributes(message.messageId());
            // Store one row per attribute
            String attributeSql = "INSERT INTO message_attributes (message_id, name, value) VALUES (?, ?, ?)";
            for (Map.Entry<String, String> attribute : message.attributes().entrySet()) {
                try (PreparedStatement pstmt = conn.prepareStatement(attributeSql)) {
                    pstmt.setString(1, message.messageId());
                    pstmt.setString(2, attribute.getKey());
                    pstmt.setString(3, attribute.getValue());
                    pstmt.executeUpdate();
                }
            }
            return null;
        });
    }

    @Override
    public synchronized boolean delete(String messageId) {
        return inTransaction("delete " + messageId, () -> {
            deleteAttributes(messageId);
            try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM messages WHERE message_id = ?")) {
                pstmt.setString(1, messageId);
                return pstmt.executeUpdate() > 0;
            }
        });
    }

    @Override
    public synchronized int deleteByQueue(String queueId) {
        return inTransaction("delete queue " + queueId, () -> {
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "DELETE FROM message_attributes WHERE message_id IN (SELECT message_id FROM messages WHERE queue_id = ?)")) {
                pstmt.setString(1, queueId);
                pstmt.executeUpdate();
            }
            try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM messages WHERE queue_id = ?")) {
                pstmt.setString(1, queueId);
                return pstmt.executeUpdate();
            }
        });
    }

    @Override
    public synchronized void putQueue(Queue queue) {
        inTransaction("put queue " + queue.queueId(), () -> {
            String sql = "INSERT OR REPLACE INTO queues (" + QUEUE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
            try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
                QueueConfig config = queue.config();
                pstmt.setString(1, queue.queueId());
                pstmt.setString(2, queue.name());
                pstmt.setString(3, queue.discipline().getValue());
                pstmt.setInt(4, config.maxSize());
                pstmt.setInt(5, config.ttlSeconds());
                pstmt.setInt(6, config.visibilityTimeoutSeconds());
                pstmt.setInt(7, config.maxRetries());
                pstmt.setString(8, config.deliveryMode().getValue());
                pstmt.setInt(9, config.delaySeconds());
                pstmt.setString(10, queue.dlqId());
                pstmt.setString(11, queue.originQueueId());
                pstmt.setLong(12, queue.createdAt());
                return pstmt.executeUpdate();
            }
        });
    }

    @Override
    public synchronized boolean deleteQueue(String queueId) {
        return inTransaction("delete queue definition " + queueId, () -> {
            try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM queues WHERE queue_id = ?")) {
                pstmt.setString(1, queueId);
                return pstmt.executeUpdate() > 0;
            }
        });
    }

    private void deleteAttributes(String messageId) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM message_attributes WHERE message_id = ?")) {
            pstmt.setString(1, messageId);
            pstmt.executeUpdate();
        }
    }

    private static void setNullableLong(PreparedStatement pstmt, int index, Long value) throws SQLException {
        if (value == null) {
            pstmt.setNull(index, java.sql.Types.INTEGER);
        } else {
            pstmt.setLong(index, value);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    private <T> T inTransaction(String operation, SqlWork<T> work) {
        try {
            // Check if we need to manage the transaction
            boolean wasAutoCommit = conn.getAutoCommit();

            if (wasAutoCommit) {
                conn.setAutoCommit(false);
            }

            try {
                T result = work.run();
                if (wasAutoCommit) {
                    // Only commit if we started the transaction
                    conn.commit();
                }
                return result;
            } catch (SQLException e) {
                if (wasAutoCommit) {
                    conn.rollback();
                }
                throw e;
            } finally {
                if (wasAutoCommit) {
                    conn.setAutoCommit(true);
                }
            }
        } catch (SQLException e) {
            logger.error("Error in {}: {}", operation, e.getMessage(), e);
            throw new StoreException("SQLite store failed to " + operation, e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (!conn.isClosed()) {
                conn.close();
            }
        } catch (SQLException e) {
            logger.error("Error closing connection: {}", e.getMessage(), e);
        }
    }

    public String getSQLiteVersion() throws SQLException {
        return conn.getMetaData().getDatabaseProductVersion();
    }

    @Override
    public String toString() {
        return "SqliteMessageStore{dbPath='" + dbPath + "'}";
    }

    private void init(int cacheSize) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(String.format("PRAGMA cache_size = %d;", cacheSize));
            stmt.execute("PRAGMA journal_mode = WAL;");
            stmt.execute("PRAGMA temp_store = MEMORY;");
            stmt.execute("PRAGMA synchronous = NORMAL;");

            stmt.executeUpdate("CREATE TABLE IF NOT EXISTS messages " +
                    "(message_id TEXT NOT NULL PRIMARY KEY, " +
                    " queue_id TEXT NOT NULL, " +
                    " body TEXT NOT NULL, " +
                    " priority INTEGER NOT NULL, " +
                    " state INTEGER NOT NULL, " +
                    " delivery_count INTEGER NOT NULL, " +
                    " first_delivered_at INTEGER, " +
                    " last_delivered_at INTEGER, " +
                    " visible_at INTEGER NOT NULL, " +
                    " created_at INTEGER NOT NULL, " +
                    " expires_at INTEGER NOT NULL, " +
                    " dedup_id TEXT, " +
                    " group_id TEXT, " +
                    " sequence INTEGER NOT NULL)");
            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_messages_queue_visible ON messages(queue_id, visible_at)");
            stmt.executeUpdate("CREATE INDEX IF NOT EXISTS idx_messages_queue_sequence ON messages(queue_id, sequence)");

            stmt.executeUpdate("CREATE TABLE IF NOT EXISTS message_attributes " +
                    "(message_id TEXT NOT NULL, " +
                    " name TEXT NOT NULL, " +
                    " value TEXT NOT NULL, " +
                    " PRIMARY KEY (message_id, name))");

            stmt.executeUpdate("CREATE TABLE IF NOT EXISTS queues " +
                    "(queue_id TEXT NOT NULL PRIMARY KEY, " +
                    " name TEXT NOT NULL UNIQUE, " +
                    " discipline TEXT NOT NULL, " +
                    " max_size INTEGER NOT NULL, " +
                    " ttl_seconds INTEGER NOT NULL, " +
                    " visibility_timeout_seconds INTEGER NOT NULL, " +
                    " max_retries INTEGER NOT NULL, " +
                    " delivery_mode TEXT NOT NULL, " +
                    " delay_seconds INTEGER NOT NULL, " +
                    " dlq_id TEXT, " +
                    " origin_queue_id TEXT, " +
                    " created_at INTEGER NOT NULL)");
        }
        logger.debug("SQLite message store ready at {}", dbPath);
    }
}
