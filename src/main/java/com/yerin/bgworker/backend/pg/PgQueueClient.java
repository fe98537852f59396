package com.yerin.bgworker.backend.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.yerin.bgworker.domain.Job;
import com.yerin.bgworker.domain.QueueMessage;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.code.EnqueueErrorCode;
import com.yerin.bgworker.global.exception.code.RegistrationErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Message-queue operations over plain Postgres tables. Every queue owns a live table
 * {@code q_<name>} and an archive table {@code a_<name>}; a message is hidden from readers until
 * its visibility timeout ({@code vt}) has passed.
 */
@Slf4j
public class PgQueueClient {

    public static final String PERIODIC_QUEUE = "periodic";

    // 접두사(q_/a_)와 인덱스 접미사를 붙여도 Postgres 식별자 길이(63) 안에 들어가도록 제한
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z0-9_]{1,47}");

    private static final String PERIODIC_HASH = "(message->'metadata'->'periodic'->>'hash')";

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper;
    private final String schema;

    public PgQueueClient(JdbcTemplate jdbc, ObjectMapper mapper, String schema) {
        this.jdbc = jdbc;
        this.mapper = mapper;
        this.schema = validate(schema);
    }

    /**
     * Creates the queue's live and archive tables if they do not exist yet.
     */
    public void create(String queue) {
        String live = table("q_", queue);
        String archive = table("a_", queue);
        try {
            jdbc.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        msg_id      BIGINT GENERATED ALWAYS AS IDENTITY PRIMARY KEY,
                        read_ct     INT NOT NULL DEFAULT 0,
                        enqueued_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                        vt          TIMESTAMPTZ NOT NULL,
                        message     JSONB
                    )""".formatted(live));
            jdbc.execute("CREATE INDEX IF NOT EXISTS q_%s_vt_idx ON %s (vt ASC)".formatted(queue, live));
            jdbc.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        msg_id      BIGINT PRIMARY KEY,
                        read_ct     INT NOT NULL DEFAULT 0,
                        enqueued_at TIMESTAMPTZ NOT NULL,
                        archived_at TIMESTAMPTZ NOT NULL DEFAULT now(),
                        vt          TIMESTAMPTZ NOT NULL,
                        message     JSONB
                    )""".formatted(archive));
        } catch (DuplicateKeyException e) {
            // 다른 인스턴스가 동시에 생성한 경우
            log.debug("[PgQueue] concurrent create ignored queue={}, cause={}", queue, e.getMessage());
        }
    }

    /**
     * Unique index on the periodic content hash, so storage rejects a second copy of the same
     * periodic definition.
     */
    public void createPeriodicHashIndex() {
        try {
            jdbc.execute("CREATE UNIQUE INDEX IF NOT EXISTS q_periodic_hash_idx ON %s ((message->'metadata'->'periodic'->'hash'))"
                    .formatted(table("q_", PERIODIC_QUEUE)));
        } catch (DuplicateKeyException e) {
            log.debug("[PgQueue] concurrent periodic index create ignored, cause={}", e.getMessage());
        }
    }

    /**
     * Inserts the jobs in one statement and returns their msg ids.
     *
     * @throws DuplicateKeyException when a periodic job with the same hash is already stored
     */
    public List<Long> send(String queue, List<Job> jobs, Duration delay) {
        if (jobs.isEmpty()) return List.of();

        StringBuilder sql = new StringBuilder("INSERT INTO ").append(table("q_", queue)).append(" (vt, message) VALUES ");
        List<Object> params = new ArrayList<>(jobs.size() * 2);
        double delaySeconds = seconds(delay);
        for (int i = 0; i < jobs.size(); i++) {
            if (i > 0) sql.append(", ");
            sql.append("(clock_timestamp() + make_interval(secs => ?), ?::jsonb)");
            params.add(delaySeconds);
            params.add(toJson(jobs.get(i)));
        }
        sql.append(" RETURNING msg_id");

        return jdbc.queryForList(sql.toString(), Long.class, params.toArray());
    }

    /**
     * Reads and locks the oldest visible message, hiding it for {@code visibilityTimeout} and
     * incrementing its read count.
     */
    public Optional<QueueMessage> read(String queue, Duration visibilityTimeout) {
        String live = table("q_", queue);
        String sql = """
                WITH cte AS (
                    SELECT msg_id
                      FROM %1$s
                     WHERE vt <= clock_timestamp()
                     ORDER BY msg_id ASC
                     LIMIT 1
                       FOR UPDATE SKIP LOCKED
                )
                UPDATE %1$s m
                   SET vt = clock_timestamp() + make_interval(secs => ?),
                       read_ct = m.read_ct + 1
                  FROM cte
                 WHERE m.msg_id = cte.msg_id
                RETURNING m.msg_id, m.read_ct, m.enqueued_at, m.vt, m.message::text AS message
                """.formatted(live);
        List<QueueMessage> rows = jdbc.query(sql, messageMapper(), seconds(visibilityTimeout));
        return rows.stream().findFirst();
    }

    /**
     * Hides the message until {@code delay} from now.
     */
    public boolean setVisibilityTimeout(String queue, long msgId, Duration delay) {
        int updated = jdbc.update("UPDATE %s SET vt = clock_timestamp() + make_interval(secs => ?) WHERE msg_id = ?"
                .formatted(table("q_", queue)), seconds(delay), msgId);
        return updated > 0;
    }

    public boolean archive(String queue, long msgId) {
        String sql = """
                WITH archived AS (
                    DELETE FROM %s WHERE msg_id = ?
                    RETURNING msg_id, read_ct, enqueued_at, vt, message
                )
                INSERT INTO %s (msg_id, read_ct, enqueued_at, vt, message)
                SELECT msg_id, read_ct, enqueued_at, vt, message FROM archived
                """.formatted(table("q_", queue), table("a_", queue));
        return jdbc.update(sql, msgId) > 0;
    }

    public boolean delete(String queue, long msgId) {
        return jdbc.update("DELETE FROM %s WHERE msg_id = ?".formatted(table("q_", queue)), msgId) > 0;
    }

    /**
     * Deletes every message of the live table.
     *
     * @return number of deleted messages
     */
    public int purge(String queue) {
        return jdbc.update("DELETE FROM " + table("q_", queue));
    }

    /**
     * Deletes periodic messages whose hash is not in {@code hashes}. Messages without a hash are
     * deleted as well.
     *
     * @return number of deleted messages
     */
    public int deletePeriodicNotIn(Collection<Long> hashes) {
        String sql = "DELETE FROM %s WHERE %s IS NULL OR NOT (%s = ANY (?))"
                .formatted(table("q_", PERIODIC_QUEUE), PERIODIC_HASH, PERIODIC_HASH);
        String[] values = hashes.stream().map(String::valueOf).toArray(String[]::new);
        return jdbc.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            Array array = con.createArrayOf("text", values);
            ps.setArray(1, array);
            return ps;
        });
    }

    public long count(String queue) {
        Long count = jdbc.queryForObject("SELECT count(*) FROM " + table("q_", queue), Long.class);
        return count == null ? 0 : count;
    }

    public long countArchived(String queue) {
        Long count = jdbc.queryForObject("SELECT count(*) FROM " + table("a_", queue), Long.class);
        return count == null ? 0 : count;
    }

    String table(String prefix, String queue) {
        return schema + "." + prefix + validate(queue);
    }

    static String validate(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new WorkerException(RegistrationErrorCode.INVALID_QUEUE_NAME
                    .withDetail("Invalid queue or schema name: `" + name + "`"));
        }
        return name;
    }

    private RowMapper<QueueMessage> messageMapper() {
        return (rs, rowNum) -> {
            long msgId = rs.getLong("msg_id");
            String message = rs.getString("message");
            try {
                return new QueueMessage(
                        msgId,
                        rs.getInt("read_ct"),
                        rs.getTimestamp("enqueued_at").toInstant(),
                        rs.getTimestamp("vt").toInstant(),
                        message == null ? NullNode.getInstance() : mapper.readTree(message));
            } catch (JsonProcessingException e) {
                throw new DataRetrievalFailureException("Unreadable message msgId=" + msgId, e);
            }
        };
    }

    private String toJson(Job job) {
        try {
            return mapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new WorkerException(EnqueueErrorCode.SERIALIZATION, e);
        }
    }

    private static double seconds(Duration duration) {
        if (duration == null || duration.isNegative()) return 0;
        return duration.toMillis() / 1000.0;
    }
}
