package com.yerin.bgworker.backend.redis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.code.EnqueueErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.DefaultTypedTuple;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Redis layout of the engine, all keys under one prefix:
 * <ul>
 *     <li>{@code <prefix>:queue:<name>} list of ready jobs, pushed left and popped right</li>
 *     <li>{@code <prefix>:schedule} sorted set of delayed jobs scored by due time</li>
 *     <li>{@code <prefix>:retry} sorted set of failed jobs waiting for their next attempt</li>
 *     <li>{@code <prefix>:dead} sorted set of jobs that ran out of retries</li>
 *     <li>{@code <prefix>:periodic} sorted set of periodic jobs scored by next fire time</li>
 * </ul>
 * Scores are epoch milliseconds.
 */
@Slf4j
public class RedisQueueClient {

    /** Result of a blocking pop: the list key it came from and the raw member. */
    public record Popped(String key, String payload) {}

    private final StringRedisTemplate redis;
    private final ObjectMapper mapper;
    private final String prefix;

    public RedisQueueClient(StringRedisTemplate redis, ObjectMapper mapper, String prefix) {
        this.redis = redis;
        this.mapper = mapper;
        this.prefix = prefix;
    }

    public String queueKey(String queue) {
        return prefix + ":queue:" + queue;
    }

    public String scheduleKey() {
        return prefix + ":schedule";
    }

    public String retryKey() {
        return prefix + ":retry";
    }

    public String deadKey() {
        return prefix + ":dead";
    }

    public String periodicKey() {
        return prefix + ":periodic";
    }

    public void push(String queue, List<RedisJobRecord> records) {
        if (records.isEmpty()) return;
        List<String> values = new ArrayList<>(records.size());
        for (RedisJobRecord record : records) values.add(toJson(record));
        redis.opsForList().leftPushAll(queueKey(queue), values);
    }

    /**
     * Adds the records to the schedule set; the scheduler moves them to their queue once due.
     */
    public void schedule(List<RedisJobRecord> records, Instant at) {
        if (records.isEmpty()) return;
        Set<ZSetOperations.TypedTuple<String>> tuples = new HashSet<>();
        for (RedisJobRecord record : records) {
            tuples.add(new DefaultTypedTuple<>(toJson(record), score(at)));
        }
        redis.opsForZSet().add(scheduleKey(), tuples);
    }

    public void retry(RedisJobRecord record, Instant at) {
        redis.opsForZSet().add(retryKey(), toJson(record), score(at));
    }

    public void dead(String payload) {
        redis.opsForZSet().add(deadKey(), payload, score(Instant.now()));
    }

    /**
     * BRPOP over the queue lists in the given order.
     */
    public Optional<Popped> popAny(List<String> queues, Duration timeout) {
        if (queues.isEmpty()) return Optional.empty();
        byte[][] keys = new byte[queues.size()][];
        for (int i = 0; i < queues.size(); i++) {
            keys[i] = queueKey(queues.get(i)).getBytes(StandardCharsets.UTF_8);
        }
        int seconds = (int) Math.max(1, timeout.toSeconds());
        List<byte[]> result = redis.execute((RedisCallback<List<byte[]>>) (RedisConnection connection) ->
                connection.listCommands().bRPop(seconds, keys));
        if (result == null || result.size() < 2) return Optional.empty();
        return Optional.of(new Popped(
                new String(result.get(0), StandardCharsets.UTF_8),
                new String(result.get(1), StandardCharsets.UTF_8)));
    }

    /**
     * Members of {@code key} whose score is at or before {@code now}, oldest first.
     */
    public Set<String> due(String key, Instant now, int limit) {
        Set<String> members = redis.opsForZSet().rangeByScore(key, Double.NEGATIVE_INFINITY, score(now), 0, limit);
        return members == null ? Set.of() : members;
    }

    /**
     * Removes {@code member}; only the caller that actually removed it owns it afterwards.
     */
    public boolean claim(String key, String member) {
        Long removed = redis.opsForZSet().remove(key, member);
        return removed != null && removed > 0;
    }

    /**
     * ZADD NX on the periodic set.
     *
     * @return true if the member was added
     */
    public boolean addPeriodicIfAbsent(String member, Instant nextRun) {
        return Boolean.TRUE.equals(redis.opsForZSet().addIfAbsent(periodicKey(), member, score(nextRun)));
    }

    public void addPeriodic(String member, Instant nextRun) {
        redis.opsForZSet().add(periodicKey(), member, score(nextRun));
    }

    public Set<String> periodicMembers() {
        Set<String> members = redis.opsForZSet().range(periodicKey(), 0, -1);
        return members == null ? Set.of() : new LinkedHashSet<>(members);
    }

    public long removePeriodic(Collection<String> members) {
        if (members.isEmpty()) return 0;
        Long removed = redis.opsForZSet().remove(periodicKey(), members.toArray());
        return removed == null ? 0 : removed;
    }

    public void deletePeriodicKey() {
        redis.delete(periodicKey());
    }

    public long queueSize(String queue) {
        Long size = redis.opsForList().size(queueKey(queue));
        return size == null ? 0 : size;
    }

    public long setSize(String key) {
        Long size = redis.opsForZSet().zCard(key);
        return size == null ? 0 : size;
    }

    public String toJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new WorkerException(EnqueueErrorCode.SERIALIZATION, e);
        }
    }

    public RedisJobRecord parse(String payload) throws JsonProcessingException {
        return mapper.readValue(payload, RedisJobRecord.class);
    }

    private static double score(Instant at) {
        return at.toEpochMilli();
    }
}
