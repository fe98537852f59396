package com.yerin.bgworker.infra;

import com.yerin.bgworker.backend.pg.PgProcessor;
import com.yerin.bgworker.backend.redis.RedisProcessor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts the processor beans with the application context and stops them with it. All processors
 * share one token, so one of them stopping stops the others.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "bgworker.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerRunner {

    private final ObjectProvider<PgProcessor> pgProcessor;
    private final ObjectProvider<RedisProcessor> redisProcessor;

    private final CancellationToken token = new CancellationToken();
    private final List<Thread> threads = new ArrayList<>();

    public WorkerRunner(ObjectProvider<PgProcessor> pgProcessor, ObjectProvider<RedisProcessor> redisProcessor) {
        this.pgProcessor = pgProcessor;
        this.redisProcessor = redisProcessor;
    }

    @PostConstruct
    void startProcessors() {
        Map<String, ProcessorTask> processors = new LinkedHashMap<>();
        pgProcessor.ifAvailable(p -> {
            p.beforeRun();
            processors.put("pg", p::run);
        });
        redisProcessor.ifAvailable(p -> {
            p.beforeRun();
            processors.put("redis", p::run);
        });

        if (processors.isEmpty()) {
            log.info("[WorkerRunner] no processor configured");
            return;
        }

        processors.forEach((name, task) -> {
            Thread thread = new Thread(() -> {
                try {
                    task.run(token);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("[WorkerRunner] processor interrupted name={}", name);
                } catch (RuntimeException e) {
                    log.error("[WorkerRunner] processor failed name={}, err={}", name, e.toString(), e);
                } finally {
                    token.cancel();
                }
            }, "bgworker-runner-" + name);
            threads.add(thread);
            thread.start();
        });
        log.info("[WorkerRunner] started processors={}", processors.keySet());
    }

    @PreDestroy
    void stopProcessors() throws InterruptedException {
        token.cancel();
        for (Thread thread : threads) {
            thread.join();
        }
        log.info("[WorkerRunner] stopped");
    }

    public CancellationToken getToken() {
        return token;
    }

    @FunctionalInterface
    private interface ProcessorTask {
        void run(CancellationToken token) throws InterruptedException;
    }
}
