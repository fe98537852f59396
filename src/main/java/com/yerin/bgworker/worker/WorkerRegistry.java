package com.yerin.bgworker.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.yerin.bgworker.config.ConfigResolver;
import com.yerin.bgworker.config.EnqueueConfig;
import com.yerin.bgworker.global.exception.WorkerException;
import com.yerin.bgworker.global.exception.code.RegistrationErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Worker table, queue set and periodic definitions collected while a processor is being built.
 * Only the builders mutate it; processors read it after {@code build()}.
 */
@Slf4j
public class WorkerRegistry {

    @Getter
    private final AppContext context;

    private final Set<String> queues = new TreeSet<>();
    private final Map<String, WorkerWrapper> workers = new TreeMap<>();
    private final Map<Long, PeriodicDefinition> periodic = new LinkedHashMap<>();

    public WorkerRegistry(AppContext context) {
        this.context = context;
    }

    public <A> void register(Worker<A> worker) {
        log.info("[WorkerRegistry] registering worker name={}", worker.name());
        registerInternal(worker, false);
    }

    public <A> void registerPeriodic(Worker<A> worker, PeriodicArgs<A> periodicArgs) {
        String name = worker.name();
        log.info("[WorkerRegistry] registering periodic worker name={}, schedule={}", name, periodicArgs.getSchedule());

        String schedule;
        try {
            schedule = PeriodicSchedule.normalize(periodicArgs.getSchedule());
        } catch (IllegalArgumentException e) {
            throw new WorkerException(RegistrationErrorCode.INVALID_SCHEDULE
                    .withDetail("Invalid cron schedule `" + periodicArgs.getSchedule() + "` for worker `" + name + "`."), e);
        }

        registerInternal(worker, true);

        JsonNode args = context.getObjectMapper().valueToTree(periodicArgs.getArgs());
        PeriodicDefinition definition = PeriodicDefinition.of(context.getObjectMapper(), name, schedule, args);
        PeriodicDefinition existing = periodic.putIfAbsent(definition.hash(), definition);
        if (existing != null) {
            throw new WorkerException(RegistrationErrorCode.ALREADY_REGISTERED_PERIODIC.withDetail(
                    "The provided periodic worker job was already registered. Worker: `" + existing.workerName()
                            + "`, schedule: `" + existing.schedule() + "`, args: `" + existing.args() + "`"));
        }
    }

    private <A> void registerInternal(Worker<A> worker, boolean skipDuplicate) {
        String name = worker.name();
        WorkerWrapper wrapper = WorkerWrapper.of(context, worker);
        EnqueueConfig global = context.getProperties().getEnqueueConfig();

        String queue = ConfigResolver.queue(global, wrapper.getEnqueueConfig()).orElseThrow(() -> {
            log.error("[WorkerRegistry] unable to register worker, no queue configured name={}", name);
            return new WorkerException(RegistrationErrorCode.NO_QUEUE
                    .withDetail("No queue configured for worker `" + name + "`."));
        });

        WorkerWrapper existing = workers.get(name);
        if (existing != null) {
            if (!existing.getWorkerType().equals(wrapper.getWorkerType())) {
                throw new WorkerException(RegistrationErrorCode.ALREADY_REGISTERED_WITH_DIFFERENT_TYPE
                        .withDetail("The provided worker name was already registered for a different type: `" + name + "`"));
            }
            if (!skipDuplicate) {
                throw new WorkerException(RegistrationErrorCode.ALREADY_REGISTERED
                        .withDetail("The provided worker was already registered: `" + name + "`"));
            }
            return;
        }

        queues.add(queue);
        workers.put(name, wrapper);
    }

    public Optional<WorkerWrapper> worker(String name) {
        return Optional.ofNullable(workers.get(name));
    }

    public Map<String, WorkerWrapper> workers() {
        return Collections.unmodifiableMap(workers);
    }

    public Set<String> queues() {
        return Collections.unmodifiableSet(queues);
    }

    public Collection<PeriodicDefinition> periodicDefinitions() {
        return Collections.unmodifiableCollection(periodic.values());
    }

    public Set<Long> periodicHashes() {
        return Collections.unmodifiableSet(periodic.keySet());
    }

    /**
     * Queue a registered worker's jobs go to.
     */
    public Optional<String> queueOf(WorkerWrapper worker) {
        return ConfigResolver.queue(context.getProperties().getEnqueueConfig(), worker.getEnqueueConfig());
    }
}
