package com.taskpilot.dispatch.api;

import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.events.TaskPilotEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Forwards {@link EventBus} events to SSE clients.
 *
 * <p>A client follows one task or, without a task id, the whole run. Idle connections get a
 * heartbeat comment every 30 seconds so proxies keep them open.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Long enough to watch a full run. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Creates an emitter for one task's events, or for every event when {@code taskId} is null.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        register(taskId, emitter);
        emitter.onCompletion(() -> cleanup(emitter));
        emitter.onTimeout(() -> cleanup(emitter));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", label(taskId), ex.getMessage());
            cleanup(emitter);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to greet SSE client for {}: {}", label(taskId), e.getMessage());
        }
        log.info("SSE emitter created for {} (timeout={}ms)", label(taskId), timeoutMs);
        return emitter;
    }

    void register(String taskId, SseEmitter emitter) {
        EventBus.Subscription subscription = taskId == null
                ? eventBus.subscribeAll(event -> sendEvent(emitter, event))
                : eventBus.subscribe(taskId, event -> sendEvent(emitter, event));
        activeRegistrations.add(new EmitterRegistration(taskId, emitter, subscription));
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat to {} failed: {}", label(registration.taskId()), e.getMessage());
                cleanup(registration.emitter());
            }
        }
    }

    private void sendEvent(SseEmitter emitter, TaskPilotEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session_id", event.sessionId());
        if (event.taskId() != null) {
            data.put("task_id", event.taskId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE client after failed send of {}: {}", event.eventType(), e.getMessage());
            cleanup(emitter);
        }
    }

    private void cleanup(SseEmitter emitter) {
        for (EmitterRegistration registration : activeRegistrations) {
            if (registration.emitter() == emitter && activeRegistrations.remove(registration)) {
                registration.subscription().unsubscribe();
                log.debug("Cleaned up SSE registration for {}", label(registration.taskId()));
            }
        }
    }

    private static String label(String taskId) {
        return taskId == null ? "all tasks" : "task " + taskId;
    }

    private record EmitterRegistration(String taskId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
