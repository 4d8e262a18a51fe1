package com.docweaver.dispatch.api;

import com.docweaver.core.events.EventBus;
import com.docweaver.core.events.PipelineEvent;
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
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * When a client connects, this service creates an emitter, subscribes to the task's events
 * and forwards them as SSE data frames. The stream is completed after the task's terminal
 * event. Heartbeat comments are sent every 30 seconds to keep idle connections open through
 * proxies.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

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
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
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
        log.info("SSE heartbeat scheduler stopped");
    }

    private void sendHeartbeats() {
        if (activeRegistrations.isEmpty()) {
            return;
        }

        log.debug("Sending heartbeat to {} active SSE emitters", activeRegistrations.size());
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks do the cleanup
                log.debug("Heartbeat failed for task {} (connection likely closed): {}",
                        registration.taskId, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for task {} (emitter not active)", registration.taskId);
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given task.
     */
    public SseEmitter createEmitter(String taskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(taskId, event -> {
            sendEvent(emitter, event);
            if (event.isTerminal()) {
                emitter.complete();
            }
        });

        var registration = new EmitterRegistration(taskId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> {
            log.debug("SSE emitter completed for task {}", taskId);
            cleanup(registration);
        });
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for task {}", taskId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for task {}: {}", taskId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial heartbeat for task {}: {}", taskId, e.getMessage());
        }

        log.info("SSE emitter created for task {} (timeout={}ms)", taskId, timeoutMs);
        return emitter;
    }

    /**
     * Sends a single snapshot event and completes the stream. Used when the task has already
     * finished before the client connected.
     */
    public SseEmitter createCompletedEmitter(PipelineEvent terminalEvent) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        sendEvent(emitter, terminalEvent);
        emitter.complete();
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, PipelineEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("taskId", event.taskId());
            if (event.stageName() != null) {
                data.put("stage", event.stageName());
            }
            data.put("status", event.status());
            data.put("progress", event.progress());
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for task {}: {}",
                    event.eventType(), event.taskId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for task {}", registration.taskId);
    }

    private record EmitterRegistration(
            String taskId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
