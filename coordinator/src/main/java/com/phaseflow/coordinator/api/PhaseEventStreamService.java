package com.phaseflow.coordinator.api;

import com.phaseflow.coordinator.events.PhaseEventBroadcaster;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link PhaseEventBroadcaster} subscriptions to {@link SseEmitter}s.
 * <p>
 * Each connected client gets its own subscription. A failed send propagates out
 * of the subscriber, which makes the broadcaster drop it; emitter completion,
 * timeout and error callbacks unsubscribe as well.
 * <p>
 * Heartbeat comments every 30 seconds keep idle connections open through proxies.
 */
@Service
public class PhaseEventStreamService {

    private static final Logger log = LoggerFactory.getLogger(PhaseEventStreamService.class);

    /** Default emitter timeout: 30 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final PhaseEventBroadcaster broadcaster;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public PhaseEventStreamService(PhaseEventBroadcaster broadcaster) {
        this(broadcaster, DEFAULT_TIMEOUT_MS);
    }

    PhaseEventStreamService(PhaseEventBroadcaster broadcaster, long timeoutMs) {
        this.broadcaster = broadcaster;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
        activeRegistrations.forEach(r -> r.emitter().complete());
    }

    /**
     * Creates an emitter streaming phase events.
     *
     * @param parentTaskId only stream this parent's events; null streams everything
     */
    public SseEmitter createEmitter(Long parentTaskId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        PhaseEventBroadcaster.Subscriber subscriber = event ->
                emitter.send(SseEmitter.event().name(event.type()).data(event));
        PhaseEventBroadcaster.Subscription subscription = parentTaskId == null
                ? broadcaster.subscribeAll(subscriber)
                : broadcaster.subscribe(parentTaskId, subscriber);

        var registration = new EmitterRegistration(parentTaskId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> cleanup(registration));

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment to SSE client: {}", e.getMessage());
        }

        log.info("SSE emitter created (parentTaskId={}, timeout={}ms)", parentTaskId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // The emitter's own callbacks clean up closed connections.
                log.debug("Heartbeat failed (parentTaskId={}): {}", registration.parentTaskId(), e.getMessage());
            }
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            Long parentTaskId,
            SseEmitter emitter,
            PhaseEventBroadcaster.Subscription subscription
    ) {}
}
