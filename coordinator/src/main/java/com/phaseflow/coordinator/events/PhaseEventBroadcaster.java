package com.phaseflow.coordinator.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory pub/sub fan-out of {@link PhaseEvent}s.
 * <p>
 * Delivery is best-effort and synchronous on the publishing thread. A subscriber
 * that throws is removed from the active set; the remaining subscribers still
 * receive the event. There is no retry and no buffering.
 */
@Service
public class PhaseEventBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(PhaseEventBroadcaster.class);

    /** Receives events. Throwing from {@link #push} unsubscribes the receiver. */
    @FunctionalInterface
    public interface Subscriber {
        void push(PhaseEvent event) throws Exception;
    }

    /** Handle for cancelling a subscription. */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Subscribe to events of every parent task.
     */
    public Subscription subscribeAll(Subscriber subscriber) {
        return register(new Registration(null, subscriber));
    }

    /**
     * Subscribe to events of a single parent task.
     */
    public Subscription subscribe(long parentTaskId, Subscriber subscriber) {
        return register(new Registration(parentTaskId, subscriber));
    }

    /**
     * Deliver an event to every matching subscriber now.
     */
    public void publish(PhaseEvent event) {
        log.debug("Publishing {} for phase {} of parent {} ({})",
                event.type(), event.phaseNumber(), event.parentTaskId(), event.status());
        for (Registration registration : registrations) {
            if (registration.accepts(event)) {
                deliver(registration, event);
            }
        }
    }

    /**
     * Deliver an event once the surrounding transaction commits, or immediately
     * when there is none. Observers never see a transition that was rolled back,
     * and no subscriber I/O happens while the transaction holds row locks.
     */
    public void publishAfterCommit(PhaseEvent event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish(event);
            }
        });
    }

    public int subscriberCount() {
        return registrations.size();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        log.debug("Subscriber added (parentTaskId={}, active={})",
                registration.parentTaskId(), registrations.size());
        return () -> registrations.remove(registration);
    }

    private void deliver(Registration registration, PhaseEvent event) {
        try {
            registration.subscriber().push(event);
        } catch (Exception e) {
            registrations.remove(registration);
            log.warn("Dropping subscriber after failed delivery of {} for phase {} of parent {}: {}",
                    event.type(), event.phaseNumber(), event.parentTaskId(), e.getMessage());
        }
    }

    private record Registration(Long parentTaskId, Subscriber subscriber) {
        boolean accepts(PhaseEvent event) {
            return parentTaskId == null || parentTaskId == event.parentTaskId();
        }
    }
}
