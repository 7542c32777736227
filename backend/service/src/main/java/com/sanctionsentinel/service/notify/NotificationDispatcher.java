package com.sanctionsentinel.service.notify;

import com.sanctionsentinel.core.bus.EventBus;
import com.sanctionsentinel.core.events.NotificationDelivered;
import com.sanctionsentinel.core.events.NotificationFailed;
import com.sanctionsentinel.core.model.ChangeEvent;
import com.sanctionsentinel.core.model.RiskLevel;
import com.sanctionsentinel.service.download.RetryPolicy;
import com.sanctionsentinel.service.download.Sleeper;
import com.sanctionsentinel.service.store.SanctionsRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Routes classified change events to every configured channel. CRITICAL events go out one by
 * one as soon as they are dispatched; lower tiers are buffered and sent as one digest per tier
 * on each flush. Delivery failures are published and logged, never thrown to the caller.
 */
public class NotificationDispatcher implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(NotificationDispatcher.class.getName());
    private static final List<RiskLevel> DIGEST_TIERS = List.of(RiskLevel.HIGH, RiskLevel.MEDIUM, RiskLevel.LOW);

    private final List<NotificationChannel> channels;
    private final SanctionsRepository repository;
    private final EventBus eventBus;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final Duration batchWindow;
    private final NotificationFormatter formatter;

    private final ReentrantLock bufferLock = new ReentrantLock();
    private final Map<RiskLevel, List<ChangeEvent>> buffers = new EnumMap<>(RiskLevel.class);
    private final ReentrantLock flushLock = new ReentrantLock();
    private ScheduledExecutorService ticker;

    public NotificationDispatcher(
            List<NotificationChannel> channels,
            SanctionsRepository repository,
            EventBus eventBus,
            Clock clock,
            RetryPolicy retryPolicy,
            Duration batchWindow
    ) {
        this(channels, repository, eventBus, clock, retryPolicy, Sleeper.SYSTEM,
                () -> ThreadLocalRandom.current().nextDouble(), batchWindow, new NotificationFormatter());
    }

    public NotificationDispatcher(
            List<NotificationChannel> channels,
            SanctionsRepository repository,
            EventBus eventBus,
            Clock clock,
            RetryPolicy retryPolicy,
            Sleeper sleeper,
            DoubleSupplier random,
            Duration batchWindow,
            NotificationFormatter formatter
    ) {
        this.channels = List.copyOf(channels);
        this.repository = Objects.requireNonNull(repository, "repository is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = clock;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.random = random;
        this.batchWindow = batchWindow;
        this.formatter = formatter;
        for (RiskLevel tier : DIGEST_TIERS) {
            buffers.put(tier, new ArrayList<>());
        }
    }

    public void start() {
        if (ticker != null) {
            return;
        }
        ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "notification-digest");
            thread.setDaemon(true);
            return thread;
        });
        long windowMillis = Math.max(1, batchWindow.toMillis());
        ticker.scheduleAtFixedRate(this::flushFromTicker, windowMillis, windowMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Sends CRITICAL events immediately and buffers the rest. Returns the outcomes of the
     * immediate deliveries.
     */
    public List<DeliveryOutcome> dispatch(List<ChangeEvent> events) {
        List<ChangeEvent> critical = new ArrayList<>();
        for (ChangeEvent event : events) {
            if (event.riskLevel() == null) {
                throw new IllegalArgumentException("Change event " + event.eventId() + " has not been classified");
            }
        }
        bufferLock.lock();
        try {
            for (ChangeEvent event : events) {
                if (event.riskLevel() == RiskLevel.CRITICAL) {
                    critical.add(event);
                } else {
                    buffers.get(event.riskLevel()).add(event);
                }
            }
        } finally {
            bufferLock.unlock();
        }

        List<DeliveryOutcome> outcomes = new ArrayList<>();
        for (ChangeEvent event : critical) {
            outcomes.add(deliver(formatter.criticalAlert(event, clock.instant())));
        }
        return outcomes;
    }

    /**
     * Sends one digest per non-empty tier, HIGH first.
     */
    public List<DeliveryOutcome> flush() {
        flushLock.lock();
        try {
            Map<RiskLevel, List<ChangeEvent>> drained = new LinkedHashMap<>();
            bufferLock.lock();
            try {
                for (RiskLevel tier : DIGEST_TIERS) {
                    List<ChangeEvent> buffered = buffers.get(tier);
                    if (!buffered.isEmpty()) {
                        drained.put(tier, List.copyOf(buffered));
                        buffered.clear();
                    }
                }
            } finally {
                bufferLock.unlock();
            }

            List<DeliveryOutcome> outcomes = new ArrayList<>();
            drained.forEach((tier, events) -> outcomes.add(deliver(formatter.digest(tier, events, clock.instant()))));
            return outcomes;
        } finally {
            flushLock.unlock();
        }
    }

    public int pending(RiskLevel tier) {
        bufferLock.lock();
        try {
            List<ChangeEvent> buffered = buffers.get(tier);
            return buffered == null ? 0 : buffered.size();
        } finally {
            bufferLock.unlock();
        }
    }

    public List<String> channelIds() {
        return channels.stream().map(NotificationChannel::id).toList();
    }

    @Override
    public void close() {
        if (ticker != null) {
            ticker.shutdown();
            try {
                ticker.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ticker = null;
        }
        flush();
    }

    private void flushFromTicker() {
        try {
            flush();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Scheduled digest flush failed", e);
        }
    }

    private DeliveryOutcome deliver(NotificationPayload payload) {
        Set<String> succeeded = new LinkedHashSet<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (NotificationChannel channel : channels) {
            String failure = sendWithRetry(channel, payload);
            if (failure == null) {
                succeeded.add(channel.id());
            } else {
                failures.put(channel.id(), failure);
            }
        }

        boolean stamped = false;
        if (!succeeded.isEmpty()) {
            try {
                repository.markNotified(payload.eventIds(), clock.instant(), succeeded);
                stamped = true;
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Unable to record notification for " + payload.eventIds().size()
                        + " change events", e);
            }
        }
        return new DeliveryOutcome(payload.kind(), payload.riskLevel(), payload.eventIds(), succeeded, failures, stamped);
    }

    private String sendWithRetry(NotificationChannel channel, NotificationPayload payload) {
        int attempt = 0;
        NotificationException last = null;
        while (attempt < retryPolicy.maxAttempts()) {
            attempt++;
            try {
                channel.send(payload);
                eventBus.publish(new NotificationDelivered(clock.instant(), channel.id(), payload.riskLevel(),
                        payload.events().size(), attempt));
                return null;
            } catch (NotificationException e) {
                last = e;
                LOGGER.warning("Channel " + channel.id() + " attempt " + attempt + " failed: " + e.getMessage());
                if (!e.retryable() || attempt >= retryPolicy.maxAttempts()) {
                    break;
                }
            } catch (RuntimeException e) {
                last = new NotificationException(e.getMessage(), false, e);
                LOGGER.log(Level.WARNING, "Channel " + channel.id() + " attempt " + attempt + " failed", e);
                break;
            }
            try {
                sleeper.sleep(retryPolicy.delayBefore(attempt, random));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                last = new NotificationException("delivery interrupted", false, e);
                break;
            }
        }

        String reason = last == null ? "unknown failure" : last.getMessage();
        LOGGER.log(Level.SEVERE, "Notification on channel " + channel.id() + " failed after " + attempt
                + " attempt(s): " + reason, last);
        eventBus.publish(new NotificationFailed(clock.instant(), channel.id(), payload.riskLevel(),
                payload.events().size(), attempt, reason));
        return reason;
    }

    public record DeliveryOutcome(
            NotificationPayload.Kind kind,
            RiskLevel riskLevel,
            List<String> eventIds,
            Set<String> succeededChannels,
            Map<String, String> failedChannels,
            boolean stamped
    ) {
        public DeliveryOutcome {
            eventIds = List.copyOf(eventIds);
            succeededChannels = Set.copyOf(succeededChannels);
            failedChannels = Map.copyOf(failedChannels);
        }

        public boolean delivered() {
            return !succeededChannels.isEmpty();
        }
    }
}
