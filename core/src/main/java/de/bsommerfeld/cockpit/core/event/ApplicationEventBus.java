package de.bsommerfeld.cockpit.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process pub/sub bus built on Guava's {@link EventBus}. Producers (poller,
 * aggregators) publish {@link CockpitEvent}s; consumers subscribe plain
 * {@link EventHandler} callbacks and get back a {@link SubscriptionId} to
 * unsubscribe with.
 *
 * <h3>Delivery</h3>
 * Handlers run synchronously on the publishing thread, in subscription order.
 * A handler that throws is isolated and delivery continues with the next
 * handler. Guava hands runtime exceptions to {@link #onHandlerFailure};
 * errors it would rethrow are caught by the subscriber adapter itself. Only
 * {@link VirtualMachineError}s reach the publisher. Events published from one thread reach every handler in the
 * order they were published.
 *
 * <h3>History</h3>
 * Every published event is appended to a bounded history (oldest dropped
 * first) for diagnostics. The history is guarded by a read-write lock; the
 * lock is never held while handlers run.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);

    public static final int DEFAULT_HISTORY_SIZE = 100;

    private final EventBus eventBus;
    private final Clock clock;
    private final int maxHistory;

    private final Object registrationLock = new Object();
    private final AtomicLong nextId = new AtomicLong();
    private final Map<SubscriptionId, HandlerSubscriber> subscribers = new ConcurrentHashMap<>();

    private final ReadWriteLock historyLock = new ReentrantReadWriteLock();
    private final Deque<PublishedEvent> history = new ArrayDeque<>();

    private final AtomicLong failedDeliveries = new AtomicLong();

    public ApplicationEventBus() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public ApplicationEventBus(int maxHistory) {
        this(maxHistory, Clock.systemUTC());
    }

    public ApplicationEventBus(int maxHistory, Clock clock) {
        if (maxHistory < 0)
            throw new IllegalArgumentException("maxHistory must not be negative: " + maxHistory);
        this.maxHistory = maxHistory;
        this.clock = clock;
        this.eventBus = new EventBus(this::onHandlerFailure);
    }

    /**
     * Registers a handler for every subsequently published event.
     *
     * @return a unique id, greater than every id handed out before
     */
    public SubscriptionId subscribe(EventHandler handler) {
        if (handler == null)
            throw new IllegalArgumentException("handler must not be null");

        synchronized (registrationLock) {
            SubscriptionId id = new SubscriptionId(nextId.getAndIncrement());
            HandlerSubscriber subscriber = new HandlerSubscriber(id, handler);
            subscribers.put(id, subscriber);
            eventBus.register(subscriber);
            LOG.debug("New subscription {}", id);
            return id;
        }
    }

    /**
     * @return {@code true} if a handler was registered under {@code id}
     */
    public boolean unsubscribe(SubscriptionId id) {
        synchronized (registrationLock) {
            HandlerSubscriber subscriber = subscribers.remove(id);
            if (subscriber == null)
                return false;
            eventBus.unregister(subscriber);
            LOG.debug("Removed subscription {}", id);
            return true;
        }
    }

    public void publish(CockpitEvent event) {
        if (event == null)
            throw new IllegalArgumentException("event must not be null");

        record(event);
        LOG.debug("Publishing {}", event.typeName());
        eventBus.post(event);
    }

    private void record(CockpitEvent event) {
        if (maxHistory == 0)
            return;

        historyLock.writeLock().lock();
        try {
            history.addLast(new PublishedEvent(clock.instant(), event));
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        } finally {
            historyLock.writeLock().unlock();
        }
    }

    /**
     * Returns the retained events, oldest first.
     */
    public List<PublishedEvent> getHistory() {
        historyLock.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            historyLock.readLock().unlock();
        }
    }

    public void clearHistory() {
        historyLock.writeLock().lock();
        try {
            history.clear();
        } finally {
            historyLock.writeLock().unlock();
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public void clearSubscribers() {
        synchronized (registrationLock) {
            for (HandlerSubscriber subscriber : subscribers.values()) {
                eventBus.unregister(subscriber);
            }
            subscribers.clear();
        }
        LOG.info("All subscribers cleared");
    }

    /**
     * Number of handler invocations that ended in an exception since the bus
     * was created.
     */
    public long failedDeliveries() {
        return failedDeliveries.get();
    }

    private void onHandlerFailure(Throwable exception, SubscriberExceptionContext context) {
        Object event = context.getEvent();
        String type = event instanceof CockpitEvent ? ((CockpitEvent) event).typeName() : String.valueOf(event);
        recordFailure(context.getSubscriber(), type, exception);
    }

    private void recordFailure(Object subscriber, String eventType, Throwable exception) {
        failedDeliveries.incrementAndGet();
        LOG.error("Handler {} failed on {}", subscriber, eventType, exception);
    }

    /**
     * Bridges a callback into Guava's annotation-driven registry. All adapters
     * listen on {@link CockpitEvent}, so Guava keeps them in one
     * insertion-ordered set.
     */
    final class HandlerSubscriber {

        private final SubscriptionId id;
        private final EventHandler handler;

        HandlerSubscriber(SubscriptionId id, EventHandler handler) {
            this.id = id;
            this.handler = handler;
        }

        @Subscribe
        public void dispatch(CockpitEvent event) {
            try {
                handler.onEvent(event);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Error e) {
                // Guava only routes Exceptions to the handler, Errors escape publish()
                recordFailure(this, event.typeName(), e);
            }
        }

        @Override
        public String toString() {
            return id.toString();
        }
    }
}
