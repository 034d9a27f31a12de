package alpha.eventsystem.dispatch;

import alpha.eventsystem.Config;
import alpha.eventsystem.event.Event;
import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.TRACE;
import static java.lang.System.Logger.Level.WARNING;
import static java.util.Objects.requireNonNull;

/**
 * Thread-safe implementation of {@link EventDispatcher}.<p>
 * 
 * The behavior of this class is documented in {@link EventDispatcher}.<p>
 * 
 * The registry of subscriptions is created on the first subscription and
 * released when the last subscription is removed. A dispatcher without
 * subscriptions holds no other state than its configuration.<p>
 * 
 * All access to the registry is guarded by this object's monitor. The monitor
 * is not held while observers are notified; a publication works on a copy of
 * the category's observer list.
 */
public class DefaultEventDispatcher implements EventDispatcher
{
    private final Config config;
    private final System.Logger log;
    // null when there are no subscriptions
    private Registry registry;
    
    /**
     * Constructs a dispatcher using {@link Config#DEFAULT}.
     */
    public DefaultEventDispatcher() {
        this(Config.DEFAULT);
    }
    
    /**
     * Constructs a dispatcher.
     * 
     * @param config of dispatcher
     * @throws NullPointerException if {@code config} is {@code null}
     */
    public DefaultEventDispatcher(Config config) {
        this.config = requireNonNull(config);
        this.log = requireNonNull(config.logger());
    }
    
    /**
     * Returns the configuration used by this dispatcher.
     * 
     * @return the configuration used by this dispatcher
     */
    public final Config config() {
        return config;
    }
    
    @Override
    public boolean subscribe(EventCategory category, Observer observer) {
        requireNonNull(category);
        requireNonNull(observer);
        final boolean created, added;
        final List<ObserverRef> stale;
        synchronized (this) {
            created = registry == null;
            if (created) {
                registry = new Registry();
            }
            stale = registry.prune(category);
            added = registry.add(category, observer);
        }
        if (created) {
            log.log(DEBUG, "Registry created.");
        }
        logPruned(category, stale);
        if (!added) {
            log.log(WARNING, () ->
                "Observer already subscribed to " + category + ", ignoring. " +
                "Probably missed to unsubscribe: " + observer);
        }
        return added;
    }
    
    @Override
    public boolean unsubscribe(EventCategory category, Observer observer) {
        requireNonNull(category);
        requireNonNull(observer);
        final boolean removed, released;
        final List<ObserverRef> stale;
        synchronized (this) {
            if (registry == null) {
                removed = released = false;
                stale = null;
            } else {
                removed = registry.remove(category, observer);
                stale = registry.prune(category);
                released = releaseIfEmpty();
            }
        }
        if (stale == null) {
            log.log(DEBUG, () ->
                "No subscriptions, nothing to unsubscribe " + observer +
                " from (" + category + ").");
            return false;
        }
        logPruned(category, stale);
        if (!removed) {
            log.log(WARNING, () ->
                "Observer is not subscribed to " + category + ", can not unsubscribe. " +
                "This may leak the observer elsewhere: " + observer);
        }
        logReleased(released);
        return removed;
    }
    
    @Override
    public int unsubscribeAll(Observer observer) {
        requireNonNull(observer);
        final List<EventCategory> found;
        final boolean released;
        final Map<EventCategory, List<ObserverRef>> stale = new LinkedHashMap<>();
        synchronized (this) {
            if (registry == null) {
                found = null;
                released = false;
            } else {
                found = registry.categoriesOf(observer);
                for (EventCategory c : found) {
                    registry.remove(c, observer);
                    stale.put(c, registry.prune(c));
                }
                released = releaseIfEmpty();
            }
        }
        if (found == null) {
            log.log(DEBUG, () ->
                "No subscriptions, nothing to unsubscribe " + observer + " from.");
            return 0;
        }
        stale.forEach(this::logPruned);
        if (found.isEmpty()) {
            log.log(WARNING, () ->
                "Observer is not subscribed to any category, can not unsubscribe. " +
                "This may leak the observer elsewhere: " + observer);
        }
        logReleased(released);
        return found.size();
    }
    
    @Override
    public int publish(Event event) {
        requireNonNull(event);
        final EventCategory category = requireNonNull(event.category(), "category");
        final List<ObserverRef> targets;
        synchronized (this) {
            targets = registry == null ? List.of() : registry.snapshot(category);
        }
        if (targets.isEmpty()) {
            log.log(TRACE, () -> "No observers of " + category + ".");
            return 0;
        }
        return config.isolateObserverFailures() ?
                notifyIsolated(targets, category, event) :
                notifyInOrder(targets, category, event);
    }
    
    @Override
    public synchronized boolean isActive() {
        return registry != null;
    }
    
    @Override
    public synchronized int categoryCount() {
        return registry == null ? 0 : registry.categoryCount();
    }
    
    @Override
    public int subscriberCount(EventCategory category) {
        requireNonNull(category);
        synchronized (this) {
            return registry == null ? 0 : registry.subscriberCount(category);
        }
    }
    
    /**
     * Returns the registry, or {@code null} if there are no subscriptions.
     */
    synchronized Registry registry() {
        return registry;
    }
    
    private int notifyInOrder(List<ObserverRef> targets, EventCategory category, Event event) {
        int n = 0;
        for (ObserverRef ref : targets) {
            Observer o = ref.get();
            if (o == null) {
                logStale(category, ref);
                continue;
            }
            o.onNotify(event);
            ++n;
        }
        return n;
    }
    
    private int notifyIsolated(List<ObserverRef> targets, EventCategory category, Event event) {
        int n = 0;
        List<RuntimeException> failures = null;
        for (ObserverRef ref : targets) {
            Observer o = ref.get();
            if (o == null) {
                logStale(category, ref);
                continue;
            }
            try {
                o.onNotify(event);
                ++n;
            } catch (RuntimeException e) {
                log.log(WARNING, () ->
                    "Observer of " + category + " failed, continuing: " + o, e);
                if (failures == null) {
                    failures = new ArrayList<>(1);
                }
                failures.add(e);
            }
        }
        if (failures != null) {
            throw new ObserverFailedException(category, n, failures);
        }
        return n;
    }
    
    private boolean releaseIfEmpty() {
        assert Thread.holdsLock(this);
        if (registry.isEmpty()) {
            registry = null;
            return true;
        }
        return false;
    }
    
    private void logReleased(boolean released) {
        if (released) {
            log.log(DEBUG, "No subscriptions left, registry released.");
        }
    }
    
    private void logStale(EventCategory category, ObserverRef ref) {
        log.log(WARNING, () ->
            "Observer of " + category + " was garbage collected without " +
            "being unsubscribed, skipping: " + ref);
    }
    
    private void logPruned(EventCategory category, List<ObserverRef> stale) {
        if (!stale.isEmpty()) {
            log.log(DEBUG, () ->
                "Discarded " + stale.size() + " collected observer(s) of " + category + ".");
        }
    }
}
