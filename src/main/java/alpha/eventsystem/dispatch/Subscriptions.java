package alpha.eventsystem.dispatch;

import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * The subscriptions of one observer, scoped to the lifetime of the component
 * that owns the observer.<p>
 * 
 * {@link #open(EventDispatcher, Observer, EventCategory, EventCategory...)}
 * initializes the observer and subscribes it. {@link #close()} unsubscribes the
 * observer and then destroys it. This way, the observer is never left
 * subscribed after having been destroyed.
 * <pre>
 *   try (var subs = Subscriptions.open(dispatcher, healthBar, DAMAGE, HEAL)) {
 *       ...
 *   }
 * </pre>
 * 
 * This class is not thread-safe.
 */
public final class Subscriptions implements AutoCloseable
{
    /**
     * Calls {@link Observer#onInit()} and subscribes the observer to the given
     * categories.<p>
     * 
     * Duplicated categories are ignored.
     * 
     * @param dispatcher to subscribe with
     * @param observer to subscribe
     * @param first category
     * @param more categories
     * @return the subscriptions
     * @throws NullPointerException if any arg is {@code null}
     */
    public static Subscriptions open(
            EventDispatcher dispatcher, Observer observer,
            EventCategory first, EventCategory... more)
    {
        requireNonNull(dispatcher);
        requireNonNull(observer);
        Set<EventCategory> all = new LinkedHashSet<>();
        all.add(requireNonNull(first));
        for (EventCategory c : more) {
            all.add(requireNonNull(c));
        }
        observer.onInit();
        all.forEach(c -> dispatcher.subscribe(c, observer));
        return new Subscriptions(dispatcher, observer, List.copyOf(all));
    }
    
    private final EventDispatcher dispatcher;
    private final Observer observer;
    private final List<EventCategory> categories;
    private boolean closed;
    
    private Subscriptions(
            EventDispatcher dispatcher, Observer observer, List<EventCategory> categories) {
        this.dispatcher = dispatcher;
        this.observer = observer;
        this.categories = categories;
    }
    
    /**
     * Returns the observer.
     * 
     * @return the observer
     */
    public Observer observer() {
        return observer;
    }
    
    /**
     * Returns the categories, in the order they were subscribed.
     * 
     * @return the categories (unmodifiable)
     */
    public List<EventCategory> categories() {
        return categories;
    }
    
    /**
     * Returns {@code true} if closed, otherwise {@code false}.
     * 
     * @return {@code true} if closed
     */
    public boolean isClosed() {
        return closed;
    }
    
    /**
     * Unsubscribes the observer from all categories, then calls {@link
     * Observer#onDestroy()}.<p>
     * 
     * Subsequent invocations are no-ops.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        categories.forEach(c -> dispatcher.unsubscribe(c, observer));
        observer.onDestroy();
    }
}
