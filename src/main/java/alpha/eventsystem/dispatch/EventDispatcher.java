package alpha.eventsystem.dispatch;

import alpha.eventsystem.Config;
import alpha.eventsystem.event.Event;
import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;

/**
 * Routes published events to the observers subscribed to the event's
 * category.<p>
 * 
 * Delivery is synchronous. The thread publishing the event is the thread that
 * notifies the observers, one at a time, in the order they subscribed. Events
 * are not saved; an observer does not receive events published before it
 * subscribed.
 * 
 * <pre>
 *   record Damage(int amount) implements Event {}
 *   
 *   EventDispatcher dispatcher = new DefaultEventDispatcher();
 *   Observer healthBar = ...
 *   dispatcher.subscribe(Damage.class, healthBar);
 *   dispatcher.publish(new Damage(10));
 *   dispatcher.unsubscribe(Damage.class, healthBar);
 * </pre>
 * 
 * An observer is subscribed at most once per category. Observers are compared
 * using identity. Misuse of the subscription methods, such as subscribing an
 * observer twice or unsubscribing an observer that is not subscribed, never
 * throws an exception. It is reported on the {@linkplain Config#logger()
 * configured logger} and the method returns {@code false}.<p>
 * 
 * The dispatcher does not keep observers alive. An observer must be
 * unsubscribed before it is discarded. An observer that is garbage collected
 * while still subscribed is skipped and reported.<p>
 * 
 * Observers may subscribe and unsubscribe observers while being notified.
 * Each publication notifies the observers that were subscribed when the
 * publication began, and such changes apply to the next publication.<p>
 * 
 * What happens when an observer throws an exception is {@linkplain
 * Config#isolateObserverFailures() configurable}. By default, the exception
 * propagates to the publisher and the remaining observers miss out on the
 * event.<p>
 * 
 * The default implementation, {@link DefaultEventDispatcher}, is thread-safe.
 */
public interface EventDispatcher
{
    /**
     * Subscribe an observer to a category.
     * 
     * @param category to observe
     * @param observer to notify
     * @return {@code true} if subscribed,
     *         {@code false} if the observer was already subscribed
     * @throws NullPointerException if any arg is {@code null}
     */
    boolean subscribe(EventCategory category, Observer observer);
    
    /**
     * Subscribe an observer to events of the given type.<p>
     * 
     * Same as {@code subscribe(EventCategory.of(type), observer)}. Events of
     * the type must not override {@link Event#category()}, or they will never
     * reach the observer.
     * 
     * @param type of event to observe
     * @param observer to notify
     * @return {@code true} if subscribed,
     *         {@code false} if the observer was already subscribed
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code type} is an interface
     */
    default boolean subscribe(Class<? extends Event> type, Observer observer) {
        return subscribe(EventCategory.of(type), observer);
    }
    
    /**
     * Unsubscribe an observer from a category.<p>
     * 
     * The last observer unsubscribed from the last category releases all
     * memory held by the dispatcher, and the dispatcher is no longer
     * {@linkplain #isActive() active}.
     * 
     * @param category to stop observing
     * @param observer to unsubscribe
     * @return {@code true} if unsubscribed,
     *         {@code false} if the observer was not subscribed
     * @throws NullPointerException if any arg is {@code null}
     */
    boolean unsubscribe(EventCategory category, Observer observer);
    
    /**
     * Unsubscribe an observer from events of the given type.<p>
     * 
     * Same as {@code unsubscribe(EventCategory.of(type), observer)}.
     * 
     * @param type of event to stop observing
     * @param observer to unsubscribe
     * @return {@code true} if unsubscribed,
     *         {@code false} if the observer was not subscribed
     * @throws NullPointerException if any arg is {@code null}
     * @throws IllegalArgumentException if {@code type} is an interface
     */
    default boolean unsubscribe(Class<? extends Event> type, Observer observer) {
        return unsubscribe(EventCategory.of(type), observer);
    }
    
    /**
     * Unsubscribe an observer from all categories it is subscribed to.
     * 
     * @param observer to unsubscribe
     * @return the number of categories the observer was unsubscribed from
     * @throws NullPointerException if {@code observer} is {@code null}
     */
    int unsubscribeAll(Observer observer);
    
    /**
     * Publish an event to all observers of its category.<p>
     * 
     * If there are no observers, this method is a no-op.
     * 
     * @param event to publish
     * @return the number of observers notified
     * @throws NullPointerException
     *             if {@code event}, or its category, is {@code null}
     * @throws ObserverFailedException
     *             if observer failures are isolated, and at least one
     *             observer failed
     */
    int publish(Event event);
    
    /**
     * Returns {@code true} if at least one observer is subscribed, otherwise
     * {@code false}.
     * 
     * @return {@code true} if at least one observer is subscribed
     */
    boolean isActive();
    
    /**
     * Returns the number of categories having at least one subscription.
     * 
     * @return the number of categories having at least one subscription
     */
    int categoryCount();
    
    /**
     * Returns the number of subscriptions to the given category.<p>
     * 
     * The count includes observers that have been garbage collected without
     * being unsubscribed, until they are found and discarded.
     * 
     * @param category to query
     * @return the number of subscriptions to the given category
     * @throws NullPointerException if {@code category} is {@code null}
     */
    int subscriberCount(EventCategory category);
}
