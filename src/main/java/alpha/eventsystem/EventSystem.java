package alpha.eventsystem;

import alpha.eventsystem.dispatch.DefaultEventDispatcher;
import alpha.eventsystem.dispatch.EventDispatcher;
import alpha.eventsystem.event.Event;
import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;

/**
 * A process-wide {@link EventDispatcher}.<p>
 * 
 * The dispatcher is created on first use with {@link Config#DEFAULT}. Its
 * registry of subscriptions follows the same lifecycle as any other {@link
 * DefaultEventDispatcher}; it is allocated on the first subscription and
 * released when the last subscription is removed.<p>
 * 
 * Prefer to create and pass around a dispatcher instance. A shared dispatcher
 * is global state; subscriptions made by one component are observable by all
 * others, and tests using it are not isolated from each other.
 */
public final class EventSystem
{
    private EventSystem() {
        // Empty
    }
    
    private static final class Holder {
        static final EventDispatcher INSTANCE = new DefaultEventDispatcher();
    }
    
    /**
     * Returns the process-wide dispatcher.
     * 
     * @return the process-wide dispatcher
     */
    public static EventDispatcher dispatcher() {
        return Holder.INSTANCE;
    }
    
    /**
     * Subscribe an observer to events of the given type.
     * 
     * @param type of event to observe
     * @param observer to notify
     * @return {@code true} if subscribed,
     *         {@code false} if the observer was already subscribed
     * @see EventDispatcher#subscribe(Class, Observer)
     */
    public static boolean subscribe(Class<? extends Event> type, Observer observer) {
        return dispatcher().subscribe(type, observer);
    }
    
    /**
     * Subscribe an observer to a category.
     * 
     * @param category to observe
     * @param observer to notify
     * @return {@code true} if subscribed,
     *         {@code false} if the observer was already subscribed
     * @see EventDispatcher#subscribe(EventCategory, Observer)
     */
    public static boolean subscribe(EventCategory category, Observer observer) {
        return dispatcher().subscribe(category, observer);
    }
    
    /**
     * Unsubscribe an observer from events of the given type.
     * 
     * @param type of event to stop observing
     * @param observer to unsubscribe
     * @return {@code true} if unsubscribed,
     *         {@code false} if the observer was not subscribed
     * @see EventDispatcher#unsubscribe(Class, Observer)
     */
    public static boolean unsubscribe(Class<? extends Event> type, Observer observer) {
        return dispatcher().unsubscribe(type, observer);
    }
    
    /**
     * Unsubscribe an observer from a category.
     * 
     * @param category to stop observing
     * @param observer to unsubscribe
     * @return {@code true} if unsubscribed,
     *         {@code false} if the observer was not subscribed
     * @see EventDispatcher#unsubscribe(EventCategory, Observer)
     */
    public static boolean unsubscribe(EventCategory category, Observer observer) {
        return dispatcher().unsubscribe(category, observer);
    }
    
    /**
     * Publish an event.
     * 
     * @param event to publish
     * @return the number of observers notified
     * @see EventDispatcher#publish(Event)
     */
    public static int publish(Event event) {
        return dispatcher().publish(event);
    }
}
