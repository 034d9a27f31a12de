package alpha.eventsystem.event;

/**
 * An event value routed by an {@link alpha.eventsystem.dispatch.EventDispatcher
 * EventDispatcher} to the observers of its {@linkplain #category() category}.<p>
 * 
 * The dispatcher treats the event as immutable and never keeps a reference to
 * it once the publishing call returns. The lifetime of the event belongs to the
 * producer.<p>
 * 
 * By default, the category of an event is its runtime type. Two instances of
 * the same class are therefore always delivered to the same observers:
 * <pre>
 *   record Damage(int amount) implements Event {}
 *   
 *   dispatcher.subscribe(Damage.class, healthBar);
 *   dispatcher.publish(new Damage(10)); // healthBar is notified
 * </pre>
 * 
 * An event definition may instead use an explicit tag, by overriding {@link
 * #category()}. The method must be a pure function; it must return an equal
 * category for every instance that belongs to the same logical group of events.
 * <pre>
 *   enum Lifecycle implements Event {
 *       STARTED, STOPPED;
 *       static final EventCategory CATEGORY = EventCategory.of("lifecycle");
 *       {@literal @}Override
 *       public EventCategory category() {
 *           return CATEGORY;
 *       }
 *   }
 * </pre>
 * 
 * Category lookup is exact. Subscribing to a supertype or to an interface does
 * not make the observer receive events of a subtype.
 */
public interface Event
{
    /**
     * Returns the dispatch key of this event.<p>
     * 
     * The default implementation returns {@code EventCategory.of(getClass())}.
     * 
     * @return the dispatch key of this event (never {@code null})
     */
    default EventCategory category() {
        return EventCategory.of(getClass());
    }
}
