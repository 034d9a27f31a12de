/**
 * A synchronous publish/subscribe dispatcher keyed by event category.<p>
 * 
 * Observers subscribe to a {@link alpha.eventsystem.event.EventCategory} of a
 * {@link alpha.eventsystem.dispatch.EventDispatcher}. Publishing an {@link
 * alpha.eventsystem.event.Event} notifies every observer of the event's
 * category, on the publishing thread, in subscription order.<p>
 * 
 * Dispatchers are configured with a {@link alpha.eventsystem.Config}.
 */
package alpha.eventsystem;
