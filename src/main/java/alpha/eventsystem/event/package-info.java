/**
 * Events, the categories used as their dispatch keys, and the observers that
 * receive them.<p>
 * 
 * Listeners are grouped by {@link alpha.eventsystem.event.EventCategory}, so
 * that a published event is routed with one map lookup. There is no matching
 * on supertypes or patterns.
 */
package alpha.eventsystem.event;
