/**
 * The dispatcher, which maps event categories to observers and fans out
 * published events.<p>
 * 
 * {@link alpha.eventsystem.dispatch.DefaultEventDispatcher} is meant to be
 * created by the application and passed to the producers and observers that
 * need it. {@link alpha.eventsystem.EventSystem} provides a shared instance for
 * code that prefers a process-wide dispatcher.
 */
package alpha.eventsystem.dispatch;
