package alpha.eventsystem.event;

/**
 * A receiver of events.<p>
 * 
 * An observer is subscribed to one or many categories of an {@link
 * alpha.eventsystem.dispatch.EventDispatcher EventDispatcher}, and is then
 * notified of each published event of those categories.<p>
 * 
 * The dispatcher identifies observers by object identity, not by {@code
 * equals()}. The dispatcher also does not own the observer; it keeps only a
 * weak reference to it. Whoever created the observer must unsubscribe it before
 * the observer is discarded. Failure to do so is logged by the dispatcher when
 * it finds the reference cleared.<p>
 * 
 * The lifecycle methods {@link #onInit()} and {@link #onDestroy()} are never
 * called by the dispatcher. They are invoked by the component owning the
 * observer, for example by {@link alpha.eventsystem.dispatch.Subscriptions}.
 * 
 * @see AbstractObserver
 * @see Observers
 */
public interface Observer
{
    /**
     * Receive an event.<p>
     * 
     * The method is called synchronously by the thread publishing the event,
     * and so the implementation should not block.<p>
     * 
     * The observer may subscribe and unsubscribe observers, itself included,
     * while being notified. The change will apply to subsequent publications.
     * 
     * @param event published (never {@code null})
     */
    void onNotify(Event event);
    
    /**
     * Called by the owning component when the observer has been created and is
     * about to start observing events.
     */
    void onInit();
    
    /**
     * Called by the owning component when the observer has stopped observing
     * events and is about to be discarded.
     */
    void onDestroy();
}
