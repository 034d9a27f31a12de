package alpha.eventsystem.dispatch;

import alpha.eventsystem.Config;
import alpha.eventsystem.event.EventCategory;

import java.util.List;

/**
 * Thrown by {@link EventDispatcher#publish} after all observers have been
 * notified, if at least one observer threw an exception and observer failures
 * are {@linkplain Config#isolateObserverFailures() isolated}.<p>
 * 
 * The cause is the first observer exception. Subsequent observer exceptions
 * are added as suppressed.
 */
public final class ObserverFailedException extends RuntimeException
{
    private static final long serialVersionUID = 1L;
    
    private final transient EventCategory category;
    private final int notified, failed;
    
    ObserverFailedException(EventCategory category, int notified, List<RuntimeException> failures) {
        super(failures.size() + " observer(s) of " + category.name() + " failed.",
              failures.get(0));
        this.category = category;
        this.notified = notified;
        this.failed   = failures.size();
        failures.stream().skip(1).forEach(this::addSuppressed);
    }
    
    /**
     * Returns the category of the published event.<p>
     * 
     * The category is not serialized, and will be {@code null} if this
     * exception has been deserialized.
     * 
     * @return the category of the published event
     */
    public EventCategory category() {
        return category;
    }
    
    /**
     * Returns the number of observers that returned normally.
     * 
     * @return the number of observers that returned normally
     */
    public int notified() {
        return notified;
    }
    
    /**
     * Returns the number of observers that threw an exception.
     * 
     * @return the number of observers that threw an exception
     */
    public int failed() {
        return failed;
    }
}
