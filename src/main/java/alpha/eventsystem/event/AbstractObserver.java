package alpha.eventsystem.event;

/**
 * Skeletal implementation of {@link Observer} which tracks whether the
 * observer is active.<p>
 * 
 * The observer is active between {@link #onInit()} and {@link #onDestroy()}.
 * Subclasses overriding either method must call super.
 */
public abstract class AbstractObserver implements Observer
{
    private volatile boolean active;
    
    @Override
    public void onInit() {
        active = true;
    }
    
    @Override
    public void onDestroy() {
        active = false;
    }
    
    /**
     * Returns {@code true} if this observer has been initialized and not yet
     * destroyed, otherwise {@code false}.
     * 
     * @return {@code true} if this observer is active
     */
    public final boolean isActive() {
        return active;
    }
}
