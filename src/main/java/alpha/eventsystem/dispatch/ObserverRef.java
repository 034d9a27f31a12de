package alpha.eventsystem.dispatch;

import alpha.eventsystem.event.Observer;

import java.lang.ref.WeakReference;

/**
 * A weak reference to a subscribed observer.<p>
 * 
 * The observer's class name is retained so that a cleared reference can still
 * be reported meaningfully.
 */
final class ObserverRef extends WeakReference<Observer>
{
    private final String type;
    
    ObserverRef(Observer observer) {
        super(observer);
        type = observer.getClass().getName();
    }
    
    boolean isStale() {
        return refersTo(null);
    }
    
    @Override
    public String toString() {
        Observer o = get();
        return o == null ? "<collected " + type + ">" : o.toString();
    }
}
