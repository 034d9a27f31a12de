package alpha.eventsystem.event;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Factories of {@link Observer}s.
 */
public final class Observers
{
    private Observers() {
        // Empty
    }
    
    /**
     * Returns an observer that casts each received event to the given type and
     * passes it to the given action.<p>
     * 
     * The returned observer has no-op lifecycle methods.<p>
     * 
     * Each invocation returns a new observer. The caller must keep the
     * returned instance in order to unsubscribe it; this will not work:
     * <pre>
     *   dispatcher.subscribe(Damage.class, Observers.of(Damage.class, log::add));
     *   // Does nothing, a different observer
     *   dispatcher.unsubscribe(Damage.class, Observers.of(Damage.class, log::add));
     * </pre>
     * 
     * Also note that the dispatcher does not keep the observer alive.
     * 
     * @param type of event
     * @param action to execute
     * @param <E> type of event
     * @return an observer
     * @throws NullPointerException if any arg is {@code null}
     */
    public static <E extends Event> Observer of(Class<E> type, Consumer<? super E> action) {
        requireNonNull(type);
        requireNonNull(action);
        return new Typed<>(type, action);
    }
    
    private static final class Typed<E extends Event> implements Observer {
        private final Class<E> type;
        private final Consumer<? super E> action;
        
        Typed(Class<E> type, Consumer<? super E> action) {
            this.type = type;
            this.action = action;
        }
        
        @Override
        public void onNotify(Event event) {
            // ClassCastException if subscribed to the wrong category
            action.accept(type.cast(event));
        }
        
        @Override
        public void onInit() {
            // Empty
        }
        
        @Override
        public void onDestroy() {
            // Empty
        }
        
        @Override
        public String toString() {
            return Observers.class.getSimpleName() + ".of(" + type.getSimpleName() + ")";
        }
    }
}
