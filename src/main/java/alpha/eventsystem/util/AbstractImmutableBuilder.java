package alpha.eventsystem.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Base class for builders whose every setter returns a new builder.<p>
 * 
 * Each builder links to the builder it was derived from and stores only the
 * modification it represents. The modifications are replayed, oldest first,
 * against a fresh mutable state when {@link #constructState(Supplier)} is
 * called. A builder may therefore be shared and branched freely.
 * 
 * @param <S> mutable state container
 */
public abstract class AbstractImmutableBuilder<S>
{
    private final AbstractImmutableBuilder<S> prev;
    private final Consumer<? super S> modifier;
    
    /**
     * Constructs a root builder; one that has no modifications.
     */
    protected AbstractImmutableBuilder() {
        this.prev = null;
        this.modifier = null;
    }
    
    /**
     * Constructs a builder derived from another.
     * 
     * @param prev builder
     * @param modifier of the state
     * @throws NullPointerException if any arg is {@code null}
     */
    protected AbstractImmutableBuilder(
            AbstractImmutableBuilder<S> prev, Consumer<? super S> modifier) {
        this.prev = requireNonNull(prev);
        this.modifier = requireNonNull(modifier);
    }
    
    /**
     * Creates a state container and applies all modifications of this builder
     * chain.
     * 
     * @param factory of state
     * @return the modified state
     */
    protected final S constructState(Supplier<? extends S> factory) {
        Deque<Consumer<? super S>> chain = new ArrayDeque<>();
        for (var b = this; b.modifier != null; b = b.prev) {
            chain.addFirst(b.modifier);
        }
        S state = factory.get();
        chain.forEach(m -> m.accept(state));
        return state;
    }
}
