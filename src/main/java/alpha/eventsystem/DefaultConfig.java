package alpha.eventsystem;

import alpha.eventsystem.dispatch.EventDispatcher;
import alpha.eventsystem.util.AbstractImmutableBuilder;

import java.util.function.Consumer;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder builder;
    private final System.Logger logger;
    private final boolean isolateObserverFailures;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder                 = b;
        logger                  = s.logger;
        isolateObserverFailures = s.isolateObserverFailures;
    }
    
    @Override
    public System.Logger logger() {
        return logger;
    }
    
    @Override
    public boolean isolateObserverFailures() {
        return isolateObserverFailures;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return "Config{logger=" + logger.getName() +
                ", isolateObserverFailures=" + isolateObserverFailures + "}";
    }
    
    static final class DefaultBuilder
            extends AbstractImmutableBuilder<DefaultBuilder.MutableState>
            implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            System.Logger logger = System.getLogger(
                    EventDispatcher.class.getPackageName());
            boolean isolateObserverFailures = false;
        }
        
        private DefaultBuilder() {
            // super()
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            super(prev, modifier);
        }
        
        @Override
        public Builder logger(System.Logger newVal) {
            requireNonNull(newVal);
            return new DefaultBuilder(this, s -> s.logger = newVal);
        }
        
        @Override
        public Builder isolateObserverFailures(boolean newVal) {
            return new DefaultBuilder(this, s -> s.isolateObserverFailures = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState(MutableState::new));
        }
    }
}
