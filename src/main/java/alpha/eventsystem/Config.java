package alpha.eventsystem;

import alpha.eventsystem.dispatch.ObserverFailedException;

/**
 * Dispatcher configuration.<p>
 * 
 * The implementation is immutable and thread-safe.<p>
 * 
 * The implementation used if none is specified is {@link #DEFAULT}.<p>
 * 
 * Any configuration object can be turned into a builder for customization. The
 * static method {@link #configuration()} is a shortcut for {@code
 * Config.DEFAULT.toBuilder()}.
 * <pre>
 *   Config cfg = Config.configuration()
 *           .isolateObserverFailures(true)
 *           .build();
 *   EventDispatcher dispatcher = new DefaultEventDispatcher(cfg);
 * </pre>
 */
public interface Config
{
    /**
     * Values used:<p>
     * 
     * Logger = {@code System.getLogger("alpha.eventsystem.dispatch")} <br>
     * Isolate observer failures = false
     */
    Config DEFAULT = DefaultConfig.DefaultBuilder.ROOT.build();
    
    /**
     * Returns the logger used for diagnostics.<p>
     * 
     * Anomalies in how the dispatcher is used, a duplicated subscription or an
     * unsubscription of an observer that was never subscribed, are not errors.
     * They are logged on this logger, on level {@code WARNING}. Less severe
     * conditions are logged on {@code DEBUG} and {@code TRACE}.<p>
     * 
     * The default value is a logger named after the dispatcher's package, which
     * means that unless the application installs a different {@code
     * System.LoggerFinder}, the records end up in {@code java.util.logging}.
     * 
     * @return the logger used for diagnostics
     */
    System.Logger logger();
    
    /**
     * Returns whether an exception thrown by one observer prevents the event
     * from reaching the remaining observers.<p>
     * 
     * If {@code false}, the first exception thrown by an observer propagates
     * unchanged to the caller of {@code publish}, and observers not yet
     * notified miss out on the event.<p>
     * 
     * If {@code true}, the exception is logged and delivery continues. Once
     * all observers have been notified, an {@link ObserverFailedException} is
     * thrown, having the first failure as cause and the rest as suppressed.<p>
     * 
     * Only {@code RuntimeException}s are isolated; an {@code Error} always
     * propagates.<p>
     * 
     * The default value is {@code false}.
     * 
     * @return whether observer failures are isolated
     */
    boolean isolateObserverFailures();
    
    /**
     * Returns a builder pre-populated with the values of this configuration.
     * 
     * @return a builder pre-populated with the values of this configuration
     */
    Builder toBuilder();
    
    /**
     * Returns {@code Config.DEFAULT.toBuilder()}.
     * 
     * @return {@code Config.DEFAULT.toBuilder()}
     */
    static Builder configuration() {
        return DEFAULT.toBuilder();
    }
    
    /**
     * Builder of a {@link Config}.<p>
     * 
     * The builder is immutable. Each setter returns a new builder instance
     * representing the new state.
     */
    interface Builder {
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @throws NullPointerException if {@code newVal} is {@code null}
         * @see Config#logger()
         */
        Builder logger(System.Logger newVal);
        
        /**
         * Sets a new value.
         * 
         * @param newVal new value
         * @return a new builder representing the new state
         * @see Config#isolateObserverFailures()
         */
        Builder isolateObserverFailures(boolean newVal);
        
        /**
         * Builds the configuration.
         * 
         * @return a configuration
         */
        Config build();
    }
}
