package alpha.eventsystem.dispatch;

import alpha.eventsystem.Config;
import alpha.eventsystem.event.Event;
import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests concerning observers that throw.
 */
class ObserverFailureTest {
    record Damage(int amount) implements Event {}
    
    private final Observer o1 = mock(Observer.class),
                           o2 = mock(Observer.class),
                           o3 = mock(Observer.class);
    
    @Test
    void default_propagates_remainingMissOut() {
        var testee = new DefaultEventDispatcher();
        var boom = new IllegalStateException("boom");
        doThrow(boom).when(o1).onNotify(any());
        testee.subscribe(Damage.class, o1);
        testee.subscribe(Damage.class, o2);
        
        assertThatThrownBy(() -> testee.publish(new Damage(1)))
                .isSameAs(boom);
        verifyNoInteractions(o2);
        // Subscriptions unaffected
        assertThat(testee.subscriberCount(EventCategory.of(Damage.class))).isEqualTo(2);
    }
    
    @Test
    void isolated_allNotified_thenThrows() {
        var testee = isolating();
        var first  = new IllegalStateException("first");
        var second = new UnsupportedOperationException("second");
        doThrow(first).when(o1).onNotify(any());
        doThrow(second).when(o3).onNotify(any());
        testee.subscribe(Damage.class, o1);
        testee.subscribe(Damage.class, o2);
        testee.subscribe(Damage.class, o3);
        
        var ev = new Damage(1);
        var thr = catchThrowableOfType(() -> testee.publish(ev), ObserverFailedException.class);
        assertThat(thr).hasMessage("2 observer(s) of " + Damage.class.getName() + " failed.")
                       .hasCause(first);
        assertThat(thr.getCause()).isSameAs(first);
        assertThat(thr.getSuppressed()).containsExactly(second);
        assertThat(thr.notified()).isOne();
        assertThat(thr.failed()).isEqualTo(2);
        assertThat(thr.category()).isEqualTo(EventCategory.of(Damage.class));
        verify(o2).onNotify(ev);
        verify(o3).onNotify(ev);
    }
    
    @Test
    void isolated_noFailure_returnsCount() {
        var testee = isolating();
        testee.subscribe(Damage.class, o1);
        testee.subscribe(Damage.class, o2);
        assertThat(testee.publish(new Damage(1))).isEqualTo(2);
    }
    
    @Test
    void isolated_errorNotCaught() {
        var testee = isolating();
        var err = new Error("fatal");
        doThrow(err).when(o1).onNotify(any());
        testee.subscribe(Damage.class, o1);
        testee.subscribe(Damage.class, o2);
        assertThatThrownBy(() -> testee.publish(new Damage(1)))
                .isSameAs(err);
        verifyNoInteractions(o2);
    }
    
    private static DefaultEventDispatcher isolating() {
        return new DefaultEventDispatcher(Config.configuration()
                .isolateObserverFailures(true)
                .build());
    }
}
