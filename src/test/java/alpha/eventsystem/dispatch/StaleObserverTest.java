package alpha.eventsystem.dispatch;

import alpha.eventsystem.event.Event;
import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;
import alpha.eventsystem.testutil.Logging;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests concerning observers collected without being unsubscribed.<p>
 * 
 * The garbage collector can not be relied upon in a test, so instead the
 * registry's reference is cleared manually.
 */
class StaleObserverTest {
    record Damage(int amount) implements Event {}
    
    private static final EventCategory DAMAGE = EventCategory.of(Damage.class);
    
    private final DefaultEventDispatcher testee = new DefaultEventDispatcher();
    private final Observer o1 = mock(Observer.class),
                           o2 = mock(Observer.class),
                           o3 = mock(Observer.class);
    private Logging.Recorder log;
    
    @BeforeEach
    void startRecording() {
        log = Logging.startRecording(DefaultEventDispatcher.class);
    }
    
    @AfterEach
    void stopRecording() {
        log.stop();
    }
    
    @Test
    void publish_skipsAndReports() {
        testee.subscribe(DAMAGE, o1);
        testee.subscribe(DAMAGE, o2);
        clearFirst();
        
        var ev = new Damage(1);
        assertThat(testee.publish(ev)).isOne();
        verifyNoInteractions(o1);
        verify(o2).onNotify(ev);
        assertThat(log.records())
                .filteredOn(r -> r.getLevel().equals(Level.WARNING))
                .extracting(r -> r.getMessage())
                .singleElement()
                .asString()
                .startsWith("Observer of " + DAMAGE + " was garbage collected without being unsubscribed, skipping: <collected ");
        
        // Publish does not mutate
        assertThat(testee.subscriberCount(DAMAGE)).isEqualTo(2);
    }
    
    @Test
    void subscribe_prunes() {
        testee.subscribe(DAMAGE, o1);
        testee.subscribe(DAMAGE, o2);
        clearFirst();
        assertTrue(testee.subscribe(DAMAGE, o3));
        assertThat(testee.subscriberCount(DAMAGE)).isEqualTo(2);
        assertThat(log.records())
                .extracting(r -> r.getMessage())
                .contains("Discarded 1 collected observer(s) of " + DAMAGE + ".");
    }
    
    @Test
    void unsubscribe_prunesLast_registryReleased() {
        testee.subscribe(DAMAGE, o1);
        clearFirst();
        assertFalse(testee.unsubscribe(DAMAGE, o2));
        assertThat(testee.isActive()).isFalse();
    }
    
    @Test
    void unsubscribeAll_prunesVisitedCategories() {
        var heal = EventCategory.of("heal");
        testee.subscribe(DAMAGE, o1);
        testee.subscribe(DAMAGE, o2);
        testee.subscribe(heal, o3);
        clearFirst();
        assertThat(testee.unsubscribeAll(o2)).isOne();
        assertThat(testee.subscriberCount(DAMAGE)).isZero();
        assertThat(testee.categoryCount()).isOne();
        assertThat(log.records())
                .extracting(r -> r.getMessage())
                .contains("Discarded 1 collected observer(s) of " + DAMAGE + ".");
        assertThat(testee.unsubscribeAll(o3)).isOne();
        assertThat(testee.isActive()).isFalse();
    }
    
    @Test
    void clearedObserver_canSubscribeAgain() {
        testee.subscribe(DAMAGE, o1);
        clearFirst();
        assertTrue(testee.subscribe(DAMAGE, o1));
        assertThat(testee.subscriberCount(DAMAGE)).isOne();
        var ev = new Damage(1);
        assertThat(testee.publish(ev)).isOne();
        verify(o1).onNotify(ev);
    }
    
    @Test
    void refToString() {
        var ref = new ObserverRef(o1);
        assertThat(ref.isStale()).isFalse();
        assertThat(ref).hasToString(o1.toString());
        ref.clear();
        assertThat(ref.isStale()).isTrue();
        assertThat(ref.toString()).startsWith("<collected ").endsWith(">");
    }
    
    private void clearFirst() {
        testee.registry().snapshot(DAMAGE).get(0).clear();
    }
}
