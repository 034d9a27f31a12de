package alpha.eventsystem.dispatch;

import alpha.eventsystem.event.AbstractObserver;
import alpha.eventsystem.event.Event;
import alpha.eventsystem.event.EventCategory;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.spy;

/**
 * Small tests of {@code Subscriptions}.
 */
class SubscriptionsTest {
    record Damage(int amount) implements Event {}
    record Heal(int amount) implements Event {}
    
    private static final EventCategory
            DAMAGE = EventCategory.of(Damage.class),
            HEAL   = EventCategory.of(Heal.class);
    
    static class HealthBar extends AbstractObserver {
        final List<Event> received = new ArrayList<>();
        
        @Override
        public void onNotify(Event event) {
            received.add(event);
        }
    }
    
    private final DefaultEventDispatcher dispatcher = spy(new DefaultEventDispatcher());
    private final HealthBar bar = spy(new HealthBar());
    
    @Test
    void lifecycle() {
        var ev = new Damage(10);
        try (var subs = Subscriptions.open(dispatcher, bar, DAMAGE, HEAL)) {
            assertThat(bar.isActive()).isTrue();
            assertThat(subs.observer()).isSameAs(bar);
            assertThat(subs.categories()).containsExactly(DAMAGE, HEAL);
            assertThat(dispatcher.categoryCount()).isEqualTo(2);
            dispatcher.publish(ev);
        }
        assertThat(bar.received).containsExactly(ev);
        assertThat(bar.isActive()).isFalse();
        assertThat(dispatcher.isActive()).isFalse();
        
        InOrder order = inOrder(bar, dispatcher);
        order.verify(bar).onInit();
        order.verify(dispatcher).subscribe(DAMAGE, bar);
        order.verify(dispatcher).subscribe(HEAL, bar);
        order.verify(dispatcher).unsubscribe(DAMAGE, bar);
        order.verify(dispatcher).unsubscribe(HEAL, bar);
        order.verify(bar).onDestroy();
    }
    
    @Test
    void duplicateCategories_ignored() {
        var subs = Subscriptions.open(dispatcher, bar, DAMAGE, DAMAGE, HEAL, DAMAGE);
        assertThat(subs.categories()).containsExactly(DAMAGE, HEAL);
        assertThat(dispatcher.subscriberCount(DAMAGE)).isOne();
        subs.close();
        assertThat(dispatcher.isActive()).isFalse();
    }
    
    @Test
    void closeTwice_noop() {
        var subs = Subscriptions.open(dispatcher, bar, DAMAGE);
        subs.close();
        assertThat(subs.isClosed()).isTrue();
        subs.close();
        InOrder order = inOrder(bar);
        order.verify(bar).onInit();
        order.verify(bar).onDestroy();
        order.verifyNoMoreInteractions();
    }
    
    @Test
    void nullCategory_nothingHappens() {
        assertThatThrownBy(() -> Subscriptions.open(dispatcher, bar, DAMAGE, (EventCategory) null))
                .isExactlyInstanceOf(NullPointerException.class);
        assertThat(bar.isActive()).isFalse();
        assertThat(dispatcher.isActive()).isFalse();
    }
}
