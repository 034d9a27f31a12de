package alpha.eventsystem.dispatch;

import alpha.eventsystem.event.EventCategory;
import alpha.eventsystem.event.Observer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Maps a category to the ordered list of its observers.<p>
 * 
 * A category key exists only for as long as it has at least one observer.<p>
 * 
 * Not thread-safe. Guarded by the owning {@link DefaultEventDispatcher}.
 */
final class Registry
{
    private final Map<EventCategory, List<ObserverRef>> categories = new HashMap<>();
    
    /**
     * Appends the observer to the category's list.
     * 
     * @return {@code false} if the observer is already in the list
     */
    boolean add(EventCategory category, Observer observer) {
        var list = categories.computeIfAbsent(category, k -> new ArrayList<>(2));
        if (indexOf(list, observer) >= 0) {
            return false;
        }
        list.add(new ObserverRef(observer));
        return true;
    }
    
    /**
     * Removes the observer from the category's list.
     * 
     * @return {@code false} if the observer was not found
     */
    boolean remove(EventCategory category, Observer observer) {
        var list = categories.get(category);
        if (list == null) {
            return false;
        }
        int i = indexOf(list, observer);
        if (i < 0) {
            return false;
        }
        list.remove(i);
        dropIfEmpty(category, list);
        return true;
    }
    
    /**
     * Removes cleared references from the category's list.
     * 
     * @return the references removed
     */
    List<ObserverRef> prune(EventCategory category) {
        var list = categories.get(category);
        if (list == null) {
            return List.of();
        }
        List<ObserverRef> stale = null;
        for (Iterator<ObserverRef> it = list.iterator(); it.hasNext();) {
            var ref = it.next();
            if (ref.isStale()) {
                it.remove();
                if (stale == null) {
                    stale = new ArrayList<>(1);
                }
                stale.add(ref);
            }
        }
        dropIfEmpty(category, list);
        return stale == null ? List.of() : stale;
    }
    
    /**
     * Returns the categories to which the observer is subscribed.
     */
    List<EventCategory> categoriesOf(Observer observer) {
        List<EventCategory> found = new ArrayList<>();
        categories.forEach((c, list) -> {
            if (indexOf(list, observer) >= 0) {
                found.add(c);
            }
        });
        return found;
    }
    
    /**
     * Returns an immutable copy of the category's list.
     */
    List<ObserverRef> snapshot(EventCategory category) {
        var list = categories.get(category);
        return list == null ? List.of() : List.copyOf(list);
    }
    
    int categoryCount() {
        return categories.size();
    }
    
    int subscriberCount(EventCategory category) {
        var list = categories.get(category);
        return list == null ? 0 : list.size();
    }
    
    boolean isEmpty() {
        return categories.isEmpty();
    }
    
    private void dropIfEmpty(EventCategory category, List<ObserverRef> list) {
        if (list.isEmpty()) {
            categories.remove(category);
        }
    }
    
    private static int indexOf(List<ObserverRef> list, Observer observer) {
        for (int i = 0; i < list.size(); ++i) {
            if (list.get(i).refersTo(observer)) {
                return i;
            }
        }
        return -1;
    }
}
