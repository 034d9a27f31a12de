package alpha.eventsystem.event;

import static java.util.Objects.requireNonNull;

/**
 * The key under which observers subscribe and events are looked up.<p>
 * 
 * A category is derived either from an event type, or from an explicit string
 * tag. A type-derived category is never equal to a tag-derived category, even
 * if the tag happens to be the fully qualified name of the type.<p>
 * 
 * Categories are immutable values and safe to use as map keys.
 */
public final class EventCategory
{
    private static final ClassValue<EventCategory> TYPES = new ClassValue<>() {
        @Override
        protected EventCategory computeValue(Class<?> type) {
            return new EventCategory(type);
        }
    };
    
    /**
     * Returns the category of the given event type.<p>
     * 
     * Repeated calls with the same type return the same instance.
     * 
     * @param type of event
     * @return the category of the given event type
     * @throws NullPointerException if {@code type} is {@code null}
     * @throws IllegalArgumentException if {@code type} is an interface
     */
    public static EventCategory of(Class<? extends Event> type) {
        if (type.isInterface()) {
            // Lookup is by runtime type, which is never an interface
            throw new IllegalArgumentException(
                    "Event type can not be an interface: " + type.getName());
        }
        return TYPES.get(type);
    }
    
    /**
     * Returns the category identified by the given tag.
     * 
     * @param tag of category
     * @return the category identified by the given tag
     * @throws NullPointerException if {@code tag} is {@code null}
     * @throws IllegalArgumentException if {@code tag} is blank
     */
    public static EventCategory of(String tag) {
        if (tag.isBlank()) {
            throw new IllegalArgumentException("Tag is blank.");
        }
        return new EventCategory(tag);
    }
    
    // Class or String
    private final Object key;
    
    private EventCategory(Object key) {
        this.key = requireNonNull(key);
    }
    
    /**
     * Returns {@code true} if this category was created from a string tag,
     * otherwise {@code false}.
     * 
     * @return {@code true} if this category was created from a string tag
     */
    public boolean isTag() {
        return key instanceof String;
    }
    
    /**
     * Returns the tag, or the fully qualified name of the event type.
     * 
     * @return the name of this category
     */
    public String name() {
        return key instanceof Class ? ((Class<?>) key).getName() : (String) key;
    }
    
    @Override
    public int hashCode() {
        return key.hashCode();
    }
    
    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || obj.getClass() != EventCategory.class) {
            return false;
        }
        return key.equals(((EventCategory) obj).key);
    }
    
    @Override
    public String toString() {
        return EventCategory.class.getSimpleName() +
                (isTag() ? "{tag=" : "{type=") + name() + "}";
    }
}
