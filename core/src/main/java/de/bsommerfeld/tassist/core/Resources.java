package de.bsommerfeld.tassist.core;

import com.google.common.base.Preconditions;
import com.google.common.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Type-keyed store of singleton values shared by every subsystem of a
 * {@link Context}.
 *
 * <p>
 * Each entry is keyed by the exact type it was registered under: the runtime
 * class of the value for {@link #add(Object)}, or an explicit Guava
 * {@link TypeToken} for generic values such as a per-kind state arena. At most
 * one instance per key is resident and re-registration overwrites. Lookups
 * never consider subtypes or supertypes, so a {@code get(Object.class)} does
 * not find a {@code String}.
 *
 * <p>
 * The store is type-erased internally. Every read re-checks the stored
 * instance against the raw type of the requested key before handing it out; a
 * failing check means a value was smuggled in under a foreign key and is
 * reported as a {@link ClassCastException}.
 *
 * <p>
 * Absence is a normal result ({@link Optional#empty()}), never an exception.
 * Call sites that cannot proceed without a resource convert the absence into an
 * application error themselves, see {@link Context#requireResource(Class)}.
 */
public final class Resources {

    private static final Logger LOG = LoggerFactory.getLogger(Resources.class);

    private final Map<TypeToken<?>, Object> entries = new HashMap<>();

    /**
     * Registers {@code value} under its own runtime class, replacing any
     * previous instance of that class.
     */
    public <T> void add(T value) {
        Preconditions.checkNotNull(value, "resource must not be null");
        put(TypeToken.of(value.getClass()), value);
    }

    /**
     * Registers {@code value} under an explicit type key. Needed for generic
     * resources, whose runtime class alone cannot tell instantiations apart.
     */
    public <T> void add(TypeToken<T> type, T value) {
        Preconditions.checkNotNull(type, "type must not be null");
        Preconditions.checkNotNull(value, "resource must not be null");
        Preconditions.checkArgument(type.getRawType().isInstance(value),
                "%s is not an instance of %s", value.getClass().getName(), type);
        put(type, value);
    }

    public <T> Optional<T> get(Class<T> type) {
        return get(TypeToken.of(type));
    }

    public <T> Optional<T> get(TypeToken<T> type) {
        Object value = entries.get(type);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(verify(type, value));
    }

    public boolean has(Class<?> type) {
        return entries.containsKey(TypeToken.of(type));
    }

    public boolean has(TypeToken<?> type) {
        return entries.containsKey(type);
    }

    /**
     * Drops the resource registered under {@code type}.
     *
     * @return the removed instance, or empty if there was none
     */
    public <T> Optional<T> remove(Class<T> type) {
        TypeToken<T> key = TypeToken.of(type);
        Object value = entries.remove(key);
        return value == null ? Optional.empty() : Optional.of(verify(key, value));
    }

    public int size() {
        return entries.size();
    }

    private void put(TypeToken<?> type, Object value) {
        Object previous = entries.put(type, value);
        if (previous != null) {
            LOG.debug("Replaced resource {}", type);
        } else {
            LOG.trace("Registered resource {}", type);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T verify(TypeToken<T> type, Object value) {
        Class<? super T> raw = type.getRawType();
        if (!raw.isInstance(value)) {
            throw new ClassCastException("resource registered as " + type
                    + " holds a " + value.getClass().getName());
        }
        return (T) value;
    }
}
