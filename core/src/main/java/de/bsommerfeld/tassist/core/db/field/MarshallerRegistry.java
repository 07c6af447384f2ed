package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeToken;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of {@link FieldMarshaller}s keyed by the Java type they handle.
 *
 * <p>
 * Primitive component types resolve to the marshaller of their wrapper.
 * {@code Optional<X>} needs no registration of its own: it resolves to an
 * {@link OptionalMarshaller} around the marshaller of {@code X}.
 *
 * <pre>
 * MarshallerRegistry registry = MarshallerRegistry.getDefault();
 * FieldMarshaller&lt;?&gt; marshaller = registry.lookup(TypeToken.of(LocalDate.class));
 * </pre>
 */
public class MarshallerRegistry {

    private final Map<TypeToken<?>, FieldMarshaller<?>> marshallers = new ConcurrentHashMap<>();

    /** A registry with the built-in marshallers. */
    public MarshallerRegistry() {
        registerDefaults();
    }

    private MarshallerRegistry(boolean registerDefaults) {
        if (registerDefaults) {
            registerDefaults();
        }
    }

    /** A registry without any marshallers. */
    public static MarshallerRegistry empty() {
        return new MarshallerRegistry(false);
    }

    /** The shared registry used by {@link de.bsommerfeld.tassist.core.db.TableDescriptor#of}. */
    public static MarshallerRegistry getDefault() {
        return DefaultHolder.INSTANCE;
    }

    private void registerDefaults() {
        register(ScalarMarshaller.STRING);
        register(ScalarMarshaller.INTEGER);
        register(ScalarMarshaller.LONG);
        register(ScalarMarshaller.DOUBLE);
        register(ScalarMarshaller.BOOLEAN);
        register(new RowIdMarshaller());
        register(new LocalDateMarshaller());
        register(new RowIdListMarshaller());
    }

    /** Registers or replaces the marshaller for its {@link FieldMarshaller#javaType()}. */
    public <T> void register(FieldMarshaller<T> marshaller) {
        marshallers.put(marshaller.javaType(), marshaller);
    }

    /**
     * Finds the marshaller for a field type.
     *
     * @throws IllegalArgumentException if the type is not supported
     */
    public FieldMarshaller<?> lookup(TypeToken<?> type) {
        return find(type).orElseThrow(() -> new IllegalArgumentException("no field marshaller for " + type));
    }

    public boolean supports(TypeToken<?> type) {
        return find(type).isPresent();
    }

    private Optional<FieldMarshaller<?>> find(TypeToken<?> type) {
        TypeToken<?> key = type.wrap();
        FieldMarshaller<?> marshaller = marshallers.get(key);
        if (marshaller != null) {
            return Optional.of(marshaller);
        }
        if (key.getRawType() == Optional.class) {
            TypeToken<?> element = key.resolveType(Optional.class.getTypeParameters()[0]);
            return find(element).map(inner -> optionalOf(inner));
        }
        return Optional.empty();
    }

    private static <T> FieldMarshaller<?> optionalOf(FieldMarshaller<T> inner) {
        return new OptionalMarshaller<>(inner);
    }

    private static final class DefaultHolder {
        private static final MarshallerRegistry INSTANCE = new MarshallerRegistry();
    }
}
