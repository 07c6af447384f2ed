package de.bsommerfeld.tassist.core.db.field;

import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.RowId;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MarshallerRegistryTest {

    private final MarshallerRegistry registry = new MarshallerRegistry();

    @Test
    void lookup_shouldResolvePrimitivesToWrapperMarshaller() {
        assertSame(ScalarMarshaller.INTEGER, registry.lookup(TypeToken.of(int.class)));
        assertSame(ScalarMarshaller.LONG, registry.lookup(TypeToken.of(long.class)));
        assertSame(ScalarMarshaller.BOOLEAN, registry.lookup(TypeToken.of(boolean.class)));
    }

    @Test
    void lookup_shouldReportSqlTypes() {
        assertEquals("TEXT", registry.lookup(TypeToken.of(String.class)).sqlType());
        assertEquals("INTEGER", registry.lookup(TypeToken.of(RowId.class)).sqlType());
        assertEquals("REAL", registry.lookup(TypeToken.of(double.class)).sqlType());
        assertEquals("TEXT", registry.lookup(TypeToken.of(LocalDate.class)).sqlType());
        assertEquals("TEXT", registry.lookup(new TypeToken<List<RowId>>() {
        }).sqlType());
    }

    @Test
    void lookup_shouldWrapOptionalOfSupportedType() {
        FieldMarshaller<?> marshaller = registry.lookup(new TypeToken<Optional<RowId>>() {
        });

        assertInstanceOf(OptionalMarshaller.class, marshaller);
        assertEquals("INTEGER", marshaller.sqlType());
        assertEquals(new TypeToken<Optional<RowId>>() {
        }, marshaller.javaType());
    }

    @Test
    void lookup_shouldRejectUnsupportedTypes() {
        assertFalse(registry.supports(TypeToken.of(StringBuilder.class)));
        assertFalse(registry.supports(new TypeToken<List<String>>() {
        }));
        assertFalse(registry.supports(new TypeToken<Optional<StringBuilder>>() {
        }));
        assertThrows(IllegalArgumentException.class, () -> registry.lookup(TypeToken.of(Object.class)));
    }

    @Test
    void empty_shouldSupportOnlyRegisteredTypes() {
        MarshallerRegistry empty = MarshallerRegistry.empty();
        assertFalse(empty.supports(TypeToken.of(String.class)));

        empty.register(ScalarMarshaller.STRING);

        assertTrue(empty.supports(TypeToken.of(String.class)));
        assertTrue(empty.supports(new TypeToken<Optional<String>>() {
        }));
    }
}
