package de.bsommerfeld.tassist.db;

import com.google.common.base.Splitter;
import com.google.common.reflect.TypeToken;
import de.bsommerfeld.tassist.core.db.FieldInfo;
import de.bsommerfeld.tassist.core.db.RowId;
import de.bsommerfeld.tassist.core.error.InvalidArgumentsException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns user-typed text into a value for a record field, so that what is
 * stored reads back through the field's marshaller.
 *
 * <p>
 * Text is taken as-is for {@code String} fields. Numbers, booleans
 * ({@code true}/{@code false}), ISO dates and row ids are parsed. An
 * {@code Optional} field accepts the empty string as "no value"; a
 * {@code List<RowId>} field takes comma separated ids.
 */
final class FieldParser {

    private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();

    private FieldParser() {
    }

    static boolean isEditable(FieldInfo field) {
        return isEditable(field.type());
    }

    static Object parse(FieldInfo field, String text) throws InvalidArgumentsException {
        try {
            return parse(field.type(), text);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new InvalidArgumentsException(
                    "'" + text + "' is not a valid value for " + field.column() + " (" + describe(field.type()) + ")", e);
        }
    }

    private static Object parse(TypeToken<?> type, String text) throws InvalidArgumentsException {
        Class<?> raw = type.wrap().getRawType();
        if (raw == Optional.class) {
            TypeToken<?> element = type.resolveType(Optional.class.getTypeParameters()[0]);
            return text.isBlank() ? Optional.empty() : Optional.of(parse(element, text));
        }
        if (raw == List.class) {
            List<RowId> ids = new ArrayList<>();
            for (String part : COMMA.split(text)) {
                ids.add(RowId.of(Long.parseLong(part)));
            }
            return ids;
        }
        if (raw == String.class) {
            return text;
        }
        String trimmed = text.trim();
        if (raw == Long.class) {
            return Long.parseLong(trimmed);
        }
        if (raw == Integer.class) {
            return Integer.parseInt(trimmed);
        }
        if (raw == Double.class) {
            return Double.parseDouble(trimmed);
        }
        if (raw == Boolean.class) {
            if (!trimmed.equalsIgnoreCase("true") && !trimmed.equalsIgnoreCase("false")) {
                throw new InvalidArgumentsException("'" + text + "' is not true or false");
            }
            return Boolean.parseBoolean(trimmed);
        }
        if (raw == LocalDate.class) {
            return LocalDate.parse(trimmed);
        }
        if (raw == RowId.class) {
            return RowId.of(Long.parseLong(trimmed));
        }
        throw new InvalidArgumentsException("fields of type " + describe(type) + " cannot be set from text");
    }

    private static boolean isEditable(TypeToken<?> type) {
        Class<?> raw = type.wrap().getRawType();
        if (raw == Optional.class) {
            return isEditable(type.resolveType(Optional.class.getTypeParameters()[0]));
        }
        if (raw == List.class) {
            return type.resolveType(List.class.getTypeParameters()[0]).getRawType() == RowId.class;
        }
        return raw == String.class || raw == Long.class || raw == Integer.class || raw == Double.class
                || raw == Boolean.class || raw == LocalDate.class || raw == RowId.class;
    }

    private static String describe(TypeToken<?> type) {
        return type.toString()
                .replace("java.lang.", "")
                .replace("java.util.", "")
                .replace("java.time.", "")
                .replace(RowId.class.getPackageName() + ".", "");
    }
}
