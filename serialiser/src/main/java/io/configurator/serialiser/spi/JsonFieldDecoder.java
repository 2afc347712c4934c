package io.configurator.serialiser.spi;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.configurator.serialiser.FieldKind;

import com.jsoniter.JsonIterator;
import com.jsoniter.spi.JsonException;

/**
 * Decodes a JSON document onto a configuration object by matching object keys against the fields' file keys.
 *
 * <p> Keys are matched exactly first and case-insensitively second, unknown keys are ignored and {@code null}
 * values leave the field untouched. Fields of unsupported kind and fields with the file key {@code "-"} are never
 * written. All writes are staged and applied only once the complete document has been matched: a document that
 * fails to decode leaves the configuration object unchanged.
 */
public class JsonFieldDecoder {
    public static final String NOT_A_JSON_COMPATIBLE_DOCUMENT = "Not a JSON compatible document";
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFieldDecoder.class);

    /**
     * @param json raw document bytes (UTF-8)
     * @param config configuration object to be updated
     * @return number of fields that have been written
     * @throws DecodeException if the document is no valid JSON or its structure does not match the configuration class
     */
    public int decode(@NotNull final byte[] json, @NotNull final Object config) throws DecodeException {
        Objects.requireNonNull(config, "config must not be null");
        final Object document = parse(Objects.requireNonNull(json, "json must not be null"));
        if (document == null) {
            return 0; // 'null' document, nothing to do
        }

        final ConfigFieldDescription root = ConfigFieldDescription.of(config.getClass());
        final List<PendingWrite> pendingWrites = new ArrayList<>();
        match(root, config, document, pendingWrites);

        for (final PendingWrite write : pendingWrites) {
            write.field.setValue(write.fieldParent, write.value);
            LOGGER.atTrace().addArgument(write.field.getFieldNameRelative()).log("set '{}' from configuration file");
        }
        return (int) pendingWrites.stream().filter(w -> w.field.getKind().isValue()).count();
    }

    /**
     * @param json raw document bytes (UTF-8)
     * @return the single JSON value of the document
     * @throws DecodeException if the document is no valid JSON or anything but whitespace follows its value
     */
    protected static Object parse(final byte[] json) throws DecodeException {
        // JsonIterator#read stops after the first value: the document is enclosed in an array with a per-call end
        // marker so that any trailing content shows up as a parse error or as an unexpected array element
        final String endMarker = UUID.randomUUID().toString();
        final byte[] prefix = "[".getBytes(StandardCharsets.UTF_8);
        final byte[] suffix = ("\n,\"" + endMarker + "\"]").getBytes(StandardCharsets.UTF_8);
        final byte[] enclosed = new byte[prefix.length + json.length + suffix.length];
        System.arraycopy(prefix, 0, enclosed, 0, prefix.length);
        System.arraycopy(json, 0, enclosed, prefix.length, json.length);
        System.arraycopy(suffix, 0, enclosed, prefix.length + json.length, suffix.length);

        final Object enclosing;
        try (JsonIterator iter = JsonIterator.parse(enclosed)) {
            enclosing = iter.read();
        } catch (IOException | JsonException | NumberFormatException | ArrayIndexOutOfBoundsException e) {
            throw new DecodeException(NOT_A_JSON_COMPATIBLE_DOCUMENT, e);
        }
        if (!(enclosing instanceof List) || ((List<?>) enclosing).size() != 2 || !endMarker.equals(((List<?>) enclosing).get(1))) {
            throw new DecodeException(NOT_A_JSON_COMPATIBLE_DOCUMENT + ": exactly one JSON value expected");
        }
        return ((List<?>) enclosing).get(0);
    }

    private static void match(final ConfigFieldDescription record, final Object instance, final Object node, final List<PendingWrite> pendingWrites) throws DecodeException {
        if (!(node instanceof Map)) {
            throw new DecodeException("expected JSON object for '" + (record.isRoot() ? record.getFieldName() : record.getFieldNameRelative()) + "' but found: " + typeName(node));
        }
        final Map<?, ?> object = (Map<?, ?>) node;

        for (final ConfigFieldDescription child : record.getChildren()) {
            if (child.getKind() == FieldKind.UNSUPPORTED || child.isFileIgnored()) {
                continue;
            }
            final Object value = lookup(object, child.getFileKey());
            if (value == null) {
                // missing key or explicit 'null': keep the previous value
                continue;
            }
            if (child.getKind() == FieldKind.RECORD) {
                Object nested = child.getValue(instance);
                if (nested == null && child.isFinal()) {
                    LOGGER.atWarn().addArgument(child.getFieldNameRelative()).log("final nested configuration '{}' is null and cannot be assigned - skipped");
                    continue;
                }
                if (nested == null) {
                    nested = child.newInstance(instance);
                    if (nested == null) {
                        throw new DecodeException("cannot allocate nested configuration '" + child.getFieldNameRelative() + "'");
                    }
                    pendingWrites.add(new PendingWrite(child, instance, nested));
                }
                match(child, nested, value, pendingWrites);
                continue;
            }
            pendingWrites.add(new PendingWrite(child, instance, convert(child, value)));
        }
    }

    private static Object convert(final ConfigFieldDescription field, final Object value) throws DecodeException {
        switch (field.getKind()) {
        case BOOLEAN:
            if (value instanceof Boolean) {
                return value;
            }
            break;
        case STRING:
            if (value instanceof String) {
                return value;
            }
            break;
        case INTEGER:
            if (value instanceof Number && isIntegral((Number) value)) {
                final long number = ((Number) value).longValue();
                if (field.isLongType()) {
                    return number;
                }
                if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                    return (int) number;
                }
                throw new DecodeException("JSON number " + number + " overflows field '" + field.getFieldNameRelative() + "' of type " + field.getType().getName());
            }
            break;
        default:
            break;
        }
        throw new DecodeException("cannot assign JSON " + typeName(value) + " to field '" + field.getFieldNameRelative() + "' of type " + field.getType().getName());
    }

    private static boolean isIntegral(final Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte) {
            return true;
        }
        final double value = number.doubleValue();
        return value == Math.rint(value) && value >= Long.MIN_VALUE && value <= Long.MAX_VALUE;
    }

    private static Object lookup(final Map<?, ?> object, final String key) {
        if (object.containsKey(key)) {
            return object.get(key);
        }
        for (final Map.Entry<?, ?> entry : object.entrySet()) {
            if (entry.getKey() instanceof String && ((String) entry.getKey()).equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String typeName(final Object node) {
        if (node == null) {
            return "null";
        } else if (node instanceof Map) {
            return "object";
        } else if (node instanceof List) {
            return "array";
        } else if (node instanceof Number) {
            return "number " + node;
        } else if (node instanceof Boolean) {
            return "boolean " + node;
        }
        return "string \"" + node + '"';
    }

    private static final class PendingWrite {
        private final ConfigFieldDescription field;
        private final Object fieldParent;
        private final Object value;

        private PendingWrite(final ConfigFieldDescription field, final Object fieldParent, final Object value) {
            this.field = field;
            this.fieldParent = fieldParent;
            this.value = value;
        }
    }
}
