package io.configurator.serialiser;

import io.configurator.serialiser.spi.ConfigFieldDescription;

/**
 * Per-kind callback used to walk a configuration object.
 *
 * @see ConfigFieldDescription#accept(FieldVisitor, Object)
 */
public interface FieldVisitor {
    void visitBoolean(ConfigFieldDescription field, Object parent);

    void visitInteger(ConfigFieldDescription field, Object parent);

    void visitString(ConfigFieldDescription field, Object parent);

    /**
     * @param field the nested configuration field
     * @param parent the object holding the field
     */
    void visitRecord(ConfigFieldDescription field, Object parent);

    /**
     * Fields of unsupported kinds (maps, lists, floating point, ...) are skipped by all configuration sources.
     *
     * @param field the skipped field
     * @param parent the object holding the field
     */
    default void visitUnsupported(final ConfigFieldDescription field, final Object parent) {
        // nothing to populate
    }
}
