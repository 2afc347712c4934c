package io.configurator.serialiser.spi;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.CharBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.configurator.serialiser.FieldKind;
import io.configurator.serialiser.FieldVisitor;
import io.configurator.serialiser.annotations.Setting;

/**
 * Tree description of a configuration class: one node per field, nested configuration objects carrying their own
 * children. The root node describes the configuration class itself.
 *
 * <p> Static and synthetic fields are not part of the tree, final fields only if they hold a nested configuration.
 * Fields whose type is already part of the path from the root are described as {@link FieldKind#UNSUPPORTED} since populating them would never terminate.
 */
public final class ConfigFieldDescription {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigFieldDescription.class);
    private static final Map<Class<?>, ConfigFieldDescription> DESCRIPTION_CACHE = new ConcurrentHashMap<>();
    private static final int INDENTATION_NUMBER_OF_SPACE = 4;
    private final int hierarchyDepth;
    private final Field field;
    private final String fieldName;
    private final String fieldNameRelative;
    private final ConfigFieldDescription parent;
    private final List<ConfigFieldDescription> children = new ArrayList<>();
    private final Class<?> classType;
    private final FieldKind kind;
    private final String defaultValue;
    private final String fileKey;
    private final String envSuffix;

    private ConfigFieldDescription(final Class<?> referenceClass) {
        hierarchyDepth = 0;
        parent = null;
        field = null; // NOPMD it's a root, no field definition available
        classType = referenceClass;
        fieldName = classType.getName();
        fieldNameRelative = "";
        kind = FieldKind.RECORD;
        defaultValue = "";
        fileKey = "";
        envSuffix = "";
    }

    private ConfigFieldDescription(final Field field, final ConfigFieldDescription parent, final FieldKind kind) {
        this.hierarchyDepth = parent.hierarchyDepth + 1;
        this.parent = parent;
        this.field = field;
        this.kind = kind;
        classType = field.getType();
        fieldName = field.getName();
        fieldNameRelative = parent.isRoot() ? fieldName : parent.getFieldNameRelative() + '.' + fieldName;

        final Setting setting = field.getAnnotation(Setting.class);
        defaultValue = setting == null || kind == FieldKind.RECORD ? "" : setting.value();
        envSuffix = setting == null || kind == FieldKind.RECORD ? "" : setting.env();
        fileKey = setting == null || setting.file().isEmpty() ? fieldName : setting.file();
    }

    /**
     * @param referenceClass configuration class
     * @return the (cached) field tree of the given class
     */
    public static ConfigFieldDescription of(@NotNull final Class<?> referenceClass) {
        Objects.requireNonNull(referenceClass, "referenceClass must not be null");
        if (FieldKind.fromClassType(referenceClass) != FieldKind.RECORD) {
            throw new IllegalArgumentException("not a configuration class: " + referenceClass.getName());
        }
        return DESCRIPTION_CACHE.computeIfAbsent(referenceClass, clazz -> {
            final ConfigFieldDescription root = new ConfigFieldDescription(clazz);
            exploreClass(clazz, root);
            return root;
        });
    }

    /**
     * Dispatches this field to the visitor callback matching its kind.
     *
     * @param visitor the per-kind handler
     * @param fieldParent the object holding this field (for the root: the configuration object itself)
     */
    public void accept(@NotNull final FieldVisitor visitor, @NotNull final Object fieldParent) {
        switch (kind) {
        case BOOLEAN:
            visitor.visitBoolean(this, fieldParent);
            break;
        case INTEGER:
            visitor.visitInteger(this, fieldParent);
            break;
        case STRING:
            visitor.visitString(this, fieldParent);
            break;
        case RECORD:
            visitor.visitRecord(this, fieldParent);
            break;
        case UNSUPPORTED:
        default:
            visitor.visitUnsupported(this, fieldParent);
            break;
        }
    }

    /**
     * Dispatches all children of this (record) node.
     *
     * @param visitor the per-kind handler
     * @param instance the object described by this node
     */
    public void acceptChildren(@NotNull final FieldVisitor visitor, @NotNull final Object instance) {
        for (final ConfigFieldDescription child : children) {
            child.accept(visitor, instance);
        }
    }

    /**
     * Returns the nested configuration object held by this field, allocating and assigning it when {@code null}.
     *
     * @param fieldParent the object holding this field
     * @return the nested object or {@code null} if it could not be allocated
     */
    public Object getOrAllocate(@NotNull final Object fieldParent) {
        if (isRoot()) {
            return fieldParent;
        }
        final Object current = getValue(fieldParent);
        if (current != null) {
            return current;
        }
        if (isFinal()) {
            LOGGER.atWarn().addArgument(fieldNameRelative).log("final nested configuration '{}' is null and cannot be assigned - skipped");
            return null;
        }
        final Object newFieldObj = newInstance(fieldParent);
        if (newFieldObj != null) {
            setValue(fieldParent, newFieldObj);
        }
        return newFieldObj;
    }

    /**
     * Allocates a new, unassigned instance of this field's type.
     *
     * @param fieldParent the object holding this field (needed as enclosing instance for inner classes)
     * @return the new object or {@code null} if the type cannot be instantiated
     */
    public Object newInstance(@NotNull final Object fieldParent) {
        try {
            final Constructor<?> constr;
            final Object newFieldObj;
            if (classType.getDeclaringClass() == null || java.lang.reflect.Modifier.isStatic(classType.getModifiers())) {
                constr = classType.getDeclaredConstructor();
                constr.setAccessible(true); // NOSONAR
                newFieldObj = constr.newInstance();
            } else {
                constr = classType.getDeclaredConstructor(classType.getDeclaringClass());
                constr.setAccessible(true); // NOSONAR
                newFieldObj = constr.newInstance(fieldParent);
            }
            return newFieldObj;
        } catch (InstantiationException | InvocationTargetException | SecurityException | NoSuchMethodException | IllegalAccessException | IllegalArgumentException e) {
            LOGGER.atError().setCause(e).addArgument(fieldNameRelative).addArgument(classType.getName()).log("error initialising nested configuration '{}' of type {}");
        }
        return null;
    }

    public ConfigFieldDescription findChildField(final String name) {
        for (final ConfigFieldDescription child : children) {
            if (child.getFieldName().equals(name)) {
                return child;
            }
        }
        return null;
    }

    public Object getValue(@NotNull final Object fieldParent) {
        return field == null ? fieldParent : field.get(fieldParent);
    }

    public void setValue(@NotNull final Object fieldParent, final Object value) {
        if (field == null) {
            throw new UnsupportedOperationException("cannot assign the root configuration object");
        }
        field.set(fieldParent, value);
    }

    /**
     * @return direct child fields (only populated for {@link FieldKind#RECORD} nodes)
     */
    public List<ConfigFieldDescription> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * @return the default literal, empty if none has been declared
     */
    public String getDefaultValue() {
        return defaultValue;
    }

    /**
     * @return the environment variable suffix, empty if none has been declared
     */
    public String getEnvSuffix() {
        return envSuffix;
    }

    public Field getField() {
        return field;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return relative field name within class hierarchy (ie. field_level0.field_level1.variable_0)
     */
    public String getFieldNameRelative() {
        return fieldNameRelative;
    }

    /**
     * @return JSON key of this field, the field name if not declared otherwise
     */
    public String getFileKey() {
        return fileKey;
    }

    public int getHierarchyDepth() {
        return hierarchyDepth;
    }

    public FieldKind getKind() {
        return kind;
    }

    public ConfigFieldDescription getParent() {
        return parent;
    }

    public Class<?> getType() {
        return classType;
    }

    /**
     * @return {@code true} if the field is declared as {@code long}/{@code Long}, ie. wider than {@code int}
     */
    public boolean isLongType() {
        return classType == long.class || classType == Long.class;
    }

    /**
     * @return {@code true} for {@code final} fields, only nested configurations are kept in the tree as such and
     *         populated in place without being reassigned
     */
    public boolean isFinal() {
        return field != null && field.isFinal();
    }

    public boolean isFileIgnored() {
        return Setting.IGNORE_FILE_KEY.equals(fileKey);
    }

    public boolean isRoot() {
        return hierarchyDepth == 0;
    }

    public void printFieldStructure() {
        printClassStructure(this, 0);
    }

    @Override
    public String toString() {
        return ConfigFieldDescription.class.getSimpleName() + " for: " + kind + " " + classType.getName() + " " + (isRoot() ? fieldName : fieldNameRelative) + " (hierarchyDepth = " + hierarchyDepth + ")";
    }

    private boolean isOnPath(final Class<?> type) {
        for (ConfigFieldDescription node = this; node != null; node = node.parent) {
            if (node.classType.equals(type)) {
                return true;
            }
        }
        return false;
    }

    private static void exploreClass(final Class<?> classType, final ConfigFieldDescription parent) {
        // call super types first, fields declared there precede the sub-class ones
        if (classType.getSuperclass() != null && !classType.getSuperclass().equals(Object.class)) {
            exploreClass(classType.getSuperclass(), parent);
        }

        Arrays.stream(classType.getDeclaredFields()).map(Field::new).forEach(pfield -> {
            if (pfield.isStatic() || pfield.isSynthetic() || pfield.getName().startsWith("this$")) {
                // constants and inner class back references are no configuration
                return;
            }
            FieldKind fieldKind = FieldKind.fromClassType(pfield.getType());
            if (pfield.isFinal() && fieldKind != FieldKind.RECORD) {
                // write-once values, final nested configurations are populated in place
                return;
            }
            if (fieldKind == FieldKind.RECORD && parent.isOnPath(pfield.getType())) {
                LOGGER.atWarn().addArgument(pfield).addArgument(pfield.getType().getName()).log("configuration field {} refers back to enclosing type {} - skipped");
                fieldKind = FieldKind.UNSUPPORTED;
            }
            if (!pfield.isAccessible() && fieldKind != FieldKind.UNSUPPORTED) {
                LOGGER.atWarn().addArgument(pfield).log("configuration field {} is not accessible (module not opened?) - skipped");
                fieldKind = FieldKind.UNSUPPORTED;
            }
            final ConfigFieldDescription child = new ConfigFieldDescription(pfield, parent, fieldKind); // NOPMD - necessary to allocate inside loop
            parent.children.add(child);
            if (fieldKind == FieldKind.RECORD) {
                exploreClass(pfield.getType(), child);
            }
        });
    }

    private static void printClassStructure(final ConfigFieldDescription field, final int recursionLevel) {
        final String mspace = spaces(recursionLevel * INDENTATION_NUMBER_OF_SPACE);
        if (field.getKind() == FieldKind.RECORD) {
            LOGGER.atInfo().addArgument(mspace).addArgument(field.getType().getName()).addArgument(field.getFieldName()).addArgument(field.getFileKey()).log("{}{} {} <file:'{}'>");
            field.getChildren().forEach(f -> printClassStructure(f, recursionLevel + 1));
            return;
        }
        LOGGER.atInfo().addArgument(mspace) //
                .addArgument(field.getKind())
                .addArgument(field.getFieldName())
                .addArgument(field.getDefaultValue())
                .addArgument(field.getFileKey())
                .addArgument(field.getEnvSuffix())
                .log("{}{} {} <default:'{}' file:'{}' env:'{}'>");
    }

    private static String spaces(final int spaces) {
        return CharBuffer.allocate(spaces).toString().replace('\0', ' ');
    }
}
