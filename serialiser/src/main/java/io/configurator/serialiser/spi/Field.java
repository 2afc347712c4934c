package io.configurator.serialiser.spi;

import java.lang.annotation.Annotation;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.InaccessibleObjectException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;

import org.jetbrains.annotations.NotNull;

/**
 * Reflection-based access to configuration fields including those w/o direct access from user-code (private,
 * package-private or protected members).
 *
 * <p> N.B. access checks are suppressed once at construction. Primitive fields are boxed/unboxed transparently.
 */
public class Field implements AnnotatedElement {
    private final java.lang.reflect.Field jdkField;
    private final boolean primitive;
    private final Type genericType;
    private final boolean accessible;
    private Annotation[] declaredAnnotations;

    Field(final java.lang.reflect.Field jdkField) {
        this.jdkField = jdkField;
        this.genericType = jdkField.getGenericType();
        primitive = jdkField.getType().isPrimitive();
        accessible = makeAccessible(jdkField);
    }

    /**
     * Generic access to field values for a given class instance reference.
     *
     * @param classReference class instance the data should be retrieved for.
     * @return the value object contained by this field. Primitives are automatically boxed.
     * @throws IllegalStateException if the field cannot be accessed, e.g. it resides in a module not opened to this library
     */
    public Object get(final Object classReference) {
        try {
            return jdkField.get(classReference);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("cannot read field " + this, e);
        }
    }

    /**
     * Sets the (boxed) value of the field for a given class instance.
     *
     * @param classReference class instance the data should be written to.
     * @param value new value, unboxed automatically for primitive fields
     * @throws IllegalStateException if the field cannot be accessed
     * @throws IllegalArgumentException if the value does not match the field type (e.g. {@code null} for a primitive)
     */
    public void set(final Object classReference, final Object value) {
        if (primitive && value == null) {
            throw new IllegalArgumentException("cannot assign null to primitive-typed field " + this);
        }
        try {
            jdkField.set(classReference, value);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("cannot write field " + this, e);
        }
    }

    @Override
    public <T extends Annotation> T getAnnotation(@NotNull final Class<T> annotationClass) {
        return jdkField.getAnnotation(annotationClass);
    }

    @Override
    public final Annotation @NotNull[] getAnnotations() {
        return getDeclaredAnnotations();
    }

    @Override
    public Annotation @NotNull[] getDeclaredAnnotations() {
        if (declaredAnnotations == null) {
            declaredAnnotations = jdkField.getDeclaredAnnotations();
        }
        return declaredAnnotations;
    }

    /**
     * @return the {@code Class} object representing the class or interface that declares this {@code Field} object.
     */
    public final Class<?> getDeclaringClass() {
        return jdkField.getDeclaringClass();
    }

    /**
     * @return {@code Type} object that represents the declared (possibly parameterised) type for this field
     */
    public final Type getGenericType() {
        return genericType;
    }

    /**
     * @return the Java language modifiers for the field represented by this {@code Field} object, as an integer.
     */
    public final int getModifiers() {
        return jdkField.getModifiers();
    }

    /**
     * @return the name of the field represented by this {@code Field} object.
     */
    public final String getName() {
        return jdkField.getName();
    }

    /**
     * @return {@code Class} object that identifies the declared type for this {@code Field} object.
     */
    public final Class<?> getType() {
        return jdkField.getType();
    }

    /**
     * @return {@code false} if access checks could not be suppressed (field belongs to a closed module)
     */
    public final boolean isAccessible() {
        return accessible;
    }

    public final boolean isFinal() {
        return Modifier.isFinal(jdkField.getModifiers());
    }

    /**
     * @return {@code true} if the field is a primitive (e.g. boolean, int, long), {@code false} otherwise.
     */
    public final boolean isPrimitive() {
        return primitive;
    }

    public final boolean isPrivate() {
        return Modifier.isPrivate(jdkField.getModifiers());
    }

    public final boolean isPublic() {
        return Modifier.isPublic(jdkField.getModifiers());
    }

    public final boolean isStatic() {
        return Modifier.isStatic(jdkField.getModifiers());
    }

    public final boolean isSynthetic() {
        return jdkField.isSynthetic();
    }

    public final boolean isTransient() {
        return Modifier.isTransient(jdkField.getModifiers());
    }

    @Override
    public String toString() {
        return getDeclaringClass().getName() + '.' + getName();
    }

    public static Field getField(@NotNull final Class<?> clazz, @NotNull final String fieldName) {
        try {
            return new Field(clazz.getDeclaredField(fieldName));
        } catch (NoSuchFieldException e) {
            throw new IllegalArgumentException("class " + clazz + " does not contain field named '" + fieldName + "'", e);
        }
    }

    private static boolean makeAccessible(final java.lang.reflect.Field jdkField) {
        try {
            jdkField.setAccessible(true); // NOSONAR - purposeful access to private configuration fields
            return true;
        } catch (InaccessibleObjectException | SecurityException e) {
            return false;
        }
    }
}
