package io.configurator.serialiser.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declarative source mapping of a configuration field.
 *
 * <pre>{@code
 * public class ServerConfig {
 *     @Setting(value = "8080", file = "port", env = "HTTP_PORT")
 *     private int port;
 * }
 * }</pre>
 *
 * For nested configuration objects only {@link #file()} is evaluated: it names the JSON object holding the nested
 * fields.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.FIELD)
public @interface Setting {
    /**
     * Key value excluding a field from the configuration file.
     */
    String IGNORE_FILE_KEY = "-";

    /**
     * @return default literal, converted to the field type; empty leaves the field's initial value untouched
     */
    String value() default "";

    /**
     * @return JSON object key; empty defaults to the Java field name, {@value #IGNORE_FILE_KEY} excludes the field
     */
    String file() default "";

    /**
     * @return environment variable suffix appended to the environment prefix; also the origin of the flag name
     */
    String env() default "";
}
