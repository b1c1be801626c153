package net.vortexdevelopment.vattribute.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Binds a Java annotation to the marker class it carries arguments for.
 * <p>
 * Elements of the bound annotation are matched by name to the marker's fields. Only
 * elements whose value differs from the element default are passed, so the marker's
 * own field initializers stay in charge of defaulting.
 *
 * <pre>
 * {@code
 * @Retention(RetentionPolicy.RUNTIME)
 * @Marker(Table.class)
 * public @interface TableName {
 *     String name() default "";
 * }
 * }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.ANNOTATION_TYPE)
public @interface Marker {

    /**
     * The marker class instantiated from this annotation.
     */
    Class<?> value();
}
