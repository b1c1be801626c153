package net.vortexdevelopment.vattribute.fixtures.annotations;

import net.vortexdevelopment.vattribute.annotation.Marker;
import net.vortexdevelopment.vattribute.fixtures.markers.TableMarker;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE})
@Marker(TableMarker.class)
public @interface Table {
    String name() default "";

    boolean includeStatic() default false;
}
