package net.vortexdevelopment.vattribute.fixtures.annotations;

import net.vortexdevelopment.vattribute.annotation.Marker;
import net.vortexdevelopment.vattribute.fixtures.markers.Description;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.FIELD})
@Marker(Description.class)
public @interface Describe {
    String text();
}
