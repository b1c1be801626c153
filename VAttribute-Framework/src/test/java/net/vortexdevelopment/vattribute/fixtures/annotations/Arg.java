package net.vortexdevelopment.vattribute.fixtures.annotations;

import net.vortexdevelopment.vattribute.annotation.Marker;
import net.vortexdevelopment.vattribute.fixtures.markers.ArgMarker;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.PARAMETER})
@Marker(ArgMarker.class)
public @interface Arg {
    String alias();
}
