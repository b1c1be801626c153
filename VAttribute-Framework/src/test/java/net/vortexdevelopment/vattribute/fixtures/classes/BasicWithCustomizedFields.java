package net.vortexdevelopment.vattribute.fixtures.classes;

import net.vortexdevelopment.vattribute.fixtures.annotations.Fielded;
import net.vortexdevelopment.vattribute.fixtures.annotations.Prop;

@Fielded
public class BasicWithCustomizedFields {
    public int i;
    @Prop(a = "A")
    public String s;
    @Prop(b = "B")
    public float f;
}
