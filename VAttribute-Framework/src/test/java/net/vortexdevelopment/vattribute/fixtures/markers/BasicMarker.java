package net.vortexdevelopment.vattribute.fixtures.markers;

public class BasicMarker {
    public int a = 0;
    public int b = 0;
}
