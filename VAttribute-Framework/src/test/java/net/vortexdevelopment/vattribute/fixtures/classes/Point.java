package net.vortexdevelopment.vattribute.fixtures.classes;

public class Point {
    public int x;
    public int y;
}
