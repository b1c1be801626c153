package net.vortexdevelopment.vattribute.fixtures.markers;

import lombok.Getter;
import net.vortexdevelopment.vattribute.capability.ParsesProperties;

import java.util.Map;

@Getter
public class ModelMarker implements ParsesProperties<StoreMarker> {

    private transient Map<String, StoreMarker> properties;

    @Override
    public Class<StoreMarker> propertyMarker() {
        return StoreMarker.class;
    }

    @Override
    public void setProperties(Map<String, StoreMarker> properties) {
        this.properties = properties;
    }
}
