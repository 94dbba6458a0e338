package com.tbpivot.model;

/**
 * A ThingsBoard entity (asset, device, ...) telemetry is fetched for.
 */
public class EntityRef {

    private final String type;
    private final String id;
    private final String name;

    public EntityRef(String type, String id, String name) {
        this.type = type;
        this.id = id;
        this.name = name;
    }

    public String getType() { return type; }
    public String getId() { return id; }

    /**
     * Label used in table rows and column names
     */
    public String getName() { return name; }

    @Override
    public String toString() {
        return type + "/" + id + " (" + name + ")";
    }
}
