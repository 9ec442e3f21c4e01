package de.conciso.plantdiag.model;

import java.util.Map;

/**
 * Ein Knoten des Wissensgraphen.
 * {@code type} ist das Label aus dem Snapshot (unverändert), {@link #kind()} die
 * daraus abgeleitete Kategorie. Alle übrigen Felder landen in {@code properties}.
 */
public record GraphNode(
        String id,
        String type,
        String name,
        String description,
        Map<String, String> properties
) {
    public GraphNode {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public NodeKind kind() {
        return NodeKind.fromType(type);
    }

    public boolean hasName() {
        return !name.isBlank();
    }

    /** Returns the extra field or {@code null} if absent or blank. */
    public String property(String key) {
        String value = properties.get(key);
        return value == null || value.isBlank() ? null : value;
    }
}
