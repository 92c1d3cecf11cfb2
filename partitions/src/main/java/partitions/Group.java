package partitions;

import partitions.exceptions.PartitionFormatException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An id and name for a group of students.
 *
 * <p>The id should be unique within the {@link UserPartition} the group
 * appears in. Groups are immutable and compare by value.
 *
 * <p>Groups are serialized into course content, so the JSON form carries a
 * {@link #VERSION} to allow reading older layouts later.
 *
 * @see UserPartition
 */
public final class Group {

    /** Current serialization version. */
    public static final int VERSION = 1;

    private final int id;
    private final String name;

    /**
     * Creates a new group.
     *
     * @param id the group id, unique within its partition
     * @param name the display name
     */
    public Group(int id, String name) {
        this.id = id;
        this.name = name;
    }

    /**
     * Creates a new group, coercing the id to an integer.
     *
     * @param id an Integer, another Number, or a decimal String
     * @param name the display name
     * @return the new group
     * @throws PartitionFormatException if the id is not an integer
     */
    public static Group of(Object id, String name) {
        return new Group(Ids.coerce(id), name);
    }

    /** Returns the group id. */
    public int id() { return id; }

    /** Returns the group name. */
    public String name() { return name; }

    /**
     * Serializes this group to its JSON map form.
     *
     * @return a map with {@code id}, {@code name} and {@code version}
     */
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", id);
        json.put("name", name);
        json.put("version", VERSION);
        return json;
    }

    /**
     * Deserializes a group from its JSON map form.
     *
     * <p>A {@code Group} instance is returned unchanged.
     *
     * @param value a Group, or a map with {@code id}, {@code name} and {@code version}
     * @return the group
     * @throws PartitionFormatException if a key is missing, the version is not
     *         {@value #VERSION}, the id is not an integer or the name is not a string
     */
    public static Group fromJson(Object value) {
        if (value instanceof Group group) {
            return group;
        }

        Map<?, ?> map = JsonValues.requireMap(value, "Group");
        JsonValues.requireKeys(map, "Group", "id", "name", "version");

        if (!JsonValues.isVersion(map.get("version"), VERSION)) {
            throw new PartitionFormatException("Group dict " + map + " has unexpected version");
        }

        return of(map.get("id"), JsonValues.stringOrNull(map, "Group", "name"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Group other)) return false;
        return id == other.id && Objects.equals(name, other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name);
    }

    @Override
    public String toString() {
        return "Group{id=" + id + ", name='" + name + "'}";
    }
}
