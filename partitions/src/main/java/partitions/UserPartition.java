package partitions;

import partitions.exceptions.PartitionFormatException;
import partitions.scheme.SchemeResolver;
import partitions.scheme.UserPartitionScheme;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named way to partition users into groups, primarily for running experiments.
 *
 * <p>Each user is expected to be in at most one group of a partition. The id
 * is meant to be unique within the context the partition is used in (for
 * partitions of users within a course, unique per course). The
 * {@link UserPartitionScheme} decides which group a user is put into.
 *
 * <p>Group order matters: {@link #getGroup(int)} returns the first match.
 * Duplicate group ids are not rejected.
 *
 * <h2>Serialized versions:</h2>
 * <ul>
 *   <li>1 - no {@code scheme} key; the {@value #VERSION_1_SCHEME} scheme is assumed</li>
 *   <li>2 - {@code scheme} holds the scheme name</li>
 * </ul>
 *
 * @see Group
 * @see SchemeResolver
 */
public final class UserPartition {

    /** Current serialization version. */
    public static final int VERSION = 2;

    /** Scheme used for version 1 partitions, and when no scheme is given. */
    public static final String VERSION_1_SCHEME = "random";

    private final int id;
    private final String name;
    private final String description;
    private final List<Group> groups;
    private final UserPartitionScheme scheme;

    /**
     * Creates a partition with an already resolved scheme.
     *
     * @param id the partition id (coerced to an integer)
     * @param name the partition name
     * @param description the partition description
     * @param groups the groups, in lookup order
     * @param scheme the scheme; if null, {@value #VERSION_1_SCHEME} is resolved
     * @throws PartitionFormatException if the id is not an integer or the scheme cannot be resolved
     */
    public UserPartition(Object id, String name, String description, List<Group> groups,
                         UserPartitionScheme scheme) {
        this(id, name, description, groups, scheme, VERSION_1_SCHEME);
    }

    /**
     * Creates a partition whose scheme is resolved by name through {@link #getScheme(String)}.
     *
     * @param id the partition id (coerced to an integer)
     * @param name the partition name
     * @param description the partition description
     * @param groups the groups, in lookup order
     * @param schemeId the scheme name
     * @throws PartitionFormatException if the id is not an integer or the scheme is unrecognized
     */
    public UserPartition(Object id, String name, String description, List<Group> groups,
                         String schemeId) {
        this(id, name, description, groups, null, schemeId);
    }

    /**
     * Creates a partition using the {@value #VERSION_1_SCHEME} scheme.
     */
    public UserPartition(Object id, String name, String description, List<Group> groups) {
        this(id, name, description, groups, null, VERSION_1_SCHEME);
    }

    private UserPartition(Object id, String name, String description, List<Group> groups,
                          UserPartitionScheme scheme, String schemeId) {
        this.id = Ids.coerce(id);
        this.name = name;
        this.description = description;
        this.groups = List.copyOf(groups);
        this.scheme = scheme != null ? scheme : getScheme(schemeId);
    }

    /**
     * Returns the process-wide scheme registered under the given name.
     *
     * <p>Instances are built once per name and reused for the life of the process.
     *
     * @param name the scheme name
     * @return the scheme
     * @throws PartitionFormatException if the scheme is unrecognized
     * @see SchemeResolver#global()
     */
    public static UserPartitionScheme getScheme(String name) {
        return SchemeResolver.global().resolve(name);
    }

    /** Returns the partition id. */
    public int id() { return id; }

    /** Returns the partition name. */
    public String name() { return name; }

    /** Returns the partition description. */
    public String description() { return description; }

    /** Returns the groups, in lookup order. */
    public List<Group> groups() { return groups; }

    /** Returns the scheme assigning users to groups. */
    public UserPartitionScheme scheme() { return scheme; }

    /**
     * Returns the first group with the given id.
     *
     * @param groupId the group id
     * @return the group, or null if none matches
     */
    public Group getGroup(int groupId) {
        for (Group group : groups) {
            if (group.id() == groupId) {
                return group;
            }
        }
        return null;
    }

    /**
     * Serializes this partition to its JSON map form.
     *
     * @return a map with {@code id}, {@code name}, {@code scheme}, {@code description},
     *         {@code groups} and {@code version}
     */
    public Map<String, Object> toJson() {
        List<Map<String, Object>> groupsJson = new ArrayList<>(groups.size());
        for (Group group : groups) {
            groupsJson.add(group.toJson());
        }

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("id", id);
        json.put("name", name);
        json.put("scheme", scheme.name());
        json.put("description", description);
        json.put("groups", groupsJson);
        json.put("version", VERSION);
        return json;
    }

    /**
     * Deserializes a partition, resolving its scheme through the global resolver.
     *
     * @see #fromJson(Object, SchemeResolver)
     */
    public static UserPartition fromJson(Object value) {
        return fromJson(value, SchemeResolver::global);
    }

    /**
     * Deserializes a partition from its JSON map form.
     *
     * <p>A {@code UserPartition} instance is returned unchanged. Version 1
     * maps have no {@code scheme} key and get the {@value #VERSION_1_SCHEME}
     * scheme; version 2 maps must name their scheme.
     *
     * @param value a UserPartition, or a map in the serialized layout
     * @param resolver resolves the scheme name
     * @return the partition
     * @throws PartitionFormatException if a key is missing, the version is
     *         unsupported, the id is not an integer, the name or description
     *         is not a string, a group is invalid or the scheme is unrecognized
     */
    public static UserPartition fromJson(Object value, SchemeResolver resolver) {
        Objects.requireNonNull(resolver, "resolver");
        return fromJson(value, () -> resolver);
    }

    /**
     * The resolver is only obtained once the map itself has been validated.
     */
    static UserPartition fromJson(Object value, Supplier<SchemeResolver> resolver) {
        if (value instanceof UserPartition partition) {
            return partition;
        }

        Map<?, ?> map = JsonValues.requireMap(value, "UserPartition");
        JsonValues.requireKeys(map, "UserPartition", "id", "name", "description", "version", "groups");

        Object version = map.get("version");
        String schemeId;
        if (JsonValues.isVersion(version, 1)) {
            schemeId = VERSION_1_SCHEME;
        } else if (JsonValues.isVersion(version, VERSION)) {
            if (!map.containsKey("scheme")) {
                throw JsonValues.missingKey(map, "UserPartition", "scheme");
            }
            Object rawScheme = map.get("scheme");
            schemeId = rawScheme != null ? rawScheme.toString() : null;
        } else {
            throw new PartitionFormatException("UserPartition dict " + map + " has unexpected version");
        }

        if (!(map.get("groups") instanceof Collection<?> rawGroups)) {
            throw new PartitionFormatException("UserPartition dict " + map + " has non-list groups");
        }
        List<Group> groups = new ArrayList<>(rawGroups.size());
        for (Object rawGroup : rawGroups) {
            groups.add(Group.fromJson(rawGroup));
        }
        String name = JsonValues.stringOrNull(map, "UserPartition", "name");
        String description = JsonValues.stringOrNull(map, "UserPartition", "description");
        int id = Ids.coerce(map.get("id"));

        UserPartitionScheme scheme = resolver.get().resolve(schemeId);
        if (scheme == null) {
            throw new PartitionFormatException(
                    "UserPartition dict " + map + " has unrecognized scheme " + schemeId);
        }

        return new UserPartition(id, name, description, groups, scheme);
    }

    /**
     * Partitions are equal when their fields match; schemes are compared by name.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserPartition other)) return false;
        return id == other.id
                && Objects.equals(name, other.name)
                && Objects.equals(description, other.description)
                && groups.equals(other.groups)
                && Objects.equals(scheme.name(), other.scheme.name());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, groups, scheme.name());
    }

    @Override
    public String toString() {
        return "UserPartition{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", scheme=" + scheme.name() +
                ", groups=" + groups +
                '}';
    }
}
