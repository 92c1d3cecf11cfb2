package partitions.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import partitions.Group;
import partitions.UserPartition;
import partitions.exceptions.PartitionFormatException;
import partitions.scheme.SchemeResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts groups and partitions to and from JSON text.
 *
 * <p>Text is parsed into the map form with Jackson and then handed to
 * {@link Group#fromJson(Object)} and {@link UserPartition#fromJson(Object, SchemeResolver)},
 * so all version handling stays in the value classes.
 */
public final class PartitionJsonCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<Object>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final SchemeResolver resolver;

    /**
     * Creates a codec resolving schemes through the global resolver.
     */
    public PartitionJsonCodec() {
        this(new ObjectMapper(), null);
    }

    /**
     * @param mapper the Jackson mapper used for text conversion
     * @param resolver resolves scheme names, or null for {@link SchemeResolver#global()}
     */
    public PartitionJsonCodec(ObjectMapper mapper, SchemeResolver resolver) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.resolver = resolver;
    }

    public String writeGroup(Group group) {
        return write(group.toJson());
    }

    public String writePartition(UserPartition partition) {
        return write(partition.toJson());
    }

    /**
     * Writes partitions as a JSON array, in order.
     */
    public String writePartitions(List<UserPartition> partitions) {
        List<Map<String, Object>> json = new ArrayList<>(partitions.size());
        for (UserPartition partition : partitions) {
            json.add(partition.toJson());
        }
        return write(json);
    }

    public Group readGroup(String text) {
        return Group.fromJson(read(text, MAP_TYPE));
    }

    public UserPartition readPartition(String text) {
        return UserPartition.fromJson(read(text, MAP_TYPE), resolver());
    }

    /**
     * Reads a JSON array of partitions.
     *
     * @param text JSON array text
     * @return the partitions, in array order
     * @throws PartitionFormatException if the text is malformed or any partition is invalid
     */
    public List<UserPartition> readPartitions(String text) {
        List<Object> raw = read(text, LIST_TYPE);
        SchemeResolver schemes = resolver();
        List<UserPartition> partitions = new ArrayList<>(raw.size());
        for (Object value : raw) {
            partitions.add(UserPartition.fromJson(value, schemes));
        }
        return partitions;
    }

    private SchemeResolver resolver() {
        return resolver != null ? resolver : SchemeResolver.global();
    }

    private String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PartitionFormatException("Failed to write JSON: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T read(String text, TypeReference<T> type) {
        T value;
        try {
            value = mapper.readValue(text, type);
        } catch (JsonProcessingException e) {
            throw new PartitionFormatException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (value == null) {
            throw new PartitionFormatException("Malformed JSON: null document");
        }
        return value;
    }
}
