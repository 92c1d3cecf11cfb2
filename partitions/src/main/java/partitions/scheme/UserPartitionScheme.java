package partitions.scheme;

import partitions.Group;
import partitions.UserPartition;

/**
 * Policy that decides which group of a partition a user belongs to.
 *
 * <p>Schemes are looked up by name through a {@link SchemeRegistry} and
 * instantiated once per name by a {@link SchemeResolver}. Implementations
 * usually extend {@link AbstractUserPartitionScheme}, which derives
 * {@link #name()} from the registry entry.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}PartitionScheme("first")
 * public class FirstGroupScheme extends AbstractUserPartitionScheme {
 *     public FirstGroupScheme(SchemeExtension extension) {
 *         super(extension);
 *     }
 *
 *     public Group getGroupForUser(UserPartition partition) {
 *         return partition.groups().isEmpty() ? null : partition.groups().get(0);
 *     }
 * }
 * </pre>
 *
 * @see AbstractUserPartitionScheme
 * @see SchemeResolver
 */
public interface UserPartitionScheme {

    /**
     * Returns the name of the registry entry that produced this scheme.
     *
     * @return the scheme name, or null if the scheme was built outside a registry
     */
    String name();

    /**
     * Returns the group the current user should be assigned to.
     *
     * @param partition the partition being queried
     * @return the assigned group, or null if the user is in none
     */
    Group getGroupForUser(UserPartition partition);

    /**
     * Returns true if this scheme computes the user's group on every call.
     *
     * <p>The default is false, meaning the group is assigned once and then
     * persisted for the user.
     */
    default boolean isDynamic() {
        return false;
    }
}
