package partitions.scanner.duplicate;

import partitions.Group;
import partitions.UserPartition;
import partitions.annotations.PartitionScheme;
import partitions.scheme.AbstractUserPartitionScheme;
import partitions.scheme.SchemeExtension;

@PartitionScheme("twin")
public class FirstDuplicateScheme extends AbstractUserPartitionScheme {

    public FirstDuplicateScheme(SchemeExtension extension) {
        super(extension);
    }

    @Override
    public Group getGroupForUser(UserPartition partition) {
        return null;
    }
}
