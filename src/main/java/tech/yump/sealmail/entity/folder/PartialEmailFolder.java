package tech.yump.sealmail.entity.folder;

import java.time.Instant;
import java.util.List;
import tech.yump.sealmail.entity.Owner;

/**
 * The fields of an e-mail folder that are available without unsealing.
 */
public record PartialEmailFolder(
        String id,
        String owner,
        List<Owner> owners,
        String emailAddressId,
        String folderName,
        double size,
        int unseenCount,
        int version,
        Instant createdAt,
        Instant updatedAt) {

  public PartialEmailFolder {
    owners = owners == null ? List.of() : List.copyOf(owners);
  }

  public static PartialEmailFolder of(SealedEmailFolder sealed) {
    return new PartialEmailFolder(sealed.id(), sealed.owner(), sealed.owners(), sealed.emailAddressId(),
            sealed.folderName(), sealed.size(), sealed.unseenCount(), sealed.version(), sealed.createdAt(),
            sealed.updatedAt());
  }
}
