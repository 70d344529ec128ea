package tech.yump.sealmail.entity.folder;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import tech.yump.sealmail.entity.Owner;
import tech.yump.sealmail.sealing.SealedValue;

/**
 * An e-mail folder as stored by the remote service. {@code sealedCustomFolderName} is
 * {@code null} for folders without a custom name.
 */
@Builder(toBuilder = true)
public record SealedEmailFolder(
        String id,
        String owner,
        List<Owner> owners,
        String emailAddressId,
        String folderName,
        double size,
        int unseenCount,
        int version,
        Instant createdAt,
        Instant updatedAt,
        SealedValue sealedCustomFolderName) {

  public SealedEmailFolder {
    owners = owners == null ? List.of() : List.copyOf(owners);
  }
}
