package tech.yump.sealmail.entity.folder;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import tech.yump.sealmail.entity.Owner;

@Builder
public record UnsealedEmailFolder(
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
        String customFolderName) {

  public UnsealedEmailFolder {
    owners = owners == null ? List.of() : List.copyOf(owners);
  }
}
