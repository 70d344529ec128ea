package tech.yump.sealmail.entity.address;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import tech.yump.sealmail.entity.Owner;
import tech.yump.sealmail.entity.folder.UnsealedEmailFolder;

@Builder
public record UnsealedEmailAddress(
        String id,
        String owner,
        List<Owner> owners,
        String emailAddress,
        double size,
        int numberOfEmailMessages,
        int version,
        Instant createdAt,
        Instant updatedAt,
        Instant lastReceivedAt,
        String alias,
        List<UnsealedEmailFolder> folders) {

  public UnsealedEmailAddress {
    owners = owners == null ? List.of() : List.copyOf(owners);
    folders = folders == null ? List.of() : List.copyOf(folders);
  }
}
