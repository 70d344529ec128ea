package tech.yump.sealmail.entity.address;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import tech.yump.sealmail.entity.Owner;
import tech.yump.sealmail.entity.folder.PartialEmailFolder;

/**
 * The fields of an e-mail address that are available without unsealing.
 */
public record PartialEmailAddress(
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
        List<PartialEmailFolder> folders) {

  public PartialEmailAddress {
    owners = owners == null ? List.of() : List.copyOf(owners);
    folders = folders == null ? List.of() : List.copyOf(folders);
  }

  public static PartialEmailAddress of(SealedEmailAddress sealed) {
    List<PartialEmailFolder> folders = sealed.folders().stream()
            .map(PartialEmailFolder::of)
            .collect(Collectors.toList());
    return new PartialEmailAddress(sealed.id(), sealed.owner(), sealed.owners(), sealed.emailAddress(),
            sealed.size(), sealed.numberOfEmailMessages(), sealed.version(), sealed.createdAt(),
            sealed.updatedAt(), sealed.lastReceivedAt(), folders);
  }
}
