package tech.yump.sealmail.entity.address;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import tech.yump.sealmail.entity.Owner;
import tech.yump.sealmail.entity.folder.SealedEmailFolder;
import tech.yump.sealmail.sealing.SealedValue;

/**
 * An e-mail address as stored by the remote service, with its folders.
 * {@code sealedAlias} is {@code null} for addresses without an alias.
 */
@Builder(toBuilder = true)
public record SealedEmailAddress(
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
        SealedValue sealedAlias,
        List<SealedEmailFolder> folders) {

  public SealedEmailAddress {
    owners = owners == null ? List.of() : List.copyOf(owners);
    folders = folders == null ? List.of() : List.copyOf(folders);
  }
}
