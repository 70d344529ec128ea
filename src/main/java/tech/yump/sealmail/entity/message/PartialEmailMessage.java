package tech.yump.sealmail.entity.message;

import java.time.Instant;
import java.util.List;
import tech.yump.sealmail.entity.Owner;

/**
 * The fields of an e-mail message that are available without unsealing its header.
 */
public record PartialEmailMessage(
        String id,
        String clientRefId,
        String owner,
        List<Owner> owners,
        String emailAddressId,
        String folderId,
        String previousFolderId,
        EmailMessageDirection direction,
        EmailMessageState state,
        boolean seen,
        boolean repliedTo,
        boolean forwarded,
        int version,
        Instant sortDate,
        Instant createdAt,
        Instant updatedAt,
        double size,
        EmailMessageEncryptionStatus encryptionStatus) {

  public PartialEmailMessage {
    owners = owners == null ? List.of() : List.copyOf(owners);
  }

  public static PartialEmailMessage of(SealedEmailMessage sealed) {
    return new PartialEmailMessage(sealed.id(), sealed.clientRefId(), sealed.owner(), sealed.owners(),
            sealed.emailAddressId(), sealed.folderId(), sealed.previousFolderId(), sealed.direction(),
            sealed.state(), sealed.seen(), sealed.repliedTo(), sealed.forwarded(), sealed.version(),
            sealed.sortDate(), sealed.createdAt(), sealed.updatedAt(), sealed.size(), sealed.encryptionStatus());
  }
}
