package tech.yump.sealmail.entity.message;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import tech.yump.sealmail.entity.Owner;

@Builder
public record UnsealedEmailMessage(
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
        EmailMessageEncryptionStatus encryptionStatus,
        List<EmailMessageAddress> from,
        List<EmailMessageAddress> to,
        List<EmailMessageAddress> cc,
        List<EmailMessageAddress> bcc,
        List<EmailMessageAddress> replyTo,
        boolean hasAttachments,
        String subject,
        Instant date) {

  public UnsealedEmailMessage {
    owners = owners == null ? List.of() : List.copyOf(owners);
    from = from == null ? List.of() : List.copyOf(from);
    to = to == null ? List.of() : List.copyOf(to);
    cc = cc == null ? List.of() : List.copyOf(cc);
    bcc = bcc == null ? List.of() : List.copyOf(bcc);
    replyTo = replyTo == null ? List.of() : List.copyOf(replyTo);
  }
}
