package tech.yump.sealmail.entity.message;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import lombok.Builder;
import tech.yump.sealmail.entity.Owner;
import tech.yump.sealmail.sealing.SealedValue;

/**
 * An e-mail message as stored by the remote service. Addresses, subject and date are only
 * available inside {@code rfc822Header}, which is sealed for the recipient's key pair: its
 * {@code keyId} names a private key and its {@code algorithmName} a public key algorithm.
 *
 * @param size Size in bytes of the sealed RFC 822 data held by the service.
 */
@Builder(toBuilder = true)
public record SealedEmailMessage(
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
        SealedValue rfc822Header) {

  public SealedEmailMessage {
    Objects.requireNonNull(rfc822Header, "rfc822Header");
    owners = owners == null ? List.of() : List.copyOf(owners);
    if (encryptionStatus == null) {
      encryptionStatus = EmailMessageEncryptionStatus.UNENCRYPTED;
    }
  }
}
