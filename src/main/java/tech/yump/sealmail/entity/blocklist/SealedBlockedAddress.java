package tech.yump.sealmail.entity.blocklist;

import java.util.Objects;
import tech.yump.sealmail.sealing.SealedValue;

/**
 * A blocklist entry as stored by the remote service.
 *
 * @param hashedBlockedValue Hash of the blocked address, usable without unsealing.
 * @param sealedValue        The blocked address, sealed with a symmetric key.
 * @param action             Action applied to mail from the address.
 * @param emailAddressId     The e-mail address the entry applies to, or {@code null} for all.
 */
public record SealedBlockedAddress(String hashedBlockedValue, SealedValue sealedValue, BlockedAddressAction action,
                                   String emailAddressId) {

  public SealedBlockedAddress {
    Objects.requireNonNull(hashedBlockedValue, "hashedBlockedValue");
    Objects.requireNonNull(sealedValue, "sealedValue");
    Objects.requireNonNull(action, "action");
  }
}
