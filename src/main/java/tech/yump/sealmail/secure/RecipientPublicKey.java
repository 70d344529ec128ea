package tech.yump.sealmail.secure;

import java.util.Arrays;
import java.util.Objects;
import tech.yump.sealmail.keys.PublicKeyFormat;

/**
 * Public key of one recipient of a secure e-mail.
 *
 * @param keyId     Identifier of the recipient's key pair.
 * @param publicKey DER encoded public key.
 * @param keyFormat Encoding of {@code publicKey}.
 */
public record RecipientPublicKey(String keyId, byte[] publicKey, PublicKeyFormat keyFormat) {

  public RecipientPublicKey {
    Objects.requireNonNull(keyId, "keyId");
    Objects.requireNonNull(publicKey, "publicKey");
    Objects.requireNonNull(keyFormat, "keyFormat");
    publicKey = publicKey.clone();
  }

  @Override
  public byte[] publicKey() {
    return publicKey.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RecipientPublicKey)) {
      return false;
    }
    RecipientPublicKey that = (RecipientPublicKey) o;
    return keyId.equals(that.keyId) && keyFormat == that.keyFormat && Arrays.equals(publicKey, that.publicKey);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(keyId, keyFormat) + Arrays.hashCode(publicKey);
  }

  @Override
  public String toString() {
    return "RecipientPublicKey[keyId=" + keyId + ", keyFormat=" + keyFormat + "]";
  }
}
