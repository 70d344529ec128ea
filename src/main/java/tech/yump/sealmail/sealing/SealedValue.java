package tech.yump.sealmail.sealing;

import java.util.Objects;

/**
 * A sealed attribute value as stored by the remote service.
 *
 * @param keyId                   Identifier of the key the value was sealed with.
 * @param algorithmName           Symmetric algorithm the value was sealed with.
 * @param plainTextType           Type hint of the plaintext, {@code "string"} for every value sealed here.
 * @param base64EncodedSealedData The ciphertext, standard base64.
 */
public record SealedValue(String keyId, String algorithmName, String plainTextType, String base64EncodedSealedData) {

  public static final String PLAIN_TEXT_TYPE_STRING = "string";

  public SealedValue {
    Objects.requireNonNull(keyId, "keyId");
    Objects.requireNonNull(algorithmName, "algorithmName");
    Objects.requireNonNull(plainTextType, "plainTextType");
    Objects.requireNonNull(base64EncodedSealedData, "base64EncodedSealedData");
  }

  @Override
  public String toString() {
    return "SealedValue[keyId=" + keyId + ", algorithmName=" + algorithmName
            + ", plainTextType=" + plainTextType + "]";
  }
}
