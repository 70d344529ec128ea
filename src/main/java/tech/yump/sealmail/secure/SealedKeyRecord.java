package tech.yump.sealmail.secure;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import tech.yump.sealmail.keys.PublicKeyEncryptionAlgorithm;

/**
 * The message key wrapped for one recipient, as carried by a key exchange attachment.
 *
 * <pre>
 * {
 *   "publicKeyId": "RECIPIENT_KEY_ID",
 *   "encryptedKey": "BASE64_ENCODED_WRAPPED_KEY",
 *   "algorithm": "RSA_ECB_OAEPSHA1"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SealedKeyRecord {

  @JsonProperty("publicKeyId")
  private String publicKeyId;

  @JsonProperty("encryptedKey")
  private String encryptedKeyBase64;

  @JsonProperty("algorithm")
  private PublicKeyEncryptionAlgorithm algorithm;

  public SealedKeyRecord(String publicKeyId, byte[] encryptedKey, PublicKeyEncryptionAlgorithm algorithm) {
    if (publicKeyId == null || encryptedKey == null || algorithm == null) {
      throw new IllegalArgumentException("Public key id, encrypted key and algorithm cannot be null.");
    }
    this.publicKeyId = publicKeyId;
    this.encryptedKeyBase64 = Base64.getEncoder().encodeToString(encryptedKey);
    this.algorithm = algorithm;
  }

  /**
   * @throws IllegalStateException    If the field is missing.
   * @throws IllegalArgumentException If the field is not valid base64.
   */
  @JsonIgnore
  public byte[] getEncryptedKeyBytes() {
    if (encryptedKeyBase64 == null) {
      throw new IllegalStateException("encryptedKey is missing.");
    }
    return Base64.getDecoder().decode(encryptedKeyBase64);
  }
}
