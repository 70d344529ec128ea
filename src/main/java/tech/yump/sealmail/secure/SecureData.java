package tech.yump.sealmail.secure;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Encrypted e-mail body as carried by the body attachment.
 *
 * <pre>
 * {
 *   "encryptedData": "BASE64_ENCODED_CIPHERTEXT",
 *   "initVectorKeyID": "BASE64_ENCODED_IV"
 * }
 * </pre>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SecureData {

  /** AES/CBC/PKCS7Padding ciphertext of the body, base64. */
  @JsonProperty("encryptedData")
  private String encryptedDataBase64;

  /** The 16 byte initialization vector, base64. */
  @JsonProperty("initVectorKeyID")
  private String initVectorBase64;

  public SecureData(byte[] encryptedData, byte[] initVector) {
    if (encryptedData == null || initVector == null) {
      throw new IllegalArgumentException("Encrypted data and initialization vector cannot be null.");
    }
    this.encryptedDataBase64 = Base64.getEncoder().encodeToString(encryptedData);
    this.initVectorBase64 = Base64.getEncoder().encodeToString(initVector);
  }

  /**
   * @throws IllegalStateException    If the field is missing.
   * @throws IllegalArgumentException If the field is not valid base64.
   */
  @JsonIgnore
  public byte[] getEncryptedDataBytes() {
    if (encryptedDataBase64 == null) {
      throw new IllegalStateException("encryptedData is missing.");
    }
    return Base64.getDecoder().decode(encryptedDataBase64);
  }

  @JsonIgnore
  public byte[] getInitVectorBytes() {
    if (initVectorBase64 == null) {
      throw new IllegalStateException("initVectorKeyID is missing.");
    }
    return Base64.getDecoder().decode(initVectorBase64);
  }
}
