package tech.yump.sealmail.secure.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.secure.EmailCryptoException.SecureDataParsingException;
import tech.yump.sealmail.secure.SealedKeyRecord;
import tech.yump.sealmail.secure.SecureData;

/**
 * JSON encoding of the records carried by secure e-mail attachments. Decoding checks that every
 * field is present and valid base64 and that the initialization vector is one AES block, so a
 * record returned by this codec can be used without further validation.
 */
@Slf4j
public class SecureDataCodec {

  /** AES block size; the only initialization vector length {@code AES/CBC} accepts. */
  public static final int INIT_VECTOR_LENGTH = 16;

  private final ObjectMapper objectMapper;

  public SecureDataCodec() {
    this(new ObjectMapper());
  }

  /**
   * @param objectMapper Mapper to use. A copy is taken and configured to ignore unknown fields.
   */
  public SecureDataCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public byte[] encodeSecureData(SecureData secureData) {
    return write(secureData);
  }

  public byte[] encodeSealedKeyRecord(SealedKeyRecord sealedKeyRecord) {
    return write(sealedKeyRecord);
  }

  /**
   * @throws SecureDataParsingException If the data is not a complete {@link SecureData} record.
   */
  public SecureData decodeSecureData(byte[] json) {
    SecureData secureData = read(json, SecureData.class);
    byte[] initVector;
    try {
      secureData.getEncryptedDataBytes();
      initVector = secureData.getInitVectorBytes();
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw new SecureDataParsingException("Invalid SecureData record: " + e.getMessage(), e);
    }
    if (initVector.length != INIT_VECTOR_LENGTH) {
      throw new SecureDataParsingException("Invalid SecureData record: initVectorKeyID must be "
              + INIT_VECTOR_LENGTH + " bytes, got " + initVector.length + ".", null);
    }
    return secureData;
  }

  /**
   * @throws SecureDataParsingException If the data is not a complete {@link SealedKeyRecord}.
   */
  public SealedKeyRecord decodeSealedKeyRecord(byte[] json) {
    SealedKeyRecord sealedKeyRecord = read(json, SealedKeyRecord.class);
    if (sealedKeyRecord.getPublicKeyId() == null || sealedKeyRecord.getAlgorithm() == null) {
      throw new SecureDataParsingException("Invalid SealedKeyRecord: publicKeyId and algorithm are required.", null);
    }
    try {
      sealedKeyRecord.getEncryptedKeyBytes();
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw new SecureDataParsingException("Invalid SealedKeyRecord: " + e.getMessage(), e);
    }
    return sealedKeyRecord;
  }

  private byte[] write(Object value) {
    try {
      return objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      // only reachable with a misconfigured mapper
      log.error("Failed to serialize {} to JSON.", value.getClass().getSimpleName(), e);
      throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
    }
  }

  private <T> T read(byte[] json, Class<T> type) {
    if (json == null || json.length == 0) {
      throw new SecureDataParsingException("No " + type.getSimpleName() + " data to parse.", null);
    }
    try {
      T value = objectMapper.readValue(json, type);
      if (value == null) {
        throw new SecureDataParsingException(type.getSimpleName() + " data is JSON null.", null);
      }
      return value;
    } catch (IOException e) {
      log.debug("Failed to parse {} JSON: {}", type.getSimpleName(), e.getMessage());
      throw new SecureDataParsingException("Failed to parse " + type.getSimpleName() + " JSON.", e);
    }
  }
}
