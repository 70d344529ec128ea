package tech.yump.sealmail.sealing;

import java.util.Arrays;

/**
 * Binary layout of a single-recipient sealed value: the symmetric key wrapped with the
 * recipient's RSA-2048 public key in bytes {@code [0, 256)}, followed by the payload encrypted
 * with that key. The payload carries no initialization vector.
 */
public final class SealedEnvelope {

  /** Size of the wrapped key zone, one RSA-2048 block. */
  public static final int WRAPPED_KEY_LENGTH = 256;

  private final byte[] wrappedKey;
  private final byte[] cipherBody;

  private SealedEnvelope(byte[] wrappedKey, byte[] cipherBody) {
    this.wrappedKey = wrappedKey;
    this.cipherBody = cipherBody;
  }

  /**
   * Splits sealed bytes into the wrapped key and payload zones.
   *
   * @throws UnsealerException.SealedDataTooShortException If fewer than 256 bytes are given.
   */
  public static SealedEnvelope parse(byte[] sealedData) {
    if (sealedData == null || sealedData.length < WRAPPED_KEY_LENGTH) {
      int length = sealedData == null ? 0 : sealedData.length;
      throw new UnsealerException.SealedDataTooShortException(
              "Sealed data is " + length + " bytes, expected at least " + WRAPPED_KEY_LENGTH + ".");
    }
    return new SealedEnvelope(
            Arrays.copyOfRange(sealedData, 0, WRAPPED_KEY_LENGTH),
            Arrays.copyOfRange(sealedData, WRAPPED_KEY_LENGTH, sealedData.length));
  }

  /**
   * Joins a wrapped key and payload into sealed bytes.
   *
   * @throws IllegalArgumentException If the wrapped key is not exactly 256 bytes.
   */
  public static byte[] compose(byte[] wrappedKey, byte[] cipherBody) {
    if (wrappedKey == null || wrappedKey.length != WRAPPED_KEY_LENGTH) {
      throw new IllegalArgumentException("Wrapped key must be exactly " + WRAPPED_KEY_LENGTH + " bytes.");
    }
    byte[] body = cipherBody == null ? new byte[0] : cipherBody;
    byte[] sealed = Arrays.copyOf(wrappedKey, WRAPPED_KEY_LENGTH + body.length);
    System.arraycopy(body, 0, sealed, WRAPPED_KEY_LENGTH, body.length);
    return sealed;
  }

  public byte[] wrappedKey() {
    return wrappedKey.clone();
  }

  public byte[] cipherBody() {
    return cipherBody.clone();
  }
}
