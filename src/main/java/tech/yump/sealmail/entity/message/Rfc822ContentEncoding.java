package tech.yump.sealmail.entity.message;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The transformations recorded in the {@code Content-Encoding} metadata of stored RFC 822 data.
 * Encodings are listed in the order they were applied, so they are undone last to first.
 */
public enum Rfc822ContentEncoding {
  /** Sealed for the recipient's key pair, as base64 text. */
  CRYPTO("sudoplatform-crypto"),
  /** Gzip compressed, as base64 text. */
  COMPRESSION("sudoplatform-compression"),
  /** Raw bytes; nothing to undo. */
  BINARY_DATA("sudoplatform-binary-data");

  /** Encodings assumed when the stored object carries no {@code Content-Encoding}. */
  public static final List<Rfc822ContentEncoding> DEFAULT = List.of(CRYPTO, BINARY_DATA);

  private final String headerValue;

  Rfc822ContentEncoding(String headerValue) {
    this.headerValue = headerValue;
  }

  public String headerValue() {
    return headerValue;
  }

  public static Rfc822ContentEncoding fromHeaderValue(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Rfc822ContentEncoding encoding : values()) {
      if (encoding.headerValue.equals(normalized)) {
        return encoding;
      }
    }
    throw new EmailMessageUnsealException("Invalid Content-Encoding value: " + value.trim());
  }

  /**
   * Parses a comma separated {@code Content-Encoding} value into the order the encodings must be
   * undone. A {@code null} value stands for {@link #DEFAULT}.
   *
   * @throws EmailMessageUnsealException If any value is not a known encoding.
   */
  public static List<Rfc822ContentEncoding> decodingOrder(String contentEncoding) {
    List<Rfc822ContentEncoding> applied = new ArrayList<>();
    if (contentEncoding == null) {
      applied.addAll(DEFAULT);
    } else {
      for (String value : contentEncoding.split(",")) {
        applied.add(fromHeaderValue(value));
      }
    }
    Collections.reverse(applied);
    return applied;
  }
}
