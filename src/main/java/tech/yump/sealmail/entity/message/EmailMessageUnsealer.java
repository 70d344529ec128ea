package tech.yump.sealmail.entity.message;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Base64;
import java.util.List;
import java.util.zip.GZIPInputStream;
import lombok.extern.slf4j.Slf4j;
import tech.yump.sealmail.entity.EntityUnsealer;
import tech.yump.sealmail.keys.KeyDescriptor;
import tech.yump.sealmail.keys.KeyKind;
import tech.yump.sealmail.sealing.SealedValue;
import tech.yump.sealmail.sealing.Unsealer;

/**
 * Unseals e-mail messages. The {@code rfc822Header} and the stored RFC 822 data are both sealed
 * envelopes for the recipient's key pair, named by the header's {@code keyId} and
 * {@code algorithmName}. Key store failures propagate unchanged.
 */
@Slf4j
public class EmailMessageUnsealer implements EntityUnsealer<SealedEmailMessage, UnsealedEmailMessage> {

  private final Unsealer unsealer;
  private final ObjectMapper objectMapper;

  public EmailMessageUnsealer(Unsealer unsealer) {
    this(unsealer, new ObjectMapper());
  }

  /**
   * @param objectMapper Mapper to use. A copy is taken and configured to ignore unknown fields.
   */
  public EmailMessageUnsealer(Unsealer unsealer, ObjectMapper objectMapper) {
    this.unsealer = unsealer;
    this.objectMapper = objectMapper.copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * @throws EmailMessageUnsealException If the unsealed header is not an {@link EmailHeaderDetails}
   *     document.
   */
  @Override
  public UnsealedEmailMessage unseal(SealedEmailMessage sealed) {
    log.trace("Unsealing header of message '{}'.", sealed.id());
    EmailHeaderDetails header = unsealHeader(sealed.rfc822Header());
    return UnsealedEmailMessage.builder()
            .id(sealed.id())
            .clientRefId(sealed.clientRefId())
            .owner(sealed.owner())
            .owners(sealed.owners())
            .emailAddressId(sealed.emailAddressId())
            .folderId(sealed.folderId())
            .previousFolderId(sealed.previousFolderId())
            .direction(sealed.direction())
            .state(sealed.state())
            .seen(sealed.seen())
            .repliedTo(sealed.repliedTo())
            .forwarded(sealed.forwarded())
            .version(sealed.version())
            .sortDate(sealed.sortDate())
            .createdAt(sealed.createdAt())
            .updatedAt(sealed.updatedAt())
            .size(sealed.size())
            .encryptionStatus(sealed.encryptionStatus())
            .from(header.from())
            .to(header.to())
            .cc(header.cc())
            .bcc(header.bcc())
            .replyTo(header.replyTo())
            .hasAttachments(header.hasAttachments())
            .subject(header.subject())
            .date(header.date() == null ? null : header.date().toInstant())
            .build();
  }

  public EmailHeaderDetails unsealHeader(SealedValue rfc822Header) {
    String json = unsealer.unseal(envelopeKey(rfc822Header), rfc822Header.base64EncodedSealedData());
    try {
      EmailHeaderDetails header = objectMapper.readValue(json, EmailHeaderDetails.class);
      if (header == null) {
        throw new EmailMessageUnsealException("Message header is JSON null.");
      }
      return header;
    } catch (IOException e) {
      log.debug("Failed to parse message header JSON: {}", e.getMessage());
      throw new EmailMessageUnsealException("Failed to parse message header JSON.", e);
    }
  }

  /**
   * Undoes the {@code Content-Encoding} of stored RFC 822 data, last applied encoding first.
   *
   * @param message         The message the data belongs to; its header names the key pair.
   * @param storedData      The data as fetched from storage.
   * @param contentEncoding The stored object's {@code Content-Encoding}, or {@code null} for
   *                        {@link Rfc822ContentEncoding#DEFAULT}.
   * @return The RFC 822 message bytes.
   * @throws EmailMessageUnsealException If an encoding is unknown or the data is not valid for it.
   */
  public byte[] unsealRfc822Data(SealedEmailMessage message, byte[] storedData, String contentEncoding) {
    List<Rfc822ContentEncoding> decodingOrder = Rfc822ContentEncoding.decodingOrder(contentEncoding);
    log.debug("Decoding RFC 822 data of message '{}' ({} bytes) through {}.",
            message.id(), storedData.length, decodingOrder);
    byte[] data = storedData;
    for (Rfc822ContentEncoding encoding : decodingOrder) {
      switch (encoding) {
        case CRYPTO:
          data = unsealer.unsealBytes(envelopeKey(message.rfc822Header()), data);
          break;
        case COMPRESSION:
          data = gunzip(decodeBase64(data));
          break;
        case BINARY_DATA:
          break;
        default:
          throw new IllegalStateException("Unhandled content encoding: " + encoding);
      }
    }
    return data;
  }

  private static KeyDescriptor envelopeKey(SealedValue rfc822Header) {
    return new KeyDescriptor(rfc822Header.keyId(), KeyKind.ASYMMETRIC, rfc822Header.algorithmName());
  }

  private static byte[] decodeBase64(byte[] data) {
    try {
      return Base64.getDecoder().decode(data);
    } catch (IllegalArgumentException e) {
      throw new EmailMessageUnsealException("Compressed RFC 822 data is not valid base64.", e);
    }
  }

  private static byte[] gunzip(byte[] compressed) {
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      return in.readAllBytes();
    } catch (IOException e) {
      throw new EmailMessageUnsealException("Failed to decompress RFC 822 data.", e);
    }
  }
}
