package tech.yump.sealmail.secure;

/**
 * The two kinds of attachment that make up a secure e-mail bundle.
 */
public enum SecureEmailAttachmentType {

  KEY_EXCHANGE("Secure Data", "application/x-sudomail-key", "securekeyexchangedata@sudomail.com"),
  BODY("Secure Email", "application/x-sudomail-body", "securebody@sudomail.com");

  private final String fileName;
  private final String mimeType;
  private final String contentId;

  SecureEmailAttachmentType(String fileName, String mimeType, String contentId) {
    this.fileName = fileName;
    this.mimeType = mimeType;
    this.contentId = contentId;
  }

  public String fileName() {
    return fileName;
  }

  public String mimeType() {
    return mimeType;
  }

  public String contentId() {
    return contentId;
  }

  /**
   * @return true if {@code attachment} carries this type's content id.
   */
  public boolean matches(EmailAttachment attachment) {
    return attachment != null && contentId.equals(attachment.contentId());
  }

  /**
   * Builds an attachment of this type.
   *
   * @param fileName Name of the attachment; key attachments are numbered.
   */
  public EmailAttachment attachment(String fileName, byte[] data) {
    return new EmailAttachment(fileName, contentId, mimeType, false, data);
  }
}
