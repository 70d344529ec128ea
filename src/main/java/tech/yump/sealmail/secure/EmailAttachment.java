package tech.yump.sealmail.secure;

import java.util.Arrays;
import java.util.Objects;

/**
 * A named, typed blob carried by an e-mail message.
 *
 * @param fileName         File name of the attachment.
 * @param contentId        Content id, used to recognise secure e-mail attachments.
 * @param mimeType         MIME type of the data.
 * @param inlineAttachment Whether the attachment is displayed inline.
 * @param data             Raw attachment data.
 */
public record EmailAttachment(String fileName, String contentId, String mimeType, boolean inlineAttachment,
                              byte[] data) {

  public EmailAttachment {
    Objects.requireNonNull(fileName, "fileName");
    Objects.requireNonNull(contentId, "contentId");
    Objects.requireNonNull(mimeType, "mimeType");
    data = data == null ? new byte[0] : data.clone();
  }

  @Override
  public byte[] data() {
    return data.clone();
  }

  public boolean isEmpty() {
    return data.length == 0;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof EmailAttachment)) {
      return false;
    }
    EmailAttachment that = (EmailAttachment) o;
    return inlineAttachment == that.inlineAttachment
            && fileName.equals(that.fileName)
            && contentId.equals(that.contentId)
            && mimeType.equals(that.mimeType)
            && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return 31 * Objects.hash(fileName, contentId, mimeType, inlineAttachment) + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "EmailAttachment[fileName=" + fileName + ", contentId=" + contentId + ", mimeType=" + mimeType
            + ", inlineAttachment=" + inlineAttachment + ", size=" + data.length + "]";
  }
}
