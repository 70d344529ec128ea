package tech.yump.sealmail.secure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An encrypted e-mail body together with the symmetric key wrapped once for every recipient.
 * Key attachments keep their insertion order.
 */
public final class SecureBundle {

  private final Set<EmailAttachment> keyAttachments;
  private final EmailAttachment bodyAttachment;

  public SecureBundle(Set<EmailAttachment> keyAttachments, EmailAttachment bodyAttachment) {
    Objects.requireNonNull(keyAttachments, "keyAttachments");
    Objects.requireNonNull(bodyAttachment, "bodyAttachment");
    this.keyAttachments = Collections.unmodifiableSet(new LinkedHashSet<>(keyAttachments));
    this.bodyAttachment = bodyAttachment;
  }

  /**
   * Classifies the attachments of a received message by content id. Attachments that are not
   * part of a secure e-mail are ignored.
   *
   * @throws IllegalArgumentException If there is no key attachment or no body attachment.
   */
  public static SecureBundle fromAttachments(List<EmailAttachment> attachments) {
    Set<EmailAttachment> keys = new LinkedHashSet<>();
    EmailAttachment body = null;
    for (EmailAttachment attachment : attachments) {
      if (SecureEmailAttachmentType.KEY_EXCHANGE.matches(attachment)) {
        keys.add(attachment);
      } else if (SecureEmailAttachmentType.BODY.matches(attachment) && body == null) {
        body = attachment;
      }
    }
    if (keys.isEmpty()) {
      throw new IllegalArgumentException("No key exchange attachments found.");
    }
    if (body == null) {
      throw new IllegalArgumentException("No secure body attachment found.");
    }
    return new SecureBundle(keys, body);
  }

  public Set<EmailAttachment> keyAttachments() {
    return keyAttachments;
  }

  public EmailAttachment bodyAttachment() {
    return bodyAttachment;
  }

  /**
   * @return The key attachments in order, followed by the body attachment.
   */
  public List<EmailAttachment> toList() {
    List<EmailAttachment> attachments = new ArrayList<>(keyAttachments);
    attachments.add(bodyAttachment);
    return attachments;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SecureBundle)) {
      return false;
    }
    SecureBundle that = (SecureBundle) o;
    return keyAttachments.equals(that.keyAttachments) && bodyAttachment.equals(that.bodyAttachment);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keyAttachments, bodyAttachment);
  }

  @Override
  public String toString() {
    return "SecureBundle[keyAttachments=" + keyAttachments.size() + ", bodyAttachment=" + bodyAttachment + "]";
  }
}
