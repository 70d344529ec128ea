package tech.yump.sealmail.entity.message;

import java.util.Date;
import java.util.List;

/**
 * The JSON document sealed in a message's {@code rfc822Header}. Address lists absent from the
 * document are empty, never {@code null}. {@code date} is read as epoch milliseconds or an
 * ISO-8601 timestamp.
 */
public record EmailHeaderDetails(
        List<EmailMessageAddress> from,
        List<EmailMessageAddress> to,
        List<EmailMessageAddress> cc,
        List<EmailMessageAddress> bcc,
        List<EmailMessageAddress> replyTo,
        boolean hasAttachments,
        String subject,
        Date date,
        String inReplyTo,
        List<String> references) {

  public EmailHeaderDetails {
    from = copyOrEmpty(from);
    to = copyOrEmpty(to);
    cc = copyOrEmpty(cc);
    bcc = copyOrEmpty(bcc);
    replyTo = copyOrEmpty(replyTo);
    date = date == null ? null : new Date(date.getTime());
  }

  @Override
  public Date date() {
    return date == null ? null : new Date(date.getTime());
  }

  private static <T> List<T> copyOrEmpty(List<T> values) {
    return values == null ? List.of() : List.copyOf(values);
  }
}
