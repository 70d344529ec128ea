package tech.yump.sealmail.entity.message;

/**
 * A mailbox named in an RFC 822 header. {@code displayName} is {@code null} when the header
 * carries a bare address.
 */
public record EmailMessageAddress(String emailAddress, String displayName) {
}
