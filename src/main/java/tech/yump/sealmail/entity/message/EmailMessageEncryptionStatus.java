package tech.yump.sealmail.entity.message;

/**
 * Whether the message travelled end-to-end encrypted between platform users.
 */
public enum EmailMessageEncryptionStatus {
  ENCRYPTED,
  UNENCRYPTED,
  UNKNOWN
}
