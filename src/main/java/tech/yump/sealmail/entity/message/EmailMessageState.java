package tech.yump.sealmail.entity.message;

public enum EmailMessageState {
  QUEUED,
  SENT,
  DELIVERED,
  UNDELIVERED,
  FAILED,
  RECEIVED,
  UNKNOWN
}
