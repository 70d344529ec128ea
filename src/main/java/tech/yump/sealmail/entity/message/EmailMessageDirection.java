package tech.yump.sealmail.entity.message;

public enum EmailMessageDirection {
  INBOUND,
  OUTBOUND,
  UNKNOWN
}
