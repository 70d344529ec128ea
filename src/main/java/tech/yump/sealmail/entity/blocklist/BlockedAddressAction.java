package tech.yump.sealmail.entity.blocklist;

/**
 * What the service does with mail from a blocked address.
 */
public enum BlockedAddressAction {
  DROP,
  SPAM
}
