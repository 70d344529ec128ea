package tech.yump.sealmail.entity.blocklist;

/**
 * A blocklist entry after unsealing. When the status is failed, {@code address} is empty and only
 * the hashed value identifies the entry.
 */
public record UnsealedBlockedAddress(String hashedBlockedValue, String address, BlockedAddressStatus status,
                                     BlockedAddressAction action, String emailAddressId) {
}
