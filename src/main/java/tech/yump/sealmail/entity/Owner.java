package tech.yump.sealmail.entity;

/**
 * An owner of a record and the issuer that vouches for it.
 */
public record Owner(String id, String issuer) {
}
