package tech.yump.sealmail.entity.result;

/**
 * A record that could not be unsealed, reduced to its unsealed fields, with the failure.
 */
public record PartialResult<P>(P partial, Exception cause) {
}
