package tech.yump.sealmail.entity.blocklist;

import java.util.Optional;

/**
 * Outcome of unsealing one blocklist entry.
 */
public final class BlockedAddressStatus {

  public enum State {
    COMPLETED,
    FAILED
  }

  private static final BlockedAddressStatus COMPLETED = new BlockedAddressStatus(State.COMPLETED, null);

  private final State state;
  private final Exception cause;

  private BlockedAddressStatus(State state, Exception cause) {
    this.state = state;
    this.cause = cause;
  }

  public static BlockedAddressStatus completed() {
    return COMPLETED;
  }

  public static BlockedAddressStatus failed(Exception cause) {
    if (cause == null) {
      throw new IllegalArgumentException("A failed status requires a cause.");
    }
    return new BlockedAddressStatus(State.FAILED, cause);
  }

  public State state() {
    return state;
  }

  public boolean isCompleted() {
    return state == State.COMPLETED;
  }

  /**
   * @return The failure, present only for {@link State#FAILED}.
   */
  public Optional<Exception> cause() {
    return Optional.ofNullable(cause);
  }

  @Override
  public String toString() {
    return cause == null ? state.name() : state + "(" + cause.getMessage() + ")";
  }
}
