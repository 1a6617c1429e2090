package secenv.vault.types;

/**
 * The caller asked for key material in a way that cannot work.  Retrying with
 * the same inputs will fail the same way.
 */
public class InvalidKeyConfig extends Exception {

  public enum Reason {
    /** both a password and a key file were given */
    MUTUALLY_EXCLUSIVE,
    /** the key file is missing or cannot be read */
    UNREADABLE,
    /** neither a password nor a key file was given */
    MISSING,
  }

  private final Reason reason;

  public InvalidKeyConfig(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public InvalidKeyConfig(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
