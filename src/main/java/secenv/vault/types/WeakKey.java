package secenv.vault.types;

/**
 * A password did not meet the strength policy.  Choosing a different password
 * is the only fix; key files are never subject to the policy.
 */
public class WeakKey extends Exception {

  private final PasswordStrength strength;

  public WeakKey(PasswordStrength strength) {
    super(strength.message());
    this.strength = strength;
  }

  public PasswordStrength getStrength() {
    return strength;
  }
}
