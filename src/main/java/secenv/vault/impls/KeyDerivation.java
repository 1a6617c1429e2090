package secenv.vault.impls;

import secenv.vault.Util;
import secenv.vault.types.KeyMaterial;
import secenv.vault.types.PasswordStrength;
import secenv.vault.types.ProjectIdentity;
import secenv.vault.types.WeakKey;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * Turns key material into a 256-bit AES key.
 *
 * <p>The derivation runs PBKDF2-HMAC-SHA256 three times, each round's output being
 * the next round's password:
 * <ol>
 *   <li>the key material itself with the random salt;</li>
 *   <li>with salt ‖ projectEntropy, which binds the key to the project name;</li>
 *   <li>with SHA-256(salt ‖ projectEntropy).</li>
 * </ol>
 * where projectEntropy = SHA-256(projectName ‖ {@value #FORMAT_TAG}).  Passwords must
 * pass {@link KeyValidator} first; raw key file bytes go straight in.
 *
 * <p>PBKDF2 is implemented here over {@link Mac} rather than through
 * <code>SecretKeyFactory</code> because rounds two and three take binary passwords,
 * which <code>PBEKeySpec</code> cannot represent.
 */
public class KeyDerivation {

  public static final int KEY_LENGTH_BYTES = 32;
  static final String FORMAT_TAG = "securedenv-v1";
  private static final String HMAC = "HmacSHA256";

  /**
   * Iteration counts for the three rounds.
   */
  public record Iterations(int stretch, int bind, int harden) {
    public static final Iterations DEFAULT = new Iterations(500_000, 100_000, 50_000);

    public Iterations {
      if (stretch < 1 || bind < 1 || harden < 1) {
        throw new IllegalArgumentException("iteration counts must be positive");
      }
    }
  }

  private final KeyValidator validator;
  private final Iterations iterations;

  public KeyDerivation(KeyValidator validator, Iterations iterations) {
    this.validator = validator;
    this.iterations = iterations;
  }

  public KeyDerivation() {
    this(new KeyValidator(), Iterations.DEFAULT);
  }

  public byte[] derive(KeyMaterial material, byte[] salt, ProjectIdentity project) throws WeakKey {
    if (material instanceof KeyMaterial.Password p) {
      PasswordStrength strength = validator.validate(p.value());
      if (!strength.strong()) {
        throw new WeakKey(strength);
      }
    }

    byte[] projectEntropy = Util.sha256(Util.utf8(project.name()), Util.utf8(FORMAT_TAG));
    byte[] boundSalt = Util.concat(salt, projectEntropy);

    byte[] input = material.derivationInput();
    byte[] key = pbkdf2(input, salt, iterations.stretch());
    Arrays.fill(input, (byte)0);
    key = rekey(key, boundSalt, iterations.bind());
    key = rekey(key, Util.sha256(boundSalt), iterations.harden());
    return key;
  }

  private static byte[] rekey(byte[] previous, byte[] salt, int rounds) {
    byte[] next = pbkdf2(previous, salt, rounds);
    Arrays.fill(previous, (byte)0);
    return next;
  }

  /**
   * PBKDF2 (RFC 8018) with HMAC-SHA256, producing {@value #KEY_LENGTH_BYTES} bytes.  Since
   * that is exactly one HMAC-SHA256 output, only the first block is ever computed.
   */
  static byte[] pbkdf2(byte[] password, byte[] salt, int rounds) {
    Mac mac;
    try {
      mac = Mac.getInstance(HMAC);
      // An empty key file is legal, but SecretKeySpec rejects empty keys.  HMAC pads
      // keys with zeros, so a single zero byte is the same key as no bytes at all.
      mac.init(new SecretKeySpec(password.length == 0 ? new byte[1] : password, HMAC));
    } catch (GeneralSecurityException e) {
      // All JREs are required to support HmacSHA256.
      throw new UnsupportedOperationException(e);
    }

    mac.update(salt);
    mac.update(new byte[] { 0, 0, 0, 1 });
    byte[] u = mac.doFinal();
    byte[] result = u.clone();
    for (int i = 1; i < rounds; ++i) {
      u = mac.doFinal(u);
      for (int j = 0; j < result.length; ++j) {
        result[j] ^= u[j];
      }
    }
    return result;
  }

}
