package secenv.vault.impls;

import secenv.vault.Util;
import secenv.vault.types.DecryptionFailure;
import secenv.vault.types.EncryptedBlob;
import secenv.vault.types.KeyMaterial;
import secenv.vault.types.ProjectIdentity;
import secenv.vault.types.WeakKey;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Arrays;

/**
 * AES-256-GCM with a 128-bit tag, keyed through {@link KeyDerivation}.
 *
 * <p>Every call to {@link #encrypt(byte[], KeyMaterial, ProjectIdentity) encrypt} draws a
 * fresh salt (so a fresh key) and a fresh nonce, so the same (key, nonce) pair is never
 * used twice.  The salt and nonce are stored next to the ciphertext.
 */
public class AuthenticatedCipher {

  public static final int SALT_LENGTH = 32;
  public static final int NONCE_LENGTH = 16;
  public static final int TAG_LENGTH = 16;

  private static final String TRANSFORMATION = "AES/GCM/NoPadding";

  private final KeyDerivation kdf;

  public AuthenticatedCipher(KeyDerivation kdf) {
    this.kdf = kdf;
  }

  public EncryptedBlob encrypt(byte[] plaintext, KeyMaterial key, ProjectIdentity project) throws WeakKey {
    byte[] salt = Util.randomBytes(SALT_LENGTH);
    byte[] nonce = Util.randomBytes(NONCE_LENGTH);
    byte[] sealed;
    try {
      sealed = init(Cipher.ENCRYPT_MODE, kdf.derive(key, salt, project), nonce).doFinal(plaintext);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM encryption failed", e);
    }

    // JCA appends the tag to the ciphertext; it is stored separately.
    int split = sealed.length - TAG_LENGTH;
    return new EncryptedBlob(
            Arrays.copyOfRange(sealed, 0, split),
            salt,
            nonce,
            Arrays.copyOfRange(sealed, split, sealed.length));
  }

  public byte[] decrypt(EncryptedBlob blob, KeyMaterial key, ProjectIdentity project) throws WeakKey, DecryptionFailure {
    if (blob.salt().length != SALT_LENGTH || blob.nonce().length != NONCE_LENGTH || blob.authTag().length != TAG_LENGTH) {
      throw new DecryptionFailure("malformed encrypted blob (salt, nonce or tag has the wrong length)");
    }

    Cipher cipher;
    try {
      cipher = init(Cipher.DECRYPT_MODE, kdf.derive(key, blob.salt(), project), blob.nonce());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("AES-GCM initialization failed", e);
    }

    try {
      return cipher.doFinal(Util.concat(blob.ciphertext(), blob.authTag()));
    } catch (AEADBadTagException e) {
      throw new DecryptionFailure("authentication failed: wrong key, or the data is corrupted", e);
    } catch (GeneralSecurityException e) {
      throw new DecryptionFailure("decryption failed", e);
    }
  }

  private static Cipher init(int mode, byte[] key, byte[] nonce) throws GeneralSecurityException {
    Cipher cipher = Cipher.getInstance(TRANSFORMATION);
    try {
      cipher.init(mode, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_LENGTH * 8, nonce));
    } finally {
      Arrays.fill(key, (byte)0);
    }
    return cipher;
  }

}
