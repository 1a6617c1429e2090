package secenv.vault.impls;

import secenv.vault.types.InvalidKeyConfig;
import secenv.vault.types.KeyMaterial;
import secenv.vault.types.KeyOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Decides which key material an operation uses.  Exactly one of a password or a
 * key file must be given.  Password strength is not checked here; that happens
 * when a key is derived from it.
 */
public class KeyResolver {

  public KeyMaterial resolve(KeyOptions options) throws InvalidKeyConfig {
    String password = options.getPassword();
    Path keyFile = options.getKeyFile();

    if (password != null && keyFile != null) {
      throw new InvalidKeyConfig(InvalidKeyConfig.Reason.MUTUALLY_EXCLUSIVE,
              "use either a password or a key file, not both");
    }

    if (keyFile != null) {
      try {
        return new KeyMaterial.RawKey(Files.readAllBytes(keyFile));
      } catch (IOException e) {
        throw new InvalidKeyConfig(InvalidKeyConfig.Reason.UNREADABLE,
                "cannot read key file " + keyFile, e);
      }
    }

    if (password != null) {
      return new KeyMaterial.Password(password);
    }

    throw new InvalidKeyConfig(InvalidKeyConfig.Reason.MISSING,
            "a password or a key file is required");
  }

}
