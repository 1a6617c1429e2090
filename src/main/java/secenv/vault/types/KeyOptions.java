package secenv.vault.types;

import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;

/**
 * What the caller said about key material, before any of it is checked.  At most
 * one of the two fields should be set; see {@link secenv.vault.impls.KeyResolver}.
 */
@Value
public class KeyOptions {
  @Nullable String password;
  @Nullable Path keyFile;

  public static KeyOptions password(String password) {
    return new KeyOptions(password, null);
  }

  public static KeyOptions keyFile(Path keyFile) {
    return new KeyOptions(null, keyFile);
  }

  @Override
  public String toString() {
    return "KeyOptions(password=" + (password == null ? "none" : "***") + ", keyFile=" + keyFile + ')';
  }
}
