package secenv.vault.impls;

import secenv.vault.Util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

public abstract class KeyFiles {

  public static final int KEY_FILE_LENGTH = 32;

  /**
   * Write a new random key file.  The file is created exclusively, so an existing
   * key (and every backup made with it) is never clobbered.
   *
   * @param target where to write the key
   * @throws java.nio.file.FileAlreadyExistsException if <code>target</code> exists
   * @throws IOException if the file cannot be written
   */
  public static void generate(Path target) throws IOException {
    byte[] key = Util.randomBytes(KEY_FILE_LENGTH);
    try (OutputStream out = Files.newOutputStream(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
      out.write(key);
    } finally {
      Arrays.fill(key, (byte)0);
    }
  }

}
