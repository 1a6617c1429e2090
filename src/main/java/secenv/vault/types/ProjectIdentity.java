package secenv.vault.types;

import secenv.vault.Util;

import java.nio.file.Path;

/**
 * Identifies a project by the name of its root directory.  Only the name matters,
 * not the full path: the same folder name on another machine, or in another place
 * on this one, is the same project.
 *
 * <p>The <code>hash</code> is the first 16 hex characters of SHA-256(name).  It names
 * the project's local storage directory, so that project names are not spelled out
 * on disk.
 */
public record ProjectIdentity(String name, String hash) {

  private static final int HASH_CHARS = 16;

  public static ProjectIdentity of(Path projectRoot) {
    Path fileName = projectRoot.toAbsolutePath().normalize().getFileName();
    if (fileName == null) {
      throw new IllegalArgumentException("cannot identify a project rooted at " + projectRoot);
    }
    return named(fileName.toString());
  }

  public static ProjectIdentity named(String name) {
    String hash = Util.toHex(Util.sha256(Util.utf8(name))).substring(0, HASH_CHARS);
    return new ProjectIdentity(name, hash);
  }

  @Override
  public String toString() {
    return name;
  }
}
