package secenv.prim.storage;

import secenv.vault.Util;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.stream.Stream;

/**
 * A flat directory of named files on the local disk.
 *
 * <p>Writes are all-or-nothing: {@link #createOrReplace(String, InputStream)} writes a
 * temporary sibling file and renames it over the target once every byte is on disk.  A
 * crash or an exception part-way through leaves whatever was there before.  The rename
 * is atomic on filesystems that support it; elsewhere there is a short window in which
 * the target may be replaced non-atomically, but it is never half-written.
 *
 * <p>The directory itself is created on first write, not on construction, so that merely
 * looking for a file does not leave empty directories behind.
 */
public class LocalDirectory {

  private static final String TEMP_PREFIX = ".secenv-tmp-";
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path dir;

  public LocalDirectory(Path dir) {
    this.dir = dir;
  }

  public Path path() {
    return dir;
  }

  /**
   * Resolve an entry name against this directory.
   * @param name a plain file name
   * @return the path for that entry
   * @throws IllegalArgumentException if the name contains a path separator or is
   *   <code>.</code> or <code>..</code>
   */
  public Path resolve(String name) {
    if (name.isEmpty() || name.equals(".") || name.equals("..") || name.contains("/") || name.contains("\\")) {
      throw new IllegalArgumentException("not a plain file name: '" + name + '\'');
    }
    return dir.resolve(name);
  }

  /**
   * List the regular files in the directory (not recursively).
   * @return a stream of file names
   * @throws IOException if the directory cannot be read
   */
  public Stream<String> list() throws IOException {
    List<String> result;
    try (Stream<Path> entries = Files.list(dir)) {
      result = entries
              .filter(Files::isRegularFile)
              .map(p -> p.getFileName().toString())
              .toList();
    }
    return result.stream();
  }

  public boolean exists(String name) {
    return Files.isRegularFile(resolve(name));
  }

  public void createOrReplace(String name, InputStream data) throws IOException {
    Path target = resolve(name);
    Files.createDirectories(dir);
    Path tmp = Files.createTempFile(dir, TEMP_PREFIX, TEMP_SUFFIX);
    try {
      try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        OutputStream out = Channels.newOutputStream(channel);
        Util.copyStream(data, out);
        out.flush();
        channel.force(true);
      }
      try {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException | RuntimeException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException onCleanup) {
        e.addSuppressed(onCleanup);
      }
      throw e;
    }
  }

  public void createOrReplace(String name, byte[] data) throws IOException {
    createOrReplace(name, new ByteArrayInputStream(data));
  }

  /**
   * Open an entry for reading.
   * @param name the entry to read
   * @return an unbuffered stream
   * @throws NoSuchFileException if the entry does not exist
   * @throws IOException if the entry cannot be opened
   */
  public InputStream open(String name) throws IOException {
    return Files.newInputStream(resolve(name));
  }

  public byte[] read(String name) throws IOException {
    try (InputStream in = open(name)) {
      return Util.read(in);
    }
  }

  @Override
  public String toString() {
    return dir.toString();
  }

}
