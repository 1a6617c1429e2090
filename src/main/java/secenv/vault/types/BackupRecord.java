package secenv.vault.types;

import com.google.common.collect.ImmutableSortedMap;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A snapshot of one project's secret files, each encrypted separately.
 *
 * <p>File names are plain names relative to the project root.  None of them may
 * contain a path separator, be <code>.</code> or <code>..</code>, or end with the
 * container extension {@value #CONTAINER_EXTENSION}.
 */
public record BackupRecord(String projectName, String projectHash, Instant timestamp, Map<String, EncryptedBlob> files) {

  public static final String CONTAINER_EXTENSION = ".secenv";

  public BackupRecord {
    Objects.requireNonNull(projectName);
    Objects.requireNonNull(projectHash);
    Objects.requireNonNull(timestamp);
    for (String name : files.keySet()) {
      if (!isLegalFileName(name)) {
        throw new IllegalArgumentException("illegal file name in backup: '" + name + '\'');
      }
    }
    files = ImmutableSortedMap.copyOf(files);
  }

  public static boolean isLegalFileName(String name) {
    return !name.isEmpty()
            && !name.equals(".")
            && !name.equals("..")
            && !name.contains("/")
            && !name.contains("\\")
            && !name.endsWith(CONTAINER_EXTENSION);
  }

}
