package secenv.vault.types;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Container metadata, readable without any key.
 */
@Value
public class BackupInfo {
  String project;
  String hash;
  Instant timestamp;
  List<String> files;
}
