package secenv.vault.types;

import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

@Value
public class ExportResult {
  ProjectIdentity project;
  Path exportPath;
  Instant timestamp;
  int fileCount;
}
