package secenv.vault.types;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * What a restore, import or pull wrote.
 */
@Value
public class RestoreResult {
  ProjectIdentity project;
  /** the project name recorded in the container, which may differ from {@link #project} */
  String originalProject;
  Instant timestamp;
  List<String> files;
}
