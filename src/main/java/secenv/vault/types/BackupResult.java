package secenv.vault.types;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
public class BackupResult {
  ProjectIdentity project;
  List<String> files;
  Path container;
}
