package secenv.vault.types;

import lombok.Value;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Where <code>--push</code> and <code>--pull</code> go.  Every field is optional;
 * an empty config is valid until something tries to use a remote.
 */
@Value
public class RemoteConfig {
  public static final RemoteConfig EMPTY = new RemoteConfig(null, null, null, null);

  @Nullable String githubToken;
  /** "owner/name" */
  @Nullable String githubRepo;
  @Nullable String s3Bucket;
  @Nullable String s3Region;

  public RemoteConfig withGitHub(@Nullable String token, @Nullable String repo) {
    return new RemoteConfig(
            token != null ? token : githubToken,
            repo != null ? repo : githubRepo,
            s3Bucket,
            s3Region);
  }

  @Override
  public String toString() {
    return "RemoteConfig(githubToken=" + (githubToken == null ? "none" : "***")
            + ", githubRepo=" + githubRepo
            + ", s3Bucket=" + s3Bucket
            + ", s3Region=" + s3Region + ')';
  }
}
