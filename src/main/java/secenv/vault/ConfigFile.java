package secenv.vault;

import secenv.prim.MalformedDataException;
import secenv.prim.storage.LocalDirectory;
import secenv.vault.types.RemoteConfig;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * The remote configuration, kept in <code>&lt;storage root&gt;/config/config.json</code>:
 * <pre>
 *   {
 *     // comments are allowed
 *     "github": {"token": "...", "repo": "owner/name"},
 *     "s3": {"bucket": "...", "region": "us-east-2"}
 *   }
 * </pre>
 * A missing file is an empty configuration.  A file that is not JSON, or that names a
 * repository not of the form <code>owner/name</code>, is a {@link MalformedDataException}.
 */
public class ConfigFile {

  public static final String DIRECTORY = "config";
  public static final String FILE_NAME = "config.json";

  private static class RawGitHub {
    public @Nullable String token;
    public @Nullable String repo;
  }

  private static class RawS3 {
    public @Nullable String bucket;
    public @Nullable String region;
  }

  private static class RawConfig {
    public @Nullable RawGitHub github;
    public @Nullable RawS3 s3;
  }

  private final LocalDirectory dir;
  private final ObjectMapper mapper;

  public ConfigFile(Path storageRoot) {
    this.dir = new LocalDirectory(storageRoot.resolve(DIRECTORY));
    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    this.mapper = new ObjectMapper(f);
    mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
  }

  public static boolean isLegalRepo(String repo) {
    return repo.matches("[^/\\s]+/[^/\\s]+");
  }

  public Path path() {
    return dir.resolve(FILE_NAME);
  }

  public RemoteConfig load() throws IOException, MalformedDataException {
    RawConfig r;
    try (InputStream in = dir.open(FILE_NAME)) {
      r = mapper.readValue(in, RawConfig.class);
    } catch (NoSuchFileException e) {
      return RemoteConfig.EMPTY;
    } catch (JsonProcessingException e) {
      throw new MalformedDataException("Config at " + path() + " is not valid JSON", e);
    }
    if (r == null) {
      return RemoteConfig.EMPTY;
    }

    String repo = r.github != null ? r.github.repo : null;
    if (repo != null && !isLegalRepo(repo)) {
      throw new MalformedDataException("Config at " + path() + " has malformed \"github.repo\" '" + repo + "' (expected owner/name)");
    }

    return new RemoteConfig(
            r.github != null ? r.github.token : null,
            repo,
            r.s3 != null ? r.s3.bucket : null,
            r.s3 != null ? r.s3.region : null);
  }

  public void save(RemoteConfig config) throws IOException {
    RawConfig r = new RawConfig();
    if (config.getGithubToken() != null || config.getGithubRepo() != null) {
      r.github = new RawGitHub();
      r.github.token = config.getGithubToken();
      r.github.repo = config.getGithubRepo();
    }
    if (config.getS3Bucket() != null || config.getS3Region() != null) {
      r.s3 = new RawS3();
      r.s3.bucket = config.getS3Bucket();
      r.s3.region = config.getS3Region();
    }
    dir.createOrReplace(FILE_NAME, mapper.writeValueAsBytes(r));
  }

}
