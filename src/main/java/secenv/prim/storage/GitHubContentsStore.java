package secenv.prim.storage;

import secenv.prim.NoValue;
import secenv.prim.PreconditionFailed;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * A {@link RemoteBlobStore} backed by a file in a hosted git repository, accessed
 * through the repository "contents" REST API.  Each write is a commit.  The blob's
 * git object hash (<code>sha</code>) serves as its revision; the server rejects an
 * update whose <code>sha</code> does not match the current file.
 */
public class GitHubContentsStore implements RemoteBlobStore {

  public static final URI DEFAULT_API = URI.create("https://api.github.com");

  private static final Duration TIMEOUT = Duration.ofSeconds(30);
  private static final String USER_AGENT = "secenv/1.0";
  private static final String ACCEPT = "application/vnd.github.v3+json";

  private final HttpClient httpClient;
  private final URI baseUri;
  private final String token;
  private final String repo;
  private final ObjectMapper mapper;

  public GitHubContentsStore(HttpClient httpClient, URI baseUri, String token, String repo) {
    if (!repo.matches("[^/\\s]+/[^/\\s]+")) {
      throw new IllegalArgumentException("repository must look like 'owner/name', got '" + repo + '\'');
    }
    this.httpClient = httpClient;
    this.baseUri = baseUri;
    this.token = token;
    this.repo = repo;
    this.mapper = new ObjectMapper();
    mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public static GitHubContentsStore connect(String token, String repo) {
    HttpClient client = HttpClient.newBuilder()
            .connectTimeout(TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    return new GitHubContentsStore(client, DEFAULT_API, token, repo);
  }

  private static String encodePath(String path) {
    StringBuilder result = new StringBuilder();
    for (String segment : path.split("/")) {
      if (segment.isEmpty()) {
        continue;
      }
      if (result.length() > 0) {
        result.append('/');
      }
      result.append(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
    }
    return result.toString();
  }

  private URI contentsUri(String path) {
    String base = baseUri.toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    return URI.create(base + "/repos/" + repo + "/contents/" + encodePath(path));
  }

  private HttpRequest.Builder request(String path) {
    return HttpRequest.newBuilder(contentsUri(path))
            .timeout(TIMEOUT)
            .header("Authorization", "token " + token)
            .header("User-Agent", USER_AGENT)
            .header("Accept", ACCEPT);
  }

  private HttpResponse<String> send(HttpRequest request) throws IOException {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted during " + request.method() + ' ' + request.uri());
    }
  }

  private static IOException apiError(HttpRequest request, HttpResponse<String> response) {
    return new IOException("contents API error: " + request.method() + ' ' + request.uri()
            + " returned " + response.statusCode() + ' ' + response.body());
  }

  @Override
  public Snapshot read(String path) throws IOException, NoValue {
    HttpRequest req = request(path).GET().build();
    HttpResponse<String> response = send(req);
    if (response.statusCode() == 404) {
      throw new NoValue(path);
    }
    if (response.statusCode() / 100 != 2) {
      throw apiError(req, response);
    }

    JsonNode body;
    try {
      body = mapper.readTree(response.body());
    } catch (JsonProcessingException e) {
      throw new IOException("contents API returned malformed JSON for " + path, e);
    }

    // Directories come back as arrays; treat them like a missing file.
    if (!body.isObject() || !"file".equals(body.path("type").asText())) {
      throw new NoValue(path);
    }
    String sha = body.path("sha").asText(null);
    String content = body.path("content").asText(null);
    if (sha == null || content == null) {
      throw new IOException("contents API response for " + path + " has no sha or content");
    }
    // Files over 1 MB come back with encoding "none" and empty content.
    String encoding = body.path("encoding").asText("base64");
    if (!"base64".equals(encoding)) {
      throw new IOException(path + " is too large for the contents API (1 MB limit); got encoding '" + encoding + "' and no content");
    }
    byte[] data;
    try {
      // The API wraps base64 content at 60 columns.
      data = Base64.getMimeDecoder().decode(content);
    } catch (IllegalArgumentException e) {
      throw new IOException("contents API returned undecodable content for " + path, e);
    }
    return new Snapshot(data, sha);
  }

  @Override
  public String write(String path, byte[] data, @Nullable String expectedRevision) throws IOException, PreconditionFailed {
    ObjectNode payload = mapper.createObjectNode();
    payload.put("message", "Update environment backup for " + path);
    payload.put("content", Base64.getEncoder().encodeToString(data));
    if (expectedRevision != null) {
      payload.put("sha", expectedRevision);
    }

    HttpRequest req = request(path)
            .header("Content-Type", "application/json")
            .PUT(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload), StandardCharsets.UTF_8))
            .build();
    HttpResponse<String> response = send(req);

    // 409: the sha we sent is stale.  422: we sent no sha but the file exists.
    if (response.statusCode() == 409 || response.statusCode() == 422) {
      throw new PreconditionFailed(path + " changed since revision " + expectedRevision + ": " + response.body());
    }
    if (response.statusCode() / 100 != 2) {
      throw apiError(req, response);
    }

    String sha;
    try {
      sha = mapper.readTree(response.body()).path("content").path("sha").asText(null);
    } catch (JsonProcessingException e) {
      throw new IOException("contents API returned malformed JSON after writing " + path, e);
    }
    if (sha == null) {
      throw new IOException("contents API did not report a new sha for " + path);
    }
    return sha;
  }

  @Override
  public String toString() {
    return baseUri + "/repos/" + repo;
  }

}
