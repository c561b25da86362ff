package net.certrevoke.client.core.transport;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import net.certrevoke.client.log.RevokeLogger;
import net.certrevoke.client.log.RevokeLoggerFactory;
import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;

/** {@link ResourceFetcher} backed by Apache HttpClient. Closing it closes the client. */
public class HttpClientResourceFetcher implements ResourceFetcher, Closeable {
  private static final RevokeLogger logger =
      RevokeLoggerFactory.getLogger(HttpClientResourceFetcher.class);

  private final CloseableHttpClient httpClient;

  public HttpClientResourceFetcher(CloseableHttpClient httpClient) {
    this.httpClient = httpClient;
  }

  /**
   * Builds a fetcher with its own HttpClient.
   *
   * @param connectionTimeoutMs connect and connection-request timeout
   * @param socketTimeoutMs socket read timeout
   * @return fetcher
   */
  public static HttpClientResourceFetcher create(int connectionTimeoutMs, int socketTimeoutMs) {
    RequestConfig config =
        RequestConfig.custom()
            .setConnectTimeout(connectionTimeoutMs)
            .setConnectionRequestTimeout(connectionTimeoutMs)
            .setSocketTimeout(socketTimeoutMs)
            .build();
    logger.debug(
        "Building http client with connect timeout: {} ms, socket timeout: {} ms",
        connectionTimeoutMs,
        socketTimeoutMs);
    return new HttpClientResourceFetcher(
        HttpClientBuilder.create().setDefaultRequestConfig(config).useSystemProperties().build());
  }

  @Override
  public FetchResponse get(String url) throws IOException {
    return execute(toUri(url), new HttpGet());
  }

  @Override
  public FetchResponse post(String url, String contentType, byte[] body) throws IOException {
    HttpPost post = new HttpPost();
    post.setEntity(new ByteArrayEntity(body, ContentType.create(contentType)));
    return execute(toUri(url), post);
  }

  @Override
  public void close() throws IOException {
    logger.debug("Closing http client");
    httpClient.close();
  }

  private static URI toUri(String url) throws IOException {
    try {
      return new URI(url);
    } catch (URISyntaxException e) {
      throw new IOException("Invalid URL: " + url, e);
    }
  }

  private FetchResponse execute(URI uri, HttpRequestBase request) throws IOException {
    request.setURI(uri);
    logger.debug("Sending {} request to {}", request.getMethod(), request.getURI());
    try (CloseableHttpResponse response = httpClient.execute(request)) {
      int statusCode = response.getStatusLine().getStatusCode();
      HttpEntity entity = response.getEntity();
      byte[] body;
      if (entity == null) {
        body = new byte[0];
      } else {
        try (InputStream inputStream = entity.getContent()) {
          body = IOUtils.toByteArray(inputStream);
        }
      }
      logger.debug(
          "Received status {} with {} bytes from {}", statusCode, body.length, request.getURI());
      return new FetchResponse(statusCode, body);
    } catch (IllegalArgumentException e) {
      // HttpClient rejects malformed URIs with an unchecked exception
      throw new IOException("Invalid URL: " + request.getURI(), e);
    }
  }
}
