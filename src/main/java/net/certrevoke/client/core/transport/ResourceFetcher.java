package net.certrevoke.client.core.transport;

import java.io.IOException;

/**
 * Network access used to download CRLs, issuer certificates and OCSP responses. Transport failures
 * are reported as {@link IOException}; any answer from the server, successful or not, is returned
 * as a {@link FetchResponse}.
 */
public interface ResourceFetcher {
  FetchResponse get(String url) throws IOException;

  FetchResponse post(String url, String contentType, byte[] body) throws IOException;
}
