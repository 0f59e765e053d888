package com.acme.gateway.web;

import com.acme.gateway.config.IdentityConfig;
import io.micronaut.http.HttpRequest;
import jakarta.inject.Singleton;
import java.net.InetSocketAddress;

/**
 * Rate-limit and audit identity of a caller: the API key id set by the authenticating proxy,
 * else the first forwarded client address, else the socket peer, else {@code anonymous}. The two
 * headers are only honoured when the socket peer is a configured trusted proxy.
 */
@Singleton
public class IdentityResolver {

  public static final String API_KEY_ID_HEADER = "X-API-Key-Id";
  static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
  static final String ANONYMOUS = "anonymous";
  private static final int MAX_IDENTITY_LENGTH = 128;

  private final IdentityConfig config;

  public IdentityResolver(IdentityConfig config) {
    this.config = config;
  }

  public String resolve(HttpRequest<?> request) {
    return resolve(
        peer(request),
        request.getHeaders().get(API_KEY_ID_HEADER),
        request.getHeaders().get(FORWARDED_FOR_HEADER));
  }

  /** The API key id when sent by a trusted proxy and well formed, else null. */
  public String apiKeyId(HttpRequest<?> request) {
    if (!config.isTrusted(peer(request))) {
      return null;
    }
    return clean(request.getHeaders().get(API_KEY_ID_HEADER));
  }

  String resolve(String peer, String keyHeader, String forwardedHeader) {
    if (config.isTrusted(peer)) {
      String keyId = clean(keyHeader);
      if (keyId != null) {
        return "key:" + keyId;
      }
      if (forwardedHeader != null) {
        String first = clean(forwardedHeader.split(",", 2)[0]);
        if (first != null) {
          return "ip:" + first;
        }
      }
    }
    return peer != null ? "ip:" + peer : ANONYMOUS;
  }

  private static String peer(HttpRequest<?> request) {
    InetSocketAddress remote = request.getRemoteAddress();
    if (remote == null || remote.getAddress() == null) {
      return null;
    }
    return remote.getAddress().getHostAddress();
  }

  private static String clean(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.isEmpty() || trimmed.length() > MAX_IDENTITY_LENGTH) {
      return null;
    }
    return trimmed;
  }
}
