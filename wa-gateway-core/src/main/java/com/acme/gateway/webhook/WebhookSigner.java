package com.acme.gateway.webhook;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/** HMAC-SHA256 signatures over webhook bodies, formatted {@code sha256=<hex>}. */
public final class WebhookSigner {

  public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
  public static final String ID_HEADER = "X-Webhook-Id";
  public static final String EVENT_HEADER = "X-Event-Type";

  private static final String ALGORITHM = "HmacSHA256";
  private static final String PREFIX = "sha256=";

  private WebhookSigner() {}

  public static String newSecret() {
    return "whsec_" + UUID.randomUUID().toString().replace("-", "");
  }

  public static String sign(String body, String secret) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      byte[] digest = mac.doFinal(body.getBytes(StandardCharsets.UTF_8));
      return PREFIX + HexFormat.of().formatHex(digest);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("HmacSHA256 not available", e);
    }
  }

  /** Constant-time comparison of a received signature header against the expected one. */
  public static boolean verify(String body, String secret, String signature) {
    if (signature == null) {
      return false;
    }
    byte[] expected = sign(body, secret).getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
  }
}
