package com.kalbot.kalshi.auth;

import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authentication material for exactly one outgoing request.
 */
public record SignedRequestContext(
    String keyId,
    String method,
    String path,
    long timestampMs,
    byte[] signature
) {

  public static final String KEY_HEADER = "KALSHI-ACCESS-KEY";
  public static final String TIMESTAMP_HEADER = "KALSHI-ACCESS-TIMESTAMP";
  public static final String SIGNATURE_HEADER = "KALSHI-ACCESS-SIGNATURE";

  public SignedRequestContext {
    signature = signature.clone();
  }

  @Override
  public byte[] signature() {
    return signature.clone();
  }

  public String signatureBase64() {
    return Base64.getEncoder().encodeToString(signature);
  }

  public Map<String, String> headers() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(KEY_HEADER, keyId);
    headers.put(TIMESTAMP_HEADER, Long.toString(timestampMs));
    headers.put(SIGNATURE_HEADER, signatureBase64());
    return headers;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SignedRequestContext other)) {
      return false;
    }
    return timestampMs == other.timestampMs
        && keyId.equals(other.keyId)
        && method.equals(other.method)
        && path.equals(other.path)
        && Arrays.equals(signature, other.signature);
  }

  @Override
  public int hashCode() {
    int result = keyId.hashCode();
    result = 31 * result + method.hashCode();
    result = 31 * result + path.hashCode();
    result = 31 * result + Long.hashCode(timestampMs);
    return 31 * result + Arrays.hashCode(signature);
  }

  @Override
  public String toString() {
    return "SignedRequestContext[" + method + " " + path + " @" + timestampMs + "]";
  }
}
