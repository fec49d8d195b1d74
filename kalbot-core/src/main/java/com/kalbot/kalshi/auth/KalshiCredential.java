package com.kalbot.kalshi.auth;

import lombok.NonNull;

import java.security.PrivateKey;

/**
 * API key id plus the RSA private key registered for it.
 */
public record KalshiCredential(@NonNull String keyId, @NonNull PrivateKey privateKey) {

  public KalshiCredential {
    if (keyId.isBlank()) {
      throw new IllegalArgumentException("keyId must not be blank");
    }
  }

  @Override
  public String toString() {
    return "KalshiCredential[keyId=" + keyId + ", privateKey=" + privateKey.getAlgorithm() + "/***]";
  }
}
