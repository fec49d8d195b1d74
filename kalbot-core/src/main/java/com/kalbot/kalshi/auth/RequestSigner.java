package com.kalbot.kalshi.auth;

import lombok.NonNull;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Locale;

/**
 * Signs {@code timestamp + METHOD + path} with RSASSA-PSS (SHA-256, MGF1-SHA-256, 32-byte salt).
 *
 * PSS is randomized: two signatures over the same message differ, both verify.
 * Holds no mutable state and may be shared between threads.
 */
public final class RequestSigner {

  private static final String ALGORITHM = "RSASSA-PSS";
  private static final PSSParameterSpec PSS_SHA256 =
      new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, 32, 1);

  private final KalshiCredential credential;

  public RequestSigner(@NonNull KalshiCredential credential) {
    if (!(credential.privateKey() instanceof RSAPrivateKey)) {
      throw new SigningException("Kalshi requests must be signed with an RSA private key, got "
          + credential.privateKey().getAlgorithm());
    }
    this.credential = credential;
  }

  public String keyId() {
    return credential.keyId();
  }

  public SignedRequestContext sign(long timestampMs, @NonNull String method, @NonNull String path) {
    String normalizedMethod = method.toUpperCase(Locale.ROOT);
    String signedPath = stripQuery(path);
    byte[] message = canonicalMessage(timestampMs, normalizedMethod, signedPath)
        .getBytes(StandardCharsets.UTF_8);
    try {
      Signature signature = Signature.getInstance(ALGORITHM);
      signature.setParameter(PSS_SHA256);
      signature.initSign(credential.privateKey());
      signature.update(message);
      return new SignedRequestContext(credential.keyId(), normalizedMethod, signedPath, timestampMs, signature.sign());
    } catch (GeneralSecurityException e) {
      throw new SigningException("RSA-PSS signing failed for %s %s".formatted(normalizedMethod, signedPath), e);
    }
  }

  static String canonicalMessage(long timestampMs, String method, String path) {
    return timestampMs + method + path;
  }

  static String stripQuery(String path) {
    int q = path.indexOf('?');
    return q < 0 ? path : path.substring(0, q);
  }
}
