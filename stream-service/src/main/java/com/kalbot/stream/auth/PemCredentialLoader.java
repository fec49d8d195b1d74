package com.kalbot.stream.auth;

import com.kalbot.config.KalbotProperties;
import com.kalbot.kalshi.auth.KalshiCredential;
import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.util.encoders.DecoderException;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;

/**
 * Turns the configured key id and PEM private key into a {@link KalshiCredential}.
 *
 * Accepts PKCS#8 ({@code BEGIN PRIVATE KEY}) and PKCS#1 ({@code BEGIN RSA PRIVATE KEY}) PEM,
 * either inline or from a file.
 */
@Slf4j
public final class PemCredentialLoader {

  private PemCredentialLoader() {
  }

  public static KalshiCredential load(KalbotProperties.Auth auth) {
    if (auth == null || auth.keyId() == null || auth.keyId().isBlank()) {
      throw new IllegalStateException("kalbot.kalshi.auth.key-id is not configured");
    }
    String pem = auth.privateKeyPem();
    if (pem == null || pem.isBlank()) {
      if (auth.privateKeyPath() == null || auth.privateKeyPath().isBlank()) {
        throw new IllegalStateException(
            "Neither kalbot.kalshi.auth.private-key-path nor kalbot.kalshi.auth.private-key-pem is configured");
      }
      pem = readPem(Path.of(auth.privateKeyPath()));
    }
    PrivateKey key = parsePrivateKey(pem);
    log.info("loaded Kalshi credential keyId={}", auth.keyId().trim());
    return new KalshiCredential(auth.keyId().trim(), key);
  }

  public static PrivateKey parsePrivateKey(String pem) {
    Object parsed;
    try (PEMParser parser = new PEMParser(new StringReader(pem))) {
      parsed = parser.readObject();
    } catch (IOException | DecoderException e) {
      throw new IllegalArgumentException("PEM is malformed", e);
    }

    PrivateKeyInfo keyInfo;
    if (parsed instanceof PEMKeyPair keyPair) {
      keyInfo = keyPair.getPrivateKeyInfo();
    } else if (parsed instanceof PrivateKeyInfo info) {
      keyInfo = info;
    } else {
      throw new IllegalArgumentException("Unsupported PEM: expected a PRIVATE KEY or RSA PRIVATE KEY block, got "
          + (parsed == null ? "nothing" : parsed.getClass().getSimpleName()));
    }

    try {
      return new JcaPEMKeyConverter().getPrivateKey(keyInfo);
    } catch (IOException e) {
      throw new IllegalArgumentException("PEM does not contain a usable private key", e);
    }
  }

  private static String readPem(Path path) {
    try {
      return Files.readString(path, StandardCharsets.US_ASCII);
    } catch (IOException e) {
      throw new IllegalStateException("Failed reading private key from " + path, e);
    }
  }
}
