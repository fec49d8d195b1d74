package com.kalbot.kalshi.auth;

import org.junit.jupiter.api.Test;

import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.spec.ECGenParameterSpec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestSignerTest {

  private final RequestSigner signer = new RequestSigner(TestKeys.credential());

  @Test
  void signatureVerifiesOverTimestampMethodAndPath() {
    SignedRequestContext context = signer.sign(1_700_000_000_123L, "get", "/trade-api/v2/portfolio/balance");

    assertThat(context.method()).isEqualTo("GET");
    assertThat(context.path()).isEqualTo("/trade-api/v2/portfolio/balance");
    assertThat(TestKeys.verifies(TestKeys.rsa().getPublic(),
        "1700000000123GET/trade-api/v2/portfolio/balance", context.signatureBase64())).isTrue();
  }

  @Test
  void queryStringIsNotPartOfTheSignedMessage() {
    SignedRequestContext context = signer.sign(42L, "GET", "/trade-api/v2/markets?limit=5&status=open");

    assertThat(context.path()).isEqualTo("/trade-api/v2/markets");
    assertThat(TestKeys.verifies(TestKeys.rsa().getPublic(), "42GET/trade-api/v2/markets", context.signatureBase64()))
        .isTrue();
  }

  @Test
  void distinctTriplesProduceDistinctSignatures() {
    String a = signer.sign(1L, "GET", "/a").signatureBase64();
    String b = signer.sign(2L, "GET", "/a").signatureBase64();
    String c = signer.sign(1L, "POST", "/a").signatureBase64();
    String d = signer.sign(1L, "GET", "/b").signatureBase64();

    assertThat(a).isNotEqualTo(b).isNotEqualTo(c).isNotEqualTo(d);
    assertThat(TestKeys.verifies(TestKeys.rsa().getPublic(), "2GET/a", a)).isFalse();
  }

  @Test
  void sameTripleAlwaysVerifiesEvenThoughPssIsRandomized() {
    String first = signer.sign(7L, "DELETE", "/trade-api/v2/portfolio/orders/abc").signatureBase64();
    String second = signer.sign(7L, "DELETE", "/trade-api/v2/portfolio/orders/abc").signatureBase64();

    String message = "7DELETE/trade-api/v2/portfolio/orders/abc";
    assertThat(TestKeys.verifies(TestKeys.rsa().getPublic(), message, first)).isTrue();
    assertThat(TestKeys.verifies(TestKeys.rsa().getPublic(), message, second)).isTrue();
  }

  @Test
  void headersCarryKeyTimestampAndSignature() {
    SignedRequestContext context = signer.sign(99L, "POST", "/trade-api/v2/portfolio/orders");

    assertThat(context.headers())
        .containsEntry(SignedRequestContext.KEY_HEADER, "test-key-id")
        .containsEntry(SignedRequestContext.TIMESTAMP_HEADER, "99")
        .containsEntry(SignedRequestContext.SIGNATURE_HEADER, context.signatureBase64());
  }

  @Test
  void rejectsNonRsaKeys() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
    generator.initialize(new ECGenParameterSpec("secp256r1"));
    PrivateKey ecKey = generator.generateKeyPair().getPrivate();

    assertThatThrownBy(() -> new RequestSigner(new KalshiCredential("k", ecKey)))
        .isInstanceOf(SigningException.class)
        .hasMessageContaining("RSA");
  }

  @Test
  void credentialToStringHidesKeyMaterial() {
    assertThat(TestKeys.credential().toString())
        .contains("test-key-id")
        .doesNotContain(TestKeys.rsa().getPrivate().toString());
  }
}
