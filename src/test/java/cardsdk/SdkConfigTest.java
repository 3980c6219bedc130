package cardsdk;

import cardsdk.attestation.AttestationMode;
import cardsdk.channel.EncryptionMode;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SdkConfigTest {

  @Test
  void defaultsMatchBundledProperties() {
    SdkConfig loaded = SdkConfig.load();
    SdkConfig defaults = SdkConfig.defaults();

    assertEquals(defaults.attestationMode, loaded.attestationMode);
    assertEquals(defaults.encryptionMode, loaded.encryptionMode);
    assertEquals(defaults.maxRecoveryAttempts, loaded.maxRecoveryAttempts);
    assertEquals(defaults.verifierEndpoint, loaded.verifierEndpoint);
    assertEquals(defaults.verifierTimeout, loaded.verifierTimeout);
    assertEquals(AttestationMode.NORMAL, loaded.attestationMode);
    assertTrue(loaded.linkedTerminal);
    assertFalse(loaded.allowUntrustedCards);
  }

  @Test
  void readsOverridesFromProperties() {
    Properties properties = new Properties();
    properties.setProperty("cardsdk.attestationMode", " full ");
    properties.setProperty("cardsdk.encryptionMode", "strong");
    properties.setProperty("cardsdk.allowUntrustedCards", "true");
    properties.setProperty("cardsdk.legacyMode", "true");
    properties.setProperty("cardsdk.linkedTerminal", "false");
    properties.setProperty("cardsdk.maxRecoveryAttempts", "7");
    properties.setProperty("cardsdk.verifier.endpoint", "http://localhost:8080/verify");
    properties.setProperty("cardsdk.verifier.timeoutSeconds", "2");

    SdkConfig config = SdkConfig.fromProperties(properties);

    assertEquals(AttestationMode.FULL, config.attestationMode);
    assertEquals(EncryptionMode.STRONG, config.encryptionMode);
    assertTrue(config.allowUntrustedCards);
    assertTrue(config.legacyMode);
    assertFalse(config.linkedTerminal);
    assertEquals(7, config.maxRecoveryAttempts);
    assertEquals(URI.create("http://localhost:8080/verify"), config.verifierEndpoint);
    assertEquals(Duration.ofSeconds(2), config.verifierTimeout);
  }

  @Test
  void rejectsUnknownMode() {
    Properties properties = new Properties();
    properties.setProperty("cardsdk.attestationMode", "paranoid");
    assertThrows(IllegalArgumentException.class, () -> SdkConfig.fromProperties(properties));
  }

  @Test
  void toBuilderCopiesEverything() {
    SdkConfig config = SdkConfig.builder().attestationMode(AttestationMode.OFFLINE).keepSessionOpened(true).build();
    SdkConfig copy = config.toBuilder().maxRecoveryAttempts(0).build();

    assertEquals(AttestationMode.OFFLINE, copy.attestationMode);
    assertTrue(copy.keepSessionOpened);
    assertEquals(0, copy.maxRecoveryAttempts);
    assertThrows(IllegalArgumentException.class, () -> SdkConfig.builder().maxRecoveryAttempts(-1));
  }
}
