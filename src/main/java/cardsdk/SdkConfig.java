package cardsdk;

import cardsdk.attestation.AttestationMode;
import cardsdk.channel.EncryptionMode;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/** Immutable configuration shared by a card session and the tasks run in it. */
public final class SdkConfig {

  public static final String RESOURCE_NAME = "cardsdk.properties";
  public static final URI DEFAULT_VERIFIER_ENDPOINT =
      URI.create("https://verify.tangem.com/card/verify-and-get-info");

  public final AttestationMode attestationMode;
  public final boolean allowUntrustedCards;
  public final boolean legacyMode;
  public final boolean linkedTerminal;
  public final EncryptionMode encryptionMode;
  public final int maxRecoveryAttempts;
  public final boolean keepSessionOpened;
  public final URI verifierEndpoint;
  public final Duration verifierTimeout;

  private SdkConfig(Builder builder) {
    this.attestationMode = builder.attestationMode;
    this.allowUntrustedCards = builder.allowUntrustedCards;
    this.legacyMode = builder.legacyMode;
    this.linkedTerminal = builder.linkedTerminal;
    this.encryptionMode = builder.encryptionMode;
    this.maxRecoveryAttempts = builder.maxRecoveryAttempts;
    this.keepSessionOpened = builder.keepSessionOpened;
    this.verifierEndpoint = builder.verifierEndpoint;
    this.verifierTimeout = builder.verifierTimeout;
  }

  public static SdkConfig defaults() {
    return new Builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Loads {@value #RESOURCE_NAME} from the classpath, falling back to defaults when absent. */
  public static SdkConfig load() {
    Properties properties = new Properties();
    try (InputStream in = SdkConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
      if (in != null) {
        properties.load(in);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Unable to read " + RESOURCE_NAME, e);
    }
    return fromProperties(properties);
  }

  public static SdkConfig fromProperties(Properties properties) {
    Builder builder = new Builder();
    String mode = properties.getProperty("cardsdk.attestationMode");
    if (mode != null && !mode.isBlank()) {
      builder.attestationMode(AttestationMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
    }
    String encryption = properties.getProperty("cardsdk.encryptionMode");
    if (encryption != null && !encryption.isBlank()) {
      builder.encryptionMode(EncryptionMode.valueOf(encryption.trim().toUpperCase(Locale.ROOT)));
    }
    builder.allowUntrustedCards(bool(properties, "cardsdk.allowUntrustedCards", builder.allowUntrustedCards));
    builder.legacyMode(bool(properties, "cardsdk.legacyMode", builder.legacyMode));
    builder.linkedTerminal(bool(properties, "cardsdk.linkedTerminal", builder.linkedTerminal));
    builder.keepSessionOpened(bool(properties, "cardsdk.keepSessionOpened", builder.keepSessionOpened));
    String attempts = properties.getProperty("cardsdk.maxRecoveryAttempts");
    if (attempts != null && !attempts.isBlank()) {
      builder.maxRecoveryAttempts(Integer.parseInt(attempts.trim()));
    }
    String endpoint = properties.getProperty("cardsdk.verifier.endpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      builder.verifierEndpoint(URI.create(endpoint.trim()));
    }
    String timeout = properties.getProperty("cardsdk.verifier.timeoutSeconds");
    if (timeout != null && !timeout.isBlank()) {
      builder.verifierTimeout(Duration.ofSeconds(Long.parseLong(timeout.trim())));
    }
    return builder.build();
  }

  private static boolean bool(Properties properties, String key, boolean fallback) {
    String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.attestationMode = attestationMode;
    builder.allowUntrustedCards = allowUntrustedCards;
    builder.legacyMode = legacyMode;
    builder.linkedTerminal = linkedTerminal;
    builder.encryptionMode = encryptionMode;
    builder.maxRecoveryAttempts = maxRecoveryAttempts;
    builder.keepSessionOpened = keepSessionOpened;
    builder.verifierEndpoint = verifierEndpoint;
    builder.verifierTimeout = verifierTimeout;
    return builder;
  }

  public static final class Builder {
    AttestationMode attestationMode = AttestationMode.NORMAL;
    boolean allowUntrustedCards;
    boolean legacyMode;
    boolean linkedTerminal = true;
    EncryptionMode encryptionMode = EncryptionMode.NONE;
    int maxRecoveryAttempts = 3;
    boolean keepSessionOpened;
    URI verifierEndpoint = DEFAULT_VERIFIER_ENDPOINT;
    Duration verifierTimeout = Duration.ofSeconds(15);

    public Builder attestationMode(AttestationMode value) {
      if (value == null) {
        throw new IllegalArgumentException("attestationMode is required");
      }
      this.attestationMode = value;
      return this;
    }

    public Builder allowUntrustedCards(boolean value) {
      this.allowUntrustedCards = value;
      return this;
    }

    public Builder legacyMode(boolean value) {
      this.legacyMode = value;
      return this;
    }

    public Builder linkedTerminal(boolean value) {
      this.linkedTerminal = value;
      return this;
    }

    public Builder encryptionMode(EncryptionMode value) {
      if (value == null) {
        throw new IllegalArgumentException("encryptionMode is required");
      }
      this.encryptionMode = value;
      return this;
    }

    public Builder maxRecoveryAttempts(int value) {
      if (value < 0) {
        throw new IllegalArgumentException("maxRecoveryAttempts must not be negative");
      }
      this.maxRecoveryAttempts = value;
      return this;
    }

    public Builder keepSessionOpened(boolean value) {
      this.keepSessionOpened = value;
      return this;
    }

    public Builder verifierEndpoint(URI value) {
      this.verifierEndpoint = value;
      return this;
    }

    public Builder verifierTimeout(Duration value) {
      this.verifierTimeout = value;
      return this;
    }

    public SdkConfig build() {
      return new SdkConfig(this);
    }
  }
}
