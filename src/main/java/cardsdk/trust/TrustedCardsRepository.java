package cardsdk.trust;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.attestation.Attestation;
import cardsdk.attestation.AttestationMode;
import cardsdk.attestation.AttestationStatus;
import cardsdk.crypto.CryptoUtils;

import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Last verified attestation per card, keyed by the hex SHA-256 of the card public key.
 * Entries live in memory and, when a {@link SecureStorage} is given, are mirrored into it
 * as a single JSON blob. Entries never expire; {@link #clear()} drops them all.
 */
public final class TrustedCardsRepository {

  static final String STORAGE_KEY = "trustedCards";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY);
  private static final TypeReference<LinkedHashMap<String, StoredAttestation>> ENTRIES =
      new TypeReference<LinkedHashMap<String, StoredAttestation>>() {};

  private final SecureStorage storage;
  private final Map<String, Attestation> entries = new LinkedHashMap<>();
  private boolean loaded;

  /** Process-local repository without persistence. */
  public TrustedCardsRepository() {
    this(null);
  }

  public TrustedCardsRepository(SecureStorage storage) {
    this.storage = storage;
  }

  public synchronized Optional<Attestation> lookup(byte[] cardPublicKey) throws CardSdkException {
    ensureLoaded();
    return Optional.ofNullable(entries.get(keyFor(cardPublicKey)));
  }

  public synchronized void record(byte[] cardPublicKey, Attestation attestation) throws CardSdkException {
    Objects.requireNonNull(attestation, "attestation");
    ensureLoaded();
    entries.put(keyFor(cardPublicKey), attestation);
    persist();
  }

  public synchronized void clear() throws CardSdkException {
    entries.clear();
    loaded = true;
    if (storage != null) {
      storage.delete(STORAGE_KEY);
    }
  }

  public synchronized int size() throws CardSdkException {
    ensureLoaded();
    return entries.size();
  }

  static String keyFor(byte[] cardPublicKey) {
    return Hex.toHexString(CryptoUtils.sha256(Objects.requireNonNull(cardPublicKey, "cardPublicKey")));
  }

  private void ensureLoaded() throws CardSdkException {
    if (loaded) {
      return;
    }
    loaded = true;
    if (storage == null) {
      return;
    }
    byte[] blob = storage.get(STORAGE_KEY);
    if (blob == null || blob.length == 0) {
      return;
    }
    try {
      Map<String, StoredAttestation> stored = MAPPER.readValue(blob, ENTRIES);
      for (Map.Entry<String, StoredAttestation> entry : stored.entrySet()) {
        Attestation attestation = entry.getValue().toAttestation();
        if (attestation != null) {
          entries.put(entry.getKey(), attestation);
        }
      }
    } catch (IOException e) {
      throw new CardSdkException(SdkError.STORAGE_FAILED, "Trusted cards blob is unreadable", e);
    }
  }

  private void persist() throws CardSdkException {
    if (storage == null) {
      return;
    }
    Map<String, StoredAttestation> stored = new LinkedHashMap<>();
    for (Map.Entry<String, Attestation> entry : entries.entrySet()) {
      stored.put(entry.getKey(), StoredAttestation.of(entry.getValue()));
    }
    try {
      storage.set(STORAGE_KEY, MAPPER.writeValueAsBytes(stored));
    } catch (IOException e) {
      throw new CardSdkException(SdkError.STORAGE_FAILED, "Unable to serialize trusted cards", e);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private static final class StoredAttestation {
    String cardKeyAttestation;
    String walletKeysAttestation;
    String mode;

    static StoredAttestation of(Attestation attestation) {
      StoredAttestation stored = new StoredAttestation();
      stored.cardKeyAttestation = attestation.getCardKeyAttestation().name();
      stored.walletKeysAttestation = attestation.getWalletKeysAttestation().name();
      stored.mode = attestation.getMode().name();
      return stored;
    }

    /** {@code null} for entries written by an incompatible version. */
    Attestation toAttestation() {
      try {
        return new Attestation(
            AttestationStatus.valueOf(cardKeyAttestation),
            AttestationStatus.valueOf(walletKeysAttestation),
            AttestationMode.valueOf(mode));
      } catch (IllegalArgumentException | NullPointerException e) {
        return null;
      }
    }
  }
}
