package cardsdk.trust;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.attestation.Attestation;
import cardsdk.attestation.AttestationMode;
import cardsdk.attestation.AttestationStatus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrustedCardsRepositoryTest {

  private static final byte[] CARD_KEY = {0x04, 0x01, 0x02, 0x03};
  private static final Attestation VERIFIED = new Attestation(
      AttestationStatus.VERIFIED, AttestationStatus.NOT_ATTESTED, AttestationMode.NORMAL);

  @Test
  void recordsAndLooksUpByCardKey() throws Exception {
    TrustedCardsRepository repository = new TrustedCardsRepository();
    assertFalse(repository.lookup(CARD_KEY).isPresent());

    repository.record(CARD_KEY, VERIFIED);

    assertEquals(Optional.of(VERIFIED), repository.lookup(CARD_KEY.clone()));
    assertFalse(repository.lookup(new byte[]{0x04, 0x09}).isPresent());
  }

  @Test
  void keyIsHexSha256OfThePublicKey() {
    String key = TrustedCardsRepository.keyFor(CARD_KEY);
    assertEquals(64, key.length());
    assertTrue(key.matches("[0-9a-f]+"));
  }

  @Test
  void survivesReloadFromFileStorage(@TempDir Path directory) throws Exception {
    new TrustedCardsRepository(new FileSecureStorage(directory)).record(CARD_KEY, VERIFIED);

    TrustedCardsRepository reloaded = new TrustedCardsRepository(new FileSecureStorage(directory));

    assertEquals(Optional.of(VERIFIED), reloaded.lookup(CARD_KEY));
    assertEquals(1, reloaded.size());
  }

  @Test
  void clearRemovesPersistedEntries() throws Exception {
    InMemorySecureStorage storage = new InMemorySecureStorage();
    TrustedCardsRepository repository = new TrustedCardsRepository(storage);
    repository.record(CARD_KEY, VERIFIED);

    repository.clear();

    assertEquals(0, new TrustedCardsRepository(storage).size());
  }

  @Test
  void corruptBlobIsAStorageFailure() throws Exception {
    InMemorySecureStorage storage = new InMemorySecureStorage();
    storage.set(TrustedCardsRepository.STORAGE_KEY, "not json".getBytes(StandardCharsets.UTF_8));

    CardSdkException error = assertThrows(CardSdkException.class,
        () -> new TrustedCardsRepository(storage).lookup(CARD_KEY));

    assertEquals(SdkError.STORAGE_FAILED, error.getError());
  }

  @Test
  void entriesFromIncompatibleVersionsAreIgnored() throws Exception {
    InMemorySecureStorage storage = new InMemorySecureStorage();
    String blob = "{\"" + TrustedCardsRepository.keyFor(CARD_KEY) + "\":"
        + "{\"cardKeyAttestation\":\"SOMETHING_NEW\",\"walletKeysAttestation\":\"VERIFIED\",\"mode\":\"FULL\"}}";
    storage.set(TrustedCardsRepository.STORAGE_KEY, blob.getBytes(StandardCharsets.UTF_8));

    assertFalse(new TrustedCardsRepository(storage).lookup(CARD_KEY).isPresent());
  }
}
