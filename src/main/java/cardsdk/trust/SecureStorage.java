package cardsdk.trust;

import cardsdk.CardSdkException;

/** Opaque blob storage backing the trust cache. */
public interface SecureStorage {

  /** @return stored bytes, or {@code null} when nothing is stored under {@code key} */
  byte[] get(String key) throws CardSdkException;

  void set(String key, byte[] value) throws CardSdkException;

  void delete(String key) throws CardSdkException;
}
