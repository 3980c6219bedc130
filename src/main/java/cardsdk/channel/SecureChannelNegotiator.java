package cardsdk.channel;

import cardsdk.CardSdkException;
import cardsdk.card.Card;

/**
 * Establishes a session key when the card refuses plaintext traffic. Implementations
 * typically run a key agreement with the card over the same transport.
 */
public interface SecureChannelNegotiator {

  /**
   * @return AES key of 16, 24 or 32 bytes to use for the rest of the session
   */
  byte[] negotiate(EncryptionMode mode, Card card) throws CardSdkException;
}
