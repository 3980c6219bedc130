package cardsdk.attestation;

import cardsdk.CardSdkException;
import cardsdk.crypto.CryptoUtils;
import cardsdk.crypto.EllipticCurve;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Card answer to a key challenge. The card signs {@code challenge || salt}, followed by
 * {@code "BACKUP_CARDS" || key1 || key2 ...} when linked card keys are returned.
 */
public final class AttestCardKeyResponse {

  static final String LINKED_CARDS_PREFIX = "BACKUP_CARDS";

  private final String cardId;
  private final byte[] salt;
  private final byte[] cardSignature;
  private final byte[] challenge;
  private final List<byte[]> linkedCardPublicKeys;

  public AttestCardKeyResponse(String cardId,
                               byte[] salt,
                               byte[] cardSignature,
                               byte[] challenge,
                               List<byte[]> linkedCardPublicKeys) {
    this.cardId = cardId;
    this.salt = salt.clone();
    this.cardSignature = cardSignature.clone();
    this.challenge = challenge.clone();
    List<byte[]> keys = new ArrayList<>();
    for (byte[] key : linkedCardPublicKeys) {
      keys.add(key.clone());
    }
    this.linkedCardPublicKeys = Collections.unmodifiableList(keys);
  }

  public String getCardId() {
    return cardId;
  }

  public byte[] getSalt() {
    return salt.clone();
  }

  public byte[] getCardSignature() {
    return cardSignature.clone();
  }

  public byte[] getChallenge() {
    return challenge.clone();
  }

  public List<byte[]> getLinkedCardPublicKeys() {
    return linkedCardPublicKeys;
  }

  public byte[] signedMessage() {
    return signedMessage(challenge, salt, linkedCardPublicKeys);
  }

  public boolean verify(byte[] cardPublicKey) throws CardSdkException {
    return CryptoUtils.verify(EllipticCurve.SECP256K1, cardPublicKey, signedMessage(), cardSignature);
  }

  static byte[] signedMessage(byte[] challenge, byte[] salt, List<byte[]> linkedCardPublicKeys) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(challenge);
    out.writeBytes(salt);
    if (!linkedCardPublicKeys.isEmpty()) {
      out.writeBytes(LINKED_CARDS_PREFIX.getBytes(StandardCharsets.UTF_8));
      for (byte[] key : linkedCardPublicKeys) {
        out.writeBytes(key);
      }
    }
    return out.toByteArray();
  }
}
