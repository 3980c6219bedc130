package cardsdk.attestation;

import cardsdk.CardSdkException;
import cardsdk.crypto.CryptoUtils;
import cardsdk.crypto.EllipticCurve;

/** Wallet signature over {@code challenge || salt}, plus the attestation counter when reported. */
public final class AttestWalletKeyResponse {

  private final String cardId;
  private final byte[] salt;
  private final byte[] walletSignature;
  private final byte[] challenge;
  private final Integer counter;

  public AttestWalletKeyResponse(String cardId, byte[] salt, byte[] walletSignature, byte[] challenge, Integer counter) {
    this.cardId = cardId;
    this.salt = salt.clone();
    this.walletSignature = walletSignature.clone();
    this.challenge = challenge.clone();
    this.counter = counter;
  }

  public String getCardId() {
    return cardId;
  }

  public byte[] getSalt() {
    return salt.clone();
  }

  public byte[] getWalletSignature() {
    return walletSignature.clone();
  }

  public byte[] getChallenge() {
    return challenge.clone();
  }

  /** Number of wallet attestations performed so far, or {@code null}. */
  public Integer getCounter() {
    return counter;
  }

  public boolean verify(EllipticCurve curve, byte[] walletPublicKey) throws CardSdkException {
    byte[] message = new byte[challenge.length + salt.length];
    System.arraycopy(challenge, 0, message, 0, challenge.length);
    System.arraycopy(salt, 0, message, challenge.length, salt.length);
    return CryptoUtils.verify(curve, walletPublicKey, message, walletSignature);
  }
}
