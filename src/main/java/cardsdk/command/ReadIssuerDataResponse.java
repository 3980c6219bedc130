package cardsdk.command;

import cardsdk.CardSdkException;

/** Issuer data stored on the card with its signature and, when replay protection is on, counter. */
public final class ReadIssuerDataResponse {

  private final String cardId;
  private final byte[] issuerData;
  private final byte[] issuerDataSignature;
  private final Integer issuerDataCounter;

  public ReadIssuerDataResponse(String cardId, byte[] issuerData, byte[] issuerDataSignature, Integer issuerDataCounter) {
    this.cardId = cardId;
    this.issuerData = issuerData.clone();
    this.issuerDataSignature = issuerDataSignature.clone();
    this.issuerDataCounter = issuerDataCounter;
  }

  public String getCardId() {
    return cardId;
  }

  public byte[] getIssuerData() {
    return issuerData.clone();
  }

  public byte[] getIssuerDataSignature() {
    return issuerDataSignature.clone();
  }

  public Integer getIssuerDataCounter() {
    return issuerDataCounter;
  }

  public boolean verify(byte[] issuerPublicKey) throws CardSdkException {
    return IssuerDataVerifier.verify(cardId, issuerData, issuerDataCounter, issuerPublicKey, issuerDataSignature);
  }
}
