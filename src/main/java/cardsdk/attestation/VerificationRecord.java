package cardsdk.attestation;

/** What the online verification service reports for a card that passed. */
public final class VerificationRecord {

  private final String cardId;
  private final String batchId;

  public VerificationRecord(String cardId, String batchId) {
    this.cardId = cardId;
    this.batchId = batchId;
  }

  public String getCardId() {
    return cardId;
  }

  public String getBatchId() {
    return batchId;
  }

  @Override
  public String toString() {
    return "VerificationRecord[" + cardId + ", batch=" + batchId + "]";
  }
}
