package cardsdk.card;

/** Personalization state reported by the card. */
public enum CardStatus {
  NOT_PERSONALIZED(0x00),
  EMPTY(0x01),
  LOADED(0x02),
  PURGED(0x03);

  private final int code;

  CardStatus(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public static CardStatus fromCode(int code) {
    for (CardStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    return null;
  }
}
