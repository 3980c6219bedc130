package cardsdk.channel;

/** Payload encryption negotiated with the card. The byte value travels in P1. */
public enum EncryptionMode {
  NONE(0x00),
  FAST(0x01),
  STRONG(0x02);

  private final int byteValue;

  EncryptionMode(int byteValue) {
    this.byteValue = byteValue;
  }

  public int getByteValue() {
    return byteValue;
  }
}
