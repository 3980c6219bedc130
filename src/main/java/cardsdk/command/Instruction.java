package cardsdk.command;

/** INS byte of each card command. */
public enum Instruction {
  READ(0xF2),
  ATTEST_WALLET_KEY(0xF3),
  ATTEST_CARD_KEY(0xF4),
  WRITE_ISSUER_DATA(0xF6),
  READ_ISSUER_DATA(0xF7),
  OPEN_SESSION(0xFF);

  private final int code;

  Instruction(int code) {
    this.code = code;
  }

  public int getCode() {
    return code;
  }

  public static Instruction fromCode(int code) {
    for (Instruction instruction : values()) {
      if (instruction.code == code) {
        return instruction;
      }
    }
    return null;
  }
}
