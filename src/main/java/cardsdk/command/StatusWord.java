package cardsdk.command;

import cardsdk.SdkError;

/** Two-byte status returned with every response and the error it stands for. */
public enum StatusWord {
  SUCCESS(0x9000, null),
  INVALID_PARAMS(0x6A86, SdkError.INVALID_PARAMS),
  ERROR_PROCESSING_COMMAND(0x6286, SdkError.ERROR_PROCESSING_COMMAND),
  INVALID_STATE(0x6985, SdkError.INVALID_STATE),
  INS_NOT_SUPPORTED(0x6D00, SdkError.INS_NOT_SUPPORTED),
  NEED_ENCRYPTION(0x6982, SdkError.NEED_ENCRYPTION),
  NEED_PAUSE(0x9789, SdkError.NEED_PAUSE),
  WRONG_LENGTH(0x6700, SdkError.WRONG_LENGTH),
  FILE_NOT_FOUND(0x6A82, SdkError.FILE_NOT_FOUND),
  WALLET_NOT_FOUND(0x6A88, SdkError.WALLET_NOT_FOUND),
  UNKNOWN(-1, SdkError.UNKNOWN_STATUS);

  private final int code;
  private final SdkError error;

  StatusWord(int code, SdkError error) {
    this.code = code;
    this.error = error;
  }

  public int getCode() {
    return code;
  }

  /** Error for this status, {@code null} for {@link #SUCCESS}. */
  public SdkError getError() {
    return error;
  }

  public boolean isSuccess() {
    return this == SUCCESS;
  }

  public static StatusWord fromCode(int sw) {
    for (StatusWord statusWord : values()) {
      if (statusWord.code == sw) {
        return statusWord;
      }
    }
    return UNKNOWN;
  }
}
