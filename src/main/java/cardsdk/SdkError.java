package cardsdk;

/** Error codes raised by the SDK, grouped by the stage that produces them. */
public enum SdkError {
  ENCODING_FAILED(Category.ENCODING, "Value does not match the tag's declared type"),
  DUPLICATE_TAG(Category.ENCODING, "Tag may appear only once"),
  MISSING_ENCRYPTION_KEY(Category.ENCODING, "Encryption is enabled but no session key is available"),

  DECODING_MISSING_TAG(Category.DECODING, "Required tag is missing"),
  DECODING_TYPE_MISMATCH(Category.DECODING, "Tag value is invalid for its declared type"),
  MALFORMED_TLV(Category.DECODING, "TLV framing is malformed"),
  DECRYPTION_FAILED(Category.DECODING, "Encrypted payload failed authentication"),

  MISSING_PREFLIGHT_READ(Category.PRECHECK, "Card must be read before running this operation"),
  NOT_PERSONALIZED(Category.PRECHECK, "Card is not personalized"),
  NOT_ACTIVATED(Category.PRECHECK, "Card is not activated"),
  MISSING_ISSUER_PUBLIC_KEY(Category.PRECHECK, "Issuer public key is unknown"),
  DATA_SIZE_TOO_LARGE(Category.PRECHECK, "Data exceeds the maximum size accepted by the card"),
  MISSING_COUNTER(Category.PRECHECK, "Replay protection requires a counter"),
  ISSUER_SIGNATURE_INVALID(Category.PRECHECK, "Issuer signature does not match the data"),
  WALLET_NOT_FOUND(Category.PRECHECK, "Wallet not found"),

  NOT_SUPPORTED_FIRMWARE_VERSION(Category.CONFIGURATION, "Firmware version does not support this operation"),

  CARD_VERIFICATION_FAILED(Category.VERIFICATION, "Card verification failed"),

  INVALID_PARAMS(Category.TRANSPORT, "Card rejected the command parameters"),
  DATA_CANNOT_BE_WRITTEN(Category.TRANSPORT, "Data cannot be written, the counter is stale"),
  ERROR_PROCESSING_COMMAND(Category.TRANSPORT, "Card failed to process the command"),
  INVALID_STATE(Category.TRANSPORT, "Card is in an invalid state for this command"),
  INS_NOT_SUPPORTED(Category.TRANSPORT, "Instruction not supported by the card"),
  WRONG_LENGTH(Category.TRANSPORT, "Wrong request length"),
  FILE_NOT_FOUND(Category.TRANSPORT, "File not found"),
  NEED_ENCRYPTION(Category.TRANSPORT, "Card requires an encrypted channel"),
  NEED_PAUSE(Category.TRANSPORT, "Card requested a security delay"),
  ACCESS_CODE_REQUIRED(Category.TRANSPORT, "Access code required"),
  UNKNOWN_STATUS(Category.TRANSPORT, "Unknown status word"),
  TRANSPORT_FAILED(Category.TRANSPORT, "Transport failure"),

  NETWORK_ERROR(Category.NETWORK, "Online verification service unavailable"),

  USER_CANCELLED(Category.USER_CANCELLED, "User cancelled the operation"),

  CRYPTO_FAILED(Category.CONFIGURATION, "Cryptographic operation failed"),
  STORAGE_FAILED(Category.CONFIGURATION, "Secure storage failure");

  public enum Category {
    PRECHECK,
    ENCODING,
    DECODING,
    TRANSPORT,
    VERIFICATION,
    USER_CANCELLED,
    CONFIGURATION,
    NETWORK
  }

  private final Category category;
  private final String description;

  SdkError(Category category, String description) {
    this.category = category;
    this.description = description;
  }

  public Category getCategory() {
    return category;
  }

  public String getDescription() {
    return description;
  }

  /** Errors the session may resolve on its own and then re-run the command. */
  public boolean isRecoverable() {
    return this == NEED_ENCRYPTION || this == NEED_PAUSE || this == ACCESS_CODE_REQUIRED;
  }
}
