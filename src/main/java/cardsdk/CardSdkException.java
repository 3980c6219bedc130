package cardsdk;

import java.util.Objects;

/** Checked failure carrying an {@link SdkError} code. */
public class CardSdkException extends Exception {

  private static final long serialVersionUID = 1L;

  private final SdkError error;

  public CardSdkException(SdkError error) {
    this(error, error.getDescription(), null);
  }

  public CardSdkException(SdkError error, String message) {
    this(error, message, null);
  }

  public CardSdkException(SdkError error, String message, Throwable cause) {
    super(message, cause);
    this.error = Objects.requireNonNull(error, "error");
  }

  public SdkError getError() {
    return error;
  }

  public SdkError.Category getCategory() {
    return error.getCategory();
  }

  public boolean isRecoverable() {
    return error.isRecoverable();
  }

  public boolean is(SdkError candidate) {
    return error == candidate;
  }

  /**
   * Unwraps the SDK failure behind an async completion. Anything that is not a
   * {@link CardSdkException} is reported as {@code fallback}.
   */
  public static CardSdkException from(Throwable throwable, SdkError fallback) {
    Throwable current = throwable;
    while (current != null) {
      if (current instanceof CardSdkException) {
        return (CardSdkException) current;
      }
      current = current.getCause();
    }
    String message = throwable != null && throwable.getMessage() != null
        ? throwable.getMessage()
        : fallback.getDescription();
    return new CardSdkException(fallback, message, throwable);
  }

  @Override
  public String toString() {
    return "CardSdkException[" + error + "]: " + getMessage();
  }
}
