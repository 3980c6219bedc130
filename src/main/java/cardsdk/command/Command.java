package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.card.Card;
import cardsdk.tlv.TlvBuilder;
import cardsdk.tlv.TlvTag;

/**
 * One request/response exchange with the card. {@link CardSession#send(Command)} drives
 * the stages in order: precheck, serialize, transceive, deserialize, with
 * {@link #mapError} applied to failures reported by the card.
 *
 * @param <R> typed response
 */
public interface Command<R> {

  int LEGACY_MODE_VALUE = 4;

  /** Whether a preflight read must have happened before this command is sent. */
  default boolean requiresCard() {
    return true;
  }

  /** Validates the card snapshot before any I/O. Must not have side effects. */
  default void precheck(Card card) throws CardSdkException {
  }

  CommandApdu serialize(SessionEnvironment environment) throws CardSdkException;

  R deserialize(SessionEnvironment environment, ResponseApdu apdu) throws CardSdkException;

  /** Translates a card-reported error into a more specific one using the card state. */
  default CardSdkException mapError(Card card, CardSdkException error) {
    return error;
  }

  /** Builder pre-populated with the legacy mode marker when the session needs it. */
  default TlvBuilder createTlvBuilder(SessionEnvironment environment) throws CardSdkException {
    TlvBuilder builder = new TlvBuilder();
    if (environment.isLegacyMode()) {
      builder.append(TlvTag.LEGACY_MODE, LEGACY_MODE_VALUE);
    }
    return builder;
  }
}
