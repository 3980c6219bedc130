package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.card.Card;

/** Asks the user for the card's access code when the default one is rejected. */
@FunctionalInterface
public interface AccessCodeProvider {

  /**
   * @return the entered code, or {@code null} when the user dismissed the request
   */
  String requestAccessCode(Card card) throws CardSdkException;
}
