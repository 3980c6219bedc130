package cardsdk.attestation;

import java.util.concurrent.CompletableFuture;

/**
 * Looks a card up at the issuer's verification service.
 *
 * <p>The returned future fails with a {@link cardsdk.CardSdkException} carrying
 * {@link cardsdk.SdkError#CARD_VERIFICATION_FAILED} when the service rejects the card and
 * {@link cardsdk.SdkError#NETWORK_ERROR} when the service could not be reached.</p>
 */
public interface OnlineCardVerifier {

  CompletableFuture<VerificationRecord> getCardInfo(String cardId, byte[] cardPublicKey);
}
