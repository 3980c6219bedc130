package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.Card;
import cardsdk.card.CardStatus;
import cardsdk.card.SettingsMask;
import cardsdk.tlv.TlvTag;

import java.util.Objects;

/**
 * Writes the issuer data field together with the issuer's signature over it. When the card
 * protects issuer data against replay, a strictly increasing counter is mandatory.
 */
public final class WriteIssuerDataCommand implements Command<String> {

  public static final int MAX_SIZE = 512;

  private final byte[] issuerData;
  private final byte[] issuerDataSignature;
  private final Integer issuerDataCounter;
  private final byte[] issuerPublicKey;

  public WriteIssuerDataCommand(byte[] issuerData, byte[] issuerDataSignature, Integer issuerDataCounter) {
    this(issuerData, issuerDataSignature, issuerDataCounter, null);
  }

  /**
   * @param issuerPublicKey key to check the signature with; the card's issuer key when {@code null}
   */
  public WriteIssuerDataCommand(byte[] issuerData,
                                byte[] issuerDataSignature,
                                Integer issuerDataCounter,
                                byte[] issuerPublicKey) {
    this.issuerData = Objects.requireNonNull(issuerData, "issuerData").clone();
    this.issuerDataSignature = Objects.requireNonNull(issuerDataSignature, "issuerDataSignature").clone();
    this.issuerDataCounter = issuerDataCounter;
    this.issuerPublicKey = issuerPublicKey != null ? issuerPublicKey.clone() : null;
  }

  @Override
  public void precheck(Card card) throws CardSdkException {
    if (card.getStatus() == CardStatus.NOT_PERSONALIZED) {
      throw new CardSdkException(SdkError.NOT_PERSONALIZED);
    }
    if (card.hasSetting(SettingsMask.Flag.USE_ACTIVATION) && !card.isActivated()) {
      throw new CardSdkException(SdkError.NOT_ACTIVATED);
    }
    byte[] publicKey = issuerPublicKey != null ? issuerPublicKey : card.getIssuerDataPublicKey();
    if (publicKey == null) {
      throw new CardSdkException(SdkError.MISSING_ISSUER_PUBLIC_KEY);
    }
    if (issuerData.length > MAX_SIZE) {
      throw new CardSdkException(SdkError.DATA_SIZE_TOO_LARGE,
          "Issuer data is " + issuerData.length + " bytes, limit is " + MAX_SIZE);
    }
    if (card.hasSetting(SettingsMask.Flag.PROTECT_ISSUER_DATA_AGAINST_REPLAY) && issuerDataCounter == null) {
      throw new CardSdkException(SdkError.MISSING_COUNTER);
    }
    if (!IssuerDataVerifier.verify(card.getCardId(), issuerData, issuerDataCounter, publicKey, issuerDataSignature)) {
      throw new CardSdkException(SdkError.ISSUER_SIGNATURE_INVALID);
    }
  }

  /** With replay protection on, a rejected write means the counter did not increase. */
  @Override
  public CardSdkException mapError(Card card, CardSdkException error) {
    if (card != null && card.hasSetting(SettingsMask.Flag.PROTECT_ISSUER_DATA_AGAINST_REPLAY)
        && error.is(SdkError.INVALID_PARAMS)) {
      return new CardSdkException(SdkError.DATA_CANNOT_BE_WRITTEN, error.getMessage(), error);
    }
    return error;
  }

  @Override
  public CommandApdu serialize(SessionEnvironment environment) throws CardSdkException {
    return CommandApdu.of(Instruction.WRITE_ISSUER_DATA, createTlvBuilder(environment)
        .append(TlvTag.ACCESS_CODE, environment.getAccessCode().getValue())
        .append(TlvTag.CARD_ID, environment.getCard().getCardId())
        .append(TlvTag.ISSUER_DATA, issuerData)
        .append(TlvTag.ISSUER_DATA_SIGNATURE, issuerDataSignature)
        .append(TlvTag.ISSUER_DATA_COUNTER, issuerDataCounter));
  }

  /** @return card id echoed by the card */
  @Override
  public String deserialize(SessionEnvironment environment, ResponseApdu apdu) throws CardSdkException {
    return apdu.decoder(environment.envelope()).decode(TlvTag.CARD_ID, String.class);
  }
}
