package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.Card;
import cardsdk.card.CardStatus;
import cardsdk.tlv.TlvDecoder;
import cardsdk.tlv.TlvTag;

public final class ReadIssuerDataCommand implements Command<ReadIssuerDataResponse> {

  @Override
  public void precheck(Card card) throws CardSdkException {
    if (card.getStatus() == CardStatus.NOT_PERSONALIZED) {
      throw new CardSdkException(SdkError.NOT_PERSONALIZED);
    }
  }

  @Override
  public CommandApdu serialize(SessionEnvironment environment) throws CardSdkException {
    return CommandApdu.of(Instruction.READ_ISSUER_DATA, createTlvBuilder(environment)
        .append(TlvTag.ACCESS_CODE, environment.getAccessCode().getValue())
        .append(TlvTag.CARD_ID, environment.getCard().getCardId()));
  }

  @Override
  public ReadIssuerDataResponse deserialize(SessionEnvironment environment, ResponseApdu apdu)
      throws CardSdkException {
    TlvDecoder decoder = apdu.decoder(environment.envelope());
    return new ReadIssuerDataResponse(
        decoder.decode(TlvTag.CARD_ID, String.class),
        decoder.decode(TlvTag.ISSUER_DATA, byte[].class),
        decoder.decode(TlvTag.ISSUER_DATA_SIGNATURE, byte[].class),
        decoder.decodeOptional(TlvTag.ISSUER_DATA_COUNTER, Integer.class));
  }
}
