package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.Card;
import cardsdk.card.CardStatus;
import cardsdk.card.FirmwareVersion;
import cardsdk.card.SettingsMask;
import cardsdk.tlv.TlvBuilder;
import cardsdk.tlv.TlvDecoder;
import cardsdk.tlv.TlvTag;

import java.time.LocalDate;

/** Preflight read of the card record. Wallets are read separately by {@link ReadWalletCommand}. */
public final class ReadCommand implements Command<Card> {

  @Override
  public boolean requiresCard() {
    return false;
  }

  @Override
  public CommandApdu serialize(SessionEnvironment environment) throws CardSdkException {
    TlvBuilder builder = createTlvBuilder(environment)
        .append(TlvTag.ACCESS_CODE, environment.getAccessCode().getValue());
    if (environment.getConfig().linkedTerminal && environment.getTerminalKeys() != null) {
      builder.append(TlvTag.TERMINAL_PUBLIC_KEY, environment.getTerminalKeys().getPublicKey());
    }
    return CommandApdu.of(Instruction.READ, builder);
  }

  @Override
  public Card deserialize(SessionEnvironment environment, ResponseApdu apdu) throws CardSdkException {
    TlvDecoder decoder = apdu.decoder(environment.envelope());
    CardStatus status = decoder.decode(TlvTag.STATUS, CardStatus.class);
    if (status == CardStatus.NOT_PERSONALIZED) {
      throw new CardSdkException(SdkError.NOT_PERSONALIZED);
    }
    String firmware = decoder.decode(TlvTag.FIRMWARE_VERSION, String.class);
    FirmwareVersion firmwareVersion;
    try {
      firmwareVersion = FirmwareVersion.parse(firmware);
    } catch (IllegalArgumentException e) {
      throw new CardSdkException(SdkError.DECODING_TYPE_MISMATCH, e.getMessage(), e);
    }
    Integer walletsCount = decoder.decodeOptional(TlvTag.WALLETS_COUNT, Integer.class);
    Boolean activated = decoder.decodeOptional(TlvTag.IS_ACTIVATED, Boolean.class);

    Card.Builder card = Card.builder()
        .cardId(decoder.decode(TlvTag.CARD_ID, String.class))
        .cardPublicKey(decoder.decode(TlvTag.CARD_PUBLIC_KEY, byte[].class))
        .firmwareVersion(firmwareVersion)
        .status(status)
        .settingsMask(decoder.decodeOptional(TlvTag.SETTINGS_MASK, SettingsMask.class))
        .issuerDataPublicKey(decoder.decodeOptional(TlvTag.ISSUER_DATA_PUBLIC_KEY, byte[].class))
        .activated(activated != null && activated)
        .walletsCount(walletsCount != null ? walletsCount : 0);

    TlvDecoder cardData = decoder.decodeNested(TlvTag.CARD_DATA);
    if (cardData != null) {
      card.batchId(cardData.decodeOptional(TlvTag.BATCH_ID, String.class))
          .manufactureDate(cardData.decodeOptional(TlvTag.MANUFACTURE_DATE_TIME, LocalDate.class))
          .issuerName(cardData.decodeOptional(TlvTag.ISSUER_NAME, String.class));
    }
    return card.build();
  }
}
