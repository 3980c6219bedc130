package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.card.CardWallet;
import cardsdk.crypto.EllipticCurve;
import cardsdk.tlv.TlvDecoder;
import cardsdk.tlv.TlvTag;

/** Reads one wallet slot by index. An empty slot is reported as {@code WALLET_NOT_FOUND}. */
public final class ReadWalletCommand implements Command<CardWallet> {

  private final int walletIndex;

  public ReadWalletCommand(int walletIndex) {
    if (walletIndex < 0) {
      throw new IllegalArgumentException("walletIndex must not be negative");
    }
    this.walletIndex = walletIndex;
  }

  @Override
  public CommandApdu serialize(SessionEnvironment environment) throws CardSdkException {
    return CommandApdu.of(Instruction.READ, createTlvBuilder(environment)
        .append(TlvTag.ACCESS_CODE, environment.getAccessCode().getValue())
        .append(TlvTag.CARD_ID, environment.getCard().getCardId())
        .append(TlvTag.WALLET_INDEX, walletIndex));
  }

  @Override
  public CardWallet deserialize(SessionEnvironment environment, ResponseApdu apdu) throws CardSdkException {
    TlvDecoder decoder = apdu.decoder(environment.envelope());
    Integer index = decoder.decodeOptional(TlvTag.WALLET_INDEX, Integer.class);
    return new CardWallet(
        index != null ? index : walletIndex,
        decoder.decode(TlvTag.WALLET_PUBLIC_KEY, byte[].class),
        decoder.decodeOptional(TlvTag.CURVE_ID, EllipticCurve.class),
        decoder.decodeOptional(TlvTag.WALLET_SIGNED_HASHES, Integer.class),
        decoder.decodeOptional(TlvTag.WALLET_REMAINING_SIGNATURES, Integer.class));
  }
}
