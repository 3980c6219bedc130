package cardsdk.attestation;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.Card;
import cardsdk.card.CardWallet;
import cardsdk.command.Command;
import cardsdk.command.CommandApdu;
import cardsdk.command.Instruction;
import cardsdk.command.ResponseApdu;
import cardsdk.command.SessionEnvironment;
import cardsdk.crypto.CryptoUtils;
import cardsdk.tlv.TlvDecoder;
import cardsdk.tlv.TlvTag;

import java.util.Objects;

/** Challenge/response over one wallet key. */
public final class AttestWalletKeyCommand implements Command<AttestWalletKeyResponse> {

  private final byte[] publicKey;
  private final byte[] challenge;

  public AttestWalletKeyCommand(byte[] publicKey) {
    this(publicKey, null);
  }

  public AttestWalletKeyCommand(byte[] publicKey, byte[] challenge) {
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey").clone();
    this.challenge = challenge != null
        ? challenge.clone()
        : CryptoUtils.generateRandomBytes(AttestCardKeyCommand.CHALLENGE_LENGTH);
  }

  @Override
  public void precheck(Card card) throws CardSdkException {
    if (card.findWallet(publicKey) == null) {
      throw new CardSdkException(SdkError.WALLET_NOT_FOUND);
    }
  }

  @Override
  public CommandApdu serialize(SessionEnvironment environment) throws CardSdkException {
    return CommandApdu.of(Instruction.ATTEST_WALLET_KEY, createTlvBuilder(environment)
        .append(TlvTag.ACCESS_CODE, environment.getAccessCode().getValue())
        .append(TlvTag.CARD_ID, environment.getCard().getCardId())
        .append(TlvTag.WALLET_PUBLIC_KEY, publicKey)
        .append(TlvTag.CHALLENGE, challenge));
  }

  @Override
  public AttestWalletKeyResponse deserialize(SessionEnvironment environment, ResponseApdu apdu)
      throws CardSdkException {
    TlvDecoder decoder = apdu.decoder(environment.envelope());
    AttestWalletKeyResponse response = new AttestWalletKeyResponse(
        decoder.decode(TlvTag.CARD_ID, String.class),
        decoder.decode(TlvTag.SALT, byte[].class),
        decoder.decode(TlvTag.WALLET_SIGNATURE, byte[].class),
        challenge,
        decoder.decodeOptional(TlvTag.CHECK_WALLET_COUNTER, Integer.class));
    CardWallet wallet = environment.getCard().findWallet(publicKey);
    if (wallet == null) {
      throw new CardSdkException(SdkError.WALLET_NOT_FOUND);
    }
    if (!response.verify(wallet.getCurve(), publicKey)) {
      throw new CardSdkException(SdkError.CARD_VERIFICATION_FAILED, "Wallet key signature does not verify");
    }
    return response;
  }
}
