package cardsdk.attestation;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.Card;
import cardsdk.card.FirmwareVersion;
import cardsdk.command.Command;
import cardsdk.command.CommandApdu;
import cardsdk.command.Instruction;
import cardsdk.command.ResponseApdu;
import cardsdk.command.SessionEnvironment;
import cardsdk.crypto.CryptoUtils;
import cardsdk.tlv.TlvBuilder;
import cardsdk.tlv.TlvDecoder;
import cardsdk.tlv.TlvTag;

/**
 * Challenge/response over the card key. A response whose signature does not verify
 * against the card public key from the preflight read fails with
 * {@link SdkError#CARD_VERIFICATION_FAILED}.
 */
public final class AttestCardKeyCommand implements Command<AttestCardKeyResponse> {

  public enum Mode {
    /** Attest this card only. */
    DEFAULT,
    /** Also return the public keys of linked cards. */
    FULL
  }

  static final int CHALLENGE_LENGTH = 16;
  static final int FULL_INTERACTION_MODE = 0x01;

  private final Mode mode;
  private final byte[] challenge;

  public AttestCardKeyCommand() {
    this(Mode.DEFAULT, null);
  }

  /**
   * @param challenge caller supplied challenge; a random 16-byte one when {@code null}
   */
  public AttestCardKeyCommand(Mode mode, byte[] challenge) {
    this.mode = mode != null ? mode : Mode.DEFAULT;
    this.challenge = challenge != null ? challenge.clone() : CryptoUtils.generateRandomBytes(CHALLENGE_LENGTH);
  }

  public Mode getMode() {
    return mode;
  }

  @Override
  public void precheck(Card card) throws CardSdkException {
    if (mode == Mode.FULL && card.getFirmwareVersion().isBefore(FirmwareVersion.KEYS_IMPORT_AVAILABLE)) {
      throw new CardSdkException(SdkError.NOT_SUPPORTED_FIRMWARE_VERSION,
          "Linked card attestation needs firmware " + FirmwareVersion.KEYS_IMPORT_AVAILABLE + " or later");
    }
  }

  @Override
  public CommandApdu serialize(SessionEnvironment environment) throws CardSdkException {
    TlvBuilder builder = createTlvBuilder(environment)
        .append(TlvTag.ACCESS_CODE, environment.getAccessCode().getValue())
        .append(TlvTag.CARD_ID, environment.getCard().getCardId())
        .append(TlvTag.CHALLENGE, challenge);
    if (mode == Mode.FULL) {
      builder.append(TlvTag.INTERACTION_MODE, FULL_INTERACTION_MODE);
    }
    return CommandApdu.of(Instruction.ATTEST_CARD_KEY, builder);
  }

  @Override
  public AttestCardKeyResponse deserialize(SessionEnvironment environment, ResponseApdu apdu)
      throws CardSdkException {
    TlvDecoder decoder = apdu.decoder(environment.envelope());
    AttestCardKeyResponse response = new AttestCardKeyResponse(
        decoder.decode(TlvTag.CARD_ID, String.class),
        decoder.decode(TlvTag.SALT, byte[].class),
        decoder.decode(TlvTag.CARD_SIGNATURE, byte[].class),
        challenge,
        decoder.decodeAll(TlvTag.BACKUP_CARD_PUBLIC_KEY, byte[].class));
    if (!response.verify(environment.getCard().getCardPublicKey())) {
      throw new CardSdkException(SdkError.CARD_VERIFICATION_FAILED, "Card key signature does not verify");
    }
    return response;
  }
}
