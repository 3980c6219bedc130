package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.SdkConfig;
import cardsdk.card.Card;
import cardsdk.channel.EncryptionMode;
import cardsdk.channel.SecureChannelEnvelope;
import cardsdk.crypto.RawKeyPair;

import java.util.Objects;

/**
 * Immutable snapshot of everything a command needs to build a request and read the reply.
 * The session replaces its current snapshot between commands; a command always sees the
 * snapshot it was started with.
 */
public final class SessionEnvironment {

  private final SdkConfig config;
  private final Card card;
  private final UserCode accessCode;
  private final UserCode passcode;
  private final EncryptionMode encryptionMode;
  private final byte[] encryptionKey;
  private final RawKeyPair terminalKeys;

  private SessionEnvironment(SdkConfig config,
                             Card card,
                             UserCode accessCode,
                             UserCode passcode,
                             EncryptionMode encryptionMode,
                             byte[] encryptionKey,
                             RawKeyPair terminalKeys) {
    this.config = Objects.requireNonNull(config, "config");
    this.card = card;
    this.accessCode = Objects.requireNonNull(accessCode, "accessCode");
    this.passcode = Objects.requireNonNull(passcode, "passcode");
    this.encryptionMode = Objects.requireNonNull(encryptionMode, "encryptionMode");
    this.encryptionKey = encryptionKey != null ? encryptionKey.clone() : null;
    this.terminalKeys = terminalKeys;
  }

  /** Fresh environment: no card, default codes, plaintext channel. */
  public static SessionEnvironment create(SdkConfig config) {
    return new SessionEnvironment(config, null,
        UserCode.defaultCode(UserCode.Type.ACCESS_CODE),
        UserCode.defaultCode(UserCode.Type.PASSCODE),
        EncryptionMode.NONE, null, null);
  }

  public SdkConfig getConfig() {
    return config;
  }

  /** Card from the last preflight read, or {@code null} before the first scan. */
  public Card getCard() {
    return card;
  }

  public UserCode getAccessCode() {
    return accessCode;
  }

  public UserCode getPasscode() {
    return passcode;
  }

  public EncryptionMode getEncryptionMode() {
    return encryptionMode;
  }

  public byte[] getEncryptionKey() {
    return encryptionKey != null ? encryptionKey.clone() : null;
  }

  public RawKeyPair getTerminalKeys() {
    return terminalKeys;
  }

  public boolean isLegacyMode() {
    return config.legacyMode;
  }

  public SecureChannelEnvelope envelope() throws CardSdkException {
    return SecureChannelEnvelope.of(encryptionMode, encryptionKey);
  }

  public SessionEnvironment withCard(Card value) {
    return new SessionEnvironment(config, value, accessCode, passcode, encryptionMode, encryptionKey, terminalKeys);
  }

  public SessionEnvironment withAccessCode(UserCode value) {
    return new SessionEnvironment(config, card, value, passcode, encryptionMode, encryptionKey, terminalKeys);
  }

  public SessionEnvironment withPasscode(UserCode value) {
    return new SessionEnvironment(config, card, accessCode, value, encryptionMode, encryptionKey, terminalKeys);
  }

  public SessionEnvironment withEncryption(EncryptionMode mode, byte[] key) {
    return new SessionEnvironment(config, card, accessCode, passcode, mode, key, terminalKeys);
  }

  public SessionEnvironment withTerminalKeys(RawKeyPair value) {
    return new SessionEnvironment(config, card, accessCode, passcode, encryptionMode, encryptionKey, value);
  }

  @Override
  public String toString() {
    return "SessionEnvironment[card=" + (card != null ? card.getCardId() : "none")
        + ", encryption=" + encryptionMode + ", accessCode=" + accessCode + "]";
  }
}
