package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.LogCategory;
import cardsdk.SdkConfig;
import cardsdk.SdkError;
import cardsdk.SdkEvents;
import cardsdk.SdkPhase;
import cardsdk.card.Card;
import cardsdk.card.CardWallet;
import cardsdk.channel.EncryptionMode;
import cardsdk.channel.SecureChannelNegotiator;
import cardsdk.crypto.CryptoUtils;
import cardsdk.crypto.EllipticCurve;

import net.sf.scuba.smartcards.ResponseAPDU;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Owns the transport and the {@link SessionEnvironment} for one card. Commands are executed
 * one at a time; the environment is only replaced between commands or while recovering
 * from an error the card reported.
 */
public final class CardSession implements AutoCloseable {

  private final CardTransport transport;
  private final SdkEvents events;
  private volatile SessionEnvironment environment;
  private AccessCodeProvider accessCodeProvider;
  private SecureChannelNegotiator secureChannelNegotiator;

  public CardSession(CardTransport transport, SdkConfig config, SdkEvents events) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.events = events != null ? events : SdkEvents.none();
    this.environment = SessionEnvironment.create(Objects.requireNonNull(config, "config"));
  }

  public void setAccessCodeProvider(AccessCodeProvider accessCodeProvider) {
    this.accessCodeProvider = accessCodeProvider;
  }

  public void setSecureChannelNegotiator(SecureChannelNegotiator secureChannelNegotiator) {
    this.secureChannelNegotiator = secureChannelNegotiator;
  }

  public SessionEnvironment environment() {
    return environment;
  }

  public SdkConfig getConfig() {
    return environment.getConfig();
  }

  public SdkEvents getEvents() {
    return events;
  }

  /**
   * Preflight read: reads the card record and every wallet slot and stores the result in
   * the environment.
   */
  public synchronized Card scan() throws CardSdkException {
    events.onPhase(SdkPhase.READING, "Reading card");
    if (environment.getConfig().linkedTerminal && environment.getTerminalKeys() == null) {
      environment = environment.withTerminalKeys(CryptoUtils.generateKeyPair(EllipticCurve.SECP256K1));
    }
    Card card = send(new ReadCommand());
    environment = environment.withCard(card);
    List<CardWallet> wallets = new ArrayList<>();
    for (int index = 0; index < card.getWalletsCount(); index++) {
      try {
        wallets.add(send(new ReadWalletCommand(index)));
      } catch (CardSdkException e) {
        if (!e.is(SdkError.WALLET_NOT_FOUND)) {
          throw e;
        }
        events.onLog(LogCategory.GENERAL, "Wallet slot " + index + " is empty");
      }
    }
    Card scanned = updateCard(current -> current.withWallets(wallets));
    events.onLog(LogCategory.GENERAL, "Scanned " + scanned);
    return scanned;
  }

  /**
   * Runs {@code command} to completion, re-running it after each recoverable error up to
   * {@link SdkConfig#maxRecoveryAttempts} times.
   */
  public synchronized <R> R send(Command<R> command) throws CardSdkException {
    SessionEnvironment current = environment;
    if (command.requiresCard()) {
      Card card = current.getCard();
      if (card == null) {
        throw new CardSdkException(SdkError.MISSING_PREFLIGHT_READ);
      }
      command.precheck(card);
    }
    current = establishEncryptionIfConfigured(current);
    int attempt = 0;
    while (true) {
      try {
        return execute(command, current);
      } catch (CardSdkException e) {
        if (!e.isRecoverable() || attempt >= current.getConfig().maxRecoveryAttempts) {
          throw e;
        }
        attempt++;
        current = recover(e, current);
        environment = current;
      }
    }
  }

  /** Applies {@code update} to the stored card. Waits for any in-flight command. */
  public synchronized Card updateCard(UnaryOperator<Card> update) throws CardSdkException {
    Card card = environment.getCard();
    if (card == null) {
      throw new CardSdkException(SdkError.MISSING_PREFLIGHT_READ);
    }
    Card updated = update.apply(card);
    environment = environment.withCard(updated);
    return updated;
  }

  public void pause() {
    transport.pause();
  }

  public void resume() {
    transport.resume();
  }

  @Override
  public void close() {
    transport.close();
  }

  private <R> R execute(Command<R> command, SessionEnvironment env) throws CardSdkException {
    CommandApdu request = command.serialize(env);
    ResponseAPDU raw = transport.transceive(request.encode(env.envelope()));
    ResponseApdu response = ResponseApdu.from(raw);
    StatusWord statusWord = response.getStatusWord();
    if (!statusWord.isSuccess()) {
      CardSdkException reported = new CardSdkException(statusWord.getError(),
          String.format("%s failed with SW=%04X", request.getInstruction(), response.getSw()));
      CardSdkException mapped = command.mapError(env.getCard(), reported);
      if (mapped.is(SdkError.INVALID_PARAMS) && env.getAccessCode().isDefault()) {
        throw new CardSdkException(SdkError.ACCESS_CODE_REQUIRED,
            "Card rejected the default access code", mapped);
      }
      throw mapped;
    }
    return command.deserialize(env, response);
  }

  private SessionEnvironment recover(CardSdkException error, SessionEnvironment env) throws CardSdkException {
    switch (error.getError()) {
      case NEED_PAUSE:
        events.onLog(LogCategory.SECURITY, "Card requested a security delay, resending");
        return env;
      case NEED_ENCRYPTION: {
        if (secureChannelNegotiator == null) {
          throw error;
        }
        EncryptionMode configured = env.getConfig().encryptionMode;
        return negotiate(env, configured != EncryptionMode.NONE ? configured : EncryptionMode.FAST);
      }
      case ACCESS_CODE_REQUIRED: {
        if (accessCodeProvider == null) {
          throw error;
        }
        events.onPhase(SdkPhase.WAITING_FOR_USER, "Access code required");
        String code = accessCodeProvider.requestAccessCode(env.getCard());
        if (code == null) {
          throw new CardSdkException(SdkError.USER_CANCELLED, "Access code entry cancelled");
        }
        return env.withAccessCode(UserCode.of(UserCode.Type.ACCESS_CODE, code));
      }
      default:
        throw error;
    }
  }

  private SessionEnvironment establishEncryptionIfConfigured(SessionEnvironment env) throws CardSdkException {
    EncryptionMode configured = env.getConfig().encryptionMode;
    if (configured == EncryptionMode.NONE || env.getEncryptionMode() != EncryptionMode.NONE
        || secureChannelNegotiator == null) {
      return env;
    }
    SessionEnvironment negotiated = negotiate(env, configured);
    environment = negotiated;
    return negotiated;
  }

  private SessionEnvironment negotiate(SessionEnvironment env, EncryptionMode mode) throws CardSdkException {
    events.onLog(LogCategory.SECURITY, "Negotiating " + mode + " encryption");
    byte[] key = secureChannelNegotiator.negotiate(mode, env.getCard());
    return env.withEncryption(mode, key);
  }
}
