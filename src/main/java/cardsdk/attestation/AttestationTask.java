package cardsdk.attestation;

import cardsdk.CardSdkException;
import cardsdk.LogCategory;
import cardsdk.SdkError;
import cardsdk.SdkEvents;
import cardsdk.SdkPhase;
import cardsdk.card.Card;
import cardsdk.card.CardWallet;
import cardsdk.command.CardSession;
import cardsdk.trust.TrustedCardsRepository;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Attests the scanned card and turns the partial results into one {@link Attestation}.
 *
 * <p>Card work (card key and wallet key challenges) runs on the calling thread inside
 * {@link #run()}. The returned future completes once the online verification and any user
 * decision are in. On success the verdict is also written onto the session's card.</p>
 */
public final class AttestationTask implements AutoCloseable {

  /** Signature or attestation counters above this value look like key extraction attempts. */
  public static final int MAX_COUNTER = 100000;

  private final AttestationMode mode;
  private final CardSession session;
  private final OnlineCardVerifier onlineVerifier;
  private final TrustedCardsRepository trustedCards;
  private final AttestationPrompts prompts;
  private final SdkEvents events;
  private final OnlineResultSlot onlineSlot = new OnlineResultSlot();

  private volatile Attestation current;
  private volatile boolean keepSessionOpened;
  private volatile CompletableFuture<Attestation> result;

  public AttestationTask(CardSession session,
                         OnlineCardVerifier onlineVerifier,
                         TrustedCardsRepository trustedCards,
                         AttestationPrompts prompts) {
    this(session.getConfig().attestationMode, session, onlineVerifier, trustedCards, prompts);
  }

  public AttestationTask(AttestationMode mode,
                         CardSession session,
                         OnlineCardVerifier onlineVerifier,
                         TrustedCardsRepository trustedCards,
                         AttestationPrompts prompts) {
    this.mode = Objects.requireNonNull(mode, "mode");
    this.session = Objects.requireNonNull(session, "session");
    this.onlineVerifier = Objects.requireNonNull(onlineVerifier, "onlineVerifier");
    this.trustedCards = Objects.requireNonNull(trustedCards, "trustedCards");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.events = session.getEvents();
    this.keepSessionOpened = session.getConfig().keepSessionOpened;
  }

  /** When set, the transport is not paused while waiting on the online verification. */
  public void setKeepSessionOpened(boolean keepSessionOpened) {
    this.keepSessionOpened = keepSessionOpened;
  }

  public AttestationMode getMode() {
    return mode;
  }

  public synchronized CompletableFuture<Attestation> run() {
    if (result != null) {
      throw new IllegalStateException("AttestationTask can only be run once");
    }
    result = new CompletableFuture<>();
    events.onPhase(SdkPhase.ATTESTING, "Attesting card in " + mode + " mode");
    try {
      Card card = session.environment().getCard();
      if (card == null) {
        throw new CardSdkException(SdkError.MISSING_PREFLIGHT_READ);
      }
      current = Attestation.empty(mode);
      if (attestCardKey(card)) {
        complete();
      } else {
        continueAttestation(card);
      }
    } catch (CardSdkException e) {
      fail(e);
    }
    return result;
  }

  /** Tears down any pending online verification. An unfinished run fails as cancelled. */
  @Override
  public void close() {
    onlineSlot.close();
    CompletableFuture<Attestation> pending = result;
    if (pending != null && !pending.isDone()) {
      pending.completeExceptionally(new CardSdkException(SdkError.USER_CANCELLED, "Attestation task closed"));
    }
  }

  /** @return {@code true} when a cached verdict already satisfies the requested mode */
  private boolean attestCardKey(Card card) throws CardSdkException {
    try {
      session.send(new AttestCardKeyCommand());
    } catch (CardSdkException e) {
      if (!e.is(SdkError.CARD_VERIFICATION_FAILED)) {
        throw e;
      }
      events.onLog(LogCategory.ATTESTATION, "Card key attestation failed: " + e.getMessage());
      current = current.withCardKeyAttestation(AttestationStatus.FAILED);
      return false;
    }
    Optional<Attestation> cached = trustedCards.lookup(card.getCardPublicKey());
    if (cached.isPresent() && cached.get().satisfies(mode)) {
      events.onLog(LogCategory.ATTESTATION, "Card already trusted: " + cached.get());
      current = cached.get();
      return true;
    }
    current = current.withCardKeyAttestation(AttestationStatus.VERIFIED_OFFLINE);
    return false;
  }

  private void continueAttestation(Card card) throws CardSdkException {
    switch (mode) {
      case OFFLINE:
        processReport();
        break;
      case NORMAL:
        dispatchOnline(card);
        waitForOnline();
        break;
      case FULL:
        dispatchOnline(card);
        attestWallets();
        waitForOnline();
        break;
      default:
        throw new IllegalStateException("Unhandled mode " + mode);
    }
  }

  /** One wallet at a time, in card order; they share the transport. */
  private void attestWallets() throws CardSdkException {
    Card card = session.environment().getCard();
    boolean warnings = false;
    for (CardWallet wallet : card.getWallets()) {
      Integer signed = wallet.getTotalSignedHashes();
      if (signed != null && signed > MAX_COUNTER) {
        events.onLog(LogCategory.ATTESTATION, "Wallet " + wallet.getIndex() + " signed " + signed + " hashes");
        warnings = true;
      }
    }
    try {
      for (CardWallet wallet : card.getWallets()) {
        AttestWalletKeyResponse response = session.send(new AttestWalletKeyCommand(wallet.getPublicKey()));
        Integer counter = response.getCounter();
        if (counter != null && counter > MAX_COUNTER) {
          events.onLog(LogCategory.ATTESTATION, "Wallet " + wallet.getIndex() + " attested " + counter + " times");
          warnings = true;
        }
      }
    } catch (CardSdkException e) {
      if (!e.is(SdkError.CARD_VERIFICATION_FAILED)) {
        throw e;
      }
      events.onLog(LogCategory.ATTESTATION, "Wallet key attestation failed: " + e.getMessage());
      current = current.withWalletKeysAttestation(AttestationStatus.FAILED);
      return;
    }
    current = current.withWalletKeysAttestation(warnings ? AttestationStatus.WARNING : AttestationStatus.VERIFIED);
  }

  /**
   * Development cards never pass online and a card whose stored record already failed
   * need not be asked about, so both get an immediate verification failure.
   */
  private void dispatchOnline(Card card) {
    if (card.isDevelopmentCard()
        || card.getAttestation().getCardKeyAttestation() == AttestationStatus.FAILED) {
      events.onLog(LogCategory.NETWORK, "Online verification skipped for " + card.getCardId());
      onlineSlot.dispatch(CompletableFuture.failedFuture(
          new CardSdkException(SdkError.CARD_VERIFICATION_FAILED, "Online verification skipped")));
      return;
    }
    events.onPhase(SdkPhase.VERIFYING_ONLINE, "Verifying " + card.getCardId() + " online");
    CompletableFuture<VerificationRecord> lookup;
    try {
      lookup = onlineVerifier.getCardInfo(card.getCardId(), card.getCardPublicKey());
    } catch (RuntimeException e) {
      lookup = CompletableFuture.failedFuture(
          new CardSdkException(SdkError.NETWORK_ERROR, "Online verifier failed: " + e.getMessage(), e));
    }
    onlineSlot.dispatch(lookup);
  }

  private void waitForOnline() {
    if (!keepSessionOpened) {
      session.pause();
    }
    long generation = onlineSlot.generation();
    onlineSlot.current().whenComplete((record, error) -> {
      if (!onlineSlot.isCurrent(generation) || result.isDone()) {
        return;
      }
      try {
        onOnlineResult(record, error);
      } catch (CardSdkException e) {
        fail(e);
      }
    });
  }

  private void onOnlineResult(VerificationRecord record, Throwable error) throws CardSdkException {
    if (error == null) {
      events.onLog(LogCategory.NETWORK, "Online verification passed: " + record);
      current = current.withCardKeyAttestation(AttestationStatus.VERIFIED);
      trustedCards.record(session.environment().getCard().getCardPublicKey(), current);
    } else {
      CardSdkException failure = CardSdkException.from(error, SdkError.NETWORK_ERROR);
      if (failure.is(SdkError.CARD_VERIFICATION_FAILED)) {
        events.onLog(LogCategory.NETWORK, "Online verification rejected the card: " + failure.getMessage());
        current = current.withCardKeyAttestation(AttestationStatus.FAILED);
      } else {
        events.onLog(LogCategory.NETWORK, "Online verification unavailable: " + failure.getMessage());
      }
    }
    processReport();
  }

  private void processReport() throws CardSdkException {
    Card card = session.environment().getCard();
    AttestationStatus status = current.getStatus();
    events.onLog(LogCategory.ATTESTATION, "Attestation report: " + current);
    switch (status) {
      case FAILED:
      case SKIPPED: {
        boolean developmentCard = card.isDevelopmentCard();
        if (developmentCard || session.getConfig().allowUntrustedCards) {
          events.onPhase(SdkPhase.WAITING_FOR_USER, "Attestation failed");
          prompts.attestationDidFail(developmentCard, this::accept, this::cancel);
          return;
        }
        throw new CardSdkException(SdkError.CARD_VERIFICATION_FAILED, "Card failed attestation");
      }
      case VERIFIED_OFFLINE:
        if (session.getConfig().attestationMode == AttestationMode.OFFLINE) {
          complete();
          return;
        }
        events.onPhase(SdkPhase.WAITING_FOR_USER, "Attestation completed offline");
        prompts.attestationCompletedOffline(this::accept, this::cancel, this::retryOnline);
        return;
      case WARNING:
        events.onPhase(SdkPhase.WAITING_FOR_USER, "Attestation completed with warnings");
        prompts.attestationCompletedWithWarnings(this::accept);
        return;
      default:
        complete();
    }
  }

  private void retryOnline() {
    if (result.isDone()) {
      events.onLog(LogCategory.ATTESTATION, "Ignoring online retry, attestation already finished");
      return;
    }
    Card card = session.environment().getCard();
    if (card == null) {
      fail(new CardSdkException(SdkError.MISSING_PREFLIGHT_READ));
      return;
    }
    events.onLog(LogCategory.ATTESTATION, "Retrying online verification");
    dispatchOnline(card);
    waitForOnline();
  }

  private void complete() throws CardSdkException {
    Attestation verdict = current;
    session.updateCard(card -> card.withAttestation(verdict));
    onlineSlot.close();
    events.onPhase(SdkPhase.COMPLETE, verdict.toString());
    result.complete(verdict);
  }

  private void accept() {
    try {
      complete();
    } catch (CardSdkException e) {
      fail(e);
    }
  }

  private void cancel() {
    fail(new CardSdkException(SdkError.USER_CANCELLED));
  }

  private void fail(CardSdkException error) {
    onlineSlot.close();
    events.onPhase(SdkPhase.FAILED, error.getMessage());
    result.completeExceptionally(error);
  }
}
