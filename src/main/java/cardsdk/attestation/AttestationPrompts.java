package cardsdk.attestation;

/**
 * User decisions the attestation flow waits on. Each prompt must eventually invoke exactly
 * one of its callbacks, from any thread.
 */
public interface AttestationPrompts {

  void attestationDidFail(boolean developmentCard, Runnable onContinue, Runnable onCancel);

  void attestationCompletedOffline(Runnable onContinue, Runnable onCancel, Runnable onRetry);

  void attestationCompletedWithWarnings(Runnable onContinue);

  /** Accepts every outcome without asking. */
  static AttestationPrompts acceptAll() {
    return new AttestationPrompts() {
      @Override
      public void attestationDidFail(boolean developmentCard, Runnable onContinue, Runnable onCancel) {
        onContinue.run();
      }

      @Override
      public void attestationCompletedOffline(Runnable onContinue, Runnable onCancel, Runnable onRetry) {
        onContinue.run();
      }

      @Override
      public void attestationCompletedWithWarnings(Runnable onContinue) {
        onContinue.run();
      }
    };
  }
}
