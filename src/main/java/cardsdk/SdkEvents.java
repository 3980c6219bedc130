package cardsdk;

/** Event callbacks surfaced by a {@link cardsdk.command.CardSession} and the tasks it runs. */
public interface SdkEvents {

  default void onPhase(SdkPhase phase, String detail) {
  }

  default void onLog(LogCategory category, String message) {
  }

  static SdkEvents none() {
    return new SdkEvents() {};
  }

  /** Prints every log line to stdout, prefixed with its category. */
  static SdkEvents console() {
    return new SdkEvents() {
      @Override
      public void onPhase(SdkPhase phase, String detail) {
        System.out.printf("[%s] %s%n", phase, detail);
      }

      @Override
      public void onLog(LogCategory category, String message) {
        System.out.printf("[%s] %s%n", category, message);
      }
    };
  }
}
