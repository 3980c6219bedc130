package cardsdk;

/** High level lifecycle phases of a card session. */
public enum SdkPhase {
  CONNECTING,
  READING,
  ATTESTING,
  VERIFYING_ONLINE,
  WAITING_FOR_USER,
  COMPLETE,
  FAILED
}
