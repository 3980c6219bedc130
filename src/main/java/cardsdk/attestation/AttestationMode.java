package cardsdk.attestation;

/** How much of the card is attested, ordered {@code OFFLINE < NORMAL < FULL}. */
public enum AttestationMode {
  /** Card key challenge only. */
  OFFLINE,
  /** Card key challenge plus the online verification service. */
  NORMAL,
  /** Everything in {@link #NORMAL} plus every wallet key on the card. */
  FULL;

  public boolean isAtLeast(AttestationMode other) {
    return compareTo(other) >= 0;
  }
}
