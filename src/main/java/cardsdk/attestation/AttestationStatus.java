package cardsdk.attestation;

/**
 * Outcome of one attestation component. Constants are declared from least to most
 * severe, so the derived status of a verdict is the component with the highest ordinal.
 */
public enum AttestationStatus {
  NOT_ATTESTED,
  VERIFIED,
  VERIFIED_OFFLINE,
  WARNING,
  SKIPPED,
  FAILED;

  public boolean isMoreSevereThan(AttestationStatus other) {
    return compareTo(other) > 0;
  }

  public static AttestationStatus mostSevere(AttestationStatus first, AttestationStatus second) {
    return first.isMoreSevereThan(second) ? first : second;
  }
}
