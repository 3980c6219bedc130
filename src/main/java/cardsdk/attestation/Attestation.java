package cardsdk.attestation;

import java.util.Objects;

/** Attestation verdict for one card together with the mode it was achieved under. */
public final class Attestation {

  public static final Attestation EMPTY =
      new Attestation(AttestationStatus.NOT_ATTESTED, AttestationStatus.NOT_ATTESTED, AttestationMode.OFFLINE);

  private final AttestationStatus cardKeyAttestation;
  private final AttestationStatus walletKeysAttestation;
  private final AttestationMode mode;

  public Attestation(AttestationStatus cardKeyAttestation,
                     AttestationStatus walletKeysAttestation,
                     AttestationMode mode) {
    this.cardKeyAttestation = Objects.requireNonNull(cardKeyAttestation, "cardKeyAttestation");
    this.walletKeysAttestation = Objects.requireNonNull(walletKeysAttestation, "walletKeysAttestation");
    this.mode = Objects.requireNonNull(mode, "mode");
  }

  public static Attestation empty(AttestationMode mode) {
    return new Attestation(AttestationStatus.NOT_ATTESTED, AttestationStatus.NOT_ATTESTED, mode);
  }

  public AttestationStatus getCardKeyAttestation() {
    return cardKeyAttestation;
  }

  public AttestationStatus getWalletKeysAttestation() {
    return walletKeysAttestation;
  }

  public AttestationMode getMode() {
    return mode;
  }

  /** Most severe of the component statuses. */
  public AttestationStatus getStatus() {
    return AttestationStatus.mostSevere(cardKeyAttestation, walletKeysAttestation);
  }

  /** Whether this verdict was achieved under a mode at least as strict as {@code requested}. */
  public boolean satisfies(AttestationMode requested) {
    return mode.isAtLeast(requested);
  }

  public Attestation withCardKeyAttestation(AttestationStatus value) {
    return new Attestation(value, walletKeysAttestation, mode);
  }

  public Attestation withWalletKeysAttestation(AttestationStatus value) {
    return new Attestation(cardKeyAttestation, value, mode);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Attestation)) {
      return false;
    }
    Attestation other = (Attestation) o;
    return cardKeyAttestation == other.cardKeyAttestation
        && walletKeysAttestation == other.walletKeysAttestation
        && mode == other.mode;
  }

  @Override
  public int hashCode() {
    return Objects.hash(cardKeyAttestation, walletKeysAttestation, mode);
  }

  @Override
  public String toString() {
    return "Attestation[cardKey=" + cardKeyAttestation + ", walletKeys=" + walletKeysAttestation
        + ", mode=" + mode + ", status=" + getStatus() + "]";
  }
}
