package cardsdk.card;

import cardsdk.crypto.EllipticCurve;

import java.util.Objects;

/** Wallet key slot as read from the card. */
public final class CardWallet {

  private final int index;
  private final byte[] publicKey;
  private final EllipticCurve curve;
  private final Integer totalSignedHashes;
  private final Integer remainingSignatures;

  public CardWallet(int index,
                    byte[] publicKey,
                    EllipticCurve curve,
                    Integer totalSignedHashes,
                    Integer remainingSignatures) {
    this.index = index;
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey").clone();
    this.curve = curve != null ? curve : EllipticCurve.SECP256K1;
    this.totalSignedHashes = totalSignedHashes;
    this.remainingSignatures = remainingSignatures;
  }

  public int getIndex() {
    return index;
  }

  public byte[] getPublicKey() {
    return publicKey.clone();
  }

  public EllipticCurve getCurve() {
    return curve;
  }

  /** Number of hashes signed so far, or {@code null} when the card does not report it. */
  public Integer getTotalSignedHashes() {
    return totalSignedHashes;
  }

  public Integer getRemainingSignatures() {
    return remainingSignatures;
  }

  @Override
  public String toString() {
    return "CardWallet[index=" + index + ", curve=" + curve + ", signedHashes=" + totalSignedHashes + "]";
  }
}
