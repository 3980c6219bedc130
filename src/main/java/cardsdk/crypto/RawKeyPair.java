package cardsdk.crypto;

import java.util.Arrays;
import java.util.Objects;

/** Private and public key in the raw encodings used on the wire. */
public final class RawKeyPair {

  private final byte[] privateKey;
  private final byte[] publicKey;

  public RawKeyPair(byte[] privateKey, byte[] publicKey) {
    this.privateKey = Objects.requireNonNull(privateKey, "privateKey").clone();
    this.publicKey = Objects.requireNonNull(publicKey, "publicKey").clone();
  }

  public byte[] getPrivateKey() {
    return privateKey.clone();
  }

  public byte[] getPublicKey() {
    return publicKey.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawKeyPair)) {
      return false;
    }
    RawKeyPair other = (RawKeyPair) o;
    return Arrays.equals(privateKey, other.privateKey) && Arrays.equals(publicKey, other.publicKey);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(privateKey) + Arrays.hashCode(publicKey);
  }
}
