package cardsdk.crypto;

import java.util.Locale;

/** Curves a card may use for its own key and for wallet keys. */
public enum EllipticCurve {
  SECP256K1("secp256k1"),
  SECP256R1("secp256r1"),
  ED25519("ed25519");

  private final String curveName;

  EllipticCurve(String curveName) {
    this.curveName = curveName;
  }

  /** Name used on the wire and by the JCE provider. */
  public String getCurveName() {
    return curveName;
  }

  public static EllipticCurve fromCurveName(String name) {
    if (name == null) {
      return null;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (EllipticCurve curve : values()) {
      if (curve.curveName.equals(normalized)) {
        return curve;
      }
    }
    return null;
  }
}
