package cardsdk.command;

import cardsdk.CardSdkException;
import cardsdk.crypto.CryptoUtils;
import cardsdk.crypto.EllipticCurve;

import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Checks an issuer signature over {@code cardId || issuerData [|| counter]}. The counter is
 * appended as four big-endian bytes when present.
 */
public final class IssuerDataVerifier {

  private IssuerDataVerifier() {
  }

  public static byte[] message(String cardId, byte[] issuerData, Integer counter) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(Hex.decode(cardId));
    out.writeBytes(issuerData);
    if (counter != null) {
      out.writeBytes(ByteBuffer.allocate(Integer.BYTES).putInt(counter).array());
    }
    return out.toByteArray();
  }

  public static boolean verify(String cardId,
                               byte[] issuerData,
                               Integer counter,
                               byte[] issuerPublicKey,
                               byte[] signature) throws CardSdkException {
    return CryptoUtils.verify(EllipticCurve.SECP256K1, issuerPublicKey,
        message(cardId, issuerData, counter), signature);
  }
}
