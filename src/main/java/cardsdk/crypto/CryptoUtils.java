package cardsdk.crypto;

import cardsdk.CardSdkException;
import cardsdk.SdkError;

import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.bouncycastle.jce.interfaces.ECPrivateKey;
import org.bouncycastle.jce.interfaces.ECPublicKey;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.jce.spec.ECNamedCurveParameterSpec;
import org.bouncycastle.jce.spec.ECPrivateKeySpec;
import org.bouncycastle.jce.spec.ECPublicKeySpec;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.MessageDigest;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.Signature;
import java.security.SignatureException;
import java.security.spec.ECGenParameterSpec;
import java.util.Arrays;

/**
 * Hashing, random and signature helpers backed by BouncyCastle.
 *
 * <p>EC signatures are the plain 64-byte {@code r||s} form the card produces, computed
 * over SHA-256 of the message. Ed25519 signatures are computed over the message itself.</p>
 */
public final class CryptoUtils {

  private static final String PLAIN_ECDSA = "SHA256withPLAIN-ECDSA";
  private static final int EC_PRIVATE_KEY_LENGTH = 32;
  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private CryptoUtils() {
  }

  public static byte[] sha256(byte[]... parts) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      for (byte[] part : parts) {
        if (part != null) {
          digest.update(part);
        }
      }
      return digest.digest();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  public static byte[] generateRandomBytes(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
    byte[] bytes = new byte[count];
    SECURE_RANDOM.nextBytes(bytes);
    return bytes;
  }

  /**
   * Checks {@code signature} over {@code message}. A signature that simply does not match
   * returns {@code false}; a public key that cannot be parsed is reported as
   * {@link SdkError#CRYPTO_FAILED}.
   */
  public static boolean verify(EllipticCurve curve, byte[] publicKey, byte[] message, byte[] signature)
      throws CardSdkException {
    if (publicKey == null || message == null || signature == null) {
      throw new CardSdkException(SdkError.CRYPTO_FAILED, "Public key, message and signature are required");
    }
    if (curve == EllipticCurve.ED25519) {
      return verifyEd25519(publicKey, message, signature);
    }
    try {
      Signature verifier = Signature.getInstance(PLAIN_ECDSA, BouncyCastleProvider.PROVIDER_NAME);
      verifier.initVerify(toEcPublicKey(curve, publicKey));
      verifier.update(message);
      return verifier.verify(signature);
    } catch (SignatureException e) {
      return false;
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new CardSdkException(SdkError.CRYPTO_FAILED, "Unable to verify " + curve.getCurveName() + " signature", e);
    }
  }

  public static byte[] sign(EllipticCurve curve, byte[] privateKey, byte[] message) throws CardSdkException {
    if (curve == EllipticCurve.ED25519) {
      Ed25519Signer signer = new Ed25519Signer();
      signer.init(true, new Ed25519PrivateKeyParameters(privateKey, 0));
      signer.update(message, 0, message.length);
      return signer.generateSignature();
    }
    try {
      Signature signer = Signature.getInstance(PLAIN_ECDSA, BouncyCastleProvider.PROVIDER_NAME);
      signer.initSign(toEcPrivateKey(curve, privateKey));
      signer.update(message);
      return signer.sign();
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new CardSdkException(SdkError.CRYPTO_FAILED, "Unable to sign with " + curve.getCurveName(), e);
    }
  }

  /** Generates a key pair; EC public keys are returned uncompressed (65 bytes). */
  public static RawKeyPair generateKeyPair(EllipticCurve curve) throws CardSdkException {
    if (curve == EllipticCurve.ED25519) {
      Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(SECURE_RANDOM);
      return new RawKeyPair(privateKey.getEncoded(), privateKey.generatePublicKey().getEncoded());
    }
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
      generator.initialize(new ECGenParameterSpec(curve.getCurveName()), SECURE_RANDOM);
      KeyPair keyPair = generator.generateKeyPair();
      byte[] publicKey = ((ECPublicKey) keyPair.getPublic()).getQ().getEncoded(false);
      byte[] privateKey = toFixedLength(((ECPrivateKey) keyPair.getPrivate()).getD(), EC_PRIVATE_KEY_LENGTH);
      return new RawKeyPair(privateKey, publicKey);
    } catch (GeneralSecurityException e) {
      throw new CardSdkException(SdkError.CRYPTO_FAILED, "Unable to generate " + curve.getCurveName() + " key pair", e);
    }
  }

  private static boolean verifyEd25519(byte[] publicKey, byte[] message, byte[] signature) throws CardSdkException {
    if (publicKey.length != Ed25519PublicKeyParameters.KEY_SIZE) {
      throw new CardSdkException(SdkError.CRYPTO_FAILED, "Ed25519 public key must be 32 bytes");
    }
    Ed25519Signer verifier = new Ed25519Signer();
    verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
    verifier.update(message, 0, message.length);
    return verifier.verifySignature(signature);
  }

  private static PublicKey toEcPublicKey(EllipticCurve curve, byte[] publicKey) throws GeneralSecurityException {
    ECNamedCurveParameterSpec spec = ECNamedCurveTable.getParameterSpec(curve.getCurveName());
    ECPublicKeySpec keySpec = new ECPublicKeySpec(spec.getCurve().decodePoint(publicKey), spec);
    return KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME).generatePublic(keySpec);
  }

  private static PrivateKey toEcPrivateKey(EllipticCurve curve, byte[] privateKey) throws GeneralSecurityException {
    ECNamedCurveParameterSpec spec = ECNamedCurveTable.getParameterSpec(curve.getCurveName());
    ECPrivateKeySpec keySpec = new ECPrivateKeySpec(new BigInteger(1, privateKey), spec);
    return KeyFactory.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME).generatePrivate(keySpec);
  }

  private static byte[] toFixedLength(BigInteger value, int length) {
    byte[] raw = value.toByteArray();
    if (raw.length == length) {
      return raw;
    }
    if (raw.length > length) {
      return Arrays.copyOfRange(raw, raw.length - length, raw.length);
    }
    byte[] padded = new byte[length];
    System.arraycopy(raw, 0, padded, length - raw.length, raw.length);
    return padded;
  }
}
