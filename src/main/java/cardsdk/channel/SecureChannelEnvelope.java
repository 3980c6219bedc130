package cardsdk.channel;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.crypto.CryptoUtils;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.util.Arrays;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

/**
 * AES-GCM wrapper around serialized TLV payloads.
 *
 * <p>A protected payload is {@code nonce(12) || ciphertext || tag(16)}. With
 * {@link EncryptionMode#NONE} both directions return the input unchanged. Otherwise an
 * empty plaintext is still sealed, so an encrypted payload is never shorter than nonce and
 * tag.</p>
 */
public final class SecureChannelEnvelope {

  static final int NONCE_LENGTH = 12;
  static final int TAG_BITS = 128;
  private static final String TRANSFORMATION = "AES/GCM/NoPadding";

  private static final SecureChannelEnvelope PLAIN = new SecureChannelEnvelope(EncryptionMode.NONE, null);

  static {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private final EncryptionMode mode;
  private final SecretKeySpec key;

  private SecureChannelEnvelope(EncryptionMode mode, SecretKeySpec key) {
    this.mode = mode;
    this.key = key;
  }

  public static SecureChannelEnvelope plain() {
    return PLAIN;
  }

  /**
   * @throws CardSdkException {@link SdkError#MISSING_ENCRYPTION_KEY} when encryption is
   *     requested without a usable key
   */
  public static SecureChannelEnvelope of(EncryptionMode mode, byte[] key) throws CardSdkException {
    if (mode == null || mode == EncryptionMode.NONE) {
      return PLAIN;
    }
    if (key == null) {
      throw new CardSdkException(SdkError.MISSING_ENCRYPTION_KEY);
    }
    if (key.length != 16 && key.length != 24 && key.length != 32) {
      throw new CardSdkException(SdkError.MISSING_ENCRYPTION_KEY,
          "Session key must be 16, 24 or 32 bytes, got " + key.length);
    }
    return new SecureChannelEnvelope(mode, new SecretKeySpec(key, "AES"));
  }

  public EncryptionMode getMode() {
    return mode;
  }

  public boolean isActive() {
    return mode != EncryptionMode.NONE;
  }

  public byte[] protect(byte[] plaintext) throws CardSdkException {
    if (!isActive()) {
      return plaintext;
    }
    byte[] nonce = CryptoUtils.generateRandomBytes(NONCE_LENGTH);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION, BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      byte[] sealed = cipher.doFinal(plaintext);
      byte[] out = new byte[NONCE_LENGTH + sealed.length];
      System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
      System.arraycopy(sealed, 0, out, NONCE_LENGTH, sealed.length);
      return out;
    } catch (GeneralSecurityException e) {
      throw new CardSdkException(SdkError.CRYPTO_FAILED, "Unable to encrypt payload", e);
    }
  }

  /**
   * @throws CardSdkException {@link SdkError#DECRYPTION_FAILED} when the payload is too
   *     short or fails authentication
   */
  public byte[] unprotect(byte[] protectedData) throws CardSdkException {
    if (!isActive()) {
      return protectedData;
    }
    if (protectedData.length < NONCE_LENGTH + TAG_BITS / 8) {
      throw new CardSdkException(SdkError.DECRYPTION_FAILED,
          "Encrypted payload too short: " + protectedData.length + " bytes");
    }
    byte[] nonce = Arrays.copyOfRange(protectedData, 0, NONCE_LENGTH);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION, BouncyCastleProvider.PROVIDER_NAME);
      cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
      return cipher.doFinal(protectedData, NONCE_LENGTH, protectedData.length - NONCE_LENGTH);
    } catch (GeneralSecurityException e) {
      throw new CardSdkException(SdkError.DECRYPTION_FAILED, "Encrypted payload failed authentication", e);
    }
  }

  @Override
  public String toString() {
    return "SecureChannelEnvelope(" + mode + ")";
  }
}
