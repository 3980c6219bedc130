package cardsdk.channel;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.command.ResponseApdu;
import cardsdk.tlv.TlvTag;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SecureChannelEnvelopeTest {

  private static final byte[] KEY = new byte[32];

  static {
    Arrays.fill(KEY, (byte) 0x5A);
  }

  @Test
  void plainModeIsIdentity() throws Exception {
    byte[] payload = {1, 2, 3};
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.NONE, null);
    assertFalse(envelope.isActive());
    assertSame(payload, envelope.protect(payload));
    assertSame(payload, envelope.unprotect(payload));
  }

  @Test
  void protectedPayloadRoundTrips() throws Exception {
    byte[] payload = "issuer data".getBytes();
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.FAST, KEY);

    byte[] sealed = envelope.protect(payload);
    assertEquals(SecureChannelEnvelope.NONCE_LENGTH + payload.length + SecureChannelEnvelope.TAG_BITS / 8,
        sealed.length);
    assertArrayEquals(payload, envelope.unprotect(sealed));
  }

  @Test
  void anyFlippedBitFailsAuthentication() throws Exception {
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.STRONG, KEY);
    byte[] sealed = envelope.protect(new byte[]{0x01, 0x02, 0x10, 0x20});

    for (int position = 0; position < sealed.length; position++) {
      byte[] tampered = sealed.clone();
      tampered[position] ^= 0x01;
      CardSdkException error = assertThrows(CardSdkException.class, () -> envelope.unprotect(tampered));
      assertEquals(SdkError.DECRYPTION_FAILED, error.getError());
    }
  }

  @Test
  void truncatedPayloadFails() throws Exception {
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.FAST, KEY);
    CardSdkException error = assertThrows(CardSdkException.class, () -> envelope.unprotect(new byte[20]));
    assertEquals(SdkError.DECRYPTION_FAILED, error.getError());
  }

  @Test
  void wrongKeyFails() throws Exception {
    byte[] sealed = SecureChannelEnvelope.of(EncryptionMode.FAST, KEY).protect(new byte[]{7});
    byte[] otherKey = KEY.clone();
    otherKey[0] = 0;
    SecureChannelEnvelope other = SecureChannelEnvelope.of(EncryptionMode.FAST, otherKey);
    assertEquals(SdkError.DECRYPTION_FAILED,
        assertThrows(CardSdkException.class, () -> other.unprotect(sealed)).getError());
  }

  @Test
  void encryptionWithoutUsableKeyIsRejected() {
    assertEquals(SdkError.MISSING_ENCRYPTION_KEY, assertThrows(CardSdkException.class,
        () -> SecureChannelEnvelope.of(EncryptionMode.FAST, null)).getError());
    assertEquals(SdkError.MISSING_ENCRYPTION_KEY, assertThrows(CardSdkException.class,
        () -> SecureChannelEnvelope.of(EncryptionMode.STRONG, new byte[7])).getError());
  }

  @Test
  void emptyPlaintextIsStillSealed() throws Exception {
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.FAST, KEY);
    byte[] sealed = envelope.protect(new byte[0]);
    assertEquals(SecureChannelEnvelope.NONCE_LENGTH + SecureChannelEnvelope.TAG_BITS / 8, sealed.length);
    assertEquals(0, envelope.unprotect(sealed).length);
  }

  @Test
  void strippedPayloadFailsAuthentication() throws Exception {
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.FAST, KEY);
    assertEquals(SdkError.DECRYPTION_FAILED,
        assertThrows(CardSdkException.class, () -> envelope.unprotect(new byte[0])).getError());
  }

  @Test
  void strippedSuccessResponseSurfacesAsDecryptionFailure() throws Exception {
    SecureChannelEnvelope envelope = SecureChannelEnvelope.of(EncryptionMode.FAST, KEY);
    ResponseApdu response = new ResponseApdu(0x9000, new byte[0]);
    CardSdkException error = assertThrows(CardSdkException.class,
        () -> response.decoder(envelope).decode(TlvTag.CARD_ID, String.class));
    assertEquals(SdkError.DECRYPTION_FAILED, error.getError());
  }
}
