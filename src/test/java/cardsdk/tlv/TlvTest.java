package cardsdk.tlv;

import cardsdk.CardSdkException;
import cardsdk.SdkError;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TlvTest {

  @Test
  void shortLengthUsesOneByte() throws Exception {
    byte[] encoded = Tlv.serialize(List.of(new Tlv(TlvTag.SALT, new byte[254])));
    assertEquals(2 + 254, encoded.length);
    assertEquals(0x17, encoded[0] & 0xFF);
    assertEquals(0xFE, encoded[1] & 0xFF);
  }

  @Test
  void lengthOf255UsesExtendedForm() throws Exception {
    byte[] encoded = Tlv.serialize(List.of(new Tlv(TlvTag.SALT, new byte[255])));
    assertEquals(4 + 255, encoded.length);
    assertEquals(0xFF, encoded[1] & 0xFF);
    assertEquals(0x00, encoded[2] & 0xFF);
    assertEquals(0xFF, encoded[3] & 0xFF);
    assertEquals(255, Tlv.deserialize(encoded).get(0).getLength());
  }

  @Test
  void extendedLengthRoundTripsAt256() throws Exception {
    byte[] value = new byte[256];
    value[0] = 0x11;
    value[255] = 0x22;
    byte[] encoded = Tlv.serialize(List.of(new Tlv(TlvTag.ISSUER_DATA, value)));
    assertEquals(0xFF, encoded[1] & 0xFF);
    assertEquals(0x01, encoded[2] & 0xFF);
    assertEquals(0x00, encoded[3] & 0xFF);

    List<Tlv> decoded = Tlv.deserialize(encoded);
    assertEquals(1, decoded.size());
    assertArrayEquals(value, decoded.get(0).getValue());
  }

  @Test
  void zeroLengthRecordRoundTrips() throws Exception {
    byte[] encoded = Tlv.serialize(List.of(new Tlv(TlvTag.ISSUER_DATA, new byte[0])));
    assertArrayEquals(new byte[]{0x32, 0x00}, encoded);
    Tlv decoded = Tlv.deserialize(encoded).get(0);
    assertEquals(TlvTag.ISSUER_DATA, decoded.getTag());
    assertEquals(0, decoded.getLength());
  }

  @Test
  void valuesAboveTwoByteLengthAreRejected() {
    Tlv tooLong = new Tlv(TlvTag.ISSUER_DATA, new byte[0x10000]);
    CardSdkException error = assertThrows(CardSdkException.class, () -> Tlv.serialize(List.of(tooLong)));
    assertEquals(SdkError.ENCODING_FAILED, error.getError());
  }

  @Test
  void unknownTagsAreKeptAlongsideKnownOnes() throws Exception {
    byte[] encoded = {(byte) 0xEE, 0x02, 0x01, 0x02, 0x01, 0x02, (byte) 0xCB, 0x79};
    List<Tlv> decoded = Tlv.deserialize(encoded);
    assertEquals(2, decoded.size());
    assertEquals(TlvTag.UNKNOWN, decoded.get(0).getTag());
    assertEquals(0xEE, decoded.get(0).getTagCode());
    assertEquals("CB79", new TlvDecoder(decoded).decode(TlvTag.CARD_ID, String.class));
  }

  @Test
  void truncatedInputIsMalformed() {
    assertEquals(SdkError.MALFORMED_TLV, assertThrows(CardSdkException.class,
        () -> Tlv.deserialize(new byte[]{0x01})).getError());
    assertEquals(SdkError.MALFORMED_TLV, assertThrows(CardSdkException.class,
        () -> Tlv.deserialize(new byte[]{0x01, 0x04, 0x00})).getError());
    assertEquals(SdkError.MALFORMED_TLV, assertThrows(CardSdkException.class,
        () -> Tlv.deserialize(new byte[]{0x01, (byte) 0xFF, 0x01})).getError());
  }

  @Test
  void emptyInputDecodesToNoRecords() throws Exception {
    assertTrue(Tlv.deserialize(new byte[0]).isEmpty());
  }

  @Test
  void recordOrderIsPreserved() throws Exception {
    List<Tlv> records = List.of(
        new Tlv(TlvTag.SALT, new byte[]{1}),
        new Tlv(TlvTag.CARD_ID, new byte[]{2}),
        new Tlv(TlvTag.CHALLENGE, new byte[]{3}));
    assertEquals(records, Tlv.deserialize(Tlv.serialize(records)));
  }
}
