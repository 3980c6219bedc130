package cardsdk.tlv;

import cardsdk.CardSdkException;
import cardsdk.SdkError;

import org.bouncycastle.util.encoders.Hex;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One tag-length-value record. On the wire: a one-byte tag, a one-byte length (or
 * {@code 0xFF} followed by a two-byte big-endian length) and the value bytes.
 */
public final class Tlv {

  static final int MAX_SHORT_LENGTH = 0xFE;
  static final int EXTENDED_LENGTH_MARKER = 0xFF;
  static final int MAX_LENGTH = 0xFFFF;

  private final int tagCode;
  private final byte[] value;

  public Tlv(TlvTag tag, byte[] value) {
    this(Objects.requireNonNull(tag, "tag").getCode(), value);
  }

  public Tlv(int tagCode, byte[] value) {
    if (tagCode < 0 || tagCode > 0xFF) {
      throw new IllegalArgumentException("Tag code must fit in one byte: " + tagCode);
    }
    this.tagCode = tagCode;
    this.value = Objects.requireNonNull(value, "value").clone();
  }

  /** Registered tag for this record, or {@link TlvTag#UNKNOWN}. */
  public TlvTag getTag() {
    return TlvTag.fromCode(tagCode);
  }

  public int getTagCode() {
    return tagCode;
  }

  public int getLength() {
    return value.length;
  }

  public byte[] getValue() {
    return value.clone();
  }

  public static byte[] serialize(List<Tlv> tlvs) throws CardSdkException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (Tlv tlv : tlvs) {
      tlv.writeTo(out);
    }
    return out.toByteArray();
  }

  /**
   * Parses a TLV sequence. Records with unregistered tags are kept as-is so callers can
   * still decode the tags they know.
   */
  public static List<Tlv> deserialize(byte[] data) throws CardSdkException {
    if (data == null || data.length == 0) {
      return Collections.emptyList();
    }
    List<Tlv> tlvs = new ArrayList<>();
    int offset = 0;
    while (offset < data.length) {
      int tag = data[offset++] & 0xFF;
      if (offset >= data.length) {
        throw new CardSdkException(SdkError.MALFORMED_TLV, String.format("Missing length for tag 0x%02X", tag));
      }
      int length = data[offset++] & 0xFF;
      if (length == EXTENDED_LENGTH_MARKER) {
        if (offset + 2 > data.length) {
          throw new CardSdkException(SdkError.MALFORMED_TLV,
              String.format("Truncated extended length for tag 0x%02X", tag));
        }
        length = ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF);
        offset += 2;
      }
      if (offset + length > data.length) {
        throw new CardSdkException(SdkError.MALFORMED_TLV,
            String.format("Tag 0x%02X declares %d bytes but only %d remain", tag, length, data.length - offset));
      }
      tlvs.add(new Tlv(tag, Arrays.copyOfRange(data, offset, offset + length)));
      offset += length;
    }
    return tlvs;
  }

  void writeTo(ByteArrayOutputStream out) throws CardSdkException {
    if (value.length > MAX_LENGTH) {
      throw new CardSdkException(SdkError.ENCODING_FAILED,
          String.format("Value of tag 0x%02X is too long: %d bytes", tagCode, value.length));
    }
    out.write(tagCode);
    writeLength(out, value.length);
    out.write(value, 0, value.length);
  }

  private static void writeLength(ByteArrayOutputStream out, int length) {
    if (length <= MAX_SHORT_LENGTH) {
      out.write(length);
    } else {
      out.write(EXTENDED_LENGTH_MARKER);
      out.write((length >> 8) & 0xFF);
      out.write(length & 0xFF);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tlv)) {
      return false;
    }
    Tlv other = (Tlv) o;
    return tagCode == other.tagCode && Arrays.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return 31 * tagCode + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    TlvTag tag = getTag();
    String name = tag != TlvTag.UNKNOWN ? tag.name() : String.format("0x%02X", tagCode);
    return name + "[" + value.length + "]: " + Hex.toHexString(value).toUpperCase(Locale.ROOT);
  }
}
