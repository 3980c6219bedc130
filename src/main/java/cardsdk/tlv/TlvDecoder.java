package cardsdk.tlv;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.CardStatus;
import cardsdk.card.SettingsMask;
import cardsdk.crypto.EllipticCurve;

import org.bouncycastle.util.encoders.Hex;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Typed reader over a decoded TLV sequence.
 */
public final class TlvDecoder {

  private final List<Tlv> tlvs;

  public TlvDecoder(List<Tlv> tlvs) {
    this.tlvs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(tlvs, "tlvs")));
  }

  public static TlvDecoder of(byte[] serialized) throws CardSdkException {
    return new TlvDecoder(Tlv.deserialize(serialized));
  }

  public List<Tlv> getTlvs() {
    return tlvs;
  }

  public boolean contains(TlvTag tag) {
    return find(tag) != null;
  }

  /** First record with {@code tag}, converted to the tag's value type. */
  public <T> T decode(TlvTag tag, Class<T> type) throws CardSdkException {
    Tlv tlv = find(tag);
    if (tlv == null) {
      throw new CardSdkException(SdkError.DECODING_MISSING_TAG, "Missing required tag " + tag);
    }
    return convert(tlv, tag, type);
  }

  /** Same as {@link #decode} but returns {@code null} when the tag is absent. */
  public <T> T decodeOptional(TlvTag tag, Class<T> type) throws CardSdkException {
    Tlv tlv = find(tag);
    return tlv != null ? convert(tlv, tag, type) : null;
  }

  /** Every record with {@code tag} in wire order; empty when there is none. */
  public <T> List<T> decodeAll(TlvTag tag, Class<T> type) throws CardSdkException {
    List<T> values = new ArrayList<>();
    for (Tlv tlv : tlvs) {
      if (tlv.getTagCode() == tag.getCode()) {
        values.add(convert(tlv, tag, type));
      }
    }
    return values;
  }

  /** Decoder over the nested sequence of a {@link TlvValueType#TLV_LIST} tag, or {@code null}. */
  public TlvDecoder decodeNested(TlvTag tag) throws CardSdkException {
    Tlv tlv = find(tag);
    if (tlv == null) {
      return null;
    }
    List<?> nested = convert(tlv, tag, List.class);
    List<Tlv> records = new ArrayList<>();
    for (Object item : nested) {
      records.add((Tlv) item);
    }
    return new TlvDecoder(records);
  }

  private Tlv find(TlvTag tag) {
    for (Tlv tlv : tlvs) {
      if (tlv.getTagCode() == tag.getCode()) {
        return tlv;
      }
    }
    return null;
  }

  private static <T> T convert(Tlv tlv, TlvTag tag, Class<T> type) throws CardSdkException {
    TlvValueType valueType = tag.getValueType();
    if (!type.isAssignableFrom(valueType.getJavaType())) {
      throw new IllegalArgumentException(tag + " decodes to " + valueType.getJavaType().getSimpleName()
          + ", not " + type.getSimpleName());
    }
    return type.cast(decodeValue(tag, tlv.getValue()));
  }

  static Object decodeValue(TlvTag tag, byte[] value) throws CardSdkException {
    switch (tag.getValueType()) {
      case HEX_STRING:
        return Hex.toHexString(value).toUpperCase(Locale.ROOT);
      case UTF8_STRING:
        return decodeUtf8(tag, value);
      case INT_VALUE:
        return decodeInt(tag, value);
      case BYTE:
        requireLength(tag, value, 1);
        return value[0] & 0xFF;
      case DATA:
        return value;
      case BOOL:
        requireLength(tag, value, 1);
        return value[0] != 0x00;
      case DATE_TIME:
        return decodeDate(tag, value);
      case CARD_STATUS: {
        requireLength(tag, value, 1);
        CardStatus status = CardStatus.fromCode(value[0] & 0xFF);
        if (status == null) {
          throw mismatch(tag, String.format("unknown card status 0x%02X", value[0] & 0xFF));
        }
        return status;
      }
      case SETTINGS_MASK:
        if (value.length == 2) {
          return new SettingsMask(((value[0] & 0xFF) << 8) | (value[1] & 0xFF));
        }
        if (value.length == 4) {
          return new SettingsMask(ByteBuffer.wrap(value).getInt());
        }
        throw mismatch(tag, "expected 2 or 4 bytes, got " + value.length);
      case ELLIPTIC_CURVE: {
        String name = decodeUtf8(tag, value);
        EllipticCurve curve = EllipticCurve.fromCurveName(name);
        if (curve == null) {
          throw mismatch(tag, "unknown curve " + name);
        }
        return curve;
      }
      case TLV_LIST:
        try {
          return Tlv.deserialize(value);
        } catch (CardSdkException e) {
          throw new CardSdkException(SdkError.DECODING_TYPE_MISMATCH, tag + ": " + e.getMessage(), e);
        }
      default:
        throw mismatch(tag, "unsupported value type " + tag.getValueType());
    }
  }

  private static int decodeInt(TlvTag tag, byte[] value) throws CardSdkException {
    if (value.length == 0 || value.length > Long.BYTES) {
      throw mismatch(tag, "integer width " + value.length + " is out of range");
    }
    long result = 0;
    for (byte b : value) {
      result = (result << 8) | (b & 0xFF);
    }
    if (result < 0 || result > Integer.MAX_VALUE) {
      throw mismatch(tag, "integer does not fit in 31 bits");
    }
    return (int) result;
  }

  private static String decodeUtf8(TlvTag tag, byte[] value) throws CardSdkException {
    int end = value.length;
    while (end > 0 && value[end - 1] == 0x00) {
      end--;
    }
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(value, 0, end))
          .toString();
    } catch (CharacterCodingException e) {
      throw new CardSdkException(SdkError.DECODING_TYPE_MISMATCH, tag + " is not valid UTF-8", e);
    }
  }

  private static LocalDate decodeDate(TlvTag tag, byte[] value) throws CardSdkException {
    requireLength(tag, value, 4);
    int year = ((value[0] & 0xFF) << 8) | (value[1] & 0xFF);
    try {
      return LocalDate.of(year, value[2] & 0xFF, value[3] & 0xFF);
    } catch (DateTimeException e) {
      throw new CardSdkException(SdkError.DECODING_TYPE_MISMATCH, tag + " is not a valid date", e);
    }
  }

  private static void requireLength(TlvTag tag, byte[] value, int expected) throws CardSdkException {
    if (value.length != expected) {
      throw mismatch(tag, "expected " + expected + " byte(s), got " + value.length);
    }
  }

  private static CardSdkException mismatch(TlvTag tag, String detail) {
    return new CardSdkException(SdkError.DECODING_TYPE_MISMATCH, tag + ": " + detail);
  }
}
