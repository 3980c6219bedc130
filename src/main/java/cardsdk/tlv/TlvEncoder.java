package cardsdk.tlv;

import cardsdk.CardSdkException;
import cardsdk.SdkError;
import cardsdk.card.CardStatus;
import cardsdk.card.SettingsMask;
import cardsdk.crypto.EllipticCurve;

import org.bouncycastle.util.encoders.Hex;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/** Converts typed values into {@link Tlv} records according to each tag's value type. */
public final class TlvEncoder {

  private static final Pattern HEX = Pattern.compile("^([0-9A-Fa-f]{2})*$");

  private TlvEncoder() {
  }

  public static Tlv encode(TlvTag tag, Object value) throws CardSdkException {
    if (tag == null || tag == TlvTag.UNKNOWN) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, "Cannot encode a value for an unknown tag");
    }
    if (value == null) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, "Value for " + tag + " is null");
    }
    return new Tlv(tag, encodeValue(tag, value));
  }

  private static byte[] encodeValue(TlvTag tag, Object value) throws CardSdkException {
    switch (tag.getValueType()) {
      case HEX_STRING:
        return encodeHex(tag, expect(tag, value, String.class));
      case UTF8_STRING:
        return encodeUtf8(tag, value);
      case INT_VALUE:
        return trimmedBigEndian(expectNonNegative(tag, value, Integer.MAX_VALUE));
      case BYTE:
        return new byte[]{(byte) expectNonNegative(tag, value, 0xFF)};
      case DATA:
        return expect(tag, value, byte[].class).clone();
      case BOOL:
        return new byte[]{(byte) (expect(tag, value, Boolean.class) ? 0x01 : 0x00)};
      case DATE_TIME:
        return encodeDate(tag, expect(tag, value, LocalDate.class));
      case CARD_STATUS:
        return new byte[]{(byte) expect(tag, value, CardStatus.class).getCode()};
      case SETTINGS_MASK:
        return encodeSettingsMask(expect(tag, value, SettingsMask.class));
      case ELLIPTIC_CURVE:
        return expect(tag, value, EllipticCurve.class).getCurveName().getBytes(StandardCharsets.UTF_8);
      case TLV_LIST:
        return encodeNested(tag, expect(tag, value, List.class));
      default:
        throw new CardSdkException(SdkError.ENCODING_FAILED, "Unsupported value type " + tag.getValueType());
    }
  }

  /** Minimal big-endian form; zero is a single zero byte. */
  static byte[] trimmedBigEndian(long value) {
    byte[] full = ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    int start = 0;
    while (start < full.length - 1 && full[start] == 0x00) {
      start++;
    }
    return Arrays.copyOfRange(full, start, full.length);
  }

  private static <T> T expect(TlvTag tag, Object value, Class<T> type) throws CardSdkException {
    if (!type.isInstance(value)) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, String.format(
          "%s expects %s but got %s", tag, type.getSimpleName(), value.getClass().getSimpleName()));
    }
    return type.cast(value);
  }

  private static long expectNonNegative(TlvTag tag, Object value, long max) throws CardSdkException {
    if (!(value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, String.format(
          "%s expects an integer but got %s", tag, value.getClass().getSimpleName()));
    }
    long number = ((Number) value).longValue();
    if (number < 0 || number > max) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, String.format(
          "%s value %d is outside 0..%d", tag, number, max));
    }
    return number;
  }

  private static byte[] encodeHex(TlvTag tag, String value) throws CardSdkException {
    if (!HEX.matcher(value).matches()) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, tag + " expects an even-length hex string");
    }
    return Hex.decode(value);
  }

  private static byte[] encodeUtf8(TlvTag tag, Object value) throws CardSdkException {
    try {
      if (value instanceof byte[]) {
        byte[] bytes = (byte[]) value;
        StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes));
        return bytes.clone();
      }
      ByteBuffer encoded = StandardCharsets.UTF_8.newEncoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .encode(CharBuffer.wrap(expect(tag, value, String.class)));
      byte[] bytes = new byte[encoded.remaining()];
      encoded.get(bytes);
      return bytes;
    } catch (CharacterCodingException e) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, tag + " value is not valid UTF-8", e);
    }
  }

  private static byte[] encodeDate(TlvTag tag, LocalDate date) throws CardSdkException {
    int year = date.getYear();
    if (year < 0 || year > 0xFFFF) {
      throw new CardSdkException(SdkError.ENCODING_FAILED, tag + " year out of range: " + year);
    }
    return new byte[]{
        (byte) ((year >> 8) & 0xFF),
        (byte) (year & 0xFF),
        (byte) date.getMonthValue(),
        (byte) date.getDayOfMonth()};
  }

  private static byte[] encodeSettingsMask(SettingsMask mask) {
    int raw = mask.getRawValue();
    if ((raw & 0xFFFF0000) == 0) {
      return new byte[]{(byte) ((raw >> 8) & 0xFF), (byte) (raw & 0xFF)};
    }
    return ByteBuffer.allocate(Integer.BYTES).putInt(raw).array();
  }

  private static byte[] encodeNested(TlvTag tag, List<?> items) throws CardSdkException {
    TlvBuilder nested = new TlvBuilder();
    for (Object item : items) {
      if (!(item instanceof Tlv)) {
        throw new CardSdkException(SdkError.ENCODING_FAILED, tag + " expects a list of TLV records");
      }
      nested.add((Tlv) item);
    }
    return nested.serialize();
  }
}
