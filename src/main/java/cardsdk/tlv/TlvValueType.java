package cardsdk.tlv;

import cardsdk.card.CardStatus;
import cardsdk.card.SettingsMask;
import cardsdk.crypto.EllipticCurve;

import java.time.LocalDate;
import java.util.List;

/** Value kinds a tag may carry, with the Java type each kind decodes to. */
public enum TlvValueType {
  /** Raw bytes rendered as an upper-case hex string, e.g. card and batch ids. */
  HEX_STRING(String.class),
  /** UTF-8 text; trailing zero bytes are dropped on decode. */
  UTF8_STRING(String.class),
  /** Non-negative integer, big-endian, trimmed to its minimal width. */
  INT_VALUE(Integer.class),
  /** Exactly one unsigned byte. */
  BYTE(Integer.class),
  DATA(byte[].class),
  /** One byte, zero for false. */
  BOOL(Boolean.class),
  /** Four bytes: two-byte year, month, day. */
  DATE_TIME(LocalDate.class),
  CARD_STATUS(CardStatus.class),
  /** Two bytes, or four when high flags are set. */
  SETTINGS_MASK(SettingsMask.class),
  ELLIPTIC_CURVE(EllipticCurve.class),
  /** Nested TLV sequence. */
  TLV_LIST(List.class);

  private final Class<?> javaType;

  TlvValueType(Class<?> javaType) {
    this.javaType = javaType;
  }

  public Class<?> getJavaType() {
    return javaType;
  }
}
