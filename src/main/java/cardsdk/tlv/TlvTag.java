package cardsdk.tlv;

import java.util.HashMap;
import java.util.Map;

/**
 * Tag registry of the card protocol. Codes are stable wire constants.
 */
public enum TlvTag {
  UNKNOWN(0x00, TlvValueType.DATA, true),
  CARD_ID(0x01, TlvValueType.HEX_STRING),
  STATUS(0x02, TlvValueType.CARD_STATUS),
  CARD_PUBLIC_KEY(0x03, TlvValueType.DATA),
  CARD_SIGNATURE(0x04, TlvValueType.DATA),
  CURVE_ID(0x05, TlvValueType.ELLIPTIC_CURVE),
  SETTINGS_MASK(0x0A, TlvValueType.SETTINGS_MASK),
  CARD_DATA(0x0C, TlvValueType.TLV_LIST),
  ACCESS_CODE(0x10, TlvValueType.DATA),
  PASSCODE(0x11, TlvValueType.DATA),
  CHALLENGE(0x16, TlvValueType.DATA),
  SALT(0x17, TlvValueType.DATA),
  CHECK_WALLET_COUNTER(0x19, TlvValueType.INT_VALUE),
  INTERACTION_MODE(0x23, TlvValueType.BYTE),
  LEGACY_MODE(0x29, TlvValueType.BYTE),
  ISSUER_DATA_PUBLIC_KEY(0x30, TlvValueType.DATA),
  ISSUER_DATA(0x32, TlvValueType.DATA),
  ISSUER_DATA_SIGNATURE(0x33, TlvValueType.DATA),
  ISSUER_DATA_COUNTER(0x35, TlvValueType.INT_VALUE),
  IS_ACTIVATED(0x3A, TlvValueType.BOOL),
  TERMINAL_PUBLIC_KEY(0x5C, TlvValueType.DATA),
  WALLET_PUBLIC_KEY(0x60, TlvValueType.DATA),
  WALLET_SIGNATURE(0x61, TlvValueType.DATA),
  WALLET_REMAINING_SIGNATURES(0x62, TlvValueType.INT_VALUE),
  WALLET_SIGNED_HASHES(0x63, TlvValueType.INT_VALUE),
  WALLET_INDEX(0x65, TlvValueType.INT_VALUE),
  WALLETS_COUNT(0x66, TlvValueType.BYTE),
  FIRMWARE_VERSION(0x80, TlvValueType.UTF8_STRING),
  BATCH_ID(0x81, TlvValueType.HEX_STRING),
  MANUFACTURE_DATE_TIME(0x82, TlvValueType.DATE_TIME),
  ISSUER_NAME(0x83, TlvValueType.UTF8_STRING),
  BACKUP_CARD_PUBLIC_KEY(0xA5, TlvValueType.DATA, true);

  private static final Map<Integer, TlvTag> BY_CODE = new HashMap<>();

  static {
    for (TlvTag tag : values()) {
      if (tag != UNKNOWN) {
        BY_CODE.put(tag.code, tag);
      }
    }
  }

  private final int code;
  private final TlvValueType valueType;
  private final boolean multiValued;

  TlvTag(int code, TlvValueType valueType) {
    this(code, valueType, false);
  }

  TlvTag(int code, TlvValueType valueType, boolean multiValued) {
    this.code = code;
    this.valueType = valueType;
    this.multiValued = multiValued;
  }

  public int getCode() {
    return code;
  }

  public TlvValueType getValueType() {
    return valueType;
  }

  /** Whether a message may carry several records with this tag. */
  public boolean isMultiValued() {
    return multiValued;
  }

  public static TlvTag fromCode(int code) {
    TlvTag tag = BY_CODE.get(code & 0xFF);
    return tag != null ? tag : UNKNOWN;
  }
}
