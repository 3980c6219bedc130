package cardsdk.card;

import java.util.EnumSet;
import java.util.Set;

/** Bit mask of card behaviour flags fixed at personalization. */
public final class SettingsMask {

  public enum Flag {
    IS_REUSABLE(0x0001),
    USE_ACTIVATION(0x0002),
    PERMANENT_WALLET(0x0004),
    USE_BLOCK(0x0008),
    ALLOW_SET_ACCESS_CODE(0x0010),
    ALLOW_SET_PASSCODE(0x0020),
    USE_CVC(0x0040),
    PROHIBIT_DEFAULT_ACCESS_CODE(0x0080),
    USE_ONE_COMMAND_AT_TIME(0x0100),
    USE_NDEF(0x0200),
    USE_DYNAMIC_NDEF(0x0400),
    SMART_SECURITY_DELAY(0x0800),
    ALLOW_UNENCRYPTED(0x1000),
    ALLOW_FAST_ENCRYPTION(0x2000),
    PROTECT_ISSUER_DATA_AGAINST_REPLAY(0x4000),
    ALLOW_SELECT_BLOCKCHAIN(0x8000),
    DISABLE_PRECOMPUTED_NDEF(0x00010000),
    SKIP_SECURITY_DELAY_IF_VALIDATED_BY_LINKED_TERMINAL(0x00080000),
    RESTRICT_OVERWRITE_ISSUER_EXTRA_DATA(0x00100000);

    private final int bit;

    Flag(int bit) {
      this.bit = bit;
    }

    public int getBit() {
      return bit;
    }
  }

  private final int rawValue;

  public SettingsMask(int rawValue) {
    this.rawValue = rawValue;
  }

  public static SettingsMask of(Flag... flags) {
    int value = 0;
    for (Flag flag : flags) {
      value |= flag.bit;
    }
    return new SettingsMask(value);
  }

  public int getRawValue() {
    return rawValue;
  }

  public boolean contains(Flag flag) {
    return (rawValue & flag.bit) != 0;
  }

  public Set<Flag> getFlags() {
    Set<Flag> flags = EnumSet.noneOf(Flag.class);
    for (Flag flag : Flag.values()) {
      if (contains(flag)) {
        flags.add(flag);
      }
    }
    return flags;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SettingsMask && ((SettingsMask) o).rawValue == rawValue;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(rawValue);
  }

  @Override
  public String toString() {
    return String.format("SettingsMask[0x%08X]", rawValue);
  }
}
