package cardsdk.card;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Card operating system version, e.g. {@code 4.52r} or {@code 6.33d SDK}.
 */
public final class FirmwareVersion implements Comparable<FirmwareVersion> {

  public enum Type {
    RELEASE,
    SDK,
    SPECIAL
  }

  /** First version able to attest linked cards and import keys. */
  public static final FirmwareVersion KEYS_IMPORT_AVAILABLE = new FirmwareVersion(6, 16, 0, Type.RELEASE);

  private static final Pattern VERSION = Pattern.compile("^(\\d+)\\.(\\d+)(?:\\.(\\d+))?(.*)$");

  private final int major;
  private final int minor;
  private final int patch;
  private final Type type;

  public FirmwareVersion(int major, int minor, int patch, Type type) {
    if (major < 0 || minor < 0 || patch < 0) {
      throw new IllegalArgumentException("Version components must not be negative");
    }
    this.major = major;
    this.minor = minor;
    this.patch = patch;
    this.type = Objects.requireNonNull(type, "type");
  }

  public static FirmwareVersion parse(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Firmware version is required");
    }
    Matcher matcher = VERSION.matcher(value.trim());
    if (!matcher.matches()) {
      throw new IllegalArgumentException("Unrecognised firmware version: " + value);
    }
    int major = Integer.parseInt(matcher.group(1));
    int minor = Integer.parseInt(matcher.group(2));
    int patch = matcher.group(3) != null ? Integer.parseInt(matcher.group(3)) : 0;
    String suffix = matcher.group(4).trim();
    Type type;
    if (suffix.startsWith("d")) {
      type = Type.SDK;
    } else if (suffix.equals("r") || suffix.isEmpty()) {
      type = Type.RELEASE;
    } else {
      type = Type.SPECIAL;
    }
    return new FirmwareVersion(major, minor, patch, type);
  }

  public int getMajor() {
    return major;
  }

  public int getMinor() {
    return minor;
  }

  public int getPatch() {
    return patch;
  }

  public Type getType() {
    return type;
  }

  public boolean isDevelopment() {
    return type == Type.SDK;
  }

  public boolean isBefore(FirmwareVersion other) {
    return compareTo(other) < 0;
  }

  /** Orders by version number only; the build type is ignored. */
  @Override
  public int compareTo(FirmwareVersion other) {
    if (major != other.major) {
      return Integer.compare(major, other.major);
    }
    if (minor != other.minor) {
      return Integer.compare(minor, other.minor);
    }
    return Integer.compare(patch, other.patch);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FirmwareVersion)) {
      return false;
    }
    FirmwareVersion other = (FirmwareVersion) o;
    return major == other.major && minor == other.minor && patch == other.patch && type == other.type;
  }

  @Override
  public int hashCode() {
    return Objects.hash(major, minor, patch, type);
  }

  @Override
  public String toString() {
    String number = patch > 0
        ? String.format("%d.%02d.%d", major, minor, patch)
        : String.format("%d.%02d", major, minor);
    switch (type) {
      case SDK:
        return number + "d SDK";
      case SPECIAL:
        return number + " special";
      default:
        return number + "r";
    }
  }
}
