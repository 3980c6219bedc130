package cardsdk.command;

import cardsdk.crypto.CryptoUtils;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/** SHA-256 of a user code as the card expects it in {@code ACCESS_CODE} and {@code PASSCODE}. */
public final class UserCode {

  public enum Type {
    ACCESS_CODE("000000"),
    PASSCODE("000");

    private final String defaultValue;

    Type(String defaultValue) {
      this.defaultValue = defaultValue;
    }

    public String getDefaultValue() {
      return defaultValue;
    }
  }

  private final Type type;
  private final byte[] value;

  private UserCode(Type type, byte[] value) {
    this.type = type;
    this.value = value;
  }

  public static UserCode defaultCode(Type type) {
    return of(type, type.getDefaultValue());
  }

  public static UserCode of(Type type, String code) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(code, "code");
    return new UserCode(type, CryptoUtils.sha256(code.getBytes(StandardCharsets.UTF_8)));
  }

  public Type getType() {
    return type;
  }

  public byte[] getValue() {
    return value.clone();
  }

  public boolean isDefault() {
    return Arrays.equals(value, CryptoUtils.sha256(type.getDefaultValue().getBytes(StandardCharsets.UTF_8)));
  }

  @Override
  public String toString() {
    return "UserCode(" + type + (isDefault() ? ", default" : "") + ")";
  }
}
