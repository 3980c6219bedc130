package cardsdk.trust;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySecureStorage implements SecureStorage {

  private final Map<String, byte[]> values = new ConcurrentHashMap<>();

  @Override
  public byte[] get(String key) {
    byte[] value = values.get(Objects.requireNonNull(key, "key"));
    return value != null ? value.clone() : null;
  }

  @Override
  public void set(String key, byte[] value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value").clone());
  }

  @Override
  public void delete(String key) {
    values.remove(Objects.requireNonNull(key, "key"));
  }
}
