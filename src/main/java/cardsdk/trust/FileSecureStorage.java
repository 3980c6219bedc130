package cardsdk.trust;

import cardsdk.CardSdkException;
import cardsdk.SdkError;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Stores each key as one file under a directory. Writes go through a temporary file and
 * an atomic move so a crash never leaves a half-written blob behind.
 */
public final class FileSecureStorage implements SecureStorage {

  private static final Pattern KEY = Pattern.compile("[A-Za-z0-9._-]+");

  private final Path directory;

  public FileSecureStorage(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  public Path getDirectory() {
    return directory;
  }

  @Override
  public byte[] get(String key) throws CardSdkException {
    Path file = resolve(key);
    if (!Files.exists(file)) {
      return null;
    }
    try {
      return Files.readAllBytes(file);
    } catch (IOException e) {
      throw new CardSdkException(SdkError.STORAGE_FAILED, "Unable to read " + file, e);
    }
  }

  @Override
  public void set(String key, byte[] value) throws CardSdkException {
    Path file = resolve(key);
    try {
      Files.createDirectories(directory);
      Path tmp = Files.createTempFile(directory, key, ".tmp");
      Files.write(tmp, value);
      Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new CardSdkException(SdkError.STORAGE_FAILED, "Unable to write " + file, e);
    }
  }

  @Override
  public void delete(String key) throws CardSdkException {
    Path file = resolve(key);
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      throw new CardSdkException(SdkError.STORAGE_FAILED, "Unable to delete " + file, e);
    }
  }

  private Path resolve(String key) {
    if (key == null || !KEY.matcher(key).matches()) {
      throw new IllegalArgumentException("Invalid storage key: " + key);
    }
    return directory.resolve(key);
  }
}
