package cardsdk.trust;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSecureStorageTest {

  @TempDir
  Path directory;

  @Test
  void storesOverwritesAndDeletes() throws Exception {
    FileSecureStorage storage = new FileSecureStorage(directory.resolve("nested"));
    assertNull(storage.get("trustedCards"));

    storage.set("trustedCards", new byte[]{1});
    storage.set("trustedCards", new byte[]{2, 3});
    assertArrayEquals(new byte[]{2, 3}, storage.get("trustedCards"));
    assertTrue(Files.exists(directory.resolve("nested").resolve("trustedCards")));

    storage.delete("trustedCards");
    assertNull(storage.get("trustedCards"));
    storage.delete("trustedCards");
  }

  @Test
  void leavesNoTemporaryFilesBehind() throws Exception {
    FileSecureStorage storage = new FileSecureStorage(directory);
    storage.set("a", new byte[]{1});
    try (var files = Files.list(directory)) {
      assertFalse(files.anyMatch(path -> path.toString().endsWith(".tmp")));
    }
  }

  @Test
  void rejectsKeysThatEscapeTheDirectory() {
    FileSecureStorage storage = new FileSecureStorage(directory);
    assertThrows(IllegalArgumentException.class, () -> storage.get("../outside"));
    assertThrows(IllegalArgumentException.class, () -> storage.set("", new byte[0]));
  }
}
