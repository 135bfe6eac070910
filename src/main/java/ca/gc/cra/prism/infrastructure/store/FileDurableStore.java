package ca.gc.cra.prism.infrastructure.store;

import ca.gc.cra.prism.application.port.DurableStorePort;
import ca.gc.cra.prism.domain.store.ResultSummary;
import ca.gc.cra.prism.domain.store.StoredResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DurableStorePort} writing one JSON document per key into a directory.
 *
 * <p>File names are the SHA-256 of the key, so arbitrary keys are safe. Both writes go to a temporary file in the
 * store directory first, so readers only ever see complete documents. {@link #create(StoredResult)} then
 * hard-links it to the target, which fails if the key exists and keeps creation atomic per key across processes;
 * {@link #replace(StoredResult)} moves it over the target.</p>
 *
 * @since PRISM 0.1
 */
public final class FileDurableStore implements DurableStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileDurableStore.class);
  private static final String SUFFIX = ".json";

  private final Path directory;
  private final StoredResultJson codec = new StoredResultJson();

  /**
   * Creates a store rooted at {@code directory}, creating it if needed.
   *
   * @param directory store directory
   * @throws IOException if the directory cannot be created
   */
  public FileDurableStore(Path directory) throws IOException {
    this.directory = Files.createDirectories(Objects.requireNonNull(directory, "directory"));
  }

  @Override
  public boolean create(StoredResult result) throws IOException {
    Path target = pathFor(result.key());
    Path temp = Files.createTempFile(directory, "prism-", ".tmp");
    try {
      Files.write(temp, codec.write(result));
      if (!publish(temp, target)) {
        return false;
      }
    } finally {
      Files.deleteIfExists(temp);
    }
    log.debug("Stored {} at {}", result.key(), target.getFileName());
    return true;
  }

  // Hard-links a fully written document into place; the link fails instead of replacing an existing target.
  private static boolean publish(Path temp, Path target) throws IOException {
    try {
      Files.createLink(target, temp);
      return true;
    } catch (FileAlreadyExistsException ex) {
      return false;
    } catch (UnsupportedOperationException ex) {
      log.debug("Hard links unsupported for {}; moving instead", target.getParent());
      try {
        Files.move(temp, target);
        return true;
      } catch (FileAlreadyExistsException exists) {
        return false;
      }
    }
  }

  @Override
  public void replace(StoredResult result) throws IOException {
    Path target = pathFor(result.key());
    Path temp = Files.createTempFile(directory, "prism-", ".tmp");
    try {
      Files.write(temp, codec.write(result));
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  @Override
  public Optional<StoredResult> get(String key) throws IOException {
    Path path = pathFor(key);
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(path);
    } catch (NoSuchFileException ex) {
      return Optional.empty();
    }
    return Optional.of(parse(path, bytes));
  }

  @Override
  public List<ResultSummary> list() throws IOException {
    List<ResultSummary> summaries = new ArrayList<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
      for (Path file : files) {
        byte[] bytes;
        try {
          bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException ex) {
          continue;
        }
        summaries.add(parse(file, bytes).summary());
      }
    }
    summaries.sort(Comparator.comparing(ResultSummary::key));
    return summaries;
  }

  @Override
  public boolean delete(String key) throws IOException {
    return Files.deleteIfExists(pathFor(key));
  }

  private StoredResult parse(Path path, byte[] bytes) throws IOException {
    try {
      return codec.read(bytes);
    } catch (IllegalArgumentException | DateTimeException ex) {
      throw new IOException("corrupt result document " + path.getFileName(), ex);
    }
  }

  private Path pathFor(String key) {
    Objects.requireNonNull(key, "key");
    try {
      byte[] hash = MessageDigest.getInstance("SHA-256").digest(key.getBytes(StandardCharsets.UTF_8));
      return directory.resolve(HexFormat.of().formatHex(hash) + SUFFIX);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
