package com.flamingo.ai.nexuschat.service.tempfile;

import com.flamingo.ai.nexuschat.config.NexusConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Creates scoped temporary copies of uploads for backends that need a file on disk.
 *
 * <p>Deletion is retried with exponential backoff. A file that still cannot be removed is left
 * to {@code deleteOnExit}.
 */
@Component
@Slf4j
public class TempFiles {

  private static final String PREFIX = "nexus-";

  /** Removes a file from disk. */
  @FunctionalInterface
  public interface PathDeleter {
    void delete(Path path) throws IOException;
  }

  private final Retry deleteRetry;
  private final PathDeleter deleter;

  @Autowired
  public TempFiles(NexusConfig nexusConfig) {
    this(nexusConfig.getTempFiles(), Files::deleteIfExists);
  }

  TempFiles(NexusConfig.TempFiles settings, PathDeleter deleter) {
    this.deleter = deleter;
    this.deleteRetry =
        Retry.of(
            "temp-file-delete",
            RetryConfig.custom()
                .maxAttempts(settings.getDeleteMaxAttempts())
                .intervalFunction(
                    IntervalFunction.ofExponentialBackoff(
                        settings.getDeleteInitialDelay(), settings.getDeleteBackoffMultiplier()))
                .retryExceptions(IOException.class)
                .build());
  }

  /**
   * Writes the bytes to a new temporary file.
   *
   * @param bytes content to write
   * @param suffix file suffix including the dot, e.g. ".pdf"
   * @return an open handle; the caller must close it
   * @throws IOException if the file cannot be created or written
   */
  public TempFileResource create(byte[] bytes, String suffix) throws IOException {
    Path path = Files.createTempFile(PREFIX, suffix);
    path.toFile().deleteOnExit();
    TempFileResource resource = new TempFileResource(path, this);
    try {
      Files.write(path, bytes);
    } catch (IOException e) {
      resource.close();
      throw e;
    }
    log.debug("Created temp file {} ({} bytes)", path, bytes.length);
    return resource;
  }

  /**
   * Runs the callback against a temporary copy of the bytes and deletes the copy afterwards,
   * whether the callback returns or throws.
   */
  public <T> T withTempFile(byte[] bytes, String suffix, Function<Path, T> callback)
      throws IOException {
    try (TempFileResource resource = create(bytes, suffix)) {
      return callback.apply(resource.getPath());
    }
  }

  void delete(Path path) {
    try {
      deleteRetry.executeCallable(
          () -> {
            deleter.delete(path);
            return null;
          });
      log.debug("Deleted temp file {}", path);
    } catch (Exception e) {
      log.warn(
          "Could not delete temp file {} after {} attempts: {}",
          path,
          deleteRetry.getRetryConfig().getMaxAttempts(),
          e.getMessage());
    }
  }
}
