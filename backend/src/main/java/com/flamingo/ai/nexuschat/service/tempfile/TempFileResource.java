package com.flamingo.ai.nexuschat.service.tempfile;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle to an on-disk copy of an upload, deleted on {@link #close()}.
 *
 * <p>Use with try-with-resources. Closing twice is a no-op.
 */
public final class TempFileResource implements AutoCloseable {

  private final Path path;
  private final TempFiles owner;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  TempFileResource(Path path, TempFiles owner) {
    this.path = path;
    this.owner = owner;
  }

  public Path getPath() {
    return path;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      owner.delete(path);
    }
  }
}
