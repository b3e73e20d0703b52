package io.intellixity.querygate.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Policy table backed by a file that operators edit in place.
 * <p>
 * The file is re-read when its modification time changes. A table that fails to parse, or whose
 * version is lower than the one in force, is logged and ignored; the previous table stays active.
 */
public final class FilePolicyTableSource implements PolicyTableSource {
  private static final Logger log = LoggerFactory.getLogger(FilePolicyTableSource.class);

  private final Path file;
  private final PolicyTableLoader loader;
  private volatile Loaded loaded;

  private record Loaded(PolicyTable table, FileTime modifiedAt) {}

  public FilePolicyTableSource(Path file, PolicyTableLoader loader) {
    this.file = Objects.requireNonNull(file, "file");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.loaded = new Loaded(loader.load(file), modifiedAt());
    log.info("querygate.policy loaded file={} version={}", file, loaded.table().version());
  }

  @Override
  public PolicyTable current() {
    Loaded snapshot = loaded;
    FileTime mtime = modifiedAt();
    if (mtime == null || mtime.equals(snapshot.modifiedAt())) return snapshot.table();
    return reload(mtime);
  }

  private synchronized PolicyTable reload(FileTime mtime) {
    Loaded snapshot = loaded;
    if (mtime.equals(snapshot.modifiedAt())) return snapshot.table();
    try {
      PolicyTable next = loader.load(file);
      if (next.version() < snapshot.table().version()) {
        log.warn("querygate.policy ignored file={} version={} older than active={}",
            file, next.version(), snapshot.table().version());
        loaded = new Loaded(snapshot.table(), mtime);
        return snapshot.table();
      }
      loaded = new Loaded(next, mtime);
      log.info("querygate.policy reloaded file={} version={}", file, next.version());
      return next;
    } catch (PolicyTableException e) {
      log.warn("querygate.policy reload failed file={} keeping version={}: {}",
          file, snapshot.table().version(), e.getMessage());
      loaded = new Loaded(snapshot.table(), mtime);
      return snapshot.table();
    }
  }

  private FileTime modifiedAt() {
    try {
      return Files.getLastModifiedTime(file);
    } catch (IOException e) {
      log.warn("querygate.policy cannot stat file={}: {}", file, e.getMessage());
      return null;
    }
  }
}
