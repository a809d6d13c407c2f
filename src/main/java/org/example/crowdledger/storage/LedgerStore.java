package org.example.crowdledger.storage;

import java.nio.file.Path;
import java.util.Optional;

/**
 * File-backed store for the platform state, token balances included.
 *
 * <p>The platform calls {@link #save(LedgerSnapshot)} once per committed workflow, so the file
 * only ever holds committed state. Content, profiles and tokens share one file, so a failed write
 * leaves the previous workflow's state whole. Writes use {@link JsonRepository#writeAtomic(Path, Object)}.
 *
 * <h2>Error handling</h2>
 *
 * Write failures are reported to {@code System.err} and do not throw: the in-memory state stays
 * authoritative and the next successful save catches the file up.
 */
public class LedgerStore {
  private final Path ledgerFile;

  public LedgerStore(Path ledgerFile) {
    this.ledgerFile = ledgerFile;
  }

  /** Convenience for a store whose file lives in {@code dir}. */
  public static LedgerStore in(Path dir) {
    return new LedgerStore(dir.resolve(DataPaths.LEDGER_FILE));
  }

  public Path ledgerFile() {
    return ledgerFile;
  }

  /**
   * Loads the last saved platform state.
   *
   * @return snapshot, or empty if none was saved or the file is unreadable
   */
  public Optional<LedgerSnapshot> load() {
    return JsonRepository.read(ledgerFile, LedgerSnapshot.class);
  }

  /**
   * Persists the platform state.
   *
   * @param snapshot committed state
   */
  public void save(LedgerSnapshot snapshot) {
    try {
      JsonRepository.writeAtomic(ledgerFile, snapshot);
    } catch (Exception e) {
      System.err.println("Failed to write " + ledgerFile.getFileName() + ": " + e.getMessage());
    }
  }
}
