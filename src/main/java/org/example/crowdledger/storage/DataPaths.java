package org.example.crowdledger.storage;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Centralized set of file-system paths used by storage components.
 *
 * <p>All paths are relative to the working directory:
 *
 * <ul>
 *   <li>{@link #DATA_DIR} – root data folder.
 *   <li>{@link #CONFIG_JSON} – tunable parameters.
 * </ul>
 *
 * <p>Inside a data directory the platform keeps {@link #LEDGER_FILE} (content collections,
 * profiles, usernames, the MAU histogram and token balances) and {@link #EVENTS_FILE} (workflow
 * event log).
 */
public final class DataPaths {
  private DataPaths() {}

  public static final Path DATA_DIR = Paths.get("data");

  public static final Path CONFIG_JSON = DATA_DIR.resolve("config.json");

  public static final String LEDGER_FILE = "ledger.json";

  public static final String EVENTS_FILE = "events.json";
}
