package org.example.crowdledger.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * Platform configuration holder with load/save helpers.
 *
 * <p>Holds the economic constants, the genesis timestamp that drives MAU bucketing, the
 * administrator and platform principals, and runtime switches. Values are loaded from a JSON file
 * ({@code data/config.json} by default). If the file is missing, a default file is written; if it
 * is unreadable, in-memory defaults are used.
 *
 * <p><b>File format:</b> pretty-printed JSON produced by Gson. All fields are public for simple
 * serialization/deserialization.
 *
 * <pre>{@code
 * ConfigJson cfg = ConfigJson.loadOrCreateDefault();
 * System.out.println(cfg.genesisEpochSeconds);
 * }</pre>
 */
public class ConfigJson {

  /** Network genesis in epoch seconds; MAU period 0 starts here. Default: 2024-01-01T00:00:00Z. */
  public long genesisEpochSeconds = 1_704_067_200L;

  /**
   * Reward numerator in whole tokens: one harvested like pays {@code baseReward / mau²} tokens.
   */
  public long baseReward = 1_000_000L;

  /** Per-action fee as a percentage of the per-like reward. */
  public long commissionPercent = 1L;

  /** Principal allowed to withdraw collected fees. */
  public String administrator = "admin";

  /** Token account that receives fees on behalf of the platform. */
  public String platformAccount = "platform";

  /** Enables the event log when {@code true}. */
  public boolean eventsLogEnabled = true;

  /** Saves ledger state to disk after every committed workflow when {@code true}. */
  public boolean persistState = true;

  /** Whole tokens handed out by the CLI demo faucet. */
  public long faucetGrant = 1_000_000L;

  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  /**
   * Returns the default location of the configuration file.
   *
   * @return {@code data/config.json}
   */
  public static Path getConfigPath() {
    return DataPaths.CONFIG_JSON;
  }

  /**
   * Loads configuration from {@link #getConfigPath()}, creating the file with defaults if it does
   * not exist.
   *
   * @return a non-null configuration
   */
  public static ConfigJson loadOrCreateDefault() {
    return load(getConfigPath());
  }

  /**
   * Loads configuration from {@code path}, writing a default file there when missing.
   *
   * <p>If the file is present but cannot be parsed, in-memory defaults are returned and the cause
   * is printed to {@code System.err}. Parent directories are created as necessary.
   *
   * @param path configuration file
   * @return a non-null configuration
   */
  public static ConfigJson load(Path path) {
    try {
      ensureParentDir(path);
      if (Files.exists(path)) {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          ConfigJson cfg = GSON.fromJson(br, ConfigJson.class);
          return (cfg != null) ? cfg : writeDefault(path);
        }
      } else {
        return writeDefault(path);
      }
    } catch (IOException | JsonParseException e) {
      System.err.println(
          "Failed to load " + path + ", using in-memory defaults. Cause: " + e.getMessage());
      return new ConfigJson();
    }
  }

  private static ConfigJson writeDefault(Path path) throws IOException {
    ConfigJson def = new ConfigJson();
    try (BufferedWriter bw =
        Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(def, bw);
    }
    return def;
  }

  private static void ensureParentDir(Path p) throws IOException {
    Path parent = p.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
