package org.example.crowdledger.app;

import java.time.Clock;
import org.example.crowdledger.cli.ConsoleMenu;
import org.example.crowdledger.service.PlatformService;
import org.example.crowdledger.storage.ConfigJson;
import org.example.crowdledger.storage.DataPaths;
import org.example.crowdledger.storage.LocalAccount;

/**
 * Entry point of the CrowdLedger CLI.
 *
 * <ol>
 *   <li>Loads {@code data/config.json}, creating defaults if missing.
 *   <li>Resolves the local account name from {@code .local/account}.
 *   <li>Restores the platform state from {@code data/}.
 *   <li>Runs the {@link ConsoleMenu} until exit.
 * </ol>
 *
 * <p>Single-threaded; all state changes are saved by the platform after each committed workflow.
 */
public class Main {

  /**
   * Launches the CLI.
   *
   * @param args command-line arguments (unused)
   */
  public static void main(String[] args) {
    ConfigJson config = ConfigJson.loadOrCreateDefault();

    String account = LocalAccount.ensureCurrentAccount();

    PlatformService platform = PlatformService.open(config, DataPaths.DATA_DIR, Clock.systemUTC());

    System.out.println("========================================");
    System.out.println(" CrowdLedger CLI (Java)");
    System.out.println("========================================");
    System.out.println("Account: " + account);
    System.out.println("Config loaded from: " + ConfigJson.getConfigPath().toAbsolutePath());
    System.out.println("Type a number to choose an option, 'q' to quit.\n");

    ConsoleMenu menu =
        new ConsoleMenu(config, account, platform, LocalAccount.DEFAULT_FILE, DataPaths.DATA_DIR);
    menu.mainLoop();

    System.out.println("\nBye!");
  }
}
