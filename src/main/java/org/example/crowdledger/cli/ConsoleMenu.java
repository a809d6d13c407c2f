package org.example.crowdledger.cli;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.format.DateTimeFormatter;
import java.util.List;
import org.example.crowdledger.model.ContentId;
import org.example.crowdledger.model.ContentRecord;
import org.example.crowdledger.model.ContentType;
import org.example.crowdledger.model.Digest;
import org.example.crowdledger.model.EventLog;
import org.example.crowdledger.model.LedgerException;
import org.example.crowdledger.model.UserProfile;
import org.example.crowdledger.service.EconomicsEngine;
import org.example.crowdledger.service.PlatformService;
import org.example.crowdledger.service.UserService;
import org.example.crowdledger.storage.ConfigJson;
import org.example.crowdledger.storage.LocalAccount;

/**
 * Interactive console for the platform.
 *
 * <p>Renders menus, reads input through {@link InputUtils}, calls {@link PlatformService} as the
 * session's current principal and prints results to {@code System.out}.
 *
 * <h2>Error handling</h2>
 *
 * <ul>
 *   <li>A rejected workflow prints {@code Failed: <REASON> <message>} and the menu continues.
 *   <li>Malformed input (bad identifier, bad hex) prints {@code Invalid input: ...}.
 * </ul>
 *
 * <p>Token amounts are entered and shown in whole tokens (18 decimals).
 */
public class ConsoleMenu {

  private final ConfigJson config;
  private final PlatformService platform;
  private final UserService users;
  private final Path accountFile;
  private final Path exportDir;

  /**
   * @param config loaded configuration
   * @param account principal the session starts as
   * @param platform platform service
   * @param accountFile where "make default" saves the current account
   * @param exportDir directory for JSON exports
   */
  public ConsoleMenu(
      ConfigJson config, String account, PlatformService platform, Path accountFile, Path exportDir) {
    this.config = config;
    this.platform = platform;
    this.users = new UserService(account, platform);
    this.accountFile = accountFile;
    this.exportDir = exportDir;
  }

  /** Runs until the user exits or input is closed. */
  public void mainLoop() {
    while (true) {
      printMainMenu();
      String choice = InputUtils.readTrimmed("Select: ");

      if (choice == null) {
        System.out.println("Input closed. Exiting.");
        return;
      }

      switch (choice.toLowerCase()) {
        case "1" -> menuContent();
        case "2" -> menuVoting();
        case "3" -> menuAccount();
        case "4" -> menuPlatform();
        case "5" -> menuUsers();
        case "6" -> showSettings();
        case "7", "q", "quit", "exit" -> {
          return;
        }
        default -> System.out.println("Unknown option. Please try again.");
      }
    }
  }

  private void printMainMenu() {
    System.out.println();
    System.out.println("Main Menu  [" + users.current() + "]");
    System.out.println("1. Content");
    System.out.println("2. Vote & Harvest");
    System.out.println("3. My Account");
    System.out.println("4. Platform");
    System.out.println("5. Users");
    System.out.println("6. Settings");
    System.out.println("7. Exit");
  }

  // =========================
  // Submenu: Content
  // =========================

  private void menuContent() {
    while (true) {
      System.out.println();
      System.out.println("Content");
      System.out.println("1. Upload");
      System.out.println("2. Show Content");
      System.out.println("3. List My Content");
      System.out.println("4. Reply (link my content to a target)");
      System.out.println("5. Show Replies");
      System.out.println("6. Delete My Content");
      System.out.println("7. Export My Content (JSON)");
      System.out.println("0. Back");

      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      switch (c) {
        case "1" -> actionUpload();
        case "2" -> actionShowContent();
        case "3" -> actionListMine();
        case "4" -> actionReply();
        case "5" -> actionShowReplies();
        case "6" -> actionVoluntaryDelete();
        case "7" -> actionExport();
        default -> System.out.println("Unknown option. Try again.");
      }
    }
  }

  private void actionUpload() {
    String typeStr = InputUtils.readTrimmed("Content type (e.g. POST, COMMENT, IMAGE): ");
    if (typeStr == null || typeStr.isBlank()) {
      System.out.println("No type provided.");
      return;
    }
    String content = InputUtils.readTrimmed("Content (64 hex chars, or text to hash): ");
    if (content == null || content.isBlank()) {
      System.out.println("No content provided.");
      return;
    }
    String meta = InputUtils.readTrimmed("Metadata (hex/text, empty = none): ");
    attempt(
        () -> {
          ContentType type = ContentType.parse(typeStr);
          ContentId id = platform.upload(users.current(), digest(content), digest(meta), type);
          System.out.println("Uploaded: " + id);
        });
  }

  private void actionShowContent() {
    ContentId id = readId("Content id (TYPE:index): ");
    if (id == null) return;
    attempt(() -> printRecord(id, platform.getContentById(id)));
  }

  private void actionListMine() {
    List<ContentId> ids = platform.listContentByOwner(users.current());
    if (ids.isEmpty()) {
      System.out.println("No content yet.");
      return;
    }
    System.out.println(
        pad("id", 20) + " " + pad("likes", 7) + " " + pad("dislikes", 9) + " " + "harvested");
    System.out.println("-".repeat(20 + 1 + 7 + 1 + 9 + 1 + 9));
    for (ContentId id : ids) {
      ContentRecord r = platform.getContentById(id);
      System.out.println(
          pad(id.toString(), 20)
              + " "
              + pad(String.valueOf(r.likes), 7)
              + " "
              + pad(String.valueOf(r.dislikes), 9)
              + " "
              + r.harvestedLikes);
    }
  }

  private void actionReply() {
    ContentId reply = readId("Your reply id (TYPE:index): ");
    if (reply == null) return;
    ContentId target = readId("Target id (TYPE:index): ");
    if (target == null) return;
    attempt(
        () -> {
          platform.reply(users.current(), reply, target);
          System.out.println("Linked " + reply + " -> " + target);
        });
  }

  private void actionShowReplies() {
    ContentId id = readId("Content id (TYPE:index): ");
    if (id == null) return;
    attempt(
        () -> {
          System.out.println("Replies to " + id + ": " + platform.getRepliesOf(id));
          System.out.println(id + " replies to: " + platform.getRepliedBy(id));
        });
  }

  private void actionVoluntaryDelete() {
    ContentId id = readId("Content id to delete (TYPE:index): ");
    if (id == null) return;
    attempt(
        () -> {
          platform.voluntarilyDelete(users.current(), id);
          System.out.println("Deleted " + id);
        });
  }

  private void actionExport() {
    try {
      Path p = platform.exportContentOf(users.current(), exportDir);
      System.out.println("Exported to: " + p.toAbsolutePath());
    } catch (IOException e) {
      System.out.println("Export failed: " + e.getMessage());
    }
  }

  // =========================
  // Submenu: Vote & Harvest
  // =========================

  private void menuVoting() {
    while (true) {
      System.out.println();
      System.out.println("Vote & Harvest");
      System.out.println("1. Like");
      System.out.println("2. Dislike");
      System.out.println("3. Harvest Likes");
      System.out.println("4. Request Deletion (crowd disapproval)");
      System.out.println("0. Back");

      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      switch (c) {
        case "1" -> actionVote(true);
        case "2" -> actionVote(false);
        case "3" -> actionHarvest();
        case "4" -> actionDeletion();
        default -> System.out.println("Unknown option. Try again.");
      }
    }
  }

  private void actionVote(boolean like) {
    ContentId id = readId("Content id (TYPE:index): ");
    if (id == null) return;
    attempt(
        () -> {
          if (like) platform.like(users.current(), id);
          else platform.dislike(users.current(), id);
          System.out.println((like ? "Liked " : "Disliked ") + id);
        });
  }

  private void actionHarvest() {
    ContentId id = readId("Content id (TYPE:index): ");
    if (id == null) return;
    attempt(
        () -> {
          BigInteger minted = platform.harvestLikes(users.current(), id);
          System.out.println("Harvested " + tokens(minted) + " tokens for the owner of " + id);
        });
  }

  private void actionDeletion() {
    ContentId id = readId("Content id (TYPE:index): ");
    if (id == null) return;
    attempt(
        () -> {
          platform.deletion(users.current(), id);
          System.out.println("Removed " + id + "; owner received a strike.");
        });
  }

  // =========================
  // Submenu: My Account
  // =========================

  private void menuAccount() {
    while (true) {
      System.out.println();
      System.out.println("My Account");
      System.out.println("1. Show Profile");
      System.out.println("2. Claim Username");
      System.out.println("3. Update Metadata");
      System.out.println("4. Balance & Allowance");
      System.out.println("5. Get Demo Tokens");
      System.out.println("6. Approve Platform Allowance");
      System.out.println("7. Recent Events");
      System.out.println("0. Back");

      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      switch (c) {
        case "1" -> actionShowProfile();
        case "2" -> actionClaimUsername();
        case "3" -> actionUpdateMetadata();
        case "4" -> actionBalance();
        case "5" -> attempt(
            () -> System.out.println("Received " + tokens(platform.faucet(users.current())) + " tokens."));
        case "6" -> actionApprove();
        case "7" -> actionRecentEvents(false);
        default -> System.out.println("Unknown option. Try again.");
      }
    }
  }

  private void actionShowProfile() {
    UserProfile p = platform.getProfile(users.current());
    System.out.println();
    System.out.println("== Profile ==");
    System.out.println("Account:          " + users.current());
    System.out.println("Username:         " + (p.userName.isEmpty() ? "-" : p.userName));
    System.out.println("Metadata:         " + (p.metadataHash.isZero() ? "-" : p.metadataHash.toHex()));
    System.out.println("Strikes:          " + p.strikes);
    System.out.println("Last interaction: " + (p.latestInteractionTime == 0 ? "-" : p.latestInteractionTime));
  }

  private void actionClaimUsername() {
    String name = InputUtils.readTrimmed("Username (4-15 of a-z, 0-9, _): ");
    if (name == null || name.isBlank()) {
      System.out.println("No username provided.");
      return;
    }
    String meta = InputUtils.readTrimmed("Profile metadata (hex/text, empty = none): ");
    attempt(
        () -> {
          platform.createUser(users.current(), name, digest(meta));
          System.out.println("Username claimed: " + name);
        });
  }

  private void actionUpdateMetadata() {
    String meta = InputUtils.readTrimmed("Profile metadata (hex/text, empty = clear): ");
    attempt(
        () -> {
          platform.updateMetadata(users.current(), digest(meta));
          System.out.println("Metadata updated.");
        });
  }

  private void actionBalance() {
    String me = users.current();
    System.out.println("Balance:   " + tokens(platform.balanceOf(me)));
    System.out.println("Allowance: " + tokens(platform.allowanceOf(me)) + " (for " + platform.platformAccount() + ")");
    attempt(() -> System.out.println("Vote fee:  " + tokens(platform.quoteVoteFee())));
    attempt(() -> System.out.println("Upload fee: " + tokens(platform.quoteUploadFee(me))));
  }

  private void actionApprove() {
    String s = InputUtils.readTrimmed("Allowance in whole tokens: ");
    long whole = InputUtils.parseLongOr(s, -1);
    if (whole < 0) {
      System.out.println("Invalid number.");
      return;
    }
    attempt(
        () -> {
          platform.approvePlatform(
              users.current(), EconomicsEngine.SCALE.multiply(BigInteger.valueOf(whole)));
          System.out.println("Allowance set to " + whole + " tokens.");
        });
  }

  // =========================
  // Submenu: Platform
  // =========================

  private void menuPlatform() {
    while (true) {
      System.out.println();
      System.out.println("Platform");
      System.out.println("1. Monthly Active Users");
      System.out.println("2. Library Sizes");
      System.out.println("3. Validate Ledger");
      System.out.println("4. Recent Events (global)");
      System.out.println("5. Withdraw Fees (administrator)");
      System.out.println("6. Username Lookup");
      System.out.println("0. Back");

      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      switch (c) {
        case "1" -> actionMau();
        case "2" -> actionLibrarySizes();
        case "3" -> actionValidate();
        case "4" -> actionRecentEvents(true);
        case "5" -> attempt(
            () -> System.out.println("Withdrew " + tokens(platform.withdraw(users.current())) + " tokens."));
        case "6" -> actionUsernameLookup();
        default -> System.out.println("Unknown option. Try again.");
      }
    }
  }

  private void actionMau() {
    System.out.println("Current MAU (pricing): " + platform.currentPeriodMAU());
    List<Long> hist = platform.historicMAU();
    for (int i = 0; i < hist.size(); i++) {
      System.out.println("  period " + i + ": " + hist.get(i));
    }
  }

  private void actionLibrarySizes() {
    for (ContentType t : ContentType.values()) {
      long n = platform.getContentLibraryLength(t);
      if (n > 0) System.out.println(pad(t.name(), 12) + " " + n);
    }
  }

  private void actionValidate() {
    var rep = platform.validateLedger();
    System.out.println("\n== Ledger Validation Report ==");
    System.out.println("Total records: " + rep.totalRecords);
    System.out.println("Tombstones:    " + rep.tombstones);
    System.out.println("Issues:        " + rep.issues);

    if (rep.issues == 0) {
      System.out.println("No problems found.");
      return;
    }
    int show = Math.min(30, rep.messages.size());
    for (int i = 0; i < show; i++) {
      System.out.println("- " + rep.messages.get(i));
    }
    if (rep.messages.size() > show) {
      System.out.println("... and " + (rep.messages.size() - show) + " more");
    }
  }

  private void actionRecentEvents(boolean global) {
    if (!platform.events().isEnabled()) {
      System.out.println("Events are disabled by configuration.");
      return;
    }
    String limStr = InputUtils.readTrimmed("How many latest events to show? (default 20): ");
    int limit = (int) Math.min(1000, Math.max(1, InputUtils.parseLongOr(limStr, 20)));

    List<EventLog> list =
        global
            ? platform.events().recentGlobal(limit)
            : platform.events().recentByAccount(users.current(), limit);
    if (list.isEmpty()) {
      System.out.println("No events yet.");
      return;
    }
    System.out.println(pad("time", 16) + " " + pad("type", 10) + " " + pad("account", 16) + " message");
    System.out.println("-".repeat(16 + 1 + 10 + 1 + 16 + 1 + 40));
    for (EventLog e : list) {
      System.out.println(
          pad(e.ts == null ? "-" : DT.format(e.ts), 16)
              + " "
              + pad(String.valueOf(e.type), 10)
              + " "
              + pad(e.account == null ? "-" : e.account, 16)
              + " "
              + (e.message == null ? "-" : e.message));
    }
  }

  private void actionUsernameLookup() {
    String name = InputUtils.readTrimmed("Username: ");
    if (name == null || name.isBlank()) return;
    System.out.println(platform.getUsernameOwner(name).map(o -> "Owner: " + o).orElse("Not registered."));
  }

  // =========================
  // Submenu: Users
  // =========================

  private void menuUsers() {
    while (true) {
      System.out.println();
      System.out.println("Users");
      System.out.println("1. Show Current Account");
      System.out.println("2. List Known Accounts");
      System.out.println("3. Switch Account");
      System.out.println("4. Create New Account & Switch");
      System.out.println("5. Make Current Account Default");
      System.out.println("0. Back");

      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      switch (c) {
        case "1" -> System.out.println("Account: " + users.current());
        case "2" -> {
          List<String> known = users.listKnown();
          if (known.isEmpty()) System.out.println("No accounts yet.");
          for (String a : known) System.out.println("- " + a);
        }
        case "3" -> {
          String a = InputUtils.readTrimmed("Account name: ");
          System.out.println(users.switchCurrent(a) ? "Switched to: " + users.current() : "No account provided.");
        }
        case "4" -> System.out.println("New account: " + users.createNewAndSwitch());
        case "5" -> {
          boolean ok = LocalAccount.setCurrentAccount(accountFile, users.current());
          System.out.println(ok ? "Saved as default: " + users.current() : "Failed to save default account.");
        }
        default -> System.out.println("Unknown option. Try again.");
      }
    }
  }

  private void showSettings() {
    System.out.println();
    System.out.println("== Settings ==");
    System.out.println("genesisEpochSeconds: " + config.genesisEpochSeconds);
    System.out.println("baseReward:          " + config.baseReward);
    System.out.println("commissionPercent:   " + config.commissionPercent);
    System.out.println("administrator:       " + config.administrator);
    System.out.println("platformAccount:     " + config.platformAccount);
    System.out.println("eventsLogEnabled:    " + config.eventsLogEnabled);
    System.out.println("persistState:        " + config.persistState);
    System.out.println("faucetGrant:         " + config.faucetGrant);
  }

  // ---- helpers ----

  private static final DateTimeFormatter DT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private static final BigDecimal ONE_TOKEN = new BigDecimal(EconomicsEngine.SCALE);

  /** Runs a platform call, printing failures instead of propagating them. */
  private void attempt(Runnable action) {
    try {
      action.run();
    } catch (LedgerException e) {
      System.out.println("Failed: " + e.reason() + " " + e.getMessage());
    } catch (IllegalArgumentException e) {
      System.out.println("Invalid input: " + e.getMessage());
    }
  }

  private ContentId readId(String prompt) {
    String s = InputUtils.readTrimmed(prompt);
    if (s == null || s.isBlank()) {
      System.out.println("No id provided.");
      return null;
    }
    try {
      return ContentId.parse(s);
    } catch (IllegalArgumentException e) {
      System.out.println("Invalid input: " + e.getMessage());
      return null;
    }
  }

  private void printRecord(ContentId id, ContentRecord r) {
    System.out.println();
    System.out.println("== " + id + " ==");
    if (r.isTombstone()) {
      System.out.println("(removed)");
      return;
    }
    System.out.println("Owner:     " + r.owner);
    System.out.println("Content:   " + r.contentHash.toHex());
    System.out.println("Metadata:  " + (r.metadataHash.isZero() ? "-" : r.metadataHash.toHex()));
    System.out.println("Likes:     " + r.likes + " (harvested " + r.harvestedLikes + ")");
    System.out.println("Dislikes:  " + r.dislikes);
    System.out.println("Replies:   " + r.repliedBy().size());
  }

  /**
   * Blank input is {@link Digest#ZERO}; 64 hex digits (optionally {@code 0x}-prefixed) are taken
   * as-is; anything else is hashed with SHA-256.
   */
  static Digest digest(String input) {
    if (input == null || input.isBlank()) return Digest.ZERO;
    String s = input.trim();
    String hex = s.startsWith("0x") ? s.substring(2) : s;
    if (hex.length() == 2 * Digest.LENGTH && hex.matches("[0-9a-fA-F]+")) {
      return Digest.fromHex(hex);
    }
    try {
      return Digest.of(MessageDigest.getInstance("SHA-256").digest(s.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }

  /** Base units as whole tokens, without trailing zeros. */
  static String tokens(BigInteger amount) {
    return new BigDecimal(amount).divide(ONE_TOKEN).stripTrailingZeros().toPlainString();
  }

  private String pad(String s, int width) {
    if (s == null) s = "";
    if (s.length() >= width) return s;
    return s + " ".repeat(width - s.length());
  }
}
