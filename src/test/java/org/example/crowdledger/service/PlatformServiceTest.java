package org.example.crowdledger.service;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.example.crowdledger.model.ContentId;
import org.example.crowdledger.model.ContentRecord;
import org.example.crowdledger.model.ContentType;
import org.example.crowdledger.model.Digest;
import org.example.crowdledger.model.EventLog;
import org.example.crowdledger.model.EventType;
import org.example.crowdledger.model.FailureReason;
import org.example.crowdledger.model.LedgerException;
import org.example.crowdledger.storage.ConfigJson;
import org.example.crowdledger.storage.ContentLedger;
import org.example.crowdledger.storage.EventsRepository;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;

/**
 * Workflow tests for {@link PlatformService}.
 *
 * <p>The service runs against an {@link InMemoryTokenLedger}, a {@link MutableClock} starting one
 * day after genesis and an event log in a {@code @TempDir}. Persistence is off except in the
 * round-trip test.
 */
public class PlatformServiceTest {

  @TempDir Path tempDir;

  private static final Digest HASH = Digest.fromHex("ab".repeat(32));
  private static final BigInteger FUNDS = EconomicsEngine.SCALE.multiply(BigInteger.valueOf(1_000_000L));

  private ConfigJson cfg;
  private MutableClock clock;
  private InMemoryTokenLedger tokens;
  private EventService events;
  private EconomicsEngine econ;
  private PlatformService platform;

  @BeforeEach
  void setUp() {
    cfg = new ConfigJson();
    cfg.persistState = false;
    clock = new MutableClock(Instant.ofEpochSecond(cfg.genesisEpochSeconds).plus(Duration.ofDays(1)));
    tokens = new InMemoryTokenLedger();
    events = new EventService(new EventsRepository(tempDir.resolve("events.json")), clock);
    econ = EconomicsEngine.fromConfig(cfg);
    platform =
        new PlatformService(
            cfg,
            new ContentLedger(),
            new ActivityTracker(cfg.genesisEpochSeconds),
            econ,
            tokens,
            events,
            clock,
            null);
  }

  // ---------- helpers ----------

  private void fund(String account) {
    tokens.mint(account, FUNDS);
    platform.approvePlatform(account, FUNDS);
  }

  private ContentId upload(String owner) {
    return platform.upload(owner, HASH, Digest.ZERO, ContentType.POST);
  }

  private void votes(ContentId id, int likes, int dislikes) {
    for (int i = 0; i < likes; i++) {
      String v = "liker" + i;
      fund(v);
      platform.like(v, id);
    }
    for (int i = 0; i < dislikes; i++) {
      String v = "disliker" + i;
      fund(v);
      platform.dislike(v, id);
    }
  }

  private static void assertFails(FailureReason reason, Executable call) {
    LedgerException ex = assertThrows(LedgerException.class, call);
    assertEquals(reason, ex.reason(), ex.getMessage());
  }

  // ---------- upload & votes ----------

  @Test
  @DisplayName("upload without strikes is free, logs the interaction and emits UPLOADED")
  void upload_basic() {
    ContentId id = upload("owner");

    assertEquals(ContentId.of(ContentType.POST, 0), id);
    assertEquals("owner", platform.getContentById(id).owner);
    assertEquals(List.of(1L), platform.historicMAU());
    assertEquals(1, platform.getContentLibraryLength(ContentType.POST));
    assertEquals(1, events.listByType(EventType.UPLOADED).size());
    assertEquals(BigInteger.ZERO, tokens.balanceOf(cfg.platformAccount));
  }

  @Test
  @DisplayName("a like collects fee(MAU) into the platform account")
  void like_collectsFee() {
    ContentId id = upload("owner");
    fund("voter");
    BigInteger fee = platform.quoteVoteFee();
    assertEquals(econ.fee(1), fee);

    platform.like("voter", id);

    assertEquals(1, platform.getContentById(id).likes);
    assertEquals(fee, tokens.balanceOf(cfg.platformAccount));
    assertEquals(FUNDS.subtract(fee), tokens.balanceOf("voter"));
    assertEquals(FUNDS.subtract(fee), tokens.allowance("voter", cfg.platformAccount));
    assertEquals(List.of(2L), platform.historicMAU());
    assertEquals(1, events.listByAccount("voter").size());
  }

  @Test
  @DisplayName("votes fail on missing funds or allowance and leave no trace")
  void vote_insufficientFunds() {
    ContentId id = upload("owner");
    assertFails(FailureReason.INSUFFICIENT_BALANCE, () -> platform.like("poor", id));

    tokens.mint("poor", FUNDS);
    assertFails(FailureReason.INSUFFICIENT_ALLOWANCE, () -> platform.dislike("poor", id));

    ContentRecord r = platform.getContentById(id);
    assertEquals(0, r.likes);
    assertEquals(0, r.dislikes);
    assertEquals(List.of("owner"), platform.knownAccounts());
  }

  @Test
  @DisplayName("a failure after the fee was taken refunds balance and allowance")
  void vote_rollsBackFee() {
    upload("owner");
    fund("voter");

    assertFails(FailureReason.NOT_FOUND, () -> platform.like("voter", ContentId.of(ContentType.POST, 9)));

    assertEquals(FUNDS, tokens.balanceOf("voter"));
    assertEquals(FUNDS, tokens.allowance("voter", cfg.platformAccount));
    assertEquals(BigInteger.ZERO, tokens.balanceOf(cfg.platformAccount));
    assertEquals(List.of(1L), platform.historicMAU());
    assertTrue(events.listByType(EventType.LIKED).isEmpty());
  }

  @Test
  @DisplayName("votes on removed content fail with NOT_FOUND")
  void vote_onTombstone() {
    ContentId id = upload("owner");
    platform.voluntarilyDelete("owner", id);
    fund("voter");

    assertFails(FailureReason.NOT_FOUND, () -> platform.like("voter", id));
    assertEquals(FUNDS, tokens.balanceOf("voter"));
  }

  @Test
  @DisplayName("a silent closed period makes pricing fail with DIVISION_BY_ZERO, atomically")
  void vote_divisionByZero() {
    ContentId id = upload("owner");
    clock.advance(Duration.ofDays(61));
    fund("early");
    platform.like("early", id);
    assertEquals(List.of(1L, 0L, 1L), platform.historicMAU());

    fund("late");
    assertFails(FailureReason.DIVISION_BY_ZERO, () -> platform.like("late", id));
    assertEquals(1, platform.getContentById(id).likes);
    assertEquals(FUNDS, tokens.balanceOf("late"));
    assertEquals(List.of(1L, 0L, 1L), platform.historicMAU());
  }

  // ---------- harvest ----------

  @Test
  @DisplayName("harvest of 5 likes / 1 dislike mints 4 rewards to the owner, once")
  void harvest_mintsNetLikes() {
    ContentId id = upload("owner");
    votes(id, 5, 1);
    long mau = platform.currentPeriodMAU();
    assertEquals(7, mau);

    BigInteger minted = platform.harvestLikes("liker0", id);

    assertEquals(econ.reward(mau).multiply(BigInteger.valueOf(4)), minted);
    assertEquals(minted, tokens.balanceOf("owner"));
    assertEquals(4, platform.getContentById(id).harvestedLikes);

    EventLog e = events.listByType(EventType.HARVESTED).get(0);
    assertEquals("owner", e.account);
    assertEquals(minted, e.amount);

    assertFails(FailureReason.NO_LIKES_TO_HARVEST, () -> platform.harvestLikes("owner", id));
    assertEquals(minted, tokens.balanceOf("owner"));
  }

  @Test
  @DisplayName("harvest needs more likes than dislikes and a met quorum")
  void harvest_preconditions() {
    ContentId disliked = upload("owner");
    votes(disliked, 0, 1);
    assertFails(FailureReason.NO_LIKES_TO_HARVEST, () -> platform.harvestLikes("owner", disliked));

    ContentId small = upload("owner");
    votes(small, 2, 0);
    assertFails(FailureReason.QUORUM_NOT_MET, () -> platform.harvestLikes("owner", small));
    assertEquals(0, platform.getContentById(small).harvestedLikes);
    assertEquals(BigInteger.ZERO, tokens.balanceOf("owner"));
  }

  @Test
  @DisplayName("new likes after a harvest can be harvested again")
  void harvest_incremental() {
    ContentId id = upload("owner");
    votes(id, 6, 0);
    platform.harvestLikes("owner", id);

    fund("late");
    platform.like("late", id);
    BigInteger second = platform.harvestLikes("owner", id);
    assertEquals(econ.reward(platform.currentPeriodMAU()), second);
    assertEquals(7, platform.getContentById(id).harvestedLikes);
  }

  // ---------- deletion ----------

  @Test
  @DisplayName("crowd deletion tombstones, strikes the owner and emits DELETED")
  void deletion_strikesOwner() {
    ContentId id = upload("owner");
    votes(id, 0, 6);

    platform.deletion("anyone", id);

    assertTrue(platform.getContentById(id).isTombstone());
    assertEquals(1, platform.getProfile("owner").strikes);
    EventLog e = events.listByType(EventType.DELETED).get(0);
    assertEquals("owner", e.account);
    assertEquals(HASH, e.contentHash);

    assertFails(FailureReason.NOT_FOUND, () -> platform.deletion("anyone", id));
    assertEquals(1, platform.getProfile("owner").strikes);
  }

  @Test
  @DisplayName("deletion needs a positive elimination test and a met quorum")
  void deletion_preconditions() {
    ContentId liked = upload("owner");
    votes(liked, 5, 1);
    assertFails(FailureReason.NOT_ELIGIBLE_FOR_DELETION, () -> platform.deletion("x", liked));

    ContentId small = upload("owner");
    votes(small, 0, 2);
    assertFails(FailureReason.QUORUM_NOT_MET, () -> platform.deletion("x", small));

    assertFalse(platform.getContentById(liked).isTombstone());
    assertEquals(0, platform.getProfile("owner").strikes);
  }

  @Test
  @DisplayName("after a strike, uploads cost feeForStrikes and fail atomically without funds")
  void upload_withStrikes() {
    ContentId id = upload("owner");
    votes(id, 0, 6);
    platform.deletion("anyone", id);
    BigInteger platformBefore = tokens.balanceOf(cfg.platformAccount);

    assertFails(FailureReason.INSUFFICIENT_BALANCE, () -> upload("owner"));
    assertEquals(1, platform.getContentLibraryLength(ContentType.POST));

    fund("owner");
    BigInteger fee = platform.quoteUploadFee("owner");
    assertEquals(econ.feeForStrikes(1, platform.currentPeriodMAU()), fee);
    ContentId next = upload("owner");

    assertEquals(1, next.index());
    assertEquals(platformBefore.add(fee), tokens.balanceOf(cfg.platformAccount));
  }

  @Test
  @DisplayName("only the owner may delete voluntarily; no strike is given")
  void voluntarilyDelete() {
    ContentId id = upload("owner");
    assertFails(FailureReason.UNAUTHORIZED, () -> platform.voluntarilyDelete("mallory", id));

    platform.voluntarilyDelete("owner", id);
    assertTrue(platform.getContentById(id).isTombstone());
    assertEquals(0, platform.getProfile("owner").strikes);
    assertTrue(events.listByType(EventType.DELETED).isEmpty());

    ContentId next = upload("owner");
    assertEquals(1, next.index());
  }

  // ---------- replies ----------

  @Test
  @DisplayName("reply links both records, emits REPLIED and keeps the ledger valid")
  void reply_links() {
    ContentId post = upload("owner");
    ContentId comment = platform.upload("bob", HASH, Digest.ZERO, ContentType.COMMENT);

    assertFails(FailureReason.UNAUTHORIZED, () -> platform.reply("owner", comment, post));
    platform.reply("bob", comment, post);

    assertEquals(List.of(post), platform.getRepliesOf(comment));
    assertEquals(List.of(comment), platform.getRepliedBy(post));
    EventLog e = events.listByType(EventType.REPLIED).get(0);
    assertEquals(comment, e.contentId());
    assertEquals(ContentType.POST, e.targetType);
    assertEquals(0, platform.validateLedger().issues);
  }

  @Test
  @DisplayName("replying to removed or missing content fails with NOT_FOUND")
  void reply_missingTarget() {
    ContentId post = upload("owner");
    ContentId comment = platform.upload("bob", HASH, Digest.ZERO, ContentType.COMMENT);
    platform.voluntarilyDelete("owner", post);

    assertFails(FailureReason.NOT_FOUND, () -> platform.reply("bob", comment, post));
    assertFails(
        FailureReason.NOT_FOUND,
        () -> platform.reply("bob", comment, ContentId.of(ContentType.VIDEO, 0)));
    assertTrue(platform.getRepliesOf(comment).isEmpty());
  }

  // ---------- withdraw ----------

  @Test
  @DisplayName("withdraw moves all collected fees to the administrator")
  void withdraw() {
    assertFails(FailureReason.UNAUTHORIZED, () -> platform.withdraw("mallory"));
    assertFails(FailureReason.NOTHING_TO_WITHDRAW, () -> platform.withdraw(cfg.administrator));

    ContentId id = upload("owner");
    fund("voter");
    platform.like("voter", id);
    BigInteger collected = tokens.balanceOf(cfg.platformAccount);

    assertEquals(collected, platform.withdraw(cfg.administrator));
    assertEquals(BigInteger.ZERO, tokens.balanceOf(cfg.platformAccount));
    assertEquals(collected, tokens.balanceOf(cfg.administrator));
  }

  // ---------- users ----------

  @Test
  @DisplayName("createUser binds the name and metadata; failures leave the profile untouched")
  void createUser() {
    Digest meta = Digest.fromHex("01".repeat(32));
    platform.createUser("alice", "alice_1", meta);

    assertEquals("alice", platform.getUsernameOwner("alice_1").orElseThrow());
    assertEquals("alice_1", platform.getProfile("alice").userName);
    assertEquals(meta, platform.getProfile("alice").metadataHash);

    assertFails(FailureReason.ALREADY_REGISTERED, () -> platform.createUser("bob", "alice_1", meta));
    assertFails(FailureReason.INVALID_USERNAME, () -> platform.createUser("bob", "Bob", meta));
    assertTrue(platform.getProfile("bob").metadataHash.isZero());

    platform.updateMetadata("alice", Digest.ZERO);
    assertTrue(platform.getProfile("alice").metadataHash.isZero());
    assertEquals("alice_1", platform.getProfile("alice").userName);
  }

  // ---------- persistence & export ----------

  @Test
  @DisplayName("committed state survives reopening the data directory")
  void persistenceRoundTrip() {
    ConfigJson persistent = new ConfigJson();
    Path dataDir = tempDir.resolve("data");

    PlatformService first = PlatformService.open(persistent, dataDir, clock);
    BigInteger granted = first.faucet("alice");
    first.approvePlatform("alice", granted);
    ContentId id = first.upload("alice", HASH, Digest.ZERO, ContentType.ARTICLE);
    BigInteger fee = first.quoteVoteFee();
    first.like("alice", id);
    first.createUser("alice", "alice_1", Digest.ZERO);

    assertTrue(Files.exists(dataDir.resolve("ledger.json")));
    assertFalse(Files.exists(dataDir.resolve("tokens.json")));

    PlatformService second = PlatformService.open(persistent, dataDir, clock);
    assertEquals(1, second.getContentById(id).likes);
    assertEquals(HASH, second.getContentById(id).contentHash);
    assertEquals(granted.subtract(fee), second.balanceOf("alice"));
    assertEquals(fee, second.balanceOf(persistent.platformAccount));
    assertEquals(first.historicMAU(), second.historicMAU());
    assertEquals("alice", second.getUsernameOwner("alice_1").orElseThrow());
    assertEquals(2, second.events().recentGlobal(10).size());
  }

  @Test
  @DisplayName("a failed workflow is not written to disk")
  void persistence_skipsFailures() {
    ConfigJson persistent = new ConfigJson();
    Path dataDir = tempDir.resolve("data");
    PlatformService first = PlatformService.open(persistent, dataDir, clock);
    first.upload("alice", HASH, Digest.ZERO, ContentType.POST);

    assertThrows(LedgerException.class, () -> first.like("broke", ContentId.of(ContentType.POST, 0)));

    PlatformService second = PlatformService.open(persistent, dataDir, clock);
    assertEquals(List.of("alice"), second.knownAccounts());
  }

  @Test
  @DisplayName("a failed save leaves the last written commit whole, fee and like together")
  void persistence_failedWriteKeepsFeeAndLikeTogether() throws Exception {
    ConfigJson persistent = new ConfigJson();
    Path dataDir = tempDir.resolve("data");
    PlatformService first = PlatformService.open(persistent, dataDir, clock);
    ContentId id = first.upload("alice", HASH, Digest.ZERO, ContentType.POST);
    BigInteger granted = first.faucet("voter");
    first.approvePlatform("voter", granted);
    BigInteger fee = first.quoteVoteFee();

    // a non-empty directory where the temp file goes makes the next write fail
    Path blocker = dataDir.resolve(".ledger.json.tmp");
    Files.createDirectories(blocker.resolve("busy"));
    first.like("voter", id);
    assertEquals(1, first.getContentById(id).likes);

    PlatformService stale = PlatformService.open(persistent, dataDir, clock);
    assertEquals(0, stale.getContentById(id).likes);
    assertEquals(granted, stale.balanceOf("voter"));
    assertEquals(granted, stale.allowanceOf("voter"));
    assertEquals(BigInteger.ZERO, stale.balanceOf(persistent.platformAccount));

    Files.delete(blocker.resolve("busy"));
    Files.delete(blocker);
    first.updateMetadata("alice", Digest.ZERO);

    PlatformService caughtUp = PlatformService.open(persistent, dataDir, clock);
    assertEquals(1, caughtUp.getContentById(id).likes);
    assertEquals(granted.subtract(fee), caughtUp.balanceOf("voter"));
    assertEquals(fee, caughtUp.balanceOf(persistent.platformAccount));
  }

  @Test
  @DisplayName("events of an opened platform are stamped by its clock")
  void open_eventsUsePlatformClock() {
    ConfigJson persistent = new ConfigJson();
    PlatformService opened = PlatformService.open(persistent, tempDir.resolve("data"), clock);
    opened.upload("alice", HASH, Digest.ZERO, ContentType.POST);

    EventLog e = opened.events().recentGlobal(1).get(0);
    assertEquals(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC), e.ts);
  }

  @Test
  @DisplayName("export writes the owner's live records keyed by identifier")
  void export() throws Exception {
    ContentId keep = upload("owner");
    ContentId gone = upload("owner");
    platform.voluntarilyDelete("owner", gone);
    upload("someone");

    Path file = platform.exportContentOf("owner", tempDir.resolve("exports"));
    String json = Files.readString(file);
    assertTrue(json.contains("\"" + keep + "\""), json);
    assertFalse(json.contains("\"" + gone + "\""), json);
    assertFalse(json.contains("someone"), json);
  }
}
