package org.example.crowdledger.service;

import com.google.gson.Gson;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.example.crowdledger.model.ContentId;
import org.example.crowdledger.model.ContentRecord;
import org.example.crowdledger.model.ContentType;
import org.example.crowdledger.model.Digest;
import org.example.crowdledger.model.FailureReason;
import org.example.crowdledger.model.LedgerException;
import org.example.crowdledger.model.UserProfile;
import org.example.crowdledger.storage.ConfigJson;
import org.example.crowdledger.storage.ContentLedger;
import org.example.crowdledger.storage.DataPaths;
import org.example.crowdledger.storage.EventsRepository;
import org.example.crowdledger.storage.LedgerSnapshot;
import org.example.crowdledger.storage.LedgerStore;
import org.example.crowdledger.util.JsonUtils;

/**
 * The platform's workflows: upload, vote, harvest, delete, reply, withdraw and user management.
 *
 * <p>The service composes its collaborators instead of owning their state: {@link ContentLedger}
 * for records, {@link ActivityTracker} for profiles and MAU, {@link EconomicsEngine} for prices and
 * the elimination test, {@link TokenLedger} for settlement, and {@link EventService} for emitted
 * records.
 *
 * <h2>Atomicity</h2>
 *
 * <p>Every workflow runs inside a {@link UnitOfWork}. Each step registers how to undo itself as
 * soon as it has been applied: collected fees are refunded, records and profiles are restored, a
 * created slot is discarded. If any later step fails, the undo steps run newest first and the
 * original {@link LedgerException} propagates, so callers never observe partial effects. Events
 * are only published, and state only persisted, after the whole workflow succeeded.
 *
 * <h2>Execution model</h2>
 *
 * <p>Public methods are {@code synchronized}: one invocation runs to completion before the next
 * starts. There are no background threads and no retries; a failed call must be resubmitted by the
 * caller.
 *
 * <h2>Tombstones</h2>
 *
 * <p>The read accessors return tombstoned records as they are. Workflows that act on a record
 * (votes, harvest, deletions, replies) treat a tombstone as {@code NOT_FOUND}.
 */
public class PlatformService {

    private final ContentLedger content;
    private final ActivityTracker activity;
    private final EconomicsEngine economics;
    private final TokenLedger tokens;
    private final EventService events;
    private final Clock clock;
    private final LedgerStore store;
    private final String platformAccount;
    private final String administrator;
    private final long faucetGrant;

    /**
     * @param cfg platform and administrator principals, faucet size
     * @param content content storage
     * @param activity profiles and MAU histogram
     * @param economics price and elimination rules
     * @param tokens token settlement
     * @param events event sink
     * @param clock source of "now" for interaction logging
     * @param store where committed state is saved; {@code null} keeps state in memory only
     */
    public PlatformService(
            ConfigJson cfg,
            ContentLedger content,
            ActivityTracker activity,
            EconomicsEngine economics,
            TokenLedger tokens,
            EventService events,
            Clock clock,
            LedgerStore store) {
        this.content = Objects.requireNonNull(content, "content");
        this.activity = Objects.requireNonNull(activity, "activity");
        this.economics = Objects.requireNonNull(economics, "economics");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.store = store;
        this.platformAccount = cfg.platformAccount;
        this.administrator = cfg.administrator;
        this.faucetGrant = cfg.faucetGrant;
    }

    /**
     * Builds a platform whose state lives in {@code dataDir}: {@code ledger.json} and
     * {@code events.json}. Missing files start empty.
     *
     * @param cfg configuration
     * @param dataDir data directory
     * @param clock time source
     * @return ready platform backed by an {@link InMemoryTokenLedger}
     */
    public static PlatformService open(ConfigJson cfg, Path dataDir, Clock clock) {
        LedgerStore store = LedgerStore.in(dataDir);
        LedgerSnapshot snap = store.load().orElse(null);

        long genesis = cfg.genesisEpochSeconds;
        ContentLedger content;
        ActivityTracker activity;
        if (snap == null) {
            content = new ContentLedger();
            activity = new ActivityTracker(genesis);
        } else {
            if (snap.genesisEpochSeconds != genesis) {
                System.err.println(
                        "Warning: saved ledger uses genesis "
                                + snap.genesisEpochSeconds
                                + ", config says "
                                + genesis
                                + "; keeping the saved value.");
                genesis = snap.genesisEpochSeconds;
            }
            content = new ContentLedger(snap.content);
            activity = new ActivityTracker(genesis, snap.profiles, snap.usernames, snap.histogram);
        }

        InMemoryTokenLedger.State tokenState = null;
        if (snap != null) {
            tokenState = new InMemoryTokenLedger.State();
            tokenState.balances = snap.balances;
            tokenState.allowances = snap.allowances;
        }
        InMemoryTokenLedger tokens = new InMemoryTokenLedger(tokenState);
        EventService events =
                new EventService(
                        cfg.eventsLogEnabled
                                ? new EventsRepository(dataDir.resolve(DataPaths.EVENTS_FILE))
                                : null,
                        clock);

        return new PlatformService(
                cfg,
                content,
                activity,
                EconomicsEngine.fromConfig(cfg),
                tokens,
                events,
                clock,
                cfg.persistState ? store : null);
    }

    // ---------- Workflows ----------

    /**
     * Publishes new content.
     *
     * <p>An account with strikes first pays {@code feeForStrikes(strikes, MAU)}. The interaction is
     * logged, the record created, and {@code UPLOADED} emitted.
     *
     * @return identifier of the new record
     * @throws LedgerException {@code INSUFFICIENT_BALANCE}/{@code INSUFFICIENT_ALLOWANCE} when the
     *     surcharge cannot be paid; {@code DIVISION_BY_ZERO} when it cannot be priced
     */
    public synchronized ContentId upload(
            String caller, Digest contentHash, Digest metadataHash, ContentType type) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(metadataHash, "metadataHash");
        Objects.requireNonNull(type, "type");
        return atomically(
                uow -> {
                    long strikes = activity.profile(caller).strikes;
                    if (strikes > 0) {
                        BigInteger fee =
                                economics.feeForStrikes(strikes, activity.currentPeriodMAU());
                        collectFee(uow, caller, fee);
                    }
                    logInteraction(uow, caller);
                    ContentId id =
                            content.create(
                                    ContentRecord.newContent(caller, contentHash, metadataHash), type);
                    uow.onRollback(() -> content.discardCreated(id));
                    uow.emit(() -> events.uploaded(caller, id));
                    return id;
                });
    }

    /**
     * Likes a record: pays {@code fee(MAU)}, increments {@code likes}, logs the interaction and
     * emits {@code LIKED}.
     */
    public synchronized void like(String caller, ContentId id) {
        vote(caller, id, true);
    }

    /**
     * Dislikes a record: pays {@code fee(MAU)}, increments {@code dislikes}, logs the interaction
     * and emits {@code DISLIKED}.
     */
    public synchronized void dislike(String caller, ContentId id) {
        vote(caller, id, false);
    }

    private void vote(String caller, ContentId id, boolean like) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(id, "id");
        atomically(
                uow -> {
                    collectFee(uow, caller, economics.fee(activity.currentPeriodMAU()));
                    ContentRecord r = liveRecord(id);
                    ContentRecord before = r.copy();
                    if (like) r.likes++;
                    else r.dislikes++;
                    content.update(id, r);
                    uow.onRollback(() -> content.update(id, before));
                    logInteraction(uow, caller);
                    if (like) uow.emit(() -> events.liked(caller, id));
                    else uow.emit(() -> events.disliked(caller, id));
                    return null;
                });
    }

    /**
     * Converts a record's unharvested net likes into tokens minted to its owner.
     *
     * <p>Requires {@code likes > dislikes}, a negative elimination test, and {@code likes >
     * dislikes + harvestedLikes}. Mints {@code unharvested * reward(MAU)}, marks the likes as
     * harvested and emits {@code HARVESTED}. Anyone may trigger the harvest; the owner is paid.
     *
     * @return minted amount in base units
     * @throws LedgerException {@code NO_LIKES_TO_HARVEST}, {@code QUORUM_NOT_MET}, {@code
     *     ELIMINATION_PENDING}, {@code DIVISION_BY_ZERO} or {@code NOT_FOUND}
     */
    public synchronized BigInteger harvestLikes(String caller, ContentId id) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(id, "id");
        return atomically(
                uow -> {
                    ContentRecord r = liveRecord(id);
                    if (r.likes <= r.dislikes) {
                        throw new LedgerException(
                                FailureReason.NO_LIKES_TO_HARVEST,
                                "Likes do not exceed dislikes on " + id);
                    }
                    if (economics.shouldEliminate(r.likes, r.dislikes)) {
                        throw new LedgerException(
                                FailureReason.ELIMINATION_PENDING, id + " qualifies for removal");
                    }
                    long unharvested = r.unharvestedLikes();
                    if (unharvested <= 0) {
                        throw new LedgerException(
                                FailureReason.NO_LIKES_TO_HARVEST, "Nothing left to harvest on " + id);
                    }
                    BigInteger amount =
                            economics
                                    .reward(activity.currentPeriodMAU())
                                    .multiply(BigInteger.valueOf(unharvested));

                    ContentRecord before = r.copy();
                    r.harvestedLikes += unharvested;
                    content.update(id, r);
                    uow.onRollback(() -> content.update(id, before));

                    // last step: nothing after it can fail, so the mint needs no compensation
                    tokens.mint(r.owner, amount);
                    String owner = r.owner;
                    uow.emit(() -> events.harvested(owner, id, amount));
                    return amount;
                });
    }

    /**
     * Removes content the crowd disapproved of: the elimination test must be positive. The record
     * is tombstoned, its owner receives a strike, and {@code DELETED} is emitted with the former
     * owner and hashes.
     *
     * @throws LedgerException {@code NOT_ELIGIBLE_FOR_DELETION}, {@code QUORUM_NOT_MET} or {@code
     *     NOT_FOUND}
     */
    public synchronized void deletion(String caller, ContentId id) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(id, "id");
        atomically(
                uow -> {
                    ContentRecord r = liveRecord(id);
                    if (!economics.shouldEliminate(r.likes, r.dislikes)) {
                        throw new LedgerException(
                                FailureReason.NOT_ELIGIBLE_FOR_DELETION,
                                id + " is not disapproved by the crowd");
                    }
                    tombstone(uow, id, r);

                    String owner = r.owner;
                    ActivityTracker.Savepoint sp = activity.savepoint(owner);
                    activity.addStrike(owner);
                    uow.onRollback(() -> activity.rollback(sp));

                    uow.emit(() -> events.deleted(owner, id, r.contentHash, r.metadataHash));
                    return null;
                });
    }

    /**
     * Lets an owner remove their own content. No strike is given and no event is emitted.
     *
     * @throws LedgerException {@code UNAUTHORIZED} if the caller is not the owner
     */
    public synchronized void voluntarilyDelete(String caller, ContentId id) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(id, "id");
        atomically(
                uow -> {
                    ContentRecord r = liveRecord(id);
                    requireOwner(caller, r, id);
                    tombstone(uow, id, r);
                    return null;
                });
    }

    /**
     * Links {@code replyId} as a reply to {@code targetId} and emits {@code REPLIED}.
     *
     * @throws LedgerException {@code UNAUTHORIZED} if the caller does not own {@code replyId};
     *     {@code NOT_FOUND} if either record is missing or removed
     */
    public synchronized void reply(String caller, ContentId replyId, ContentId targetId) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(replyId, "replyId");
        Objects.requireNonNull(targetId, "targetId");
        atomically(
                uow -> {
                    ContentRecord reply = liveRecord(replyId);
                    requireOwner(caller, reply, replyId);
                    ContentRecord target = liveRecord(targetId);

                    content.link(replyId, targetId);
                    uow.onRollback(
                            () -> {
                                content.update(targetId, target);
                                content.update(replyId, reply);
                            });
                    uow.emit(() -> events.replied(caller, replyId, targetId));
                    return null;
                });
    }

    /**
     * Sends every collected fee to the administrator.
     *
     * @return withdrawn amount
     * @throws LedgerException {@code UNAUTHORIZED} unless the caller is the administrator; {@code
     *     NOTHING_TO_WITHDRAW} if the platform balance is zero
     */
    public synchronized BigInteger withdraw(String caller) {
        Objects.requireNonNull(caller, "caller");
        return atomically(
                uow -> {
                    if (!caller.equals(administrator)) {
                        throw new LedgerException(
                                FailureReason.UNAUTHORIZED, "Only the administrator may withdraw");
                    }
                    BigInteger balance = tokens.balanceOf(platformAccount);
                    if (balance.signum() == 0) {
                        throw new LedgerException(
                                FailureReason.NOTHING_TO_WITHDRAW, "No fees collected");
                    }
                    tokens.transfer(platformAccount, administrator, balance);
                    uow.onRollback(() -> tokens.transfer(administrator, platformAccount, balance));
                    return balance;
                });
    }

    /**
     * Claims a username and sets the caller's profile metadata.
     *
     * @throws LedgerException {@code INVALID_USERNAME} or {@code ALREADY_REGISTERED}
     */
    public synchronized void createUser(String caller, String name, Digest metadata) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(metadata, "metadata");
        atomically(
                uow -> {
                    ActivityTracker.Savepoint sp = activity.savepoint(caller);
                    uow.onRollback(() -> activity.rollback(sp));
                    activity.registerUsername(caller, name);
                    activity.setMetadata(caller, metadata);
                    return null;
                });
    }

    /** Overwrites the caller's profile metadata; {@link Digest#ZERO} clears it. */
    public synchronized void updateMetadata(String caller, Digest metadata) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(metadata, "metadata");
        atomically(
                uow -> {
                    ActivityTracker.Savepoint sp = activity.savepoint(caller);
                    uow.onRollback(() -> activity.rollback(sp));
                    activity.setMetadata(caller, metadata);
                    return null;
                });
    }

    // ---------- Token helpers for the bundled ledger ----------

    /**
     * Grants the caller {@code faucetGrant} whole tokens. Demo helper for the bundled token ledger.
     *
     * @return minted amount in base units
     */
    public synchronized BigInteger faucet(String caller) {
        Objects.requireNonNull(caller, "caller");
        return atomically(
                uow -> {
                    BigInteger amount =
                            EconomicsEngine.SCALE.multiply(BigInteger.valueOf(faucetGrant));
                    tokens.mint(caller, amount);
                    return amount;
                });
    }

    /**
     * Sets how much the platform may collect from the caller's account as fees.
     *
     * @param amount allowance in base units
     */
    public synchronized void approvePlatform(String caller, BigInteger amount) {
        Objects.requireNonNull(caller, "caller");
        atomically(
                uow -> {
                    BigInteger previous = tokens.allowance(caller, platformAccount);
                    tokens.approve(caller, platformAccount, amount);
                    uow.onRollback(() -> tokens.approve(caller, platformAccount, previous));
                    return null;
                });
    }

    // ---------- Read accessors ----------

    public synchronized UserProfile getProfile(String account) {
        return activity.profile(account);
    }

    public synchronized Optional<String> getUsernameOwner(String name) {
        return activity.usernameOwner(name);
    }

    public synchronized long currentPeriodMAU() {
        return activity.currentPeriodMAU();
    }

    public synchronized List<Long> historicMAU() {
        return activity.historicMAU();
    }

    /** @throws LedgerException {@code NOT_FOUND} if the index is out of range */
    public synchronized ContentRecord getContentById(ContentId id) {
        return content.get(id);
    }

    public synchronized long getContentLibraryLength(ContentType type) {
        return content.length(type);
    }

    public synchronized List<ContentId> getRepliesOf(ContentId id) {
        return content.repliesOf(id);
    }

    public synchronized List<ContentId> getRepliedBy(ContentId id) {
        return content.repliedByOf(id);
    }

    public synchronized List<ContentId> listContentByOwner(String owner) {
        return content.listByOwner(owner);
    }

    public synchronized List<String> knownAccounts() {
        return activity.knownAccounts();
    }

    public synchronized BigInteger balanceOf(String account) {
        return tokens.balanceOf(account);
    }

    public synchronized BigInteger allowanceOf(String account) {
        return tokens.allowance(account, platformAccount);
    }

    /**
     * Fee the caller would pay for one like or dislike right now.
     *
     * @throws LedgerException {@code DIVISION_BY_ZERO} when MAU is zero
     */
    public synchronized BigInteger quoteVoteFee() {
        return economics.fee(activity.currentPeriodMAU());
    }

    /** Upload fee the caller would pay right now; zero without strikes. */
    public synchronized BigInteger quoteUploadFee(String caller) {
        long strikes = activity.profile(caller).strikes;
        if (strikes == 0) return BigInteger.ZERO;
        return economics.feeForStrikes(strikes, activity.currentPeriodMAU());
    }

    /** Consistency check over all stored content. */
    public synchronized ContentLedger.ValidationReport validateLedger() {
        return content.validate();
    }

    public String platformAccount() {
        return platformAccount;
    }

    public String administrator() {
        return administrator;
    }

    public EventService events() {
        return events;
    }

    /**
     * Exports an owner's live records to {@code dir/export_<owner>_<timestamp>.json} as a map from
     * identifier text ({@code TYPE:index}) to record.
     *
     * @param owner principal whose records are exported
     * @param dir target directory (created if missing)
     * @return written file
     * @throws IOException if the file cannot be written
     */
    public synchronized Path exportContentOf(String owner, Path dir) throws IOException {
        Map<String, ContentRecord> out = new LinkedHashMap<>();
        for (ContentId id : content.listByOwner(owner)) out.put(id.toString(), content.get(id));

        Files.createDirectories(dir);
        String ts =
                LocalDateTime.now(clock).format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        Path file = dir.resolve("export_" + owner + "_" + ts + ".json");
        Gson gson = JsonUtils.gson();
        try (var bw =
                Files.newBufferedWriter(
                        file,
                        StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.WRITE)) {
            gson.toJson(out, bw);
        }
        return file;
    }

    /** Current state in persistable form. */
    public synchronized LedgerSnapshot snapshot() {
        LedgerSnapshot s = new LedgerSnapshot();
        s.genesisEpochSeconds = activity.genesis();
        s.content = content.snapshot();
        s.profiles = activity.profilesSnapshot();
        s.usernames = activity.usernamesSnapshot();
        s.histogram = new ArrayList<>(activity.historicMAU());
        if (tokens instanceof InMemoryTokenLedger) {
            InMemoryTokenLedger.State t = ((InMemoryTokenLedger) tokens).state();
            s.balances = t.balances;
            s.allowances = t.allowances;
        }
        return s;
    }

    // ---------- Helpers ----------

    private <T> T atomically(Function<UnitOfWork, T> work) {
        UnitOfWork uow = new UnitOfWork();
        T result;
        try {
            result = work.apply(uow);
        } catch (RuntimeException e) {
            uow.rollback(e);
            throw e;
        }
        uow.commit();
        persist();
        return result;
    }

    private void persist() {
        if (store == null) return;
        store.save(snapshot());
    }

    /**
     * Collects {@code fee} from {@code caller} into the platform account. Balance and allowance
     * are checked first; the refund restores both.
     */
    private void collectFee(UnitOfWork uow, String caller, BigInteger fee) {
        if (fee.signum() == 0) return;
        BigInteger balance = tokens.balanceOf(caller);
        if (balance.compareTo(fee) < 0) {
            throw new LedgerException(
                    FailureReason.INSUFFICIENT_BALANCE,
                    "Fee " + fee + " exceeds balance " + balance);
        }
        BigInteger allowed = tokens.allowance(caller, platformAccount);
        if (allowed.compareTo(fee) < 0) {
            throw new LedgerException(
                    FailureReason.INSUFFICIENT_ALLOWANCE,
                    "Fee " + fee + " exceeds allowance " + allowed);
        }
        tokens.transferFrom(platformAccount, caller, platformAccount, fee);
        uow.onRollback(
                () -> {
                    tokens.transfer(platformAccount, caller, fee);
                    tokens.approve(
                            caller, platformAccount, tokens.allowance(caller, platformAccount).add(fee));
                });
    }

    private void logInteraction(UnitOfWork uow, String caller) {
        ActivityTracker.Savepoint sp = activity.savepoint(caller);
        activity.logInteraction(caller, clock.instant().getEpochSecond());
        uow.onRollback(() -> activity.rollback(sp));
    }

    private void tombstone(UnitOfWork uow, ContentId id, ContentRecord before) {
        content.delete(id);
        uow.onRollback(() -> content.update(id, before));
    }

    private ContentRecord liveRecord(ContentId id) {
        ContentRecord r = content.get(id);
        if (r.isTombstone()) {
            throw new LedgerException(FailureReason.NOT_FOUND, id + " was removed");
        }
        return r;
    }

    private static void requireOwner(String caller, ContentRecord r, ContentId id) {
        if (!caller.equals(r.owner)) {
            throw new LedgerException(FailureReason.UNAUTHORIZED, caller + " does not own " + id);
        }
    }
}
