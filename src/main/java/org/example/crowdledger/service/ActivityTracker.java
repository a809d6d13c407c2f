package org.example.crowdledger.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.example.crowdledger.model.Digest;
import org.example.crowdledger.model.FailureReason;
import org.example.crowdledger.model.LedgerException;
import org.example.crowdledger.model.UserProfile;
import org.example.crowdledger.util.TimeUtils;
import org.example.crowdledger.util.UsernameValidator;

/**
 * Per-user profiles, the username registry, and the monthly-active-user (MAU) histogram.
 *
 * <p>The histogram has one counter per elapsed 30-day period since genesis. It approximates the
 * number of distinct accounts that interacted in each period without storing any per-period set
 * of accounts: an account is counted in the open period only if its own last interaction happened
 * before that period started (or never happened). That comparison allows at most one increment per
 * account per period.
 *
 * <h2>Histogram invariants</h2>
 *
 * <ul>
 *   <li>It only grows, and only inside {@link #logInteraction(String, long)}.
 *   <li>Silent periods are back-filled with zero buckets; there are no holes.
 *   <li>Once a later period has been opened, earlier buckets never change.
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> not thread-safe; calls are serialized by {@link
 * PlatformService}.
 */
public class ActivityTracker {
    private final long genesis;
    private final Map<String, UserProfile> profiles;
    private final Map<String, String> ownerByName;
    private final Map<String, String> nameByOwner;
    private final List<Long> histogram;

    /**
     * Creates an empty tracker.
     *
     * @param genesis network genesis in epoch seconds
     */
    public ActivityTracker(long genesis) {
        this(genesis, null, null, null);
    }

    /**
     * Restores a tracker from persisted state (see {@link #profilesSnapshot()} and {@link
     * #usernamesSnapshot()}). Any argument may be {@code null}, meaning empty.
     *
     * @param genesis network genesis in epoch seconds
     * @param profiles profiles by account
     * @param usernames owning account by username
     * @param histogram MAU counters, oldest first
     */
    public ActivityTracker(
            long genesis,
            Map<String, UserProfile> profiles,
            Map<String, String> usernames,
            List<Long> histogram) {
        this.genesis = genesis;
        this.profiles = new LinkedHashMap<>();
        this.ownerByName = new LinkedHashMap<>();
        this.nameByOwner = new HashMap<>();
        this.histogram = new ArrayList<>();
        if (profiles != null) {
            profiles.forEach((k, v) -> this.profiles.put(k, v == null ? new UserProfile() : v.copy()));
        }
        if (usernames != null) {
            usernames.forEach(
                    (name, owner) -> {
                        ownerByName.put(name, owner);
                        nameByOwner.put(owner, name);
                    });
        }
        if (histogram != null) {
            for (Long v : histogram) this.histogram.add(v == null ? 0L : v);
        }
    }

    public long genesis() {
        return genesis;
    }

    // ---------- Queries ----------

    /**
     * Returns a copy of the account's profile; a zero profile if the account was never touched.
     *
     * @param account principal
     * @return profile copy, never {@code null}
     */
    public UserProfile profile(String account) {
        UserProfile p = profiles.get(account);
        return p == null ? new UserProfile() : p.copy();
    }

    /**
     * Active-user count used for pricing: the last fully closed period.
     *
     * <ul>
     *   <li>two or more buckets: the bucket before the open one ({@code length - 2});
     *   <li>one bucket: that bucket, although the period is still open (bootstrap);
     *   <li>no buckets: {@code 0}.
     * </ul>
     *
     * @return MAU for fee and reward calculations
     */
    public long currentPeriodMAU() {
        int n = histogram.size();
        if (n >= 2) return histogram.get(n - 2);
        if (n == 1) return histogram.get(0);
        return 0L;
    }

    /** Unmodifiable copy of all MAU buckets, oldest first. */
    public List<Long> historicMAU() {
        return Collections.unmodifiableList(new ArrayList<>(histogram));
    }

    /**
     * Looks up the owner of a username.
     *
     * @param name username, with or without NUL padding
     * @return owning account, or empty if unclaimed
     */
    public Optional<String> usernameOwner(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(ownerByName.get(UsernameValidator.stripPadding(name)));
    }

    /** Accounts that have a profile entry, in first-touch order. */
    public List<String> knownAccounts() {
        return new ArrayList<>(profiles.keySet());
    }

    // ---------- Mutations ----------

    /**
     * Logs one interaction of {@code account} at time {@code now}.
     *
     * <ol>
     *   <li>Back-fills zero buckets for every silent period before the current one.
     *   <li>If the current period has no bucket yet, opens it with a count of 1 for this caller.
     *   <li>Otherwise counts the caller once if it never interacted or last interacted before the
     *       open period began.
     *   <li>Records {@code now} as the caller's latest interaction.
     * </ol>
     *
     * @param account principal
     * @param now epoch seconds; must not precede genesis
     * @throws IllegalArgumentException if {@code now} is before genesis
     */
    public void logInteraction(String account, long now) {
        Objects.requireNonNull(account, "account");
        long elapsed = TimeUtils.elapsedPeriods(now, genesis);
        UserProfile p = profiles.computeIfAbsent(account, k -> new UserProfile());

        while (histogram.size() < elapsed) histogram.add(0L);

        if (elapsed + 1 > histogram.size()) {
            histogram.add(1L);
        } else {
            long openStart = TimeUtils.periodStart(genesis, histogram.size() - 1L);
            boolean newlyActive =
                    p.latestInteractionTime == 0 || p.latestInteractionTime < openStart;
            if (newlyActive) {
                int last = histogram.size() - 1;
                histogram.set(last, histogram.get(last) + 1);
            }
        }
        p.latestInteractionTime = now;
    }

    /**
     * Adds one strike to the account's profile.
     *
     * @param account principal
     */
    public void addStrike(String account) {
        profiles.computeIfAbsent(account, k -> new UserProfile()).strikes++;
    }

    /**
     * Claims {@code name} for {@code account}. Both directions of the registry are bound and the
     * profile's {@code userName} is set.
     *
     * @param account principal
     * @param name username, optionally NUL padded
     * @throws LedgerException {@code INVALID_USERNAME} if the name is malformed; {@code
     *     ALREADY_REGISTERED} if the account already has a name or the name is taken
     */
    public void registerUsername(String account, String name) {
        Objects.requireNonNull(account, "account");
        if (!UsernameValidator.isValid(name)) {
            throw new LedgerException(FailureReason.INVALID_USERNAME, "Invalid username: " + name);
        }
        String clean = UsernameValidator.stripPadding(name);
        if (nameByOwner.containsKey(account)) {
            throw new LedgerException(
                    FailureReason.ALREADY_REGISTERED,
                    "Account already owns username " + nameByOwner.get(account));
        }
        if (ownerByName.containsKey(clean)) {
            throw new LedgerException(
                    FailureReason.ALREADY_REGISTERED, "Username is taken: " + clean);
        }
        ownerByName.put(clean, account);
        nameByOwner.put(account, clean);
        profiles.computeIfAbsent(account, k -> new UserProfile()).userName = clean;
    }

    /**
     * Overwrites the account's metadata hash; {@link Digest#ZERO} clears it.
     *
     * @param account principal
     * @param hash new metadata hash
     */
    public void setMetadata(String account, Digest hash) {
        Objects.requireNonNull(hash, "hash");
        profiles.computeIfAbsent(account, k -> new UserProfile()).metadataHash = hash;
    }

    // ---------- Rollback support ----------

    /**
     * Captured state for undoing a workflow's changes to a set of accounts and to the histogram.
     * Obtain via {@link #savepoint(String...)} before mutating, pass to {@link
     * #rollback(Savepoint)} to undo.
     *
     * <p>The histogram only grows and only its last counter is ever incremented, so its length
     * and last value are enough to restore it.
     */
    public static final class Savepoint {
        private final int histogramSize;
        private final long lastBucket;
        private final Map<String, UserProfile> profiles = new HashMap<>();
        private final Map<String, String> names = new HashMap<>();

        private Savepoint(int histogramSize, long lastBucket) {
            this.histogramSize = histogramSize;
            this.lastBucket = lastBucket;
        }
    }

    /**
     * Captures the histogram tail and the state of the given accounts.
     *
     * @param accounts accounts the upcoming mutations may touch
     * @return savepoint
     */
    public Savepoint savepoint(String... accounts) {
        int n = histogram.size();
        Savepoint sp = new Savepoint(n, n == 0 ? 0L : histogram.get(n - 1));
        for (String a : accounts) {
            UserProfile p = profiles.get(a);
            sp.profiles.put(a, p == null ? null : p.copy());
            sp.names.put(a, nameByOwner.get(a));
        }
        return sp;
    }

    /**
     * Restores the histogram and the saved accounts to the captured state.
     *
     * @param sp savepoint from this tracker
     */
    public void rollback(Savepoint sp) {
        while (histogram.size() > sp.histogramSize) histogram.remove(histogram.size() - 1);
        if (sp.histogramSize > 0) histogram.set(sp.histogramSize - 1, sp.lastBucket);
        for (Map.Entry<String, UserProfile> e : sp.profiles.entrySet()) {
            if (e.getValue() == null) profiles.remove(e.getKey());
            else profiles.put(e.getKey(), e.getValue().copy());
        }
        for (Map.Entry<String, String> e : sp.names.entrySet()) {
            String account = e.getKey();
            String current = nameByOwner.get(account);
            if (current != null && !current.equals(e.getValue())) {
                nameByOwner.remove(account);
                ownerByName.remove(current);
            }
        }
    }

    // ---------- Persistence ----------

    /** Deep copy of the profile store, for persistence. */
    public Map<String, UserProfile> profilesSnapshot() {
        Map<String, UserProfile> out = new LinkedHashMap<>();
        profiles.forEach((k, v) -> out.put(k, v.copy()));
        return out;
    }

    /** Copy of the username registry (name to owner), for persistence. */
    public Map<String, String> usernamesSnapshot() {
        return new LinkedHashMap<>(ownerByName);
    }
}
