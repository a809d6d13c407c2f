package org.example.crowdledger.service;

import java.util.List;
import org.example.crowdledger.storage.LocalAccount;

/**
 * Tracks which principal the interactive session acts as.
 *
 * <p>Accounts need no registration: any name becomes a principal the first time it interacts.
 * Known accounts are the ones the platform holds a profile for.
 *
 * <p>There is no internal synchronization; the CLI uses it from a single thread.
 */
public class UserService {
    private String current;

    private final PlatformService platform;

    /**
     * @param current principal the session starts as; must be non-blank
     * @param platform platform used to list known accounts
     */
    public UserService(String current, PlatformService platform) {
        if (current == null || current.isBlank()) {
            throw new IllegalArgumentException("Account must not be blank");
        }
        this.current = current.trim();
        this.platform = platform;
    }

    public String current() {
        return current;
    }

    /** Accounts with a profile, in first-touch order. */
    public List<String> listKnown() {
        return platform.knownAccounts();
    }

    /**
     * Switches the session to {@code account}. Blank values are ignored.
     *
     * @return {@code true} if the session switched
     */
    public boolean switchCurrent(String account) {
        if (account == null || account.isBlank()) return false;
        this.current = account.trim();
        return true;
    }

    /**
     * Generates a new account name and switches to it.
     *
     * @return the new account
     */
    public String createNewAndSwitch() {
        this.current = LocalAccount.generate();
        return current;
    }
}
