package org.example.crowdledger.model;

/**
 * Per-account profile kept by the activity tracker.
 *
 * <p>A profile springs into existence (with all fields at their zero value) the first time it is
 * read; it is never deleted.
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code latestInteractionTime} – epoch seconds of the last logged interaction; {@code 0}
 *       means the account never interacted.</li>
 *   <li>{@code metadataHash} – hash of the user's off-ledger profile document.</li>
 *   <li>{@code userName} – registered username without padding; empty if none.</li>
 *   <li>{@code strikes} – number of the user's records removed for disapproval.</li>
 * </ul>
 */
public class UserProfile {
    public long latestInteractionTime;
    public Digest metadataHash = Digest.ZERO;
    public String userName = "";
    public long strikes;

    public UserProfile copy() {
        UserProfile p = new UserProfile();
        p.latestInteractionTime = latestInteractionTime;
        p.metadataHash = metadataHash;
        p.userName = userName;
        p.strikes = strikes;
        return p;
    }
}
