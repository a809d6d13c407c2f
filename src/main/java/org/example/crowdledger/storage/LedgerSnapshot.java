package org.example.crowdledger.storage;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.example.crowdledger.model.ContentRecord;
import org.example.crowdledger.model.UserProfile;

/**
 * Serializable image of the platform state written to {@code ledger.json}.
 *
 * <p>Plain data holder with public fields for Gson. Content collections are indexed by {@code
 * ContentType.ordinal()}. Token balances and allowances of the bundled token ledger travel in the
 * same image, so one atomic write covers both sides of a workflow.
 */
public class LedgerSnapshot {
  /** Genesis the histogram was built against; a mismatch with the config is reported on load. */
  public long genesisEpochSeconds;

  public List<List<ContentRecord>> content = new ArrayList<>();

  public Map<String, UserProfile> profiles = new LinkedHashMap<>();

  /** username -> owning account */
  public Map<String, String> usernames = new LinkedHashMap<>();

  public List<Long> histogram = new ArrayList<>();

  public Map<String, BigInteger> balances = new LinkedHashMap<>();

  /** owner -> spender -> allowance */
  public Map<String, Map<String, BigInteger>> allowances = new LinkedHashMap<>();
}
