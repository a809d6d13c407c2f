package org.example.crowdledger.service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.example.crowdledger.model.FailureReason;
import org.example.crowdledger.model.LedgerException;

/**
 * Map-backed {@link TokenLedger}.
 *
 * <p>Keeps balances and allowances in memory; {@link #state()} exposes a copy that the platform
 * writes into {@code ledger.json}, and the {@link #InMemoryTokenLedger(State)} constructor
 * restores it.
 *
 * <p><strong>Thread-safety:</strong> not thread-safe; the platform serializes all calls.
 */
public class InMemoryTokenLedger implements TokenLedger {

  /** Persistable state of the ledger. Public fields for Gson. */
  public static class State {
    public Map<String, BigInteger> balances = new LinkedHashMap<>();
    /** owner -> spender -> allowance */
    public Map<String, Map<String, BigInteger>> allowances = new LinkedHashMap<>();
  }

  private final Map<String, BigInteger> balances = new LinkedHashMap<>();
  private final Map<String, Map<String, BigInteger>> allowances = new LinkedHashMap<>();

  public InMemoryTokenLedger() {}

  /**
   * Restores balances and allowances.
   *
   * @param restored previously saved state; {@code null} means empty
   */
  public InMemoryTokenLedger(State restored) {
    if (restored == null) return;
    if (restored.balances != null) {
      restored.balances.forEach((k, v) -> { if (v != null && v.signum() > 0) balances.put(k, v); });
    }
    if (restored.allowances != null) {
      restored.allowances.forEach(
          (owner, m) -> {
            if (m != null) allowances.put(owner, new LinkedHashMap<>(m));
          });
    }
  }

  @Override
  public BigInteger balanceOf(String account) {
    return balances.getOrDefault(account, BigInteger.ZERO);
  }

  @Override
  public BigInteger allowance(String owner, String spender) {
    Map<String, BigInteger> m = allowances.get(owner);
    return m == null ? BigInteger.ZERO : m.getOrDefault(spender, BigInteger.ZERO);
  }

  @Override
  public void approve(String owner, String spender, BigInteger amount) {
    requireNonNegative(amount);
    allowances.computeIfAbsent(owner, k -> new LinkedHashMap<>()).put(spender, amount);
  }

  @Override
  public void transferFrom(String spender, String from, String to, BigInteger amount) {
    requireNonNegative(amount);
    BigInteger allowed = allowance(from, spender);
    if (allowed.compareTo(amount) < 0) {
      throw new LedgerException(
          FailureReason.INSUFFICIENT_ALLOWANCE,
          from + " allows " + spender + " only " + allowed + ", needs " + amount);
    }
    move(from, to, amount);
    allowances.get(from).put(spender, allowed.subtract(amount));
  }

  @Override
  public void transfer(String from, String to, BigInteger amount) {
    requireNonNegative(amount);
    move(from, to, amount);
  }

  @Override
  public void mint(String to, BigInteger amount) {
    requireNonNegative(amount);
    Objects.requireNonNull(to, "to");
    balances.merge(to, amount, BigInteger::add);
  }

  @Override
  public BigInteger totalSupply() {
    return balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
  }

  /** Copy of the current state, for persistence. */
  public State state() {
    State s = new State();
    s.balances.putAll(balances);
    allowances.forEach((owner, m) -> s.allowances.put(owner, new LinkedHashMap<>(m)));
    return s;
  }

  // ---------- Helpers ----------

  private void move(String from, String to, BigInteger amount) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    BigInteger have = balanceOf(from);
    if (have.compareTo(amount) < 0) {
      throw new LedgerException(
          FailureReason.INSUFFICIENT_BALANCE, from + " holds " + have + ", needs " + amount);
    }
    balances.put(from, have.subtract(amount));
    balances.merge(to, amount, BigInteger::add);
  }

  private static void requireNonNegative(BigInteger amount) {
    if (amount == null || amount.signum() < 0) {
      throw new IllegalArgumentException("Amount must be >= 0: " + amount);
    }
  }
}
