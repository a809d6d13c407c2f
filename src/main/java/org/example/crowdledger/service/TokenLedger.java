package org.example.crowdledger.service;

import java.math.BigInteger;

/**
 * Fungible token accounts the platform settles fees and rewards against.
 *
 * <p>The platform consumes this contract and does not implement token economics itself; {@link
 * InMemoryTokenLedger} is the bundled stand-in used by the CLI and tests. Amounts are base units
 * (see {@link EconomicsEngine#SCALE}).
 *
 * <p>Failures are synchronous and final: an implementation either applies a movement completely or
 * throws, leaving balances unchanged. There is no retry.
 */
public interface TokenLedger {

  /** Balance of {@code account}; zero for unknown accounts. */
  BigInteger balanceOf(String account);

  /** Amount {@code spender} may still move out of {@code owner}'s account. */
  BigInteger allowance(String owner, String spender);

  /**
   * Sets {@code spender}'s allowance on {@code owner}'s account.
   *
   * @param owner account granting the allowance
   * @param spender account allowed to spend
   * @param amount new allowance (replaces the previous one)
   */
  void approve(String owner, String spender, BigInteger amount);

  /**
   * Moves {@code amount} from {@code from} to {@code to} on behalf of {@code spender}, consuming
   * allowance.
   *
   * @throws org.example.crowdledger.model.LedgerException {@code INSUFFICIENT_BALANCE} or {@code
   *     INSUFFICIENT_ALLOWANCE}
   */
  void transferFrom(String spender, String from, String to, BigInteger amount);

  /**
   * Moves {@code amount} from {@code from}'s own account to {@code to}.
   *
   * @throws org.example.crowdledger.model.LedgerException {@code INSUFFICIENT_BALANCE}
   */
  void transfer(String from, String to, BigInteger amount);

  /** Creates {@code amount} new tokens in {@code to}'s account. */
  void mint(String to, BigInteger amount);

  /** Sum of all balances. */
  BigInteger totalSupply();
}
