package org.example.crowdledger.service;

import java.math.BigInteger;
import org.example.crowdledger.model.FailureReason;
import org.example.crowdledger.model.LedgerException;
import org.example.crowdledger.storage.ConfigJson;
import org.example.crowdledger.util.UsernameValidator;

/**
 * Pure, deterministic economics of the platform: rewards, fees and the elimination test.
 *
 * <p>All amounts are token base units in fixed point with {@link #SCALE} = 10<sup>18</sup> base
 * units per whole token, computed with {@link BigInteger} so that intermediate products cannot
 * overflow. Integer division truncates toward zero throughout.
 *
 * <h2>Formulas</h2>
 *
 * <ul>
 *   <li>{@code reward(mau) = SCALE * baseReward / mau²} – paid per harvested net like. It shrinks
 *       quadratically as the user base grows, which bounds long-run issuance.
 *   <li>{@code fee(mau) = commissionConstant / mau²} with {@code commissionConstant = SCALE *
 *       baseReward * commissionPercent / 100}, precomputed once.
 *   <li>{@code feeForStrikes(s, mau) = 3 * fee(mau) * s} – posting surcharge for repeat offenders.
 * </ul>
 *
 * <p>Instances hold only constants and are safe to share.
 */
public class EconomicsEngine {

  /** Base units per whole token. */
  public static final BigInteger SCALE = BigInteger.TEN.pow(18);

  /** Combined like and dislike count that must be exceeded before elimination can be judged. */
  public static final long MINIMUM_QUORUM = 5L;

  /** z-value of the 95% confidence interval, scaled by {@link #Z_SCALE}. */
  public static final BigInteger Z = BigInteger.valueOf(1_960_000_000L);

  public static final BigInteger Z_SCALE = BigInteger.TEN.pow(9);

  /** Modulus of the wrapping subtraction used by the elimination test (256-bit words). */
  static final BigInteger WORD = BigInteger.ONE.shiftLeft(256);

  private static final BigInteger HALF = SCALE.shiftRight(1);
  private static final BigInteger STRIKE_MULTIPLIER = BigInteger.valueOf(3);

  private final BigInteger baseReward;
  private final BigInteger rewardNumerator;
  private final BigInteger commissionConstant;

  /**
   * @param baseReward reward numerator in whole tokens; must be positive
   * @param commissionPercent fee as a percentage of the reward; must not be negative
   */
  public EconomicsEngine(long baseReward, long commissionPercent) {
    if (baseReward <= 0) throw new IllegalArgumentException("baseReward must be > 0");
    if (commissionPercent < 0) throw new IllegalArgumentException("commissionPercent must be >= 0");
    this.baseReward = BigInteger.valueOf(baseReward);
    this.rewardNumerator = SCALE.multiply(this.baseReward);
    this.commissionConstant =
        rewardNumerator.multiply(BigInteger.valueOf(commissionPercent)).divide(BigInteger.valueOf(100));
  }

  public static EconomicsEngine fromConfig(ConfigJson cfg) {
    return new EconomicsEngine(cfg.baseReward, cfg.commissionPercent);
  }

  public BigInteger commissionConstant() {
    return commissionConstant;
  }

  /**
   * Reward minted per harvested net like.
   *
   * @param mau active-user count of the pricing period
   * @return {@code SCALE * baseReward / mau²}
   * @throws LedgerException {@code DIVISION_BY_ZERO} if {@code mau == 0}
   */
  public BigInteger reward(long mau) {
    return rewardNumerator.divide(squared(mau));
  }

  /**
   * Fee for one like or dislike.
   *
   * @param mau active-user count of the pricing period
   * @return {@code commissionConstant / mau²}
   * @throws LedgerException {@code DIVISION_BY_ZERO} if {@code mau == 0}
   */
  public BigInteger fee(long mau) {
    return commissionConstant.divide(squared(mau));
  }

  /**
   * Upload fee for an account with strikes.
   *
   * @param strikes number of strikes; must be positive
   * @param mau active-user count of the pricing period
   * @return {@code 3 * fee(mau) * strikes}
   * @throws IllegalArgumentException if {@code strikes <= 0}
   * @throws LedgerException {@code DIVISION_BY_ZERO} if {@code mau == 0}
   */
  public BigInteger feeForStrikes(long strikes, long mau) {
    if (strikes <= 0) throw new IllegalArgumentException("strikes must be > 0, got " + strikes);
    return STRIKE_MULTIPLIER.multiply(fee(mau)).multiply(BigInteger.valueOf(strikes));
  }

  /**
   * Decides whether the crowd has disapproved of a piece of content.
   *
   * <p>Let {@code p} be the dislike share. The test takes the lower bound of an approximate 95%
   * confidence interval, {@code p - z * sqrt(p(1-p)/n)}, and flags the content only when that
   * bound still exceeds one half. Small samples therefore need a clear majority of dislikes.
   *
   * <p>The subtraction is done modulo 2<sup>256</sup>. When the margin exceeds {@code p} the
   * result wraps to a value larger than {@code p}; that is read as "lower bound at or below zero"
   * and the answer is {@code false}.
   *
   * @param likes like count
   * @param dislikes dislike count
   * @return {@code true} if the content may be removed
   * @throws LedgerException {@code QUORUM_NOT_MET} if {@code likes + dislikes <= 5}
   */
  public boolean shouldEliminate(long likes, long dislikes) {
    if (likes < 0 || dislikes < 0) throw new IllegalArgumentException("Negative vote count");
    BigInteger total = BigInteger.valueOf(likes).add(BigInteger.valueOf(dislikes));
    if (total.compareTo(BigInteger.valueOf(MINIMUM_QUORUM)) <= 0) {
      throw new LedgerException(
          FailureReason.QUORUM_NOT_MET,
          "Need more than " + MINIMUM_QUORUM + " votes, have " + total);
    }
    if (dislikes == 0) return false;

    BigInteger p = BigInteger.valueOf(dislikes).multiply(SCALE).divide(total);
    BigInteger variance = p.multiply(SCALE.subtract(p)).divide(total);
    BigInteger margin = variance.sqrt().multiply(Z).divide(Z_SCALE);

    BigInteger lower = p.subtract(margin).mod(WORD);
    if (lower.compareTo(p) > 0) return false;
    return lower.compareTo(HALF) > 0;
  }

  /**
   * @param name candidate username
   * @return {@code true} if the name fits the username rules
   * @see UsernameValidator
   */
  public boolean isValidUsername(String name) {
    return UsernameValidator.isValid(name);
  }

  /**
   * Validates a username and returns it without padding.
   *
   * @param name candidate username
   * @return the name without NUL padding
   * @throws LedgerException {@code INVALID_USERNAME} if the name is rejected
   */
  public String requireValidUsername(String name) {
    if (!UsernameValidator.isValid(name)) {
      throw new LedgerException(FailureReason.INVALID_USERNAME, "Invalid username: " + name);
    }
    return UsernameValidator.stripPadding(name);
  }

  private static BigInteger squared(long mau) {
    if (mau == 0) {
      throw new LedgerException(FailureReason.DIVISION_BY_ZERO, "No active users in the period");
    }
    BigInteger m = BigInteger.valueOf(mau);
    return m.multiply(m);
  }
}
