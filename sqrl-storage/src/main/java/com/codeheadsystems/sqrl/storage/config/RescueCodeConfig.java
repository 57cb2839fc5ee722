package com.codeheadsystems.sqrl.storage.config;

import com.codeheadsystems.sqrl.storage.common.RandomProvider;
import com.codeheadsystems.sqrl.storage.scrypt.EnScrypt;
import com.codeheadsystems.sqrl.storage.scrypt.KeyStretchingFunction;
import com.codeheadsystems.sqrl.storage.scrypt.ScryptConfig;

/**
 * Configuration for rescue-code protection of the identity unlock key.
 * Holds the EnScrypt cost, the effort multiplier, the key stretching function and the random
 * source.
 * <p>
 * Every seal stores {@code baseIterations * effortMultiplier} as the block's iteration count;
 * recovery replays whatever count the block carries.
 *
 * @param logNFactor       scrypt N as a power of two, used for new blocks
 * @param baseIterations   EnScrypt iterations of a quick derivation
 * @param effortMultiplier multiplier applied on top of the base iterations
 * @param ksf              the key stretching function
 * @param randomProvider   the random provider
 */
public record RescueCodeConfig(
    int logNFactor,
    int baseIterations,
    int effortMultiplier,
    KeyStretchingFunction ksf,
    RandomProvider randomProvider
) {

  /**
   * Rescue code recovery is rare and attackable offline, so it costs seven quick derivations.
   */
  public static final int RESCUE_CODE_EFFORT_MULTIPLIER = 7;

  /**
   * SQRL scrypt N = 2^9.
   */
  public static final int SQRL_LOG_N_FACTOR = 9;

  /**
   * Default production configuration: SQRL EnScrypt (N=512, r=256, p=1), 20 base iterations.
   */
  public static final RescueCodeConfig DEFAULT = new RescueCodeConfig(
      SQRL_LOG_N_FACTOR, 20, RESCUE_CODE_EFFORT_MULTIPLIER, new EnScrypt(), new RandomProvider());

  /**
   * Validates the cost parameters.
   */
  public RescueCodeConfig {
    if (logNFactor < 1 || logNFactor > ScryptConfig.MAX_LOG_N_FACTOR) {
      throw new IllegalArgumentException("logNFactor out of range: " + logNFactor);
    }
    if (baseIterations < 1) {
      throw new IllegalArgumentException("baseIterations must be positive: " + baseIterations);
    }
    if (effortMultiplier < 1) {
      throw new IllegalArgumentException("effortMultiplier must be positive: " + effortMultiplier);
    }
    if ((long) baseIterations * effortMultiplier > ScryptConfig.MAX_ITERATION_COUNT) {
      throw new IllegalArgumentException("baseIterations * effortMultiplier exceeds "
          + ScryptConfig.MAX_ITERATION_COUNT);
    }
    if (ksf == null || randomProvider == null) {
      throw new IllegalArgumentException("ksf and randomProvider are required");
    }
  }

  /**
   * Creates a cheap test configuration: EnScrypt with N=16, r=8, p=1 and one base iteration.
   * Do not use in production.
   *
   * @return the rescue code config
   */
  public static RescueCodeConfig forTesting() {
    return new RescueCodeConfig(4, 1, RESCUE_CODE_EFFORT_MULTIPLIER, new EnScrypt(8, 1), new RandomProvider());
  }

  /**
   * Creates an EnScrypt configuration with the given costs.
   *
   * @param logNFactor     the log n factor
   * @param baseIterations the base iterations
   * @param blockSize      scrypt r
   * @param parallelism    scrypt p
   * @return the rescue code config
   */
  public static RescueCodeConfig withEnScrypt(int logNFactor, int baseIterations, int blockSize, int parallelism) {
    return new RescueCodeConfig(logNFactor, baseIterations, RESCUE_CODE_EFFORT_MULTIPLIER,
        new EnScrypt(blockSize, parallelism), new RandomProvider());
  }

  /**
   * Returns a new config identical to this one but using the given {@link RandomProvider}.
   *
   * @param randomProvider the random provider
   * @return the rescue code config
   */
  public RescueCodeConfig withRandomProvider(RandomProvider randomProvider) {
    return new RescueCodeConfig(logNFactor, baseIterations, effortMultiplier, ksf, randomProvider);
  }

  /**
   * Returns a new config identical to this one but with another effort multiplier.
   *
   * @param effortMultiplier the effort multiplier
   * @return the rescue code config
   */
  public RescueCodeConfig withEffortMultiplier(int effortMultiplier) {
    return new RescueCodeConfig(logNFactor, baseIterations, effortMultiplier, ksf, randomProvider);
  }

  /**
   * Iteration count written into a block sealed under this configuration.
   *
   * @return the long
   */
  public long sealingIterations() {
    return (long) baseIterations * effortMultiplier;
  }
}
