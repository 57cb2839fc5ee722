package com.codeheadsystems.sqrl.client.config;

import com.codeheadsystems.sqrl.storage.config.RescueCodeConfig;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;

/**
 * Client-side configuration for rescue code protection, bindable from JSON.
 * <p>
 * {@code blockSize} and {@code parallelism} are not stored in blocks: every client reading a
 * block must use the values its writer used. The SQRL values are 256 and 1.
 *
 * @param logNFactor        scrypt N as a power of two for newly sealed blocks
 * @param baseIterations    EnScrypt iterations of a quick derivation
 * @param effortMultiplier  multiplier for rescue code derivations (SQRL uses 7)
 * @param blockSize         scrypt r
 * @param parallelism       scrypt p
 * @param derivationThreads size of the worker pool running asynchronous derivations
 */
public record IdentityUnlockClientConfig(
    @JsonProperty("logNFactor") int logNFactor,
    @JsonProperty("baseIterations") int baseIterations,
    @JsonProperty("effortMultiplier") int effortMultiplier,
    @JsonProperty("blockSize") int blockSize,
    @JsonProperty("parallelism") int parallelism,
    @JsonProperty("derivationThreads") int derivationThreads) {

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES);

  /**
   * Validates the worker pool size. Cost parameters are validated by {@link RescueCodeConfig}.
   */
  public IdentityUnlockClientConfig {
    if (derivationThreads < 1) {
      throw new IllegalArgumentException("derivationThreads must be positive: " + derivationThreads);
    }
  }

  /**
   * Production defaults matching {@link RescueCodeConfig#DEFAULT}.
   *
   * @return the identity unlock client config
   */
  public static IdentityUnlockClientConfig defaults() {
    return new IdentityUnlockClientConfig(RescueCodeConfig.SQRL_LOG_N_FACTOR, 20,
        RescueCodeConfig.RESCUE_CODE_EFFORT_MULTIPLIER, 256, 1, 2);
  }

  /**
   * Cheap configuration for tests. Do not use in production.
   *
   * @return the identity unlock client config
   */
  public static IdentityUnlockClientConfig forTesting() {
    return new IdentityUnlockClientConfig(4, 1, RescueCodeConfig.RESCUE_CODE_EFFORT_MULTIPLIER, 8, 1, 1);
  }

  /**
   * Reads a configuration from JSON. Every property is required.
   *
   * @param json the json stream
   * @return the identity unlock client config
   * @throws IOException if the stream cannot be read or parsed
   */
  public static IdentityUnlockClientConfig fromJson(InputStream json) throws IOException {
    return MAPPER.readValue(json, IdentityUnlockClientConfig.class);
  }

  /**
   * Builds the library configuration.
   *
   * @return the rescue code config
   */
  public RescueCodeConfig toRescueCodeConfig() {
    return RescueCodeConfig.withEnScrypt(logNFactor, baseIterations, blockSize, parallelism)
        .withEffortMultiplier(effortMultiplier);
  }
}
