package com.codeheadsystems.sqrl.storage.scrypt;

/**
 * Key Stretching Function: turns low-entropy secret text into a 32-byte key at the cost
 * described by a {@link ScryptConfig}.
 */
public interface KeyStretchingFunction {

  /**
   * Output length of every stretch.
   */
  int KEY_LENGTH = 32;

  /**
   * Stretches the secret. Must be deterministic for a given secret and configuration.
   *
   * @param secret the secret bytes
   * @param costs  the salt and work factors
   * @return a 32-byte key
   */
  byte[] stretch(byte[] secret, ScryptConfig costs);
}
