package com.codeheadsystems.sqrl.storage.rescue;

import com.codeheadsystems.sqrl.storage.common.RandomProvider;
import java.nio.charset.StandardCharsets;

/**
 * A SQRL rescue code: 24 decimal digits, displayed as six dash-separated groups of four.
 * The digits themselves (as ASCII) are the key material fed to EnScrypt.
 * <p>
 * Rescue codes are never persisted. {@link #toString()} does not reveal the digits.
 *
 * @param digits the 24 digits, no separators
 */
public record RescueCode(String digits) {

  /**
   * Number of digits in a rescue code.
   */
  public static final int DIGIT_COUNT = 24;

  private static final int GROUP_SIZE = 4;

  // Largest multiple of 10 that fits in an unsigned byte; bytes at or above are rejected.
  private static final int REJECTION_LIMIT = 250;

  /**
   * Validates the digits.
   */
  public RescueCode {
    if (digits == null || digits.length() != DIGIT_COUNT || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
      throw new IllegalArgumentException("Rescue code must be exactly " + DIGIT_COUNT + " decimal digits");
    }
  }

  /**
   * Generates a new rescue code with uniformly distributed digits.
   *
   * @param randomProvider the random provider
   * @return the rescue code
   */
  public static RescueCode generate(RandomProvider randomProvider) {
    StringBuilder sb = new StringBuilder(DIGIT_COUNT);
    while (sb.length() < DIGIT_COUNT) {
      for (byte b : randomProvider.randomBytes(DIGIT_COUNT)) {
        int value = b & 0xFF;
        if (value < REJECTION_LIMIT && sb.length() < DIGIT_COUNT) {
          sb.append((char) ('0' + value % 10));
        }
      }
    }
    return new RescueCode(sb.toString());
  }

  /**
   * Parses user input. Dashes and whitespace between digits are ignored.
   *
   * @param text the text as typed or displayed
   * @return the rescue code
   * @throws IllegalArgumentException if the text does not hold exactly 24 digits
   */
  public static RescueCode parse(String text) {
    if (text == null) {
      throw new IllegalArgumentException("Rescue code is required");
    }
    StringBuilder sb = new StringBuilder(DIGIT_COUNT);
    for (char c : text.toCharArray()) {
      if (c == '-' || Character.isWhitespace(c)) {
        continue;
      }
      sb.append(c);
    }
    return new RescueCode(sb.toString());
  }

  /**
   * Display form, e.g. {@code 1234-5678-9012-3456-7890-1234}.
   *
   * @return the string
   */
  public String formatted() {
    StringBuilder sb = new StringBuilder(DIGIT_COUNT + DIGIT_COUNT / GROUP_SIZE);
    for (int i = 0; i < DIGIT_COUNT; i += GROUP_SIZE) {
      if (i > 0) {
        sb.append('-');
      }
      sb.append(digits, i, i + GROUP_SIZE);
    }
    return sb.toString();
  }

  /**
   * Raw key material for the key stretching function. The caller owns (and should wipe) the
   * returned array.
   *
   * @return the byte [ ]
   */
  public byte[] keyMaterial() {
    return digits.getBytes(StandardCharsets.US_ASCII);
  }

  @Override
  public String toString() {
    return "RescueCode[****]";
  }
}
