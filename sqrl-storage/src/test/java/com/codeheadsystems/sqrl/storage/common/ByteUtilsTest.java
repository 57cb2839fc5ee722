package com.codeheadsystems.sqrl.storage.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ByteUtilsTest {

  // ─── Constructor ──────────────────────────────────────────────────────────

  @Test
  void privateConstructorIsInaccessible() throws Exception {
    Constructor<ByteUtils> ctor = ByteUtils.class.getDeclaredConstructor();
    ctor.setAccessible(true);
    ctor.newInstance();
  }

  // ─── toLittleEndian ───────────────────────────────────────────────────────

  @Test
  void toLittleEndian_singleByte() {
    assertThat(ByteUtils.toLittleEndian(0xAB, 1)).isEqualTo(new byte[]{(byte) 0xAB});
  }

  @Test
  void toLittleEndian_twoBytesLeastSignificantFirst() {
    // 73 = 0x0049
    assertThat(ByteUtils.toLittleEndian(73, 2)).isEqualTo(new byte[]{0x49, 0x00});
    // 256 = 0x0100
    assertThat(ByteUtils.toLittleEndian(256, 2)).isEqualTo(new byte[]{0x00, 0x01});
  }

  @Test
  void toLittleEndian_fourBytesUnsignedMax() {
    assertThat(ByteUtils.toLittleEndian(0xFFFFFFFFL, 4))
        .isEqualTo(new byte[]{(byte) 0xFF, (byte) 0xFF, (byte) 0xFF, (byte) 0xFF});
  }

  @Test
  void toLittleEndian_negativeValueThrows() {
    assertThatThrownBy(() -> ByteUtils.toLittleEndian(-1, 1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Value too large for specified length");
  }

  @Test
  void toLittleEndian_valueTooLargeForLengthThrows() {
    assertThatThrownBy(() -> ByteUtils.toLittleEndian(65536, 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Value too large for specified length");
  }

  // ─── concat ───────────────────────────────────────────────────────────────

  @Test
  void concat_noArraysReturnsEmpty() {
    assertThat(ByteUtils.concat()).isEmpty();
  }

  @Test
  void concat_emptyArrayAmongOthers() {
    assertThat(ByteUtils.concat(new byte[]{1, 2}, new byte[0], new byte[]{3, 4}))
        .isEqualTo(new byte[]{1, 2, 3, 4});
  }

  @Test
  void concat_doesNotMutateInputs() {
    byte[] a = {1, 2};
    byte[] result = ByteUtils.concat(a, new byte[]{3});
    result[0] = 99;
    assertThat(a[0]).isEqualTo((byte) 1);
  }

  // ─── xor ────────────────────────────────────────────────────────────────────

  @Test
  void xor_basicOperation() {
    byte[] a = {(byte) 0xFF, 0x00, 0x0F};
    byte[] b = {(byte) 0x0F, (byte) 0xF0, (byte) 0xFF};
    assertThat(ByteUtils.xor(a, b)).isEqualTo(new byte[]{(byte) 0xF0, (byte) 0xF0, (byte) 0xF0});
  }

  @Test
  void xor_unequalLengthsThrows() {
    assertThatThrownBy(() -> ByteUtils.xor(new byte[]{1, 2}, new byte[]{1}))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("equal length");
  }

  // ─── isAllZero / wipe ───────────────────────────────────────────────────────

  @Test
  void isAllZero_detectsAnyNonZeroByte() {
    assertThat(ByteUtils.isAllZero(new byte[32])).isTrue();
    assertThat(ByteUtils.isAllZero(new byte[0])).isTrue();
    byte[] last = new byte[32];
    last[31] = (byte) 0x80;
    assertThat(ByteUtils.isAllZero(last)).isFalse();
  }

  @Test
  void wipe_zeroesArrayAndIgnoresNull() {
    byte[] secret = {1, 2, 3};
    ByteUtils.wipe(secret);
    ByteUtils.wipe(null);
    assertThat(secret).containsOnly(0);
  }

  // ─── requireLength ──────────────────────────────────────────────────────────

  @Test
  void requireLength_returnsSameArrayWithoutCopying() {
    byte[] in = {1, 2, 3};
    assertThat(ByteUtils.requireLength(in, 3, "field")).isSameAs(in);
  }

  @Test
  void requireLength_rejectsWrongLengthAndNull() {
    assertThatThrownBy(() -> ByteUtils.requireLength(new byte[33], 32, "iuk"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("iuk must be exactly 32 bytes, got 33");
    assertThatThrownBy(() -> ByteUtils.requireLength(null, 32, "iuk"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("got null");
  }

  // ─── copyOfExactLength ──────────────────────────────────────────────────────

  @Test
  void copyOfExactLength_returnsCopy() {
    byte[] in = {1, 2, 3};
    byte[] out = ByteUtils.copyOfExactLength(in, 3, "field");
    assertThat(out).isEqualTo(in).isNotSameAs(in);
  }

  @Test
  void copyOfExactLength_rejectsWrongLengthAndNull() {
    assertThatThrownBy(() -> ByteUtils.copyOfExactLength(new byte[31], 32, "iuk"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("iuk must be exactly 32 bytes, got 31");
    assertThatThrownBy(() -> ByteUtils.copyOfExactLength(null, 32, "iuk"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("got null");
  }
}
