package com.codeheadsystems.sqrl.storage.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sqrl.storage.block.IdentityUnlock;
import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import com.codeheadsystems.sqrl.storage.config.RescueCodeConfig;
import com.codeheadsystems.sqrl.storage.exception.RescueCodeAuthenticationException;
import com.codeheadsystems.sqrl.storage.rescue.RescueCode;
import com.codeheadsystems.sqrl.storage.scrypt.ScryptConfig;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class IdentityUnlockCryptoTest {

  private static final RescueCodeConfig CONFIG = RescueCodeConfig.forTesting(); // cheap EnScrypt
  private static final RescueCode CODE = new RescueCode("111122223333444455556666");
  private static final RescueCode OTHER_CODE = new RescueCode("111122223333444455556667");
  private static final byte[] IUK = Hex.decode(
      "0f1e2d3c4b5a69788796a5b4c3d2e1f00112233445566778899aabbccddeeff0");
  private static final byte[] KEY_MATERIAL = Hex.decode(
      "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");

  private ScryptConfig scryptConfig;
  private byte[] aad;

  @BeforeEach
  void setUp() {
    scryptConfig = ScryptConfig.generate(CONFIG.randomProvider(), CONFIG.logNFactor(), CONFIG.sealingIterations());
    aad = IdentityUnlock.buildAad(scryptConfig);
  }

  private DerivedKey keyFor(RescueCode code) {
    return IdentityUnlockCrypto.deriveRecoveryKey(code, scryptConfig, CONFIG.ksf());
  }

  @Test
  void sealThenOpen_recoversPlaintext() {
    IdentityUnlockCrypto.SealResult sealed = IdentityUnlockCrypto.seal(keyFor(CODE), IUK, aad);

    assertThat(sealed.ciphertext()).hasSize(32).isNotEqualTo(IUK);
    assertThat(sealed.tag()).hasSize(16);
    assertThat(IdentityUnlockCrypto.open(keyFor(CODE), sealed.ciphertext(), sealed.tag(), aad)).isEqualTo(IUK);
  }

  @Test
  void seal_matchesJceAesGcmWithZeroNonce() throws Exception {
    IdentityUnlockCrypto.SealResult sealed =
        IdentityUnlockCrypto.seal(new DerivedKey(KEY_MATERIAL.clone()), IUK, aad);

    Cipher jce = Cipher.getInstance("AES/GCM/NoPadding");
    jce.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(KEY_MATERIAL, "AES"), new GCMParameterSpec(128, new byte[12]));
    jce.updateAAD(aad);
    byte[] expected = jce.doFinal(IUK);

    assertThat(ByteUtils.concat(sealed.ciphertext(), sealed.tag())).isEqualTo(expected);
  }

  @Test
  void open_wrongRescueCode_failsAuthentication() {
    IdentityUnlockCrypto.SealResult sealed = IdentityUnlockCrypto.seal(keyFor(CODE), IUK, aad);

    assertThatThrownBy(() -> IdentityUnlockCrypto.open(keyFor(OTHER_CODE), sealed.ciphertext(), sealed.tag(), aad))
        .isInstanceOf(RescueCodeAuthenticationException.class)
        .hasMessageContaining("Check your rescue code");
  }

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 3, 4, 19, 20, 21, 24})
  void open_tamperedAad_failsAuthentication(int index) {
    IdentityUnlockCrypto.SealResult sealed = IdentityUnlockCrypto.seal(keyFor(CODE), IUK, aad);
    byte[] tampered = aad.clone();
    tampered[index] ^= 0x01;

    assertThatThrownBy(() -> IdentityUnlockCrypto.open(keyFor(CODE), sealed.ciphertext(), sealed.tag(), tampered))
        .isInstanceOf(RescueCodeAuthenticationException.class);
  }

  @Test
  void open_tamperedCiphertextOrTag_failsAuthentication() {
    IdentityUnlockCrypto.SealResult sealed = IdentityUnlockCrypto.seal(keyFor(CODE), IUK, aad);
    byte[] ciphertext = sealed.ciphertext().clone();
    ciphertext[7] ^= 0x40;
    byte[] tag = sealed.tag().clone();
    tag[0] ^= 0x01;

    assertThatThrownBy(() -> IdentityUnlockCrypto.open(keyFor(CODE), ciphertext, sealed.tag(), aad))
        .isInstanceOf(RescueCodeAuthenticationException.class);
    assertThatThrownBy(() -> IdentityUnlockCrypto.open(keyFor(CODE), sealed.ciphertext(), tag, aad))
        .isInstanceOf(RescueCodeAuthenticationException.class);
  }

  @Test
  void derivedKey_cannotBeUsedTwice() {
    DerivedKey key = keyFor(CODE);
    IdentityUnlockCrypto.seal(key, IUK, aad);

    assertThat(key.isConsumed()).isTrue();
    assertThatThrownBy(() -> IdentityUnlockCrypto.seal(key, new byte[32], aad))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already been used");
  }

  @Test
  void derivedKey_wipesSourceMaterial() {
    byte[] material = KEY_MATERIAL.clone();
    new DerivedKey(material);

    assertThat(material).containsOnly(0);
  }

  @Test
  void seal_rejectsWrongPlaintextLength() {
    assertThatThrownBy(() -> IdentityUnlockCrypto.seal(keyFor(CODE), new byte[16], aad))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("identity unlock key");
  }

  @Test
  void deriveSealingKey_refreshesScryptConfigWithMultipliedIterations() {
    IdentityUnlockCrypto.SealingKey first = IdentityUnlockCrypto.deriveSealingKey(CODE, CONFIG);
    IdentityUnlockCrypto.SealingKey second = IdentityUnlockCrypto.deriveSealingKey(CODE, CONFIG);

    assertThat(first.scryptConfig().iterationCount()).isEqualTo(CONFIG.baseIterations() * 7L);
    assertThat(first.scryptConfig().logNFactor()).isEqualTo(CONFIG.logNFactor());
    assertThat(first.scryptConfig().salt()).isNotEqualTo(second.scryptConfig().salt());
  }

  @Test
  void recoveryKey_matchesSealingKeyForSameScryptConfig() {
    IdentityUnlockCrypto.SealingKey sealingKey = IdentityUnlockCrypto.deriveSealingKey(CODE, CONFIG);
    byte[] sealingAad = IdentityUnlock.buildAad(sealingKey.scryptConfig());
    IdentityUnlockCrypto.SealResult sealed = IdentityUnlockCrypto.seal(sealingKey.key(), IUK, sealingAad);

    DerivedKey recoveryKey =
        IdentityUnlockCrypto.deriveRecoveryKey(CODE, sealingKey.scryptConfig(), CONFIG.ksf());

    assertThat(IdentityUnlockCrypto.open(recoveryKey, sealed.ciphertext(), sealed.tag(), sealingAad))
        .isEqualTo(IUK);
  }
}
