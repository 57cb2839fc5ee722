package com.codeheadsystems.sqrl.storage.internal;

import com.codeheadsystems.sqrl.storage.common.ByteUtils;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * A 256-bit AES key fresh out of the key stretching function, usable for exactly one AEAD call.
 * <p>
 * The GCM nonce is a constant, so a key must never seal twice. Handing the key material over
 * wipes this holder; any second use fails.
 */
public final class DerivedKey {

  private final byte[] material;
  private boolean consumed;

  DerivedKey(byte[] material) {
    this.material = ByteUtils.copyOfExactLength(material, 32, "derived key");
    ByteUtils.wipe(material);
  }

  /**
   * Whether the key has been used.
   *
   * @return the boolean
   */
  public boolean isConsumed() {
    return consumed;
  }

  /**
   * Hands the key material to a cipher and wipes it here.
   *
   * @return the key parameter
   * @throws IllegalStateException if the key was already used
   */
  KeyParameter consume() {
    if (consumed) {
      throw new IllegalStateException("Derived key has already been used");
    }
    consumed = true;
    KeyParameter parameter = new KeyParameter(material);
    ByteUtils.wipe(material);
    return parameter;
  }
}
