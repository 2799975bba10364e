/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.atlasexplorer.client.envelope;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Encrypted payload: AES-GCM ciphertext, the wrapped content secret and the per-call KDF salt and
 * nonce needed to reverse it.
 */
@AutoValue
public abstract class Envelope {

  public static final int CURRENT_VERSION = 1;
  public static final int SALT_LENGTH = 32;
  public static final int MIN_NONCE_LENGTH = 12;
  public static final int MAX_NONCE_LENGTH = 16;
  public static final int TAG_LENGTH = 16;
  public static final int MAX_WRAPPED_KEY_LENGTH = 0xFFFF;

  public static Builder builder() {
    return new AutoValue_Envelope.Builder().setVersion(CURRENT_VERSION);
  }

  public abstract int version();

  public abstract WrapScheme wrapScheme();

  public abstract KdfParams kdfParams();

  @SuppressWarnings("mutable")
  public abstract byte[] salt();

  @SuppressWarnings("mutable")
  public abstract byte[] nonce();

  @SuppressWarnings("mutable")
  public abstract byte[] wrappedKey();

  @SuppressWarnings("mutable")
  public abstract byte[] ciphertext();

  @SuppressWarnings("mutable")
  public abstract byte[] tag();

  public abstract Builder toBuilder();

  /** Builder for {@link Envelope}. */
  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setVersion(int version);

    public abstract Builder setWrapScheme(WrapScheme wrapScheme);

    public abstract Builder setKdfParams(KdfParams kdfParams);

    public abstract Builder setSalt(byte[] salt);

    public abstract Builder setNonce(byte[] nonce);

    public abstract Builder setWrappedKey(byte[] wrappedKey);

    public abstract Builder setCiphertext(byte[] ciphertext);

    public abstract Builder setTag(byte[] tag);

    abstract Envelope autoBuild();

    /**
     * @throws IllegalArgumentException if a field length does not fit the wire format
     */
    public Envelope build() {
      Envelope envelope = autoBuild();
      checkArgument(
          envelope.version() == CURRENT_VERSION, "Unsupported version %s", envelope.version());
      checkArgument(envelope.salt().length == SALT_LENGTH, "Salt must be %s bytes", SALT_LENGTH);
      int nonceLength = envelope.nonce().length;
      checkArgument(
          nonceLength >= MIN_NONCE_LENGTH && nonceLength <= MAX_NONCE_LENGTH,
          "Nonce must be %s to %s bytes",
          MIN_NONCE_LENGTH,
          MAX_NONCE_LENGTH);
      checkArgument(envelope.tag().length == TAG_LENGTH, "Tag must be %s bytes", TAG_LENGTH);
      checkArgument(
          envelope.wrappedKey().length > 0
              && envelope.wrappedKey().length <= MAX_WRAPPED_KEY_LENGTH,
          "Wrapped key must be 1 to %s bytes",
          MAX_WRAPPED_KEY_LENGTH);
      return envelope;
    }
  }
}
