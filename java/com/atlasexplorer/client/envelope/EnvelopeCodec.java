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

import static java.nio.charset.StandardCharsets.US_ASCII;

import com.atlasexplorer.client.envelope.model.ErrorReason;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Binary codec for {@link Envelope}.
 *
 * <p>Version 1 layout, big endian:
 *
 * <pre>
 * "AXEV" | version u8 | wrapScheme u8 | log2N u8 | r u8 | p u8
 * | saltLen u8 | salt | nonceLen u8 | nonce | tagLen u8 | tag
 * | wrappedKeyLen u16 | wrappedKey | ciphertextLen u32 | ciphertext
 * </pre>
 *
 * The first nine bytes form the header that the encryptor authenticates as associated data.
 */
public final class EnvelopeCodec {

  private static final byte[] MAGIC = "AXEV".getBytes(US_ASCII);
  private static final int HEADER_LENGTH = MAGIC.length + 5;

  /** Serializes {@code envelope} into its wire form. */
  public byte[] serialize(Envelope envelope) {
    int length =
        HEADER_LENGTH
            + 1
            + envelope.salt().length
            + 1
            + envelope.nonce().length
            + 1
            + envelope.tag().length
            + 2
            + envelope.wrappedKey().length
            + 4
            + envelope.ciphertext().length;
    ByteBuffer buffer = ByteBuffer.allocate(length);
    buffer.put(header(envelope.version(), envelope.wrapScheme(), envelope.kdfParams()));
    putShortField(buffer, envelope.salt());
    putShortField(buffer, envelope.nonce());
    putShortField(buffer, envelope.tag());
    buffer.putShort((short) envelope.wrappedKey().length);
    buffer.put(envelope.wrappedKey());
    buffer.putInt(envelope.ciphertext().length);
    buffer.put(envelope.ciphertext());
    return buffer.array();
  }

  /**
   * Parses the wire form produced by {@link #serialize(Envelope)}.
   *
   * @throws EnvelopeFormatException on bad magic, unknown version or scheme, out of range lengths,
   *     truncation or trailing bytes
   */
  public Envelope parse(byte[] bytes) throws EnvelopeFormatException {
    ByteBuffer buffer = ByteBuffer.wrap(bytes).asReadOnlyBuffer();
    try {
      byte[] magic = new byte[MAGIC.length];
      buffer.get(magic);
      if (!Arrays.equals(magic, MAGIC)) {
        throw new EnvelopeFormatException("Not an envelope", ErrorReason.BAD_MAGIC);
      }
      int version = Byte.toUnsignedInt(buffer.get());
      if (version != Envelope.CURRENT_VERSION) {
        throw new EnvelopeFormatException(
            "Unsupported envelope version " + version, ErrorReason.UNSUPPORTED_VERSION);
      }
      int schemeId = Byte.toUnsignedInt(buffer.get());
      WrapScheme scheme =
          WrapScheme.fromId(schemeId)
              .orElseThrow(
                  () ->
                      new EnvelopeFormatException(
                          "Unknown wrap scheme " + schemeId, ErrorReason.UNKNOWN_WRAP_SCHEME));
      int log2N = Byte.toUnsignedInt(buffer.get());
      int r = Byte.toUnsignedInt(buffer.get());
      int p = Byte.toUnsignedInt(buffer.get());
      if (!KdfParams.isValid(log2N, r, p)) {
        throw new EnvelopeFormatException(
            String.format("Unsupported scrypt parameters log2N=%d r=%d p=%d", log2N, r, p),
            ErrorReason.INVALID_KDF_PARAMS);
      }
      byte[] salt = readShortField(buffer, "salt", Envelope.SALT_LENGTH, Envelope.SALT_LENGTH);
      byte[] nonce =
          readShortField(buffer, "nonce", Envelope.MIN_NONCE_LENGTH, Envelope.MAX_NONCE_LENGTH);
      byte[] tag = readShortField(buffer, "tag", Envelope.TAG_LENGTH, Envelope.TAG_LENGTH);
      int wrappedKeyLength = Short.toUnsignedInt(buffer.getShort());
      if (wrappedKeyLength == 0) {
        throw new EnvelopeFormatException("Empty wrapped key", ErrorReason.INVALID_LENGTH);
      }
      byte[] wrappedKey = readBytes(buffer, wrappedKeyLength);
      long ciphertextLength = Integer.toUnsignedLong(buffer.getInt());
      if (ciphertextLength > buffer.remaining()) {
        throw new EnvelopeFormatException(
            "Ciphertext length " + ciphertextLength + " exceeds the remaining input",
            ErrorReason.TRUNCATED);
      }
      byte[] ciphertext = readBytes(buffer, (int) ciphertextLength);
      if (buffer.hasRemaining()) {
        throw new EnvelopeFormatException(
            buffer.remaining() + " trailing bytes after ciphertext", ErrorReason.TRAILING_BYTES);
      }
      return Envelope.builder()
          .setVersion(version)
          .setWrapScheme(scheme)
          .setKdfParams(KdfParams.create(log2N, r, p))
          .setSalt(salt)
          .setNonce(nonce)
          .setTag(tag)
          .setWrappedKey(wrappedKey)
          .setCiphertext(ciphertext)
          .build();
    } catch (BufferUnderflowException e) {
      throw new EnvelopeFormatException(
          "Envelope truncated at " + bytes.length + " bytes", ErrorReason.TRUNCATED, e);
    }
  }

  /** Returns the header bytes of an envelope with these properties, used as AES-GCM AAD. */
  public static byte[] header(int version, WrapScheme scheme, KdfParams kdfParams) {
    return ByteBuffer.allocate(HEADER_LENGTH)
        .put(MAGIC)
        .put((byte) version)
        .put((byte) scheme.id())
        .put((byte) kdfParams.log2N())
        .put((byte) kdfParams.r())
        .put((byte) kdfParams.p())
        .array();
  }

  private static void putShortField(ByteBuffer buffer, byte[] field) {
    buffer.put((byte) field.length);
    buffer.put(field);
  }

  private static byte[] readShortField(ByteBuffer buffer, String name, int min, int max)
      throws EnvelopeFormatException {
    int length = Byte.toUnsignedInt(buffer.get());
    if (length < min || length > max) {
      throw new EnvelopeFormatException(
          String.format("Invalid %s length %d", name, length), ErrorReason.INVALID_LENGTH);
    }
    return readBytes(buffer, length);
  }

  private static byte[] readBytes(ByteBuffer buffer, int length) {
    byte[] out = new byte[length];
    buffer.get(out);
    return out;
  }
}
