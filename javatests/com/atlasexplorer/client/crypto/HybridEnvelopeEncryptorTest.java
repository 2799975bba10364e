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

package com.atlasexplorer.client.crypto;

import static com.google.common.truth.Truth.assertThat;
import static com.google.common.truth.Truth.assertWithMessage;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.atlasexplorer.client.crypto.model.ErrorReason;
import com.atlasexplorer.client.envelope.Envelope;
import com.atlasexplorer.client.envelope.EnvelopeCodec;
import com.atlasexplorer.client.envelope.EnvelopeFormatException;
import com.atlasexplorer.client.envelope.KdfParams;
import com.atlasexplorer.client.envelope.WrapScheme;
import com.google.common.io.BaseEncoding;
import com.google.crypto.tink.KeysetHandle;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import org.junit.BeforeClass;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class HybridEnvelopeEncryptorTest {

  // Cheapest accepted cost so the tests stay fast.
  private static final KdfParams TEST_KDF_PARAMS = KdfParams.create(10, 8, 1);
  private static final byte[] PLAINTEXT = "\u007fELF hello mips".getBytes(UTF_8);

  private static KeyWrapper tinkWrapper;
  private static KeyUnwrapper tinkUnwrapper;
  private static KeyWrapper rsaWrapper;
  private static KeyUnwrapper rsaUnwrapper;

  private final HybridEnvelopeEncryptor encryptor =
      new HybridEnvelopeEncryptor(new SecureRandom(), TEST_KDF_PARAMS);
  private final EnvelopeCodec codec = new EnvelopeCodec();

  @BeforeClass
  public static void generateKeys() throws Exception {
    KeysetHandle privateKeyset = TinkKeysets.generatePrivateKeyset();
    tinkWrapper = TinkHybridKeyWrapper.create(privateKeyset.getPublicKeysetHandle());
    tinkUnwrapper = TinkHybridKeyUnwrapper.create(privateKeyset);

    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    KeyPair keyPair = generator.generateKeyPair();
    rsaWrapper = RsaOaepKeyWrapper.create((RSAPublicKey) keyPair.getPublic());
    rsaUnwrapper = RsaOaepKeyUnwrapper.create((RSAPrivateKey) keyPair.getPrivate());
  }

  @Test
  public void decrypt_tinkHybrid_returnsPlaintext() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, tinkWrapper);

    assertThat(envelope.wrapScheme()).isEqualTo(WrapScheme.TINK_HYBRID);
    assertThat(envelope.kdfParams()).isEqualTo(TEST_KDF_PARAMS);
    assertThat(envelope.ciphertext()).isNotEqualTo(PLAINTEXT);
    assertThat(encryptor.decrypt(envelope, tinkUnwrapper)).isEqualTo(PLAINTEXT);
  }

  @Test
  public void decrypt_rsaOaep_returnsPlaintext() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, rsaWrapper);

    assertThat(envelope.wrapScheme()).isEqualTo(WrapScheme.RSA_OAEP_SHA256);
    assertThat(envelope.wrappedKey()).hasLength(256);
    assertThat(encryptor.decrypt(envelope, rsaUnwrapper)).isEqualTo(PLAINTEXT);
  }

  @Test
  public void decrypt_afterWireRoundTrip_returnsPlaintext() throws Exception {
    byte[] wire = codec.serialize(encryptor.encrypt(PLAINTEXT, tinkWrapper));

    assertThat(encryptor.decrypt(codec.parse(wire), tinkUnwrapper)).isEqualTo(PLAINTEXT);
  }

  @Test
  public void decrypt_emptyPlaintext() throws Exception {
    Envelope envelope = encryptor.encrypt(new byte[0], rsaWrapper);

    assertThat(envelope.ciphertext()).isEmpty();
    assertThat(encryptor.decrypt(envelope, rsaUnwrapper)).isEmpty();
  }

  @Test
  public void encrypt_neverRepeatsSaltOrNonce() throws Exception {
    Set<String> salts = new HashSet<>();
    Set<String> nonces = new HashSet<>();

    for (int i = 0; i < 1000; i++) {
      Envelope envelope = encryptor.encrypt(PLAINTEXT, rsaWrapper);
      salts.add(BaseEncoding.base16().encode(envelope.salt()));
      nonces.add(BaseEncoding.base16().encode(envelope.nonce()));
    }

    assertThat(salts).hasSize(1000);
    assertThat(nonces).hasSize(1000);
  }

  @Test
  public void decrypt_tamperedCiphertext_throwsIntegrityException() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, tinkWrapper);
    byte[] ciphertext = envelope.ciphertext().clone();
    ciphertext[0] ^= 1;
    Envelope tampered = envelope.toBuilder().setCiphertext(ciphertext).build();

    IntegrityException e =
        assertThrows(IntegrityException.class, () -> encryptor.decrypt(tampered, tinkUnwrapper));

    assertThat(e.getReason()).isEqualTo(ErrorReason.AUTHENTICATION_FAILED);
  }

  @Test
  public void decrypt_tamperedTag_throwsIntegrityException() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, rsaWrapper);
    byte[] tag = envelope.tag().clone();
    tag[15] ^= 1;
    Envelope tampered = envelope.toBuilder().setTag(tag).build();

    assertThrows(IntegrityException.class, () -> encryptor.decrypt(tampered, rsaUnwrapper));
  }

  @Test
  public void decrypt_anyFlippedTagOrCiphertextByteOnTheWire_failsAuthentication()
      throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, rsaWrapper);
    byte[] wire = codec.serialize(envelope);
    int tagOffset = tagOffset(envelope);
    int ciphertextOffset = wire.length - envelope.ciphertext().length;
    assertThat(Arrays.copyOfRange(wire, tagOffset, tagOffset + Envelope.TAG_LENGTH))
        .isEqualTo(envelope.tag());
    assertThat(Arrays.copyOfRange(wire, ciphertextOffset, wire.length))
        .isEqualTo(envelope.ciphertext());

    for (int i = 0; i < Envelope.TAG_LENGTH; i++) {
      assertAuthenticationFails(wire, tagOffset + i);
    }
    for (int i = ciphertextOffset; i < wire.length; i++) {
      assertAuthenticationFails(wire, i);
    }
  }

  @Test
  public void decrypt_anyFlippedByteOnTheWire_neverYieldsPlaintext() throws Exception {
    byte[] wire = codec.serialize(encryptor.encrypt(PLAINTEXT, rsaWrapper));

    for (int i = 0; i < wire.length; i++) {
      byte[] tampered = wire.clone();
      tampered[i] ^= 1;

      Exception e =
          assertThrows(
              Exception.class, () -> encryptor.decrypt(codec.parse(tampered), rsaUnwrapper));

      assertWithMessage("flipped byte %s", i)
          .that(e.getClass())
          .isAnyOf(EnvelopeFormatException.class, IntegrityException.class, KeyException.class);
    }
  }

  @Test
  public void decrypt_tamperedHeader_throwsIntegrityException() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, tinkWrapper);
    Envelope tampered = envelope.toBuilder().setKdfParams(KdfParams.create(11, 8, 1)).build();

    assertThrows(IntegrityException.class, () -> encryptor.decrypt(tampered, tinkUnwrapper));
  }

  @Test
  public void decrypt_wrongKey_throwsIntegrityException() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, tinkWrapper);
    KeyUnwrapper otherKey = TinkHybridKeyUnwrapper.create(TinkKeysets.generatePrivateKeyset());

    IntegrityException e =
        assertThrows(IntegrityException.class, () -> encryptor.decrypt(envelope, otherKey));

    assertThat(e.getReason()).isEqualTo(ErrorReason.KEY_UNWRAP_FAILED);
  }

  @Test
  public void decrypt_schemeMismatch_throwsKeyException() throws Exception {
    Envelope envelope = encryptor.encrypt(PLAINTEXT, tinkWrapper);

    KeyException e =
        assertThrows(KeyException.class, () -> encryptor.decrypt(envelope, rsaUnwrapper));

    assertThat(e.getReason()).isEqualTo(ErrorReason.SCHEME_MISMATCH);
  }

  private void assertAuthenticationFails(byte[] wire, int position) throws Exception {
    byte[] tampered = wire.clone();
    tampered[position] ^= 1;
    Envelope parsed = codec.parse(tampered);

    IntegrityException e =
        assertThrows(IntegrityException.class, () -> encryptor.decrypt(parsed, rsaUnwrapper));

    assertWithMessage("flipped byte %s", position)
        .that(e.getReason())
        .isEqualTo(ErrorReason.AUTHENTICATION_FAILED);
  }

  // Magic and the fixed header, then one length byte before each of salt, nonce and tag.
  private static int tagOffset(Envelope envelope) {
    return EnvelopeCodec.header(envelope.version(), envelope.wrapScheme(), envelope.kdfParams())
            .length
        + 1
        + envelope.salt().length
        + 1
        + envelope.nonce().length
        + 1;
  }
}
