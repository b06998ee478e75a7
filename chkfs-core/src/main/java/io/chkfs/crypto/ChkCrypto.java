package io.chkfs.crypto;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

/**
 * Hashing and convergent block encryption for CHK trees.
 *
 * Every block is encrypted under a key derived only from its own plaintext:
 * <pre>
 *   key        = SHA-512(plaintext)
 *   (k, iv)    = key[0..32), key[32..48)
 *   ciphertext = AES-256-CFB(k, iv, plaintext)
 *   address    = SHA-512(ciphertext)
 * </pre>
 * Identical plaintext blocks therefore always produce identical ciphertext and
 * addresses, in any encoder, with no secret and no randomness involved.
 *
 * All methods are stateless and safe to call from multiple threads.
 */
public final class ChkCrypto {
  private static final Logger logger = LogManager.getLogger(ChkCrypto.class);

  /** Digest algorithm for both content keys and retrieval addresses */
  public static final String HASH_ALGORITHM = "SHA-512";

  /** Length of every digest in bytes */
  public static final int HASH_LENGTH = 64;

  /** Cipher transformation; CFB keeps the ciphertext length equal to the input length */
  public static final String CIPHER_TRANSFORMATION = "AES/CFB/NoPadding";

  /** Cipher block alignment applied before each cipher call */
  public static final int CIPHER_ALIGNMENT = 16;

  private ChkCrypto() {
  }

  /**
   * Hashes the given bytes.
   *
   * @param data the bytes to hash
   * @return the {@link #HASH_LENGTH} byte digest
   */
  public static byte[] hash(byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    MessageDigest digest = newDigest();
    return digest.digest(data);
  }

  /**
   * Expands a digest into a session key.
   *
   * Bytes {@code [0, 32)} become the cipher key and bytes {@code [32, 48)} the IV. A digest
   * shorter than either region is zero-padded on the right. This slicing is part of the wire
   * contract: two encoders given the same digest must derive identical key and IV.
   *
   * @param digest the digest to expand, normally a {@link ContentKey}
   * @return the derived session key
   */
  public static SessionKey deriveKeyIv(byte[] digest) {
    Objects.requireNonNull(digest, "digest cannot be null");
    byte[] key = new byte[SessionKey.KEY_LENGTH];
    byte[] iv = new byte[SessionKey.IV_LENGTH];
    System.arraycopy(digest, 0, key, 0, Math.min(digest.length, SessionKey.KEY_LENGTH));
    int ivAvailable = Math.min(digest.length - SessionKey.KEY_LENGTH, SessionKey.IV_LENGTH);
    if (ivAvailable > 0) {
      System.arraycopy(digest, SessionKey.KEY_LENGTH, iv, 0, ivAvailable);
    }
    return new SessionKey(key, iv);
  }

  /**
   * Derives the session key of a block from its content key.
   *
   * @param contentKey the hash of the block plaintext
   * @return the derived session key
   */
  public static SessionKey deriveKeyIv(ContentKey contentKey) {
    return deriveKeyIv(contentKey.bytes());
  }

  /**
   * Encrypts data without changing its length.
   *
   * @param sessionKey the key and IV
   * @param data the plaintext, possibly empty
   * @return ciphertext of exactly {@code data.length} bytes
   */
  public static byte[] encrypt(SessionKey sessionKey, byte[] data) {
    return runCipher(Cipher.ENCRYPT_MODE, sessionKey, data);
  }

  /**
   * Decrypts data produced by {@link #encrypt(SessionKey, byte[])}.
   *
   * @param sessionKey the key and IV used for encryption
   * @param data the ciphertext, possibly empty
   * @return plaintext of exactly {@code data.length} bytes
   */
  public static byte[] decrypt(SessionKey sessionKey, byte[] data) {
    return runCipher(Cipher.DECRYPT_MODE, sessionKey, data);
  }

  /**
   * Runs the full convergent encoding of one block payload.
   *
   * @param payload the block plaintext
   * @return the block's record and ciphertext
   */
  public static EncodedBlock encodeBlock(byte[] payload) {
    ContentKey key = new ContentKey(hash(payload));
    byte[] ciphertext = encrypt(deriveKeyIv(key), payload);
    RetrievalAddress address = new RetrievalAddress(hash(ciphertext));
    return new EncodedBlock(new ChkRecord(key, address), ciphertext);
  }

  /**
   * Checks that a ciphertext is the block named by the given record's address.
   *
   * @param record the record naming the block
   * @param ciphertext the candidate ciphertext
   * @throws BlockVerificationException if the ciphertext hashes to a different address
   */
  public static void verifyBlock(ChkRecord record, byte[] ciphertext) {
    byte[] actual = hash(ciphertext);
    if (!record.address().matches(actual)) {
      throw new BlockVerificationException("Ciphertext does not match retrieval address",
          record.address().bytes(), actual);
    }
  }

  /**
   * Decrypts a single block and checks both of its hashes.
   *
   * @param record the record naming the block
   * @param ciphertext the block ciphertext
   * @return the block plaintext
   * @throws BlockVerificationException if either hash does not match
   */
  public static byte[] decryptBlock(ChkRecord record, byte[] ciphertext) {
    verifyBlock(record, ciphertext);
    byte[] plaintext = decrypt(deriveKeyIv(record.key()), ciphertext);
    byte[] actualKey = hash(plaintext);
    if (!Arrays.equals(actualKey, record.key().bytes())) {
      throw new BlockVerificationException("Plaintext does not match content key",
          record.key().bytes(), actualKey);
    }
    return plaintext;
  }

  private static byte[] runCipher(int mode, SessionKey sessionKey, byte[] data) {
    Objects.requireNonNull(sessionKey, "sessionKey cannot be null");
    Objects.requireNonNull(data, "data cannot be null");
    if (data.length == 0) {
      return new byte[0];
    }
    // pad to the cipher alignment, then cut the output back to the input length
    int aligned = ((data.length + CIPHER_ALIGNMENT - 1) / CIPHER_ALIGNMENT) * CIPHER_ALIGNMENT;
    byte[] input = aligned == data.length ? data : Arrays.copyOf(data, aligned);
    try {
      Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
      cipher.init(mode,
          new SecretKeySpec(sessionKey.key(), "AES"),
          new IvParameterSpec(sessionKey.iv()));
      byte[] output = cipher.doFinal(input);
      return output.length == data.length ? output : Arrays.copyOf(output, data.length);
    } catch (GeneralSecurityException e) {
      logger.error("Cipher {} failed in mode {}", CIPHER_TRANSFORMATION, mode, e);
      throw new ChkCryptoException("Unable to run " + CIPHER_TRANSFORMATION, e);
    }
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(HASH_ALGORITHM);
    } catch (NoSuchAlgorithmException e) {
      throw new ChkCryptoException(HASH_ALGORITHM + " is not available", e);
    }
  }
}
