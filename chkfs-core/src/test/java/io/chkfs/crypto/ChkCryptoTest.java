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

import io.chkfs.tree.ChkConstants;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ChkCryptoTest {

    // NIST SP 800-38A, F.3.17 CFB128-AES256.Encrypt
    private static final byte[] NIST_KEY =
        HexFormat.of().parseHex("603deb1015ca71be2b73aef0857d77811f352c073b6108d72d9810a30914dff4");
    private static final byte[] NIST_IV = HexFormat.of().parseHex("000102030405060708090a0b0c0d0e0f");
    private static final byte[] NIST_PLAINTEXT = HexFormat.of().parseHex(
        "6bc1bee22e409f96e93d7e117393172a" + "ae2d8a571e03ac9c9eb76fac45af8e51"
        + "30c81c46a35ce411e5fbc1191a0a52ef" + "f69f2445df4f9b17ad2b417be66c3710");
    private static final byte[] NIST_CIPHERTEXT = HexFormat.of().parseHex(
        "dc7e84bfda79164b7ecd8486985d3860" + "39ffed143b28b1c832113c6331e5407b"
        + "df10132415e54b92a13ed0a8267ae2f9" + "75a385741ab9cef82031623d55b1e471");

    private static byte[] randomBytes(int length, long seed) {
        byte[] data = new byte[length];
        new Random(seed).nextBytes(data);
        return data;
    }

    private static byte[] sequence(int length) {
        byte[] data = new byte[length];
        for (int i = 0; i < length; i++) {
            data[i] = (byte) i;
        }
        return data;
    }

    @Test
    public void testHashIsSha512() throws Exception {
        byte[] data = "hello".getBytes(StandardCharsets.UTF_8);
        byte[] expected = MessageDigest.getInstance("SHA-512").digest(data);
        assertArrayEquals(expected, ChkCrypto.hash(data));
        assertEquals(ChkCrypto.HASH_LENGTH, ChkCrypto.hash(new byte[0]).length);
    }

    @Test
    public void testKeyAndIvAreSlicedFromDigest() {
        byte[] digest = sequence(ChkCrypto.HASH_LENGTH);
        SessionKey sessionKey = ChkCrypto.deriveKeyIv(digest);
        assertArrayEquals(Arrays.copyOfRange(digest, 0, 32), sessionKey.key());
        assertArrayEquals(Arrays.copyOfRange(digest, 32, 48), sessionKey.iv());
    }

    @Test
    public void testShortDigestIsZeroPadded() {
        SessionKey partialIv = ChkCrypto.deriveKeyIv(sequence(40));
        byte[] expectedIv = new byte[SessionKey.IV_LENGTH];
        System.arraycopy(sequence(40), 32, expectedIv, 0, 8);
        assertArrayEquals(expectedIv, partialIv.iv());

        SessionKey partialKey = ChkCrypto.deriveKeyIv(sequence(20));
        assertArrayEquals(Arrays.copyOf(sequence(20), SessionKey.KEY_LENGTH), partialKey.key());
        assertArrayEquals(new byte[SessionKey.IV_LENGTH], partialKey.iv());
    }

    @Test
    public void testRoundTripPreservesLength() {
        SessionKey sessionKey = ChkCrypto.deriveKeyIv(ChkCrypto.hash("key".getBytes(StandardCharsets.UTF_8)));
        int[] lengths = {0, 1, 15, 16, 17, 31, 32, 33, 127, 128, 129, 1000, 4095,
            ChkConstants.LEAF_SIZE - 1, ChkConstants.LEAF_SIZE};
        for (int length : lengths) {
            byte[] plaintext = randomBytes(length, length);
            byte[] ciphertext = ChkCrypto.encrypt(sessionKey, plaintext);
            assertEquals(length, ciphertext.length, "ciphertext length for " + length);
            assertArrayEquals(plaintext, ChkCrypto.decrypt(sessionKey, ciphertext), "round trip for " + length);
        }
    }

    @Test
    public void testRoundTripForEverySmallLength() {
        SessionKey sessionKey = ChkCrypto.deriveKeyIv(ChkCrypto.hash(new byte[0]));
        for (int length = 0; length <= 64; length++) {
            byte[] plaintext = sequence(length);
            assertArrayEquals(plaintext, ChkCrypto.decrypt(sessionKey, ChkCrypto.encrypt(sessionKey, plaintext)));
        }
    }

    @Test
    public void testCiphertextPrefixDoesNotDependOnLaterBytes() {
        SessionKey sessionKey = ChkCrypto.deriveKeyIv(ChkCrypto.hash("prefix".getBytes(StandardCharsets.UTF_8)));
        byte[] longer = randomBytes(100, 7);
        byte[] shorter = Arrays.copyOf(longer, 37);
        byte[] longCipher = ChkCrypto.encrypt(sessionKey, longer);
        assertArrayEquals(Arrays.copyOf(longCipher, 37), ChkCrypto.encrypt(sessionKey, shorter));
    }

    @Test
    public void testEncryptMatchesNistCfb128Vector() {
        SessionKey sessionKey = new SessionKey(NIST_KEY, NIST_IV);
        assertArrayEquals(NIST_CIPHERTEXT, ChkCrypto.encrypt(sessionKey, NIST_PLAINTEXT));
        assertArrayEquals(NIST_PLAINTEXT, ChkCrypto.decrypt(sessionKey, NIST_CIPHERTEXT));
    }

    @Test
    public void testUnalignedInputMatchesNistVectorPrefix() {
        SessionKey sessionKey = new SessionKey(NIST_KEY, NIST_IV);
        byte[] ciphertext = ChkCrypto.encrypt(sessionKey, Arrays.copyOf(NIST_PLAINTEXT, 17));
        assertEquals("dc7e84bfda79164b7ecd8486985d386039", HexFormat.of().formatHex(ciphertext));
        assertArrayEquals(Arrays.copyOf(NIST_PLAINTEXT, 17), ChkCrypto.decrypt(sessionKey, ciphertext));
    }

    @Test
    public void testEncodedBlockCopiesCiphertext() {
        EncodedBlock block = ChkCrypto.encodeBlock(sequence(40));
        block.ciphertext()[0] ^= 0x01;
        ChkCrypto.verifyBlock(block.record(), block.ciphertext());

        EncodedBlock same = new EncodedBlock(block.record(), block.ciphertext());
        assertThat(same).isEqualTo(block);
        assertThat(same.hashCode()).isEqualTo(block.hashCode());
        assertThat(new EncodedBlock(block.record(), new byte[40])).isNotEqualTo(block);
    }

    @Test
    public void testEncryptionChangesNonEmptyData() {
        byte[] plaintext = new byte[64];
        byte[] ciphertext = ChkCrypto.encrypt(ChkCrypto.deriveKeyIv(ChkCrypto.hash(plaintext)), plaintext);
        assertThat(ciphertext).isNotEqualTo(plaintext);
    }

    @Test
    public void testEncodeBlockIsConvergent() {
        byte[] payload = randomBytes(5000, 42);
        EncodedBlock first = ChkCrypto.encodeBlock(payload);
        EncodedBlock second = ChkCrypto.encodeBlock(payload.clone());

        assertThat(second.record()).isEqualTo(first.record());
        assertArrayEquals(first.ciphertext(), second.ciphertext());
        assertThat(first.record().key()).isEqualTo(new ContentKey(ChkCrypto.hash(payload)));
        assertThat(first.record().address()).isEqualTo(new RetrievalAddress(ChkCrypto.hash(first.ciphertext())));
        assertThat(first.record().fileSize()).isEmpty();
    }

    @Test
    public void testDifferentPayloadsGiveDifferentRecords() {
        EncodedBlock a = ChkCrypto.encodeBlock(new byte[]{1});
        EncodedBlock b = ChkCrypto.encodeBlock(new byte[]{2});
        assertThat(a.record().key()).isNotEqualTo(b.record().key());
        assertThat(a.record().address()).isNotEqualTo(b.record().address());
    }

    @Test
    public void testDecryptBlockRecoversPayload() {
        byte[] payload = randomBytes(ChkConstants.LEAF_SIZE, 3);
        EncodedBlock block = ChkCrypto.encodeBlock(payload);
        ChkCrypto.verifyBlock(block.record(), block.ciphertext());
        assertArrayEquals(payload, ChkCrypto.decryptBlock(block.record(), block.ciphertext()));
    }

    @Test
    public void testTamperedCiphertextIsRejected() {
        EncodedBlock block = ChkCrypto.encodeBlock(randomBytes(300, 5));
        byte[] tampered = block.ciphertext();
        tampered[10] ^= 0x01;

        assertThatThrownBy(() -> ChkCrypto.decryptBlock(block.record(), tampered))
            .isInstanceOf(BlockVerificationException.class)
            .hasMessageContaining("retrieval address");
    }

    @Test
    public void testWrongContentKeyIsRejected() {
        EncodedBlock block = ChkCrypto.encodeBlock(randomBytes(300, 6));
        ChkRecord wrongKey = new ChkRecord(new ContentKey(ChkCrypto.hash(new byte[]{9})), block.record().address());

        BlockVerificationException e = assertThrows(
            BlockVerificationException.class, () -> ChkCrypto.decryptBlock(wrongKey, block.ciphertext()));
        assertArrayEquals(wrongKey.key().bytes(), e.getExpectedHash());
        assertThat(e.getActualHash()).hasSize(ChkCrypto.HASH_LENGTH);
    }

    @Test
    public void testDigestLengthsAreEnforced() {
        assertThatThrownBy(() -> new ContentKey(new byte[32])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrievalAddress(new byte[65])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SessionKey(new byte[16], new byte[16])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testDigestValuesAreImmutable() {
        byte[] digest = ChkCrypto.hash("immutable".getBytes(StandardCharsets.UTF_8));
        ContentKey key = new ContentKey(digest);
        digest[0] ^= (byte) 0xff;
        key.bytes()[1] ^= (byte) 0xff;
        assertThat(key).isEqualTo(new ContentKey(ChkCrypto.hash("immutable".getBytes(StandardCharsets.UTF_8))));
        assertThat(ChkCrypto.deriveKeyIv(key).toString()).isEqualTo("SessionKey[redacted]");
    }

    @Test
    public void testRecordSerialization() {
        EncodedBlock block = ChkCrypto.encodeBlock(new byte[]{1, 2, 3});
        byte[] bytes = block.record().toBytes();
        assertEquals(ChkRecord.SERIALIZED_LENGTH, bytes.length);
        assertArrayEquals(block.record().key().bytes(), Arrays.copyOfRange(bytes, 0, 64));
        assertArrayEquals(block.record().address().bytes(), Arrays.copyOfRange(bytes, 64, 128));
        assertThat(block.record().isRoot()).isFalse();
        assertThat(block.record().withFileSize(3).isRoot()).isTrue();
        assertThatThrownBy(() -> block.record().withFileSize(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
