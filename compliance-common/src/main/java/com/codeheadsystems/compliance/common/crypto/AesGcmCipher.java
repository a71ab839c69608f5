package com.codeheadsystems.compliance.common.crypto;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * AES-256-GCM with a random 12 byte IV per message.
 *
 * <p>Sealed format: [12-byte IV][ciphertext][16-byte authentication tag].</p>
 *
 * <p>Streaming format: [12-byte base IV] followed by frames of at most {@link #FRAME_SIZE} plaintext bytes,
 * each written as [1-byte last flag][4-byte sealed length][ciphertext][tag]. A frame's IV is the base IV
 * with its frame index folded into the low four bytes, and the index and last flag are authenticated with
 * the frame, so reordered or missing frames fail. Memory use is bounded by one frame.</p>
 */
@Singleton
public class AesGcmCipher {

  /**
   * IV length in bytes.
   */
  public static final int GCM_IV_LENGTH = 12;

  /**
   * Plaintext bytes per frame of the streaming format.
   */
  public static final int FRAME_SIZE = 64 * 1024;

  static final int GCM_TAG_BYTES = 16;

  private static final Logger LOGGER = LoggerFactory.getLogger(AesGcmCipher.class);
  private static final String ALGORITHM = "AES/GCM/NoPadding";
  private static final int GCM_TAG_LENGTH = 128;
  private static final int AES_KEY_LENGTH = 32;

  private final SecureRandom secureRandom;

  /**
   * Instantiates a new Aes gcm cipher.
   *
   * @param secureRandom the secure random
   */
  @Inject
  public AesGcmCipher(final SecureRandom secureRandom) {
    LOGGER.info("AesGcmCipher({})", secureRandom);
    this.secureRandom = secureRandom;
  }

  /**
   * Encrypt a message.
   *
   * @param key       32 byte key
   * @param plaintext the plaintext
   * @param aad       additional authenticated data, bound to the ciphertext
   * @return iv followed by ciphertext and tag.
   */
  public byte[] seal(final byte[] key, final byte[] plaintext, final byte[] aad) {
    LOGGER.trace("seal({})", plaintext.length);
    try {
      final byte[] iv = newIv();
      final Cipher cipher = cipher(Cipher.ENCRYPT_MODE, key, iv);
      cipher.updateAAD(aad);
      final byte[] ciphertext = cipher.doFinal(plaintext);
      return ByteBuffer.allocate(GCM_IV_LENGTH + ciphertext.length)
          .put(iv)
          .put(ciphertext)
          .array();
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to encrypt", e);
    }
  }

  /**
   * Decrypt a message written by {@link #seal(byte[], byte[], byte[])}.
   *
   * @param key    the key
   * @param sealed the sealed bytes
   * @param aad    the same aad used to seal
   * @return the plaintext.
   */
  public byte[] open(final byte[] key, final byte[] sealed, final byte[] aad) {
    LOGGER.trace("open({})", sealed.length);
    if (sealed.length < GCM_IV_LENGTH) {
      throw new EncryptionException("Encrypted data is too short", null);
    }
    try {
      final byte[] iv = Arrays.copyOfRange(sealed, 0, GCM_IV_LENGTH);
      final Cipher cipher = cipher(Cipher.DECRYPT_MODE, key, iv);
      cipher.updateAAD(aad);
      return cipher.doFinal(sealed, GCM_IV_LENGTH, sealed.length - GCM_IV_LENGTH);
    } catch (GeneralSecurityException e) {
      throw new EncryptionException("Failed to decrypt", e);
    }
  }

  /**
   * Write the base IV header to the stream and wrap it. Closing the returned stream writes the last frame
   * and closes the underlying stream.
   *
   * @param key the key
   * @param out the out
   * @return the encrypting stream.
   * @throws IOException if the header cannot be written.
   */
  public OutputStream encryptingStream(final byte[] key, final OutputStream out) throws IOException {
    checkKey(key);
    final byte[] iv = newIv();
    out.write(iv);
    return new FramedGcmOutputStream(this, key, iv, out);
  }

  /**
   * Read the base IV header from the stream and wrap it. A frame that fails authentication, or a stream
   * that ends before its last frame, surfaces as an IOException from read.
   *
   * @param key the key
   * @param in  the in
   * @return the decrypting stream.
   * @throws IOException if the header cannot be read.
   */
  public InputStream decryptingStream(final byte[] key, final InputStream in) throws IOException {
    checkKey(key);
    final byte[] iv = in.readNBytes(GCM_IV_LENGTH);
    if (iv.length != GCM_IV_LENGTH) {
      throw new EncryptionException("Encrypted stream is missing its IV header", null);
    }
    return new FramedGcmInputStream(this, key, iv, in);
  }

  Cipher frameCipher(final int mode, final byte[] key, final byte[] baseIv, final int index)
      throws GeneralSecurityException {
    final byte[] iv = baseIv.clone();
    for (int i = 0; i < Integer.BYTES; i++) {
      iv[GCM_IV_LENGTH - 1 - i] ^= (byte) (index >>> (Byte.SIZE * i));
    }
    return cipher(mode, key, iv);
  }

  static byte[] frameAad(final int index, final boolean last) {
    return ByteBuffer.allocate(Integer.BYTES + 1).putInt(index).put((byte) (last ? 1 : 0)).array();
  }

  private byte[] newIv() {
    final byte[] iv = new byte[GCM_IV_LENGTH];
    secureRandom.nextBytes(iv);
    return iv;
  }

  private Cipher cipher(final int mode, final byte[] key, final byte[] iv) throws GeneralSecurityException {
    checkKey(key);
    final SecretKey secretKey = new SecretKeySpec(key, "AES");
    final Cipher cipher = Cipher.getInstance(ALGORITHM);
    cipher.init(mode, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH, iv));
    return cipher;
  }

  private static void checkKey(final byte[] key) {
    if (key.length != AES_KEY_LENGTH) {
      throw new IllegalArgumentException("Key must be 32 bytes (256 bits) for AES-256");
    }
  }

}
