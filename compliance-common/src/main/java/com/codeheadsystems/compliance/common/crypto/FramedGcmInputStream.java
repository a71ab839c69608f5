package com.codeheadsystems.compliance.common.crypto;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Objects;
import javax.crypto.Cipher;

/**
 * Reads and authenticates one frame at a time. Nothing from a frame is returned before its tag checks.
 */
class FramedGcmInputStream extends InputStream {

  private static final byte[] EMPTY = new byte[0];

  private final AesGcmCipher aesGcmCipher;
  private final byte[] key;
  private final byte[] baseIv;
  private final InputStream in;
  private byte[] frame = EMPTY;
  private int position;
  private int index;
  private boolean last;

  FramedGcmInputStream(final AesGcmCipher aesGcmCipher,
                       final byte[] key,
                       final byte[] baseIv,
                       final InputStream in) {
    this.aesGcmCipher = aesGcmCipher;
    this.key = key;
    this.baseIv = baseIv;
    this.in = in;
  }

  @Override
  public int read() throws IOException {
    final byte[] one = new byte[1];
    final int n = read(one, 0, 1);
    return n < 0 ? -1 : one[0] & 0xff;
  }

  @Override
  public int read(final byte[] b, final int off, final int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return 0;
    }
    while (position == frame.length) {
      if (last) {
        return -1;
      }
      readFrame();
    }
    final int n = Math.min(len, frame.length - position);
    System.arraycopy(frame, position, b, off, n);
    position += n;
    return n;
  }

  @Override
  public void close() throws IOException {
    in.close();
  }

  private void readFrame() throws IOException {
    final int flag = in.read();
    if (flag < 0) {
      throw new IOException("Encrypted stream ends before its last frame");
    }
    if (flag > 1) {
      throw new IOException("Frame " + index + " has an invalid header");
    }
    final byte[] length = in.readNBytes(Integer.BYTES);
    if (length.length != Integer.BYTES) {
      throw new IOException("Encrypted stream is truncated in frame " + index);
    }
    final int size = ByteBuffer.wrap(length).getInt();
    if (size < AesGcmCipher.GCM_TAG_BYTES || size > AesGcmCipher.FRAME_SIZE + AesGcmCipher.GCM_TAG_BYTES) {
      throw new IOException("Frame " + index + " has an invalid length " + size);
    }
    final byte[] sealed = in.readNBytes(size);
    if (sealed.length != size) {
      throw new IOException("Encrypted stream is truncated in frame " + index);
    }
    try {
      final Cipher cipher = aesGcmCipher.frameCipher(Cipher.DECRYPT_MODE, key, baseIv, index);
      cipher.updateAAD(AesGcmCipher.frameAad(index, flag == 1));
      frame = cipher.doFinal(sealed);
    } catch (GeneralSecurityException e) {
      throw new IOException("Frame " + index + " failed authentication", e);
    }
    position = 0;
    index++;
    last = flag == 1;
    if (last && in.read() >= 0) {
      throw new IOException("Encrypted stream has data after its last frame");
    }
  }

}
