package com.codeheadsystems.compliance.common.crypto;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Objects;
import javax.crypto.Cipher;

/**
 * Buffers plaintext into frames and seals each one as it fills. The last frame is written on close.
 */
class FramedGcmOutputStream extends OutputStream {

  private final AesGcmCipher aesGcmCipher;
  private final byte[] key;
  private final byte[] baseIv;
  private final OutputStream out;
  private final byte[] buffer = new byte[AesGcmCipher.FRAME_SIZE];
  private int buffered;
  private int index;
  private boolean closed;

  FramedGcmOutputStream(final AesGcmCipher aesGcmCipher,
                        final byte[] key,
                        final byte[] baseIv,
                        final OutputStream out) {
    this.aesGcmCipher = aesGcmCipher;
    this.key = key;
    this.baseIv = baseIv;
    this.out = out;
  }

  @Override
  public void write(final int b) throws IOException {
    write(new byte[]{(byte) b}, 0, 1);
  }

  @Override
  public void write(final byte[] b, final int off, final int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    if (closed) {
      throw new IOException("Stream closed");
    }
    int offset = off;
    int remaining = len;
    while (remaining > 0) {
      // A full buffer is only sealed once more data arrives, so the last frame is never empty unless the
      // whole stream is.
      if (buffered == buffer.length) {
        writeFrame(false);
      }
      final int n = Math.min(remaining, buffer.length - buffered);
      System.arraycopy(b, offset, buffer, buffered, n);
      buffered += n;
      offset += n;
      remaining -= n;
    }
  }

  @Override
  public void flush() throws IOException {
    out.flush();
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      writeFrame(true);
    } finally {
      out.close();
    }
  }

  private void writeFrame(final boolean last) throws IOException {
    if (index == Integer.MAX_VALUE) {
      throw new IOException("Encrypted stream exceeds the frame limit");
    }
    final byte[] sealed;
    try {
      final Cipher cipher = aesGcmCipher.frameCipher(Cipher.ENCRYPT_MODE, key, baseIv, index);
      cipher.updateAAD(AesGcmCipher.frameAad(index, last));
      sealed = cipher.doFinal(buffer, 0, buffered);
    } catch (GeneralSecurityException e) {
      throw new IOException("Failed to encrypt frame " + index, e);
    }
    out.write(last ? 1 : 0);
    out.write(ByteBuffer.allocate(Integer.BYTES).putInt(sealed.length).array());
    out.write(sealed);
    buffered = 0;
    index++;
  }

}
