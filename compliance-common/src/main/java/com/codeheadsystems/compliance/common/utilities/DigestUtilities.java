package com.codeheadsystems.compliance.common.utilities;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.function.Function;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hex encoding and SHA-256 helpers.
 */
public class DigestUtilities {

  /**
   * Hex encode.
   */
  public static final Function<byte[], String> encode = Hex::encodeHexString;

  private static final Logger LOGGER = LoggerFactory.getLogger(DigestUtilities.class);

  /**
   * Hex decode, empty if the input is not hex.
   */
  public static final Function<String, Optional<byte[]>> decode = s -> {
    try {
      return Optional.of(Hex.decodeHex(s));
    } catch (Exception e) {
      LOGGER.error("Failed to decode hex string of length {}", s == null ? 0 : s.length(), e);
      return Optional.empty();
    }
  };

  /**
   * SHA-256 of the bytes, hex encoded.
   */
  public static final Function<byte[], String> sha256 = DigestUtils::sha256Hex;

  private DigestUtilities() {
  }

  /**
   * SHA-256 of the UTF-8 bytes of a string, hex encoded.
   *
   * @param value the value
   * @return the hex digest
   */
  public static String sha256(final String value) {
    return sha256.apply(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * A fresh SHA-256 digest for streaming use.
   *
   * @return the message digest
   */
  public static MessageDigest newSha256() {
    return DigestUtils.getSha256Digest();
  }

}
