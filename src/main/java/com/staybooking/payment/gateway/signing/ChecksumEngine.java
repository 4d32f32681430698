package com.staybooking.payment.gateway.signing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.stereotype.Component;

/**
 * Computes and checks the gateway's {@code CheckMacValue}: the upper-case hex SHA-256 of a
 * canonical string produced by {@link ParameterCanonicalizer}.
 */
@Component
public class ChecksumEngine {

  private static final HexFormat UPPER_HEX = HexFormat.of().withUpperCase();

  public String sign(String canonical) {
    return UPPER_HEX.formatHex(sha256(canonical));
  }

  /**
   * Checks a received check value against the canonical string. The comparison is
   * case-sensitive and runs in constant time for equal-length inputs.
   *
   * @return {@code false} for a null or non-matching value; never throws
   */
  public boolean verify(String receivedSignature, String canonical) {
    if (receivedSignature == null) {
      return false;
    }
    byte[] expected = sign(canonical).getBytes(StandardCharsets.US_ASCII);
    byte[] received = receivedSignature.getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, received);
  }

  private static byte[] sha256(String input) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(input.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}
