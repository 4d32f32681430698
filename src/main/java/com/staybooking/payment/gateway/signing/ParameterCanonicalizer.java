package com.staybooking.payment.gateway.signing;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

/**
 * Serialises a parameter set into the canonical string the gateway hashes.
 *
 * <p>The steps must match the gateway's own implementation byte for byte:
 * <ol>
 *   <li>drop {@code CheckMacValue}, keep every other field including empty values</li>
 *   <li>sort keys in ordinal order</li>
 *   <li>wrap as {@code HashKey=<key>&k1=v1&...&HashIV=<iv>}</li>
 *   <li>URL-encode the whole string as UTF-8 and lower-case it</li>
 *   <li>turn the gateway's unescaped characters back into literals
 *       ({@code GATEWAY_LITERALS})</li>
 * </ol>
 */
@Component
public class ParameterCanonicalizer {

  public static final String CHECK_MAC_VALUE = "CheckMacValue";

  private static final String HASH_KEY = "HashKey";
  private static final String HASH_IV = "HashIV";

  /**
   * Escapes the gateway leaves as literal characters, applied in this order after
   * lower-casing.
   */
  private static final String[][] GATEWAY_LITERALS = {
      {"%20", "+"},
      {"%2d", "-"},
      {"%5f", "_"},
      {"%2e", "."},
      {"%21", "!"},
      {"%2a", "*"},
      {"%28", "("},
      {"%29", ")"},
  };

  /**
   * Builds the canonical string for the given parameters.
   *
   * @param params the fields to sign; a {@code CheckMacValue} entry is ignored
   * @param hashKey the merchant hash key
   * @param hashIv the merchant hash IV
   * @return the encoded, lower-cased canonical string
   */
  public String canonicalize(Map<String, String> params, String hashKey, String hashIv) {
    TreeMap<String, String> sorted = new TreeMap<>();
    params.forEach((key, value) -> {
      if (!CHECK_MAC_VALUE.equals(key)) {
        sorted.put(key, value == null ? "" : value);
      }
    });

    StringBuilder raw = new StringBuilder(HASH_KEY).append('=').append(hashKey);
    sorted.forEach((key, value) -> raw.append('&').append(key).append('=').append(value));
    raw.append('&').append(HASH_IV).append('=').append(hashIv);

    String encoded = URLEncoder.encode(raw.toString(), StandardCharsets.UTF_8)
        .toLowerCase(Locale.ROOT);
    for (String[] literal : GATEWAY_LITERALS) {
      encoded = encoded.replace(literal[0], literal[1]);
    }
    return encoded;
  }
}
