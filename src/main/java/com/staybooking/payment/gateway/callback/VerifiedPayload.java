package com.staybooking.payment.gateway.callback;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Callback fields whose check value has been verified, without the check value itself.
 * Instances are only created by {@link CallbackVerifier}.
 */
public final class VerifiedPayload {

  private final Map<String, String> fields;

  VerifiedPayload(Map<String, String> fields) {
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public Optional<String> get(String name) {
    return Optional.ofNullable(fields.get(name));
  }

  public Map<String, String> asMap() {
    return fields;
  }

  @Override
  public String toString() {
    return "VerifiedPayload" + fields;
  }
}
