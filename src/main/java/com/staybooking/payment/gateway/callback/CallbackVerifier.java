package com.staybooking.payment.gateway.callback;

import com.staybooking.payment.gateway.enums.VerificationError;
import com.staybooking.payment.gateway.model.CredentialSet;
import com.staybooking.payment.gateway.signing.ChecksumEngine;
import com.staybooking.payment.gateway.signing.ParameterCanonicalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the {@code CheckMacValue} of an inbound gateway callback.
 *
 * <p>The caller binds the credential set the trade was signed with; the verifier never looks
 * credentials up on its own. Verification has no side effects, so running it twice on the
 * same fields gives the same answer.
 */
@Component
public class CallbackVerifier {

  private static final Logger LOG = LoggerFactory.getLogger(CallbackVerifier.class);

  private final ParameterCanonicalizer canonicalizer;
  private final ChecksumEngine checksumEngine;

  public CallbackVerifier(ParameterCanonicalizer canonicalizer, ChecksumEngine checksumEngine) {
    this.canonicalizer = canonicalizer;
    this.checksumEngine = checksumEngine;
  }

  /**
   * Verifies a raw callback field set.
   *
   * @param callbackPayload every field the gateway posted, including {@code CheckMacValue}
   * @param credentials the credential set the trade was signed with
   * @return the verified payload, or {@link VerificationError#MISSING_SIGNATURE} /
   *     {@link VerificationError#SIGNATURE_MISMATCH}
   */
  public CallbackVerification verify(Map<String, String> callbackPayload,
      CredentialSet credentials) {
    String received = callbackPayload.get(ParameterCanonicalizer.CHECK_MAC_VALUE);
    if (received == null || received.isEmpty()) {
      return CallbackVerification.failed(VerificationError.MISSING_SIGNATURE);
    }

    Map<String, String> fields = new LinkedHashMap<>(callbackPayload);
    fields.remove(ParameterCanonicalizer.CHECK_MAC_VALUE);

    String canonical = canonicalizer.canonicalize(fields, credentials.signingKey(),
        credentials.signingIv());
    if (!checksumEngine.verify(received, canonical)) {
      LOG.debug("CheckMacValue mismatch received={} expected={}", received,
          checksumEngine.sign(canonical));
      return CallbackVerification.failed(VerificationError.SIGNATURE_MISMATCH);
    }
    return CallbackVerification.verified(new VerifiedPayload(fields));
  }
}
