package com.agentgate.governance.service;

import com.agentgate.governance.config.GovernanceConfig;
import com.agentgate.governance.model.ApprovalVerdict;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

/**
 * HMAC-SHA256 signatures over approval decisions.
 *
 * <p>The signed message is exactly {@code id:decision:approver:expiresAt}, with
 * {@code expiresAt} in ISO-8601 UTC ("2026-10-18T13:00:00Z"). Signing and verification
 * both go through {@link #canonicalMessage}.
 */
@Component
public class ApprovalSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    private final GovernanceConfig config;

    public ApprovalSigner(GovernanceConfig config) {
        this.config = config;
    }

    public static String canonicalMessage(String approvalId, ApprovalVerdict decision, String approver, Instant expiresAt) {
        return approvalId + ":" + decision.getValue() + ":" + approver + ":" + TIMESTAMP.format(expiresAt);
    }

    public static String sign(String approvalId, ApprovalVerdict decision, String approver,
                              Instant expiresAt, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(
                    canonicalMessage(approvalId, decision, approver, expiresAt).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    /**
     * Constant-time comparison against the expected signature. Hex case is ignored.
     */
    public static boolean verify(String approvalId, ApprovalVerdict decision, String approver,
                                 Instant expiresAt, String secret, String signature) {
        if (signature == null || secret == null || secret.isEmpty()) return false;
        String expected = sign(approvalId, decision, approver, expiresAt, secret);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.trim().toLowerCase().getBytes(StandardCharsets.UTF_8));
    }

    public String sign(String approvalId, ApprovalVerdict decision, String approver, Instant expiresAt) {
        return sign(approvalId, decision, approver, expiresAt, secret());
    }

    public boolean verify(String approvalId, ApprovalVerdict decision, String approver,
                          Instant expiresAt, String signature) {
        return verify(approvalId, decision, approver, expiresAt, secret(), signature);
    }

    private String secret() {
        if (!config.hasHmacSecret()) {
            throw new IllegalStateException("governance.hmac-secret is not configured");
        }
        return config.getHmacSecret();
    }
}
