package com.yoursp.oauthconnect.modules.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yoursp.oauthconnect.modules.state.dto.StatePayload;
import com.yoursp.oauthconnect.modules.state.exception.InvalidStateException;
import com.yoursp.oauthconnect.modules.state.exception.StateErrorReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;

/**
 * Signed, stateless OAuth {@code state} parameter.
 * <ul>
 * <li>Wire format: {@code base64url(json) "." base64url(HMAC-SHA256(payload segment))}</li>
 * <li>Payload: {@code {"type": ..., "iat": ..., "team_id": ...}}, {@code team_id} only when present</li>
 * <li>Valid for 600s after issuance; up to 60s of clock skew into the future is tolerated</li>
 * <li>No server-side storage: a token can be presented more than once inside its window</li>
 * </ul>
 */
@Slf4j
@Service
public class StateTokenCodec {

    public static final long MAX_AGE_SECONDS = 600;
    public static final long FUTURE_TOLERANCE_SECONDS = 60;

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final char SEPARATOR = '.';
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final ObjectMapper objectMapper;
    private final FlowRegistry flowRegistry;
    private final Clock clock;
    private final SecretKeySpec signingKey;

    public StateTokenCodec(ObjectMapper objectMapper,
            FlowRegistry flowRegistry,
            Clock clock,
            @Value("${oauth.state.secret}") String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("oauth.state.secret must be configured");
        }
        this.objectMapper = objectMapper;
        this.flowRegistry = flowRegistry;
        this.clock = clock;
        this.signingKey = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM);
    }

    /**
     * Issue a state token for the given flow.
     *
     * @param flowKind the flow being started
     * @param tenantId tenant the flow targets; must match the flow's {@link TenantRequirement}
     * @return URL-safe signed token
     * @throws IllegalArgumentException if the tenant id violates the flow's requirement
     */
    public String encode(FlowKind flowKind, Long tenantId) {
        if (flowKind == null) {
            throw new IllegalArgumentException("Invalid flow_type: null");
        }

        TenantRequirement requirement = flowRegistry.requirement(flowKind);
        if (requirement == TenantRequirement.REQUIRED && tenantId == null) {
            throw new IllegalArgumentException("tenantId is required for flow " + flowKind.wireValue());
        }
        if (requirement == TenantRequirement.FORBIDDEN && tenantId != null) {
            throw new IllegalArgumentException("tenantId must be None for flow " + flowKind.wireValue());
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("type", flowKind.wireValue());
        payload.put("iat", clock.instant().getEpochSecond());
        if (tenantId != null) {
            payload.put("team_id", tenantId);
        }

        try {
            String payloadSegment = ENCODER.encodeToString(objectMapper.writeValueAsBytes(payload));
            return payloadSegment + SEPARATOR + sign(payloadSegment);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize state payload", e);
        }
    }

    /**
     * Issue a state token from a raw wire value.
     *
     * @throws IllegalArgumentException if the value names no known flow
     */
    public String encode(String flowType, Long tenantId) {
        FlowKind kind = FlowKind.fromWireValue(flowType)
                .orElseThrow(() -> new IllegalArgumentException("Invalid flow_type: " + flowType));
        return encode(kind, tenantId);
    }

    /**
     * Verify and decode a state token.
     *
     * @param token the {@code state} query parameter from the callback
     * @return the decoded payload
     * @throws InvalidStateException with a {@link StateErrorReason} describing the failure
     */
    public StatePayload decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidStateException(StateErrorReason.MISSING, "Missing OAuth state");
        }

        int separatorAt = token.lastIndexOf(SEPARATOR);
        if (separatorAt <= 0 || separatorAt == token.length() - 1) {
            throw new InvalidStateException(StateErrorReason.BAD_SIGNATURE, "OAuth state signature is missing");
        }

        String payloadSegment = token.substring(0, separatorAt);
        String signature = token.substring(separatorAt + 1);

        // compare the encoded form so that any altered character is rejected
        byte[] expected = sign(payloadSegment).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.US_ASCII))) {
            throw new InvalidStateException(StateErrorReason.BAD_SIGNATURE, "Invalid OAuth state signature");
        }

        JsonNode payload = parsePayload(payloadSegment);

        JsonNode typeNode = payload.get("type");
        String type = typeNode != null && typeNode.isTextual() ? typeNode.asText() : null;
        FlowKind kind = FlowKind.fromWireValue(type)
                .orElseThrow(() -> new InvalidStateException(StateErrorReason.UNKNOWN_FLOW,
                        "Invalid flow_type in OAuth state: " + type));

        JsonNode iatNode = payload.get("iat");
        if (iatNode == null || !iatNode.isNumber()) {
            throw new InvalidStateException(StateErrorReason.MISSING_TIMESTAMP, "OAuth state has no timestamp");
        }
        long issuedAt = iatNode.asLong();

        long age = clock.instant().getEpochSecond() - issuedAt;
        if (age > MAX_AGE_SECONDS) {
            throw new InvalidStateException(StateErrorReason.EXPIRED, "OAuth state expired " + age + "s ago");
        }
        if (-age > FUTURE_TOLERANCE_SECONDS) {
            throw new InvalidStateException(StateErrorReason.FUTURE,
                    "OAuth state timestamp is " + (-age) + "s in the future");
        }

        JsonNode tenantNode = payload.get("team_id");
        Long tenantId = tenantNode != null && tenantNode.isIntegralNumber() ? tenantNode.asLong() : null;
        if (tenantId == null && flowRegistry.requirement(kind) == TenantRequirement.REQUIRED) {
            throw new InvalidStateException(StateErrorReason.MISSING_TENANT,
                    "OAuth state for flow " + kind.wireValue() + " has no team_id");
        }

        log.debug("Decoded OAuth state (flow={}, age={}s, tenant={})", kind.wireValue(), age, tenantId);
        return new StatePayload(kind, issuedAt, tenantId);
    }

    private JsonNode parsePayload(String payloadSegment) {
        try {
            JsonNode payload = objectMapper.readTree(DECODER.decode(payloadSegment));
            if (payload == null || !payload.isObject()) {
                throw new InvalidStateException(StateErrorReason.MALFORMED, "Malformed OAuth state payload");
            }
            return payload;
        } catch (IllegalArgumentException | IOException e) {
            throw new InvalidStateException(StateErrorReason.MALFORMED, "Malformed OAuth state payload", e);
        }
    }

    /** HMAC-SHA256 over the encoded payload segment, base64url without padding. */
    String sign(String payloadSegment) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(signingKey);
            return ENCODER.encodeToString(mac.doFinal(payloadSegment.getBytes(StandardCharsets.US_ASCII)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("State signing failed", e);
        }
    }
}
