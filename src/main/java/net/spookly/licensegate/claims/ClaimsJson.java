package net.spookly.licensegate.claims;

import java.util.Map;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes claims back into their wire shape.
 */
public final class ClaimsJson {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ClaimsJson() {
    }

    public static ObjectNode toNode(LicenseClaims claims) {
        ObjectNode node = NODES.objectNode();
        node.put("iss", claims.issuer());
        node.put("sub", claims.subject());
        node.put("iat", claims.issuedAt());
        node.put("exp", claims.expiresAt());
        node.put("tier", claims.tier().wireName());
        ArrayNode features = node.putArray("features");
        for (String feature : claims.features()) {
            features.add(feature);
        }
        ObjectNode limits = node.putObject("limits");
        for (Map.Entry<LicenseLimit, Long> entry : claims.limits().entrySet()) {
            limits.put(entry.getKey().key(), entry.getValue());
        }
        if (claims.machineId() != null) {
            node.put("machine_id", claims.machineId());
        }
        node.put("company", claims.company());
        node.put("contact", claims.contact());
        return node;
    }
}
