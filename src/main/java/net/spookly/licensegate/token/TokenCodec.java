package net.spookly.licensegate.token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Splits and decodes {@code base64url(header).base64url(claims).base64url(signature)} tokens.
 */
public final class TokenCodec {
    public static final String ALGORITHM = "RS256";
    public static final String TYPE = "LICENSE";
    private static final String LEGACY_TYPE = "JWT";
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private TokenCodec() {
    }

    /**
     * Decode a token into its header fields, raw claims bytes and signature.
     */
    public static LicenseToken decode(String token) throws TokenFormatException {
        if (token == null || token.isBlank()) {
            throw new TokenFormatException("token is empty");
        }
        String[] parts = token.trim().split("\\.", -1);
        if (parts.length != 3) {
            throw new TokenFormatException("token must have exactly three segments");
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                throw new TokenFormatException("token segments must not be empty");
            }
        }
        byte[] headerBytes = decodeSegment(parts[0], "header");
        byte[] claimsBytes = decodeSegment(parts[1], "claims");
        byte[] signature = decodeSegment(parts[2], "signature");

        JsonNode header;
        try {
            header = MAPPER.readTree(headerBytes);
        } catch (IOException e) {
            throw new TokenFormatException("token header is not valid JSON", e);
        }
        if (header == null || !header.isObject()) {
            throw new TokenFormatException("token header must be a JSON object");
        }
        JsonNode algorithm = header.get("alg");
        if (algorithm == null || !algorithm.isTextual() || !ALGORITHM.equals(algorithm.asText())) {
            throw new TokenFormatException("token header alg must be " + ALGORITHM);
        }
        String type = null;
        JsonNode typeNode = header.get("typ");
        if (typeNode != null && !typeNode.isNull()) {
            type = typeNode.isTextual() ? typeNode.asText() : null;
            if (!TYPE.equals(type) && !LEGACY_TYPE.equals(type)) {
                throw new TokenFormatException("token header typ must be " + TYPE);
            }
        }
        return new LicenseToken(ALGORITHM, type, parts[0], parts[1], claimsBytes, signature);
    }

    /**
     * Assemble a token from already serialised header and claims JSON and a signature.
     */
    public static String encode(byte[] headerJson, byte[] claimsJson, byte[] signature) {
        return signingInput(headerJson, claimsJson) + "." + ENCODER.encodeToString(signature);
    }

    /**
     * The {@code header.claims} prefix a signer has to sign.
     */
    public static String signingInput(byte[] headerJson, byte[] claimsJson) {
        return ENCODER.encodeToString(headerJson) + "." + ENCODER.encodeToString(claimsJson);
    }

    /**
     * Header JSON written by the issuing tool.
     */
    public static byte[] defaultHeader() {
        return ("{\"alg\":\"" + ALGORITHM + "\",\"typ\":\"" + TYPE + "\"}").getBytes(StandardCharsets.UTF_8);
    }

    private static byte[] decodeSegment(String segment, String name) throws TokenFormatException {
        try {
            return DECODER.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new TokenFormatException("token " + name + " is not valid base64url", e);
        }
    }
}
