package com.openclaw.webui.common.infra;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.security.*;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Set;

/**
 * Persistent Ed25519 device identity used to sign gateway handshakes.
 * <p>
 * Stored as JSON ({@code version, deviceId, publicKeyPem, privateKeyPem, createdAtMs}).
 * The deviceId is the SHA-256 hex fingerprint of the raw 32-byte public key.
 */
@Slf4j
@Getter
public final class DeviceIdentity {

    public static final String CLIENT_ID = "gateway-client";
    public static final String CLIENT_MODE = "backend";
    public static final String ROLE = "operator";
    public static final String SCOPES = "operator.admin";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String ALGORITHM = "Ed25519";
    private static final int STORE_VERSION = 1;

    /** DER prefix of an X.509 SubjectPublicKeyInfo wrapping a raw Ed25519 key. */
    private static final byte[] ED25519_SPKI_PREFIX = HexFormat.of().parseHex("302a300506032b6570032100");

    private final String deviceId;
    private final PublicKey publicKey;
    private final PrivateKey privateKey;

    private DeviceIdentity(String deviceId, PublicKey publicKey, PrivateKey privateKey) {
        this.deviceId = deviceId;
        this.publicKey = publicKey;
        this.privateKey = privateKey;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class StoredIdentity {
        private int version;
        private String deviceId;
        private String publicKeyPem;
        private String privateKeyPem;
        private long createdAtMs;
    }

    /**
     * Signed device assertion sent as {@code params.device} of the connect request.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SignedAssertion(String id, String publicKey, String signature, long signedAt, String nonce) {
    }

    /**
     * Load the identity stored at {@code filePath}, or generate and persist a new one.
     *
     * @throws IdentityException if a new identity cannot be written
     */
    public static DeviceIdentity loadOrCreate(Path filePath) {
        DeviceIdentity existing = tryLoad(filePath);
        if (existing != null) {
            return existing;
        }

        KeyPair keyPair = generateKeyPair();
        DeviceIdentity identity = new DeviceIdentity(
                fingerprintPublicKey(keyPair.getPublic()), keyPair.getPublic(), keyPair.getPrivate());
        StoredIdentity stored = StoredIdentity.builder()
                .version(STORE_VERSION)
                .deviceId(identity.deviceId)
                .publicKeyPem(toPem("PUBLIC KEY", keyPair.getPublic().getEncoded()))
                .privateKeyPem(toPem("PRIVATE KEY", keyPair.getPrivate().getEncoded()))
                .createdAtMs(System.currentTimeMillis())
                .build();
        try {
            writeIdentity(filePath, stored);
        } catch (IOException e) {
            throw new IdentityException("Failed to write device identity to " + filePath, e);
        }
        log.info("device:generated id={} path={}", identity.deviceId, filePath);
        return identity;
    }

    /**
     * Generate an in-memory identity that is never persisted.
     */
    public static DeviceIdentity generate() {
        KeyPair keyPair = generateKeyPair();
        return new DeviceIdentity(fingerprintPublicKey(keyPair.getPublic()),
                keyPair.getPublic(), keyPair.getPrivate());
    }

    /**
     * SHA-256 hex fingerprint of the raw public key bytes.
     */
    public static String fingerprintPublicKey(PublicKey publicKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawPublicKey(publicKey)));
        } catch (NoSuchAlgorithmException e) {
            throw new IdentityException("SHA-256 unavailable", e);
        }
    }

    /**
     * Raw 32-byte Ed25519 key when the SPKI encoding carries one, otherwise the full encoding.
     */
    public static byte[] rawPublicKey(PublicKey publicKey) {
        byte[] spki = publicKey.getEncoded();
        if (spki.length == ED25519_SPKI_PREFIX.length + 32
                && Arrays.equals(spki, 0, ED25519_SPKI_PREFIX.length,
                        ED25519_SPKI_PREFIX, 0, ED25519_SPKI_PREFIX.length)) {
            return Arrays.copyOfRange(spki, ED25519_SPKI_PREFIX.length, spki.length);
        }
        return spki;
    }

    /**
     * Build and sign a handshake assertion. A v2 payload is signed when a nonce is
     * given, the legacy v1 payload otherwise. The timestamp is taken on every call.
     */
    public SignedAssertion signAssertion(String token, String nonce) {
        long signedAtMs = System.currentTimeMillis();
        String payload = buildAssertionPayload(deviceId, signedAtMs, token, nonce);
        return new SignedAssertion(
                deviceId,
                base64UrlEncode(rawPublicKey(publicKey)),
                base64UrlEncode(sign(payload)),
                signedAtMs,
                hasText(nonce) ? nonce : null);
    }

    /**
     * Canonical pipe-delimited payload:
     * {@code version|deviceId|clientId|clientMode|role|scopes|signedAtMs|token[|nonce]}.
     */
    public static String buildAssertionPayload(String deviceId, long signedAtMs, String token, String nonce) {
        boolean withNonce = hasText(nonce);
        StringBuilder sb = new StringBuilder()
                .append(withNonce ? "v2" : "v1").append('|')
                .append(deviceId).append('|')
                .append(CLIENT_ID).append('|')
                .append(CLIENT_MODE).append('|')
                .append(ROLE).append('|')
                .append(SCOPES).append('|')
                .append(signedAtMs).append('|')
                .append(token != null ? token : "");
        if (withNonce) {
            sb.append('|').append(nonce);
        }
        return sb.toString();
    }

    /**
     * Verify a base64url signature over {@code payload} with this identity's public key.
     */
    public boolean verify(String payload, String signatureBase64Url) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(publicKey);
            sig.update(payload.getBytes(StandardCharsets.UTF_8));
            return sig.verify(Base64.getUrlDecoder().decode(signatureBase64Url));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    private byte[] sign(String payload) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(privateKey);
            sig.update(payload.getBytes(StandardCharsets.UTF_8));
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new IdentityException("Failed to sign device assertion", e);
        }
    }

    // --- Persistence ---

    private static DeviceIdentity tryLoad(Path filePath) {
        if (!Files.exists(filePath)) {
            return null;
        }
        try {
            StoredIdentity stored = MAPPER.readValue(
                    Files.readString(filePath, StandardCharsets.UTF_8), StoredIdentity.class);
            if (stored == null
                    || stored.getVersion() != STORE_VERSION
                    || stored.getDeviceId() == null
                    || stored.getPublicKeyPem() == null
                    || stored.getPrivateKeyPem() == null) {
                log.warn("device:invalid path={}, regenerating", filePath);
                return null;
            }

            KeyFactory kf = KeyFactory.getInstance(ALGORITHM);
            PublicKey pub = kf.generatePublic(new X509EncodedKeySpec(fromPem(stored.getPublicKeyPem())));
            PrivateKey priv = kf.generatePrivate(new PKCS8EncodedKeySpec(fromPem(stored.getPrivateKeyPem())));

            String derivedId = fingerprintPublicKey(pub);
            if (!derivedId.equals(stored.getDeviceId())) {
                log.warn("device:id-mismatch stored={} derived={}", stored.getDeviceId(), derivedId);
                stored.setDeviceId(derivedId);
                try {
                    writeIdentity(filePath, stored);
                } catch (IOException e) {
                    log.warn("Failed to rewrite device identity: {}", e.getMessage());
                }
            }
            return new DeviceIdentity(derivedId, pub, priv);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Failed to load device identity, regenerating: {}", e.getMessage());
            return null;
        }
    }

    private static void writeIdentity(Path filePath, StoredIdentity stored) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(stored) + "\n";
        Files.writeString(filePath, json, StandardCharsets.UTF_8);
        try {
            Files.setPosixFilePermissions(filePath, Set.of(
                    PosixFilePermission.OWNER_READ,
                    PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException e) {
            log.debug("device:chmod unsupported on this filesystem");
        }
    }

    private static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IdentityException("Ed25519 is not available in this JDK", e);
        }
    }

    // --- Helpers ---

    static String toPem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(der);
        return "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
    }

    static byte[] fromPem(String pem) {
        String body = pem.replaceAll("-----(BEGIN|END) [A-Z ]+-----", "").replaceAll("\\s", "");
        return Base64.getDecoder().decode(body);
    }

    static String base64UrlEncode(byte[] data) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(data);
    }

    private static boolean hasText(String s) {
        return s != null && !s.isEmpty();
    }
}
