package io.syncmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncmesh.util.Jsons;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * AES-256-GCM envelope for session records at rest.
 *
 * <p>Keys live in a keyring file; {@link #rotate()} adds a key and makes it active while
 * older keys keep decrypting existing records. The key id is bound into the GCM
 * associated data, so a record cannot be re-labelled with another key id.
 */
public final class SessionCipher {
    private static final String SCHEMA = "syncmesh.aesgcm.v1";
    private static final int GCM_TAG_BITS = 128;
    private static final int GCM_IV_BYTES = 12;
    private static final int KEY_BYTES = 32;

    private final Path keyFile;
    private final SecureRandom secureRandom;
    private volatile Keyring keyring;

    public SessionCipher(Path keyFile) {
        this.keyFile = keyFile;
        this.secureRandom = new SecureRandom();
        this.keyring = loadOrCreateKeyring();
    }

    public String encrypt(String plaintext) {
        Keyring ring = keyring;
        SecretKeySpec key = ring.keys.get(ring.activeKid);
        if (key == null) {
            throw new IllegalStateException("Active session key missing from keyring: " + keyFile);
        }
        byte[] iv = new byte[GCM_IV_BYTES];
        secureRandom.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, iv));
            cipher.updateAAD(ring.activeKid.getBytes(StandardCharsets.UTF_8));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ObjectNode row = Jsons.compact().createObjectNode();
            row.put("enc", SCHEMA);
            row.put("kid", ring.activeKid);
            row.put("iv", Base64.getEncoder().encodeToString(iv));
            row.put("ct", Base64.getEncoder().encodeToString(cipherText));
            return Jsons.compact().writeValueAsString(row);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encrypt session record", e);
        }
    }

    public String decrypt(String envelope) {
        JsonNode node;
        try {
            node = Jsons.compact().readTree(envelope);
        } catch (IOException e) {
            throw new IllegalStateException("Session record is not a cipher envelope", e);
        }
        if (!SCHEMA.equals(node.path("enc").asText(""))) {
            throw new IllegalStateException("Unsupported session envelope schema: " + node.path("enc").asText(""));
        }
        String kid = node.path("kid").asText("");
        String ivBase64 = node.path("iv").asText("");
        String ctBase64 = node.path("ct").asText("");
        if (kid.isBlank() || ivBase64.isBlank() || ctBase64.isBlank()) {
            throw new IllegalStateException("Invalid session envelope: missing kid/iv/ct");
        }
        SecretKeySpec key = keyring.keys.get(kid);
        if (key == null) {
            throw new IllegalStateException("Unknown session key id: " + kid);
        }
        try {
            Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_BITS, Base64.getDecoder().decode(ivBase64)));
            cipher.updateAAD(kid.getBytes(StandardCharsets.UTF_8));
            byte[] plain = cipher.doFinal(Base64.getDecoder().decode(ctBase64));
            return new String(plain, StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new IllegalStateException("Session record failed authentication (kid=" + kid + ")", e);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt session record", e);
        }
    }

    public synchronized RotationOutcome rotate() {
        Keyring current = keyring;
        LinkedHashMap<String, SecretKeySpec> next = new LinkedHashMap<>(current.keys);
        String kid = nextKid(next);
        next.put(kid, newKey());
        Keyring rotated = new Keyring(kid, next);
        persistKeyring(rotated);
        keyring = rotated;
        return new RotationOutcome(kid, next.size(), keyFile.toString());
    }

    public KeyringStatus status() {
        Keyring ring = keyring;
        return new KeyringStatus(ring.activeKid, ring.keys.size(), keyFile.toString());
    }

    private synchronized Keyring loadOrCreateKeyring() {
        if (!Files.exists(keyFile)) {
            Keyring created = bootstrapKeyring();
            persistKeyring(created);
            return created;
        }
        try {
            JsonNode node = Jsons.mapper().readTree(Files.readString(keyFile, StandardCharsets.UTF_8));
            String active = node.path("active_kid").asText("");
            JsonNode keysNode = node.path("keys");
            LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
            if (keysNode.isObject()) {
                keysNode.fieldNames().forEachRemaining(kid -> {
                    String rawBase64 = keysNode.path(kid).asText("");
                    if (kid.isBlank() || rawBase64.isBlank()) {
                        return;
                    }
                    keys.put(kid, new SecretKeySpec(Base64.getDecoder().decode(rawBase64), "AES"));
                });
            }
            if (keys.isEmpty()) {
                throw new IllegalStateException("Session keyring has no keys: " + keyFile);
            }
            if (!keys.containsKey(active)) {
                throw new IllegalStateException("Session keyring active key id not found: " + active);
            }
            return new Keyring(active, keys);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load session keyring: " + keyFile, e);
        }
    }

    private Keyring bootstrapKeyring() {
        LinkedHashMap<String, SecretKeySpec> keys = new LinkedHashMap<>();
        String kid = nextKid(keys);
        keys.put(kid, newKey());
        return new Keyring(kid, keys);
    }

    private SecretKeySpec newKey() {
        byte[] raw = new byte[KEY_BYTES];
        secureRandom.nextBytes(raw);
        return new SecretKeySpec(raw, "AES");
    }

    private String nextKid(Map<String, SecretKeySpec> existing) {
        String kid = "k" + Instant.now().toEpochMilli();
        int suffix = 1;
        while (existing.containsKey(kid)) {
            kid = "k" + Instant.now().toEpochMilli() + "-" + suffix++;
        }
        return kid;
    }

    private void persistKeyring(Keyring ring) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            LinkedHashMap<String, String> keys = new LinkedHashMap<>();
            for (Map.Entry<String, SecretKeySpec> entry : ring.keys.entrySet()) {
                keys.put(entry.getKey(), Base64.getEncoder().encodeToString(entry.getValue().getEncoded()));
            }
            ObjectNode root = Jsons.mapper().createObjectNode();
            root.put("schema", "syncmesh.session.keys.v1");
            root.put("active_kid", ring.activeKid);
            root.set("keys", Jsons.mapper().valueToTree(keys));
            Files.writeString(keyFile, Jsons.toJson(root), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist session keyring: " + keyFile, e);
        }
    }

    private record Keyring(String activeKid, LinkedHashMap<String, SecretKeySpec> keys) {
    }

    public record RotationOutcome(String activeKid, int totalKeys, String keyFile) {
    }

    public record KeyringStatus(String activeKid, int totalKeys, String keyFile) {
    }
}
