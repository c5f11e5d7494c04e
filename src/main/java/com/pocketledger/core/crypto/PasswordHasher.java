package com.pocketledger.core.crypto;

import org.bouncycastle.crypto.generators.SCrypt;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

@Component
public class PasswordHasher {
    private static final SecureRandom RNG = new SecureRandom();
    private static final String PREFIX = "scrypt";
    private static final int SALT_LEN = 16;
    private static final int KEY_LEN = 32;

    private final int costExponent;

    public PasswordHasher(@Value("${app.security.scrypt-cost:15}") int costExponent) {
        if (costExponent < 1 || costExponent > 24) {
            throw new IllegalArgumentException("scrypt cost exponent out of range: " + costExponent);
        }
        this.costExponent = costExponent;
    }

    static byte[] deriveKey(String password, byte[] salt, int costExponent) {
        return SCrypt.generate(password.getBytes(StandardCharsets.UTF_8), salt, 1 << costExponent, 8, 1, KEY_LEN);
    }

    /**
     * Returns scrypt$cost$base64(salt)$base64(key)
     */
    public String hash(String password) {
        byte[] salt = new byte[SALT_LEN];
        RNG.nextBytes(salt);
        byte[] key = deriveKey(password, salt, costExponent);
        Base64.Encoder b64 = Base64.getEncoder();
        return PREFIX + "$" + costExponent + "$" + b64.encodeToString(salt) + "$" + b64.encodeToString(key);
    }

    public boolean matches(String password, String stored) {
        if (password == null || stored == null) return false;
        String[] p = stored.split("\\$");
        if (p.length != 4 || !PREFIX.equals(p[0])) return false;
        try {
            int cost = Integer.parseInt(p[1]);
            byte[] salt = Base64.getDecoder().decode(p[2]);
            byte[] expected = Base64.getDecoder().decode(p[3]);
            return MessageDigest.isEqual(expected, deriveKey(password, salt, cost));
        } catch (IllegalArgumentException e) {
            // corrupt stored hash never matches
            return false;
        }
    }
}
