package com.titiplex.lanqueue.core.crypto;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;

/**
 * Queue password hashing. The host keeps only the hex SHA-256 of its password and compares
 * hashes of incoming auth requests against it.
 */
public final class PasswordHasher {

    private PasswordHasher() {
    }

    public static String hash(String password) {
        byte[] in = (password == null ? "" : password).getBytes(StandardCharsets.UTF_8);
        SHA256Digest digest = new SHA256Digest();
        digest.update(in, 0, in.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    /**
     * Constant-time check of {@code password} against a stored hex hash. A missing stored hash
     * never matches.
     */
    public static boolean matches(String password, String storedHash) {
        if (storedHash == null) return false;
        byte[] actual = hash(password).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = storedHash.getBytes(StandardCharsets.US_ASCII);
        return Arrays.constantTimeAreEqual(actual, expected);
    }
}
