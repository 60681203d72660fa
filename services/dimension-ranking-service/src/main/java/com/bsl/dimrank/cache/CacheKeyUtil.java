package com.bsl.dimrank.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import com.bsl.dimrank.filter.DimensionTarget;
import com.bsl.dimrank.filter.FilterConstraint;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

public final class CacheKeyUtil {
    private CacheKeyUtil() {
    }

    /**
     * Stable fingerprint of query text: trimmed, lower-cased and whitespace-collapsed before
     * hashing, so trivially different spellings of one query share cache entries.
     */
    public static String fingerprint(String queryText) {
        String normalized = queryText == null ? "" : queryText.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return sha256(normalized);
    }

    /**
     * Fingerprint of the dimension targets a query's filter phrases resolved to. Phrase text and
     * duplicate targets do not change alignment, so they do not change the key either.
     */
    public static String constraintsFingerprint(List<FilterConstraint> constraints) {
        if (constraints == null || constraints.isEmpty()) {
            return "none";
        }
        TreeSet<String> targets = new TreeSet<>();
        for (FilterConstraint constraint : constraints) {
            for (DimensionTarget target : constraint.targets()) {
                targets.add(target.dimension() + "|" + target.level() + "|" + target.threshold());
            }
        }
        if (targets.isEmpty()) {
            return "none";
        }
        return sha256(String.join(";", targets));
    }

    public static String sha256(String value) {
        if (value == null) {
            return "";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hashed.length * 2);
            for (byte b : hashed) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            return Integer.toHexString(value.hashCode());
        }
    }
}
