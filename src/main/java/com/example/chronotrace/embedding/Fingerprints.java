package com.example.chronotrace.embedding;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Content-derived cache keys. A segment fingerprint depends only on the bytes, never on the
 * file name or upload session, so byte-identical segments always map to the same key.
 */
public final class Fingerprints {

    static final int WINDOW = 64 * 1024;

    private Fingerprints() {}

    /**
     * SHA-256 over the content length plus its decisive bytes: the whole content when it fits in
     * three windows, otherwise the head, middle and tail windows.
     */
    public static String segment(byte[] content) {
        MessageDigest md = sha256();
        md.update("segment:".getBytes(StandardCharsets.UTF_8));
        md.update(ByteBuffer.allocate(Long.BYTES).putLong(content.length).array());
        if (content.length <= 3 * WINDOW) {
            md.update(content);
        } else {
            int middle = content.length / 2 - WINDOW / 2;
            md.update(content, 0, WINDOW);
            md.update(content, middle, WINDOW);
            md.update(content, content.length - WINDOW, WINDOW);
        }
        return hex(md.digest());
    }

    public static String query(String text) {
        MessageDigest md = sha256();
        md.update("query:".getBytes(StandardCharsets.UTF_8));
        md.update(normalizeText(text).getBytes(StandardCharsets.UTF_8));
        return hex(md.digest());
    }

    /**
     * Checksum over the full content. Two contents sharing a fingerprint but not a checksum
     * are a collision.
     */
    public static String contentChecksum(byte[] content) {
        CRC32 crc = new CRC32();
        crc.update(content);
        return content.length + ":" + Long.toHexString(crc.getValue());
    }

    public static String textChecksum(String text) {
        return contentChecksum(normalizeText(text).getBytes(StandardCharsets.UTF_8));
    }

    public static String normalizeText(String text) {
        if (text == null) return "";
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static String sha256Hex(String s) {
        return hex(sha256().digest(s.getBytes(StandardCharsets.UTF_8)));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String hex(byte[] d) {
        StringBuilder sb = new StringBuilder(d.length * 2);
        for (byte bb : d) sb.append(String.format("%02x", bb));
        return sb.toString();
    }
}
