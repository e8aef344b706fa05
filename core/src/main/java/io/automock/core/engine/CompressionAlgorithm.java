package io.automock.core.engine;

import io.automock.core.error.CompressionException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Locale;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Content codings understood by the pre-compress transform. The name is the
 * {@code Content-Encoding} token.
 */
public enum CompressionAlgorithm {
    IDENTITY("identity") {
        @Override
        public byte[] compress(byte[] input) {
            return input;
        }
    },

    GZIP("gzip") {
        @Override
        public byte[] compress(byte[] input) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
                gzip.write(input);
            } catch (IOException e) {
                throw new CompressionException("gzip compression failed: " + e.getMessage(), e);
            }
            return out.toByteArray();
        }
    },

    /** Raw DEFLATE stream (RFC 1951), no zlib wrapper. */
    DEFLATE("deflate") {
        @Override
        public byte[] compress(byte[] input) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION, true);
            try (DeflaterOutputStream stream = new DeflaterOutputStream(out, deflater)) {
                stream.write(input);
            } catch (IOException e) {
                throw new CompressionException("deflate compression failed: " + e.getMessage(), e);
            } finally {
                deflater.end();
            }
            return out.toByteArray();
        }
    };

    private final String token;

    CompressionAlgorithm(String token) {
        this.token = token;
    }

    /** The {@code Content-Encoding} token. */
    public String token() {
        return token;
    }

    /** Compresses {@code input}; {@link #IDENTITY} returns it unchanged. */
    public abstract byte[] compress(byte[] input);

    /**
     * Resolves an algorithm by token, case-insensitively.
     *
     * @throws CompressionException naming the algorithm if it is not supported
     */
    public static CompressionAlgorithm fromName(String name) {
        CompressionAlgorithm algorithm = lookup(name);
        if (algorithm == null) {
            throw new CompressionException("unsupported compression algorithm: " + name);
        }
        return algorithm;
    }

    /** Like {@link #fromName} but returns {@code null} for unknown tokens. */
    public static CompressionAlgorithm lookup(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (CompressionAlgorithm algorithm : values()) {
            if (algorithm.token.equals(normalized)) {
                return algorithm;
            }
        }
        return null;
    }
}
