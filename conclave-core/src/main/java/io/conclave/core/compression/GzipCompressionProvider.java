package io.conclave.core.compression;

import io.conclave.core.exception.CompressionException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/// {@link CompressionProvider} using GZIP from `java.util.zip`.
///
/// @implNote Thread-safe. Every call uses its own streams.
public final class GzipCompressionProvider implements CompressionProvider {

    public static final int DEFAULT_LEVEL = 6;

    private final int level;

    public GzipCompressionProvider() {
        this(DEFAULT_LEVEL);
    }

    /// Creates a provider with a deflate level.
    ///
    /// @param level 1 (fastest) to 9 (smallest)
    /// @throws IllegalArgumentException if level is outside 1..9
    public GzipCompressionProvider(int level) {
        if (level < Deflater.BEST_SPEED || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Compression level must be 1..9, got " + level);
        }
        this.level = level;
    }

    @Override
    public byte[] compress(String text) throws CompressionException {
        Objects.requireNonNull(text, "text must not be null");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (OutputStream gzip = new LeveledGzipOutputStream(buffer, level)) {
            gzip.write(text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CompressionException("Failed to compress payload", e);
        }
        return buffer.toByteArray();
    }

    @Override
    public String decompress(byte[] data) throws CompressionException {
        Objects.requireNonNull(data, "data must not be null");
        try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return new String(gzip.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CompressionException("Failed to decompress payload", e);
        }
    }

    public int getLevel() {
        return level;
    }

    private static final class LeveledGzipOutputStream extends GZIPOutputStream {
        private LeveledGzipOutputStream(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
