package io.conclave.core.compression;

import io.conclave.core.exception.CompressionException;

/// Turns serialized context text into a compact byte payload and back.
///
/// Implementations must be thread-safe and lossless:
/// `decompress(compress(text)).equals(text)` for every text.
///
/// @see GzipCompressionProvider for the default implementation
public interface CompressionProvider {

    /// Compresses text.
    ///
    /// @param text UTF-8 text, not null
    /// @return compressed bytes, never null
    /// @throws CompressionException if the payload cannot be compressed
    byte[] compress(String text) throws CompressionException;

    /// Restores text produced by {@link #compress}.
    ///
    /// @param data compressed bytes, not null
    /// @return original text, never null
    /// @throws CompressionException if the data is corrupt or was not produced by this provider
    String decompress(byte[] data) throws CompressionException;
}
