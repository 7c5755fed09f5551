package io.conclave.core.compression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.conclave.core.exception.CompressionException;
import org.junit.jupiter.api.Test;

class GzipCompressionProviderTest {

    @Test
    void shouldShrinkRepetitiveText() throws CompressionException {
        // Given
        GzipCompressionProvider provider = new GzipCompressionProvider(9);
        String text = "{\"status\":\"ok\"}".repeat(200);

        // When
        byte[] compressed = provider.compress(text);

        // Then
        assertThat(compressed.length).isLessThan(text.length());
        assertThat(provider.decompress(compressed)).isEqualTo(text);
    }

    @Test
    void shouldKeepUnicode() throws CompressionException {
        GzipCompressionProvider provider = new GzipCompressionProvider();

        assertThat(provider.decompress(provider.compress("Grüße, 世界"))).isEqualTo("Grüße, 世界");
        assertThat(provider.getLevel()).isEqualTo(GzipCompressionProvider.DEFAULT_LEVEL);
    }

    @Test
    void shouldRejectCorruptInput() {
        GzipCompressionProvider provider = new GzipCompressionProvider();

        assertThatThrownBy(() -> provider.decompress(new byte[] {1, 2, 3}))
                .isInstanceOf(CompressionException.class);
    }

    @Test
    void shouldRejectInvalidLevel() {
        assertThatThrownBy(() -> new GzipCompressionProvider(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
