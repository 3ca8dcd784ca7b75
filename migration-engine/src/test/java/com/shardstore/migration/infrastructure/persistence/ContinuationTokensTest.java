package com.shardstore.migration.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.shardstore.migration.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContinuationTokens")
class ContinuationTokensTest {

    @Test
    @DisplayName("decodes what it encodes")
    void decodesEncoded() {
        String token = ContinuationTokens.encode("shard-0042");

        assertThat(token).doesNotContain("shard-0042");
        assertThat(ContinuationTokens.decode(token)).isEqualTo("shard-0042");
    }

    @Test
    @DisplayName("a blank token starts from the beginning")
    void blankToken() {
        assertThat(ContinuationTokens.decode(null)).isEmpty();
        assertThat(ContinuationTokens.decode("  ")).isEmpty();
    }

    @Test
    @DisplayName("rejects tokens it did not produce")
    void rejectsForeignTokens() {
        assertThatThrownBy(() -> ContinuationTokens.decode("not base64!"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> ContinuationTokens.decode("c2hhcmQ"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Malformed continuation token");
    }

    @Test
    @DisplayName("the retry-pass marker is recognised and is not a keyset position")
    void retryPassMarker() {
        assertThat(ContinuationTokens.isRetryPass(ContinuationTokens.retryPass())).isTrue();
        assertThat(ContinuationTokens.isRetryPass(ContinuationTokens.encode("retry"))).isFalse();
        assertThat(ContinuationTokens.isRetryPass(null)).isFalse();
        assertThatThrownBy(() -> ContinuationTokens.decode(ContinuationTokens.retryPass()))
                .isInstanceOf(ValidationException.class);
    }
}
