package com.example.paginated.cursor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonCursorCodecTest {

    private final JsonCursorCodec<OrderKey> codec = new JsonCursorCodec<>(OrderKey.class);

    @Test
    @DisplayName("Should encode a structured cursor as JSON and read it back")
    void shouldRoundTripStructuredCursor() {
        OrderKey key = new OrderKey("order-17", 1_700_000_000_000L);

        String token = codec.encode(key);

        assertThat(token).contains("\"id\":\"order-17\"");
        assertThat(codec.decode(token)).isEqualTo(key);
    }

    @Test
    @DisplayName("Should reject tokens that do not describe a cursor")
    void shouldRejectInvalidTokens() {
        assertThatThrownBy(() -> codec.decode("{not json"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed cursor token");
        assertThatThrownBy(() -> codec.decode("{\"id\":\"a\",\"createdAt\":\"yesterday\"}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> codec.decode("null"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("null");
    }

    @Test
    @DisplayName("Identity codec should pass strings through")
    void identityShouldPassThrough() {
        CursorCodec<String> identity = CursorCodec.identity();

        assertThat(identity.decode(identity.encode("42"))).isEqualTo("42");
        assertThatThrownBy(() -> identity.decode(null)).isInstanceOf(IllegalArgumentException.class);
    }

    record OrderKey(String id, long createdAt) {
    }
}
