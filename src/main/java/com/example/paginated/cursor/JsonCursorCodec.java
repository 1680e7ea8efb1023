package com.example.paginated.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes cursors of any Jackson-mappable type as JSON.
 *
 * <p>Example usage:
 * <pre>{@code
 * CursorCodec<OrderKey> codec = new JsonCursorCodec<>(OrderKey.class);
 * String token = codec.encode(page.cursor());
 * OrderKey cursor = codec.decode(token);
 * }</pre>
 *
 * @param <C> the cursor type
 */
public class JsonCursorCodec<C> implements CursorCodec<C> {

    private final ObjectMapper objectMapper;
    private final JavaType cursorType;

    /**
     * Creates a codec with a default {@link ObjectMapper}.
     *
     * @param cursorClass the cursor type to read tokens into
     */
    public JsonCursorCodec(Class<C> cursorClass) {
        this(new ObjectMapper(), cursorClass);
    }

    /**
     * Creates a codec on a caller-configured mapper, e.g. one with extra modules registered.
     *
     * @param objectMapper the mapper to read and write cursors with
     * @param cursorClass the cursor type to read tokens into
     */
    public JsonCursorCodec(ObjectMapper objectMapper, Class<C> cursorClass) {
        this.objectMapper = objectMapper;
        this.cursorType = objectMapper.getTypeFactory().constructType(cursorClass);
    }

    @Override
    public String encode(C cursor) {
        try {
            return objectMapper.writeValueAsString(cursor);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cursor cannot be written as JSON: " + cursor, e);
        }
    }

    @Override
    public C decode(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Cursor token must not be null");
        }
        try {
            C cursor = objectMapper.readValue(token, cursorType);
            if (cursor == null) {
                throw new IllegalArgumentException("Cursor token decodes to null: " + token);
            }
            return cursor;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed cursor token: " + token, e);
        }
    }
}
