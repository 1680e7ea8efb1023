package com.example.paginated.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Encodes a {@link MergedCursor} as a JSON array holding each constituent's own encoded
 * cursor, e.g. {@code ["3","first"]}.
 *
 * <p>The codecs are given in the same order as the lists passed to
 * {@link com.example.paginated.list.PaginatedList#merge}.
 */
public class MergedCursorCodec implements CursorCodec<MergedCursor> {

    private final ObjectMapper objectMapper;
    private final List<CursorCodec<?>> codecs;

    /**
     * Creates a codec with a default {@link ObjectMapper}.
     *
     * @param codecs one codec per merged list, in merge order
     */
    public MergedCursorCodec(CursorCodec<?>... codecs) {
        this(new ObjectMapper(), Arrays.asList(codecs));
    }

    /**
     * Creates a codec writing the outer JSON array with the given mapper.
     *
     * @param objectMapper the mapper used for the outer array
     * @param codecs one codec per merged list, in merge order
     */
    public MergedCursorCodec(ObjectMapper objectMapper, List<? extends CursorCodec<?>> codecs) {
        this.objectMapper = objectMapper;
        this.codecs = List.copyOf(codecs);
    }

    @Override
    public String encode(MergedCursor cursor) {
        checkArity(cursor.size());
        ArrayNode array = objectMapper.createArrayNode();
        for (int i = 0; i < codecs.size(); i++) {
            array.add(encodeWith(codecs.get(i), cursor.get(i)));
        }
        try {
            return objectMapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Merged cursor cannot be written as JSON: " + cursor, e);
        }
    }

    @Override
    public MergedCursor decode(String token) {
        if (token == null) {
            throw new IllegalArgumentException("Cursor token must not be null");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(token);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed merged cursor token: " + token, e);
        }
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("Merged cursor token is not a JSON array: " + token);
        }
        checkArity(node.size());

        List<Object> cursors = new ArrayList<>(codecs.size());
        for (int i = 0; i < codecs.size(); i++) {
            JsonNode element = node.get(i);
            if (!element.isTextual()) {
                throw new IllegalArgumentException("Merged cursor position " + i + " is not a string: " + token);
            }
            cursors.add(codecs.get(i).decode(element.asText()));
        }
        return new MergedCursor(cursors);
    }

    private void checkArity(int size) {
        if (size != codecs.size()) {
            throw new IllegalArgumentException(
                    "Merged cursor has " + size + " positions but " + codecs.size() + " codecs are configured");
        }
    }

    private static <C> String encodeWith(CursorCodec<C> codec, Object position) {
        // Position i of a merged cursor was produced by constituent i, the one codec i encodes.
        @SuppressWarnings("unchecked")
        C cursor = (C) position;
        return codec.encode(cursor);
    }
}
