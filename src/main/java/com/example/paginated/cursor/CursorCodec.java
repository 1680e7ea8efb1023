package com.example.paginated.cursor;

/**
 * Converts cursors to and from the strings handed to clients.
 *
 * <p>Lists keep cursors as structured values; a codec is only needed where a cursor
 * crosses a process boundary, for instance as a query parameter of an HTTP endpoint.
 *
 * @param <C> the cursor type
 */
public interface CursorCodec<C> {

    /**
     * Turns a cursor into a token that can leave the process.
     *
     * @param cursor the cursor returned by a list
     * @return the token
     * @throws IllegalArgumentException if the cursor cannot be encoded
     */
    String encode(C cursor);

    /**
     * Parses a token produced by {@link #encode}.
     *
     * @param token the token handed back by a client
     * @return the cursor to pass to the list
     * @throws IllegalArgumentException if the token is not a valid cursor
     */
    C decode(String token);

    /**
     * Codec for lists whose cursors already are strings.
     */
    static CursorCodec<String> identity() {
        return new CursorCodec<>() {
            @Override
            public String encode(String cursor) {
                return cursor;
            }

            @Override
            public String decode(String token) {
                if (token == null) {
                    throw new IllegalArgumentException("Cursor token must not be null");
                }
                return token;
            }
        };
    }
}
