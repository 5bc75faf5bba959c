package com.querybridge.error;

import java.util.Objects;

/**
 * A block of vendor error codes that share one {@link ErrorKind}.
 *
 * @param fromInclusive lowest code in the block
 * @param toExclusive first code past the block
 * @param kind normalized kind returned on match
 */
public record ErrorCodeRange(int fromInclusive, int toExclusive, ErrorKind kind) {

    public ErrorCodeRange {
        Objects.requireNonNull(kind, "kind");
        if (toExclusive <= fromInclusive) {
            throw new IllegalArgumentException("Empty error code range: " + fromInclusive + ".." + toExclusive);
        }
    }

    public boolean contains(int errorCode) {
        return errorCode >= fromInclusive && errorCode < toExclusive;
    }
}
