package io.iamcore.resource;

/**
 * Paging of a list call.
 *
 * @param startIndex 1-based index of the first resource
 * @param count      maximum resources to return; {@code 0} returns only the total
 */
public record ListRequest(int startIndex, int count) {
    public static final int DEFAULT_COUNT = 100;

    public ListRequest {
        if (startIndex < 1) {
            throw new IllegalArgumentException("startIndex must be >= 1");
        }
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
    }

    public static ListRequest firstPage() {
        return new ListRequest(1, DEFAULT_COUNT);
    }

    /**
     * Returns the zero-based offset.
     */
    public int offset() {
        return startIndex - 1;
    }
}
