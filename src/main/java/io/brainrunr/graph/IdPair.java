package io.brainrunr.graph;

/**
 * Unordered pair of memory ids in canonical form: {@code low < high}.
 */
public record IdPair(String low, String high) {

    public IdPair {
        if (low.compareTo(high) >= 0) {
            throw new IllegalArgumentException("IdPair requires low < high: " + low + ", " + high);
        }
    }

    /** Canonical pair for two distinct ids in either order. */
    public static IdPair of(String a, String b) {
        return a.compareTo(b) < 0 ? new IdPair(a, b) : new IdPair(b, a);
    }

    public boolean contains(String id) {
        return low.equals(id) || high.equals(id);
    }
}
