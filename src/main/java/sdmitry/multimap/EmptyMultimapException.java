package sdmitry.multimap;

/**
 * Thrown when densification or indexing is requested on a store without records.
 *
 * No max key exists in that case, so no key range can be built.
 */
public class EmptyMultimapException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public EmptyMultimapException(String message) {
        super(message);
    }
}
