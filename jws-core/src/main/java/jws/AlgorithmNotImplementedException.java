package jws;

/**
 * No registry binding matches the requested algorithm identifier.
 */
public class AlgorithmNotImplementedException extends JwsException {

    private final String identifier;

    public AlgorithmNotImplementedException(String identifier) {
        super("Could not find algorithm defined for " + identifier);
        this.identifier = identifier;
    }

    /** The identifier exactly as it appeared in the header. */
    public String identifier() {
        return identifier;
    }
}
