package jws;

import java.util.Set;

/**
 * The header names an algorithm outside the set the caller pinned in {@link JwsSettings}.
 */
public class AlgorithmNotAcceptedException extends JwsException {

    private final String identifier;

    public AlgorithmNotAcceptedException(String identifier, Set<String> accepted) {
        super("Algorithm " + identifier + " is not accepted (accepted: " + accepted + ")");
        this.identifier = identifier;
    }

    public String identifier() {
        return identifier;
    }
}
