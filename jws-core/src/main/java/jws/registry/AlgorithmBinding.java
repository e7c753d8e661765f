package jws.registry;

import jws.crypto.SigningAlgorithm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A custom binding: identifiers fully matching {@code pattern} are built by {@code factory}.
 *
 * @param groupNames named groups declared in the pattern, in declaration order
 */
public record AlgorithmBinding(Pattern pattern, AlgorithmFactory factory, List<String> groupNames) {

    private static final Pattern GROUP_NAME = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    public AlgorithmBinding {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(factory, "factory");
        groupNames = List.copyOf(groupNames);
    }

    public static AlgorithmBinding of(Pattern pattern, AlgorithmFactory factory) {
        return new AlgorithmBinding(pattern, factory, groupNamesOf(pattern));
    }

    /**
     * Build the algorithm if the identifier matches this binding.
     * Unmatched optional groups are absent from the map handed to the factory.
     */
    public Optional<SigningAlgorithm> resolve(String identifier) {
        Matcher m = pattern.matcher(identifier);
        if (!m.matches()) {
            return Optional.empty();
        }
        Map<String, String> groups = new LinkedHashMap<>();
        for (String name : groupNames) {
            String value;
            try {
                value = m.group(name);
            } catch (IllegalArgumentException e) {
                // text inside \Q..\E or a character class can read like a group
                continue;
            }
            if (value != null) {
                groups.put(name, value);
            }
        }
        SigningAlgorithm algorithm = factory.create(Collections.unmodifiableMap(groups));
        return Optional.of(Objects.requireNonNull(algorithm,
                () -> "Factory for pattern " + pattern.pattern() + " returned null for " + identifier));
    }

    // Pattern has no public accessor for its group names before JDK 20
    private static List<String> groupNamesOf(Pattern pattern) {
        List<String> names = new ArrayList<>();
        Matcher m = GROUP_NAME.matcher(pattern.pattern());
        while (m.find()) {
            if (!isEscaped(pattern.pattern(), m.start())) {
                names.add(m.group(1));
            }
        }
        return names;
    }

    private static boolean isEscaped(String source, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && source.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    @Override
    public String toString() {
        return "AlgorithmBinding[" + pattern.pattern() + "]";
    }
}
