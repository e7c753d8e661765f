package jws.registry;

import jws.AlgorithmNotImplementedException;
import jws.crypto.SigningAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Maps algorithm identifiers to {@link SigningAlgorithm} instances.
 *
 * Resolution checks the {@link BuiltInAlgorithm built-ins} first, then custom
 * bindings in registration order; the first match wins. Custom bindings can
 * never shadow a built-in identifier.
 *
 * Registration is expected during start-up. The binding list is guarded by a
 * read-write lock, and {@link #freeze()} closes the registration phase.
 */
public class AlgorithmRegistry {

    private static final Logger log = LoggerFactory.getLogger(AlgorithmRegistry.class);

    private static final AlgorithmRegistry GLOBAL = new AlgorithmRegistry();

    private final List<AlgorithmBinding> customBindings = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean frozen;

    /** The process-wide registry used by default settings. */
    public static AlgorithmRegistry global() {
        return GLOBAL;
    }

    /**
     * Register a custom binding.
     *
     * @param regex Java regular expression, matched against the whole identifier;
     *              named groups ({@code (?<bits>\d+)}) are passed to the factory
     * @throws IllegalStateException if the registry is frozen
     */
    public AlgorithmBinding register(String regex, AlgorithmFactory factory) {
        return register(Pattern.compile(regex), factory);
    }

    public AlgorithmBinding register(Pattern pattern, AlgorithmFactory factory) {
        AlgorithmBinding binding = AlgorithmBinding.of(pattern, factory);
        lock.writeLock().lock();
        try {
            if (frozen) {
                throw new IllegalStateException("Algorithm registry is frozen; cannot register " + pattern.pattern());
            }
            customBindings.add(binding);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered custom algorithm binding pattern={} groups={}", pattern.pattern(), binding.groupNames());
        return binding;
    }

    /**
     * Resolve an identifier to a ready-to-use algorithm.
     *
     * @throws AlgorithmNotImplementedException if nothing matches
     */
    public SigningAlgorithm resolve(String identifier) {
        Objects.requireNonNull(identifier, "identifier");

        Optional<BuiltInAlgorithm> builtIn = BuiltInAlgorithm.forIdentifier(identifier);
        if (builtIn.isPresent()) {
            log.debug("Resolved alg={} to built-in {}", identifier, builtIn.get().algorithm().algorithmName());
            return builtIn.get().algorithm();
        }

        for (AlgorithmBinding binding : customBindings()) {
            Optional<SigningAlgorithm> resolved = binding.resolve(identifier);
            if (resolved.isPresent()) {
                log.debug("Resolved alg={} via custom binding {}", identifier, binding.pattern().pattern());
                return resolved.get();
            }
        }

        log.debug("No binding matches alg={}", identifier);
        throw new AlgorithmNotImplementedException(identifier);
    }

    /** True when {@link #resolve} would find a binding; the factory is not invoked. */
    public boolean isSupported(String identifier) {
        if (identifier == null) {
            return false;
        }
        if (BuiltInAlgorithm.forIdentifier(identifier).isPresent()) {
            return true;
        }
        return customBindings().stream().anyMatch(b -> b.pattern().matcher(identifier).matches());
    }

    /** Snapshot of the custom bindings in resolution order. */
    public List<AlgorithmBinding> customBindings() {
        lock.readLock().lock();
        try {
            return List.copyOf(customBindings);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** End the registration phase. Idempotent. */
    public void freeze() {
        lock.writeLock().lock();
        try {
            if (!frozen) {
                frozen = true;
                log.info("Algorithm registry frozen with {} custom binding(s)", customBindings.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isFrozen() {
        lock.readLock().lock();
        try {
            return frozen;
        } finally {
            lock.readLock().unlock();
        }
    }
}
