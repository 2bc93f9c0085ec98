package io.act.engine.runtime;

import io.act.engine.error.ActEngineException;
import io.act.engine.error.DuplicateCapabilityException;
import io.act.engine.error.UnknownCapabilityException;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps step type names (and their aliases) to capability factories.
 */
public final class CapabilityRegistry {
    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);
    static final String CLASSPATH_SOURCE = "classpath";
    private static final int MAX_LOOKUP_FAILURES = 32;

    private final Map<String, Registration> primaries = new ConcurrentHashMap<>();
    private final Map<String, String> aliases = new ConcurrentHashMap<>();
    private final Set<String> loadedSources = ConcurrentHashMap.newKeySet();
    private final boolean strict;

    public CapabilityRegistry() {
        this(false);
    }

    /**
     * @param strict when {@code true}, registering an existing key fails instead of overwriting it
     */
    public CapabilityRegistry(boolean strict) {
        this.strict = strict;
    }

    public boolean isStrict() {
        return strict;
    }

    public synchronized CapabilityRegistry register(String type, CapabilityFactory factory, String... typeAliases) {
        Objects.requireNonNull(factory, "factory");
        String primary = normalizeKey(type);
        var aliasList = new ArrayList<String>();
        if (typeAliases != null) {
            for (String alias : typeAliases) {
                String key = normalizeKey(alias);
                if (!key.equals(primary) && !aliasList.contains(key)) {
                    aliasList.add(key);
                }
            }
        }
        if (strict) {
            for (String key : keys(primary, aliasList)) {
                if (primaries.containsKey(key) || aliases.containsKey(key)) {
                    throw new DuplicateCapabilityException(key);
                }
            }
        }
        if (primaries.containsKey(primary)) {
            log.warn("Overwriting capability registration for type '{}'", primary);
        }
        String shadowed = aliases.remove(primary);
        if (shadowed != null) {
            log.warn("Type '{}' was an alias of '{}'; it now names its own registration", primary, shadowed);
        }
        primaries.put(primary, new Registration(primary, factory, List.copyOf(aliasList)));
        for (String alias : aliasList) {
            var replaced = primaries.remove(alias);
            if (replaced != null) {
                log.warn("Type '{}' is now an alias of '{}'; its previous registration was dropped", alias, primary);
                aliases.values().removeIf(alias::equals);
            }
            String previous = aliases.put(alias, primary);
            if (previous != null && !previous.equals(primary)) {
                log.warn("Alias '{}' now points to '{}' instead of '{}'", alias, primary, previous);
            }
        }
        log.debug("Registered capability '{}' (aliases: {})", primary, aliasList);
        return this;
    }

    public CapabilityFactory resolve(String typeOrAlias) {
        return registration(typeOrAlias).factory();
    }

    public Registration registration(String typeOrAlias) {
        if (typeOrAlias == null || typeOrAlias.isBlank()) {
            throw new UnknownCapabilityException(String.valueOf(typeOrAlias));
        }
        String key = typeOrAlias.trim();
        var entry = primaries.get(key);
        if (entry == null) {
            String primary = aliases.get(key);
            entry = primary == null ? null : primaries.get(primary);
        }
        if (entry == null) {
            throw new UnknownCapabilityException(key);
        }
        return entry;
    }

    public boolean isRegistered(String typeOrAlias) {
        if (typeOrAlias == null) {
            return false;
        }
        String key = typeOrAlias.trim();
        return primaries.containsKey(key) || (aliases.containsKey(key) && primaries.containsKey(aliases.get(key)));
    }

    public Set<String> types() {
        return Collections.unmodifiableSet(new TreeSet<>(primaries.keySet()));
    }

    /**
     * Describes every registered primary type. Capabilities that fail to describe themselves are skipped.
     */
    public Map<String, CapabilityDescriptor> describeAll() {
        var descriptors = new LinkedHashMap<String, CapabilityDescriptor>();
        for (String type : types()) {
            try {
                descriptors.put(type, primaries.get(type).factory().create().describe());
            } catch (RuntimeException ex) {
                log.warn("Capability '{}' could not describe itself: {}", type, ex.getMessage());
            }
        }
        return descriptors;
    }

    /**
     * Registers the {@link CapabilityProvider} services packaged in the jars of {@code directory}.
     * A directory is scanned once; later calls return {@code 0}.
     *
     * @return number of providers registered by this call
     */
    public int discover(Path directory) {
        Objects.requireNonNull(directory, "directory");
        Path normalized = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(normalized)) {
            log.warn("Capability directory does not exist: {}", normalized);
            return 0;
        }
        if (!loadedSources.add(normalized.toString())) {
            log.debug("Capability directory already scanned: {}", normalized);
            return 0;
        }
        var jars = listJars(normalized);
        if (jars.isEmpty()) {
            log.debug("No capability jars found in {}", normalized);
            return 0;
        }
        // Left open: factories load provider classes lazily for the lifetime of the registry.
        var loader = new URLClassLoader(jars.toArray(URL[]::new), CapabilityRegistry.class.getClassLoader());
        int count = registerProviders(ServiceLoader.load(CapabilityProvider.class, loader), loader);
        log.info("Discovered {} capability provider(s) in {}", count, normalized);
        return count;
    }

    /**
     * Registers the {@link CapabilityProvider} services visible on the application class path, once.
     */
    public int discoverInstalled() {
        if (!loadedSources.add(CLASSPATH_SOURCE)) {
            return 0;
        }
        var loader = CapabilityRegistry.class.getClassLoader();
        int count = registerProviders(ServiceLoader.load(CapabilityProvider.class, loader), null);
        log.info("Discovered {} installed capability provider(s)", count);
        return count;
    }

    private int registerProviders(ServiceLoader<CapabilityProvider> serviceLoader, ClassLoader owner) {
        int registered = 0;
        int failures = 0;
        Iterator<ServiceLoader.Provider<CapabilityProvider>> iterator = serviceLoader.stream().iterator();
        while (failures < MAX_LOOKUP_FAILURES) {
            ServiceLoader.Provider<CapabilityProvider> handle;
            try {
                if (!iterator.hasNext()) {
                    break;
                }
                handle = iterator.next();
            } catch (ServiceConfigurationError err) {
                failures++;
                log.warn("Skipping unloadable capability provider: {}", err.getMessage());
                continue;
            }
            if (owner != null && handle.type().getClassLoader() != owner) {
                continue;
            }
            try {
                var provider = handle.get();
                register(provider.type(), provider::create, provider.aliases().toArray(String[]::new));
                registered++;
            } catch (ServiceConfigurationError | RuntimeException ex) {
                log.warn("Skipping capability provider {}: {}", handle.type().getName(), ex.getMessage());
            }
        }
        return registered;
    }

    private static List<URL> listJars(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            var jars = entries
                .filter(path -> path.getFileName().toString().endsWith(".jar"))
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
            var urls = new ArrayList<URL>(jars.size());
            for (Path jar : jars) {
                urls.add(jar.toUri().toURL());
            }
            return urls;
        } catch (MalformedURLException ex) {
            throw new ActEngineException("capability_discovery", "Invalid jar path in " + directory, ex);
        } catch (IOException ex) {
            throw new ActEngineException("capability_discovery", "Failed to list " + directory, ex);
        }
    }

    private static List<String> keys(String primary, List<String> aliasList) {
        var keys = new ArrayList<String>(aliasList.size() + 1);
        keys.add(primary);
        keys.addAll(aliasList);
        return keys;
    }

    private static String normalizeKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Capability type must not be blank");
        }
        return key.trim();
    }

    public record Registration(String type, CapabilityFactory factory, List<String> aliases) {}
}
