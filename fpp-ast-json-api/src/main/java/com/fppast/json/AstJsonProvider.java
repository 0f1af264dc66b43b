package com.fppast.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for the JSON side of the FPP AST.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * LocationRegistry locations = new LocationRegistry();
 * provider.getLocationMapReader().load(locationsJson, locations);
 * List<TransUnit> units = provider.getDeserializer()
 *     .deserializeTransUnits(astJson, TranslationSession.create(locations));
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    LocationMapReader getLocationMapReader();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available AstJsonProvider via ServiceLoader.
     *
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add fpp-ast-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets an AstJsonProvider by name via ServiceLoader.
     *
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
