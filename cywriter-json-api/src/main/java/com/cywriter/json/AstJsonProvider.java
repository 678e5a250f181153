package com.cywriter.json;

import java.util.ServiceLoader;

/**
 * Source of JSON codecs for code trees. Implementations register themselves under
 * {@code META-INF/services/com.cywriter.json.AstJsonProvider} and are found with
 * {@link ServiceLoader}.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * ModuleNode module = provider.getDeserializer().deserializeModule(json);
 * List<String> lines = CyWriter.writeCode(module);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used to pick a provider, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * First provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No AstJsonProvider on the classpath; add cywriter-jackson to the dependencies"));
    }

    /**
     * Provider whose {@link #getName()} matches {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
