package com.snailc.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Source of an {@link AstJsonSerializer} for the two trees a compilation produces: the parsed
 * Snail {@code Program} and the lowered Python {@code Module} handed to the host interpreter.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/com.snailc.json.AstJsonProvider}; snailc-jackson ships one named "Jackson".
 *
 * <pre>{@code
 * CompilationResult result = SnailCompiler.compile(source, CompileOptions.of(CompileMode.AWK));
 * AstJsonSerializer json = AstJsonProvider.getProvider().getSerializer();
 * String module = json.serialize(result.module());   // {"_type": "Module", "body": [...], ...}
 * String program = json.serialize(result.program()); // {"type": "Program", "body": [...], ...}
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /** Short name used by {@link #getProvider(String)}, matched without regard to case. */
    String getName();

    /**
     * The first registered provider.
     *
     * @throws IllegalStateException when no serialization module is on the classpath
     */
    static AstJsonProvider getProvider() {
        return first(null).orElseThrow(() -> new IllegalStateException(
            "No Snail AST JSON provider registered; add snailc-jackson to the classpath"));
    }

    /**
     * The registered provider called {@code name}.
     *
     * @throws IllegalStateException when none of the registered providers has that name
     */
    static AstJsonProvider getProvider(String name) {
        return first(name).orElseThrow(() -> new IllegalStateException(
            "No Snail AST JSON provider named '" + name + "' is registered"));
    }

    static boolean isProviderAvailable() {
        return first(null).isPresent();
    }

    private static Optional<AstJsonProvider> first(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (name == null || provider.getName().equalsIgnoreCase(name)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
