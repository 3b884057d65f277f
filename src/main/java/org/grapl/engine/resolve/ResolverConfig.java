package org.grapl.engine.resolve;

/**
 * Binding policy for resolution. Immutable; one instance may be shared by any
 * number of environments.
 * 
 * @param allowShadowing Whether a bound name may be bound again:
 *                       {@code G = A} then {@code G = B}
 * @param allowRecursion Whether a binding may refer to its own name:
 *                       {@code G = {G, B}}. Recursive bindings are stored
 *                       as written; they are never unrolled.
 */
public record ResolverConfig(boolean allowShadowing, boolean allowRecursion) {

    private static final ResolverConfig DEFAULTS = new ResolverConfig(false, false);

    /**
     * @return Neither shadowing nor recursion allowed
     */
    public static ResolverConfig defaults() {
        return DEFAULTS;
    }

    public ResolverConfig withShadowing() {
        return new ResolverConfig(true, allowRecursion);
    }

    public ResolverConfig withRecursion() {
        return new ResolverConfig(allowShadowing, true);
    }
}
