package org.grapl.engine.resolve;

import org.grapl.dsl.GraphExpression;
import org.grapl.dsl.Identifier;
import org.grapl.dsl.Leaf;
import org.grapl.engine.graph.GraphProjection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Running binding environment of one resolution session.
 * 
 * Maps names to the expressions they were bound to. Stored expressions are
 * already resolved, so looking a name up never resolves again and rebinding a
 * name later does not change bindings that were built from it.
 */
public final class Environment {

    private final Map<Identifier, GraphExpression> bindings = new LinkedHashMap<>();
    private final ResolverConfig config;

    public Environment(ResolverConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * @return A new environment with the default policy
     */
    public static Environment withDefaults() {
        return new Environment(ResolverConfig.defaults());
    }

    /**
     * Returns the expression bound to a name, or the name itself as a node when
     * it is unbound.
     */
    public GraphExpression lookup(Identifier name) {
        GraphExpression bound = bindings.get(name);
        return bound != null ? bound : new Leaf(name);
    }

    public boolean isBound(Identifier name) {
        return bindings.containsKey(name);
    }

    /**
     * Binds a name, treating any occurrence of the name in the value as a
     * reference to itself.
     * 
     * @throws GraplResolveException on a shadowing or recursion violation
     */
    public void bind(Identifier name, GraphExpression value) {
        bind(name, value, GraphProjection.containsNode(value, name));
    }

    /**
     * Binds a name once the caller has decided whether the value refers to it.
     * 
     * @throws GraplResolveException on a shadowing or recursion violation
     */
    void bind(Identifier name, GraphExpression value, boolean selfReferential) {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        if (!config.allowShadowing() && bindings.containsKey(name)) {
            throw new GraplResolveException(GraplResolveException.Violation.SHADOWING, name);
        }
        if (!config.allowRecursion() && selfReferential) {
            throw new GraplResolveException(GraplResolveException.Violation.RECURSION, name);
        }
        bindings.put(name, value);
    }

    /**
     * @return Unmodifiable view of the bindings, in first-binding order
     */
    public Map<Identifier, GraphExpression> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    public ResolverConfig config() {
        return config;
    }

    @Override
    public String toString() {
        return "Environment[bindings=" + bindings.size() + ", config=" + config + "]";
    }
}
