package org.grapl.dsl;

/**
 * Sealed interface representing graph expressions in the Grapl AST.
 * 
 * Type hierarchy:
 * GraphExpression
 * ├── Leaf (a single named node: A)
 * ├── Connected (a clique of its members: {A, B})
 * └── Disconnected (a disjoint union of its members: [A, B])
 */
public sealed interface GraphExpression permits Leaf, Connected, Disconnected {
}
