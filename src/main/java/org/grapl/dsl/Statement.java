package org.grapl.dsl;

/**
 * A single top-level Grapl statement, as entered on one REPL line.
 */
public sealed interface Statement permits Assignment, Evaluation {
}
