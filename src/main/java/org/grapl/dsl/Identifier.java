package org.grapl.dsl;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A node name, also used as a binding name.
 * 
 * Grapl syntax: an ASCII letter or underscore followed by letters, digits or
 * underscores (e.g. {@code A}, {@code G1}, {@code left_wing}).
 * 
 * @param name The identifier text
 */
public record Identifier(String name) implements Comparable<Identifier> {

    private static final Pattern VALID = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public Identifier {
        Objects.requireNonNull(name, "Identifier name cannot be null");
        if (!VALID.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier: '" + name + "'");
        }
    }

    public static Identifier of(String name) {
        return new Identifier(name);
    }

    /**
     * @return true if the text is a well-formed identifier
     */
    public static boolean isValid(String text) {
        return text != null && VALID.matcher(text).matches();
    }

    @Override
    public int compareTo(Identifier other) {
        return name.compareTo(other.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
