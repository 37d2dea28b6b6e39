package org.contextql.engine.graph;

import java.util.Set;

/**
 * Thrown when the requested datasets are not all connected, or one of them is
 * not declared by the context.
 */
public class NoPathException extends JoinResolutionException {

    private final Set<String> unreachable;

    public NoPathException(String message, Set<String> unreachable) {
        super(message);
        this.unreachable = Set.copyOf(unreachable);
    }

    /**
     * @return The datasets that could not be joined in
     */
    public Set<String> getUnreachable() {
        return unreachable;
    }
}
