package com.grammar.exception;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Exception thrown when an architecture is not in the configured allow-list.
 */
public class UnknownArchitectureException extends GrammarException {

    private final String architecture;

    public UnknownArchitectureException(String architecture, Collection<String> validArchitectures) {
        super("Unknown architecture '" + architecture + "'. Valid architectures are: "
                + String.join(", ", new TreeSet<>(validArchitectures)));
        this.architecture = architecture;
    }

    public String getArchitecture() {
        return architecture;
    }
}
