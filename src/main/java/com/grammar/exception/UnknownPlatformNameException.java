package com.grammar.exception;

import java.util.Collection;
import java.util.TreeSet;

/**
 * Exception thrown when a platform is not in the configured allow-list.
 */
public class UnknownPlatformNameException extends PlatformNameException {

    private final String platform;

    public UnknownPlatformNameException(String platform, Collection<String> validPlatforms) {
        super("Unknown platform name '" + platform + "'. Valid platforms are: "
                + String.join(", ", new TreeSet<>(validPlatforms)));
        this.platform = platform;
    }

    public String getPlatform() {
        return platform;
    }
}
