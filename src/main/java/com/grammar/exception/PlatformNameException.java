package com.grammar.exception;

/**
 * Exception thrown when a configured platform name cannot be used.
 */
public class PlatformNameException extends GrammarException {

    public PlatformNameException(String message) {
        super(message);
    }

    /**
     * The platform {@code any} is implied by every platform set and may not be configured explicitly.
     */
    public static PlatformNameException reserved(String platform) {
        return new PlatformNameException("Platform name '" + platform
                + "' is reserved and cannot be used as a platform identifier");
    }
}
