package com.grammar.processor;

import com.grammar.exception.PlatformNameException;
import com.grammar.exception.UnknownArchitectureException;
import com.grammar.exception.UnknownPlatformNameException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * What a grammar is evaluated against: host and target architecture, and optionally the
 * platforms being built.
 * Immutable after construction.
 * <p>
 * When platforms are given, the set always contains {@value #ANY_PLATFORM}; configuring
 * {@value #ANY_PLATFORM} explicitly is an error. Allow-lists, when given, are checked at
 * construction time and by statements as they are created.
 */
public final class EvaluationContext {

    public static final String ANY_PLATFORM = "any";

    private final String arch;
    private final String targetArch;
    private final Set<String> platforms;
    private final Set<String> validPlatforms;
    private final Set<String> validArchitectures;

    private EvaluationContext(Builder builder) {
        this.arch = Objects.requireNonNull(builder.arch, "arch");
        this.targetArch = builder.targetArch != null ? builder.targetArch : builder.arch;
        this.validPlatforms = freeze(builder.validPlatforms);
        this.validArchitectures = freeze(builder.validArchitectures);

        if (builder.platforms != null) {
            if (builder.platforms.contains(ANY_PLATFORM)) {
                throw PlatformNameException.reserved(ANY_PLATFORM);
            }
            Set<String> withAny = new LinkedHashSet<>(builder.platforms);
            withAny.add(ANY_PLATFORM);
            this.platforms = Collections.unmodifiableSet(withAny);
        } else {
            this.platforms = null;
        }

        requireKnownArchitecture(arch);
        requireKnownArchitecture(targetArch);
        if (platforms != null) {
            platforms.forEach(this::requireKnownPlatform);
        }
    }

    /**
     * Create a context without platforms.
     */
    public static EvaluationContext of(String arch, String targetArch) {
        return builder().arch(arch).targetArch(targetArch).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Host architecture, the selector for 'on'.
     */
    public String getArch() {
        return arch;
    }

    /**
     * Target architecture, the selector for 'to'.
     */
    public String getTargetArch() {
        return targetArch;
    }

    /**
     * Platforms being built, the selectors for 'for'. Empty when none were configured.
     */
    public Optional<Set<String>> getPlatforms() {
        return Optional.ofNullable(platforms);
    }

    public Optional<Set<String>> getValidPlatforms() {
        return Optional.ofNullable(validPlatforms);
    }

    public Optional<Set<String>> getValidArchitectures() {
        return Optional.ofNullable(validArchitectures);
    }

    /**
     * @throws UnknownArchitectureException if an allow-list is configured and does not contain the architecture
     */
    public void requireKnownArchitecture(String architecture) {
        if (validArchitectures != null && !validArchitectures.contains(architecture)) {
            throw new UnknownArchitectureException(architecture, validArchitectures);
        }
    }

    /**
     * {@value #ANY_PLATFORM} is always known.
     *
     * @throws UnknownPlatformNameException if an allow-list is configured and does not contain the platform
     */
    public void requireKnownPlatform(String platform) {
        if (validPlatforms != null && !ANY_PLATFORM.equals(platform) && !validPlatforms.contains(platform)) {
            throw new UnknownPlatformNameException(platform, validPlatforms);
        }
    }

    private static Set<String> freeze(Collection<String> values) {
        return values == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    @Override
    public String toString() {
        return "EvaluationContext{" +
                "arch='" + arch + '\'' +
                ", targetArch='" + targetArch + '\'' +
                ", platforms=" + platforms +
                '}';
    }

    /**
     * Builder for EvaluationContext.
     */
    public static class Builder {
        private String arch;
        private String targetArch;
        private Collection<String> platforms;
        private Collection<String> validPlatforms;
        private Collection<String> validArchitectures;

        public Builder arch(String arch) {
            this.arch = arch;
            return this;
        }

        /**
         * Defaults to the host architecture.
         */
        public Builder targetArch(String targetArch) {
            this.targetArch = targetArch;
            return this;
        }

        public Builder platforms(Collection<String> platforms) {
            this.platforms = platforms;
            return this;
        }

        public Builder validPlatforms(Collection<String> validPlatforms) {
            this.validPlatforms = validPlatforms;
            return this;
        }

        public Builder validArchitectures(Collection<String> validArchitectures) {
            this.validArchitectures = validArchitectures;
            return this;
        }

        public EvaluationContext build() {
            return new EvaluationContext(this);
        }
    }
}
