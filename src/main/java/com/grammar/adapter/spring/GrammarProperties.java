package com.grammar.adapter.spring;

import com.grammar.processor.DefaultGrammarProcessor;
import com.grammar.processor.Variant;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Spring Boot configuration properties for grammar evaluation.
 */
@ConfigurationProperties(prefix = "grammar")
public class GrammarProperties {

    /**
     * Whether grammar evaluation beans are created.
     */
    private boolean enabled = true;

    /**
     * Host architecture. Defaults to the JVM's architecture.
     */
    private String arch;

    /**
     * Target architecture. Defaults to the host architecture.
     */
    private String targetArch;

    /**
     * Platforms being built. Unset means 'for' clauses never match.
     */
    private List<String> platforms;

    /**
     * Allow-list for platforms, checked when 'for' clauses are read.
     */
    private List<String> validPlatforms;

    /**
     * Allow-list for architectures, checked for the context and 'on'/'to' clauses.
     */
    private List<String> validArchitectures;

    /**
     * Dialect fixed by the application. UNKNOWN lets the first clause decide.
     */
    private Variant variant = Variant.UNKNOWN;

    /**
     * Maximum nesting of grammar bodies.
     */
    private int maxDepth = DefaultGrammarProcessor.DEFAULT_MAX_DEPTH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getArch() {
        return arch;
    }

    public void setArch(String arch) {
        this.arch = arch;
    }

    public String getTargetArch() {
        return targetArch;
    }

    public void setTargetArch(String targetArch) {
        this.targetArch = targetArch;
    }

    public List<String> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(List<String> platforms) {
        this.platforms = platforms;
    }

    public List<String> getValidPlatforms() {
        return validPlatforms;
    }

    public void setValidPlatforms(List<String> validPlatforms) {
        this.validPlatforms = validPlatforms;
    }

    public List<String> getValidArchitectures() {
        return validArchitectures;
    }

    public void setValidArchitectures(List<String> validArchitectures) {
        this.validArchitectures = validArchitectures;
    }

    public Variant getVariant() {
        return variant;
    }

    public void setVariant(Variant variant) {
        this.variant = variant;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
}
