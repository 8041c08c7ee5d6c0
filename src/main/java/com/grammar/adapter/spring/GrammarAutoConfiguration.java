package com.grammar.adapter.spring;

import com.grammar.processor.EvaluationContext;
import com.grammar.processor.GrammarProcessorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;
import java.util.Map;

/**
 * Spring Boot auto-configuration for grammar evaluation.
 */
@Configuration
@ConditionalOnProperty(prefix = "grammar", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(GrammarProperties.class)
public class GrammarAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(GrammarAutoConfiguration.class);

    /** JVM architecture names mapped to Debian architecture names. */
    private static final Map<String, String> ARCH_ALIASES = Map.of(
            "x86_64", "amd64",
            "aarch64", "arm64",
            "x86", "i386",
            "i686", "i386",
            "arm", "armhf",
            "ppc64le", "ppc64el"
    );

    @Bean
    @ConditionalOnMissingBean
    public EvaluationContext evaluationContext(GrammarProperties properties) {
        String arch = properties.getArch() != null ? properties.getArch() : hostArchitecture();
        EvaluationContext context = EvaluationContext.builder()
                .arch(arch)
                .targetArch(properties.getTargetArch())
                .platforms(properties.getPlatforms())
                .validPlatforms(properties.getValidPlatforms())
                .validArchitectures(properties.getValidArchitectures())
                .build();
        log.info("Grammar evaluation context: {}", context);
        return context;
    }

    @Bean
    @ConditionalOnMissingBean
    public GrammarProcessorFactory grammarProcessorFactory(EvaluationContext context,
                                                           GrammarProperties properties) {
        log.info("Creating GrammarProcessorFactory with variant {}", properties.getVariant());
        return new GrammarProcessorFactory(context, properties.getVariant(), properties.getMaxDepth());
    }

    /**
     * The JVM's architecture, using Debian names where they differ.
     */
    static String hostArchitecture() {
        String osArch = System.getProperty("os.arch", "").toLowerCase(Locale.ROOT);
        return ARCH_ALIASES.getOrDefault(osArch, osArch);
    }
}
