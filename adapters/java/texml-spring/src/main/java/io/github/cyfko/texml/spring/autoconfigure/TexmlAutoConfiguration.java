package io.github.cyfko.texml.spring.autoconfigure;

import io.github.cyfko.texml.core.api.LatexCompiler;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.spring.controller.TexmlController;
import io.github.cyfko.texml.spring.service.TexmlService;
import io.github.cyfko.texml.spring.service.impl.PreambleLoader;
import io.github.cyfko.texml.spring.service.impl.TexmlServiceImpl;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers a {@link TexmlService} built from {@link TexmlProperties} and, in servlet web
 * applications, the {@link TexmlController}.
 */
@AutoConfiguration
@ConditionalOnClass(LatexCompiler.class)
@EnableConfigurationProperties(TexmlProperties.class)
public class TexmlAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public CompilerPolicy texmlCompilerPolicy(TexmlProperties properties) {
        return properties.getPolicy().toCompilerPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public TexmlService texmlService(TexmlProperties properties, CompilerPolicy compilerPolicy) {
        MathMLOptions defaults = MathMLOptions.builder().displayStyle(properties.isDisplayStyle()).build();
        return new TexmlServiceImpl(
                PreambleLoader.load(properties.getMacros()),
                compilerPolicy,
                properties.getCacheSize(),
                defaults);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "texml.endpoint", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class EndpointConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public TexmlController texmlController(TexmlService texmlService) {
            return new TexmlController(texmlService);
        }
    }
}
