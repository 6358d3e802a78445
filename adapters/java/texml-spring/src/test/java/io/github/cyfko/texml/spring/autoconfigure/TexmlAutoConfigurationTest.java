package io.github.cyfko.texml.spring.autoconfigure;

import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.spring.controller.TexmlController;
import io.github.cyfko.texml.spring.service.TexmlService;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TexmlAutoConfiguration}.
 */
class TexmlAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TexmlAutoConfiguration.class));

    private final WebApplicationContextRunner webContextRunner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TexmlAutoConfiguration.class));

    @Test
    void shouldRegisterServiceWithDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TexmlService.class);
            assertThat(context).doesNotHaveBean(TexmlController.class);
            assertEquals(CompilerPolicy.defaults(), context.getBean(CompilerPolicy.class));
            assertTrue(context.getBean(TexmlService.class).compile("x").contains("display=\"inline\""));
        });
    }

    @Test
    void shouldApplyProperties() {
        contextRunner
                .withPropertyValues(
                        "texml.display-style=true",
                        "texml.policy=strict",
                        "texml.macros.reals=\\mathbb{R}")
                .run(context -> {
                    TexmlService service = context.getBean(TexmlService.class);

                    assertEquals(CompilerPolicy.strict(), context.getBean(CompilerPolicy.class));
                    assertTrue(service.preamble().contains("reals"));
                    String mathml = service.compile("\\reals");
                    assertTrue(mathml.contains("display=\"block\""));
                    assertTrue(mathml.contains("<mi>ℝ</mi>"));
                });
    }

    @Test
    void shouldFailOnInvalidPreamble() {
        contextRunner
                .withPropertyValues("texml.macros.bad=a \\")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldRegisterControllerInServletApplications() {
        webContextRunner.run(context -> assertThat(context).hasSingleBean(TexmlController.class));
    }

    @Test
    void shouldHonourDisabledEndpoint() {
        webContextRunner
                .withPropertyValues("texml.endpoint.enabled=false")
                .run(context -> {
                    assertThat(context).hasSingleBean(TexmlService.class);
                    assertThat(context).doesNotHaveBean(TexmlController.class);
                });
    }
}
