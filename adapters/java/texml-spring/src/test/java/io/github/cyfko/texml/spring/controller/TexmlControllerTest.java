package io.github.cyfko.texml.spring.controller;

import io.github.cyfko.texml.core.api.CompileResult;
import io.github.cyfko.texml.core.config.CompilerPolicy;
import io.github.cyfko.texml.core.config.MathMLOptions;
import io.github.cyfko.texml.core.spi.MacroRegistry;
import io.github.cyfko.texml.spring.service.TexmlService;
import io.github.cyfko.texml.spring.service.impl.TexmlServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Tests for {@link TexmlController}.
 */
class TexmlControllerTest {

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        TexmlService service = new TexmlServiceImpl(new MacroRegistry(), CompilerPolicy.defaults(), 8,
                MathMLOptions.defaults());
        mockMvc = MockMvcBuilders.standaloneSetup(new TexmlController(service))
                .addPlaceholderValue("texml.endpoint.path", "/texml")
                .build();
    }

    @Test
    void shouldReturnMathml() throws Exception {
        mockMvc.perform(post("/texml/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"\\\\frac{a}{b}\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mathml", containsString("display=\"inline\"")))
                .andExpect(jsonPath("$.mathml", containsString("<mfrac><mi>a</mi><mi>b</mi></mfrac>")));
    }

    @Test
    void shouldHonourDisplayFlag() throws Exception {
        mockMvc.perform(post("/texml/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"x\", \"display\": true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mathml", containsString("display=\"block\"")));
    }

    @Test
    void shouldDescribeCompileErrors() throws Exception {
        mockMvc.perform(post("/texml/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"a}\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("MismatchedBraces"))
                .andExpect(jsonPath("$.position").value(1))
                .andExpect(jsonPath("$.formatted", containsString("^")));
    }

    @Test
    void shouldRejectMissingLatex() throws Exception {
        mockMvc.perform(post("/texml/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"display\": false}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value(TexmlController.INVALID_REQUEST))
                .andExpect(jsonPath("$.position").value(-1));
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/texml/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON body"));
    }

    @Test
    void shouldUseServiceDefaultWhenDisplayIsAbsent() throws Exception {
        TexmlService service = mock(TexmlService.class);
        when(service.defaultOptions()).thenReturn(MathMLOptions.block());
        when(service.tryCompile(eq("x"), any())).thenReturn(CompileResult.success("<math/>"));
        MockMvc mvc = MockMvcBuilders.standaloneSetup(new TexmlController(service)).build();

        mvc.perform(post("/texml/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"x\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mathml").value("<math/>"));

        verify(service).tryCompile("x", MathMLOptions.block());
    }
}
