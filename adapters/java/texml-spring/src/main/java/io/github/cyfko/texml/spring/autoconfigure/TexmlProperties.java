package io.github.cyfko.texml.spring.autoconfigure;

import io.github.cyfko.texml.core.config.CompilerPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code texml.*} settings.
 *
 * <pre>
 * texml:
 *   display-style: true
 *   policy: strict
 *   cache-size: 1024
 *   macros:
 *     R: \mathbb{R}
 *     norm: \left\lVert #1 \right\rVert
 *   endpoint:
 *     enabled: true
 *     path: /api/math
 * </pre>
 */
@ConfigurationProperties(prefix = "texml")
public class TexmlProperties {

    /** Block math ({@code display="block"}) when a request does not say otherwise. */
    private boolean displayStyle = false;

    /** Resource limits preset. */
    private Policy policy = Policy.DEFAULT;

    /** Cached fragments shared by all requests; 0 disables the cache. */
    private int cacheSize = 512;

    /** Preamble macros, name (without backslash) to body. The arity is the highest {@code #k} of the body. */
    private Map<String, String> macros = new LinkedHashMap<>();

    private Endpoint endpoint = new Endpoint();

    public enum Policy {
        DEFAULT,
        STRICT,
        RELAXED;

        public CompilerPolicy toCompilerPolicy() {
            return switch (this) {
                case DEFAULT -> CompilerPolicy.defaults();
                case STRICT -> CompilerPolicy.strict();
                case RELAXED -> CompilerPolicy.relaxed();
            };
        }
    }

    public static class Endpoint {
        private boolean enabled = true;
        private String path = "/texml";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public boolean isDisplayStyle() {
        return displayStyle;
    }

    public void setDisplayStyle(boolean displayStyle) {
        this.displayStyle = displayStyle;
    }

    public Policy getPolicy() {
        return policy;
    }

    public void setPolicy(Policy policy) {
        this.policy = policy;
    }

    public int getCacheSize() {
        return cacheSize;
    }

    public void setCacheSize(int cacheSize) {
        this.cacheSize = cacheSize;
    }

    public Map<String, String> getMacros() {
        return macros;
    }

    public void setMacros(Map<String, String> macros) {
        this.macros = macros;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(Endpoint endpoint) {
        this.endpoint = endpoint;
    }
}
