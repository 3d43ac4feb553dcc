package com.codeparse.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tunable parser behavior.
 *
 * <p>Loaded from {@code codeparse.yaml}. Every section and every key is optional; anything
 * missing takes its default.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * indentation:
 *   tabWidth: 4
 *
 * decorators:
 *   order: APPLICATION
 *   allowBlankLines: false
 *
 * output:
 *   includeTokenIndices: true
 * }</pre>
 *
 * @param indentation indentation measuring settings
 * @param decorators decorator association settings
 * @param output tree output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParserConfig(
    @JsonProperty("indentation") IndentationConfig indentation,
    @JsonProperty("decorators") DecoratorConfig decorators,
    @JsonProperty("output") OutputConfig output
) {
    /** Tab stop used when no width is configured. */
    public static final int DEFAULT_TAB_WIDTH = 8;

    public ParserConfig {
        indentation = indentation != null ? indentation : new IndentationConfig(null);
        decorators = decorators != null ? decorators : new DecoratorConfig(null, null);
        output = output != null ? output : new OutputConfig(null);
    }

    /**
     * Creates the default configuration: tab width 8, decorators in source order, blank lines
     * allowed between decorators and their definition, no token indices in the tree.
     *
     * @return default configuration
     */
    public static ParserConfig defaults() {
        return new ParserConfig(null, null, null);
    }

    /**
     * Returns a copy with a different tab width.
     */
    public ParserConfig withTabWidth(int tabWidth) {
        return new ParserConfig(new IndentationConfig(tabWidth), decorators, output);
    }

    /**
     * Returns a copy with different decorator settings.
     */
    public ParserConfig withDecorators(DecoratorOrder order, boolean allowBlankLines) {
        return new ParserConfig(indentation, new DecoratorConfig(order, allowBlankLines), output);
    }

    /**
     * Returns a copy that records token indices on nodes.
     */
    public ParserConfig withTokenIndices(boolean include) {
        return new ParserConfig(indentation, decorators, new OutputConfig(include));
    }

    /**
     * Order in which stacked decorators are listed on a definition.
     */
    public enum DecoratorOrder {
        /** Top-most decorator first, as written. */
        SOURCE,
        /** Innermost decorator first, the order in which they are applied. */
        APPLICATION
    }

    /**
     * Indentation settings.
     *
     * @param tabWidth tab stop width used to expand tabs, must be positive
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IndentationConfig(
        @JsonProperty("tabWidth") Integer tabWidth
    ) {
        public IndentationConfig {
            if (tabWidth == null) {
                tabWidth = DEFAULT_TAB_WIDTH;
            } else if (tabWidth < 1) {
                throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
            }
        }
    }

    /**
     * Decorator association settings.
     *
     * @param order listing order of stacked decorators
     * @param allowBlankLines whether blank lines may separate decorators from the definition
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DecoratorConfig(
        @JsonProperty("order") DecoratorOrder order,
        @JsonProperty("allowBlankLines") Boolean allowBlankLines
    ) {
        public DecoratorConfig {
            order = order != null ? order : DecoratorOrder.SOURCE;
            allowBlankLines = allowBlankLines != null ? allowBlankLines : Boolean.TRUE;
        }
    }

    /**
     * Output settings.
     *
     * @param includeTokenIndices whether nodes carry start/end token indices and block member indices
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("includeTokenIndices") Boolean includeTokenIndices
    ) {
        public OutputConfig {
            includeTokenIndices = includeTokenIndices != null ? includeTokenIndices : Boolean.FALSE;
        }
    }
}
