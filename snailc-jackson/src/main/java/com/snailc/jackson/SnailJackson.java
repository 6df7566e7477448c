package com.snailc.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SnailJackson.createObjectMapper();
 * String snailJson = mapper.writeValueAsString(program);
 * String pythonJson = mapper.writeValueAsString(result.module());
 * </pre>
 */
public final class SnailJackson {

    private SnailJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization.
     *
     * The returned mapper:
     * - Serializes Snail nodes with type, start, end and loc (instead of a nested span)
     * - Serializes Python nodes in the shape of the ast module (_type, snake_case fields, lineno...)
     * - Keeps null fields of Python nodes, which the ast module expects to be present
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Configure serialization - exclude null values by default
        // Python nodes opt back in via the mixin registered in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
