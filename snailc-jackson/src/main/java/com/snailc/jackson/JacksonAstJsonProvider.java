package com.snailc.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.snailc.ast.Node;
import com.snailc.json.AstJsonException;
import com.snailc.json.AstJsonProvider;
import com.snailc.json.AstJsonSerializer;
import com.snailc.py.PyNode;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;

    public JacksonAstJsonProvider() {
        this.mapper = SnailJackson.createObjectMapper();
        this.serializer = new JacksonSerializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            return write(node, false, "Snail");
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            return write(node, true, "Snail");
        }

        @Override
        public String serialize(PyNode node) throws AstJsonException {
            return write(node, false, "Python");
        }

        @Override
        public String serializePretty(PyNode node) throws AstJsonException {
            return write(node, true, "Python");
        }

        private String write(Object node, boolean pretty, String language) {
            try {
                return pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : mapper.writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize " + language + " AST node", e);
            }
        }
    }
}
