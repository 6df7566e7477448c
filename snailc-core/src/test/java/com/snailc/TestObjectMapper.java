package com.snailc;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.snailc.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Test utility that dumps Snail ASTs as JSON without source positions, so two trees can be
 * compared by shape. Kept separate from snailc-jackson to avoid a cyclic test dependency.
 */
public class TestObjectMapper {

    private static ObjectMapper instance;

    public static synchronized ObjectMapper get() {
        if (instance == null) {
            instance = createObjectMapper();
        }
        return instance;
    }

    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Node class names stand in for the type property
        mapper.addMixIn(Node.class, NodeMixin.class);
        mapper.addMixIn(Statement.class, NodeMixin.class);
        mapper.addMixIn(Expression.class, NodeMixin.class);
        mapper.addMixIn(AssignTarget.class, NodeMixin.class);
        mapper.addMixIn(Condition.class, NodeMixin.class);
        mapper.addMixIn(FStringPart.class, NodeMixin.class);

        SimpleModule module = new SimpleModule("TestAstModule");
        module.setSerializerModifier(new DropSpanModifier());
        mapper.registerModule(module);
        return mapper;
    }

    /**
     * Shape of a tree as a JSON string, spans removed.
     */
    public static String shape(Object node) {
        try {
            return get().writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to dump AST", e);
        }
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.CLASS, include = JsonTypeInfo.As.PROPERTY, property = "node")
    private abstract static class NodeMixin {
    }

    private static class DropSpanModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            List<BeanPropertyWriter> filtered = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (!"span".equals(prop.getName())) {
                    filtered.add(prop);
                }
            }
            return filtered;
        }
    }
}
