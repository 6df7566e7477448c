package com.snailc.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.BeanPropertyWriter;
import com.fasterxml.jackson.databind.ser.BeanSerializerModifier;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.databind.util.NameTransformer;
import com.snailc.ast.Node;
import com.snailc.ast.SourceSpan;
import com.snailc.py.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Jackson module that configures serialization for the Snail and Python AST classes.
 *
 * This module handles:
 * - Replacing the nested span of Snail nodes with start/end offsets and a loc property
 * - Writing Python nodes the way the ast module names them (_type, snake_case, lineno...)
 * - Serializing operator and context singletons as field-less nodes
 * - Python constant values that JSON cannot express directly (bytes, complex, inf)
 */
public class AstModule extends SimpleModule {

    private static final String SPAN = "span";

    // Required ast fields the lowering never fills, with their constant values
    private static final Map<Class<?>, Map<String, Object>> PYTHON_DEFAULTS = Map.of(
        PyModule.class, Map.of("type_ignores", List.of()),
        PyStmt.FunctionDef.class, Map.of("decorator_list", List.of(), "type_params", List.of()),
        PyStmt.ClassDef.class, Map.of("bases", List.of(), "keywords", List.of(),
            "decorator_list", List.of(), "type_params", List.of()),
        PyArguments.class, Map.of("posonlyargs", List.of(), "kwonlyargs", List.of(), "kw_defaults", List.of()),
        PyComprehension.class, Map.of("is_async", 0)
    );

    // ast classes without position attributes
    private static final Set<Class<?>> UNPOSITIONED = Set.of(
        PyModule.class, PyArguments.class, PyComprehension.class, PyWithItem.class
    );

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.snailc", "snailc-jackson"));

        PyOperatorSerializer operators = new PyOperatorSerializer();
        addSerializer(ExprContext.class, operators);
        addSerializer(BoolOpKind.class, operators);
        addSerializer(Operator.class, operators);
        addSerializer(UnaryOpKind.class, operators);
        addSerializer(CmpOp.class, operators);
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Python nodes keep their null fields. Registered per concrete record
        // (mixin inheritance from interfaces may not work consistently across Java versions)
        registerPythonMixins(context, PyNode.class);
        context.setMixInAnnotations(PyExpr.Constant.class, ConstantMixin.class);

        context.addBeanSerializerModifier(new AstSerializerModifier());
    }

    private static void registerPythonMixins(SetupContext context, Class<?> type) {
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            if (type.isRecord()) {
                context.setMixInAnnotations(type, PythonNodeMixin.class);
            }
            return;
        }
        for (Class<?> sub : permitted) {
            registerPythonMixins(context, sub);
        }
    }

    // ==================== Serialization Mixins ====================

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private abstract static class PythonNodeMixin {
    }

    private abstract static class ConstantMixin extends PythonNodeMixin {
        @JsonSerialize(using = PythonConstantSerializer.class)
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract Object value();
    }

    // ==================== Serializer Modifier ====================

    private static class AstSerializerModifier extends BeanSerializerModifier {
        @Override
        public List<BeanPropertyWriter> changeProperties(SerializationConfig config,
                                                          BeanDescription beanDesc,
                                                          List<BeanPropertyWriter> beanProperties) {
            Class<?> beanClass = beanDesc.getBeanClass();
            boolean python = PyNode.class.isAssignableFrom(beanClass);
            if (!python && !Node.class.isAssignableFrom(beanClass)) {
                return beanProperties;
            }

            BeanPropertyWriter span = null;
            List<BeanPropertyWriter> fields = new ArrayList<>();
            for (BeanPropertyWriter prop : beanProperties) {
                if (SPAN.equals(prop.getName())) {
                    span = prop;
                } else {
                    fields.add(python ? prop.rename(PythonNames.INSTANCE) : prop);
                }
            }
            if (span == null) {
                return beanProperties;
            }
            BeanPropertyWriter position = span;

            // type first, then fields, then position
            List<BeanPropertyWriter> out = new ArrayList<>();
            out.add(new TypeWriter(span, python ? "_type" : "type"));
            out.addAll(fields);
            if (python) {
                Map<String, Object> defaults = PYTHON_DEFAULTS.getOrDefault(beanClass, Map.of());
                new TreeMap<>(defaults).forEach((name, value) -> out.add(new ConstantWriter(position, name, value)));
                if (!UNPOSITIONED.contains(beanClass)) {
                    out.add(new PythonPositionWriter(span));
                }
            } else {
                out.add(new SnailPositionWriter(span));
            }
            return out;
        }
    }

    /**
     * camelCase record components to the ast module's snake_case field names.
     */
    private static final class PythonNames extends NameTransformer {
        static final PythonNames INSTANCE = new PythonNames();

        @Override
        public String transform(String name) {
            if (name.equals("exceptionType")) {
                return "type";
            }
            StringBuilder sb = new StringBuilder(name.length() + 4);
            for (int i = 0; i < name.length(); i++) {
                char c = name.charAt(i);
                if (Character.isUpperCase(c)) {
                    sb.append('_').append(Character.toLowerCase(c));
                } else {
                    sb.append(c);
                }
            }
            return sb.toString();
        }

        @Override
        public String reverse(String transformed) {
            return null;
        }
    }

    // ==================== Virtual Properties ====================
    // Each wraps the span writer so Jackson sees a fully initialized property.

    /**
     * Writes the node type name.
     */
    private static class TypeWriter extends BeanPropertyWriter {
        TypeWriter(BeanPropertyWriter span, String name) {
            super(span, new SerializedString(name));
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            String type = bean instanceof PyNode py ? py.type() : ((Node) bean).type();
            gen.writeStringField(getName(), type);
        }
    }

    /**
     * Writes start/end offsets and a loc object with 1-based lines and 0-based columns.
     */
    private static class SnailPositionWriter extends BeanPropertyWriter {
        SnailPositionWriter(BeanPropertyWriter span) {
            super(span);
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            SourceSpan span = (SourceSpan) get(bean);
            if (span == null) {
                return;
            }
            gen.writeNumberField("start", span.start());
            gen.writeNumberField("end", span.end());
            gen.writeFieldName("loc");
            prov.defaultSerializeValue(span.loc(), gen);
        }
    }

    /**
     * Writes lineno, col_offset, end_lineno and end_col_offset. Synthesized nodes
     * without a position are placed on line 1.
     */
    private static class PythonPositionWriter extends BeanPropertyWriter {
        PythonPositionWriter(BeanPropertyWriter span) {
            super(span, new SerializedString("lineno"));
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws Exception {
            SourceSpan span = (SourceSpan) get(bean);
            if (span == null) {
                span = SourceSpan.NONE;
            }
            int line = Math.max(1, span.startLine());
            int endLine = Math.max(line, span.endLine());
            int endCol = endLine == line ? Math.max(span.startCol(), span.endCol()) : span.endCol();
            gen.writeNumberField("lineno", line);
            gen.writeNumberField("col_offset", span.startCol());
            gen.writeNumberField("end_lineno", endLine);
            gen.writeNumberField("end_col_offset", endCol);
        }
    }

    private static class ConstantWriter extends BeanPropertyWriter {
        private final Object value;

        ConstantWriter(BeanPropertyWriter span, String name, Object value) {
            super(span, new SerializedString(name));
            this.value = value;
        }

        @Override
        public void serializeAsField(Object bean, JsonGenerator gen, SerializerProvider prov) throws IOException {
            prov.defaultSerializeField(getName(), value, gen);
        }
    }

    // ==================== Operators ====================

    /**
     * Operators and expression contexts are field-less ast nodes: {@code {"_type": "Add"}}.
     */
    private static class PyOperatorSerializer extends StdSerializer<PyOperator> {
        PyOperatorSerializer() {
            super(PyOperator.class);
        }

        @Override
        public void serialize(PyOperator value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("_type", value.type());
            gen.writeEndObject();
        }
    }
}
