package com.snailc.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.snailc.CompileMode;
import com.snailc.CompileOptions;
import com.snailc.Parser;
import com.snailc.SnailCompiler;
import com.snailc.ast.Program;
import com.snailc.ast.SourceSpan;
import com.snailc.py.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AstModuleTest {

    private final ObjectMapper mapper = SnailJackson.createObjectMapper();

    private JsonNode snail(String source) throws Exception {
        Program program = Parser.parse(source);
        return mapper.readTree(mapper.writeValueAsString(program));
    }

    private JsonNode python(String source) throws Exception {
        PyModule module = SnailCompiler.compile(source).module();
        return mapper.readTree(mapper.writeValueAsString(module));
    }

    // ==================== Snail tree ====================

    @Test
    void testSnailNodesCarryTypeAndOffsets() throws Exception {
        JsonNode program = snail("x = 1");
        assertEquals("Program", program.get("type").asText());
        assertFalse(program.has("span"));

        JsonNode assign = program.get("body").get(0);
        assertEquals("AssignStatement", assign.get("type").asText());
        assertEquals(0, assign.get("start").asInt());
        assertEquals(5, assign.get("end").asInt());
        assertEquals(1, assign.get("loc").get("start").get("line").asInt());
        assertEquals(0, assign.get("loc").get("start").get("column").asInt());

        JsonNode target = assign.get("targets").get(0);
        assertEquals("NameTarget", target.get("type").asText());
        assertEquals("x", target.get("name").asText());
    }

    @Test
    void testSnailTypeComesFirst() throws Exception {
        String json = mapper.writeValueAsString(Parser.parse("y"));
        assertTrue(json.startsWith("{\"type\":\"Program\""), json);
    }

    @Test
    void testSnailNullFieldsAreOmitted() throws Exception {
        JsonNode ret = snail("def f() {\n  return\n}").get("body").get(0).get("body").get(0);
        assertEquals("ReturnStatement", ret.get("type").asText());
        assertFalse(ret.has("value"));
    }

    @Test
    void testReservedNamesKeepDollar() throws Exception {
        Program program = Parser.parse("{ print($n) }", CompileOptions.of(CompileMode.AWK));
        String json = mapper.writeValueAsString(program);
        assertTrue(json.contains("\"name\":\"$n\""), json);
    }

    // ==================== Python tree ====================

    @Test
    void testPythonNodesUseAstNames() throws Exception {
        JsonNode module = python("print(x)");
        assertEquals("Module", module.get("_type").asText());
        assertTrue(module.get("type_ignores").isArray());
        assertFalse(module.has("lineno"));

        JsonNode call = module.get("body").get(0).get("value");
        assertEquals("Call", call.get("_type").asText());
        JsonNode func = call.get("func");
        assertEquals("Name", func.get("_type").asText());
        assertEquals("print", func.get("id").asText());
        assertEquals("Load", func.get("ctx").get("_type").asText());
        assertEquals(1, func.get("lineno").asInt());
        assertEquals(0, func.get("col_offset").asInt());
        assertEquals(1, func.get("end_lineno").asInt());
        assertEquals(5, func.get("end_col_offset").asInt());
        assertTrue(call.get("keywords").isArray());
    }

    @Test
    void testSnakeCaseFieldNames() throws Exception {
        JsonNode with = python("with open(p) as f {\n  pass\n}").get("body").get(0);
        assertEquals("With", with.get("_type").asText());
        JsonNode item = with.get("items").get(0);
        assertEquals("withitem", item.get("_type").asText());
        assertTrue(item.has("context_expr"));
        assertEquals("Store", item.get("optional_vars").get("ctx").get("_type").asText());
        assertFalse(item.has("lineno"));
    }

    @Test
    void testFunctionDefDefaults() throws Exception {
        JsonNode def = python("def f(a) {\n  a\n}").get("body").get(0);
        assertEquals("FunctionDef", def.get("_type").asText());
        assertTrue(def.get("decorator_list").isEmpty());
        assertTrue(def.get("type_params").isEmpty());
        JsonNode args = def.get("args");
        assertEquals("arguments", args.get("_type").asText());
        assertTrue(args.get("posonlyargs").isEmpty());
        assertTrue(args.get("kw_defaults").isEmpty());
        assertTrue(args.get("vararg").isNull());
        assertEquals("a", args.get("args").get(0).get("arg").asText());
    }

    @Test
    @DisplayName("None constants and absent optionals serialize as null")
    void testPythonNullsArePresent() throws Exception {
        JsonNode assign = python("x = None").get("body").get(0);
        JsonNode constant = assign.get("value");
        assertEquals("Constant", constant.get("_type").asText());
        assertTrue(constant.has("value"));
        assertTrue(constant.get("value").isNull());
    }

    @Test
    void testOperatorsAreFieldlessNodes() throws Exception {
        JsonNode binop = python("x = a + 1").get("body").get(0).get("value");
        assertEquals("BinOp", binop.get("_type").asText());
        assertEquals("Add", binop.get("op").get("_type").asText());
        assertEquals(1, binop.get("op").size());
        assertEquals(1, binop.get("right").get("value").asInt());
    }

    @Test
    void testExceptHandlerTypeField() throws Exception {
        JsonNode handler = python("try {\n  x\n} except ValueError as e {\n  pass\n}")
            .get("body").get(0).get("handlers").get(0);
        assertEquals("ExceptHandler", handler.get("_type").asText());
        assertEquals("ValueError", handler.get("type").get("id").asText());
        assertEquals("e", handler.get("name").asText());
    }

    @Test
    void testSynthesizedNodesAreOnFirstLine() throws Exception {
        PyModule module = new PyModule(SourceSpan.NONE, List.of(Py.pass(SourceSpan.NONE)));
        JsonNode pass = mapper.readTree(mapper.writeValueAsString(module)).get("body").get(0);
        assertEquals(1, pass.get("lineno").asInt());
        assertEquals(1, pass.get("end_lineno").asInt());
    }

    // ==================== Constants ====================

    private JsonNode constantValue(Object value) throws Exception {
        JsonNode node = mapper.readTree(mapper.writeValueAsString(Py.constant(SourceSpan.NONE, value)));
        return node.get("value");
    }

    @Test
    void testPlainConstants() throws Exception {
        assertEquals("hi", constantValue("hi").asText());
        assertTrue(constantValue(true).asBoolean());
        assertEquals(1.5, constantValue(1.5).asDouble());
        assertEquals("123456789012345678901234567890",
            constantValue(new java.math.BigInteger("123456789012345678901234567890")).bigIntegerValue().toString());
    }

    @Test
    void testTaggedConstants() throws Exception {
        JsonNode inf = constantValue(Double.POSITIVE_INFINITY);
        assertEquals("float", inf.get("_type").asText());
        assertEquals("inf", inf.get("value").asText());

        assertEquals("nan", constantValue(Double.NaN).get("value").asText());

        JsonNode bytes = constantValue(new PyBytes("ab"));
        assertEquals("bytes", bytes.get("_type").asText());
        assertEquals("ab", bytes.get("value").asText());

        JsonNode complex = constantValue(new PyComplex(2.0));
        assertEquals("complex", complex.get("_type").asText());
        assertEquals(0.0, complex.get("real").asDouble());
        assertEquals(2.0, complex.get("imag").asDouble());
    }
}
