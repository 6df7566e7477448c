package com.snailc.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.snailc.py.PyBytes;
import com.snailc.py.PyComplex;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Writes the value of a Python {@code Constant}.
 * JSON has no bytes, complex or infinite values, so those are written as tagged objects:
 * <pre>
 * {"_type": "bytes", "value": "ÿ"}      each char is one byte
 * {"_type": "complex", "real": 0.0, "imag": 2.0}
 * {"_type": "float", "value": "inf"}
 * </pre>
 */
public class PythonConstantSerializer extends JsonSerializer<Object> {
    @Override
    public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
        } else if (value instanceof Double d) {
            if (d.isInfinite() || d.isNaN()) {
                tagged(gen, "float");
                gen.writeStringField("value", d.isNaN() ? "nan" : d > 0 ? "inf" : "-inf");
                gen.writeEndObject();
            } else {
                gen.writeNumber(d);
            }
        } else if (value instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else if (value instanceof Boolean b) {
            gen.writeBoolean(b);
        } else if (value instanceof String s) {
            gen.writeString(s);
        } else if (value instanceof PyBytes bytes) {
            tagged(gen, "bytes");
            gen.writeStringField("value", bytes.latin1());
            gen.writeEndObject();
        } else if (value instanceof PyComplex complex) {
            tagged(gen, "complex");
            gen.writeNumberField("real", 0.0);
            gen.writeNumberField("imag", complex.imag());
            gen.writeEndObject();
        } else {
            gen.writeObject(value);
        }
    }

    private static void tagged(JsonGenerator gen, String type) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("_type", type);
    }
}
