package com.snailc.jackson;

import com.snailc.SnailCompiler;
import com.snailc.Parser;
import com.snailc.json.AstJsonProvider;
import com.snailc.json.AstJsonSerializer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
    }

    @Test
    void testProviderByNameIgnoresCase() {
        assertInstanceOf(JacksonAstJsonProvider.class, AstJsonProvider.getProvider("jackson"));
    }

    @Test
    void testUnknownProviderName() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> AstJsonProvider.getProvider("gson"));
        assertTrue(e.getMessage().contains("'gson'"));
    }

    @Test
    void testSerializeBothTrees() throws Exception {
        AstJsonSerializer serializer = AstJsonProvider.getProvider().getSerializer();
        String snail = serializer.serialize(Parser.parse("x = 1"));
        assertTrue(snail.contains("\"type\":\"AssignStatement\""), snail);

        String python = serializer.serialize(SnailCompiler.compile("x = 1").module());
        assertTrue(python.contains("\"_type\":\"Assign\""), python);
    }

    @Test
    void testPrettyOutputIsIndented() throws Exception {
        AstJsonSerializer serializer = new JacksonAstJsonProvider().getSerializer();
        String pretty = serializer.serializePretty(Parser.parse("x = 1"));
        assertTrue(pretty.contains("\n"), pretty);
    }
}
