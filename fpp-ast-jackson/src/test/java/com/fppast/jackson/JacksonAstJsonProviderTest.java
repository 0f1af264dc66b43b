package com.fppast.jackson;

import com.fppast.TranslationSession;
import com.fppast.ast.DefConstant;
import com.fppast.ast.DefModule;
import com.fppast.ast.ExprLiteralInt;
import com.fppast.ast.ModuleMember;
import com.fppast.ast.TransUnit;
import com.fppast.json.AstJsonException;
import com.fppast.json.AstJsonProvider;
import com.fppast.loc.Location;
import com.fppast.loc.LocationRegistry;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonAstJsonProviderTest {

    private static Path fixture(String name) throws Exception {
        return Paths.get(JacksonAstJsonProviderTest.class.getResource("/fixtures/" + name).toURI());
    }

    @Test
    void testProviderIsDiscovered() {
        assertTrue(AstJsonProvider.isProviderAvailable());
        AstJsonProvider provider = AstJsonProvider.getProvider();
        assertInstanceOf(JacksonAstJsonProvider.class, provider);
        assertEquals("Jackson", provider.getName());
        assertSame(provider.getClass(), AstJsonProvider.getProvider("jackson").getClass());
    }

    @Test
    void testTranslateFixtureFiles() throws Exception {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        LocationRegistry registry = new LocationRegistry();
        provider.getLocationMapReader().load(fixture("locations.json"), registry);
        TranslationSession session = TranslationSession.create(registry);

        List<TransUnit> units = provider.getDeserializer().deserializeTransUnits(fixture("ast.json"), session);

        DefModule module = (DefModule) units.get(0).members().get(0).node().value().data();
        ModuleMember constant = module.members().get(0);
        assertEquals(List.of("A constant"), constant.node().preAnnotation());
        DefConstant c = (DefConstant) constant.node().value().data();
        assertEquals(new ExprLiteralInt("3"), c.value().data());

        Location loc = registry.get(constant.node().value().id());
        assertEquals(Path.of("a.fpp"), loc.file());
        assertEquals("1:1", loc.pos());
        assertEquals(6, session.nextId());
    }

    @Test
    void testSerializeWritesVariantTags() throws Exception {
        AstJsonProvider provider = new JacksonAstJsonProvider();
        List<TransUnit> units = provider.getDeserializer()
            .deserializeTransUnits(fixture("ast.json"), TranslationSession.create());

        String json = provider.getSerializer().serialize(units.get(0));

        assertTrue(json.contains("\"DefModule\""));
        assertTrue(json.contains("\"DefConstant\""));
        assertTrue(json.contains("\"ExprLiteralInt\""));
        assertTrue(json.contains("\"name\":\"M\""));
        assertTrue(provider.getSerializer().serializePretty(units.get(0)).contains(System.lineSeparator()));
    }

    @Test
    void testMalformedDocumentIsWrapped() {
        AstJsonProvider provider = new JacksonAstJsonProvider();

        assertThrows(AstJsonException.class,
            () -> provider.getDeserializer().deserializeTransUnits("[{\"members\": [", TranslationSession.create()));
    }
}
