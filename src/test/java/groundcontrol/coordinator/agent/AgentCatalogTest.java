package groundcontrol.coordinator.agent;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentCatalogTest {

    @Test
    void defaultsHaveFourAgents() {
        AgentCatalog catalog = AgentCatalog.withDefaults();

        assertEquals(List.of("architect", "developer", "product-manager", "reviewer"), catalog.names());
        AgentDefinition developer = catalog.get("developer");
        assertEquals("Senior Software Developer", developer.role());
        assertTrue(developer.capabilities().contains("write_code"));
        assertNull(developer.implementer());
        assertTrue(developer.systemPrompt().startsWith("# Senior Developer Agent"));
    }

    @Test
    void unknownAgent() {
        AgentCatalog catalog = AgentCatalog.withDefaults();

        assertTrue(catalog.find("designer").isEmpty());
        assertTrue(catalog.find(null).isEmpty());
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> catalog.get("designer"));
        assertTrue(e.getMessage().startsWith("Agent 'designer' not found"));
    }

    @Test
    void registerOverridesByName() {
        AgentCatalog catalog = AgentCatalog.withDefaults()
                .register(new AgentDefinition("developer", "Dev", "cursor_cli", null, "custom"));

        assertEquals("cursor_cli", catalog.get("developer").implementer());
        assertEquals(4, catalog.list().size());
    }
}
