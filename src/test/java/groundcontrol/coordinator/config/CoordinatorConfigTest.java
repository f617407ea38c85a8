package groundcontrol.coordinator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorConfigTest {

    @Test
    void defaults() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(3, config.maxParallel());
        assertEquals(Duration.ofMillis(500), config.pollInterval());
        assertEquals("claude_code", config.defaultImplementer());
        assertEquals("developer", config.defaultAgent());
        assertEquals(Duration.ofSeconds(600), config.implementerTimeout());
        assertTrue(config.databaseUrl().startsWith("jdbc:h2:"));
    }

    @Test
    void maxParallelBounds() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertEquals(1, config.withMaxParallel(1).maxParallel());
        assertEquals(20, config.withMaxParallel(20).maxParallel());
        assertThrows(IllegalArgumentException.class, () -> config.withMaxParallel(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxParallel(21));
    }

    @Test
    void rejectsInvalidDurations() {
        CoordinatorConfig config = CoordinatorConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.withPollInterval(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> config.withImplementerTimeout(Duration.ZERO));
        assertEquals(Duration.ZERO, config.withPollInterval(Duration.ZERO).pollInterval());
    }
}
