package win.ixuni.strata.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentQualifierTest {

    @Test
    @DisplayName("Missing qualifier defaults to Development")
    void defaultQualifier() {
        assertAll(
                () -> assertEquals("app-Development", EnvironmentQualifier.qualify("app", null)),
                () -> assertEquals("app-Development", EnvironmentQualifier.qualify("app", "  ")),
                () -> assertEquals("Development", UnitOfWorkOptions.builder().build().getQualifier())
        );
    }

    @Test
    @DisplayName("Configured qualifier is trimmed and appended")
    void configuredQualifier() {
        assertEquals("app-Staging", EnvironmentQualifier.qualify("app", " Staging "));
    }

    @Test
    @DisplayName("Qualifier is read from a supplied environment")
    void fromEnvironment() {
        assertEquals("Production",
                EnvironmentQualifier.fromEnvironment(Map.of(EnvironmentQualifier.VARIABLE, "Production")));
        assertEquals("Development", EnvironmentQualifier.fromEnvironment(Map.of()));
    }
}
