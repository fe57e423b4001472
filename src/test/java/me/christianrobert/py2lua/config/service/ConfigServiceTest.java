package me.christianrobert.py2lua.config.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigServiceTest {

    @Test
    void defaultsWithoutEnvironment() {
        ConfigService config = new ConfigService(Map.of());

        assertEquals("transpiler_in.json", config.getConfigValueAsString(ConfigService.IN_FILE));
        assertEquals("transpiler_out.lua", config.getConfigValueAsString(ConfigService.OUT_FILE));
        assertEquals(List.of("cc_lib"), config.getConfigValueAsStringList(ConfigService.API_ORIGINS));
        assertFalse(config.getConfigValueAsBoolean(ConfigService.RUN_ON_START));
    }

    @Test
    void environmentOverridesPaths() {
        ConfigService config = new ConfigService(Map.of(
                "in_file", "/data/tree.json",
                "out_file", "/data/out.lua",
                "run_on_start", "true"));

        assertEquals("/data/tree.json", config.getConfigValueAsString(ConfigService.IN_FILE));
        assertEquals("/data/out.lua", config.getConfigValueAsString(ConfigService.OUT_FILE));
        assertTrue(config.getConfigValueAsBoolean(ConfigService.RUN_ON_START));
    }

    @Test
    void stringListTrimsAndSkipsEmptyEntries() {
        ConfigService config = new ConfigService(Map.of());
        config.setConfigValue(ConfigService.API_ORIGINS, " cc_lib, ,cc_extra ,");

        assertEquals(List.of("cc_lib", "cc_extra"), config.getConfigValueAsStringList(ConfigService.API_ORIGINS));
    }

    @Test
    void stringListFromCollectionValue() {
        ConfigService config = new ConfigService(Map.of());
        config.setConfigValue(ConfigService.API_ORIGINS, List.of(" cc_lib", "cc_extra ", ""));

        assertEquals(List.of("cc_lib", "cc_extra"), config.getConfigValueAsStringList(ConfigService.API_ORIGINS));
    }

    @Test
    void booleanFromString() {
        ConfigService config = new ConfigService(Map.of());
        config.setConfigValue(ConfigService.RUN_ON_START, "true");

        assertTrue(config.getConfigValueAsBoolean(ConfigService.RUN_ON_START));
        assertNull(config.getConfigValueAsBoolean("unknown.key"));
    }

    @Test
    void resetRestoresEnvironmentDefaults() {
        ConfigService config = new ConfigService(Map.of("in_file", "env.json"));
        config.updateConfiguration(Map.of(ConfigService.IN_FILE, "changed.json", "custom.key", 42));

        assertEquals("changed.json", config.getConfigValueAsString(ConfigService.IN_FILE));
        assertTrue(config.hasConfigKey("custom.key"));

        config.resetToDefaults();

        assertEquals("env.json", config.getConfigValueAsString(ConfigService.IN_FILE));
        assertFalse(config.hasConfigKey("custom.key"));
    }

    @Test
    void allConfigurationIsACopy() {
        ConfigService config = new ConfigService(Map.of());
        config.getAllConfiguration().put(ConfigService.IN_FILE, "mutated.json");

        assertEquals("transpiler_in.json", config.getConfigValueAsString(ConfigService.IN_FILE));
    }
}
