package me.christianrobert.substation.config.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.substation.config.service.ConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigRestServiceTest {

    private ConfigService configService;
    private ConfigRestService restService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        restService = new ConfigRestService();
        restService.configService = configService;
    }

    @Test
    void getConfigurationReturnsAllSettings() {
        Response response = restService.getConfiguration();

        assertEquals(200, response.getStatus());
        assertEquals(configService.getAllConfiguration(), response.getEntity());
    }

    @Test
    void saveConfigurationUpdatesKnownKeys() {
        Response response = restService.saveConfiguration(Map.of(ConfigService.VALIDATION_ALWAYS, true));

        assertEquals(200, response.getStatus());
        assertTrue(configService.isEnabled(ConfigService.VALIDATION_ALWAYS, false));
    }

    @Test
    void saveConfigurationRejectsUnknownKeys() {
        Response response = restService.saveConfiguration(Map.of(
                ConfigService.VALIDATION_ALWAYS, true,
                "validation.strict", true));

        assertEquals(400, response.getStatus());
        assertEquals(Map.of("error", "Unknown configuration keys: [validation.strict]"), response.getEntity());
        assertFalse(configService.isEnabled(ConfigService.VALIDATION_ALWAYS, false), "Nothing should be applied");
    }

    @Test
    void saveConfigurationRejectsEmptyBody() {
        assertEquals(400, restService.saveConfiguration(null).getStatus());
        assertEquals(400, restService.saveConfiguration(Map.of()).getStatus());
    }

    @Test
    void saveConfigurationRejectsNullValues() {
        Map<String, Object> config = new HashMap<>();
        config.put(ConfigService.VALIDATION_ALWAYS, null);

        assertEquals(400, restService.saveConfiguration(config).getStatus());
    }

    @Test
    void getConfigValue() {
        Response response = restService.getConfigValue(ConfigService.PARSER_TWO_STAGE);

        assertEquals(200, response.getStatus());
        assertEquals(Map.of("key", ConfigService.PARSER_TWO_STAGE, "value", true), response.getEntity());
    }

    @Test
    void getUnknownConfigValueIsNotFound() {
        assertEquals(404, restService.getConfigValue("no.such.key").getStatus());
    }

    @Test
    void setConfigValue() {
        Response response = restService.setConfigValue(ConfigService.VALIDATION_STRICT_REFERENCES,
                Map.of("value", true));

        assertEquals(200, response.getStatus());
        assertTrue(configService.isEnabled(ConfigService.VALIDATION_STRICT_REFERENCES, false));
    }

    @Test
    void setConfigValueValidatesKeyAndBody() {
        assertEquals(404, restService.setConfigValue("no.such.key", Map.of("value", true)).getStatus());
        assertEquals(400, restService.setConfigValue(ConfigService.VALIDATION_ALWAYS, Map.of()).getStatus());
        assertEquals(400, restService.setConfigValue(ConfigService.VALIDATION_ALWAYS, null).getStatus());
    }

    @Test
    void resetConfiguration() {
        configService.setConfigValue(ConfigService.VALIDATION_ALWAYS, true);

        Response response = restService.resetConfiguration();

        assertEquals(200, response.getStatus());
        assertFalse(configService.isEnabled(ConfigService.VALIDATION_ALWAYS, true));
    }
}
