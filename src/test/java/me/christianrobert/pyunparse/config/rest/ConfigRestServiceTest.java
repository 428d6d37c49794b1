package me.christianrobert.pyunparse.config.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.pyunparse.config.service.ConfigService;
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
    void validIndentIsStored() {
        Response response = restService.setConfigValue(ConfigService.INDENT_WITH, Map.of("value", "\t"));

        assertEquals(200, response.getStatus());
        assertEquals("\t", configService.getIndentWith());
    }

    @Test
    void invalidIndentIsRejected() {
        Response response = restService.setConfigValue(ConfigService.INDENT_WITH, Map.of("value", "ab"));

        assertEquals(400, response.getStatus());
        assertEquals("    ", configService.getIndentWith());
    }

    @Test
    void lineInformationMustBeBoolean() {
        Map<String, Object> config = new HashMap<>();
        config.put(ConfigService.ADD_LINE_INFORMATION, "yes");

        Response response = restService.saveConfiguration(config);

        assertEquals(400, response.getStatus());
        assertFalse(configService.isAddLineInformation());
    }

    @Test
    void unknownKeyReturnsNotFound() {
        assertEquals(404, restService.getConfigValue("missing").getStatus());
    }

    @Test
    void missingValueFieldIsBadRequest() {
        assertEquals(400, restService.setConfigValue(ConfigService.INDENT_WITH, Map.of()).getStatus());
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.ADD_LINE_INFORMATION, true);

        assertEquals(200, restService.resetConfiguration().getStatus());
        assertFalse(configService.isAddLineInformation());
    }

    @Test
    void validateAcceptsOtherKeysAsIs() {
        assertNull(ConfigRestService.validate("something.else", 42));
        assertNull(ConfigRestService.validate(ConfigService.INDENT_WITH, "  \t"));
        assertNotNull(ConfigRestService.validate(ConfigService.INDENT_WITH, ""));
    }
}
