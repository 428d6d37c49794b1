package me.christianrobert.pyunparse.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.pyunparse.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * REST endpoint for reading and changing the generator defaults.
 *
 * <p>Usage:
 * <pre>
 * curl http://localhost:8080/api/config
 * curl -X PUT http://localhost:8080/api/config/generator.indent-with \
 *   -H "Content-Type: application/json" --data '{"value": "  "}'
 * </pre>
 *
 * <p>Values of the known generator keys are validated before they are stored: the indentation
 * unit must be a non-empty run of spaces or tabs, the line annotation toggle a boolean.</p>
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return badRequest("Request body must contain at least one configuration entry");
        }
        log.info("Saving configuration with {} entries", config.size());

        for (Map.Entry<String, Object> entry : config.entrySet()) {
            String problem = validate(entry.getKey(), entry.getValue());
            if (problem != null) {
                log.warn("Rejected configuration entry {}: {}", entry.getKey(), problem);
                return badRequest(problem);
            }
        }

        configService.updateConfiguration(config);
        return success("Configuration saved successfully");
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return badRequest("Request body must contain 'value' field");
        }

        Object value = body.get("value");
        String problem = validate(key, value);
        if (problem != null) {
            log.warn("Rejected value for {}: {}", key, problem);
            return badRequest(problem);
        }

        configService.setConfigValue(key, value);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);
        response.put("value", value);
        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return success("Configuration reset to defaults successfully");
    }

    /**
     * @return Problem description, or null when the value is acceptable for the key
     */
    static String validate(String key, Object value) {
        if (ConfigService.INDENT_WITH.equals(key)) {
            if (!(value instanceof String) || ((String) value).isEmpty()
                    || !((String) value).chars().allMatch(c -> c == ' ' || c == '\t')) {
                return key + " must be a non-empty string of spaces or tabs";
            }
        } else if (ConfigService.ADD_LINE_INFORMATION.equals(key)) {
            if (!(value instanceof Boolean)) {
                return key + " must be true or false";
            }
        }
        return null;
    }

    private static Response success(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", message);
        return Response.ok(response).build();
    }

    private static Response badRequest(String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return Response.status(Response.Status.BAD_REQUEST).entity(response).build();
    }
}
