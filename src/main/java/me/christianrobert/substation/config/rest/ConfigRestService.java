package me.christianrobert.substation.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.substation.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * REST endpoint for the compiler settings (validation and parser flags).
 *
 * <p>Only keys that exist in the defaults can be changed; unknown keys are rejected so a
 * typo such as {@code validation.strict} does not silently do nothing.</p>
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
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain at least one setting"))
                    .build();
        }
        log.info("Saving configuration with {} entries", config.size());

        List<String> unknownKeys = config.keySet().stream()
                .filter(key -> !configService.hasConfigKey(key))
                .sorted()
                .collect(Collectors.toList());
        if (!unknownKeys.isEmpty()) {
            log.warn("Rejected unknown configuration keys: {}", unknownKeys);
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Unknown configuration keys: " + unknownKeys))
                    .build();
        }

        if (config.values().stream().anyMatch(Objects::isNull)) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Configuration values must not be null"))
                    .build();
        }

        configService.updateConfiguration(config);

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration saved successfully");
        return Response.ok(response).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return notFound(key);
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (!configService.hasConfigKey(key)) {
            return notFound(key);
        }
        if (body == null || body.get("value") == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain a non-null 'value' field"))
                    .build();
        }

        Object value = body.get("value");
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

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration reset to defaults successfully");
        return Response.ok(response).build();
    }

    private static Response notFound(String key) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("error", "Configuration key not found: " + key))
                .build();
    }
}
