package me.christianrobert.py2lua.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.py2lua.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Read and change the transpiler configuration at runtime
 * (input/output paths, mapped API origins).
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
        log.info("Getting transpiler configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain at least one configuration entry"))
                    .build();
        }

        configService.updateConfiguration(config);
        return Response.ok(Map.of(
                "status", "success",
                "message", "Configuration saved (" + config.size() + " entries)"
        )).build();
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
        if (body == null || !body.containsKey("value") || body.get("value") == null) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain a non-null 'value' field"))
                    .build();
        }

        Object value = body.get("value");
        configService.setConfigValue(key, value);
        return Response.ok(Map.of("status", "success", "key", key, "value", value)).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        return Response.ok(Map.of(
                "status", "success",
                "message", "Configuration reset to defaults"
        )).build();
    }
}
