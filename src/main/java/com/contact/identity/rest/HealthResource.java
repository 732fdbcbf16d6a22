package com.contact.identity.rest;

import com.contact.identity.api.ContactIdentifier;
import com.contact.identity.health.HealthStatus;
import com.contact.identity.rest.dto.HealthResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Liveness and dependency health at the service root.
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Health")
public class HealthResource {

    private final ContactIdentifier identifier;

    @Inject
    public HealthResource(ContactIdentifier identifier) {
        this.identifier = identifier;
    }

    @GET
    @Operation(summary = "Service health", description = "Aggregate of the store and memory health checks.")
    @APIResponse(responseCode = "200", description = "Service is up or degraded")
    @APIResponse(responseCode = "503", description = "A health check is down")
    public Response health() {
        HealthStatus health = identifier.health();
        Response.Status status = health.isDown()
                ? Response.Status.SERVICE_UNAVAILABLE : Response.Status.OK;
        return Response.status(status).entity(HealthResponse.from(health)).build();
    }
}
