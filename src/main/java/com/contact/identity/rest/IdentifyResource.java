package com.contact.identity.rest;

import com.contact.identity.api.ContactIdentifier;
import com.contact.identity.api.IdentifyRequest;
import com.contact.identity.api.IdentifyResult;
import com.contact.identity.api.InvalidRequestException;
import com.contact.identity.rest.dto.ErrorResponse;
import com.contact.identity.rest.dto.IdentifyRequestBody;
import com.contact.identity.rest.dto.IdentifyResponse;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /identify}: reconciles an email and/or phone number against
 * stored contacts and returns the consolidated identity.
 */
@Path("/identify")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Identity", description = "Reconcile contact identifiers into clusters")
public class IdentifyResource {
    private static final Logger log = LoggerFactory.getLogger(IdentifyResource.class);
    private static final String PATH = "/identify";

    private final ContactIdentifier identifier;

    @Inject
    public IdentifyResource(ContactIdentifier identifier) {
        this.identifier = identifier;
    }

    @POST
    @Operation(summary = "Identify a contact",
            description = "Matches the supplied identifiers, merges clusters they join, records new " +
                    "information as a secondary contact and returns the consolidated cluster.")
    @APIResponse(responseCode = "200", description = "Consolidated contact cluster")
    @APIResponse(responseCode = "400", description = "No identifier supplied, or a field is not a string")
    @APIResponse(responseCode = "500", description = "Store failure or inconsistent stored data")
    public Response identify(JsonNode body) {
        IdentifyRequest request;
        try {
            request = IdentifyRequestBody.from(body);
        } catch (InvalidRequestException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), PATH))
                    .build();
        }

        try {
            IdentifyResult result = identifier.identify(request);
            return Response.ok(IdentifyResponse.from(result.contact())).build();
        } catch (InvalidRequestException e) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(ErrorResponse.badRequest(e.getMessage(), PATH))
                    .build();
        } catch (RuntimeException e) {
            log.error("identify.request.failed error={}", e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.", PATH))
                    .build();
        }
    }
}
