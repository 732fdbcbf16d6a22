package com.contact.identity.rest;

import com.contact.identity.api.ContactIdentifier;
import com.contact.identity.api.ContactSummary;
import com.contact.identity.rest.dto.ErrorResponse;
import com.contact.identity.rest.dto.IdentifyResponse;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Read-only cluster lookup.
 */
@Path("/contacts")
@Produces(MediaType.APPLICATION_JSON)
@ApplicationScoped
@Tag(name = "Identity", description = "Reconcile contact identifiers into clusters")
public class ContactResource {
    private static final Logger log = LoggerFactory.getLogger(ContactResource.class);

    private final ContactIdentifier identifier;

    @Inject
    public ContactResource(ContactIdentifier identifier) {
        this.identifier = identifier;
    }

    /**
     * GET /contacts/{id}
     */
    @GET
    @Path("/{id}")
    @Operation(summary = "Look up a contact's cluster",
            description = "Returns the consolidated cluster containing the contact without modifying anything.")
    @APIResponse(responseCode = "200", description = "Consolidated contact cluster")
    @APIResponse(responseCode = "404", description = "No such contact")
    public Response getContact(@Parameter(description = "Contact id") @PathParam("id") long id) {
        String path = "/contacts/" + id;
        try {
            Optional<ContactSummary> summary = identifier.lookup(id);
            if (summary.isEmpty()) {
                return Response.status(Response.Status.NOT_FOUND)
                        .entity(ErrorResponse.notFound("Contact not found: " + id, path))
                        .build();
            }
            return Response.ok(IdentifyResponse.from(summary.get())).build();
        } catch (RuntimeException e) {
            log.error("lookup.failed contactId={} error={}", id, e.getMessage(), e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(ErrorResponse.internalError(
                            "An internal error occurred. Check server logs for details.", path))
                    .build();
        }
    }
}
