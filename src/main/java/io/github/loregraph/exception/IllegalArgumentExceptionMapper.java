package io.github.loregraph.exception;

import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Rejected arguments (blank queries, malformed paths, out-of-range bounds) become 400 problem responses.
 */
@Provider
public class IllegalArgumentExceptionMapper implements ExceptionMapper<IllegalArgumentException> {

    private static final Logger LOG = Logger.getLogger(IllegalArgumentExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final IllegalArgumentException exception) {
        final String path = uriInfo != null ? uriInfo.getPath() : null;
        LOG.debugf("Rejected request to %s: %s", path, exception.getMessage());

        return Response.status(Response.Status.BAD_REQUEST)
                .entity(new ErrorResponse(
                    "about:blank",
                    "Bad Request",
                    Response.Status.BAD_REQUEST.getStatusCode(),
                    exception.getMessage(),
                    path))
                .type("application/problem+json")
                .build();
    }
}
