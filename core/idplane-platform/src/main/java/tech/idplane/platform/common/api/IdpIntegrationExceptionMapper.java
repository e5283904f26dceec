package tech.idplane.platform.common.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.idplane.platform.idp.IdpIntegrationException;

/**
 * Answers 503 for admin API failures that escape a resource, such as during the login hand-off.
 */
@Provider
public class IdpIntegrationExceptionMapper implements ExceptionMapper<IdpIntegrationException> {

    private static final Logger LOG = Logger.getLogger(IdpIntegrationExceptionMapper.class);

    @Override
    public Response toResponse(IdpIntegrationException exception) {
        LOG.warnf("Authorization server call failed: %s", exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse("IDP_UNAVAILABLE", exception.getMessage(), exception.details()))
            .build();
    }
}
