package tech.idplane.serviceaccount.operations;

import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.idp.IdpIntegrationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds {@link UseCaseError.RemoteIntegrationError}s from failed admin API calls.
 */
public final class RemoteFailures {

    private RemoteFailures() {
    }

    public static UseCaseError.RemoteIntegrationError of(
            String code, String clientId, IdpIntegrationException e, boolean localChangesKept) {
        Map<String, Object> details = new LinkedHashMap<>(e.details());
        details.put("clientId", clientId);
        details.put("localChangesKept", localChangesKept);
        return new UseCaseError.RemoteIntegrationError(code, e.getMessage(), details);
    }
}
