package tech.idplane.platform.authentication.flow;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import tech.idplane.platform.audit.AuditContext;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.api.ApiErrors;
import tech.idplane.platform.common.api.ErrorResponse;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.RemoteClient;
import tech.idplane.platform.idp.challenge.AcceptConsent;
import tech.idplane.platform.idp.challenge.AcceptLogin;
import tech.idplane.platform.idp.challenge.CompletedRequest;
import tech.idplane.platform.idp.challenge.ConsentRequest;
import tech.idplane.platform.idp.challenge.LoginRequest;
import tech.idplane.platform.idp.challenge.LogoutRequest;
import tech.idplane.platform.idp.challenge.RejectRequest;
import tech.idplane.user.operations.UserOperations;
import tech.idplane.user.operations.authenticate.UserAuthenticated;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Browser hand-off endpoints the authorization server redirects to.
 *
 * <p>A login challenge is accepted straight away when the server already knows the
 * subject (skip). Otherwise its details are returned as JSON and the login UI posts
 * the user's email and password back; a correct password accepts the challenge with
 * the user id as subject. Consent is granted automatically when the server or the
 * client allows skipping it.
 *
 * <p>Admin API failures surface as 503 through the integration exception mapper.
 */
@Path("/oauth2")
@Tag(name = "OAuth2 Flow", description = "Login, consent and logout challenge hand-off")
@Produces(MediaType.APPLICATION_JSON)
public class LoginFlowResource {

    private static final Logger LOG = Logger.getLogger(LoginFlowResource.class);

    static final int REMEMBER_FOR_SECONDS = 3600;

    /**
     * Session length when the user ticks "remember me" on the login form.
     */
    static final int REMEMBERED_LOGIN_SECONDS = 86400;

    @Inject
    IdpAdminClient idpClient;

    @Inject
    UserOperations userOperations;

    @Inject
    AuditContext auditContext;

    // ==================== Login ====================

    @GET
    @Path("/login")
    @Operation(summary = "Handle a login challenge")
    @APIResponses({
        @APIResponse(responseCode = "303", description = "Session remembered, login accepted"),
        @APIResponse(responseCode = "200", description = "Login needs interaction, challenge details returned"),
        @APIResponse(responseCode = "422", description = "Missing login_challenge")
    })
    public Response login(@QueryParam("login_challenge") String challenge) {
        if (challenge == null || challenge.isBlank()) {
            return missingChallenge("login_challenge");
        }
        LoginRequest request = idpClient.getLoginRequest(challenge);
        if (request.skip()) {
            CompletedRequest completed = idpClient.acceptLoginRequest(challenge,
                new AcceptLogin(request.subject(), Boolean.TRUE, REMEMBER_FOR_SECONDS));
            LOG.debugf("Login challenge for subject %s accepted without interaction", request.subject());
            return redirect(completed);
        }
        return Response.ok(new ChallengeResponse(
            challenge,
            false,
            request.subject(),
            clientId(request.client()),
            clientName(request.client()),
            request.requestedScope()
        )).build();
    }

    @POST
    @Path("/login")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Sign in with email and password")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Login accepted, redirect target returned"),
        @APIResponse(responseCode = "401", description = "Wrong credentials, or the account is disabled or locked"),
        @APIResponse(responseCode = "422", description = "Missing field")
    })
    public Response submitLogin(@Valid LoginSubmission submission) {
        LoginRequest request = idpClient.getLoginRequest(submission.loginChallenge());
        ExecutionContext context = ExecutionContext.withCorrelation(submission.email(), auditContext.getCorrelationId());

        Result<UserAuthenticated> result = userOperations.authenticate(submission.email(), submission.password(), context);
        if (result instanceof Result.Failure<UserAuthenticated> f) {
            return ApiErrors.toResponse(f.error());
        }
        UserAuthenticated authenticated = ((Result.Success<UserAuthenticated>) result).value();

        boolean remember = Boolean.TRUE.equals(submission.remember());
        CompletedRequest completed = idpClient.acceptLoginRequest(submission.loginChallenge(), new AcceptLogin(
            authenticated.userId(),
            remember,
            remember ? REMEMBERED_LOGIN_SECONDS : REMEMBER_FOR_SECONDS,
            Map.of("user_id", authenticated.userId(), "email", authenticated.email())
        ));
        LOG.infof("User %s signed in for client %s", authenticated.email(), clientId(request.client()));
        return Response.ok(new RedirectResponse(completed.redirectTo())).build();
    }

    // ==================== Consent ====================

    @GET
    @Path("/consent")
    @Operation(summary = "Handle a consent challenge")
    public Response consent(@QueryParam("consent_challenge") String challenge) {
        if (challenge == null || challenge.isBlank()) {
            return missingChallenge("consent_challenge");
        }
        ConsentRequest request = idpClient.getConsentRequest(challenge);
        boolean clientSkipsConsent = request.client() != null && Boolean.TRUE.equals(request.client().skipConsent());
        if (request.skip() || clientSkipsConsent) {
            CompletedRequest completed = idpClient.acceptConsentRequest(challenge, new AcceptConsent(
                request.requestedScope(),
                request.requestedAccessTokenAudience(),
                Boolean.TRUE,
                REMEMBER_FOR_SECONDS
            ));
            return redirect(completed);
        }
        return Response.ok(new ChallengeResponse(
            challenge,
            false,
            request.subject(),
            clientId(request.client()),
            clientName(request.client()),
            request.requestedScope()
        )).build();
    }

    @POST
    @Path("/consent")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Grant or deny consent")
    public Response decideConsent(@Valid ConsentDecision decision) {
        CompletedRequest completed;
        if (decision.accept()) {
            ConsentRequest request = idpClient.getConsentRequest(decision.consentChallenge());
            List<String> granted = decision.grantScope() != null ? decision.grantScope() : request.requestedScope();
            completed = idpClient.acceptConsentRequest(decision.consentChallenge(), new AcceptConsent(
                granted,
                request.requestedAccessTokenAudience(),
                decision.remember(),
                Boolean.TRUE.equals(decision.remember()) ? REMEMBER_FOR_SECONDS : null
            ));
        } else {
            completed = idpClient.rejectConsentRequest(decision.consentChallenge(),
                RejectRequest.accessDenied("The resource owner denied the request"));
        }
        return Response.ok(new RedirectResponse(completed.redirectTo())).build();
    }

    // ==================== Logout ====================

    @GET
    @Path("/logout")
    @Operation(summary = "Describe a logout challenge")
    public Response logout(@QueryParam("logout_challenge") String challenge) {
        if (challenge == null || challenge.isBlank()) {
            return missingChallenge("logout_challenge");
        }
        LogoutRequest request = idpClient.getLogoutRequest(challenge);
        return Response.ok(new LogoutResponse(challenge, request.subject(), request.rpInitiated())).build();
    }

    @POST
    @Path("/logout")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Confirm or cancel a logout")
    public Response decideLogout(@Valid LogoutDecision decision) {
        if (decision.accept()) {
            CompletedRequest completed = idpClient.acceptLogoutRequest(decision.logoutChallenge());
            return Response.ok(new RedirectResponse(completed.redirectTo())).build();
        }
        idpClient.rejectLogoutRequest(decision.logoutChallenge());
        return Response.noContent().build();
    }

    // ==================== Helpers ====================

    private static Response redirect(CompletedRequest completed) {
        if (completed == null || completed.redirectTo() == null) {
            return Response.status(Response.Status.BAD_GATEWAY)
                .entity(new ErrorResponse("IDP_NO_REDIRECT", "Authorization server returned no redirect"))
                .build();
        }
        return Response.seeOther(URI.create(completed.redirectTo())).build();
    }

    private static Response missingChallenge(String parameter) {
        return Response.status(ApiErrors.UNPROCESSABLE_ENTITY)
            .entity(new ErrorResponse("CHALLENGE_REQUIRED", parameter + " is required"))
            .build();
    }

    private static String clientId(RemoteClient client) {
        return client != null ? client.clientId() : null;
    }

    private static String clientName(RemoteClient client) {
        return client != null ? client.clientName() : null;
    }

    public record ChallengeResponse(
        String challenge,
        boolean skip,
        String subject,
        String clientId,
        String clientName,
        List<String> requestedScope
    ) {}

    public record LoginSubmission(
        @NotBlank String loginChallenge,
        @NotBlank String email,
        @NotBlank String password,
        Boolean remember
    ) {}

    public record ConsentDecision(
        @NotBlank String consentChallenge,
        boolean accept,
        List<String> grantScope,
        Boolean remember
    ) {}

    public record LogoutDecision(
        @NotBlank String logoutChallenge,
        boolean accept
    ) {}

    public record LogoutResponse(String challenge, String subject, boolean rpInitiated) {}

    public record RedirectResponse(String redirectTo) {}
}
