package tech.idplane.platform.idp.challenge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of a login accept call. {@code context} is stored by the server with the
 * session and handed back on the consent request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AcceptLogin(
    @JsonProperty("subject") String subject,
    @JsonProperty("remember") Boolean remember,
    @JsonProperty("remember_for") Integer rememberFor,
    @JsonProperty("context") Map<String, Object> context
) {

    public AcceptLogin(String subject, Boolean remember, Integer rememberFor) {
        this(subject, remember, rememberFor, null);
    }
}
