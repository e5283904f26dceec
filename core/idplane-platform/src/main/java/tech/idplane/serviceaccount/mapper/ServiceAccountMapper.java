package tech.idplane.serviceaccount.mapper;

import tech.idplane.serviceaccount.entity.AccountType;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.jpaentity.ServiceAccountJpaEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper for converting between ServiceAccount domain model and JPA entity.
 * Role and scope associations are loaded separately by the repository.
 */
public final class ServiceAccountMapper {

    private ServiceAccountMapper() {
    }

    public static ServiceAccount toDomain(ServiceAccountJpaEntity entity) {
        if (entity == null) {
            return null;
        }

        ServiceAccount sa = new ServiceAccount();
        sa.id = entity.id;
        sa.clientId = entity.clientId;
        sa.clientSecret = entity.clientSecret;
        sa.clientName = entity.clientName;
        sa.description = entity.description;
        sa.accountType = entity.accountType != null ? AccountType.fromValue(entity.accountType) : AccountType.SERVICE_TO_SERVICE;
        sa.grantTypes = copy(entity.grantTypes);
        sa.responseTypes = copy(entity.responseTypes);
        sa.tokenEndpointAuthMethod = entity.tokenEndpointAuthMethod;
        sa.tokenEndpointAuthSigningAlg = entity.tokenEndpointAuthSigningAlg;
        sa.audience = copy(entity.audience);
        sa.redirectUris = copy(entity.redirectUris);
        sa.postLogoutRedirectUris = copy(entity.postLogoutRedirectUris);
        sa.allowedCorsOrigins = copy(entity.allowedCorsOrigins);
        sa.skipConsent = entity.skipConsent;
        sa.owner = entity.owner;
        sa.clientMetadata = entity.clientMetadata != null ? new LinkedHashMap<>(entity.clientMetadata) : new LinkedHashMap<>();
        sa.jwks = entity.jwks;
        sa.jwksUri = entity.jwksUri;
        sa.idTokenSignedResponseAlg = entity.idTokenSignedResponseAlg;
        sa.active = entity.active;
        sa.createdBy = entity.createdBy;
        sa.lastUsedAt = entity.lastUsedAt;
        sa.createdAt = entity.createdAt;
        sa.updatedAt = entity.updatedAt;
        return sa;
    }

    public static ServiceAccountJpaEntity toEntity(ServiceAccount domain) {
        if (domain == null) {
            return null;
        }

        ServiceAccountJpaEntity entity = new ServiceAccountJpaEntity();
        entity.id = domain.id;
        entity.clientId = domain.clientId;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy every mutable field onto a managed entity. {@code clientId} and
     * {@code createdAt} never change after insert.
     */
    public static void updateEntity(ServiceAccountJpaEntity entity, ServiceAccount domain) {
        entity.clientSecret = domain.clientSecret;
        entity.clientName = domain.clientName;
        entity.description = domain.description;
        entity.accountType = domain.accountType != null ? domain.accountType.value() : AccountType.SERVICE_TO_SERVICE.value();
        entity.grantTypes = copy(domain.grantTypes);
        entity.responseTypes = copy(domain.responseTypes);
        entity.tokenEndpointAuthMethod = domain.tokenEndpointAuthMethod;
        entity.tokenEndpointAuthSigningAlg = domain.tokenEndpointAuthSigningAlg;
        entity.audience = copy(domain.audience);
        entity.redirectUris = copy(domain.redirectUris);
        entity.postLogoutRedirectUris = copy(domain.postLogoutRedirectUris);
        entity.allowedCorsOrigins = copy(domain.allowedCorsOrigins);
        entity.skipConsent = domain.skipConsent;
        entity.owner = domain.owner;
        entity.clientMetadata = domain.clientMetadata != null && !domain.clientMetadata.isEmpty()
            ? new LinkedHashMap<>(domain.clientMetadata) : null;
        entity.jwks = domain.jwks;
        entity.jwksUri = domain.jwksUri;
        entity.idTokenSignedResponseAlg = domain.idTokenSignedResponseAlg;
        entity.active = domain.active;
        entity.createdBy = domain.createdBy;
        entity.lastUsedAt = domain.lastUsedAt;
        entity.updatedAt = domain.updatedAt;
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }
}
