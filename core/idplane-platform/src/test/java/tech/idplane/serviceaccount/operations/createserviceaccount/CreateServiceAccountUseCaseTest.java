package tech.idplane.serviceaccount.operations.createserviceaccount;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.idp.IdpAdminClient;
import tech.idplane.platform.idp.IdpIntegrationException;
import tech.idplane.platform.idp.RemoteClient;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.operations.ServiceAccountAssociations;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CreateServiceAccountUseCaseTest {

    @Mock
    ServiceAccountRepository repository;

    @Mock
    ServiceAccountAssociations associations;

    @Mock
    IdpAdminClient idpClient;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    CreateServiceAccountUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    @BeforeEach
    void setUp() {
        lenient().when(associations.resolveRoles(any())).thenReturn(Result.success(List.of()));
        lenient().when(associations.resolveScopes(any(), any())).thenReturn(Result.success(List.of()));
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    private static CreateServiceAccountCommand.CreateServiceAccountCommandBuilder command(String clientId) {
        return CreateServiceAccountCommand.builder()
            .clientId(clientId)
            .clientName("Orders service")
            .clientSecret("s3cret")
            .createdBy("tester")
            .syncToIdp(true);
    }

    @Test
    @DisplayName("create should persist locally and register the client remotely")
    void execute_shouldPersistAndRegister_whenValid() {
        // Arrange
        when(repository.existsByClientId("svc-orders")).thenReturn(false);

        // Act
        Result<ServiceAccountCreated> result = useCase.execute(command("svc-orders").build(), context);

        // Assert
        assertThat(result).isInstanceOf(Result.Success.class);
        ArgumentCaptor<ServiceAccount> saved = ArgumentCaptor.forClass(ServiceAccount.class);
        verify(repository).persist(saved.capture());
        assertThat(saved.getValue().active).isTrue();
        assertThat(saved.getValue().grantTypes).containsExactly("client_credentials");
        assertThat(saved.getValue().id).startsWith("sac_");

        ArgumentCaptor<RemoteClient> remote = ArgumentCaptor.forClass(RemoteClient.class);
        verify(idpClient).createClient(remote.capture());
        assertThat(remote.getValue().clientId()).isEqualTo("svc-orders");
        assertThat(remote.getValue().clientSecret()).isEqualTo("s3cret");
        verify(repository, never()).deleteWithAssociations(anyString());
    }

    @Test
    @DisplayName("create should remove the local row again when the remote create fails")
    void execute_shouldRollBack_whenRemoteCreateFails() {
        // Arrange
        when(repository.existsByClientId("svc-orders")).thenReturn(false);
        when(idpClient.createClient(any()))
            .thenThrow(new IdpIntegrationException("Failed to create client svc-orders: HTTP 500", 500, "{\"error\":\"boom\"}"));

        // Act
        Result<ServiceAccountCreated> result = useCase.execute(command("svc-orders").build(), context);

        // Assert
        assertThat(result).isInstanceOf(Result.Failure.class);
        UseCaseError error = ((Result.Failure<ServiceAccountCreated>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.RemoteIntegrationError.class);
        assertThat(error.code()).isEqualTo("IDP_CREATE_FAILED");
        assertThat(error.details())
            .containsEntry("status", 500)
            .containsEntry("localChangesKept", false);

        ArgumentCaptor<ServiceAccount> saved = ArgumentCaptor.forClass(ServiceAccount.class);
        verify(repository).persist(saved.capture());
        verify(repository).deleteWithAssociations(saved.getValue().id);
        verify(unitOfWork).commit(any(Runnable.class), any(ServiceAccountCreationRolledBack.class), any());
    }

    @Test
    @DisplayName("create should also roll back when building or sending the client fails unexpectedly")
    void execute_shouldRollBack_whenRemoteStepThrowsUnexpectedly() {
        // Arrange
        when(repository.existsByClientId("svc-orders")).thenReturn(false);
        when(idpClient.createClient(any())).thenThrow(new IllegalArgumentException("Illegal character in path"));

        // Act
        Result<ServiceAccountCreated> result = useCase.execute(command("svc-orders").build(), context);

        // Assert
        UseCaseError error = ((Result.Failure<ServiceAccountCreated>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.RemoteIntegrationError.class);
        assertThat(error.code()).isEqualTo("IDP_CREATE_FAILED");
        assertThat(error.message()).contains("Illegal character in path");
        assertThat(error.details())
            .containsEntry("cause", "IllegalArgumentException")
            .containsEntry("localChangesKept", false)
            .doesNotContainKey("rollbackFailed");

        ArgumentCaptor<ServiceAccount> saved = ArgumentCaptor.forClass(ServiceAccount.class);
        verify(repository).persist(saved.capture());
        verify(repository).deleteWithAssociations(saved.getValue().id);
        verify(unitOfWork).commit(any(Runnable.class), any(ServiceAccountCreationRolledBack.class), any());
    }

    @Test
    @DisplayName("create should report a too long client name with a snake case code")
    void execute_shouldReturnSnakeCaseCode_whenClientNameTooLong() {
        Result<ServiceAccountCreated> result = useCase.execute(
            command("svc-orders").clientName("x".repeat(256)).build(), context);

        assertThat(((Result.Failure<ServiceAccountCreated>) result).error().code()).isEqualTo("CLIENT_NAME_TOO_LONG");
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("create should not touch the remote side when syncToIdp is false")
    void execute_shouldSkipRemote_whenSyncDisabled() {
        when(repository.existsByClientId("svc-local")).thenReturn(false);

        Result<ServiceAccountCreated> result = useCase.execute(command("svc-local").syncToIdp(false).build(), context);

        assertThat(result.isSuccess()).isTrue();
        verifyNoInteractions(idpClient);
    }

    @Test
    @DisplayName("create should fail with a conflict when the client id is taken")
    void execute_shouldReturnConflict_whenClientIdExists() {
        // Arrange
        when(repository.existsByClientId("svc-orders")).thenReturn(true);

        // Act
        Result<ServiceAccountCreated> result = useCase.execute(command("svc-orders").build(), context);

        // Assert
        assertThat(((Result.Failure<ServiceAccountCreated>) result).error())
            .isInstanceOf(UseCaseError.ConflictError.class)
            .extracting(UseCaseError::code).isEqualTo("CLIENT_ID_EXISTS");
        verify(repository, never()).persist(any());
        verifyNoInteractions(idpClient, unitOfWork);
    }

    @Test
    @DisplayName("create should reject unknown grant types before touching storage")
    void execute_shouldReturnValidationError_whenGrantTypeInvalid() {
        Result<ServiceAccountCreated> result = useCase.execute(
            command("svc-orders").grantTypes(List.of("device_code")).build(), context);

        assertThat(((Result.Failure<ServiceAccountCreated>) result).error())
            .isInstanceOf(UseCaseError.ValidationError.class)
            .extracting(UseCaseError::code).isEqualTo("INVALID_GRANT_TYPE");
        verifyNoInteractions(repository, idpClient, unitOfWork);
    }

    @Test
    @DisplayName("create should require a client id")
    void execute_shouldReturnValidationError_whenClientIdBlank() {
        Result<ServiceAccountCreated> result = useCase.execute(command(" ").build(), context);

        assertThat(((Result.Failure<ServiceAccountCreated>) result).error().code()).isEqualTo("CLIENT_ID_REQUIRED");
        verifyNoInteractions(repository);
    }

    @Test
    @DisplayName("create should pass on an unknown role as not found")
    void execute_shouldReturnNotFound_whenRoleMissing() {
        // Arrange
        when(repository.existsByClientId("svc-orders")).thenReturn(false);
        when(associations.resolveRoles(List.of("rol_missing"))).thenReturn(Result.failure(
            new UseCaseError.NotFoundError("ROLE_NOT_FOUND", "Role not found: rol_missing", java.util.Map.of())));

        // Act
        Result<ServiceAccountCreated> result = useCase.execute(
            command("svc-orders").roleIds(List.of("rol_missing")).build(), context);

        // Assert
        assertThat(((Result.Failure<ServiceAccountCreated>) result).error().code()).isEqualTo("ROLE_NOT_FOUND");
        verify(repository, never()).persist(any());
    }
}
