package tech.idplane.serviceaccount.operations.resyncserviceaccount;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
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
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResyncServiceAccountUseCaseTest {

    @Mock
    ServiceAccountRepository repository;

    @Mock
    IdpAdminClient idpClient;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    ResyncServiceAccountUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    @BeforeEach
    void setUp() {
        ServiceAccount sa = new ServiceAccount();
        sa.id = "sac_1";
        sa.clientId = "svc-1";
        sa.clientName = "Service One";
        when(repository.findById("sac_1")).thenReturn(Optional.of(sa));
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("resync should create the client when the server does not know it")
    void execute_shouldCreate_whenRemoteMissing() {
        when(idpClient.getClient("svc-1")).thenReturn(Optional.empty());

        Result<ServiceAccountResynced> result = useCase.execute(new ResyncServiceAccountCommand("sac_1"), context);

        assertThat(((Result.Success<ServiceAccountResynced>) result).value().action())
            .isEqualTo(ResyncServiceAccountUseCase.ACTION_CREATED);
        verify(idpClient).createClient(any());
        verify(idpClient, never()).updateClient(anyString(), any());
    }

    @Test
    @DisplayName("resync should overwrite the client when the server knows it")
    void execute_shouldUpdate_whenRemotePresent() {
        when(idpClient.getClient("svc-1")).thenReturn(Optional.of(RemoteClient.builder().clientId("svc-1").build()));

        Result<ServiceAccountResynced> result = useCase.execute(new ResyncServiceAccountCommand("sac_1"), context);

        assertThat(((Result.Success<ServiceAccountResynced>) result).value().action())
            .isEqualTo(ResyncServiceAccountUseCase.ACTION_UPDATED);
        verify(idpClient).updateClient(eq("svc-1"), any());
        verify(idpClient, never()).createClient(any());
    }

    @Test
    @DisplayName("resync should report a remote failure without auditing success")
    void execute_shouldFail_whenRemoteUnavailable() {
        when(idpClient.getClient("svc-1"))
            .thenThrow(new IdpIntegrationException("Timed out trying to get client svc-1", new java.net.http.HttpTimeoutException("timeout")));

        Result<ServiceAccountResynced> result = useCase.execute(new ResyncServiceAccountCommand("sac_1"), context);

        UseCaseError error = ((Result.Failure<ServiceAccountResynced>) result).error();
        assertThat(error.code()).isEqualTo("IDP_SYNC_FAILED");
        assertThat(error.details()).containsEntry("status", 0);
        verifyNoInteractions(unitOfWork);
    }
}
