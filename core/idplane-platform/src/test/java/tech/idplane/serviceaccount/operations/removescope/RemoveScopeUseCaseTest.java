package tech.idplane.serviceaccount.operations.removescope;

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
import tech.idplane.platform.idp.RemoteClient;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RemoveScopeUseCaseTest {

    @Mock
    ServiceAccountRepository repository;

    @Mock
    ScopeRepository scopeRepository;

    @Mock
    IdpAdminClient idpClient;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    RemoveScopeUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    private ServiceAccount sa;
    private Scope scope;

    @BeforeEach
    void setUp() {
        sa = new ServiceAccount();
        sa.id = "sac_1";
        sa.clientId = "svc-1";
        scope = new Scope();
        scope.id = "scp_1";
        scope.name = "orders.read";
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("remove should drop the association and push the reduced scope string")
    void execute_shouldRemoveAndPush() {
        // Arrange
        Scope kept = new Scope();
        kept.id = "scp_2";
        kept.name = "orders.write";
        sa.scopes.add(scope);
        sa.scopes.add(kept);
        when(repository.findById("sac_1")).thenReturn(Optional.of(sa));
        when(scopeRepository.findById("scp_1")).thenReturn(Optional.of(scope));

        // Act
        Result<ScopeRemoved> result = useCase.execute(new RemoveScopeCommand("sac_1", "scp_1", true), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        verify(repository).removeScope("sac_1", "scp_1");
        ArgumentCaptor<RemoteClient> pushed = ArgumentCaptor.forClass(RemoteClient.class);
        verify(idpClient).updateClient(eq("svc-1"), pushed.capture());
        assertThat(pushed.getValue().scope()).isEqualTo("orders.write");
        verify(repository, times(1)).findById("sac_1");
    }

    @Test
    @DisplayName("removing a scope the account does not hold should be SCOPE_NOT_ASSIGNED")
    void execute_shouldReturnNotAssigned() {
        when(repository.findById("sac_1")).thenReturn(Optional.of(sa));
        when(scopeRepository.findById("scp_1")).thenReturn(Optional.of(scope));

        Result<ScopeRemoved> result = useCase.execute(new RemoveScopeCommand("sac_1", "scp_1", true), context);

        assertThat(((Result.Failure<ScopeRemoved>) result).error())
            .isInstanceOf(UseCaseError.NotFoundError.class)
            .extracting(UseCaseError::code).isEqualTo("SCOPE_NOT_ASSIGNED");
        verifyNoInteractions(unitOfWork, idpClient);
    }

    @Test
    @DisplayName("removing an unknown scope should be SCOPE_NOT_FOUND")
    void execute_shouldReturnScopeNotFound_whenScopeUnknown() {
        when(repository.findById("sac_1")).thenReturn(Optional.of(sa));
        when(scopeRepository.findById("scp_missing")).thenReturn(Optional.empty());

        Result<ScopeRemoved> result =
            useCase.execute(new RemoveScopeCommand("sac_1", "scp_missing", true), context);

        assertThat(((Result.Failure<ScopeRemoved>) result).error())
            .isInstanceOf(UseCaseError.NotFoundError.class)
            .extracting(UseCaseError::code).isEqualTo("SCOPE_NOT_FOUND");
        verify(repository, never()).removeScope(anyString(), anyString());
        verifyNoInteractions(unitOfWork, idpClient);
    }
}
