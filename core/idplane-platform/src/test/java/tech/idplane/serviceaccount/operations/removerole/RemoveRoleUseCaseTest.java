package tech.idplane.serviceaccount.operations.removerole;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RemoveRoleUseCaseTest {

    @Mock
    ServiceAccountRepository repository;

    @Mock
    RoleRepository roleRepository;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    RemoveRoleUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    private ServiceAccount sa;
    private Role role;

    @BeforeEach
    void setUp() {
        sa = new ServiceAccount();
        sa.id = "sac_1";
        sa.clientId = "svc-1";
        role = new Role("rol_1", "billing:reader", null);
        lenient().when(repository.findById("sac_1")).thenReturn(Optional.of(sa));
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("remove should drop a held role and audit it")
    void execute_shouldRemove_whenHeld() {
        // Arrange
        sa.roles.add(role);
        when(roleRepository.findById("rol_1")).thenReturn(Optional.of(role));

        // Act
        Result<RoleRemoved> result = useCase.execute(new RemoveRoleCommand("sac_1", "rol_1"), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        RoleRemoved event = ((Result.Success<RoleRemoved>) result).value();
        assertThat(event.roleId()).isEqualTo("rol_1");
        assertThat(event.clientId()).isEqualTo("svc-1");
        verify(repository).removeRole("sac_1", "rol_1");
    }

    @Test
    @DisplayName("removing an unknown role should be ROLE_NOT_FOUND and write nothing")
    void execute_shouldReturnRoleNotFound_whenRoleUnknown() {
        // Arrange
        when(roleRepository.findById("rol_missing")).thenReturn(Optional.empty());

        // Act
        Result<RoleRemoved> result = useCase.execute(new RemoveRoleCommand("sac_1", "rol_missing"), context);

        // Assert
        assertThat(((Result.Failure<RoleRemoved>) result).error())
            .isInstanceOf(UseCaseError.NotFoundError.class)
            .extracting(UseCaseError::code).isEqualTo("ROLE_NOT_FOUND");
        verify(repository, never()).removeRole(anyString(), anyString());
        verifyNoInteractions(unitOfWork);
    }

    @Test
    @DisplayName("removing an existing role the account does not hold should be ROLE_NOT_ASSIGNED")
    void execute_shouldReturnNotAssigned_whenRoleNotHeld() {
        when(roleRepository.findById("rol_1")).thenReturn(Optional.of(role));

        Result<RoleRemoved> result = useCase.execute(new RemoveRoleCommand("sac_1", "rol_1"), context);

        assertThat(((Result.Failure<RoleRemoved>) result).error().code()).isEqualTo("ROLE_NOT_ASSIGNED");
        verifyNoInteractions(unitOfWork);
    }

    @Test
    @DisplayName("removing from an unknown account should be SERVICE_ACCOUNT_NOT_FOUND")
    void execute_shouldReturnAccountNotFound() {
        when(repository.findById("sac_missing")).thenReturn(Optional.empty());

        Result<RoleRemoved> result = useCase.execute(new RemoveRoleCommand("sac_missing", "rol_1"), context);

        assertThat(((Result.Failure<RoleRemoved>) result).error().code()).isEqualTo("SERVICE_ACCOUNT_NOT_FOUND");
        verifyNoInteractions(roleRepository, unitOfWork);
    }
}
