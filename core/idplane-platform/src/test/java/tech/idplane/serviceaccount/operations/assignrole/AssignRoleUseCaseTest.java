package tech.idplane.serviceaccount.operations.assignrole;

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
class AssignRoleUseCaseTest {

    @Mock
    ServiceAccountRepository repository;

    @Mock
    RoleRepository roleRepository;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    AssignRoleUseCase useCase;

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
    @DisplayName("assign should add the association and audit it")
    void execute_shouldAssign_whenNotYetHeld() {
        when(roleRepository.findById("rol_1")).thenReturn(Optional.of(role));

        Result<RoleAssigned> result = useCase.execute(new AssignRoleCommand("sac_1", "rol_1"), context);

        assertThat(result.isSuccess()).isTrue();
        assertThat(((Result.Success<RoleAssigned>) result).value().alreadyAssigned()).isFalse();
        verify(repository).assignRole("sac_1", "rol_1");
        verify(unitOfWork).commit(any(Runnable.class), any(RoleAssigned.class), any());
    }

    @Test
    @DisplayName("assigning a held role again should succeed without writing")
    void execute_shouldBeIdempotent_whenAlreadyHeld() {
        // Arrange
        sa.roles.add(role);
        when(roleRepository.findById("rol_1")).thenReturn(Optional.of(role));

        // Act
        Result<RoleAssigned> result = useCase.execute(new AssignRoleCommand("sac_1", "rol_1"), context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        assertThat(((Result.Success<RoleAssigned>) result).value().alreadyAssigned()).isTrue();
        verify(repository, never()).assignRole(anyString(), anyString());
        verifyNoInteractions(unitOfWork);
    }

    @Test
    @DisplayName("assigning an unknown role should be ROLE_NOT_FOUND")
    void execute_shouldReturnRoleNotFound_whenRoleMissing() {
        when(roleRepository.findById("rol_missing")).thenReturn(Optional.empty());

        Result<RoleAssigned> result = useCase.execute(new AssignRoleCommand("sac_1", "rol_missing"), context);

        assertThat(((Result.Failure<RoleAssigned>) result).error())
            .isInstanceOf(UseCaseError.NotFoundError.class)
            .extracting(UseCaseError::code).isEqualTo("ROLE_NOT_FOUND");
    }

    @Test
    @DisplayName("assigning to an unknown account should be SERVICE_ACCOUNT_NOT_FOUND")
    void execute_shouldReturnAccountNotFound_whenAccountMissing() {
        when(repository.findById("sac_missing")).thenReturn(Optional.empty());

        Result<RoleAssigned> result = useCase.execute(new AssignRoleCommand("sac_missing", "rol_1"), context);

        assertThat(((Result.Failure<RoleAssigned>) result).error().code()).isEqualTo("SERVICE_ACCOUNT_NOT_FOUND");
        verifyNoInteractions(roleRepository);
    }
}
