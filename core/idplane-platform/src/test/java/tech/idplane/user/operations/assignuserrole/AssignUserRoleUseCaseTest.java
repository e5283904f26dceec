package tech.idplane.user.operations.assignuserrole;

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
import tech.idplane.user.entity.User;
import tech.idplane.user.repository.UserRepository;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AssignUserRoleUseCaseTest {

    @Mock
    UserRepository userRepository;

    @Mock
    RoleRepository roleRepository;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    AssignUserRoleUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    private User user;
    private Role role;

    @BeforeEach
    void setUp() {
        user = new User();
        user.id = "usr_1";
        role = new Role("rol_1", "admin", null);
        lenient().when(userRepository.findById("usr_1")).thenReturn(Optional.of(user));
        lenient().when(roleRepository.findById("rol_1")).thenReturn(Optional.of(role));
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("assign should grant a role the user does not hold")
    void execute_shouldAssign() {
        Result<UserRoleAssigned> result = useCase.execute(new AssignUserRoleCommand("usr_1", "rol_1"), context);

        UserRoleAssigned event = ((Result.Success<UserRoleAssigned>) result).value();
        assertThat(event.alreadyAssigned()).isFalse();
        assertThat(event.roleName()).isEqualTo("admin");
        verify(userRepository).assignRole("usr_1", "rol_1");
    }

    @Test
    @DisplayName("assigning a held role should succeed without writing")
    void execute_shouldBeNoOp_whenAlreadyHeld() {
        user.roles.add(role);

        Result<UserRoleAssigned> result = useCase.execute(new AssignUserRoleCommand("usr_1", "rol_1"), context);

        assertThat(((Result.Success<UserRoleAssigned>) result).value().alreadyAssigned()).isTrue();
        verifyNoInteractions(unitOfWork);
        verify(userRepository, never()).assignRole(anyString(), anyString());
    }

    @Test
    @DisplayName("assigning an unknown role should be ROLE_NOT_FOUND")
    void execute_shouldReturnRoleNotFound() {
        when(roleRepository.findById("rol_missing")).thenReturn(Optional.empty());

        Result<UserRoleAssigned> result = useCase.execute(new AssignUserRoleCommand("usr_1", "rol_missing"), context);

        assertThat(((Result.Failure<UserRoleAssigned>) result).error().code()).isEqualTo("ROLE_NOT_FOUND");
    }
}
