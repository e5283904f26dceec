package tech.idplane.user.operations.removeuserrole;

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
class RemoveUserRoleUseCaseTest {

    @Mock
    UserRepository userRepository;

    @Mock
    RoleRepository roleRepository;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    RemoveUserRoleUseCase useCase;

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
    @DisplayName("remove should revoke a held role")
    void execute_shouldRemove_whenHeld() {
        user.roles.add(role);

        Result<UserRoleRemoved> result = useCase.execute(new RemoveUserRoleCommand("usr_1", "rol_1"), context);

        assertThat(result.isSuccess()).isTrue();
        verify(userRepository).removeRole("usr_1", "rol_1");
    }

    @Test
    @DisplayName("removing a role the user does not hold should be ROLE_NOT_ASSIGNED")
    void execute_shouldReturnNotAssigned() {
        Result<UserRoleRemoved> result = useCase.execute(new RemoveUserRoleCommand("usr_1", "rol_1"), context);

        assertThat(((Result.Failure<UserRoleRemoved>) result).error().code()).isEqualTo("ROLE_NOT_ASSIGNED");
        verifyNoInteractions(unitOfWork);
    }
}
