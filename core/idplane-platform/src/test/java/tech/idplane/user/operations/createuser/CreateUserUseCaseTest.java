package tech.idplane.user.operations.createuser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.user.PasswordService;
import tech.idplane.user.entity.User;
import tech.idplane.user.repository.UserRepository;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CreateUserUseCaseTest {

    @Mock
    UserRepository userRepository;

    @Mock
    RoleRepository roleRepository;

    @Mock
    PasswordService passwordService;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    CreateUserUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    @BeforeEach
    void setUp() {
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("create should store a normalized email and the password hash, never the password")
    void execute_shouldPersistHashedUser() {
        // Arrange
        Role admin = new Role("rol_1", "admin", null);
        when(passwordService.validateAndHashPassword("s3cret-pass")).thenReturn("$argon2id$hash");
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(false);
        when(roleRepository.findByIds(List.of("rol_1"))).thenReturn(List.of(admin));

        // Act
        Result<UserCreated> result = useCase.execute(
            new CreateUserCommand("  Ada@Example.com ", "s3cret-pass", "Ada", null, List.of("rol_1", "rol_1")),
            context);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).persist(captor.capture());
        User stored = captor.getValue();
        assertThat(stored.id).startsWith("usr_");
        assertThat(stored.email).isEqualTo("ada@example.com");
        assertThat(stored.passwordHash).isEqualTo("$argon2id$hash");
        assertThat(stored.active).isTrue();
        assertThat(stored.roleIds()).containsExactly("rol_1");
        assertThat(((Result.Success<UserCreated>) result).value().email()).isEqualTo("ada@example.com");
    }

    @Test
    @DisplayName("create should be EMAIL_EXISTS when the email is taken")
    void execute_shouldReturnConflict_whenEmailTaken() {
        when(passwordService.validateAndHashPassword("s3cret-pass")).thenReturn("$argon2id$hash");
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(true);

        Result<UserCreated> result = useCase.execute(
            new CreateUserCommand("ada@example.com", "s3cret-pass", null, null, null), context);

        assertThat(((Result.Failure<UserCreated>) result).error())
            .isInstanceOf(UseCaseError.ConflictError.class)
            .extracting(UseCaseError::code).isEqualTo("EMAIL_EXISTS");
        verifyNoInteractions(unitOfWork);
    }

    @Test
    @DisplayName("create should be INVALID_PASSWORD for a short password")
    void execute_shouldReturnInvalidPassword_whenTooShort() {
        when(passwordService.validateAndHashPassword("short"))
            .thenThrow(new IllegalArgumentException("Password must be at least 8 characters long"));

        Result<UserCreated> result = useCase.execute(
            new CreateUserCommand("ada@example.com", "short", null, null, null), context);

        UseCaseError error = ((Result.Failure<UserCreated>) result).error();
        assertThat(error.code()).isEqualTo("INVALID_PASSWORD");
        assertThat(error.message()).contains("at least 8");
        verifyNoInteractions(userRepository, unitOfWork);
    }

    @Test
    @DisplayName("create should be INVALID_EMAIL for an address without a domain")
    void execute_shouldReturnInvalidEmail() {
        Result<UserCreated> result = useCase.execute(
            new CreateUserCommand("ada@", "s3cret-pass", null, null, null), context);

        assertThat(((Result.Failure<UserCreated>) result).error().code()).isEqualTo("INVALID_EMAIL");
        verifyNoInteractions(passwordService, userRepository, unitOfWork);
    }

    @Test
    @DisplayName("create should be ROLE_NOT_FOUND when a role id is unknown")
    void execute_shouldReturnRoleNotFound() {
        when(passwordService.validateAndHashPassword("s3cret-pass")).thenReturn("$argon2id$hash");
        when(userRepository.existsByEmail("ada@example.com")).thenReturn(false);
        when(roleRepository.findByIds(List.of("rol_missing"))).thenReturn(List.of());

        Result<UserCreated> result = useCase.execute(
            new CreateUserCommand("ada@example.com", "s3cret-pass", null, null, List.of("rol_missing")), context);

        UseCaseError error = ((Result.Failure<UserCreated>) result).error();
        assertThat(error.code()).isEqualTo("ROLE_NOT_FOUND");
        assertThat(error.details()).containsEntry("roleId", "rol_missing");
        verify(userRepository, never()).persist(any());
    }
}
