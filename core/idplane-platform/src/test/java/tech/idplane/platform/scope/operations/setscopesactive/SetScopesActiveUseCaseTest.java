package tech.idplane.platform.scope.operations.setscopesactive;

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
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.events.ScopesActivationChanged;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SetScopesActiveUseCaseTest {

    @Mock
    ScopeRepository scopeRepo;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    SetScopesActiveUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    @BeforeEach
    void setUp() {
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("deactivate should switch off only the scopes that exist")
    void execute_shouldSkipUnknownIds() {
        // Arrange
        Scope known = new Scope();
        known.id = "scp_1";
        when(scopeRepo.findByIds(List.of("scp_1", "scp_missing"))).thenReturn(List.of(known));

        // Act
        Result<ScopesActivationChanged> result =
            useCase.execute(new SetScopesActiveCommand(List.of("scp_1", "scp_missing", "scp_1"), false), context);

        // Assert
        ScopesActivationChanged event = ((Result.Success<ScopesActivationChanged>) result).value();
        assertThat(event.scopeIds()).containsExactly("scp_1");
        assertThat(event.active()).isFalse();
        assertThat(event.resourceId()).isEqualTo("*");
        verify(scopeRepo).setActive(List.of("scp_1"), false);
    }

    @Test
    @DisplayName("an empty id list should be SCOPE_IDS_REQUIRED")
    void execute_shouldReject_whenNoIds() {
        Result<ScopesActivationChanged> result = useCase.execute(new SetScopesActiveCommand(List.of(), true), context);

        assertThat(((Result.Failure<ScopesActivationChanged>) result).error().code()).isEqualTo("SCOPE_IDS_REQUIRED");
        verifyNoInteractions(scopeRepo, unitOfWork);
    }
}
