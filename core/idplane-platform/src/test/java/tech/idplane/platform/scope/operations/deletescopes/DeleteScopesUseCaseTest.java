package tech.idplane.platform.scope.operations.deletescopes;

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
import tech.idplane.platform.scope.events.ScopesDeleted;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeleteScopesUseCaseTest {

    @Mock
    ScopeRepository scopeRepo;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    DeleteScopesUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    @BeforeEach
    void setUp() {
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("bulk delete should remove the existing scopes with their assignments")
    void execute_shouldDeleteExisting() {
        Scope a = new Scope();
        a.id = "scp_1";
        Scope b = new Scope();
        b.id = "scp_2";
        when(scopeRepo.findByIds(List.of("scp_1", "scp_2", "scp_missing"))).thenReturn(List.of(a, b));

        Result<ScopesDeleted> result =
            useCase.execute(new DeleteScopesCommand(List.of("scp_1", "scp_2", "scp_missing")), context);

        assertThat(((Result.Success<ScopesDeleted>) result).value().scopeIds()).containsExactly("scp_1", "scp_2");
        verify(scopeRepo).deleteAllWithAssignments(List.of("scp_1", "scp_2"));
    }

    @Test
    @DisplayName("a null id list should be SCOPE_IDS_REQUIRED")
    void execute_shouldReject_whenNoIds() {
        Result<ScopesDeleted> result = useCase.execute(new DeleteScopesCommand(null), context);

        assertThat(((Result.Failure<ScopesDeleted>) result).error().code()).isEqualTo("SCOPE_IDS_REQUIRED");
        verifyNoInteractions(scopeRepo, unitOfWork);
    }
}
