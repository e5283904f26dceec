package tech.idplane.platform.scope.operations.updatescope;

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
import tech.idplane.platform.scope.events.ScopeUpdated;
import tech.idplane.serviceaccount.entity.AccountType;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UpdateScopeUseCaseTest {

    @Mock
    ScopeRepository scopeRepo;

    @Mock
    UnitOfWork unitOfWork;

    @InjectMocks
    UpdateScopeUseCase useCase;

    private final ExecutionContext context = ExecutionContext.create("tester");

    private Scope scope;

    @BeforeEach
    void setUp() {
        scope = new Scope();
        scope.id = "scp_1";
        scope.name = "orders.read";
        scope.description = "Read orders";
        lenient().when(scopeRepo.findById("scp_1")).thenReturn(Optional.of(scope));
        lenient().when(unitOfWork.commit(any(Runnable.class), any(), any())).thenAnswer(inv -> {
            inv.getArgument(0, Runnable.class).run();
            return Result.success(inv.getArgument(1));
        });
    }

    @Test
    @DisplayName("update should change the given fields and drop duplicate account types")
    void execute_shouldUpdate() {
        Result<ScopeUpdated> result = useCase.execute(new UpdateScopeCommand("scp_1", null,
            List.of(AccountType.BROWSER, AccountType.SERVICE_TO_SERVICE, AccountType.BROWSER), false),
            context);

        assertThat(((Result.Success<ScopeUpdated>) result).value().scopeName()).isEqualTo("orders.read");
        assertThat(scope.appliesTo).containsExactly(AccountType.BROWSER, AccountType.SERVICE_TO_SERVICE);
        assertThat(scope.active).isFalse();
        assertThat(scope.description).isEqualTo("Read orders");
        verify(scopeRepo).update(scope);
    }

    @Test
    @DisplayName("an empty account type list should be APPLIES_TO_REQUIRED")
    void execute_shouldReject_whenAppliesToEmpty() {
        Result<ScopeUpdated> result = useCase.execute(new UpdateScopeCommand("scp_1", null, List.of(), null), context);

        assertThat(((Result.Failure<ScopeUpdated>) result).error().code()).isEqualTo("APPLIES_TO_REQUIRED");
        verifyNoInteractions(unitOfWork);
    }

    @Test
    @DisplayName("updating an unknown scope should be SCOPE_NOT_FOUND")
    void execute_shouldReturnNotFound() {
        when(scopeRepo.findById("scp_missing")).thenReturn(Optional.empty());

        Result<ScopeUpdated> result = useCase.execute(new UpdateScopeCommand("scp_missing", "x", null, null), context);

        assertThat(((Result.Failure<ScopeUpdated>) result).error().code()).isEqualTo("SCOPE_NOT_FOUND");
    }
}
