package tech.idplane.user.operations.deleteuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.repository.UserRepository;

/**
 * Use case for deleting a user together with its role grants.
 */
@ApplicationScoped
public class DeleteUserUseCase {

    @Inject
    UserRepository userRepository;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserDeleted> execute(DeleteUserCommand command, ExecutionContext context) {
        User user = userRepository.findById(command.userId()).orElse(null);
        if (user == null) {
            return Result.failure(UserErrors.userNotFound(command.userId()));
        }

        UserDeleted event = UserDeleted.fromContext(context)
            .userId(user.id)
            .email(user.email)
            .build();

        return unitOfWork.commit(() -> userRepository.deleteWithRoles(user.id), event, command);
    }
}
