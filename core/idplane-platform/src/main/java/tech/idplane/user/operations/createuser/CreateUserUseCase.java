package tech.idplane.user.operations.createuser;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.RoleRepository;
import tech.idplane.platform.common.ExecutionContext;
import tech.idplane.platform.common.Result;
import tech.idplane.platform.common.UnitOfWork;
import tech.idplane.platform.common.errors.UseCaseError;
import tech.idplane.platform.shared.EntityType;
import tech.idplane.platform.shared.TsidGenerator;
import tech.idplane.user.PasswordService;
import tech.idplane.user.entity.User;
import tech.idplane.user.operations.UserErrors;
import tech.idplane.user.operations.UserValidator;
import tech.idplane.user.repository.UserRepository;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Use case for creating a user. The password is hashed before anything is stored.
 */
@ApplicationScoped
public class CreateUserUseCase {

    private static final Logger LOG = Logger.getLogger(CreateUserUseCase.class);

    @Inject
    UserRepository userRepository;

    @Inject
    RoleRepository roleRepository;

    @Inject
    PasswordService passwordService;

    @Inject
    UnitOfWork unitOfWork;

    public Result<UserCreated> execute(CreateUserCommand command, ExecutionContext context) {
        String email = command.email() == null ? null : UserValidator.normalizeEmail(command.email());
        Optional<UseCaseError> invalid = UserValidator.validateEmail(email)
            .or(() -> UserValidator.validateDisplayName(command.displayName()));
        if (invalid.isPresent()) {
            return Result.failure(invalid.get());
        }

        String passwordHash;
        try {
            passwordHash = passwordService.validateAndHashPassword(command.password());
        } catch (IllegalArgumentException e) {
            return Result.failure(UserErrors.invalidPassword(e.getMessage()));
        }

        if (userRepository.existsByEmail(email)) {
            return Result.failure(UserErrors.emailExists(email));
        }

        List<String> roleIds = command.roleIds() != null ? List.copyOf(new LinkedHashSet<>(command.roleIds())) : List.of();
        List<Role> roles = roleRepository.findByIds(roleIds);
        if (roles.size() != roleIds.size()) {
            String missing = roleIds.stream()
                .filter(id -> roles.stream().noneMatch(r -> r.id.equals(id)))
                .findFirst()
                .orElse(null);
            return Result.failure(UserErrors.roleNotFound(missing));
        }

        User user = new User();
        user.id = TsidGenerator.generate(EntityType.USER);
        user.email = email;
        user.passwordHash = passwordHash;
        user.displayName = command.displayName();
        user.active = command.active() == null || command.active();
        user.roles = new ArrayList<>(roles);

        UserCreated event = UserCreated.fromContext(context)
            .userId(user.id)
            .email(user.email)
            .build();

        Result<UserCreated> result = unitOfWork.commit(() -> userRepository.persist(user), event, command);
        if (result.isSuccess()) {
            LOG.infof("User %s created with %d role(s)", user.email, roles.size());
        }
        return result;
    }
}
