package omni.sync.app.service;

import omni.sync.app.entity.User;
import omni.sync.app.repository.UserRepository;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

@Service
public class UserService {
    private final UserRepository userRepository;
    private final Clock clock;

    public UserService(UserRepository userRepository, Clock clock) {
        this.userRepository = userRepository;
        this.clock = clock;
    }

    @Transactional
    public User getOrCreateUser(Authentication authentication) {
        if (authentication == null) {
            throw new IllegalStateException("No authenticated user");
        }
        String userId = authentication.getName(); // OAuth subject
        String email = authentication.getPrincipal() instanceof OAuth2User
                ? ((OAuth2User) authentication.getPrincipal()).getAttribute("email")
                : null;

        Optional<User> existingUser = userRepository.findById(userId);
        if (existingUser.isPresent()) {
            User user = existingUser.get();
            if (email != null && !email.equals(user.getPrimaryEmail())) {
                user.setPrimaryEmail(email);
                userRepository.save(user);
            }
            return user;
        }
        User user = new User();
        user.setId(userId);
        user.setPrimaryEmail(email);
        user.setCreatedAt(clock.instant());
        return userRepository.save(user);
    }

    public String currentUserId(Authentication authentication) {
        return getOrCreateUser(authentication).getId();
    }
}
