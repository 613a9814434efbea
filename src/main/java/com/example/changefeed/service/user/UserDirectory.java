package com.example.changefeed.service.user;

import com.example.changefeed.model.domain.AppUser;
import com.example.changefeed.repository.AppUserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only view of the users table.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class UserDirectory {

    private final AppUserRepository appUserRepository;

    public Optional<String> findUsername(Long userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return appUserRepository.findById(userId).map(AppUser::getUsername);
    }

    /**
     * Case-insensitive lookup; names without a matching user are simply absent
     * from the result.
     */
    public List<AppUser> findByUsernames(Collection<String> usernames) {
        if (usernames == null || usernames.isEmpty()) {
            return List.of();
        }
        List<String> lowered = usernames.stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        return appUserRepository.findByLowerCaseUsernames(lowered);
    }
}
