package com.flagship.vault_ledger.user;

import com.flagship.vault_ledger.exception.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Registers the user identities that vaults, memberships and transactions
 * refer to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;

    /**
     * Registers a user. Usernames are trimmed and must be unique.
     *
     * @param username the identity resolved by the calling front end
     * @return the stored username
     * @throws LedgerException EXISTING_KEY if the user is already registered
     */
    @Transactional
    public String createUser(String username) {
        String normalized = username == null ? "" : username.trim();
        if (normalized.isEmpty()) {
            throw LedgerException.invalidAmount("username must not be empty");
        }
        if (userRepository.existsById(normalized)) {
            throw LedgerException.existingKey(normalized);
        }
        userRepository.save(new UserEntity(normalized));
        log.info("User registered: username={}", normalized);
        return normalized;
    }

    /**
     * @throws LedgerException KEY_NOT_FOUND if the user is unknown
     */
    @Transactional
    public void requireUser(String username) {
        if (username == null || !userRepository.existsById(username)) {
            throw LedgerException.keyNotFound("user not exists");
        }
    }
}
