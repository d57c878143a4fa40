package com.dnsfilter.api.account;

import com.dnsfilter.core.domain.Account;
import com.dnsfilter.core.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Account lifecycle: registration, approval, disabling.
 * New accounts cannot use tokens until approved.
 */
@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final Pattern USERNAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{2,63}$");
    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");
    static final int MIN_PASSWORD_LENGTH = 12;

    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    public AccountService(AccountRepository accountRepository, PasswordEncoder passwordEncoder) {
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional
    public Account register(String username, String email, String password) {
        if (username == null || !USERNAME.matcher(username).matches()) {
            throw new InvalidAccountException("Username must be 3-64 characters of letters, digits, '.', '_' or '-'");
        }
        if (email == null || email.length() > 254 || !EMAIL.matcher(email).matches()) {
            throw new InvalidAccountException("Invalid email address");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new InvalidAccountException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (accountRepository.existsByUsernameIgnoreCase(username)) {
            throw new DuplicateAccountException("Username already taken: " + username);
        }
        if (accountRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateAccountException("Email already registered");
        }

        Account account = accountRepository.save(Account.register(username, email, passwordEncoder.encode(password)));
        log.info("Registered account {} ({})", account.getUsername(), account.getId());
        return account;
    }

    @Transactional
    public Account approve(UUID accountId) {
        Account account = find(accountId);
        account.approve();
        log.info("Approved account {}", accountId);
        return account;
    }

    @Transactional
    public Account disable(UUID accountId) {
        Account account = find(accountId);
        account.disable();
        log.info("Disabled account {}", accountId);
        return account;
    }

    @Transactional
    public Account enable(UUID accountId) {
        Account account = find(accountId);
        account.enable();
        return account;
    }

    private Account find(UUID accountId) {
        return accountRepository.findById(accountId)
                .orElseThrow(() -> new AccountNotFoundException("Account not found: " + accountId));
    }

    public static class InvalidAccountException extends RuntimeException {
        public InvalidAccountException(String message) { super(message); }
    }

    public static class DuplicateAccountException extends RuntimeException {
        public DuplicateAccountException(String message) { super(message); }
    }

    public static class AccountNotFoundException extends RuntimeException {
        public AccountNotFoundException(String message) { super(message); }
    }
}
