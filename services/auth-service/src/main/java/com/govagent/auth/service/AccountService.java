package com.govagent.auth.service;

import com.govagent.auth.dto.AccountResponse;
import com.govagent.auth.dto.AuthResponse;
import com.govagent.auth.dto.ChangePasswordRequest;
import com.govagent.auth.dto.LoginRequest;
import com.govagent.auth.dto.RegisterRequest;
import com.govagent.auth.entity.Account;
import com.govagent.auth.exception.AccountNotFoundException;
import com.govagent.auth.exception.CredentialException;
import com.govagent.auth.exception.CryptoFailureException;
import com.govagent.auth.exception.DuplicateAccountException;
import com.govagent.auth.exception.InvalidCredentialsException;
import com.govagent.auth.exception.StoreUnavailableException;
import com.govagent.auth.exception.ValidationException;
import com.govagent.auth.repository.AccountRepository;
import com.govagent.auth.security.CredentialHasher;
import com.govagent.auth.security.IssuedToken;
import com.govagent.auth.security.TokenService;
import io.jsonwebtoken.JwtException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * AccountService - Registration, login, password change and profile lookup.
 *
 * Each flow receives a parsed request, talks to the {@link AccountRepository}
 * for reads and writes and to {@link CredentialHasher} / {@link TokenService}
 * for cryptography. Nothing here knows about HTTP.
 *
 * Asynchrony:
 * - Password hashing and verification run on the hashing pool, so the
 *   password flows return {@link CompletableFuture}s
 * - Every failure, including input validation, completes the returned future
 *   exceptionally with a {@link CredentialException}; flows never throw
 *   directly
 *
 * Failure Translation:
 * - Unique index violations on insert -> {@link DuplicateAccountException}
 * - Any other store error -> {@link StoreUnavailableException}
 * - Token signing errors -> {@link CryptoFailureException}
 * Nothing is retried.
 *
 * Account Enumeration:
 * Login against an unknown identifier is reported exactly like a wrong
 * password unless {@code auth.login.reveal-unknown-account} is enabled.
 *
 * @see TokenService for token issuance
 * @see CredentialHasher for password verifiers
 */
@Slf4j
@Service
public class AccountService {

    static final String INVALID_CREDENTIALS = "Invalid credentials.";
    static final String ACCOUNT_NOT_FOUND = "User not found.";

    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;
    private final TokenService tokenService;
    private final Validator validator;
    private final TransactionTemplate transactionTemplate;
    private final boolean revealUnknownAccount;

    public AccountService(AccountRepository accountRepository,
                          CredentialHasher credentialHasher,
                          TokenService tokenService,
                          Validator validator,
                          TransactionTemplate transactionTemplate,
                          @Value("${auth.login.reveal-unknown-account:false}") boolean revealUnknownAccount) {
        this.accountRepository = accountRepository;
        this.credentialHasher = credentialHasher;
        this.tokenService = tokenService;
        this.validator = validator;
        this.transactionTemplate = transactionTemplate;
        this.revealUnknownAccount = revealUnknownAccount;
    }

    /**
     * Create an account and sign the new account in.
     *
     * Flow:
     * 1. Trim email and login name, then validate every required field
     * 2. Reject an email or login name that is already taken (advisory check)
     * 3. Hash the password on the hashing pool
     * 4. Insert the account and issue a token in one transaction; a unique
     *    index violation here means a concurrent registration won the race
     *
     * Either exactly one account is written and a token returned, or nothing
     * is written.
     *
     * @param request registration payload
     * @return future success response with token and sanitised account
     */
    public CompletableFuture<AuthResponse> register(RegisterRequest request) {
        return validated(trimIdentity(request), "Please fill all required fields.")
                .thenCompose(valid -> {
                    requireHashable("password", valid.getPassword());
                    String email = normalizeEmail(valid.getEmail());
                    String loginName = valid.getLoginName();
                    log.info("Registration attempt for email: {}", email);

                    if (read(() -> accountRepository.existsByEmail(email))) {
                        log.info("Registration rejected, email already registered: {}", email);
                        throw new DuplicateAccountException("User already exists with this email.");
                    }
                    if (read(() -> accountRepository.existsByLoginName(loginName))) {
                        log.info("Registration rejected, login name taken: {}", loginName);
                        throw new DuplicateAccountException("Login name is already taken.");
                    }

                    return credentialHasher.hash(valid.getPassword())
                            .thenApply(verifier -> Account.builder()
                                    .loginName(loginName)
                                    .email(email)
                                    .passwordHash(verifier)
                                    .phoneNumber(valid.getPhoneNumber().trim())
                                    .dateOfBirth(valid.getDateOfBirth())
                                    .gender(valid.getGender().trim())
                                    .address(valid.getAddress().trim())
                                    .build())
                            .thenApply(this::createAndSignIn);
                });
    }

    /**
     * Authenticate with an email or login name and a password.
     *
     * @param request login payload
     * @return future success response with token and sanitised account
     */
    public CompletableFuture<AuthResponse> login(LoginRequest request) {
        return validated(request, "Please provide both identifier and password.")
                .thenCompose(valid -> {
                    String identifier = valid.getIdentifier().trim();
                    Optional<Account> found = read(() -> findByIdentifier(identifier));
                    if (found.isEmpty()) {
                        log.debug("Login failed, no account for identifier: {}", identifier);
                        throw revealUnknownAccount
                                ? new AccountNotFoundException(ACCOUNT_NOT_FOUND)
                                : new InvalidCredentialsException(INVALID_CREDENTIALS);
                    }

                    Account account = found.get();
                    return credentialHasher.verify(valid.getPassword(), account.getPasswordHash())
                            .thenApply(matches -> {
                                if (!matches) {
                                    log.debug("Login failed, wrong password for account: {}", account.getId());
                                    throw new InvalidCredentialsException(INVALID_CREDENTIALS);
                                }
                                log.info("Account authenticated successfully: {}", account.getId());
                                return signedIn(account, issueToken(account), "Login successful!");
                            });
                });
    }

    /**
     * Replace the password of the token's subject.
     *
     * The account is identified only by {@code accountId}, which the caller
     * must take from a verified session token. Tokens issued before the change
     * remain valid until they expire.
     *
     * @param accountId verified token subject
     * @param request old and new password
     * @return future success response without a token
     */
    public CompletableFuture<AuthResponse> changePassword(UUID accountId, ChangePasswordRequest request) {
        return validated(request, "Please provide old password and new password.")
                .thenCompose(valid -> {
                    requireHashable("newPassword", valid.getNewPassword());
                    log.info("Password change attempt for account: {}", accountId);
                    Account account = read(() -> accountRepository.findById(accountId))
                            .orElseThrow(() -> new AccountNotFoundException(ACCOUNT_NOT_FOUND));
                    String verifiedHash = account.getPasswordHash();

                    return credentialHasher.verify(valid.getOldPassword(), verifiedHash)
                            .thenCompose(matches -> {
                                if (!matches) {
                                    log.info("Password change rejected, old password mismatch for account: {}", accountId);
                                    throw new InvalidCredentialsException("Old password is incorrect.");
                                }
                                return credentialHasher.hash(valid.getNewPassword());
                            })
                            .thenApply(newHash -> {
                                replaceVerifier(accountId, verifiedHash, newHash);
                                log.info("Password changed for account: {}", accountId);
                                return AuthResponse.builder()
                                        .success(true)
                                        .message("Password changed successfully!")
                                        .build();
                            });
                });
    }

    /**
     * Load the sanitised profile of the token's subject.
     *
     * @param accountId verified token subject
     * @return account projection without the verifier
     * @throws AccountNotFoundException if the account no longer exists
     */
    public AccountResponse getProfile(UUID accountId) {
        return read(() -> accountRepository.findById(accountId))
                .map(AccountResponse::from)
                .orElseThrow(() -> new AccountNotFoundException(ACCOUNT_NOT_FOUND));
    }

    private Optional<Account> findByIdentifier(String identifier) {
        if (identifier.contains("@")) {
            return accountRepository.findByEmail(normalizeEmail(identifier));
        }
        return accountRepository.findByLoginName(identifier);
    }

    /**
     * Insert and issue the token in one transaction so a signing failure
     * leaves no account behind.
     */
    private AuthResponse createAndSignIn(Account account) {
        try {
            AuthResponse response = transactionTemplate.execute(status -> {
                Account saved = accountRepository.saveAndFlush(account);
                return signedIn(saved, issueToken(saved), "Registration successful!");
            });
            log.info("Account registered successfully: {}", response.getAccount().getId());
            return response;
        } catch (DataIntegrityViolationException e) {
            log.info("Registration lost a uniqueness race for email: {}", account.getEmail());
            throw new DuplicateAccountException("An account with this email or login name already exists.", e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Account store failed while registering email: {}", account.getEmail(), e);
            throw new StoreUnavailableException("Account store unavailable", e);
        }
    }

    /**
     * Overwrite the verifier only if it is still the one the old password was
     * checked against; a concurrent change in between makes this attempt fail.
     */
    private void replaceVerifier(UUID accountId, String expectedHash, String newHash) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Account current = accountRepository.findById(accountId)
                        .orElseThrow(() -> new AccountNotFoundException(ACCOUNT_NOT_FOUND));
                if (!expectedHash.equals(current.getPasswordHash())) {
                    throw new InvalidCredentialsException("Old password is incorrect.");
                }
                current.setPasswordHash(newHash);
                accountRepository.saveAndFlush(current);
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Account store failed while changing password for account: {}", accountId, e);
            throw new StoreUnavailableException("Account store unavailable", e);
        }
    }

    private IssuedToken issueToken(Account account) {
        try {
            return tokenService.issue(account.getId(), account.getLoginName(), account.getEmail());
        } catch (JwtException e) {
            throw new CryptoFailureException("Token signing failed", e);
        }
    }

    private static AuthResponse signedIn(Account account, IssuedToken token, String message) {
        return AuthResponse.builder()
                .success(true)
                .message(message)
                .token(token.getToken())
                .tokenType("Bearer")
                .expiresAt(token.getExpiresAt())
                .account(AccountResponse.from(account))
                .build();
    }

    private <T> T read(Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("Account store read failed", e);
            throw new StoreUnavailableException("Account store unavailable", e);
        }
    }

    /**
     * Run bean validation and turn violations into a field map.
     *
     * @param requiredMessage message used when a required field is missing
     */
    private <T> CompletableFuture<T> validated(T request, String requiredMessage) {
        if (request == null) {
            return CompletableFuture.failedFuture(new ValidationException("Request body is required."));
        }
        Set<ConstraintViolation<T>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return CompletableFuture.completedFuture(request);
        }

        Map<String, String> fields = new TreeMap<>();
        boolean missing = false;
        for (ConstraintViolation<T> violation : violations) {
            fields.merge(violation.getPropertyPath().toString(), violation.getMessage(), (a, b) -> a + "; " + b);
            Class<?> constraint = violation.getConstraintDescriptor().getAnnotation().annotationType();
            missing |= constraint == NotBlank.class || constraint == NotNull.class;
        }
        String message = missing ? requiredMessage : "Invalid request.";
        return CompletableFuture.failedFuture(new ValidationException(message, fields));
    }

    /**
     * Copy of the request with surrounding whitespace removed from the
     * identity fields, so format checks see what will be stored.
     */
    private static RegisterRequest trimIdentity(RegisterRequest request) {
        if (request == null) {
            return null;
        }
        return RegisterRequest.builder()
                .loginName(trimOrNull(request.getLoginName()))
                .email(trimOrNull(request.getEmail()))
                .password(request.getPassword())
                .phoneNumber(request.getPhoneNumber())
                .dateOfBirth(request.getDateOfBirth())
                .gender(request.getGender())
                .address(request.getAddress())
                .build();
    }

    private static String trimOrNull(String value) {
        return value == null ? null : value.trim();
    }

    /** BCrypt ignores input past its byte limit; refuse such passwords up front. */
    private static void requireHashable(String field, String password) {
        if (CredentialHasher.exceedsLimit(password)) {
            throw new ValidationException("Invalid request.",
                    Map.of(field, "must be at most " + CredentialHasher.MAX_SECRET_BYTES + " bytes"));
        }
    }

    static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
