package com.govagent.auth.repository;

import com.govagent.auth.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * AccountRepository - Data Access Layer for Account entities.
 * 
 * This is the account store the credential flows depend on. Spring Data JPA
 * generates the implementation at runtime from the method names.
 * 
 * Operations used by the flows:
 * - findByEmail: lookup by normalised (lower-case) email
 * - findByLoginName: lookup by login name
 * - findById: lookup by identifier (inherited)
 * - saveAndFlush: create or update (inherited); flushing makes unique index
 *   violations surface as {@link org.springframework.dao.DataIntegrityViolationException}
 *   inside the call rather than at some later commit
 * 
 * Query Generation:
 * - findByEmail -> SELECT * FROM accounts WHERE email = ?
 * - findByLoginName -> SELECT * FROM accounts WHERE login_name = ?
 * 
 * @see Account for entity definition
 * @see com.govagent.auth.service.AccountService for business logic using this repository
 */
@Repository
public interface AccountRepository extends JpaRepository<Account, UUID> {

    /**
     * Find an account by email address.
     * 
     * Emails are stored lower-cased, so callers pass the normalised value.
     * 
     * @param email normalised email address
     * @return Optional containing the Account if found
     */
    Optional<Account> findByEmail(String email);

    /**
     * Find an account by its login name.
     * 
     * @param loginName trimmed login name
     * @return Optional containing the Account if found
     */
    Optional<Account> findByLoginName(String loginName);

    boolean existsByEmail(String email);

    boolean existsByLoginName(String loginName);
}
