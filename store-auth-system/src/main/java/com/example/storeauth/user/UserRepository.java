package com.example.storeauth.user;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByEmail(String email);

    Optional<User> findByEmailOrUsername(String email, String username);

    boolean existsByEmailOrUsername(String email, String username);

    boolean existsByUsernameAndIdNot(String username, Long id);

    Optional<User> findByEmailVerificationTokenHashAndEmailVerificationExpiresAtAfter(String tokenHash, Instant now);

    Optional<User> findByPasswordResetTokenHashAndPasswordResetExpiresAtAfter(String tokenHash, Instant now);

    /**
     * Ends the session holding {@code refreshToken}, whichever user it belongs to.
     *
     * @return number of sessions cleared, 0 when the token is no longer current
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.refreshToken = NULL WHERE u.refreshToken = :refreshToken")
    int clearRefreshToken(@Param("refreshToken") String refreshToken);

    /**
     * Ends the session of user {@code id} only if it still holds {@code refreshToken}, so a
     * newer login that overwrote the token in the meantime survives.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE User u SET u.refreshToken = NULL WHERE u.id = :id AND u.refreshToken = :refreshToken")
    int clearRefreshTokenIfCurrent(@Param("id") Long id, @Param("refreshToken") String refreshToken);
}
