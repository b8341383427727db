package com.authplatform.validitysvc.infra.persistence;

import com.authplatform.validitysvc.domain.model.AccountValidity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface AccountValidityRepository extends JpaRepository<AccountValidity, String> {

    @Query("SELECT a.expirationTsMs FROM AccountValidity a WHERE a.userId = :userId")
    Optional<Long> findExpirationTsByUserId(@Param("userId") String userId);

    Optional<AccountValidity> findByLongRenewalToken(String longRenewalToken);

    Optional<AccountValidity> findByLongRenewalTokenAndUserId(String longRenewalToken, String userId);

    Optional<AccountValidity> findByShortRenewalTokenAndUserId(String shortRenewalToken, String userId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountValidity a SET a.longRenewalToken = :token, a.shortRenewalToken = NULL, "
            + "a.tokenUsedTsMs = NULL WHERE a.userId = :userId")
    int updateLongRenewalToken(@Param("userId") String userId, @Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountValidity a SET a.shortRenewalToken = :token, a.longRenewalToken = NULL, "
            + "a.tokenUsedTsMs = NULL WHERE a.userId = :userId")
    int updateShortRenewalToken(@Param("userId") String userId, @Param("token") String token);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountValidity a SET a.expirationTsMs = :expirationTs, a.emailSent = :emailSent, "
            + "a.tokenUsedTsMs = :usedTs WHERE a.userId = :userId AND a.longRenewalToken = :token "
            + "AND a.tokenUsedTsMs IS NULL")
    int consumeLongRenewalToken(@Param("userId") String userId,
                                @Param("token") String token,
                                @Param("expirationTs") long expirationTs,
                                @Param("emailSent") boolean emailSent,
                                @Param("usedTs") long usedTs);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountValidity a SET a.expirationTsMs = :expirationTs, a.emailSent = :emailSent, "
            + "a.tokenUsedTsMs = :usedTs WHERE a.userId = :userId AND a.shortRenewalToken = :token "
            + "AND a.tokenUsedTsMs IS NULL")
    int consumeShortRenewalToken(@Param("userId") String userId,
                                 @Param("token") String token,
                                 @Param("expirationTs") long expirationTs,
                                 @Param("emailSent") boolean emailSent,
                                 @Param("usedTs") long usedTs);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE AccountValidity a SET a.emailSent = :emailSent WHERE a.userId = :userId")
    int updateEmailSent(@Param("userId") String userId, @Param("emailSent") boolean emailSent);

    @Query("SELECT a FROM AccountValidity a WHERE a.emailSent = false AND a.expirationTsMs <= :threshold "
            + "AND a.userId > :afterUserId ORDER BY a.userId ASC")
    List<AccountValidity> findExpiringAfter(@Param("threshold") long threshold,
                                             @Param("afterUserId") String afterUserId,
                                             Pageable pageable);

    @Query("SELECT a.userId FROM AccountValidity a WHERE a.userId IN :userIds")
    List<String> findExistingUserIds(@Param("userIds") Collection<String> userIds);
}
