package com.authplatform.validitysvc.domain.port;

import com.authplatform.validitysvc.domain.model.LegacyValidity;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host view of the accounts whose validity this service tracks.
 */
public interface AccountDirectory {

    /**
     * Verified email addresses attached to the account, empty if none.
     */
    List<String> getEmailAddresses(String userId);

    Optional<String> getDisplayName(String userId);

    /**
     * Account ids in ascending order, strictly after {@code afterUserId} ("" for the first page).
     */
    List<String> listAccountIds(String afterUserId, int limit);

    /**
     * Validity state the host kept for these accounts before this service existed.
     */
    default Map<String, LegacyValidity> findLegacyValidity(Collection<String> userIds) {
        return Map.of();
    }
}
