package com.authplatform.validitysvc.infrastructure.directory;

import com.authplatform.validitysvc.domain.model.LegacyValidity;
import com.authplatform.validitysvc.domain.port.AccountDirectory;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link AccountDirectory} backed by the platform user-service internal API,
 * guarded by a circuit breaker.
 */
@Component
public class UserServiceDirectoryClient implements AccountDirectory {

    private static final Logger log = LoggerFactory.getLogger(UserServiceDirectoryClient.class);

    private final RestClient http;
    private final CircuitBreaker circuitBreaker;

    public UserServiceDirectoryClient(@Qualifier("userServiceRestClient") RestClient http) {
        this.http = http;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .ignoreExceptions(HttpClientErrorException.NotFound.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        this.circuitBreaker = registry.circuitBreaker("userService");
    }

    @Override
    public List<String> getEmailAddresses(String userId) {
        try {
            EmailAddressesResponse response = circuitBreaker.executeSupplier(() -> http.get()
                    .uri("/internal/v1/users/{userId}/emails", userId)
                    .retrieve()
                    .body(EmailAddressesResponse.class));
            return response == null || response.addresses() == null ? List.of() : response.addresses();
        } catch (HttpClientErrorException.NotFound e) {
            return List.of();
        }
    }

    @Override
    public Optional<String> getDisplayName(String userId) {
        try {
            ProfileResponse response = circuitBreaker.executeSupplier(() -> http.get()
                    .uri("/internal/v1/users/{userId}/profile", userId)
                    .retrieve()
                    .body(ProfileResponse.class));
            return Optional.ofNullable(response).map(ProfileResponse::displayName);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    @Override
    public List<String> listAccountIds(String afterUserId, int limit) {
        AccountIdsResponse response = circuitBreaker.executeSupplier(() -> http.get()
                .uri(uri -> uri.path("/internal/v1/users")
                        .queryParam("after", afterUserId == null ? "" : afterUserId)
                        .queryParam("limit", limit)
                        .build())
                .retrieve()
                .body(AccountIdsResponse.class));
        return response == null || response.userIds() == null ? List.of() : response.userIds();
    }

    /**
     * Legacy validity kept by user-service. A 404 means the host has no legacy data at all.
     */
    @Override
    public Map<String, LegacyValidity> findLegacyValidity(Collection<String> userIds) {
        if (userIds.isEmpty()) {
            return Map.of();
        }
        try {
            LegacyValidityResponse response = circuitBreaker.executeSupplier(() -> http.post()
                    .uri("/internal/v1/account-validity/legacy")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new LegacyValidityRequest(List.copyOf(userIds)))
                    .retrieve()
                    .body(LegacyValidityResponse.class));
            if (response == null || response.records() == null) {
                return Map.of();
            }
            return response.records().stream()
                    .collect(Collectors.toMap(LegacyValidity::userId, Function.identity(), (a, b) -> a));
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("user-service has no legacy validity data");
            return Map.of();
        }
    }

    public boolean isAvailable() {
        return circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    record EmailAddressesResponse(List<String> addresses) {
    }

    record ProfileResponse(String displayName) {
    }

    record AccountIdsResponse(List<String> userIds) {
    }

    record LegacyValidityRequest(List<String> userIds) {
    }

    record LegacyValidityResponse(List<LegacyValidity> records) {
    }
}
