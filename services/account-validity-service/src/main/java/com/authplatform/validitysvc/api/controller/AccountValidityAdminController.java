package com.authplatform.validitysvc.api.controller;

import com.authplatform.validitysvc.api.dto.request.AdminValidityRequest;
import com.authplatform.validitysvc.api.dto.response.AdminValidityResponse;
import com.authplatform.validitysvc.api.dto.response.ValidityStatusResponse;
import com.authplatform.validitysvc.domain.renewal.RenewalService;
import com.authplatform.validitysvc.domain.validity.ValidityStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/account-validity/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Account Validity Admin", description = "Operator endpoints")
public class AccountValidityAdminController {

    private final RenewalService renewalService;
    private final ValidityStore validityStore;

    @PostMapping
    @Operation(summary = "Set validity", description = "Sets an account's expiration and whether it gets renewal emails")
    @ApiResponse(responseCode = "200", description = "Validity written")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
    public ResponseEntity<AdminValidityResponse> setValidity(@Valid @RequestBody AdminValidityRequest request) {
        log.info("Validity override for userId={}", request.userId());
        long expirationTs = renewalService.setValidityFromAdmin(
                request.userId(), request.expirationTs(), request.renewalEmailsEnabled());
        return ResponseEntity.ok(new AdminValidityResponse(expirationTs));
    }

    @GetMapping("/users/{userId}")
    @Operation(summary = "Get validity status", description = "Tells whether an account is expired")
    @ApiResponse(responseCode = "200", description = "Status; fields are null for untracked accounts")
    @ApiResponse(responseCode = "403", description = "Caller is not an administrator")
    public ResponseEntity<ValidityStatusResponse> getStatus(@PathVariable String userId) {
        Boolean expired = renewalService.isExpired(userId).orElse(null);
        Long expirationTs = validityStore.getExpiration(userId).orElse(null);
        return ResponseEntity.ok(new ValidityStatusResponse(userId, expired, expirationTs));
    }
}
