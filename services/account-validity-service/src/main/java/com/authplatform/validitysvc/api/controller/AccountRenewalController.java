package com.authplatform.validitysvc.api.controller;

import com.authplatform.validitysvc.api.dto.request.RenewalRequest;
import com.authplatform.validitysvc.api.dto.response.RenewalResponse;
import com.authplatform.validitysvc.api.view.RenewalPageRenderer;
import com.authplatform.validitysvc.domain.model.RenewalOutcome;
import com.authplatform.validitysvc.domain.notification.RenewalNotificationService;
import com.authplatform.validitysvc.domain.renewal.RenewalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/account-validity")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Account Renewal", description = "Account renewal endpoints")
public class AccountRenewalController {

    private final RenewalService renewalService;
    private final RenewalNotificationService notificationService;
    private final RenewalPageRenderer pageRenderer;

    @GetMapping(value = "/renew", produces = MediaType.TEXT_HTML_VALUE)
    @Operation(summary = "Renew from link", description = "Redeems the token of a renewal link and shows the result")
    @ApiResponse(responseCode = "200", description = "Account renewed, or already renewed with this link")
    @ApiResponse(responseCode = "404", description = "Unknown or replaced token")
    public ResponseEntity<String> renewFromLink(
            @RequestParam("token") String token,
            @AuthenticationPrincipal Jwt jwt) {

        RenewalOutcome outcome = renewalService.attemptRenewal(token, subjectOf(jwt));
        RenewalPageRenderer.RenderedPage page = pageRenderer.render(outcome);
        return ResponseEntity.status(page.status())
                .contentType(MediaType.TEXT_HTML)
                .body(page.html());
    }

    @PostMapping("/renew")
    @Operation(summary = "Renew", description = "Redeems a renewal link token or, when signed in, a renewal code")
    @ApiResponse(responseCode = "200", description = "Renewal outcome")
    @ApiResponse(responseCode = "400", description = "Missing token")
    public ResponseEntity<RenewalResponse> renew(
            @Valid @RequestBody RenewalRequest request,
            @AuthenticationPrincipal Jwt jwt) {

        RenewalOutcome outcome = renewalService.attemptRenewal(request.token().trim(), subjectOf(jwt));
        return ResponseEntity.ok(RenewalResponse.from(outcome));
    }

    @PostMapping("/send-mail")
    @Operation(summary = "Send renewal email", description = "Sends a renewal notice to the signed-in account")
    @ApiResponse(responseCode = "200", description = "Notice sent, or nothing to send to")
    @ApiResponse(responseCode = "400", description = "Account has no expiration")
    @ApiResponse(responseCode = "401", description = "Not authenticated")
    public ResponseEntity<Void> sendMail(@AuthenticationPrincipal Jwt jwt) {
        log.info("Renewal notice requested by account");
        notificationService.sendRenewalEmailToUser(jwt.getSubject());
        return ResponseEntity.ok().build();
    }

    private static String subjectOf(Jwt jwt) {
        return jwt == null ? null : jwt.getSubject();
    }
}
