package com.nnipa.iam.controller;

import com.nnipa.iam.dto.request.CurrentPasswordRequest;
import com.nnipa.iam.dto.request.EmailRequest;
import com.nnipa.iam.dto.request.LoginRequest;
import com.nnipa.iam.dto.request.TwoFactorVerificationRequest;
import com.nnipa.iam.dto.response.DispatchResponse;
import com.nnipa.iam.dto.response.ErrorResponse;
import com.nnipa.iam.dto.response.LoginResponse;
import com.nnipa.iam.security.CallerContext;
import com.nnipa.iam.service.AuthenticationService;
import com.nnipa.iam.service.EmailVerificationService;
import com.nnipa.iam.service.TwoFactorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for login, second factor and email confirmation endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Authentication", description = "Login, two-factor and email confirmation APIs")
public class AuthController {

    private final AuthenticationService authenticationService;
    private final TwoFactorService twoFactorService;
    private final EmailVerificationService emailVerificationService;

    @PostMapping("/login")
    @SecurityRequirements
    @Operation(summary = "Authenticate employee", description = "Login with email and password")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Authenticated, or second factor required",
                    content = @Content(schema = @Schema(implementation = LoginResponse.class))),
            @ApiResponse(responseCode = "401", description = "Invalid credentials",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        return OutcomeResponses.ok(authenticationService.login(request.getEmail(), request.getPassword()));
    }

    @PostMapping("/2fa/verify")
    @SecurityRequirements
    @Operation(summary = "Verify second factor", description = "Complete a login with the emailed code")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Authenticated",
                    content = @Content(schema = @Schema(implementation = LoginResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid request or invalid/expired code",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> verifyTwoFactor(@Valid @RequestBody TwoFactorVerificationRequest request) {
        return OutcomeResponses.ok(authenticationService.verifyTwoFactor(request.getUserId(), request.getCode()));
    }

    @PostMapping("/2fa/enable")
    @Operation(summary = "Enable two-factor authentication")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Two-factor authentication enabled"),
            @ApiResponse(responseCode = "400", description = "Current password is incorrect",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> enableTwoFactor(@AuthenticationPrincipal CallerContext caller,
                                             @Valid @RequestBody CurrentPasswordRequest request) {
        return OutcomeResponses.noContent(twoFactorService.enable(caller, request.getCurrentPassword()));
    }

    @PostMapping("/2fa/disable")
    @Operation(summary = "Disable two-factor authentication")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Two-factor authentication disabled"),
            @ApiResponse(responseCode = "400", description = "Current password is incorrect",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> disableTwoFactor(@AuthenticationPrincipal CallerContext caller,
                                              @Valid @RequestBody CurrentPasswordRequest request) {
        return OutcomeResponses.noContent(twoFactorService.disable(caller, request.getCurrentPassword()));
    }

    @GetMapping("/confirm-email")
    @SecurityRequirements
    @Operation(summary = "Confirm email address", description = "Target of the emailed confirmation link")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Email confirmed"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired link",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> confirmEmail(@RequestParam UUID userId, @RequestParam String token) {
        return OutcomeResponses.noContent(emailVerificationService.confirmEmail(userId, token));
    }

    @PostMapping("/resend-confirmation")
    @SecurityRequirements
    @Operation(summary = "Resend confirmation link",
            description = "Always acknowledges; a link is sent only to active, unconfirmed accounts")
    public ResponseEntity<DispatchResponse> resendConfirmation(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(emailVerificationService.resendConfirmation(request.getEmail()));
    }
}
