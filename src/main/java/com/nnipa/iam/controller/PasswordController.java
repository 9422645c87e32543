package com.nnipa.iam.controller;

import com.nnipa.iam.dto.request.ChangePasswordRequest;
import com.nnipa.iam.dto.request.EmailRequest;
import com.nnipa.iam.dto.request.ResetPasswordRequest;
import com.nnipa.iam.dto.response.DispatchResponse;
import com.nnipa.iam.dto.response.ErrorResponse;
import com.nnipa.iam.security.CallerContext;
import com.nnipa.iam.service.PasswordService;
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
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for password management endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
@Tag(name = "Password Management", description = "Password change and reset APIs")
public class PasswordController {

    private final PasswordService passwordService;

    @PostMapping("/forgot-password")
    @SecurityRequirements
    @Operation(summary = "Request password reset",
            description = "Always acknowledges; a reset link is sent only to active, confirmed accounts")
    public ResponseEntity<DispatchResponse> forgotPassword(@Valid @RequestBody EmailRequest request) {
        return ResponseEntity.ok(passwordService.forgotPassword(request.getEmail()));
    }

    @PostMapping("/reset-password")
    @SecurityRequirements
    @Operation(summary = "Reset password", description = "Set a new password using the emailed reset token")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Password reset"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired link, or weak password",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> resetPassword(@Valid @RequestBody ResetPasswordRequest request) {
        return OutcomeResponses.noContent(
                passwordService.resetPassword(request.getEmail(), request.getToken(), request.getNewPassword()));
    }

    @PostMapping("/change-password")
    @Operation(summary = "Change password", description = "Change the password of the authenticated employee")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "400", description = "Wrong current password or weak new password",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> changePassword(@AuthenticationPrincipal CallerContext caller,
                                            @Valid @RequestBody ChangePasswordRequest request) {
        return OutcomeResponses.noContent(
                passwordService.changePassword(caller, request.getCurrentPassword(), request.getNewPassword()));
    }
}
