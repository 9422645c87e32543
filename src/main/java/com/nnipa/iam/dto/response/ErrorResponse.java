package com.nnipa.iam.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.nnipa.iam.exception.AuthErrorCode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Error envelope returned for every failed request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response")
public class ErrorResponse {

    @Schema(description = "Response status", example = "error")
    @Builder.Default
    private String status = "error";

    @Schema(description = "Error message", example = "Invalid email or password")
    private String message;

    @Schema(description = "Error code", example = "INVALID_CREDENTIALS")
    private String errorCode;

    @Schema(description = "Validation or rule messages")
    private List<String> details;

    @Schema(description = "Response timestamp")
    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    public static ErrorResponse of(AuthErrorCode code) {
        return of(code, null);
    }

    public static ErrorResponse of(AuthErrorCode code, List<String> details) {
        return ErrorResponse.builder()
                .message(code.getMessage())
                .errorCode(code.getCode())
                .details(details == null || details.isEmpty() ? null : details)
                .build();
    }
}
