package com.nnipa.iam.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement for requests that may send a message. Identical whether or not anything was sent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dispatch acknowledgement")
public class DispatchResponse {

    @Schema(description = "Always true", example = "true")
    private boolean sent;

    public static DispatchResponse accepted() {
        return new DispatchResponse(true);
    }
}
