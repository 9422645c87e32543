package com.nnipa.iam.dto.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Identifier of a created resource")
public class CreatedResponse {

    @Schema(description = "Resource ID")
    private UUID id;
}
