package com.nnipa.iam.controller;

import com.nnipa.iam.dto.request.CreateEmployeeRequest;
import com.nnipa.iam.dto.request.UpdateEmployeeRequest;
import com.nnipa.iam.dto.response.CreatedResponse;
import com.nnipa.iam.dto.response.EmployeeDetailResponse;
import com.nnipa.iam.dto.response.ErrorResponse;
import com.nnipa.iam.dto.response.PagedResponse;
import com.nnipa.iam.security.CallerContext;
import com.nnipa.iam.service.EmployeeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for administrative employee management.
 */
@Slf4j
@RestController
@RequestMapping("/admin/employees")
@RequiredArgsConstructor
@Tag(name = "Employee Administration", description = "Employee lifecycle APIs for administrators")
public class EmployeeController {

    private final EmployeeService employeeService;

    @GetMapping
    @Operation(summary = "List employees", description = "Requires ADMIN or MANAGER")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "One page of employees",
                    content = @Content(schema = @Schema(implementation = PagedResponse.class))),
            @ApiResponse(responseCode = "403", description = "Forbidden",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> list(@AuthenticationPrincipal CallerContext caller,
                                  @RequestParam(defaultValue = "1") int pageNumber,
                                  @RequestParam(defaultValue = "20") int pageSize,
                                  @RequestParam(required = false) String search,
                                  @RequestParam(defaultValue = "false") boolean includeInactive) {
        return OutcomeResponses.ok(employeeService.list(caller, pageNumber, pageSize, search, includeInactive));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get employee details", description = "Requires ADMIN or MANAGER")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Employee detail",
                    content = @Content(schema = @Schema(implementation = EmployeeDetailResponse.class))),
            @ApiResponse(responseCode = "404", description = "Not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> getDetails(@AuthenticationPrincipal CallerContext caller, @PathVariable UUID id) {
        return OutcomeResponses.ok(employeeService.getDetails(caller, id));
    }

    @PostMapping
    @Operation(summary = "Create employee", description = "Requires ADMIN")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Employee created",
                    content = @Content(schema = @Schema(implementation = CreatedResponse.class))),
            @ApiResponse(responseCode = "409", description = "Email already in use",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> create(@AuthenticationPrincipal CallerContext caller,
                                    @Valid @RequestBody CreateEmployeeRequest request) {
        log.info("Create employee request for: {}", request.getEmail());
        return OutcomeResponses.created(employeeService.create(caller, request));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update employee", description = "Requires ADMIN. The role list replaces the current roles.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Employee updated"),
            @ApiResponse(responseCode = "404", description = "Not found",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<?> update(@AuthenticationPrincipal CallerContext caller,
                                    @PathVariable UUID id,
                                    @Valid @RequestBody UpdateEmployeeRequest request) {
        return OutcomeResponses.noContent(employeeService.update(caller, id, request));
    }

    @PostMapping("/{id}/activate")
    @Operation(summary = "Activate employee", description = "Requires ADMIN")
    public ResponseEntity<?> activate(@AuthenticationPrincipal CallerContext caller, @PathVariable UUID id) {
        return OutcomeResponses.noContent(employeeService.activate(caller, id));
    }

    @PostMapping("/{id}/deactivate")
    @Operation(summary = "Deactivate employee", description = "Requires ADMIN")
    public ResponseEntity<?> deactivate(@AuthenticationPrincipal CallerContext caller, @PathVariable UUID id) {
        return OutcomeResponses.noContent(employeeService.deactivate(caller, id));
    }
}
