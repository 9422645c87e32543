package com.nnipa.iam.service;

import com.nnipa.iam.dto.request.CreateEmployeeRequest;
import com.nnipa.iam.dto.request.UpdateEmployeeRequest;
import com.nnipa.iam.dto.response.CreatedResponse;
import com.nnipa.iam.dto.response.EmployeeDetailResponse;
import com.nnipa.iam.dto.response.EmployeeSummaryResponse;
import com.nnipa.iam.dto.response.PagedResponse;
import com.nnipa.iam.entity.Identity;
import com.nnipa.iam.entity.Role;
import com.nnipa.iam.enums.AuditEventType;
import com.nnipa.iam.enums.CodePurpose;
import com.nnipa.iam.exception.AuthErrorCode;
import com.nnipa.iam.security.AuthorizationPolicy;
import com.nnipa.iam.security.CallerContext;
import com.nnipa.iam.store.IdentityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Administrative employee lifecycle. Every operation checks the caller's roles first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmployeeService {

    static final int MAX_PAGE_SIZE = 100;
    static final String DEFAULT_ROLE = "EMPLOYEE";

    private final IdentityStore identityStore;
    private final AuthorizationPolicy authorizationPolicy;
    private final PasswordEncoder passwordEncoder;
    private final PasswordPolicyService passwordPolicyService;
    private final OneTimeCodeService oneTimeCodeService;
    private final RateLimitingService rateLimitingService;
    private final AccountNotificationService accountNotificationService;
    private final AuditService auditService;
    private final Clock clock;

    @Transactional(readOnly = true)
    public AuthOutcome<PagedResponse<EmployeeSummaryResponse>> list(CallerContext caller, int pageNumber, int pageSize,
                                                                    String search, boolean includeInactive) {
        if (!authorizationPolicy.canRead(caller)) {
            return AuthOutcome.failure(AuthErrorCode.FORBIDDEN);
        }
        List<String> violations = new ArrayList<>();
        if (pageNumber < 1) {
            violations.add("pageNumber must be at least 1");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            violations.add("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (!violations.isEmpty()) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, violations);
        }

        PageRequest pageable = PageRequest.of(pageNumber - 1, pageSize, Sort.by("normalizedEmail", "id"));
        Page<Identity> page = identityStore.search(search, includeInactive, pageable);
        return AuthOutcome.success(PagedResponse.of(page, EmployeeSummaryResponse::from));
    }

    @Transactional(readOnly = true)
    public AuthOutcome<EmployeeDetailResponse> getDetails(CallerContext caller, UUID id) {
        if (!authorizationPolicy.canRead(caller)) {
            return AuthOutcome.failure(AuthErrorCode.FORBIDDEN);
        }
        return identityStore.findById(id)
                .map(identity -> AuthOutcome.success(EmployeeDetailResponse.from(identity, LocalDateTime.now(clock))))
                .orElseGet(() -> AuthOutcome.failure(AuthErrorCode.NOT_FOUND));
    }

    /**
     * Create an active, unconfirmed identity and send it a confirmation link.
     */
    @Transactional
    public AuthOutcome<CreatedResponse> create(CallerContext caller, CreateEmployeeRequest request) {
        if (!authorizationPolicy.canWrite(caller)) {
            return AuthOutcome.failure(AuthErrorCode.FORBIDDEN);
        }
        if (!StringUtils.hasText(request.getEmail()) || !StringUtils.hasText(request.getFullName())) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, List.of("Email and full name are required"));
        }
        List<String> violations = passwordPolicyService.validate(request.getPassword(), request.getEmail());
        if (!violations.isEmpty()) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, violations);
        }

        List<String> requestedRoles = request.getRoles() == null || request.getRoles().isEmpty()
                ? List.of(DEFAULT_ROLE)
                : request.getRoles();
        AuthOutcome<Set<Role>> roles = resolveRoles(requestedRoles);
        if (roles.isFailure()) {
            return roles.propagate();
        }
        if (identityStore.existsByEmail(request.getEmail())) {
            return AuthOutcome.failure(AuthErrorCode.CONFLICT, List.of("An identity with this email already exists"));
        }

        Identity identity = identityStore.create(Identity.builder()
                .email(request.getEmail().trim())
                .fullName(request.getFullName().trim())
                .phoneNumber(trimToNull(request.getPhoneNumber()))
                .passwordHash(passwordEncoder.encode(request.getPassword()))
                .roles(new HashSet<>(roles.getValue()))
                .build());

        if (rateLimitingService.tryAcquireDispatch(identity.getEmail())) {
            String token = oneTimeCodeService.issue(identity.getId(), CodePurpose.EMAIL_CONFIRMATION);
            accountNotificationService.sendEmailConfirmation(identity.getId(), identity.getEmail(), token);
        }

        auditService.record(AuditEventType.EMPLOYEE_CREATED, identity.getId(), caller.getUserId(), true,
                "Roles: " + identity.getRoleNames());
        log.info("Employee created: {} by {}", identity.getEmail(), caller.getUserId());
        return AuthOutcome.success(new CreatedResponse(identity.getId()));
    }

    /**
     * Update profile fields that are present and replace the role set with the given roles.
     */
    @Transactional
    public AuthOutcome<Void> update(CallerContext caller, UUID id, UpdateEmployeeRequest request) {
        if (!authorizationPolicy.canWrite(caller)) {
            return AuthOutcome.failure(AuthErrorCode.FORBIDDEN);
        }
        Identity identity = identityStore.findById(id).orElse(null);
        if (identity == null) {
            return AuthOutcome.failure(AuthErrorCode.NOT_FOUND);
        }
        if (request.getRoles() == null) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, List.of("roles is required"));
        }
        if (request.getFullName() != null && !StringUtils.hasText(request.getFullName())) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, List.of("fullName must not be blank"));
        }
        AuthOutcome<Set<Role>> resolved = resolveRoles(request.getRoles());
        if (resolved.isFailure()) {
            return resolved.propagate();
        }

        if (request.getFullName() != null) {
            identity.setFullName(request.getFullName().trim());
        }
        if (request.getPhoneNumber() != null) {
            identity.setPhoneNumber(trimToNull(request.getPhoneNumber()));
        }
        identityStore.update(identity);

        Set<Role> target = resolved.getValue();
        Set<Role> current = new HashSet<>(identity.getRoles());
        Set<Role> granted = target.stream()
                .filter(role -> !current.contains(role))
                .collect(Collectors.toSet());
        Set<Role> revoked = current.stream()
                .filter(role -> !target.contains(role))
                .collect(Collectors.toSet());
        identityStore.addRoles(identity, granted);
        identityStore.removeRoles(identity, revoked);

        auditService.record(AuditEventType.EMPLOYEE_UPDATED, identity.getId(), caller.getUserId(), true,
                "Roles: " + identity.getRoleNames());
        log.info("Employee updated: {} by {}", identity.getEmail(), caller.getUserId());
        return AuthOutcome.success();
    }

    @Transactional
    public AuthOutcome<Void> activate(CallerContext caller, UUID id) {
        if (!authorizationPolicy.canWrite(caller)) {
            return AuthOutcome.failure(AuthErrorCode.FORBIDDEN);
        }
        Identity identity = identityStore.findById(id).orElse(null);
        if (identity == null) {
            return AuthOutcome.failure(AuthErrorCode.NOT_FOUND);
        }
        if (identity.isActive()) {
            return AuthOutcome.success();
        }

        identity.setActive(true);
        identity.setLockoutUntil(null);
        identity.setFailedAccessCount(0);
        identityStore.update(identity);

        auditService.record(AuditEventType.EMPLOYEE_ACTIVATED, identity.getId(), caller.getUserId(), true, null);
        log.info("Employee activated: {} by {}", identity.getEmail(), caller.getUserId());
        return AuthOutcome.success();
    }

    /**
     * Deactivate an identity; it can no longer authenticate until activated again.
     */
    @Transactional
    public AuthOutcome<Void> deactivate(CallerContext caller, UUID id) {
        if (!authorizationPolicy.canWrite(caller)) {
            return AuthOutcome.failure(AuthErrorCode.FORBIDDEN);
        }
        Identity identity = identityStore.findById(id).orElse(null);
        if (identity == null) {
            return AuthOutcome.failure(AuthErrorCode.NOT_FOUND);
        }
        if (identity.getId().equals(caller.getUserId())) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, List.of("You cannot deactivate your own account"));
        }
        if (!identity.isActive() && Identity.PERMANENT_LOCKOUT.equals(identity.getLockoutUntil())) {
            return AuthOutcome.success();
        }

        identity.setActive(false);
        identity.setLockoutUntil(Identity.PERMANENT_LOCKOUT);
        identityStore.update(identity);

        auditService.record(AuditEventType.EMPLOYEE_DEACTIVATED, identity.getId(), caller.getUserId(), true, null);
        log.info("Employee deactivated: {} by {}", identity.getEmail(), caller.getUserId());
        return AuthOutcome.success();
    }

    private AuthOutcome<Set<Role>> resolveRoles(List<String> names) {
        Set<String> normalized = names.stream()
                .filter(StringUtils::hasText)
                .map(name -> name.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));

        List<Role> found = identityStore.findRolesByNames(normalized);
        Set<String> foundNames = found.stream().map(Role::getName).collect(Collectors.toSet());
        List<String> unknown = normalized.stream()
                .filter(name -> !foundNames.contains(name))
                .map(name -> "Unknown role: " + name)
                .toList();
        if (!unknown.isEmpty()) {
            return AuthOutcome.failure(AuthErrorCode.VALIDATION_ERROR, unknown);
        }
        return AuthOutcome.success(new HashSet<>(found));
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
