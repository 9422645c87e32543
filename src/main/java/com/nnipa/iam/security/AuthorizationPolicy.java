package com.nnipa.iam.security;

import com.nnipa.iam.config.SecurityProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Role-based authorization for administrative operations. Never consults the identity store.
 */
@Component
@RequiredArgsConstructor
public class AuthorizationPolicy {

    private final SecurityProperties securityProperties;

    /**
     * True when the caller holds at least one of the required roles, compared case-insensitively.
     * An empty required set allows nobody.
     */
    public static boolean allow(Collection<String> callerRoles, Collection<String> requiredRoles) {
        if (callerRoles == null || requiredRoles == null || requiredRoles.isEmpty()) {
            return false;
        }
        Set<String> required = normalize(requiredRoles);
        return callerRoles.stream()
                .filter(role -> role != null)
                .map(role -> role.toUpperCase(Locale.ROOT))
                .anyMatch(required::contains);
    }

    public boolean canRead(CallerContext caller) {
        return caller != null && allow(caller.getRoles(), securityProperties.getAdmin().getReadRoles());
    }

    public boolean canWrite(CallerContext caller) {
        return caller != null && allow(caller.getRoles(), securityProperties.getAdmin().getWriteRoles());
    }

    private static Set<String> normalize(Collection<String> roles) {
        return roles.stream()
                .filter(role -> role != null)
                .map(role -> role.toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
