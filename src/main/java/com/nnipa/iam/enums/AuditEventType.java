package com.nnipa.iam.enums;

/**
 * Audited authentication and administrative events.
 */
public enum AuditEventType {
    LOGIN_SUCCESS,
    LOGIN_FAILURE,
    TWO_FACTOR_CHALLENGE,
    TWO_FACTOR_SUCCESS,
    TWO_FACTOR_FAILURE,
    ACCOUNT_LOCKED,
    TWO_FACTOR_ENABLED,
    TWO_FACTOR_DISABLED,
    PASSWORD_CHANGE,
    PASSWORD_RESET,
    EMAIL_CONFIRMED,
    EMPLOYEE_CREATED,
    EMPLOYEE_UPDATED,
    EMPLOYEE_ACTIVATED,
    EMPLOYEE_DEACTIVATED
}
