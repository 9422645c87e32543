package com.nnipa.iam.enums;

/**
 * Purposes a one-time code can be issued for. A code only validates for the purpose it was issued for.
 */
public enum CodePurpose {
    TWO_FACTOR,
    EMAIL_CONFIRMATION,
    PASSWORD_RESET
}
