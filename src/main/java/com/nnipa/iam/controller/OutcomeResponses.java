package com.nnipa.iam.controller;

import com.nnipa.iam.dto.response.ErrorResponse;
import com.nnipa.iam.service.AuthOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Translates service outcomes into HTTP responses.
 */
final class OutcomeResponses {

    private OutcomeResponses() {
    }

    static ResponseEntity<?> ok(AuthOutcome<?> outcome) {
        return respond(outcome, HttpStatus.OK);
    }

    static ResponseEntity<?> created(AuthOutcome<?> outcome) {
        return respond(outcome, HttpStatus.CREATED);
    }

    static ResponseEntity<?> noContent(AuthOutcome<Void> outcome) {
        if (outcome.isSuccess()) {
            return ResponseEntity.noContent().build();
        }
        return error(outcome);
    }

    static ResponseEntity<ErrorResponse> error(AuthOutcome<?> outcome) {
        return ResponseEntity.status(outcome.getError().getStatus())
                .body(ErrorResponse.of(outcome.getError(), outcome.getDetails()));
    }

    private static ResponseEntity<?> respond(AuthOutcome<?> outcome, HttpStatus status) {
        if (outcome.isSuccess()) {
            return ResponseEntity.status(status).body(outcome.getValue());
        }
        return error(outcome);
    }
}
