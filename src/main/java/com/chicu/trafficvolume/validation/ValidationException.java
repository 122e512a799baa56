package com.chicu.trafficvolume.validation;

import com.chicu.trafficvolume.common.error.ErrorKind;
import com.chicu.trafficvolume.common.error.TrafficApiException;

import java.util.List;
import java.util.stream.Collectors;

public class ValidationException extends TrafficApiException {

    private final List<FieldViolation> violations;

    public ValidationException(List<FieldViolation> violations) {
        super(ErrorKind.VALIDATION_ERROR, describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    private static String describe(List<FieldViolation> violations) {
        return "Invalid input data: " + violations.stream()
                .map(FieldViolation::toString)
                .collect(Collectors.joining("; "));
    }
}
