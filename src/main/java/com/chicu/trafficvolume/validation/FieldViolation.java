package com.chicu.trafficvolume.validation;

/**
 * One rejected input field.
 *
 * @param field   wire name of the field
 * @param message what is wrong with the supplied value
 */
public record FieldViolation(String field, String message) {

    @Override
    public String toString() {
        return field + " " + message;
    }
}
