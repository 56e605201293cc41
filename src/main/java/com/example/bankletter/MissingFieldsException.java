package com.example.bankletter;

import lombok.Getter;

import java.util.List;

/** Thrown when an agreement lacks a field the letter cannot do without. */
@Getter
public class MissingFieldsException extends RuntimeException {
    private final List<String> missingFields;

    public MissingFieldsException(List<String> missingFields) {
        super("missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }
}
