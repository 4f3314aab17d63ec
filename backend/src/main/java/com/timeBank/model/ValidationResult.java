package com.timeBank.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Outcome of the evidence check that gates credit transfer. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ValidationResult {
    private boolean valid;

    /** 0..100 */
    private int confidence;

    private String reason;
}
