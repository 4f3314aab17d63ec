package com.timeBank.dto;

import com.timeBank.model.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResponseDTO {
    private ValidationResult validationResult;
}
