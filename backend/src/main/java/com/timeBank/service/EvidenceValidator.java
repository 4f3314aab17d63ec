package com.timeBank.service;

import com.timeBank.model.Task;
import com.timeBank.model.ValidationResult;

/**
 * Judges the before/after photos of a task. Called only for ASSIGNED tasks that
 * carry both photos.
 */
public interface EvidenceValidator {

    ValidationResult validate(Task task);
}
