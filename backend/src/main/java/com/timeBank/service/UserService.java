package com.timeBank.service;

import com.timeBank.dto.UserUpdateDTO;
import com.timeBank.exception.ErrorCode;
import com.timeBank.exception.ResourceNotFoundException;
import com.timeBank.exception.TaskRuleException;
import com.timeBank.model.User;
import com.timeBank.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    /** Partial update of name, skills, location and availability. */
    public User updateProfile(User current, UserUpdateDTO update) {
        if (update == null || update.isEmpty()) {
            throw new TaskRuleException(ErrorCode.NO_FIELDS, "No update data provided");
        }
        return userRepository.updateProfile(current.getId(), update)
                .orElseThrow(() -> new ResourceNotFoundException("User", current.getId()));
    }
}
