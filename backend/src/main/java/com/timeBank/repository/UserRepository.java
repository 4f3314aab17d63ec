package com.timeBank.repository;

import com.timeBank.dto.UserUpdateDTO;
import com.timeBank.model.User;

import java.util.Optional;

/** Application user profiles. Rows are created by the identity service, never here. */
public interface UserRepository {

    Optional<User> findById(String userId);

    /** @return the updated profile, or empty if no row exists for the id */
    Optional<User> updateProfile(String userId, UserUpdateDTO update);
}
