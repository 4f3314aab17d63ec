package com.timeBank.controller;

import com.timeBank.dto.UserResponseDTO;
import com.timeBank.dto.UserUpdateDTO;
import com.timeBank.model.User;
import com.timeBank.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @PutMapping("/profile")
    public ResponseEntity<UserResponseDTO> updateProfile(
            @AuthenticationPrincipal User currentUser,
            @RequestBody UserUpdateDTO body) {
        User updated = userService.updateProfile(currentUser, body);
        return ResponseEntity.ok(UserResponseDTO.fromModel(updated));
    }
}
