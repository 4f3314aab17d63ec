package com.timeBank.dto;

import com.timeBank.model.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserResponseDTO {
    private String id;
    private String email;
    private String name;
    private String picture;
    private List<String> skills;
    private String location;
    private String availability;
    private boolean verified;
    private int timeCredits;
    private Instant createdAt;

    public static UserResponseDTO fromModel(User user) {
        if (user == null)
            return null;
        return UserResponseDTO.builder()
                .id(user.getId())
                .email(user.getEmail())
                .name(user.getName())
                .picture(user.getPicture())
                .skills(user.getSkills())
                .location(user.getLocation())
                .availability(user.getAvailability())
                .verified(user.isVerified())
                .timeCredits(user.getTimeCredits())
                .createdAt(user.getCreatedAt())
                .build();
    }
}
