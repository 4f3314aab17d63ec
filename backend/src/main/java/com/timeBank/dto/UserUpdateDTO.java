package com.timeBank.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of PUT /api/users/profile. Every field is optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserUpdateDTO {
    private String name;
    private List<String> skills;
    private String location;
    private String availability;

    @JsonIgnore
    public boolean isEmpty() {
        return name == null && skills == null && location == null && availability == null;
    }
}
