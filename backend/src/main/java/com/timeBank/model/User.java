package com.timeBank.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class User {
    public static final int DEFAULT_TIME_CREDITS = 60;

    private String id;
    private String email;
    private String name;
    private String picture;

    @Builder.Default
    private List<String> skills = new ArrayList<>();

    @Builder.Default
    private String location = "";

    @Builder.Default
    private String availability = "";

    private boolean verified;

    @Builder.Default
    private int timeCredits = DEFAULT_TIME_CREDITS;

    private Instant createdAt;
}
