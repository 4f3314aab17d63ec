package com.timeBank.mapper;

import com.timeBank.dto.UserUpdateDTO;
import com.timeBank.model.User;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;

public final class UserDocumentMapper {

    public static final String EMAIL = "email";
    public static final String NAME = "name";
    public static final String PICTURE = "picture";
    public static final String SKILLS = "skills";
    public static final String LOCATION = "location";
    public static final String AVAILABILITY = "availability";
    public static final String VERIFIED = "verified";
    public static final String TIME_CREDITS = "time_credits";
    public static final String CREATED_AT = "created_at";

    private UserDocumentMapper() {
        // Utility class - prevent instantiation
    }

    public static User decode(String uid, Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        String location = DocumentValues.getString(data, LOCATION);
        String availability = DocumentValues.getString(data, AVAILABILITY);
        return User.builder()
                .id(uid)
                .email(DocumentValues.getString(data, EMAIL))
                .name(DocumentValues.getString(data, NAME))
                .picture(DocumentValues.getString(data, PICTURE))
                .skills(TextArrayParser.decode(data.get(SKILLS)))
                .location(location == null ? "" : location)
                .availability(availability == null ? "" : availability)
                .verified(DocumentValues.getBoolean(data, VERIFIED))
                .timeCredits(DocumentValues.getInt(data, TIME_CREDITS, User.DEFAULT_TIME_CREDITS))
                .createdAt(DocumentValues.getInstant(data, CREATED_AT))
                .build();
    }

    /** Profile fields present in the update. Balance, email and verification are never written here. */
    public static Map<String, Object> encode(UserUpdateDTO update) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (update.getName() != null)
            data.put(NAME, update.getName());
        if (update.getSkills() != null)
            data.put(SKILLS, new ArrayList<>(update.getSkills()));
        if (update.getLocation() != null)
            data.put(LOCATION, update.getLocation());
        if (update.getAvailability() != null)
            data.put(AVAILABILITY, update.getAvailability());
        return data;
    }
}
