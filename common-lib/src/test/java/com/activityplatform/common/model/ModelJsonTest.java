package com.activityplatform.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static com.activityplatform.common.Fixtures.HIKING;
import static com.activityplatform.common.Fixtures.MUSEUM;
import static com.activityplatform.common.Fixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

class ModelJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void activityRoundTripsWithoutDerivedIndoorFlag() throws Exception {
        String json = objectMapper.writeValueAsString(MUSEUM);

        assertFalse(objectMapper.readTree(json).has("indoor"));
        assertTrue(objectMapper.readTree(json).get("tolerance").get("indoor").asBoolean());
        assertEquals(MUSEUM, objectMapper.readValue(json, Activity.class));
        assertEquals(HIKING, objectMapper.readValue(objectMapper.writeValueAsString(HIKING), Activity.class));
    }

    @Test
    void userProfileRoundTripsWithoutDerivedColdStartFlag() throws Exception {
        UserProfile profile = new UserProfile("u1",
            Map.of("hiking", 2.0),
            Map.of("museum", ActivityHistory.of(3, NOW, "culture")),
            Set.of("cinema"));

        String json = objectMapper.writeValueAsString(profile);

        assertFalse(objectMapper.readTree(json).has("coldStart"));
        assertEquals(profile, objectMapper.readValue(json, UserProfile.class));
    }

    @Test
    void newcomerRoundTripsAsColdStart() throws Exception {
        String json = objectMapper.writeValueAsString(UserProfile.newcomer("u2"));
        assertTrue(objectMapper.readValue(json, UserProfile.class).isColdStart());
    }
}
