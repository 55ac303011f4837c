package com.entity.intelligence.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class EntityAttributesTest {

    @Test
    @DisplayName("Malformed attributes should read as absent")
    void testMalformedAttributes() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("vote_average", "8.1");
        attributes.put("genres", "Drama");
        attributes.put("production_companies", List.of("Pixar", Map.of("name", "No Id")));
        attributes.put("belongs_to_collection", List.of());
        attributes.put("release_date", "unknown");
        Entity entity = Entity.of("movie:1", attributes);

        assertTrue(EntityAttributes.rating(entity).isEmpty());
        assertTrue(EntityAttributes.genres(entity).isEmpty());
        assertTrue(EntityAttributes.companies(entity).isEmpty());
        assertTrue(EntityAttributes.collection(entity).isEmpty());
        assertTrue(EntityAttributes.releaseYear(entity).isEmpty());
    }

    @Test
    @DisplayName("Names should accept plain strings and records, skipping other elements")
    void testNames() {
        List<Object> genres = new ArrayList<>(Arrays.asList("Drama", Map.of("id", 18, "name", "Crime"), 42, null, "Drama"));
        Entity entity = Entity.of("movie:1", Map.of("genres", genres));

        assertEquals(List.of("Drama", "Crime"), EntityAttributes.genres(entity));
    }

    @ParameterizedTest
    @CsvSource({
            "1999-03-31, 1999",
            "2008, 2008",
            "' 2014-11-05', 2014",
    })
    @DisplayName("Should read the year prefix of a date")
    void testYearOf(String date, int expected) {
        assertEquals(OptionalInt.of(expected), EntityAttributes.yearOf(date));
    }

    @Test
    @DisplayName("Release year should fall back to first_air_date")
    void testReleaseYearFallback() {
        Entity show = Entity.of("show:1", Map.of("first_air_date", "2011-04-17"));
        assertEquals(OptionalInt.of(2011), EntityAttributes.releaseYear(show));
    }

    @Test
    @DisplayName("Countries should fall back to production_countries")
    void testCountriesFallback() {
        Entity entity = Entity.of("movie:1", Map.of("production_countries",
                List.of(Map.of("iso_3166_1", "GB", "name", "United Kingdom"))));
        assertEquals(List.of("GB"), EntityAttributes.countries(entity));
    }

    @Test
    @DisplayName("Integral numbers and strings should be usable as ids")
    void testIdOf() {
        assertEquals("420", EntityAttributes.idOf(420).orElseThrow());
        assertEquals("420", EntityAttributes.idOf(420.0).orElseThrow());
        assertEquals("abc", EntityAttributes.idOf("abc").orElseThrow());
        assertTrue(EntityAttributes.idOf(4.5).isEmpty());
        assertTrue(EntityAttributes.idOf(0).isEmpty());
        assertTrue(EntityAttributes.idOf(null).isEmpty());
    }
}
