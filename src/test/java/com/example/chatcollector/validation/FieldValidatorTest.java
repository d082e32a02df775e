package com.example.chatcollector.validation;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.FieldType;
import com.example.chatcollector.model.ValidationError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FieldValidatorTest {

    private final FieldValidator validator = new FieldValidator();

    private static List<String> rules(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::getRule).collect(Collectors.toList());
    }

    @Test
    void testValidate_NumericRejectsWords() {
        // Given
        CollectorField duration = CollectorField.parse("duration", "Course duration in hours | required | numeric | min:1");

        // When
        List<ValidationError> errors = validator.validate(duration, "zero");

        // Then
        assertEquals(List.of("numeric"), rules(errors));
        assertEquals("The duration must be a number.", errors.get(0).getMessage());
    }

    @Test
    void testValidate_MinComparesMagnitudeForNumbers() {
        CollectorField duration = CollectorField.parse("duration", "Course duration in hours | required | numeric | min:1");

        List<ValidationError> errors = validator.validate(duration, "0");

        assertEquals(List.of("min"), rules(errors));
        assertEquals("The duration must be at least 1.", errors.get(0).getMessage());
        assertTrue(validator.validate(duration, "12").isEmpty());
    }

    @Test
    void testValidate_MinMaxCountCharactersForText() {
        CollectorField name = CollectorField.parse("name", "The course name | required | min:3 | max:5");

        assertEquals("The name must be at least 3 characters.", validator.validate(name, "ab").get(0).getMessage());
        assertEquals("The name must not exceed 5 characters.", validator.validate(name, "abcdef").get(0).getMessage());
        // code points, not UTF-16 units
        assertTrue(validator.validate(name, "😀😀😀").isEmpty());
    }

    @Test
    void testValidate_ReportsEveryViolatedRule() {
        CollectorField code = CollectorField.builder()
                .name("code")
                .validation("required|integer|max:2")
                .build();

        List<ValidationError> errors = validator.validate(code, "abc");

        assertEquals(List.of("integer", "max"), rules(errors));
    }

    @Test
    void testValidate_EmptyValue() {
        CollectorField required = CollectorField.parse("name", "The course name | required | min:3");
        CollectorField optional = CollectorField.parse("notes", "Anything else | optional | min:3");

        List<ValidationError> errors = validator.validate(required, "  ");

        assertEquals(List.of("required"), rules(errors));
        assertEquals("The name field is required.", errors.get(0).getMessage());
        assertTrue(validator.validate(optional, "").isEmpty());
        assertTrue(validator.validate(optional, null).isEmpty());
    }

    @Test
    void testValidate_SelectOptionMembership() {
        CollectorField level = CollectorField.builder()
                .name("level")
                .type(FieldType.SELECT)
                .options(List.of("beginner", "intermediate", "advanced"))
                .build();

        assertTrue(validator.validate(level, "Beginner").isEmpty());
        List<ValidationError> errors = validator.validate(level, "expert");
        assertEquals(List.of("options"), rules(errors));
        assertEquals("The level must be one of: beginner, intermediate, advanced", errors.get(0).getMessage());
    }

    @Test
    void testValidate_EmailUrlBetweenIn() {
        CollectorField email = CollectorField.builder().name("email").validation("email").build();
        CollectorField site = CollectorField.builder().name("site").validation("url").build();
        CollectorField rating = CollectorField.builder().name("rating").type(FieldType.NUMBER).validation("between:1,5").build();
        CollectorField size = CollectorField.builder().name("size").validation("in:S,M,L").build();

        assertTrue(validator.validate(email, "a@b.io").isEmpty());
        assertFalse(validator.validate(email, "not-an-email").isEmpty());
        assertTrue(validator.validate(site, "https://example.com/x").isEmpty());
        assertFalse(validator.validate(site, "example.com").isEmpty());
        assertTrue(validator.validate(rating, "3").isEmpty());
        assertEquals("The rating must be between 1 and 5.", validator.validate(rating, "7").get(0).getMessage());
        assertTrue(validator.validate(size, "m").isEmpty());
        assertEquals(List.of("in"), rules(validator.validate(size, "XL")));
    }

    @Test
    void testValidate_IdempotentForStoredValue() {
        CollectorField level = CollectorField.builder()
                .name("level")
                .type(FieldType.SELECT)
                .options(List.of("beginner", "advanced"))
                .build();

        String stored = validator.normalize(level, "  ADVANCED ");

        assertEquals("advanced", stored);
        assertTrue(validator.validate(level, stored).isEmpty());
        assertTrue(validator.validate(level, stored).isEmpty());
    }

    @Test
    void testValidateAll_OnlyFieldsWithErrors() {
        CollectionConfig config = CollectionConfig.builder()
                .name("course")
                .fields(List.of(
                        CollectorField.parse("name", "The course name | required | min:3"),
                        CollectorField.parse("duration", "Duration | required | numeric"),
                        CollectorField.parse("notes", "Notes | optional")))
                .build();

        Map<String, List<ValidationError>> errors = validator.validateAll(config, Map.of("name", "Java 101", "duration", "long"));

        assertEquals(List.of("duration"), List.copyOf(errors.keySet()));
    }

    @Test
    void testIsWellFormed() {
        assertTrue(FieldValidator.isWellFormed("min:3"));
        assertTrue(FieldValidator.isWellFormed("between:1,10"));
        assertTrue(FieldValidator.isWellFormed("in:a,b,c"));
        assertFalse(FieldValidator.isWellFormed("min:"));
        assertFalse(FieldValidator.isWellFormed("shout"));
    }
}
