package com.example.chatcollector.config;

import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.FieldType;
import com.example.chatcollector.service.CompletionCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Built-in collection configs. Disable with {@code app.collector.samples.enabled=false}.
 */
@Configuration
@ConditionalOnProperty(name = "app.collector.samples.enabled", havingValue = "true", matchIfMissing = true)
public class CollectionDefinitions {

    private static final Logger logger = LoggerFactory.getLogger(CollectionDefinitions.class);

    @Bean
    public CollectionConfig courseCreator() {
        return CollectionConfig.builder()
                .name("course_creator")
                .title("Create a Course")
                .description("I will help you create a new course by collecting the necessary information.")
                .fields(List.of(
                        CollectorField.parse("name", "The course name | required | min:3 | max:255"),
                        CollectorField.parse("description", "A brief description of what students will learn | required | min:20"),
                        CollectorField.parse("duration", "Course duration in hours | required | numeric | min:1"),
                        CollectorField.builder()
                                .name("level")
                                .type(FieldType.SELECT)
                                .description("The difficulty level")
                                .options(List.of("beginner", "intermediate", "advanced"))
                                .validation("required")
                                .build(),
                        CollectorField.parse("lessons_count", "Number of lessons to create | required | numeric | min:1 | max:20")))
                .actionSummaryPrompt("Based on this course information, generate a preview of the course structure.\n\n"
                        + "Create exactly {lessons_count} lessons for this \"{name}\" course. For each lesson, provide a clear title, "
                        + "1-2 sentences describing what will be covered and an estimated duration in minutes.\n\n"
                        + "Lessons should progress from basics to more advanced concepts, suit the {level} level "
                        + "and roughly add up to {duration} hours. Format as a numbered markdown list.")
                .outputSchema(courseSchema())
                .outputPrompt("Generate a complete course structure with {lessons_count} lessons based on the course \"{name}\". "
                        + "The total duration should roughly match {duration} hours.")
                .completionAction("courseCreatedCallback")
                .successMessage("Course configuration complete! The course is ready to be created.")
                .build();
    }

    @Bean
    public CollectionConfig customerFeedback() {
        return CollectionConfig.builder()
                .name("customer_feedback")
                .title("Customer Feedback")
                .description("Please share your feedback to help us improve.")
                .fields(List.of(
                        CollectorField.parse("rating", "Your overall rating from 1-5 | required | numeric | min:1 | max:5"),
                        CollectorField.parse("liked", "What did you like most about our service? | optional"),
                        CollectorField.parse("improvements", "What could we improve? | optional"),
                        CollectorField.builder()
                                .name("recommend")
                                .type(FieldType.SELECT)
                                .description("Would you recommend us to others?")
                                .options(List.of("definitely", "probably", "not sure", "probably not", "definitely not"))
                                .build()))
                .actionSummary("Your feedback ({rating}/5) will be recorded and reviewed by our team.")
                .allowSkipOptional(false)
                .successMessage("Thank you for your feedback!")
                .build();
    }

    @Bean
    public CompletionCallback courseCreatedCallback() {
        return data -> {
            logger.info("Course ready: {} ({} lessons)", data.get("name"), data.get("lessons_count"));
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("created", true);
            result.put("course", data.get("name"));
            result.put("structure", data.get(CompletionCallback.GENERATED_OUTPUT_KEY));
            return result;
        };
    }

    private static Map<String, Object> courseSchema() {
        Map<String, Object> course = new LinkedHashMap<>();
        course.put("name", "string // Course name");
        course.put("description", "string // Course description");
        course.put("duration_hours", "number // Total duration in hours");
        course.put("level", "string // beginner, intermediate, or advanced");

        Map<String, Object> objective = new LinkedHashMap<>();
        objective.put("objective", "string // A specific learning objective");
        Map<String, Object> objectives = new LinkedHashMap<>();
        objectives.put("type", "array");
        objectives.put("description", "Learning objectives");
        objectives.put("count", 3);
        objectives.put("items", objective);

        Map<String, Object> lesson = new LinkedHashMap<>();
        lesson.put("order", "number // Lesson order (1, 2, 3...)");
        lesson.put("name", "string // Lesson title");
        lesson.put("description", "string // What students will learn");
        lesson.put("duration_minutes", "number // Estimated duration in minutes");
        lesson.put("objectives", objectives);

        Map<String, Object> lessons = new LinkedHashMap<>();
        lessons.put("type", "array");
        lessons.put("description", "List of lessons for the course");
        lessons.put("count", "{lessons_count}");
        lessons.put("items", lesson);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("course", course);
        schema.put("lessons", lessons);
        return schema;
    }
}
