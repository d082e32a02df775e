package com.example.chatcollector.service;

import com.example.chatcollector.generation.GenerationResult;
import com.example.chatcollector.generation.TextGenerator;
import com.example.chatcollector.locale.CollectorMessages;
import com.example.chatcollector.locale.LocaleDetector;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectorField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SummaryServiceTest {

    @Mock
    private TextGenerator textGenerator;

    private SummaryService summaryService;

    @BeforeEach
    void setUp() {
        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBasename("messages");
        source.setDefaultEncoding("UTF-8");
        source.setFallbackToSystemLocale(false);
        source.setAlwaysUseMessageFormat(true);
        CollectorMessages messages = new CollectorMessages(source);
        summaryService = new SummaryService(textGenerator, messages, new CollectorPromptBuilder(messages, new LocaleDetector()));
    }

    private static CollectionConfig.CollectionConfigBuilder config() {
        return CollectionConfig.builder()
                .name("course_creator")
                .fields(List.of(CollectorField.parse("course_name", "Name | required"),
                        CollectorField.parse("notes", "Notes | optional")));
    }

    private static Map<String, String> data() {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("course_name", "Java 101");
        return data;
    }

    @Test
    void testStaticSummary_MarksOptionalAndMissing() {
        String summary = summaryService.staticSummary(config().build(), data(), "en");

        assertTrue(summary.startsWith("## Summary: course_creator"));
        assertTrue(summary.contains("**Course Name**: Java 101"));
        assertTrue(summary.contains("**Notes** (optional): (not provided)"));
    }

    @Test
    void testActionSummary_TemplateFilled() {
        CollectionConfig config = config().actionSummary("Creates {course_name}.").build();

        assertEquals("Creates Java 101.", summaryService.actionSummary(config, data(), List.of(), "en"));
        verifyNoInteractions(textGenerator);
    }

    @Test
    void testActionSummary_DefaultWithoutTemplate() {
        assertEquals("This will complete the 'course_creator' process with the information you provided.",
                summaryService.staticActionSummary(config().build(), data(), "en"));
    }

    @Test
    void testActionSummary_GeneratedWithModifications() {
        // Given
        CollectionConfig config = config().actionSummaryPrompt("Outline lessons for {course_name}").build();
        when(textGenerator.generate(anyString(), anyString())).thenReturn(GenerationResult.success("  1. Intro\n2. Loops  "));

        // When
        String action = summaryService.actionSummary(config, data(), List.of("add a testing lesson"), "en");

        // Then
        assertEquals("1. Intro\n2. Loops", action);
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(textGenerator).generate(anyString(), prompt.capture());
        assertTrue(prompt.getValue().contains("Outline lessons for Java 101"));
        assertTrue(prompt.getValue().contains("- add a testing lesson"));
    }

    @Test
    void testDataSummary_FallsBackWhenGenerationFails() {
        CollectionConfig config = config().summaryPrompt("Summarize {course_name}").build();
        when(textGenerator.generate(anyString(), anyString())).thenReturn(GenerationResult.failure("offline"));

        String summary = summaryService.dataSummary(config, data(), "en");

        assertEquals(summaryService.staticSummary(config, data(), "en"), summary);
    }

    @Test
    void testReviewList_EmptyData() {
        assertEquals("No data", summaryService.reviewList(config().build(), Map.of(), "en"));
    }
}
