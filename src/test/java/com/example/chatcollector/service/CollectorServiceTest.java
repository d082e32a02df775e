package com.example.chatcollector.service;

import com.example.chatcollector.extraction.ContentExtractor;
import com.example.chatcollector.extraction.DirectValueExtractor;
import com.example.chatcollector.extraction.FieldExtractionPipeline;
import com.example.chatcollector.extraction.MarkerParser;
import com.example.chatcollector.extraction.SuggestionSelector;
import com.example.chatcollector.generation.GenerationResult;
import com.example.chatcollector.generation.StructuredOutputGenerator;
import com.example.chatcollector.generation.TextGenerator;
import com.example.chatcollector.intent.IntentClassifier;
import com.example.chatcollector.kv.InMemoryKvClient;
import com.example.chatcollector.locale.CollectorMessages;
import com.example.chatcollector.locale.LocaleDetector;
import com.example.chatcollector.model.CollectionConfig;
import com.example.chatcollector.model.CollectionStatus;
import com.example.chatcollector.model.CollectorField;
import com.example.chatcollector.model.CollectorResponse;
import com.example.chatcollector.model.MetadataKey;
import com.example.chatcollector.model.SessionState;
import com.example.chatcollector.store.ConfigStore;
import com.example.chatcollector.store.SessionStateStore;
import com.example.chatcollector.store.StoreClient;
import com.example.chatcollector.validation.FieldValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.ResourceBundleMessageSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Drives whole conversations through the real collaborators. Only the text generator and the
 * event store are mocked; the generator is offline unless a test says otherwise.
 */
@ExtendWith(MockitoExtension.class)
class CollectorServiceTest {

    @Mock
    private TextGenerator textGenerator;

    @Mock
    private StoreClient storeClient;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final List<Map<String, Object>> completedWith = new ArrayList<>();

    private InMemoryKvClient kv;
    private CollectorService service;

    @BeforeEach
    void setUp() {
        lenient().when(textGenerator.generate(anyString(), anyString())).thenReturn(GenerationResult.failure("offline"));

        ResourceBundleMessageSource source = new ResourceBundleMessageSource();
        source.setBasename("messages");
        source.setDefaultEncoding("UTF-8");
        source.setFallbackToSystemLocale(false);
        source.setAlwaysUseMessageFormat(true);
        CollectorMessages messages = new CollectorMessages(source);

        kv = new InMemoryKvClient();
        SessionStateStore stateStore = new SessionStateStore(kv, objectMapper);
        ConfigStore configStore = new ConfigStore(kv, objectMapper);
        for (Object store : List.of(stateStore, configStore)) {
            ReflectionTestUtils.setField(store, "keyPrefix", "data_collector_state_");
            ReflectionTestUtils.setField(store, "ttlSeconds", 3600L);
        }

        LocaleDetector localeDetector = new LocaleDetector();
        FieldValidator validator = new FieldValidator();
        CollectionEventLog eventLog = new CollectionEventLog(storeClient);
        MarkerParser markerParser = new MarkerParser();
        IntentClassifier intentClassifier = new IntentClassifier(textGenerator, objectMapper);
        FieldExtractionPipeline pipeline = new FieldExtractionPipeline(markerParser, new DirectValueExtractor(), intentClassifier);
        FieldValueRecorder recorder = new FieldValueRecorder(validator, eventLog);
        CollectorPromptBuilder promptBuilder = new CollectorPromptBuilder(messages, localeDetector);
        SummaryService summaryService = new SummaryService(textGenerator, messages, promptBuilder);
        CompletionHandler completionHandler = new CompletionHandler(validator,
                new StructuredOutputGenerator(textGenerator, objectMapper),
                new CompletionCallbackResolver(Map.of()), summaryService, eventLog);
        ConfirmingHandler confirmingHandler = new ConfirmingHandler(intentClassifier, summaryService, completionHandler,
                promptBuilder, eventLog);
        CancellationHandler cancellationHandler = new CancellationHandler(eventLog);
        CollectingHandler collectingHandler = new CollectingHandler(textGenerator, intentClassifier, pipeline, markerParser,
                new SuggestionSelector(), recorder, promptBuilder, confirmingHandler, completionHandler, cancellationHandler);
        EnhancingHandler enhancingHandler = new EnhancingHandler(textGenerator, intentClassifier, pipeline, markerParser,
                recorder, summaryService, promptBuilder, confirmingHandler);

        CollectionConfigRegistry registry = new CollectionConfigRegistry(List.of(courseConfig()));
        service = new CollectorService(registry, configStore, stateStore, localeDetector, messages, validator, recorder,
                new ContentExtractor(textGenerator, objectMapper), summaryService, promptBuilder, collectingHandler,
                confirmingHandler, enhancingHandler, cancellationHandler, eventLog);
    }

    private CollectionConfig courseConfig() {
        return CollectionConfig.builder()
                .name("course")
                .title("Course Creation")
                .fields(List.of(
                        CollectorField.parse("name", "The course name | required | min:3"),
                        CollectorField.parse("duration", "Course duration in hours | required | numeric | min:1"),
                        CollectorField.parse("level", "Difficulty level | options: beginner, intermediate, advanced"),
                        CollectorField.parse("notes", "Anything else | optional")))
                .completionCallback(data -> {
                    completedWith.add(new LinkedHashMap<>(data));
                    return Map.of("courseId", "c-1");
                })
                .build();
    }

    @Test
    void testFullConversation_CollectsConfirmsAndCompletes() {
        // Given
        CollectorResponse started = service.startSession("s-1", "course", Map.of());
        assertTrue(started.isSuccess());
        assertEquals("name", started.getCurrentField());
        assertTrue(started.getMessage().startsWith("Hello!"));

        // When
        CollectorResponse afterName = service.processMessage("s-1", "Java 101");
        CollectorResponse afterDuration = service.processMessage("s-1", "12");
        CollectorResponse afterLevel = service.processMessage("s-1", "beginner");

        // Then
        assertEquals("duration", afterName.getCurrentField());
        assertTrue(afterName.getMessage().contains("Great! I've recorded The course name: Java 101"));
        assertEquals("level", afterDuration.getCurrentField());
        assertTrue(afterLevel.isRequiresConfirmation());
        assertEquals(CollectionStatus.CONFIRMING, afterLevel.getStatus());
        assertTrue(afterLevel.getMessage().contains("## Summary: Course Creation"));
        assertTrue(afterLevel.getMessage().contains("**Please confirm:**"));

        CollectorResponse done = service.processMessage("s-1", "yes");
        assertTrue(done.isComplete());
        assertEquals(CollectionStatus.COMPLETED, done.getStatus());
        assertEquals(Map.of("courseId", "c-1"), done.getResult());
        assertEquals(1, completedWith.size());
        assertEquals("Java 101", completedWith.get(0).get("name"));
        assertEquals("12", completedWith.get(0).get("duration"));
        assertEquals("beginner", completedWith.get(0).get("level"));

        SessionState stored = service.getState("s-1").orElseThrow();
        assertEquals(CollectionStatus.COMPLETED, stored.getStatus());
        assertEquals(9, stored.getMessageHistory().size());
        verify(storeClient, atLeastOnce()).appendEvent(eq("s-1"), any());
    }

    @Test
    void testProcessMessage_CompletesWithoutConfirmation() {
        CollectionConfig quick = CollectionConfig.builder()
                .name("company")
                .fields(List.of(CollectorField.parse("name", "Company name | required")))
                .confirmBeforeComplete(false)
                .completionCallback(data -> {
                    completedWith.add(new LinkedHashMap<>(data));
                    return "company-1";
                })
                .build();
        service.startSession("s-a", quick, Map.of());

        CollectorResponse response = service.processMessage("s-a", "Acme Corp");

        assertTrue(response.isComplete());
        assertEquals(CollectionStatus.COMPLETED, response.getStatus());
        assertEquals("Acme Corp", response.getState().getCollectedData().get("name"));
        assertEquals("company-1", response.getResult());
        assertEquals(List.of(Map.of("name", "Acme Corp")), completedWith);
        assertTrue(response.getMessage().endsWith("Thank you! Your information has been successfully collected and processed."));
    }

    @Test
    void testProcessMessage_FailedCallbackCanBeRetried() {
        // Given
        AtomicInteger calls = new AtomicInteger();
        CollectionConfig flaky = CollectionConfig.builder()
                .name("flaky_company")
                .fields(List.of(CollectorField.parse("name", "Company name | required")))
                .confirmBeforeComplete(false)
                .completionCallback(data -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("downstream unavailable");
                    }
                    return "company-2";
                })
                .build();
        service.startSession("s-retry", flaky, Map.of());

        // When
        CollectorResponse failed = service.processMessage("s-retry", "Acme Corp");
        CollectorResponse retried = service.processMessage("s-retry", "try again");

        // Then
        assertFalse(failed.isSuccess());
        assertFalse(failed.isComplete());
        assertTrue(failed.getMessage().contains("There was an error processing your data: downstream unavailable"));
        assertEquals(CollectionStatus.COLLECTING, failed.getStatus());
        assertTrue(retried.isComplete());
        assertEquals(CollectionStatus.COMPLETED, retried.getStatus());
        assertEquals("company-2", retried.getResult());
        assertEquals("Acme Corp", retried.getState().getCollectedData().get("name"));
        assertEquals(2, calls.get());
    }

    @Test
    void testProcessMessage_FailedCallbackWhileConfirmingKeepsConfirming() {
        AtomicInteger calls = new AtomicInteger();
        CollectionConfig flaky = CollectionConfig.builder()
                .name("flaky_review")
                .fields(List.of(CollectorField.parse("name", "Company name | required")))
                .completionCallback(data -> {
                    if (calls.incrementAndGet() == 1) {
                        throw new IllegalStateException("downstream unavailable");
                    }
                    return "company-3";
                })
                .build();
        service.startSession("s-retry-2", flaky, Map.of());
        service.processMessage("s-retry-2", "Acme Corp");

        CollectorResponse failed = service.processMessage("s-retry-2", "yes");
        CollectorResponse retried = service.processMessage("s-retry-2", "yes");

        assertFalse(failed.isSuccess());
        assertEquals(CollectionStatus.CONFIRMING, failed.getStatus());
        assertEquals("Acme Corp", failed.getState().getCollectedData().get("name"));
        assertTrue(retried.isComplete());
        assertEquals("company-3", retried.getResult());
    }

    @Test
    void testProcessMessage_FinalValidationFailureAllowsCorrection() {
        // Given
        CollectionConfig lenientRules = CollectionConfig.builder()
                .name("company")
                .fields(List.of(CollectorField.parse("name", "Company name | required")))
                .build();
        service.startSession("s-v", lenientRules, Map.of());
        service.processMessage("s-v", "Acme");
        service.startSession("s-other", lenientRules.toBuilder()
                .fields(List.of(CollectorField.parse("name", "Company name | required | min:10")))
                .build(), Map.of());

        // When
        CollectorResponse failed = service.processMessage("s-v", "yes");
        CollectorResponse corrected = service.processMessage("s-v", "Acme Corporation Ltd");

        // Then
        assertFalse(failed.isSuccess());
        assertTrue(failed.getMessage().startsWith("There are some validation errors:"));
        assertEquals(CollectionStatus.COLLECTING, failed.getStatus());
        assertEquals("name", failed.getCurrentField());
        assertFalse(failed.getState().hasValue("name"));
        assertEquals(CollectionStatus.CONFIRMING, corrected.getStatus());
        assertEquals("Acme Corporation Ltd", corrected.getState().getCollectedData().get("name"));
    }

    @Test
    void testProcessMessage_SuggestionPickedByNumber() {
        // Given
        when(textGenerator.generate(eq(IntentClassifier.INTENT_SYSTEM_PROMPT), anyString()))
                .thenReturn(GenerationResult.success("{\"intent\": \"suggest\", \"confidence\": 0.9}"));
        when(textGenerator.generate(eq(CollectorPromptBuilder.SUGGESTION_SYSTEM_PROMPT), anyString()))
                .thenReturn(GenerationResult.success("1. Java Basics\n2. Spring Boot Essentials\n3. Reactive Java"));
        service.startSession("s-sug", "course", Map.of());

        // When
        CollectorResponse suggested = service.processMessage("s-sug", "Any ideas for a name?");
        CollectorResponse picked = service.processMessage("s-sug", "2");

        // Then
        assertTrue(suggested.getMessage().startsWith("Here are some suggestions:"));
        assertTrue(suggested.getMessage().contains("2. Spring Boot Essentials"));
        assertEquals("name", suggested.getCurrentField());
        assertEquals("Spring Boot Essentials", picked.getState().getCollectedData().get("name"));
        assertTrue(picked.getMessage().startsWith("Great! I've recorded The course name: Spring Boot Essentials"));
        assertEquals("duration", picked.getCurrentField());
        assertNull(picked.getState().getLastSuggestions());
    }

    @Test
    void testProcessMessage_SkipOptionalField() {
        // Given
        when(textGenerator.generate(eq(IntentClassifier.INTENT_SYSTEM_PROMPT), anyString()))
                .thenReturn(GenerationResult.success("{\"intent\": \"skip\", \"confidence\": 0.9}"));
        CollectionConfig profile = CollectionConfig.builder()
                .name("profile")
                .fields(List.of(CollectorField.parse("nickname", "Nickname | optional"),
                        CollectorField.parse("full_name", "Full name | required")))
                .build();
        CollectorResponse started = service.startSession("s-skip", profile, Map.of());

        // When
        CollectorResponse skipped = service.processMessage("s-skip", "I'd rather not say");

        // Then
        assertEquals("nickname", started.getCurrentField());
        assertTrue(skipped.getMessage().startsWith("Okay, skipping Nickname."));
        assertEquals("full_name", skipped.getCurrentField());
        assertEquals(List.of("nickname"), skipped.getState().metadataList(MetadataKey.SKIPPED_FIELDS));
        assertFalse(skipped.getState().hasValue("nickname"));
    }

    @Test
    void testProcessMessage_OutputChangeFeedsConfirmedSummary() {
        // Given
        when(textGenerator.generate(startsWith(SummaryService.ACTION_SYSTEM_PROMPT), anyString())).thenAnswer(inv -> {
            String prompt = inv.getArgument(1);
            return GenerationResult.success(prompt.contains("add a testing lesson") ? "1. Intro\n2. Testing" : "1. Intro");
        });
        CollectionConfig outlined = CollectionConfig.builder()
                .name("outlined_course")
                .fields(List.of(CollectorField.parse("name", "Course name | required")))
                .actionSummaryPrompt("Outline the lessons of {name}")
                .build();
        service.startSession("s-out", outlined, Map.of("name", "Java 101"));
        CollectorResponse review = service.processMessage("s-out", "ready");
        service.processMessage("s-out", "no");

        // When
        CollectorResponse changed = service.processMessage("s-out", "Please add a testing lesson to the outline");
        CollectorResponse reviewAgain = service.processMessage("s-out", "yes");
        CollectorResponse done = service.processMessage("s-out", "yes");

        // Then
        assertTrue(review.getMessage().contains("1. Intro"));
        assertEquals(CollectionStatus.ENHANCING, changed.getStatus());
        assertTrue(changed.getMessage().contains("2. Testing"));
        assertEquals(List.of("Please add a testing lesson to the outline"),
                changed.getState().metadataList(MetadataKey.OUTPUT_MODIFICATIONS));
        assertEquals(CollectionStatus.CONFIRMING, reviewAgain.getStatus());
        assertTrue(done.isComplete());
        assertEquals("1. Intro\n2. Testing", done.getState().getConfirmedActionSummary());
    }

    @Test
    void testProcessMessage_PendingValueWinsOverOutputKeywords() {
        // Given
        CollectionConfig course = CollectionConfig.builder()
                .name("schema_course")
                .fields(List.of(CollectorField.parse("name", "Course name | required"),
                        CollectorField.parse("duration", "Hours | required | numeric")))
                .outputSchema(Map.of("course", "string // Course title"))
                .build();
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java Basics");
        initial.put("duration", "10");
        service.startSession("s-pend", course, initial);
        service.processMessage("s-pend", "ready");
        service.processMessage("s-pend", "no");

        // When
        CollectorResponse asked = service.processMessage("s-pend", "I want to change the course name");
        CollectorResponse updated = service.processMessage("s-pend", "Spring Course for Teams");
        CollectorResponse outputChange = service.processMessage("s-pend", "Restructure the course content");

        // Then
        assertTrue(asked.getMessage().startsWith("Sure, let's update Course name."));
        assertEquals("Spring Course for Teams", updated.getState().getCollectedData().get("name"));
        assertNull(updated.getState().pendingFieldUpdate());
        assertEquals(List.of("Restructure the course content"),
                outputChange.getState().metadataList(MetadataKey.OUTPUT_MODIFICATIONS));
        assertEquals("Spring Course for Teams", outputChange.getState().getCollectedData().get("name"));
    }

    @Test
    void testProcessMessage_CancelFromConfirmingKeepsData() {
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        service.startSession("s-cc", "course", initial);
        service.processMessage("s-cc", "beginner");

        CollectorResponse cancelled = service.processMessage("s-cc", "cancel");

        assertTrue(cancelled.isCancelled());
        SessionState state = service.getState("s-cc").orElseThrow();
        assertEquals(CollectionStatus.CANCELLED, state.getStatus());
        assertEquals(Map.of("name", "Java 101", "duration", "12", "level", "beginner"), state.getCollectedData());
    }

    @Test
    void testProcessMessage_CancelFromEnhancingKeepsData() {
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        service.startSession("s-ce", "course", initial);
        service.processMessage("s-ce", "beginner");
        CollectorResponse enhancing = service.processMessage("s-ce", "no");

        CollectorResponse cancelled = service.processMessage("s-ce", "stop");

        assertEquals(CollectionStatus.ENHANCING, enhancing.getStatus());
        assertTrue(cancelled.isCancelled());
        SessionState state = service.getState("s-ce").orElseThrow();
        assertEquals(CollectionStatus.CANCELLED, state.getStatus());
        assertEquals(Map.of("name", "Java 101", "duration", "12", "level", "beginner"), state.getCollectedData());
    }

    @Test
    void testProcessMessage_PlainNoStartsEnhancing() {
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        service.startSession("s-d", "course", initial);
        service.processMessage("s-d", "beginner");

        CollectorResponse response = service.processMessage("s-d", "no");

        assertEquals(CollectionStatus.ENHANCING, response.getStatus());
        assertTrue(response.isAllowsEnhancement());
        assertTrue(response.getMessage().startsWith("No problem! What would you like to change?"));
        assertEquals(3, response.getState().getCollectedData().size());
    }

    @Test
    void testProcessMessage_InvalidValueKeepsField() {
        service.startSession("s-2", "course", Map.of("name", "Java 101"));

        CollectorResponse response = service.processMessage("s-2", "lots");

        assertFalse(response.isSuccess());
        assertEquals("duration", response.getCurrentField());
        assertTrue(response.getMessage().contains("Please provide a valid Course duration in hours"));
        SessionState state = service.getState("s-2").orElseThrow();
        assertFalse(state.hasValue("duration"));
        assertTrue(state.getValidationErrors().containsKey("duration"));
    }

    @Test
    void testProcessMessage_ValueFromIntentAnalysis() {
        // Given
        when(textGenerator.generate(eq(IntentClassifier.INTENT_SYSTEM_PROMPT), anyString()))
                .thenReturn(GenerationResult.success("{\"intent\": \"provide_value\", \"extracted_value\": \"beginner\", \"confidence\": 0.9}"));
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        CollectorResponse started = service.startSession("s-3", "course", initial);
        assertEquals("level", started.getCurrentField());
        assertTrue(started.getMessage().contains("✓ The course name: Java 101"));

        // When
        CollectorResponse response = service.processMessage("s-3", "I think total novices would fit best");

        // Then
        assertEquals(CollectionStatus.CONFIRMING, response.getStatus());
        assertEquals("beginner", response.getState().getCollectedData().get("level"));
    }

    @Test
    void testProcessMessage_CancelEndsSession() {
        service.startSession("s-4", "course", Map.of());

        CollectorResponse cancelled = service.processMessage("s-4", "cancel");
        CollectorResponse after = service.processMessage("s-4", "Java 101");

        assertTrue(cancelled.isCancelled());
        assertEquals("Data collection has been cancelled. Your information has not been saved.", cancelled.getMessage());
        assertEquals(CollectionStatus.CANCELLED, service.getState("s-4").orElseThrow().getStatus());
        assertFalse(after.isSuccess());
        assertTrue(after.getMessage().contains("already cancelled"));
    }

    @Test
    void testProcessMessage_ChangeDuringConfirmation() {
        // Given
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        service.startSession("s-5", "course", initial);
        service.processMessage("s-5", "advanced");

        // When
        CollectorResponse asked = service.processMessage("s-5", "I want to change the duration");
        CollectorResponse updated = service.processMessage("s-5", "20");
        CollectorResponse review = service.processMessage("s-5", "done");
        CollectorResponse done = service.processMessage("s-5", "yes");

        // Then
        assertEquals(CollectionStatus.ENHANCING, asked.getStatus());
        assertTrue(asked.getMessage().contains("let's update Course duration in hours"));
        assertTrue(updated.getMessage().startsWith("Updated Course duration in hours: 20"));
        assertEquals(CollectionStatus.CONFIRMING, review.getStatus());
        assertTrue(review.getMessage().startsWith("Here's your updated information:"));
        assertTrue(done.isComplete());
        assertEquals("20", completedWith.get(0).get("duration"));
    }

    @Test
    void testProcessMessage_RejectWithoutEnhancementRestarts() {
        CollectionConfig strict = courseConfig().toBuilder().name("strict").allowEnhancement(false).build();
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        service.startSession("s-6", strict, initial);
        service.processMessage("s-6", "advanced");

        CollectorResponse response = service.processMessage("s-6", "no");

        assertEquals(CollectionStatus.COLLECTING, response.getStatus());
        assertEquals("name", response.getCurrentField());
        assertTrue(response.getMessage().startsWith("Let's start over."));
        assertTrue(response.getState().getCollectedData().isEmpty());
    }

    @Test
    void testProcessMessage_OptionalFieldAskedWhenSkippingDisallowed() {
        // Given
        when(textGenerator.generate(eq(IntentClassifier.INTENT_SYSTEM_PROMPT), anyString()))
                .thenReturn(GenerationResult.success("{\"intent\": \"skip\", \"confidence\": 0.9}"));
        CollectionConfig config = courseConfig().toBuilder().name("feedback").allowSkipOptional(false).build();
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "Java 101");
        initial.put("duration", "12");
        initial.put("level", "advanced");

        // When
        CollectorResponse started = service.startSession("s-7", config, initial);
        CollectorResponse skipped = service.processMessage("s-7", "skip this one");

        // Then
        assertEquals("notes", started.getCurrentField());
        assertEquals("notes", skipped.getCurrentField());
        assertTrue(skipped.getMessage().startsWith("Anything else is required and can't be skipped."));
    }

    @Test
    void testStartSession_Failures() {
        service.startSession("dup", "course", Map.of());

        CollectorResponse duplicate = service.startSession("dup", "course", Map.of());
        CollectorResponse unknown = service.startSession("other", "nope", Map.of());

        assertFalse(duplicate.isSuccess());
        assertEquals("A session with id dup already exists.", duplicate.getMessage());
        assertFalse(unknown.isSuccess());
        assertEquals("Configuration not found.", unknown.getMessage());
        assertNull(unknown.getState());
    }

    @Test
    void testStartSession_GeneratesIdAndIgnoresBadInitialData() {
        Map<String, String> initial = new LinkedHashMap<>();
        initial.put("name", "JS");
        initial.put("unknown", "x");
        initial.put("level", "Advanced");

        CollectorResponse started = service.startSession(null, "course", initial);

        SessionState state = started.getState();
        assertNotNull(state.getSessionId());
        assertTrue(service.hasSession(state.getSessionId()));
        assertEquals(Map.of("level", "advanced"), state.getCollectedData());
        assertEquals("name", state.getCurrentField());
    }

    @Test
    void testStartSession_InlineConfigIsListed() {
        CollectionConfig inline = courseConfig().toBuilder().name("inline_course").build();

        service.startSession("s-8", inline, Map.of());

        assertEquals(List.of("course", "inline_course"), service.configNames());
        assertEquals("name", service.processMessage("s-8", "x").getCurrentField());
    }

    @Test
    void testStartSession_InvalidInlineConfigRejected() {
        CollectionConfig empty = CollectionConfig.builder().name("empty").build();

        assertThrows(InvalidCollectionConfigException.class, () -> service.startSession("s-9", empty, Map.of()));
        assertFalse(service.hasSession("s-9"));
    }

    @Test
    void testProcessMessage_UnknownSession() {
        CollectorResponse response = service.processMessage("missing", "hello");

        assertFalse(response.isSuccess());
        assertEquals("No active session found.", response.getMessage());
    }

    @Test
    void testApplyExtractedData_CompleteMovesToConfirmation() {
        service.startSession("s-10", "course", Map.of());
        Map<String, String> data = new LinkedHashMap<>();
        data.put("name", "Java 101");
        data.put("duration", "12");
        data.put("level", "beginner");

        CollectorResponse response = service.applyExtractedData("s-10", data);

        assertEquals(CollectionStatus.CONFIRMING, response.getStatus());
        assertTrue(response.getMessage().startsWith("Data extracted and applied."));
        assertTrue(response.getMessage().contains("• **The course name**: Java 101"));
        assertTrue(response.getMessage().endsWith("Is this information correct?"));
    }

    @Test
    void testApplyExtractedData_PartialResumesCollection() {
        service.startSession("s-11", "course", Map.of());
        Map<String, String> data = new LinkedHashMap<>();
        data.put("name", "Java 101");
        data.put("duration", "many");

        CollectorResponse response = service.applyExtractedData("s-11", data);

        assertEquals(CollectionStatus.COLLECTING, response.getStatus());
        assertEquals("duration", response.getCurrentField());
        assertTrue(response.getMessage().contains("Some information is still missing or invalid."));
        assertFalse(response.getState().hasValue("duration"));
    }

    @Test
    void testApplyExtractedData_NothingExtracted() {
        service.startSession("s-12", "course", Map.of());

        assertTrue(service.extractFromContent("s-12", "some document").isEmpty());
        CollectorResponse response = service.applyExtractedData("s-12", Map.of());

        assertFalse(response.isSuccess());
        assertEquals("No data could be extracted from the content.", response.getMessage());
    }

    @Test
    void testCancelAndDelete() {
        service.startSession("s-13", "course", Map.of());

        CollectorResponse cancelled = service.cancel("s-13");
        CollectorResponse again = service.cancel("s-13");

        assertTrue(cancelled.isCancelled());
        assertFalse(again.isSuccess());
        assertTrue(service.deleteSession("s-13"));
        assertFalse(service.deleteSession("s-13"));
        assertFalse(service.hasSession("s-13"));
    }

    @Test
    void testEvents_ReadFromStore() {
        List<Map<String, Object>> stored = List.of(Map.of("type", "session_started"));
        when(storeClient.find(StoreClient.EVENTS, Map.of("sessionId", "s-14"), Map.of("ts", 1), 100)).thenReturn(stored);

        assertEquals(stored, service.events("s-14"));
    }
}
