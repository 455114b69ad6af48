package com.example.videoenhance.ai.providers;

import com.example.videoenhance.ai.core.MalformedResponseException;
import com.example.videoenhance.model.Critique;
import com.example.videoenhance.model.CritiqueIssue;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CritiqueResponseAdapterTest {

    private final CritiqueResponseAdapter adapter = new CritiqueResponseAdapter(new ObjectMapper());

    @Test
    public void testAdapt_CanonicalShape_StringIssuesAreGlobal() {
        // When
        Critique critique = adapter.adapt("test", "{\"score\": 7.5, \"issues\": [\"Lift shadows\", \"Reduce noise\"]}");

        // Then
        assertEquals(7.5, critique.getScore());
        assertEquals(2, critique.getIssues().size());
        assertEquals(CritiqueIssue.global("Lift shadows"), critique.getIssues().get(0));
        assertFalse(critique.hasSurgicalIssues());
    }

    @Test
    public void testAdapt_AnalysisShape_ReadsImprovementObjects() {
        // Given
        String raw = """
            ```json
            {
              "overallAssessment": "Good grade, small distractions remain",
              "professionalScore": "7",
              "noFurtherEditsNeeded": false,
              "remainingImprovements": [
                {"type": "local", "description": "Flare", "region": "top-right", "impact": "high",
                 "imagenSuitable": true, "safeForPropagation": true, "editInstruction": "Remove the lens flare"},
                {"type": "global", "description": "Slightly cool", "impact": "medium",
                 "safeForPropagation": true, "editInstruction": "Warm the white balance"}
              ]
            }
            ```""";

        // When
        Critique critique = adapter.adapt("test", raw);

        // Then
        assertEquals(7.0, critique.getScore());
        assertEquals("Good grade, small distractions remain", critique.getAssessment());
        assertEquals(2, critique.getIssues().size());
        assertEquals(new CritiqueIssue("Remove the lens flare", "top-right", true), critique.getIssues().get(0));
        assertEquals(new CritiqueIssue("Warm the white balance", "global", false), critique.getIssues().get(1));
    }

    @Test
    public void testAdapt_UnsafeOrLowImpactIssues_Dropped() {
        String raw = "{\"score\": 6, \"issues\": ["
            + "{\"description\": \"Remove the person\", \"safeForPropagation\": false},"
            + "{\"description\": \"Tiny speck\", \"impact\": \"low\"},"
            + "{\"description\": \"Boost contrast\", \"impact\": \"high\"}]}";

        Critique critique = adapter.adapt("test", raw);

        assertEquals(1, critique.getIssues().size());
        assertEquals("Boost contrast", critique.getIssues().get(0).description());
    }

    @Test
    public void testAdapt_NoFurtherEditsNeeded_IgnoresIssues() {
        Critique critique = adapter.adapt("test",
            "{\"professionalScore\": 9.1, \"noFurtherEditsNeeded\": true, \"remainingImprovements\": [\"nitpick\"]}");

        assertFalse(critique.hasIssues());
        assertEquals(9.1, critique.getScore(), 1e-9);
    }

    @Test
    public void testAdapt_PercentScale_ScaledToTen() {
        Critique critique = adapter.adapt("test", "{\"score\": 85, \"issues\": []}");

        assertEquals(8.5, critique.getScore(), 1e-9);
    }

    @Test
    public void testAdapt_OutOfRangeScore_Clamped() {
        assertEquals(0.0, adapter.adapt("test", "{\"score\": -3}").getScore());
        assertEquals(10.0, adapter.adapt("test", "{\"score\": 250}").getScore());
    }

    @Test
    public void testAdapt_MissingScore_ThrowsMalformed() {
        assertThrows(MalformedResponseException.class,
            () -> adapter.adapt("test", "{\"issues\": [\"Lift shadows\"]}"));
        assertThrows(MalformedResponseException.class,
            () -> adapter.adapt("test", "{\"score\": \"great\"}"));
    }

    @Test
    public void testAdapt_NotJson_ThrowsMalformed() {
        MalformedResponseException e = assertThrows(MalformedResponseException.class,
            () -> adapter.adapt("gemini", "The image looks great to me."));

        assertTrue(e.isRetryable());
        assertEquals("gemini", e.getProvider());
    }
}
