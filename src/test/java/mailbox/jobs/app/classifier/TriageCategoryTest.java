package mailbox.jobs.app.classifier;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TriageCategoryTest {

    @Test
    void fromValue_ShouldNormaliseSeparatorsAndCase() {
        assertEquals(TriageCategory.ACTION_REQUIRED, TriageCategory.fromValue("Action_Required"));
        assertEquals(TriageCategory.ACTION_REQUIRED, TriageCategory.fromValue(" action required "));
        assertEquals(TriageCategory.NEWSLETTER, TriageCategory.fromValue("NEWSLETTER"));
    }

    @Test
    void fromValue_WithUnknownValue_ShouldFallBackToUnclear() {
        assertEquals(TriageCategory.UNCLEAR, TriageCategory.fromValue("spam"));
        assertEquals(TriageCategory.UNCLEAR, TriageCategory.fromValue(null));
    }

    @Test
    void labelFor_ShouldTitleCaseEachPart() {
        assertEquals("Triage/Action-Required", TriageCategory.labelFor("Triage", "action-required"));
        assertEquals("Triage/Fyi", TriageCategory.labelFor("Triage", "fyi"));
    }
}
