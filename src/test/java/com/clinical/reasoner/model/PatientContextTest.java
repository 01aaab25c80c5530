package com.clinical.reasoner.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PatientContext and AllergyEntry
 */
public class PatientContextTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    // ========== AllergyEntry Tests ==========

    @Test
    public void testAllergyParse_SubstanceOnly() {
        AllergyEntry entry = AllergyEntry.parse(" Penicillin ");

        assertEquals("penicillin", entry.getSubstance());
        assertNull(entry.getReactionType());
        assertEquals("penicillin", entry.toString());
    }

    @Test
    public void testAllergyParse_WithReaction() {
        AllergyEntry entry = AllergyEntry.parse("Penicillin:Rash");

        assertEquals("penicillin", entry.getSubstance());
        assertEquals("rash", entry.getReactionType());
        assertEquals("penicillin:rash", entry.toString());
    }

    @Test
    public void testAllergyParse_BlankRejected() {
        assertThrows(IllegalArgumentException.class, () -> AllergyEntry.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> AllergyEntry.parse(":rash"));
    }

    // ========== PatientContext Tests ==========

    @Test
    public void testContext_NormalizesConditions() {
        PatientContext context = new PatientContext(List.of(), List.of("Renal Impairment", "gi-ulcer", "Asthma"), AS_OF);

        assertEquals(List.of("asthma", "gi_ulcer", "renal_impairment"), List.copyOf(context.getChronicConditions()));
    }

    @Test
    public void testContext_SkipsBlankEntriesAndDuplicates() {
        PatientContext context = new PatientContext(Arrays.asList("sulfa", null, "", "Sulfa"),
                Arrays.asList("asthma", null, " "), AS_OF);

        assertEquals(1, context.getAllergies().size());
        assertEquals(1, context.getChronicConditions().size());
    }

    @Test
    public void testContext_RequiresAsOfDate() {
        assertThrows(IllegalArgumentException.class, () -> new PatientContext(List.of(), List.of(), null));
    }

    @Test
    public void testContext_IsReadOnly() {
        PatientContext context = PatientContext.empty(AS_OF);

        assertThrows(UnsupportedOperationException.class, () -> context.getChronicConditions().add("asthma"));
    }
}
