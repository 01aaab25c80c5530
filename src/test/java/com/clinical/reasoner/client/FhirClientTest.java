package com.clinical.reasoner.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FhirClient
 */
public class FhirClientTest {

    private static final String UNREACHABLE_SERVER = "http://127.0.0.1:1/fhir";

    @Test
    public void testConstructor_RejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new FhirClient(" "));
        assertThrows(IllegalArgumentException.class, () -> new FhirClient(UNREACHABLE_SERVER, new long[0]));
        assertThrows(IllegalArgumentException.class, () -> new FhirClient(UNREACHABLE_SERVER, null));
    }

    @Test
    public void testGetPatientRecords_UnreachableServerFails() {
        FhirClient fhirClient = new FhirClient(UNREACHABLE_SERVER, new long[]{0, 0});

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> fhirClient.getPatientRecords("patient-1"));
        assertTrue(e.getMessage().contains("patient-1"));
    }

    @Test
    public void testFindPatientsWithMedications_UnreachableServerFindsNone() {
        FhirClient fhirClient = new FhirClient(UNREACHABLE_SERVER, new long[]{0});

        assertTrue(fhirClient.findPatientsWithMedications(5).isEmpty());
        assertEquals(UNREACHABLE_SERVER, fhirClient.getServerUrl());
    }
}
