package com.clinical.reasoner.client;

import ca.uhn.fhir.context.FhirContext;
import ca.uhn.fhir.rest.client.api.IGenericClient;
import ca.uhn.fhir.rest.client.exceptions.FhirClientConnectionException;
import ca.uhn.fhir.rest.gclient.ICriterion;
import ca.uhn.fhir.rest.server.exceptions.ResourceNotFoundException;
import org.hl7.fhir.instance.model.api.IBaseResource;
import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.Bundle;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * FhirClient handles all FHIR server communication and resource retrieval.
 * It retrieves the medication history, allergies and conditions the reasoning engine needs.
 */
public class FhirClient {
    private static final Logger logger = LoggerFactory.getLogger(FhirClient.class);
    private static final String DEFAULT_FHIR_SERVER_URL = "https://hapi.fhir.org/baseR4";
    private static final long[] DEFAULT_RETRY_DELAYS_MS = {1000, 2000, 4000}; // 1s, 2s, 4s
    private static final int PAGE_SIZE = 100;

    private final IGenericClient client;
    private final String serverUrl;
    private final long[] retryDelaysMs;

    /**
     * Create a FhirClient with the default FHIR server URL
     */
    public FhirClient() {
        this(DEFAULT_FHIR_SERVER_URL);
    }

    /**
     * Create a FhirClient with a custom FHIR server URL
     * @param serverUrl The FHIR server base URL
     */
    public FhirClient(String serverUrl) {
        this(serverUrl, DEFAULT_RETRY_DELAYS_MS);
    }

    /**
     * Create a FhirClient with a custom FHIR server URL and retry schedule
     * @param serverUrl The FHIR server base URL
     * @param retryDelaysMs Delay before each retry; one attempt is made per entry
     */
    public FhirClient(String serverUrl, long[] retryDelaysMs) {
        if (serverUrl == null || serverUrl.isBlank()) {
            throw new IllegalArgumentException("Server URL cannot be blank");
        }
        if (retryDelaysMs == null || retryDelaysMs.length == 0) {
            throw new IllegalArgumentException("Retry delays cannot be empty");
        }
        this.serverUrl = serverUrl;
        this.retryDelaysMs = retryDelaysMs.clone();

        FhirContext ctx = FhirContext.forR4();
        this.client = ctx.newRestfulGenericClient(serverUrl);

        logger.info("FhirClient initialized with server URL: {}", serverUrl);
    }

    /**
     * Find patients that have medication statements on the server
     * @param maxPatients Maximum number of patients to return
     * @return Unique patient IDs in the order they were found
     */
    public List<String> findPatientsWithMedications(int maxPatients) {
        logger.info("Searching for patients with medication history (max: {})", maxPatients);

        Set<String> patientIds = new LinkedHashSet<>();

        Bundle statements = executeWithRetry(() -> client.search()
                .forResource(MedicationStatement.class)
                .count(maxPatients * 3)
                .returnBundle(Bundle.class)
                .execute(), "search for MedicationStatements");
        extractPatientIds(statements, patientIds, maxPatients);

        // servers populated from prescriptions often carry requests only
        if (patientIds.size() < maxPatients) {
            Bundle requests = executeWithRetry(() -> client.search()
                    .forResource(MedicationRequest.class)
                    .count(maxPatients * 3)
                    .returnBundle(Bundle.class)
                    .execute(), "search for MedicationRequests");
            extractPatientIds(requests, patientIds, maxPatients);
        }

        logger.info("Found {} patients with medication history", patientIds.size());
        return new ArrayList<>(patientIds);
    }

    /**
     * Extract subject patient IDs from a bundle of medication resources
     */
    private void extractPatientIds(Bundle bundle, Set<String> patientIds, int maxPatients) {
        if (bundle == null || !bundle.hasEntry()) {
            return;
        }
        for (Bundle.BundleEntryComponent entry : bundle.getEntry()) {
            if (patientIds.size() >= maxPatients) {
                break;
            }
            Reference subject = null;
            if (entry.getResource() instanceof MedicationStatement statement && statement.hasSubject()) {
                subject = statement.getSubject();
            } else if (entry.getResource() instanceof MedicationRequest request && request.hasSubject()) {
                subject = request.getSubject();
            }
            if (subject != null && subject.hasReferenceElement()) {
                String patientId = subject.getReferenceElement().getIdPart();
                if (patientId != null) {
                    patientIds.add(patientId);
                }
            }
        }
    }

    /**
     * Retrieve the medication history, allergies and conditions for a patient
     * @param patientId The patient ID
     * @return Record set containing all retrieved resources
     * @throws IllegalStateException if any resource type could not be retrieved completely
     */
    public PatientRecordSet getPatientRecords(String patientId) {
        logger.info("Retrieving medication records for patient: {}", patientId);

        PatientRecordSet recordSet = new PatientRecordSet();
        recordSet.setPatientId(patientId);

        recordSet.setMedicationStatements(search(MedicationStatement.class,
                MedicationStatement.PATIENT.hasId(patientId), "MedicationStatements", patientId));
        recordSet.setMedicationRequests(search(MedicationRequest.class,
                MedicationRequest.PATIENT.hasId(patientId), "MedicationRequests", patientId));
        recordSet.setAllergies(search(AllergyIntolerance.class,
                AllergyIntolerance.PATIENT.hasId(patientId), "AllergyIntolerances", patientId));
        recordSet.setConditions(search(Condition.class,
                Condition.PATIENT.hasId(patientId), "Conditions", patientId));

        logger.info("Retrieved {} statements, {} requests, {} allergies and {} conditions for patient {}",
                recordSet.getMedicationStatements().size(), recordSet.getMedicationRequests().size(),
                recordSet.getAllergies().size(), recordSet.getConditions().size(), patientId);

        return recordSet;
    }

    /**
     * Search one resource type for a patient and follow all result pages
     */
    private <T extends IBaseResource> List<T> search(Class<T> resourceClass,
                                                     ICriterion<?> patientCriterion,
                                                     String description, String patientId) {
        Bundle bundle = executeWithRetry(() -> client.search()
                .forResource(resourceClass)
                .where(patientCriterion)
                .count(PAGE_SIZE)
                .returnBundle(Bundle.class)
                .execute(), "retrieve " + description + " for patient " + patientId);

        // an unreachable server must not read as a patient without medications
        if (bundle == null) {
            throw new IllegalStateException("Failed to retrieve " + description + " for patient " + patientId);
        }
        List<T> resources = getAllPages(bundle, resourceClass);
        logger.debug("Retrieved {} {} for patient {}", resources.size(), description, patientId);
        return resources;
    }

    /**
     * Handle paginated Bundle results by following the "next" link
     * @param bundle The initial Bundle
     * @param resourceClass The class of resources to extract
     * @param <T> The resource type
     * @return List of all resources from all pages
     */
    private <T extends IBaseResource> List<T> getAllPages(Bundle bundle, Class<T> resourceClass) {
        List<T> allResources = new ArrayList<>();

        Bundle currentBundle = bundle;

        while (currentBundle != null) {
            if (currentBundle.hasEntry()) {
                for (Bundle.BundleEntryComponent entry : currentBundle.getEntry()) {
                    if (entry.hasResource() && resourceClass.isInstance(entry.getResource())) {
                        allResources.add(resourceClass.cast(entry.getResource()));
                    }
                }
            }

            Bundle.BundleLinkComponent nextLink = currentBundle.getLink(Bundle.LINK_NEXT);
            if (nextLink != null && nextLink.hasUrl()) {
                logger.debug("Following next link for pagination: {}", nextLink.getUrl());

                final Bundle bundleForRetry = currentBundle;
                Bundle nextBundle = executeWithRetry(() -> client.loadPage()
                        .next(bundleForRetry)
                        .execute(), "load next page of results");

                if (nextBundle == null) {
                    throw new IllegalStateException("Failed to load next page of results from " + nextLink.getUrl());
                }
                currentBundle = nextBundle;
            } else {
                currentBundle = null;
            }
        }

        return allResources;
    }

    /**
     * Execute a FHIR API call with retry logic and exponential backoff
     * @param operation The operation to execute
     * @param operationDescription Description of the operation for logging
     * @param <T> The return type
     * @return The result of the operation, or null if all retries fail
     */
    private <T> T executeWithRetry(Supplier<T> operation, String operationDescription) {
        Exception lastException = null;

        for (int attempt = 0; attempt < retryDelaysMs.length; attempt++) {
            try {
                return operation.get();
            } catch (ResourceNotFoundException e) {
                // not retried
                logger.warn("Resource not found while attempting to {}: {}", operationDescription, e.getMessage());
                return null;
            } catch (FhirClientConnectionException e) {
                lastException = e;
                logger.warn("Connection error on attempt {} while attempting to {}: {}",
                        attempt + 1, operationDescription, e.getMessage());
            } catch (Exception e) {
                lastException = e;
                logger.warn("Error on attempt {} while attempting to {}: {}",
                        attempt + 1, operationDescription, e.getMessage());
            }

            if (attempt < retryDelaysMs.length - 1) {
                long delay = retryDelaysMs[attempt];
                logger.info("Retrying in {} ms...", delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    logger.error("Retry interrupted for operation: {}", operationDescription);
                    return null;
                }
            }
        }

        logger.error("Failed to {} after {} attempts. Last error: {}",
                operationDescription, retryDelaysMs.length,
                lastException != null ? lastException.getMessage() : "unknown");
        return null;
    }

    /**
     * Get the configured server URL
     * @return The FHIR server URL
     */
    public String getServerUrl() {
        return serverUrl;
    }
}
