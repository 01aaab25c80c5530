package com.clinical.reasoner.main;

import com.clinical.reasoner.client.FhirClient;
import com.clinical.reasoner.client.FhirRecordMapper;
import com.clinical.reasoner.client.PatientRecordSet;
import com.clinical.reasoner.engine.ClinicalReasoningEngine;
import com.clinical.reasoner.engine.EngineConfig;
import com.clinical.reasoner.engine.EvaluationResult;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.PatientContext;
import com.clinical.reasoner.report.EvaluationJsonWriter;
import com.clinical.reasoner.report.ReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Main application for the medication timeline and drug safety engine.
 * Retrieves each patient's medication history from a FHIR server, evaluates it and prints a report.
 * <p>
 * Usage: {@code MedicationSafetyApp [--as-of=YYYY-MM-DD] [--max=N] [--json] [patientId ...]}.
 * Without patient ids, patients with medication history are discovered on the server.
 */
public class MedicationSafetyApp {

    private static final Logger logger = LoggerFactory.getLogger(MedicationSafetyApp.class);
    private static final int DEFAULT_MAX_PATIENTS = 20;

    public static void main(String[] args) {
        logger.info("Starting medication safety evaluation");

        AppOptions options;
        try {
            options = AppOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }

        try {
            EngineConfig config = new EngineConfig();
            List<String> issues = config.validate();
            if (!issues.isEmpty()) {
                issues.forEach(issue -> logger.error("Configuration issue: {}", issue));
                System.err.println("Error: invalid configuration: " + String.join("; ", issues));
                System.exit(1);
                return;
            }

            ClinicalReasoningEngine engine = ClinicalReasoningEngine.fromConfig(config);
            logger.info("Loaded rule catalog version {}", engine.getCatalog().getVersion());

            logger.info("Initializing FHIR client with server: {}", config.getFhirServerUrl());
            FhirClient fhirClient = new FhirClient(config.getFhirServerUrl());
            FhirRecordMapper mapper = new FhirRecordMapper(config.getFhirDefaultConfidence());

            List<String> patientIds = options.getPatientIds();
            if (patientIds.isEmpty()) {
                patientIds = fhirClient.findPatientsWithMedications(options.getMaxPatients());
            }
            if (patientIds.isEmpty()) {
                logger.warn("No patients with medication history found on FHIR server");
                System.out.println("No patients found for evaluation.");
                return;
            }

            logger.info("Evaluating {} patients as of {}", patientIds.size(), options.getAsOfDate());
            List<EvaluationResult> results = processPatientsInParallel(patientIds, fhirClient, mapper, engine,
                    options.getAsOfDate(), config.getThreadPoolSize());
            logger.info("Completed evaluation of {} patients", results.size());

            if (options.isJson()) {
                System.out.println(new EvaluationJsonWriter().writeAll(results));
            } else {
                System.out.println(new ReportGenerator().generateReport(results));
            }

            logger.info("Medication safety evaluation completed successfully");

        } catch (Exception e) {
            logger.error("Fatal error in medication safety application: {}", e.getMessage(), e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Retrieve and evaluate patients in parallel
     * @param patientIds List of patient IDs to process
     * @param fhirClient FHIR client for data retrieval
     * @param mapper Maps FHIR resources to engine inputs
     * @param engine Shared reasoning engine
     * @param asOfDate Date every evaluation is anchored to
     * @param threadPoolSize Number of concurrent patient processing threads
     * @return Evaluation results in patient order; patients that failed are omitted
     */
    static List<EvaluationResult> processPatientsInParallel(
            List<String> patientIds,
            FhirClient fhirClient,
            FhirRecordMapper mapper,
            ClinicalReasoningEngine engine,
            LocalDate asOfDate,
            int threadPoolSize) {

        ExecutorService executorService = Executors.newFixedThreadPool(threadPoolSize);

        AtomicInteger processedCount = new AtomicInteger(0);
        int totalPatients = patientIds.size();

        try {
            List<CompletableFuture<EvaluationResult>> futures = patientIds.stream()
                .map(patientId -> CompletableFuture.supplyAsync(() -> {
                    try {
                        int currentCount = processedCount.incrementAndGet();
                        logger.info("Processing patient {}/{}: {}", currentCount, totalPatients, patientId);

                        PatientRecordSet recordSet = fhirClient.getPatientRecords(patientId);
                        if (recordSet.hasNoMedications()) {
                            logger.info("Patient {} has no medication records", patientId);
                        }
                        List<MedicationRecord> records = mapper.toRecords(recordSet);
                        PatientContext context = mapper.toContext(recordSet, asOfDate);

                        EvaluationResult result = engine.evaluate(patientId, records, context);

                        logger.info("Patient {} evaluation complete: risk {}, {} findings",
                            patientId, result.getRiskLevel(), result.getFindings().size());

                        return result;

                    } catch (Exception e) {
                        logger.error("Error processing patient {}: {}", patientId, e.getMessage(), e);
                        return null;
                    }
                }, executorService))
                .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            return futures.stream()
                .map(CompletableFuture::join)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        } finally {
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                    logger.warn("Executor service did not terminate in time, forcing shutdown");
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                logger.error("Interrupted while waiting for executor service to terminate");
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Parsed command-line arguments
     */
    static final class AppOptions {
        private final LocalDate asOfDate;
        private final int maxPatients;
        private final boolean json;
        private final List<String> patientIds;

        private AppOptions(LocalDate asOfDate, int maxPatients, boolean json, List<String> patientIds) {
            this.asOfDate = asOfDate;
            this.maxPatients = maxPatients;
            this.json = json;
            this.patientIds = patientIds;
        }

        /**
         * @param args Command-line arguments
         * @return Parsed options; the as-of date defaults to today
         * @throws IllegalArgumentException on a malformed option
         */
        static AppOptions parse(String[] args) {
            LocalDate asOfDate = LocalDate.now();
            int maxPatients = DEFAULT_MAX_PATIENTS;
            boolean json = false;
            List<String> patientIds = new ArrayList<>();

            for (String arg : args) {
                if (arg.startsWith("--as-of=")) {
                    String value = arg.substring("--as-of=".length());
                    try {
                        asOfDate = LocalDate.parse(value);
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("Invalid --as-of date: " + value, e);
                    }
                } else if (arg.startsWith("--max=")) {
                    String value = arg.substring("--max=".length());
                    try {
                        maxPatients = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid --max value: " + value, e);
                    }
                    if (maxPatients <= 0) {
                        throw new IllegalArgumentException("--max must be positive: " + value);
                    }
                } else if (arg.equals("--json")) {
                    json = true;
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else if (!arg.isBlank()) {
                    patientIds.add(arg.trim());
                }
            }
            return new AppOptions(asOfDate, maxPatients, json, patientIds);
        }

        LocalDate getAsOfDate() {
            return asOfDate;
        }

        int getMaxPatients() {
            return maxPatients;
        }

        boolean isJson() {
            return json;
        }

        List<String> getPatientIds() {
            return patientIds;
        }
    }
}
