package com.backstop.core.diagnostics;

import com.backstop.core.logging.MdcContext;
import com.backstop.core.metrics.BackstopMetrics;
import com.backstop.core.model.ComponentSnapshot;
import com.backstop.core.model.CrashClassification;
import com.backstop.core.model.CrashRecord;
import com.backstop.core.model.CrashSummary;
import com.backstop.core.model.DeviceSnapshot;
import com.backstop.core.model.DiagnosticReport;
import com.backstop.core.model.EnrichmentStatus;
import com.backstop.core.model.RecoveryAttempt;
import com.backstop.core.model.ResourceKind;
import com.backstop.core.model.ValidationReport;
import com.backstop.core.resource.ResourceCatalogValidator;
import com.backstop.core.resource.UiResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Scope-lifetime store of crash records, component snapshots and device metadata.
 * <p>
 * Records are appended synchronously with a pending device snapshot; enrichment (device
 * snapshot plus a resource validation) runs on a background executor and fills them in.
 * The ledger holds at most {@code backstop.diagnostics.max-crash-reports} records and
 * evicts the oldest by timestamp, ties broken by insertion order.
 */
@Service
public class DiagnosticLedger {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticLedger.class);

    public static final String VERSION = "1.0.0";

    private static final Comparator<Entry> AGE_ORDER =
            Comparator.comparing((Entry e) -> e.timestamp).thenComparingLong(e -> e.sequence);

    private final FailureClassifier classifier;
    private final ResourceCatalogValidator resourceValidator;
    private final DeviceSnapshotCollector deviceCollector;
    private final DiagnosticsProperties properties;
    private final Clock clock;
    private final Executor enrichmentExecutor;
    private final BackstopMetrics metrics;

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ConcurrentHashMap<String, ComponentSnapshot> componentStates = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean destroyed = new AtomicBoolean(false);

    public DiagnosticLedger(FailureClassifier classifier,
                            ResourceCatalogValidator resourceValidator,
                            DeviceSnapshotCollector deviceCollector,
                            DiagnosticsProperties properties,
                            Clock clock,
                            @Qualifier("enrichmentExecutor") Executor enrichmentExecutor,
                            @Autowired(required = false) BackstopMetrics metrics) {
        this.classifier = classifier;
        this.resourceValidator = resourceValidator;
        this.deviceCollector = deviceCollector;
        this.properties = properties;
        this.clock = clock;
        this.enrichmentExecutor = enrichmentExecutor;
        this.metrics = metrics;
    }

    /**
     * Classifies and appends a failure record, then schedules its enrichment.
     *
     * @return the new record id
     */
    public String recordFailure(Throwable error, String context, String componentId) {
        Instant now = clock.instant();
        String id = "crash_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
        CrashClassification classification = classifier.classifyCrash(error, context);

        var entry = new Entry(id, sequence.incrementAndGet(), now, classification,
                error.getClass().getSimpleName(),
                error.getMessage() != null ? error.getMessage() : "No message",
                stackSummary(error), context, componentId);

        synchronized (entries) {
            entries.put(id, entry);
            evictOverflow();
        }

        MdcContext.setRecord(id);
        try {
            log.error("Recorded {} failure in {} ({}): {}",
                    classification, context, componentId, entry.message);
        } finally {
            MdcContext.clearRecord();
        }

        scheduleEnrichment(entry);
        return id;
    }

    /**
     * Appends a recovery attempt to a record. Unknown or evicted ids are ignored.
     */
    public void recordRecoveryAttempt(String recordId, String strategy, boolean success, String detail) {
        if (recordId == null) {
            return;
        }
        synchronized (entries) {
            Entry entry = entries.get(recordId);
            if (entry == null) {
                log.debug("Ignoring recovery attempt for unknown record {}", recordId);
                return;
            }
            entry.attempts.add(new RecoveryAttempt(strategy, success, detail, clock.instant()));
        }
        log.info("Recovery attempt {} for {}: {}", strategy, recordId, success ? "success" : "failed");
    }

    public void updateComponentState(String componentId, String state, Map<String, Object> details) {
        componentStates.put(componentId,
                new ComponentSnapshot(componentId, state, clock.instant(), Map.copyOf(details)));
        log.debug("Component {} state: {}", componentId, state);
    }

    public Optional<CrashRecord> record(String recordId) {
        synchronized (entries) {
            return Optional.ofNullable(entries.get(recordId)).map(Entry::toRecord);
        }
    }

    /**
     * Retained records, oldest first.
     */
    public List<CrashRecord> records() {
        synchronized (entries) {
            return entries.values().stream().sorted(AGE_ORDER).map(Entry::toRecord).toList();
        }
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    public List<ComponentSnapshot> componentStates() {
        return List.copyOf(componentStates.values());
    }

    public DiagnosticReport report() {
        List<CrashRecord> all = records();
        List<CrashRecord> recent = new ArrayList<>(all);
        Collections.reverse(recent);
        if (recent.size() > properties.getReportLimit()) {
            recent = recent.subList(0, properties.getReportLimit());
        }

        var counts = new EnumMap<CrashClassification, Long>(CrashClassification.class);
        counts.putAll(all.stream().collect(Collectors.groupingBy(CrashRecord::classification, Collectors.counting())));
        CrashClassification mostCommon = counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);
        double averageAttempts = all.stream().mapToInt(r -> r.recoveryAttempts().size()).average().orElse(0.0);
        int successful = (int) all.stream().filter(CrashRecord::recovered).count();

        var summary = new CrashSummary(all.size(), recent.size(), counts, mostCommon, averageAttempts, successful);
        ValidationReport resources = currentResources();

        var report = new DiagnosticReport(VERSION, clock.instant(), deviceCollector.collect(), summary,
                List.copyOf(recent), componentStates(), recommendations(summary, resources));
        log.info("Diagnostic report generated - {} total crashes, {} successful recoveries",
                summary.totalCrashes(), summary.successfulRecoveries());
        return report;
    }

    /**
     * Marks the ledger destroyed and drops all state. Enrichment still in flight is discarded.
     */
    public void teardown() {
        destroyed.set(true);
        synchronized (entries) {
            entries.clear();
        }
        componentStates.clear();
        log.info("Diagnostic ledger torn down");
    }

    static List<String> recommendations(CrashSummary summary, ValidationReport resources) {
        var recommendations = new ArrayList<String>();
        if (resources != null) {
            List<String> visuals = resources.missing(ResourceKind.VISUAL);
            if (!visuals.isEmpty()) {
                recommendations.add("Add missing visual resources: " + String.join(", ", visuals));
            }
            List<String> layouts = resources.missing(ResourceKind.LAYOUT);
            if (!layouts.isEmpty()) {
                recommendations.add("Add missing layout resources: " + String.join(", ", layouts));
            }
        }
        CrashClassification dominant = summary.mostCommonClassification();
        if (dominant == CrashClassification.LIFECYCLE_ERROR) {
            recommendations.add("Implement safer lifecycle management around UI mutations");
        } else if (dominant == CrashClassification.CUSTOM_COMPONENT_FAILURE) {
            recommendations.add("Add fallback mechanisms for custom UI components");
        } else if (dominant == CrashClassification.MEMORY_ERROR) {
            recommendations.add("Reduce memory pressure: disable advanced effects on this device");
        }
        if (summary.averageRecoveryAttempts() > 3) {
            recommendations.add("Improve error recovery strategies to reduce retry attempts");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("System appears stable - continue monitoring");
        }
        return recommendations;
    }

    private void evictOverflow() {
        while (entries.size() > properties.getMaxCrashReports()) {
            Entry oldest = entries.values().stream().min(AGE_ORDER).orElseThrow();
            entries.remove(oldest.id);
            log.debug("Evicted crash record {}", oldest.id);
            if (metrics != null) {
                metrics.recordEviction();
            }
        }
    }

    private void scheduleEnrichment(Entry entry) {
        try {
            enrichmentExecutor.execute(() -> enrich(entry));
        } catch (Exception e) {
            log.warn("Could not schedule enrichment for {}: {}", entry.id, e.getMessage());
            entry.enrichment = EnrichmentStatus.FAILED;
        }
    }

    private void enrich(Entry entry) {
        try {
            DeviceSnapshot device = deviceCollector.collect();
            ValidationReport resources = resourceValidator.validate(UiResource.CATALOG);
            if (destroyed.get()) {
                log.debug("Discarding enrichment for {}: ledger torn down", entry.id);
                return;
            }
            synchronized (entries) {
                entry.device = device;
                entry.resources = resources;
                entry.enrichment = EnrichmentStatus.COMPLETE;
            }
        } catch (Exception e) {
            log.warn("Enrichment failed for {}: {}", entry.id, e.getMessage(), e);
            synchronized (entries) {
                entry.enrichment = EnrichmentStatus.FAILED;
            }
        }
    }

    private ValidationReport currentResources() {
        try {
            return resourceValidator.validate(UiResource.CATALOG);
        } catch (Exception e) {
            log.warn("Resource validation for report failed: {}", e.getMessage());
            return null;
        }
    }

    private String stackSummary(Throwable error) {
        return Arrays.stream(error.getStackTrace())
                .limit(properties.getStackDepth())
                .map(StackTraceElement::toString)
                .collect(Collectors.joining("\n"));
    }

    /** Mutable ledger entry; guarded by the {@code entries} monitor. */
    private static final class Entry {
        final String id;
        final long sequence;
        final Instant timestamp;
        final CrashClassification classification;
        final String errorType;
        final String message;
        final String stackSummary;
        final String context;
        final String componentId;
        final List<RecoveryAttempt> attempts = new ArrayList<>();
        volatile DeviceSnapshot device = DeviceSnapshot.PENDING;
        volatile ValidationReport resources;
        volatile EnrichmentStatus enrichment = EnrichmentStatus.PENDING;

        Entry(String id, long sequence, Instant timestamp, CrashClassification classification,
              String errorType, String message, String stackSummary, String context, String componentId) {
            this.id = id;
            this.sequence = sequence;
            this.timestamp = timestamp;
            this.classification = classification;
            this.errorType = errorType;
            this.message = message;
            this.stackSummary = stackSummary;
            this.context = context;
            this.componentId = componentId;
        }

        CrashRecord toRecord() {
            return new CrashRecord(id, timestamp, classification, errorType, message, stackSummary,
                    context, componentId, device, resources, List.copyOf(attempts), enrichment);
        }
    }
}
