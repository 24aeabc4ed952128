package com.backstop.core.diagnostics;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "backstop.diagnostics")
public class DiagnosticsProperties {

    /** Hard cap on retained crash records; the oldest are evicted first. */
    private int maxCrashReports = 50;

    /** Records included in a diagnostic report. */
    private int reportLimit = 50;

    /** Stack frames kept in a record's stack summary. */
    private int stackDepth = 8;

    /** Feature area names that mark a failure as domain specific. */
    private List<String> featureAreas = new ArrayList<>(List.of("settings", "glass"));

    public int getMaxCrashReports() { return maxCrashReports; }
    public void setMaxCrashReports(int maxCrashReports) { this.maxCrashReports = maxCrashReports; }
    public int getReportLimit() { return reportLimit; }
    public void setReportLimit(int reportLimit) { this.reportLimit = reportLimit; }
    public int getStackDepth() { return stackDepth; }
    public void setStackDepth(int stackDepth) { this.stackDepth = stackDepth; }
    public List<String> getFeatureAreas() { return featureAreas; }
    public void setFeatureAreas(List<String> featureAreas) { this.featureAreas = featureAreas; }
}
