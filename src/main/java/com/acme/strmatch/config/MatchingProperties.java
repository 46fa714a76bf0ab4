package com.acme.strmatch.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "strmatch.matching")
public class MatchingProperties {

    /** Column holding the profile identifier in query and database rows. */
    @NotBlank
    private String idColumn = "PersonID";

    /** Skip candidates without any shared or adjacent allele once the top-K is full. */
    private boolean prefilterEnabled = true;

    /** Split each database scan across the scan executor. */
    private boolean parallelEnabled = false;

    /** Scan worker threads; 0 means one per available processor. */
    @Min(0)
    private int scanThreads = 0;

    /** Smallest number of candidates a scan shard is given. */
    @Min(1)
    private int minShardSize = 50_000;

    /** Queries ranked at the same time by the batch driver. */
    @Min(1)
    private int queryConcurrency = 2;

    /** Distinct allele strings kept parsed in memory. */
    @Min(0)
    private long alleleCacheSize = 10_000L;

    public String getIdColumn() {
        return idColumn;
    }

    public void setIdColumn(String idColumn) {
        this.idColumn = idColumn;
    }

    public boolean isPrefilterEnabled() {
        return prefilterEnabled;
    }

    public void setPrefilterEnabled(boolean prefilterEnabled) {
        this.prefilterEnabled = prefilterEnabled;
    }

    public boolean isParallelEnabled() {
        return parallelEnabled;
    }

    public void setParallelEnabled(boolean parallelEnabled) {
        this.parallelEnabled = parallelEnabled;
    }

    public int getScanThreads() {
        return scanThreads;
    }

    public void setScanThreads(int scanThreads) {
        this.scanThreads = scanThreads;
    }

    /** Effective scan thread count. */
    public int resolvedScanThreads() {
        return scanThreads > 0 ? scanThreads : Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int getMinShardSize() {
        return minShardSize;
    }

    public void setMinShardSize(int minShardSize) {
        this.minShardSize = minShardSize;
    }

    public int getQueryConcurrency() {
        return queryConcurrency;
    }

    public void setQueryConcurrency(int queryConcurrency) {
        this.queryConcurrency = queryConcurrency;
    }

    public long getAlleleCacheSize() {
        return alleleCacheSize;
    }

    public void setAlleleCacheSize(long alleleCacheSize) {
        this.alleleCacheSize = alleleCacheSize;
    }
}
