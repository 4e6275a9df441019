package org.dxworks.exgraph;

/**
 * Per-run switches of {@link ProjectAnalyzer#analyze}.
 */
public final class AnalysisOptions {

    private final boolean includeTests;
    private final boolean internalOnly;
    private final boolean parallel;
    private final int maxFileLines;

    private AnalysisOptions(boolean includeTests, boolean internalOnly, boolean parallel, int maxFileLines) {
        this.includeTests = includeTests;
        this.internalOnly = internalOnly;
        this.parallel = parallel;
        this.maxFileLines = maxFileLines;
    }

    public static AnalysisOptions defaults() {
        return from(ExgraphConfig.defaults());
    }

    public static AnalysisOptions from(ExgraphConfig config) {
        return new AnalysisOptions(config.isIncludeTests(), config.isInternalOnly(), config.isParallel(),
                config.getMaxFileLines());
    }

    public AnalysisOptions withIncludeTests(boolean value) {
        return new AnalysisOptions(value, internalOnly, parallel, maxFileLines);
    }

    public AnalysisOptions withInternalOnly(boolean value) {
        return new AnalysisOptions(includeTests, value, parallel, maxFileLines);
    }

    public AnalysisOptions withParallel(boolean value) {
        return new AnalysisOptions(includeTests, internalOnly, value, maxFileLines);
    }

    public boolean isIncludeTests() {
        return includeTests;
    }

    public boolean isInternalOnly() {
        return internalOnly;
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }
}
