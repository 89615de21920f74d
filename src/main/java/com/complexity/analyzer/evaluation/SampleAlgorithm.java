package com.complexity.analyzer.evaluation;

/**
 * One entry of the bundled sample corpus.
 */
public class SampleAlgorithm {

    public static final String EXACT = "exact";
    public static final String APPROXIMATE = "approximate";

    private String name;
    private String category;
    private String description;
    private String file;
    private String expectedComplexity;
    private String precision;

    // Loaded from the .psc resource, not from the index
    private transient String source;

    public String getName()               { return name; }
    public String getCategory()           { return category; }
    public String getDescription()        { return description; }
    public String getFile()               { return file; }
    public String getExpectedComplexity() { return expectedComplexity; }
    public String getPrecision()          { return precision != null ? precision : APPROXIMATE; }
    public String getSource()             { return source; }

    /**
     * @return true if the analyzer's worst case is expected to equal {@link #getExpectedComplexity()}
     */
    public boolean isExact() {
        return EXACT.equals(getPrecision());
    }

    void setSource(String source) {
        this.source = source;
    }
}
