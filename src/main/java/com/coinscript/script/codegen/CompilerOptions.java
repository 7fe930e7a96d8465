package com.coinscript.script.codegen;

/**
 * Compiler switches. A plain bean so it can be read from a JSON config file.
 */
public class CompilerOptions {

    private int maxExpressionDepth = 256;
    private boolean conservationCheck = false;
    private boolean prettyPrint = true;
    private boolean keywordOpcodes = true;
    private String launcherId;

    public int getMaxExpressionDepth() { return maxExpressionDepth; }

    public void setMaxExpressionDepth(int maxExpressionDepth) {
        if (maxExpressionDepth < 1) throw new IllegalArgumentException("maxExpressionDepth must be >= 1");
        this.maxExpressionDepth = maxExpressionDepth;
    }

    /** When set, routed programs take my_amount and fail if a path sends more than it. */
    public boolean isConservationCheck() { return conservationCheck; }
    public void setConservationCheck(boolean conservationCheck) { this.conservationCheck = conservationCheck; }

    public boolean isPrettyPrint() { return prettyPrint; }
    public void setPrettyPrint(boolean prettyPrint) { this.prettyPrint = prettyPrint; }

    public boolean isKeywordOpcodes() { return keywordOpcodes; }
    public void setKeywordOpcodes(boolean keywordOpcodes) { this.keywordOpcodes = keywordOpcodes; }

    /** Hex launcher id for @singleton coins; overrides the one in source. */
    public String getLauncherId() { return launcherId; }
    public void setLauncherId(String launcherId) { this.launcherId = launcherId; }

    public CompilerOptions copy() {
        CompilerOptions c = new CompilerOptions();
        c.maxExpressionDepth = maxExpressionDepth;
        c.conservationCheck = conservationCheck;
        c.prettyPrint = prettyPrint;
        c.keywordOpcodes = keywordOpcodes;
        c.launcherId = launcherId;
        return c;
    }
}
