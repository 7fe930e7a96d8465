package com.coinscript.error;

/** Line/column (both 1-based) plus absolute character offset into the source text. */
public final class SourcePosition {
    public final int line;
    public final int column;
    public final int offset;

    public SourcePosition(int line, int column, int offset) {
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public SourcePosition(int line, int column) {
        this(line, column, -1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition other = (SourcePosition) o;
        return line == other.line && column == other.column && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return (line * 31 + column) * 31 + offset;
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
