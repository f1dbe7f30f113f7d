package org.rholang.parser;

import com.google.common.base.Preconditions;

/**
 * Character offsets into the parsed source, end exclusive.
 */
public final class SourceSpan {
    public final int start;
    public final int end;

    public SourceSpan(int start, int end) {
        Preconditions.checkArgument(0 <= start && start <= end, "bad span %s..%s", start, end);
        this.start = start;
        this.end = end;
    }

    public static SourceSpan between(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.start, Math.max(first.end, last.end));
    }

    public int length() {
        return end - start;
    }

    public String textOf(String source) {
        return source.substring(start, end);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan other = (SourceSpan)o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
