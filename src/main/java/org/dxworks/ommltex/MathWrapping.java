package org.dxworks.ommltex;

/**
 * How the batch converter wraps LaTeX before writing it out.
 */
public enum MathWrapping {
    NONE("none", "", ""),
    INLINE("inline", "$", "$"),
    DISPLAY("display", "\\[", "\\]");

    private final String name;
    private final String open;
    private final String close;

    MathWrapping(String name, String open, String close) {
        this.name = name;
        this.open = open;
        this.close = close;
    }

    public String getName() {
        return name;
    }

    public String wrap(String latex) {
        return open + latex + close;
    }

    public static MathWrapping fromName(String name) {
        if (name == null) return null;
        for (MathWrapping wrapping : values()) {
            if (wrapping.name.equalsIgnoreCase(name.trim())) {
                return wrapping;
            }
        }
        return null;
    }
}
