package io.github.cyfko.truthtable.core.config;

/**
 * How boolean cells are written in a rendered truth table.
 */
public enum CellFormat {
    /** {@code 1} / {@code 0} */
    BINARY("1", "0"),
    /** {@code true} / {@code false} */
    BOOLEAN("true", "false");

    private final String trueText;
    private final String falseText;

    CellFormat(String trueText, String falseText) {
        this.trueText = trueText;
        this.falseText = falseText;
    }

    public String format(boolean value) {
        return value ? trueText : falseText;
    }

    /**
     * @return the widest text this format produces
     */
    public int width() {
        return Math.max(trueText.length(), falseText.length());
    }
}
