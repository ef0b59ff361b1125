package no.cantara.chaingraph;

/**
 * Thrown when a statement contains a substring that is neither a glyph, an operator,
 * nor one of the recognized prefix forms.
 */
public class ChainParseException extends IllegalArgumentException {

    private final String reason;
    private final int position;

    public ChainParseException(String reason, int position) {
        super(reason + " (position " + position + ")");
        this.reason = reason;
        this.position = position;
    }

    public String reason() { return reason; }

    /** Character offset into the trimmed statement. */
    public int position() { return position; }
}
