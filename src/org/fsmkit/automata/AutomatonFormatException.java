/*
 * @LICENSE@
 */

package org.fsmkit.automata;

/**
 * Unchecked exception thrown by {@link AutomatonFormat#read(java.io.Reader)}
 * for malformed or out of range input. Carries the offending token - or
 * <code>null</code> at a premature end of input - and its zero based position
 * in the token stream.
 */
public final class AutomatonFormatException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String desc;
    private final String token;
    private final int index;

    public AutomatonFormatException(String desc, String token, int index) {
        this.desc = desc;
        this.token = token;
        this.index = index;
    }

    public String getDescription() {
        return desc;
    }

    public String getToken() {
        return token;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(desc);
        sb.append(" at token ").append(index);
        if (token == null) {
            sb.append(" (end of input)");
        } else {
            sb.append(": \"").append(token).append('"');
        }
        return sb.toString();
    }
}
