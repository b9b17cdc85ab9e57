package org.javai.gura;

import java.util.Objects;

/**
 * Exception thrown when a Gura document cannot be parsed.
 *
 * <p>{@link #position()} is the offset, in grapheme clusters, from the start of
 * the (import-flattened) document where the failure was detected, or
 * {@link #NO_POSITION} when the failure is not located inside a document.
 * {@link #line()} is 1-based, or 0 together with {@link #NO_POSITION}.</p>
 */
public class GuraParseException extends RuntimeException {

	public static final int NO_POSITION = -1;

	private final ErrorKind kind;
	private final int position;
	private final int line;

	public GuraParseException(ErrorKind kind, String message, int position, int line) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.position = position;
		this.line = line;
	}

	public GuraParseException(ErrorKind kind, String message, int position, int line, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind");
		this.position = position;
		this.line = line;
	}

	public ErrorKind kind() {
		return kind;
	}

	public int position() {
		return position;
	}

	public int line() {
		return line;
	}

	@Override
	public String toString() {
		if (position == NO_POSITION) {
			return kind + ": " + getMessage();
		}
		return kind + " at line " + line + " position " + position + ": " + getMessage();
	}
}
