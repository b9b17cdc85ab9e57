package org.javai.gura.parse;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.gura.ErrorKind;
import org.javai.gura.GuraParseException;

/**
 * Mutable scanning state of a single parse: the document as grapheme clusters,
 * the current position and line, and the tables the grammar shares.
 *
 * <p>A cursor is owned by one parse and is never shared between threads.
 * Every consumed line terminator advances {@link #line()}, so restoring a
 * {@link Mark} is enough to undo any scanning done by a failed rule.</p>
 */
public final class GuraCursor {

	/** Graphemes that end a line. {@code \r\n} is a single cluster. */
	static final String NEW_LINE_CHARS = "\n\f\u000B\b";

	private List<String> graphemes;
	private int position;
	private int line = 1;
	private final Map<String, CharClass> charClasses = new HashMap<>();
	private final VariableTable variables;
	private final IndentationStack indentation = new IndentationStack();
	private final Set<Path> importedFiles;
	private GuraParseException furthestFailure;

	public GuraCursor(String text, VariableTable variables) {
		this(text, variables, new HashSet<>());
	}

	/**
	 * Creates a cursor that shares {@code importedFiles} with other cursors of the
	 * same parse.
	 */
	public GuraCursor(String text, VariableTable variables, Set<Path> importedFiles) {
		this.graphemes = Graphemes.split(Objects.requireNonNull(text, "text"));
		this.variables = Objects.requireNonNull(variables, "variables");
		this.importedFiles = Objects.requireNonNull(importedFiles, "importedFiles");
	}

	/**
	 * Snapshot of the state a failing rule must give back.
	 */
	public record Mark(int position, int line, List<Integer> indentation) {
	}

	public int position() {
		return position;
	}

	public int line() {
		return line;
	}

	public int length() {
		return graphemes.size();
	}

	public boolean atEnd() {
		return position >= graphemes.size();
	}

	public VariableTable variables() {
		return variables;
	}

	public IndentationStack indentation() {
		return indentation;
	}

	public Set<Path> importedFiles() {
		return importedFiles;
	}

	/**
	 * Returns the next grapheme without consuming it, or {@code null} at the end.
	 */
	public String peek() {
		return atEnd() ? null : graphemes.get(position);
	}

	/**
	 * Consumes the next grapheme. With a {@code null} spec any grapheme is
	 * accepted, otherwise only members of the char class.
	 *
	 * @throws GuraParseException a syntax failure if nothing acceptable follows
	 */
	public String consumeChar(String spec) {
		if (atEnd()) {
			String expected = spec == null ? "next character" : "'" + spec + "'";
			throw syntaxError("Expected " + expected + " but got end of string");
		}
		String next = graphemes.get(position);
		if (spec != null && !charClass(spec).contains(next)) {
			throw syntaxError("Expected '[" + spec + "]' but got '" + next + "'");
		}
		advance(next);
		return next;
	}

	/**
	 * Like {@link #consumeChar(String)} but returns {@code null} and leaves the
	 * cursor untouched when nothing acceptable follows.
	 */
	public String maybeChar(String spec) {
		if (atEnd()) {
			return null;
		}
		String next = graphemes.get(position);
		if (spec != null && !charClass(spec).contains(next)) {
			return null;
		}
		advance(next);
		return next;
	}

	/**
	 * Consumes the first option that appears at the cursor.
	 *
	 * @throws GuraParseException a syntax failure if no option matches
	 */
	public String keyword(String... options) {
		if (atEnd()) {
			throw syntaxError("Expected '" + String.join(",", options) + "' but got end of string");
		}
		String matched = maybeKeyword(options);
		if (matched == null) {
			throw syntaxError("Expected '" + String.join(", ", options) + "' but got '" + peek() + "'");
		}
		return matched;
	}

	public String maybeKeyword(String... options) {
		for (String option : options) {
			int end = matchEnd(option);
			if (end >= 0) {
				while (position < end) {
					advance(graphemes.get(position));
				}
				return option;
			}
		}
		return null;
	}

	/**
	 * Whether {@code text} follows the cursor. Nothing is consumed.
	 */
	public boolean lookingAt(String text) {
		return matchEnd(text) >= 0;
	}

	private int matchEnd(String text) {
		StringBuilder sb = new StringBuilder();
		int index = position;
		while (sb.length() < text.length() && index < graphemes.size()) {
			sb.append(graphemes.get(index++));
		}
		return sb.toString().equals(text) ? index : -1;
	}

	/**
	 * Consumes the next grapheme as a line terminator. A comment may end at a
	 * bare carriage return, which is not a terminator anywhere else.
	 */
	void consumeLineEnd() {
		position++;
		line++;
	}

	private void advance(String grapheme) {
		position++;
		if (isNewLine(grapheme)) {
			line++;
		}
	}

	static boolean isNewLine(String grapheme) {
		return "\r\n".equals(grapheme) || (grapheme.length() == 1 && NEW_LINE_CHARS.contains(grapheme));
	}

	CharClass charClass(String spec) {
		return charClasses.computeIfAbsent(spec, CharClass::parse);
	}

	public Mark mark() {
		return new Mark(position, line, indentation.snapshot());
	}

	/**
	 * Restores position, line and indentation stack.
	 */
	public void rewind(Mark mark) {
		rewindPosition(mark);
		indentation.reset(mark.indentation());
	}

	/**
	 * Restores position and line only, keeping indentation changes made since.
	 */
	public void rewindPosition(Mark mark) {
		this.position = mark.position();
		this.line = mark.line();
	}

	/**
	 * Consumes one line terminator if one follows.
	 */
	public boolean maybeNewLine() {
		String next = peek();
		if (next == null || !isNewLine(next)) {
			return false;
		}
		advance(next);
		return true;
	}

	/**
	 * Text of the graphemes in {@code [from, to)}.
	 */
	public String slice(int from, int to) {
		return Graphemes.join(graphemes, from, to);
	}

	/**
	 * Text from the cursor to the end of the document.
	 */
	public String rest() {
		return Graphemes.join(graphemes, Math.min(position, graphemes.size()), graphemes.size());
	}

	/**
	 * Replaces the document and scans it from the start.
	 */
	public void reset(String text) {
		this.graphemes = Graphemes.split(Objects.requireNonNull(text, "text"));
		this.position = 0;
		this.line = 1;
		this.furthestFailure = null;
	}

	/**
	 * Creates a syntax failure at the current position and remembers it if it
	 * lies further than any failure seen so far.
	 */
	public GuraParseException syntaxError(String message) {
		GuraParseException failure = new GuraParseException(ErrorKind.SYNTAX, message, position, line);
		if (furthestFailure == null || failure.position() > furthestFailure.position()) {
			furthestFailure = failure;
		}
		return failure;
	}

	/**
	 * The syntax failure with the largest position recorded since the last reset.
	 */
	GuraParseException furthestFailure() {
		return furthestFailure;
	}

	@Override
	public String toString() {
		return "GuraCursor{position=" + position + ", line=" + line + ", length=" + graphemes.size()
				+ ", indentation=" + indentation + "}";
	}
}
