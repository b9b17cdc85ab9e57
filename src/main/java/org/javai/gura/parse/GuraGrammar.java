package org.javai.gura.parse;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.gura.ErrorKind;
import org.javai.gura.GuraParseException;
import org.javai.gura.value.GuraArray;
import org.javai.gura.value.GuraBool;
import org.javai.gura.value.GuraNull;
import org.javai.gura.value.GuraObject;
import org.javai.gura.value.GuraString;
import org.javai.gura.value.GuraValue;

/**
 * The rules of the Gura grammar.
 *
 * <p>Each rule reads from a {@link GuraCursor} and either returns what it
 * matched or throws a {@link GuraParseException}. Rules are combined with
 * {@link Rules#matches} and {@link Rules#maybeMatch}, which take care of
 * rewinding the cursor when an alternative fails.</p>
 */
public final class GuraGrammar {

	static final String KEY_CHARS = "0-9A-Za-z_";

	private static final String HEX_DIGITS = "0-9a-fA-F";

	private static final Map<String, String> ESCAPES = Map.of(
			"b", "\b",
			"f", "\f",
			"n", "\n",
			"r", "\r",
			"t", "\t",
			"\"", "\"",
			"\\", "\\",
			"$", "$");

	private GuraGrammar() {
		// Utility class - no instantiation
	}

	/**
	 * Parses a whole document: expands its imports, reads the top-level object
	 * and checks that nothing but blank space is left.
	 *
	 * @param originDirectory directory relative imports resolve against, or {@code null}
	 * @return the document, empty if it has no pairs
	 */
	public static GuraObject start(GuraCursor cursor, ImportExpander imports, Path originDirectory) {
		imports.expand(cursor, originDirectory);
		Fragment result = Rules.matches(cursor, GuraGrammar::object);
		eatWsAndNewLines(cursor);
		assertEnd(cursor);
		if (result instanceof Fragment.IndentedObject document) {
			return document.object();
		}
		return GuraObject.empty();
	}

	static void assertEnd(GuraCursor cursor) {
		if (cursor.atEnd()) {
			return;
		}
		GuraParseException furthest = cursor.furthestFailure();
		if (furthest != null && furthest.position() > cursor.position()) {
			throw furthest;
		}
		throw cursor.syntaxError("Expected end of string but got '" + cursor.peek() + "'");
	}

	// Values

	static Fragment anyType(GuraCursor cursor) {
		Fragment primitive = Rules.maybeMatch(cursor, GuraGrammar::primitiveType);
		if (primitive != null) {
			return primitive;
		}
		return Rules.matches(cursor, GuraGrammar::list, GuraGrammar::object);
	}

	static Fragment primitiveType(GuraCursor cursor) {
		ws(cursor);
		GuraValue value = Rules.matches(cursor,
				GuraGrammar::nullValue,
				GuraGrammar::bool,
				GuraGrammar::basicString,
				GuraGrammar::literalString,
				GuraGrammar::number,
				GuraGrammar::variableValue,
				GuraGrammar::emptyObject);
		return new Fragment.Value(value);
	}

	static GuraValue nullValue(GuraCursor cursor) {
		cursor.keyword("null");
		return GuraNull.INSTANCE;
	}

	static GuraValue emptyObject(GuraCursor cursor) {
		cursor.keyword("empty");
		return GuraObject.empty();
	}

	static GuraValue bool(GuraCursor cursor) {
		return GuraBool.of("true".equals(cursor.keyword("true", "false")));
	}

	static GuraValue basicString(GuraCursor cursor) {
		String quote = cursor.keyword("\"\"\"", "\"");
		boolean multiline = quote.length() == 3;
		if (multiline) {
			trimLeadingNewLine(cursor);
		}

		StringBuilder sb = new StringBuilder();
		while (cursor.maybeKeyword(quote) == null) {
			int position = cursor.position();
			int line = cursor.line();
			String current = cursor.consumeChar(null);
			if ("\\".equals(current)) {
				String escape = cursor.consumeChar(null);
				if (multiline && GuraCursor.isNewLine(escape)) {
					eatWsAndNewLines(cursor);
				} else if ("u".equals(escape) || "U".equals(escape)) {
					sb.appendCodePoint(unicodeEscape(cursor, "u".equals(escape) ? 4 : 8));
				} else {
					String unescaped = ESCAPES.get(escape);
					sb.append(unescaped != null ? unescaped : current + escape);
				}
			} else if ("$".equals(current)) {
				String name = variableName(cursor);
				sb.append(cursor.variables().resolveAsText(name, position, line));
			} else {
				sb.append(current);
			}
		}
		return new GuraString(sb.toString());
	}

	private static int unicodeEscape(GuraCursor cursor, int digits) {
		StringBuilder hex = new StringBuilder(digits);
		for (int i = 0; i < digits; i++) {
			hex.append(cursor.consumeChar(HEX_DIGITS));
		}
		long codePoint = Long.parseLong(hex.toString(), 16);
		if (codePoint > Character.MAX_CODE_POINT
				|| (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
			throw cursor.syntaxError("Bad hex value \\" + (digits == 4 ? "u" : "U") + hex);
		}
		return (int) codePoint;
	}

	static GuraValue literalString(GuraCursor cursor) {
		String quote = cursor.keyword("'''", "'");
		if (quote.length() == 3) {
			trimLeadingNewLine(cursor);
		}

		StringBuilder sb = new StringBuilder();
		while (cursor.maybeKeyword(quote) == null) {
			sb.append(cursor.consumeChar(null));
		}
		return new GuraString(sb.toString());
	}

	private static void trimLeadingNewLine(GuraCursor cursor) {
		String next = cursor.peek();
		if ("\n".equals(next) || "\r\n".equals(next)) {
			cursor.maybeNewLine();
		}
	}

	static GuraValue number(GuraCursor cursor) {
		StringBuilder sb = new StringBuilder(cursor.consumeChar(NumberLiteral.CHARS));
		String next;
		while ((next = cursor.maybeChar(NumberLiteral.CHARS)) != null) {
			sb.append(next);
		}
		String literal = sb.toString();
		GuraValue value = NumberLiteral.parse(literal);
		if (value == null) {
			throw cursor.syntaxError("'" + literal + "' is not a valid number");
		}
		return value;
	}

	static GuraValue variableValue(GuraCursor cursor) {
		int position = cursor.position();
		int line = cursor.line();
		cursor.keyword("$");
		String name = unquotedString(cursor);
		return cursor.variables().resolve(name, position, line);
	}

	static Fragment list(GuraCursor cursor) {
		List<GuraValue> elements = new ArrayList<>();
		ws(cursor);
		cursor.keyword("[");
		while (true) {
			if (Rules.maybeMatch(cursor, GuraGrammar::uselessLine) != null) {
				continue;
			}
			Fragment item = Rules.maybeMatch(cursor, GuraGrammar::anyType);
			if (item == null) {
				break;
			}
			if (item instanceof Fragment.IndentedObject element) {
				elements.add(element.object());
			} else if (item instanceof Fragment.Value element) {
				elements.add(element.value());
			}

			ws(cursor);
			cursor.maybeNewLine();
			if (cursor.maybeKeyword(",") == null) {
				break;
			}
		}
		ws(cursor);
		cursor.maybeNewLine();
		cursor.keyword("]");
		return new Fragment.Value(new GuraArray(elements));
	}

	// Objects and indentation

	/**
	 * Collects sibling pairs until the block ends.
	 *
	 * @return the object with the indentation of its pairs, or
	 * {@link Fragment.Marker#BREAK_PARENT} if no pair was found
	 */
	static Fragment object(GuraCursor cursor) {
		Map<String, GuraValue> members = new LinkedHashMap<>();
		int indentation = 0;
		while (!cursor.atEnd()) {
			Fragment fragment = Rules.maybeMatch(cursor,
					GuraGrammar::variable, GuraGrammar::pair, GuraGrammar::uselessLine);
			if (fragment == null || fragment == Fragment.Marker.BREAK_PARENT) {
				break;
			}
			if (fragment instanceof Fragment.Pair pair) {
				if (members.containsKey(pair.key())) {
					throw new GuraParseException(ErrorKind.DUPLICATED_KEY,
							"The key '" + pair.key() + "' has been already defined", pair.position(), pair.line());
				}
				members.put(pair.key(), pair.value());
				indentation = pair.indentation();
			}

			// The enclosing list owns the delimiter
			if (cursor.lookingAt("]") || cursor.lookingAt(",")) {
				cursor.indentation().pop();
				break;
			}
		}
		if (members.isEmpty()) {
			return Fragment.Marker.BREAK_PARENT;
		}
		return new Fragment.IndentedObject(new GuraObject(members), indentation);
	}

	/**
	 * Reads an indented {@code key: value} pair and updates the indentation
	 * stack. A pair indented less than the current block is left unread and
	 * {@link Fragment.Marker#BREAK_PARENT} is returned instead.
	 */
	static Fragment pair(GuraCursor cursor) {
		GuraCursor.Mark beforePair = cursor.mark();
		int level = 0;
		boolean tabbed = false;
		String blank;
		while ((blank = cursor.maybeKeyword(" ", "\t")) != null) {
			if ("\t".equals(blank)) {
				tabbed = true;
			} else {
				level++;
			}
		}

		int keyPosition = cursor.position();
		int keyLine = cursor.line();
		String key = key(cursor);
		if (tabbed) {
			throw indentationError("Tabs are not allowed to define indentation blocks", keyPosition, keyLine);
		}
		ws(cursor);

		if (level % 4 != 0) {
			throw indentationError("Indentation block (" + level + ") must be divisible by 4", keyPosition, keyLine);
		}
		IndentationStack stack = cursor.indentation();
		Integer current = stack.peek();
		if (current == null) {
			if (level != 0) {
				throw indentationError("The first pair of the document must not be indented, found "
						+ level + " spaces", keyPosition, keyLine);
			}
			stack.push(level);
		} else if (level > current) {
			stack.push(level);
		} else if (level < current) {
			stack.pop();
			cursor.rewindPosition(beforePair);
			return Fragment.Marker.BREAK_PARENT;
		}

		Fragment matched = Rules.matches(cursor, GuraGrammar::anyType);
		GuraValue value;
		if (matched instanceof Fragment.IndentedObject nested) {
			if (nested.indentation() == level) {
				throw indentationError("Wrong level for parent with key " + key, keyPosition, keyLine);
			}
			if (Math.abs(nested.indentation() - level) != 4) {
				throw indentationError("Difference between different indentation levels must be 4",
						keyPosition, keyLine);
			}
			value = nested.object();
		} else if (matched instanceof Fragment.Value scalar) {
			value = scalar.value();
		} else {
			throw cursor.syntaxError("Invalid pair");
		}

		// Indentation inside a list must not leak into the enclosing block
		if (value instanceof GuraArray) {
			stack.restore(level);
		}
		cursor.maybeNewLine();
		return new Fragment.Pair(key, value, level, keyPosition, keyLine);
	}

	private static GuraParseException indentationError(String message, int position, int line) {
		return new GuraParseException(ErrorKind.INVALID_INDENTATION, message, position, line);
	}

	static String key(GuraCursor cursor) {
		String name = unquotedString(cursor);
		cursor.keyword(":");
		return name;
	}

	static String unquotedString(GuraCursor cursor) {
		String first = cursor.maybeChar(KEY_CHARS);
		if (first == null) {
			String found = cursor.atEnd() ? "end of string" : "'" + cursor.peek() + "'";
			throw cursor.syntaxError("Expected string but got " + found);
		}
		return first + variableName(cursor);
	}

	private static String variableName(GuraCursor cursor) {
		StringBuilder sb = new StringBuilder();
		String next;
		while ((next = cursor.maybeChar(KEY_CHARS)) != null) {
			sb.append(next);
		}
		return sb.toString();
	}

	// Statements

	/**
	 * Matches {@code $name: value} and stores the variable.
	 */
	static Fragment variable(GuraCursor cursor) {
		cursor.keyword("$");
		int position = cursor.position();
		int line = cursor.line();
		String name = key(cursor);
		ws(cursor);
		GuraValue value = Rules.matches(cursor,
				GuraGrammar::basicString,
				GuraGrammar::literalString,
				GuraGrammar::number,
				GuraGrammar::variableValue);
		if (!VariableTable.canHold(value)) {
			throw cursor.syntaxError("Invalid variable value for '" + name
					+ "': expected a string, a 64-bit integer or a float");
		}
		cursor.variables().define(name, value, position, line);
		return Fragment.Marker.VARIABLE_DEFINED;
	}

	/**
	 * Matches {@code import "path"}. The path may contain variables but no escapes.
	 */
	static Fragment importDirective(GuraCursor cursor) {
		int position = cursor.position();
		int line = cursor.line();
		cursor.keyword("import");
		cursor.consumeChar(" ");
		String path = quotedStringWithVariables(cursor);
		ws(cursor);
		cursor.maybeNewLine();
		return new Fragment.Import(path, position, line);
	}

	private static String quotedStringWithVariables(GuraCursor cursor) {
		cursor.keyword("\"");
		StringBuilder sb = new StringBuilder();
		while (true) {
			int position = cursor.position();
			int line = cursor.line();
			String current = cursor.consumeChar(null);
			if ("\"".equals(current)) {
				return sb.toString();
			}
			if ("$".equals(current)) {
				sb.append(cursor.variables().resolveAsText(variableName(cursor), position, line));
			} else {
				sb.append(current);
			}
		}
	}

	/**
	 * Matches a line holding nothing but blanks and an optional comment. At the
	 * very end of the document the line terminator may be missing.
	 */
	static Fragment uselessLine(GuraCursor cursor) {
		int start = cursor.position();
		ws(cursor);
		boolean comment = Rules.maybeMatch(cursor, GuraGrammar::comment) != null;
		boolean newLine = !comment && cursor.maybeNewLine();
		if (!comment && !newLine && !(cursor.atEnd() && cursor.position() > start)) {
			throw cursor.syntaxError("Expected a blank line or a comment");
		}
		return Fragment.Marker.USELESS_LINE;
	}

	/**
	 * Matches {@code #} up to and including the end of the line.
	 */
	static Fragment comment(GuraCursor cursor) {
		cursor.keyword("#");
		while (!cursor.atEnd()) {
			if ("\r".equals(cursor.peek())) {
				cursor.consumeLineEnd();
				break;
			}
			if (GuraCursor.isNewLine(cursor.consumeChar(null))) {
				break;
			}
		}
		return Fragment.Marker.USELESS_LINE;
	}

	static void ws(GuraCursor cursor) {
		while (cursor.maybeKeyword(" ", "\t") != null) {
			// skip
		}
	}

	static void eatWsAndNewLines(GuraCursor cursor) {
		while (cursor.maybeKeyword(" ") != null || cursor.maybeNewLine()) {
			// skip
		}
	}
}
