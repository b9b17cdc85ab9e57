package org.javai.gura;

import java.nio.file.Path;
import org.javai.gura.dump.GuraDumper;
import org.javai.gura.value.GuraObject;
import org.javai.gura.value.GuraValue;

/**
 * Entry points for parsing and writing Gura text with the default configuration.
 */
public final class Gura {

	private static final GuraParser DEFAULT_PARSER = new GuraParser();

	private Gura() {
		// Utility class - no instantiation
	}

	/**
	 * Parses a document.
	 *
	 * @throws GuraParseException if the document is invalid
	 */
	public static GuraObject parse(String text) {
		return DEFAULT_PARSER.parse(text);
	}

	public static GuraObject parse(Path file) {
		return DEFAULT_PARSER.parse(file);
	}

	/**
	 * Writes a value as Gura text that parses back to an equal value.
	 */
	public static String dump(GuraValue value) {
		return GuraDumper.dump(value);
	}
}
