package org.javai.gura;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.javai.gura.parse.GuraCursor;
import org.javai.gura.parse.GuraGrammar;
import org.javai.gura.parse.ImportExpander;
import org.javai.gura.parse.VariableTable;
import org.javai.gura.value.GuraObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses Gura documents.
 *
 * <p>A parser is immutable and may be shared between threads; every call
 * works on its own cursor.</p>
 *
 * <pre>{@code
 * GuraParser parser = new GuraParser();
 * GuraObject config = parser.parse("title: \"Gura\"\nport: 8080");
 * }</pre>
 */
public class GuraParser {

	private static final Logger logger = LoggerFactory.getLogger(GuraParser.class);

	private final GuraParserConfig config;

	public GuraParser() {
		this(GuraParserConfig.defaults());
	}

	public GuraParser(GuraParserConfig config) {
		this.config = Objects.requireNonNull(config, "config");
	}

	public GuraParserConfig config() {
		return config;
	}

	/**
	 * Parses a document. Relative imports resolve against the configured base directory.
	 *
	 * @param text the document
	 * @return the top-level object, empty if the document has no pairs
	 * @throws GuraParseException if the document is invalid or an import fails
	 */
	public GuraObject parse(String text) {
		Objects.requireNonNull(text, "text");
		return parse(text, null, new HashSet<>());
	}

	/**
	 * Reads and parses a file. Relative imports resolve against the file's directory.
	 *
	 * @throws GuraParseException if the file cannot be read, the document is
	 * invalid or an import fails
	 */
	public GuraObject parse(Path file) {
		Path absolute = file.toAbsolutePath().normalize();
		String text;
		try {
			text = config.importSource().read(absolute);
		} catch (IOException e) {
			throw new GuraParseException(ErrorKind.FILE_NOT_FOUND, "The file " + absolute + " could not be read",
					GuraParseException.NO_POSITION, 0, e);
		}
		logger.debug("Parsing {}", absolute);
		Set<Path> importedFiles = new HashSet<>();
		importedFiles.add(absolute);
		return parse(text, absolute.getParent(), importedFiles);
	}

	private GuraObject parse(String text, Path originDirectory, Set<Path> importedFiles) {
		VariableTable variables = new VariableTable(config.environment());
		GuraCursor cursor = new GuraCursor(text, variables, importedFiles);
		ImportExpander imports = new ImportExpander(config.importSource(), config.baseDirectory());
		return GuraGrammar.start(cursor, imports, originDirectory);
	}
}
