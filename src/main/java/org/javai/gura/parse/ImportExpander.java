package org.javai.gura.parse;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.gura.ErrorKind;
import org.javai.gura.GuraParseException;
import org.javai.gura.io.ImportSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces the {@code import} directives at the head of a document with the
 * contents of the imported files.
 *
 * <p>Directives may only be preceded by variable definitions, blank lines and
 * comments. Imported files are expanded recursively before being spliced in, and
 * every file may be imported at most once per parse.</p>
 */
public final class ImportExpander {

	private static final Logger logger = LoggerFactory.getLogger(ImportExpander.class);

	private final ImportSource source;
	private final Path baseDirectory;

	/**
	 * @param baseDirectory directory relative imports of the top-level text resolve
	 * against, or {@code null} for the working directory
	 */
	public ImportExpander(ImportSource source, Path baseDirectory) {
		this.source = Objects.requireNonNull(source, "source");
		this.baseDirectory = baseDirectory;
	}

	/**
	 * Expands the imports of the document under {@code cursor}. If there are any,
	 * the cursor is reset to the flattened text.
	 *
	 * @param originDirectory directory of the document's file, or {@code null}
	 */
	public void expand(GuraCursor cursor, Path originDirectory) {
		Scan scan = scan(cursor, originDirectory);
		if (scan.imports().isEmpty()) {
			return;
		}
		String imported = splice(cursor, scan.imports());
		cursor.reset(imported + cursor.rest());
		logger.debug("Expanded {} import(s) into a document of {} characters", scan.imports().size(), cursor.length());
	}

	/**
	 * Consumes the directives, variable definitions and useless lines at the head
	 * of the document.
	 */
	private Scan scan(GuraCursor cursor, Path originDirectory) {
		List<PendingImport> imports = new ArrayList<>();
		StringBuilder definitions = new StringBuilder();
		while (!cursor.atEnd()) {
			int start = cursor.position();
			Fragment fragment = Rules.maybeMatch(cursor,
					GuraGrammar::importDirective, GuraGrammar::variable, GuraGrammar::uselessLine);
			if (fragment == null) {
				break;
			}
			if (fragment instanceof Fragment.Import directive) {
				logger.trace("Found import of '{}' at line {}", directive.path(), directive.line());
				imports.add(new PendingImport(directive.path(), originDirectory, directive.position(), directive.line()));
			} else if (fragment == Fragment.Marker.VARIABLE_DEFINED) {
				definitions.append(cursor.slice(start, cursor.position())).append('\n');
			}
		}
		return new Scan(imports, definitions.toString());
	}

	private String splice(GuraCursor cursor, List<PendingImport> imports) {
		StringBuilder sb = new StringBuilder();
		for (PendingImport pending : imports) {
			Path file = resolve(pending);
			if (!cursor.importedFiles().add(file)) {
				throw failure(ErrorKind.DUPLICATED_IMPORT, "The file " + file + " has been already imported", pending, null);
			}
			if (!source.exists(file)) {
				throw failure(ErrorKind.FILE_NOT_FOUND, "The file " + file + " does not exist", pending, null);
			}
			String content;
			try {
				content = source.read(file);
			} catch (IOException e) {
				throw failure(ErrorKind.FILE_NOT_FOUND, "The file " + file + " could not be read", pending, e);
			}
			logger.debug("Importing {}", file);
			sb.append(expandFile(file, content, cursor)).append('\n');
		}
		return sb.toString();
	}

	/**
	 * Flattens an imported file. Its head variable definitions are kept in the
	 * text ahead of the files it imports, so that those files can use them.
	 */
	private String expandFile(Path file, String content, GuraCursor parent) {
		GuraCursor nested = new GuraCursor(content, parent.variables().fresh(), parent.importedFiles());
		Scan scan = scan(nested, file.getParent());
		if (scan.imports().isEmpty()) {
			return content;
		}
		return scan.definitions() + splice(nested, scan.imports()) + nested.rest();
	}

	private Path resolve(PendingImport pending) {
		try {
			return pending.resolve(baseDirectory);
		} catch (InvalidPathException e) {
			throw failure(ErrorKind.FILE_NOT_FOUND, "The file " + pending.path() + " is not a valid path", pending, e);
		}
	}

	private static GuraParseException failure(ErrorKind kind, String message, PendingImport pending, Throwable cause) {
		return new GuraParseException(kind, message, pending.position(), pending.line(), cause);
	}

	private record Scan(List<PendingImport> imports, String definitions) {
	}
}
