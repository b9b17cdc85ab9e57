package org.javai.gura.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Access to the files a document imports.
 *
 * <p>Paths handed to an import source are absolute and normalized.</p>
 */
public interface ImportSource {

	boolean exists(Path path);

	/**
	 * Reads the whole file as text.
	 *
	 * @throws IOException if the file cannot be read
	 */
	String read(Path path) throws IOException;
}
