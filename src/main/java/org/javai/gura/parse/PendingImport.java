package org.javai.gura.parse;

import java.nio.file.Path;

/**
 * An import directive found by the pre-pass, waiting to be spliced in.
 *
 * @param path the path as written, after variable substitution
 * @param originDirectory directory of the file holding the directive, or {@code null} for the top-level text
 * @param position where the directive starts
 * @param line line of the directive
 */
record PendingImport(String path, Path originDirectory, int position, int line) {

	/**
	 * Absolute, normalized location of the imported file.
	 */
	Path resolve(Path fallbackDirectory) {
		Path target = Path.of(path);
		Path base = originDirectory != null ? originDirectory : fallbackDirectory;
		if (!target.isAbsolute() && base != null) {
			target = base.resolve(target);
		}
		return target.toAbsolutePath().normalize();
	}
}
