package org.javai.gura.io;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads imported files from the default file system.
 */
public final class FileSystemImportSource implements ImportSource {

	private final Charset charset;

	public FileSystemImportSource() {
		this(StandardCharsets.UTF_8);
	}

	public FileSystemImportSource(Charset charset) {
		this.charset = Objects.requireNonNull(charset, "charset");
	}

	@Override
	public boolean exists(Path path) {
		return Files.isRegularFile(path);
	}

	@Override
	public String read(Path path) throws IOException {
		return Files.readString(path, charset);
	}
}
