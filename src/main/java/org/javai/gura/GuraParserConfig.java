package org.javai.gura;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import org.javai.gura.io.FileSystemImportSource;
import org.javai.gura.io.ImportSource;

/**
 * Configuration of a {@link GuraParser}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Files and environment of the running process
 * GuraParserConfig config = GuraParserConfig.defaults();
 *
 * // Fixed environment, imports resolved against a directory
 * GuraParserConfig config = GuraParserConfig.builder()
 *         .environment(Map.of("HOME", "/home/gura")::get)
 *         .baseDirectory(Path.of("/etc/app"))
 *         .build();
 * }</pre>
 *
 * @param importSource where imported files are read from
 * @param environment lookup for variables not defined in the document; returns {@code null} when absent
 * @param baseDirectory directory relative imports of parsed text resolve against, or {@code null}
 * for the working directory
 */
public record GuraParserConfig(
		ImportSource importSource,
		Function<String, String> environment,
		Path baseDirectory
) {

	public GuraParserConfig {
		Objects.requireNonNull(importSource, "importSource");
		Objects.requireNonNull(environment, "environment");
	}

	/**
	 * Reads imports from the file system and falls back to the process environment.
	 *
	 * @return default configuration
	 */
	public static GuraParserConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public GuraParserConfig withImportSource(ImportSource importSource) {
		return new GuraParserConfig(importSource, environment, baseDirectory);
	}

	public GuraParserConfig withEnvironment(Function<String, String> environment) {
		return new GuraParserConfig(importSource, environment, baseDirectory);
	}

	public GuraParserConfig withBaseDirectory(Path baseDirectory) {
		return new GuraParserConfig(importSource, environment, baseDirectory);
	}

	/**
	 * Builder for {@link GuraParserConfig}.
	 */
	public static class Builder {
		private ImportSource importSource = new FileSystemImportSource();
		private Function<String, String> environment = System::getenv;
		private Path baseDirectory;

		private Builder() {}

		public Builder importSource(ImportSource importSource) {
			this.importSource = importSource;
			return this;
		}

		/**
		 * Sets the lookup used for variables the document does not define.
		 *
		 * @param environment returns the value of a variable, or {@code null} when it is not set
		 * @return this builder
		 */
		public Builder environment(Function<String, String> environment) {
			this.environment = environment;
			return this;
		}

		public Builder baseDirectory(Path baseDirectory) {
			this.baseDirectory = baseDirectory;
			return this;
		}

		public GuraParserConfig build() {
			return new GuraParserConfig(importSource, environment, baseDirectory);
		}
	}
}
