package org.javai.gura.io;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemImportSourceTest {

	@TempDir
	Path dir;

	private final ImportSource source = new FileSystemImportSource();

	@Test
	void onlyRegularFilesExist() throws IOException {
		Path file = Files.writeString(dir.resolve("a.ura"), "a: 1");

		assertThat(source.exists(file)).isTrue();
		assertThat(source.exists(dir)).isFalse();
		assertThat(source.exists(dir.resolve("missing.ura"))).isFalse();
	}

	@Test
	void readsUtf8ByDefault() throws IOException {
		Path file = Files.write(dir.resolve("name.ura"), "name: \"Aníbal\"".getBytes(StandardCharsets.UTF_8));

		assertThat(source.read(file)).isEqualTo("name: \"Aníbal\"");
	}

	@Test
	void configuredCharset() throws IOException {
		Path file = Files.write(dir.resolve("latin.ura"), "n: \"ñ\"".getBytes(StandardCharsets.ISO_8859_1));

		assertThat(new FileSystemImportSource(StandardCharsets.ISO_8859_1).read(file)).isEqualTo("n: \"ñ\"");
	}

	@Test
	void missingFileFails() {
		assertThatThrownBy(() -> source.read(dir.resolve("missing.ura")))
				.isInstanceOf(NoSuchFileException.class);
	}
}
