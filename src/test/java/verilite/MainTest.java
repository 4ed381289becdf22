package verilite;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	@Test
	void usageErrorWithoutArguments() {
		assertEquals(2, Main.run(new String[0]));
		assertEquals(2, Main.run(new String[] { "a", "b", "c" }));
	}

	@Test
	void compilesSingleFileNextToSource(@TempDir Path dir) throws Exception {
		Path source = dir.resolve("top.vlt");
		Files.writeString(source, "module top {\n    reg#1 q = '1\n}\n");

		assertEquals(0, Main.run(new String[] { source.toString() }));

		Path target = dir.resolve("top.v");
		assertTrue(Files.exists(target));
		assertEquals("module top;\n    reg [0:0] q = 1'b1;\nendmodule\n", Files.readString(target));
	}

	@Test
	void compileErrorExitsWithOne(@TempDir Path dir) throws Exception {
		Path source = dir.resolve("bad.vlt");
		Files.writeString(source, "module bad {\n    reg q = 0\n}\n");

		assertEquals(1, Main.run(new String[] { source.toString(), dir.resolve("bad.v").toString() }));
	}

	@Test
	void missingInputExitsWithOne(@TempDir Path dir) {
		assertEquals(1, Main.run(new String[] { dir.resolve("missing.vlt").toString() }));
	}
}
