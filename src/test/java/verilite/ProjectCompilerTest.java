package verilite;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectCompilerTest {
	private final ProjectCompiler project = new ProjectCompiler(new Compiler(CompilerOptions.defaults()));

	@Test
	void compilesEveryFileOfATreeSeparately(@TempDir Path dir) throws Exception {
		Path srcRoot = dir.resolve("src");
		Path outRoot = dir.resolve("out");

		Path counter = srcRoot.resolve(Path.of("core", "counter.vlt"));
		Path top = srcRoot.resolve("top.vlt");
		Path notes = srcRoot.resolve("notes.txt");
		Files.createDirectories(counter.getParent());
		Files.writeString(counter, "module counter {\n    reg#4 count = 0\n}\n");
		Files.writeString(top, "module top {\n    reg#4 count = 0\n}\n");
		Files.writeString(notes, "not a source");

		int compiled = project.compileTree(srcRoot, outRoot);

		assertEquals(2, compiled);
		Path counterOut = outRoot.resolve(Path.of("core", "counter.v"));
		assertTrue(Files.exists(counterOut), "expected core/counter.v to be generated");
		assertTrue(Files.exists(outRoot.resolve("top.v")), "expected top.v to be generated");
		assertFalse(Files.exists(outRoot.resolve("notes.v")));
		assertEquals("module counter;\n    reg [3:0] count = 0;\nendmodule\n", Files.readString(counterOut));
	}

	@Test
	void failingFileStopsTheTree(@TempDir Path dir) throws Exception {
		Path srcRoot = dir.resolve("src");
		Files.createDirectories(srcRoot);
		Files.writeString(srcRoot.resolve("bad.vlt"), "module bad {\n    ghost <- 1\n}\n");

		CompileException e = assertThrows(CompileException.class,
				() -> project.compileTree(srcRoot, dir.resolve("out")));
		assertEquals(ErrorKind.UNDEFINED_NAME, e.kind());
		assertFalse(Files.exists(dir.resolve(Path.of("out", "bad.v"))));
	}

	@Test
	void targetNameSwapsExtension() {
		assertEquals("blinky.v", ProjectCompiler.targetName(Path.of("rtl", "blinky.vlt")));
		assertEquals("README.v", ProjectCompiler.targetName(Path.of("README")));
	}
}
