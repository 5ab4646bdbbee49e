package net.scoreworks.scoregraph;

import net.scoreworks.scoregraph.document.GraphDocument;
import net.scoreworks.scoregraph.document.JsonLdParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class MainTest {

    @TempDir
    Path tempDir;

    private Path copyFixture(Path directory, String name) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(name);
        try (InputStream in = MainTest.class.getClassLoader().getResourceAsStream("fixtures/" + Fixtures.SONATA)) {
            Assertions.assertNotNull(in);
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    public void testUsageErrors() {
        Assertions.assertEquals(Main.EXIT_USAGE, Main.run(new String[0]));
        Assertions.assertEquals(Main.EXIT_USAGE, Main.run(new String[] {tempDir.resolve("absent.xml").toString()}));
        Assertions.assertEquals(Main.EXIT_USAGE, Main.run(new String[] {tempDir.toString(), "--bogus", "x"}));
        Assertions.assertEquals(Main.EXIT_USAGE, Main.run(new String[] {tempDir.toString(), "--out"}));
        Assertions.assertEquals(Main.EXIT_USAGE, Main.run(new String[] {tempDir.toString(), tempDir.toString()}));
        Assertions.assertEquals(Main.EXIT_USAGE,
                Main.run(new String[] {tempDir.toString(), "--config", tempDir.resolve("absent.properties").toString()}));
    }

    @Test
    public void testSingleScoreNextToSource() throws IOException {
        Path score = copyFixture(tempDir, "sonata.xml");
        Assertions.assertEquals(Main.EXIT_OK, Main.run(new String[] {score.toString(), "--ttl", tempDir.toString()}));
        Path document = tempDir.resolve("sonata.jsonld");
        Assertions.assertTrue(Files.exists(document));
        Assertions.assertTrue(Files.readString(tempDir.resolve("sonata.ttl"), StandardCharsets.UTF_8).contains("so:sonata a "));

        //a second run merges into the same document
        int size = JsonLdParser.read(document).getStore().size();
        Assertions.assertEquals(Main.EXIT_OK, Main.run(new String[] {score.toString()}));
        Assertions.assertEquals(size, JsonLdParser.read(document).getStore().size());
    }

    @Test
    public void testBatchReportsFailures() throws IOException {
        Path scores = tempDir.resolve("scores");
        copyFixture(scores, "a.musicxml");
        Files.writeString(scores.resolve("broken.xml"), "<score-partwise>", StandardCharsets.UTF_8);
        Files.writeString(scores.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);
        Path out = tempDir.resolve("out");

        Assertions.assertEquals(Main.EXIT_FAILURE, Main.run(new String[] {scores.toString(), "--out", out.toString()}));
        GraphDocument document = JsonLdParser.read(out.resolve("a.jsonld"));
        Assertions.assertTrue(document.getStore().size() > 0);
        Assertions.assertFalse(Files.exists(out.resolve("broken.jsonld")));
    }

    @Test
    public void testEmptyDirectory() throws IOException {
        Files.createDirectories(tempDir.resolve("none"));
        Assertions.assertEquals(Main.EXIT_OK, Main.run(new String[] {tempDir.resolve("none").toString()}));
    }

    @Test
    public void testTarget() {
        Path score = tempDir.resolve("sonata.xml");
        Assertions.assertEquals(tempDir.toAbsolutePath().resolve("sonata.jsonld"),
                Main.target(null, false, score, "sonata.jsonld"));
        Assertions.assertEquals(tempDir.resolve("x.jsonld"), Main.target(tempDir.resolve("x.jsonld"), false, score, "sonata.jsonld"));
        Assertions.assertEquals(tempDir.resolve("sonata.jsonld"), Main.target(tempDir, false, score, "sonata.jsonld"));
        Assertions.assertEquals(tempDir.resolve("out/sonata.jsonld"), Main.target(tempDir.resolve("out"), true, score, "sonata.jsonld"));
    }
}
