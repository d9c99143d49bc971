package cal.dupes;

import cal.dupes.types.Config;
import cal.dupes.types.DigestAlgorithm;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

@Test
public class MainTests {

  private Path root;
  private Path work;
  private Path config;

  private String stdout;
  private String stderr;

  @BeforeMethod
  public void setUp() throws IOException {
    root = FileTrees.newTree();
    work = FileTrees.newTree();
    config = FileTrees.write(work, "config.json", "{}");
  }

  @AfterMethod
  public void tearDown() throws IOException {
    FileTrees.deleteTree(root);
    FileTrees.deleteTree(work);
  }

  /** Run with the test config, in quiet mode, against the test tree. */
  private int run(String... args) {
    List<String> all = new ArrayList<>();
    all.add("-q");
    all.add("-c");
    all.add(config.toString());
    all.addAll(Arrays.asList(args));
    all.add(root.toString());
    return runRaw(all.toArray(new String[0]));
  }

  private int runRaw(String... args) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ByteArrayOutputStream err = new ByteArrayOutputStream();
    int status = Main.run(args,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    stdout = out.toString(StandardCharsets.UTF_8);
    stderr = err.toString(StandardCharsets.UTF_8);
    return status;
  }

  private void writeBasicTree() throws IOException {
    FileTrees.write(root, "a.txt", "0123456789");
    FileTrees.write(root, "b.txt", "0123456789");
    FileTrees.write(root, "c.txt", "abcdefghijklmnopqrst");
  }

  @Test
  public void testReport() throws IOException {
    writeBasicTree();
    Assert.assertEquals(run("--sort-paths"), 0, stderr);
    Assert.assertTrue(stdout.contains("3 files indexed"), stdout);
    Assert.assertTrue(stdout.contains("2 candidates with matching sizes"), stdout);
    Assert.assertTrue(stdout.contains("Duplicate groups:  1"), stdout);
    Assert.assertTrue(stdout.contains("Wasted space:      10 B"), stdout);
    Assert.assertTrue(stdout.contains("[keep] " + root.resolve("a.txt")), stdout);
    Assert.assertTrue(stdout.contains("[dupe] " + root.resolve("b.txt")), stdout);
    Assert.assertFalse(stdout.contains("c.txt"), stdout);
  }

  @Test
  public void testNoDuplicates() throws IOException {
    FileTrees.write(root, "a", "one");
    FileTrees.write(root, "b", "two");
    Assert.assertEquals(run(), 0, stderr);
    Assert.assertTrue(stdout.contains("No duplicate files found"), stdout);
  }

  @Test
  public void testJsonOutput() throws IOException {
    writeBasicTree();
    Path report = work.resolve("report.json");
    Assert.assertEquals(run("-o", report.toString()), 0, stderr);
    JsonNode json = new ObjectMapper().readTree(report.toFile());
    Assert.assertEquals(json.get("total_groups").asInt(), 1);
    Assert.assertEquals(json.get("total_duplicates").asInt(), 1);
    Assert.assertEquals(json.get("wasted_space").asLong(), 10L);
    Assert.assertEquals(json.get("groups").get(0).get("size").asLong(), 10L);
    Assert.assertEquals(json.get("groups").get(0).get("files").size(), 2);
  }

  @Test
  public void testJsonOutputFailure() throws IOException {
    writeBasicTree();
    Assert.assertEquals(run("-o", work.resolve("missing/report.json").toString()), 1);
    Assert.assertTrue(stderr.contains("Failed to write report"), stderr);
  }

  @Test
  public void testDelete() throws IOException {
    writeBasicTree();
    Assert.assertEquals(run("--sort-paths", "--delete", "--yes"), 0, stderr);
    Assert.assertTrue(Files.exists(root.resolve("a.txt")));
    Assert.assertFalse(Files.exists(root.resolve("b.txt")));
    Assert.assertTrue(Files.exists(root.resolve("c.txt")));
    Assert.assertTrue(stdout.contains("x " + root.resolve("b.txt")), stdout);
    Assert.assertTrue(stdout.contains("Deleted 1 files, freed 10 B"), stdout);
  }

  @Test
  public void testDryRun() throws IOException {
    writeBasicTree();
    Assert.assertEquals(run("--sort-paths", "--delete", "--dry-run"), 0, stderr);
    Assert.assertTrue(Files.exists(root.resolve("a.txt")));
    Assert.assertTrue(Files.exists(root.resolve("b.txt")));
    Assert.assertTrue(stdout.contains("would delete " + root.resolve("b.txt")), stdout);
    Assert.assertTrue(stdout.contains("Would delete 1 files, freeing 10 B"), stdout);
  }

  @Test
  public void testDeleteWithoutConfirmation() throws IOException {
    // no console under the test runner, so the prompt is declined
    writeBasicTree();
    Assert.assertEquals(run("--delete"), 0, stderr);
    Assert.assertTrue(Files.exists(root.resolve("a.txt")));
    Assert.assertTrue(Files.exists(root.resolve("b.txt")));
    Assert.assertTrue(stdout.contains("Nothing deleted."), stdout);
  }

  @Test
  public void testMinSizeOption() throws IOException {
    writeBasicTree();
    Assert.assertEquals(run("-m", "11B"), 0, stderr);
    Assert.assertTrue(stdout.contains("No duplicate files found"), stdout);
  }

  @Test
  public void testExtensionsOption() throws IOException {
    FileTrees.write(root, "a.jpg", "picture");
    FileTrees.write(root, "b.JPG", "picture");
    FileTrees.write(root, "c.txt", "picture");
    Assert.assertEquals(run("-e", ".jpg"), 0, stderr);
    Assert.assertTrue(stdout.contains("Total duplicates:  1"), stdout);
    Assert.assertFalse(stdout.contains("c.txt"), stdout);
  }

  @Test
  public void testConfigFile() throws IOException {
    writeBasicTree();
    FileTrees.write(root, "a.bak", "0123456789");
    Files.writeString(config, "{\n  // leave backups alone\n  \"exclude\": [\"*.bak\"],\n  \"minSize\": \"2B\"\n}\n");
    Assert.assertEquals(run("--sort-paths"), 0, stderr);
    Assert.assertTrue(stdout.contains("3 files indexed"), stdout);
    Assert.assertFalse(stdout.contains("a.bak"), stdout);
  }

  @Test
  public void testCommandLineBeatsConfig() throws IOException {
    writeBasicTree();
    Files.writeString(config, "{ \"minSize\": \"1KB\" }");
    Assert.assertEquals(run(), 0, stderr);
    Assert.assertTrue(stdout.contains("No duplicate files found"), stdout);
    Assert.assertEquals(run("-m", "1"), 0, stderr);
    Assert.assertTrue(stdout.contains("Duplicate groups:  1"), stdout);
  }

  @Test
  public void testMissingRoot() {
    Assert.assertEquals(runRaw("-q", "-c", config.toString(), root.resolve("nope").toString()), 1);
    Assert.assertTrue(stderr.contains("No such directory"), stderr);
  }

  @Test
  public void testRootIsAFile() throws IOException {
    Path f = FileTrees.write(root, "plain", "x");
    Assert.assertEquals(runRaw("-q", "-c", config.toString(), f.toString()), 1);
    Assert.assertTrue(stderr.contains("Not a directory"), stderr);
  }

  @Test
  public void testBadOptions() {
    Assert.assertEquals(runRaw("--no-such-flag"), 1);
    Assert.assertEquals(run("-m", "lots"), 1);
    Assert.assertEquals(run("-a", "crc32"), 1);
    Assert.assertEquals(run("-j", "0"), 1);
  }

  @Test
  public void testBadConfig() throws IOException {
    Files.writeString(config, "{ \"threads\": 0 }");
    Assert.assertEquals(run(), 1);
    Assert.assertTrue(stderr.contains("Bad config file"), stderr);

    Files.writeString(config, "{ not json");
    Assert.assertEquals(run(), 1);
  }

  @Test
  public void testMissingConfig() {
    Assert.assertEquals(runRaw("-q", "-c", work.resolve("absent.json").toString(), root.toString()), 1);
    Assert.assertTrue(stderr.contains("not found"), stderr);
  }

  @Test
  public void testHelp() {
    Assert.assertEquals(runRaw("-h"), 0);
    Assert.assertTrue(stdout.contains("--min-size"), stdout);
  }

  @Test
  public void testLoadConfig() throws IOException {
    Files.writeString(config, String.join("\n",
            "{",
            "  /* block comment */",
            "  \"algorithm\": \"SHA512\",",
            "  \"minSize\": \"4KB\",",
            "  \"includeHidden\": true,",
            "  \"threads\": 3,",
            "  \"exclude\": [\"*.tmp\"]",
            "}"));
    Config c = Main.loadConfig(config);
    Assert.assertEquals(c.getAlgorithm(), DigestAlgorithm.SHA512);
    Assert.assertEquals(c.getMinSize(), Long.valueOf(4096));
    Assert.assertEquals(c.getIncludeHidden(), Boolean.TRUE);
    Assert.assertEquals(c.getThreads(), Integer.valueOf(3));
    Assert.assertEquals(c.getExclusions().size(), 1);
    Assert.assertTrue(c.getExclusions().get(0).matches(Paths.get("x.tmp")));
  }

  @Test
  public void testLoadEmptyConfig() throws IOException {
    Config c = Main.loadConfig(config);
    Assert.assertNull(c.getAlgorithm());
    Assert.assertNull(c.getMinSize());
    Assert.assertTrue(c.getExclusions().isEmpty());
  }

}
