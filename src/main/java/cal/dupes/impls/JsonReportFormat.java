package cal.dupes.impls;

import cal.dupes.types.DuplicateReport;
import cal.dupes.types.HashGroup;
import cal.prim.fs.FileRecord;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * The machine-readable report.  Field names and types are part of the output contract:
 * <pre>
 * {
 *   "total_groups": 1,
 *   "total_duplicates": 1,
 *   "wasted_space": 10,
 *   "groups": [ { "hash": "...", "size": 10, "files": ["/a.txt", "/b.txt"] } ]
 * }
 * </pre>
 * Byte counts are exact.
 */
public class JsonReportFormat {

  @JsonPropertyOrder({"hash", "size", "files"})
  private static class JsonGroup {
    @JsonProperty("hash") public String hash;
    @JsonProperty("size") public long size;
    @JsonProperty("files") public List<String> files = new ArrayList<>();
  }

  @JsonPropertyOrder({"total_groups", "total_duplicates", "wasted_space", "groups"})
  private static class Format {
    @JsonProperty("total_groups") public long totalGroups;
    @JsonProperty("total_duplicates") public long totalDuplicates;
    @JsonProperty("wasted_space") public long wastedSpace;
    @JsonProperty("groups") public List<JsonGroup> groups = new ArrayList<>();
  }

  private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private static Format simplify(DuplicateReport report) {
    Format result = new Format();
    result.totalGroups = report.totalGroups();
    result.totalDuplicates = report.totalDuplicates();
    result.wastedSpace = report.wastedSpace();
    for (HashGroup g : report.groups()) {
      JsonGroup group = new JsonGroup();
      group.hash = g.digest();
      group.size = g.size();
      for (FileRecord f : g.files()) {
        group.files.add(f.path().toString());
      }
      result.groups.add(group);
    }
    return result;
  }

  public void write(DuplicateReport report, OutputStream out) throws IOException {
    mapper.writeValue(out, simplify(report));
  }

  /**
   * Write the report to a file.  The report goes to a temporary file next to the
   * destination first and is then moved into place, so readers never see half a report.
   *
   * @throws IOException if the report cannot be written; the destination is left as it was
   */
  public void export(DuplicateReport report, Path destination) throws IOException {
    Path target = destination.toAbsolutePath();
    Path dir = target.getParent();
    Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(tmp)) {
        write(report, out);
      }
      try {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }

}
