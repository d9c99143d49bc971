package cal.dupes.impls;

import cal.dupes.types.SizeBucket;
import cal.prim.fs.FileRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

@Test
public class SizeBucketerTests {

  private static FileRecord file(String name, long size) {
    return new FileRecord(Paths.get("/data", name), size);
  }

  private static List<Path> paths(SizeBucket b) {
    return b.files().stream().map(FileRecord::path).collect(Collectors.toList());
  }

  @Test
  public void testSingletonsArePruned() {
    List<SizeBucket> buckets = new SizeBucketer(false).bucket(List.of(
            file("a", 10),
            file("c", 20),
            file("b", 10),
            file("d", 30)));
    Assert.assertEquals(buckets.size(), 1);
    Assert.assertEquals(buckets.get(0).size(), 10L);
    Assert.assertEquals(paths(buckets.get(0)), List.of(Paths.get("/data/a"), Paths.get("/data/b")));
  }

  @Test
  public void testEveryFileSharingASizeSurvives() {
    List<FileRecord> files = List.of(file("x", 7), file("y", 7), file("z", 7));
    List<SizeBucket> buckets = new SizeBucketer(false).bucket(files);
    Assert.assertEquals(buckets.size(), 1);
    Assert.assertEquals(buckets.get(0).files(), files);
  }

  @Test
  public void testDiscoveryOrderIsKept() {
    List<SizeBucket> buckets = new SizeBucketer(false).bucket(List.of(
            file("zz", 5),
            file("big1", 99),
            file("aa", 5),
            file("big2", 99),
            file("mm", 5)));
    Assert.assertEquals(buckets.size(), 2);
    // buckets in order of first appearance
    Assert.assertEquals(buckets.get(0).size(), 5L);
    Assert.assertEquals(buckets.get(1).size(), 99L);
    Assert.assertEquals(paths(buckets.get(0)), List.of(Paths.get("/data/zz"), Paths.get("/data/aa"), Paths.get("/data/mm")));
  }

  @Test
  public void testSortByPath() {
    List<SizeBucket> buckets = new SizeBucketer(true).bucket(List.of(
            file("zz", 5),
            file("aa", 5),
            file("mm", 5)));
    Assert.assertEquals(paths(buckets.get(0)), List.of(Paths.get("/data/aa"), Paths.get("/data/mm"), Paths.get("/data/zz")));
  }

  @Test
  public void testNoFiles() {
    Assert.assertTrue(new SizeBucketer(false).bucket(List.of()).isEmpty());
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testBucketRejectsMismatchedSizes() {
    new SizeBucket(10, List.of(file("a", 10), file("b", 11)));
  }

}
