package cal.dupes.types;

import cal.prim.fs.FileRecord;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.nio.file.Paths;
import java.util.List;

@Test
public class HashGroupTests {

  private static HashGroup copies(long size, int n) {
    FileRecord[] files = new FileRecord[n];
    for (int i = 0; i < n; ++i) {
      files[i] = new FileRecord(Paths.get("/data", "f" + i), size);
    }
    return new HashGroup("ab", size, List.of(files));
  }

  @Test
  public void testWastedBytes() {
    Assert.assertEquals(copies(10, 1).wastedBytes(), 0L);
    Assert.assertEquals(copies(10, 4).wastedBytes(), 30L);
    Assert.assertEquals(copies(Long.MAX_VALUE, 2).wastedBytes(), Long.MAX_VALUE);
  }

  @Test(expectedExceptions = ArithmeticException.class)
  public void testWastedBytesOverflow() {
    copies(Long.MAX_VALUE / 2 + 1, 3).wastedBytes();
  }

  @Test(expectedExceptions = ArithmeticException.class)
  public void testReportTotalOverflow() {
    DuplicateReport.of(List.of(copies(Long.MAX_VALUE, 2), copies(1, 2)));
  }

}
