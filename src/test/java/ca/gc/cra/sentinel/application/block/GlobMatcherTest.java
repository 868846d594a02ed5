package ca.gc.cra.sentinel.application.block;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class GlobMatcherTest {
  @Test
  void starAndQuestionMarkAreAnchored() {
    GlobMatcher glob = GlobMatcher.compile("/api/v?/admin/*");
    assertTrue(glob.matches("/api/v1/admin/users"));
    assertTrue(glob.matches("/API/V2/admin/"));
    assertFalse(glob.matches("/api/v10/admin/users"));
    assertFalse(glob.matches("/prefix/api/v1/admin/x"));
  }

  @Test
  void regexMetacharactersAreLiteral() {
    GlobMatcher glob = GlobMatcher.compile("/files/(a+b).txt");
    assertTrue(glob.matches("/files/(a+b).txt"));
    assertFalse(glob.matches("/files/aab.txt"));
    assertFalse(GlobMatcher.isGlob("/plain/path"));
  }
}
