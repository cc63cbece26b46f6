/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.adaptive.telemetryfilter.tracker;

import java.util.Arrays;
import java.util.Map;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;


/**
 * Unit test class for {@link IncludeListMatcher}.
 */
public class IncludeListMatcherTest {

  @Test
  public void testBasenameEntriesNeverMatch() {
    IncludeListMatcher matcher = new IncludeListMatcher(Arrays.asList("nginx", " java "));
    assertTrue(matcher.isEmpty());
    assertFalse(matcher.matches(Map.of("process.executable.path", "/tmp/nginx")));
    assertFalse(matcher.matches(Map.of("process.executable.path", "nginx")));
  }

  @Test
  public void testFullPathMatchesExactly() {
    IncludeListMatcher matcher = new IncludeListMatcher(Arrays.asList("/usr/sbin/nginx", "nginx"));
    assertFalse(matcher.isEmpty());
    assertTrue(matcher.matches(Map.of("process.executable.path", "/usr/sbin/nginx")));
    assertFalse(matcher.matches(Map.of("process.executable.path", "/tmp/nginx")));
    assertFalse(matcher.matches(Map.of("process.executable.path", "/usr/sbin/nginx2")));
    assertFalse(matcher.matches(Map.of("process.pid", "1")));
  }

  @Test
  public void testCommandUsedWhenItIsAPath() {
    IncludeListMatcher matcher = new IncludeListMatcher(Arrays.asList("/usr/sbin/nginx", "C:\\Tools\\app.exe"));
    assertTrue(matcher.matches(Map.of("process.command", "/usr/sbin/nginx")));
    assertTrue(matcher.matches(Map.of("process.command", "C:\\Tools\\app.exe")));
    assertFalse(matcher.matches(Map.of("process.command", "nginx")));
    assertNull(IncludeListMatcher.executableOf(Map.of("process.command", "nginx")));
    assertEquals("/bin/a", IncludeListMatcher.executableOf(Map.of("process.executable.path", "/bin/a",
                                                                   "process.command", "/bin/b")));
  }

  @Test
  public void testCommandWithArgumentsMatchesOnExecutable() {
    IncludeListMatcher matcher = new IncludeListMatcher(Arrays.asList("/usr/sbin/nginx", "C:\\Tools\\app.exe"));
    assertTrue(matcher.matches(Map.of("process.command", "/usr/sbin/nginx -g daemon off;")));
    assertTrue(matcher.matches(Map.of("process.command", "  /usr/sbin/nginx\t-c /etc/nginx.conf")));
    assertTrue(matcher.matches(Map.of("process.command", "C:\\Tools\\app.exe --service")));
    assertFalse(matcher.matches(Map.of("process.command", "nginx -g /usr/sbin/nginx")));
    assertEquals("/usr/sbin/nginx", IncludeListMatcher.executableOf(Map.of("process.command", "/usr/sbin/nginx -g daemon off;")));
    assertNull(IncludeListMatcher.executableOf(Map.of("process.command", "")));
  }
}
