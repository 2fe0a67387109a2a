package com.github.csp;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import com.github.csp.TraceConfiguration.TraceConfigurationBuilder;

public class TraceConfigurationTest {

  @Test
  public void testDefaults() {
    final TraceConfiguration config = TraceConfiguration.defaults();
    assertEquals(0, config.getMaxDepth());
    assertFalse(config.isBounded());
    assertTrue(config.getHideTau());
    assertEquals("TraceConfiguration [maxDepth=0, hideTau=true]", config.toString());
  }

  @Test
  public void testBuilder() {
    final TraceConfiguration config =
        TraceConfigurationBuilder.newBuilder().maxDepth(12).hideTau(false).build();
    assertEquals(12, config.getMaxDepth());
    assertTrue(config.isBounded());
    assertFalse(config.getHideTau());
    assertEquals(config, CspAlgebra.standard().traceEngine(config).getConfiguration());
  }

  @Test
  public void testNegativeMaxDepth() {
    try {
      TraceConfigurationBuilder.newBuilder().maxDepth(-1).build();
      fail("Built a configuration with a negative maxDepth");
    } catch (ProcessException expected) {
      assertEquals(ProcessException.Code.INVALID_CONFIGURATION, expected.getCode());
      assertEquals("maxDepth cannot be negative: -1.", expected.getMessage());
    }
  }

  @Test(expected = ProcessException.class)
  public void testEngineNeedsConfiguration() {
    CspAlgebra.standard().traceEngine(null);
  }
}
