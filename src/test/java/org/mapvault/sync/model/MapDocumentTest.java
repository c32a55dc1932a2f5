/* Copyright 2026 The MapVault Project
 * See LICENSE for licensing information */

package org.mapvault.sync.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

public class MapDocumentTest {

  private static MapDocument sample() {
    MapDocument map = MapDocument.create("m", "v", "Plans", 100L);
    map.getNodes().add(Node.of("root", null, "Root", "", 0, 100L));
    map.getNodes().add(Node.of("a", "root", "A", "alpha", 0, 100L));
    map.getNodes().add(Node.of("b", "root", "B", "beta", 1, 100L));
    map.getEdges().add(Edge.of("e", "a", "b", "relates"));
    return map;
  }

  @Test()
  public void testConsistentMap() {
    assertNull(sample().checkIntegrity());
  }

  @Test()
  public void testUnknownParent() {
    MapDocument map = sample();
    map.getNodes().add(Node.of("c", "nowhere", "C", "", 0, 100L));
    assertNotNull(map.checkIntegrity());
  }

  @Test()
  public void testParentCycle() {
    MapDocument map = sample();
    map.findNode("root").setParentId("a");
    assertTrue(map.checkIntegrity().contains("Cycle"));
  }

  @Test()
  public void testDuplicateNode() {
    MapDocument map = sample();
    map.getNodes().add(Node.of("a", null, "Again", "", 0, 100L));
    assertTrue(map.checkIntegrity().contains("Duplicate"));
  }

  @Test()
  public void testDanglingEdge() {
    MapDocument map = sample();
    map.getEdges().add(Edge.of("f", "a", "missing", null));
    assertNotNull(map.checkIntegrity());
  }

  @Test()
  public void testDirtyUntilSynced() {
    MapDocument map = sample();
    assertTrue(map.isDirty());
    map.setLastSyncedAt(map.getLocalModifiedAt());
    assertFalse(map.isDirty());
  }

  @Test()
  public void testFromPayloadIsClean() {
    MapDocument map = sample();
    MapDocument pulled = MapDocument.fromPayload(map.toPayload(), 250L,
        "rev");
    assertFalse(pulled.isDirty());
    assertEquals(250L, pulled.getLocalModifiedAt());
    assertEquals("rev", pulled.getRemoteRevision());
    assertEquals(3, pulled.getNodes().size());
    assertTrue(pulled.toPayload().sameContent(map.toPayload()));
  }

  @Test()
  public void testCopyIsDeep() {
    MapDocument map = sample();
    MapDocument copy = map.copy();
    copy.findNode("a").setTitle("changed");
    copy.getEdges().clear();
    assertEquals("A", map.findNode("a").getTitle());
    assertEquals(1, map.getEdges().size());
  }

  @Test()
  public void testSameContentIgnoresModificationTime() {
    MapPayload first = sample().toPayload();
    MapDocument later = sample();
    later.setLocalModifiedAt(900L);
    assertTrue(first.sameContent(later.toPayload()));
    later.findNode("b").setContent("gamma");
    assertFalse(first.sameContent(later.toPayload()));
  }

  @Test()
  public void testJsonUsesSnakeCase() throws Exception {
    ObjectMapper mapper = Serialization.mapper();
    String json = mapper.writeValueAsString(sample());
    assertTrue(json, json.contains("\"local_modified_at\":100"));
    assertTrue(json, json.contains("\"parent_id\":\"root\""));
    MapDocument read = mapper.readValue(json, MapDocument.class);
    assertTrue(read.toPayload().sameContent(sample().toPayload()));
    assertEquals(100L, read.getLocalModifiedAt());
  }
}
