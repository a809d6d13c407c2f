package org.example.crowdledger.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.example.crowdledger.model.ContentId;
import org.example.crowdledger.model.ContentRecord;
import org.example.crowdledger.model.ContentType;
import org.example.crowdledger.model.Digest;
import org.example.crowdledger.model.FailureReason;
import org.example.crowdledger.model.LedgerException;
import org.junit.jupiter.api.*;

/** Tests for {@link ContentLedger}: indexing, tombstones, reply graph and validation. */
public class ContentLedgerTest {

  private ContentLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = new ContentLedger();
  }

  private ContentId post(String owner) {
    return ledger.create(ContentRecord.newContent(owner, Digest.ZERO, Digest.ZERO), ContentType.POST);
  }

  @Test
  @DisplayName("indices grow per type and are never reused after deletion")
  void indices_strictlyIncreasing() {
    ContentId a = post("alice");
    ContentId b = post("bob");
    ContentId img = ledger.create(ContentRecord.newContent("alice", Digest.ZERO, Digest.ZERO), ContentType.IMAGE);

    assertEquals(0, a.index());
    assertEquals(1, b.index());
    assertEquals(0, img.index());

    ledger.delete(b);
    ContentId c = post("carol");
    assertEquals(2, c.index());
    assertEquals(3, ledger.length(ContentType.POST));
    assertTrue(ledger.get(b).isTombstone());
  }

  @Test
  @DisplayName("get returns a copy; changes only land through update")
  void get_returnsCopy() {
    ContentId a = post("alice");
    ContentRecord r = ledger.get(a);
    r.likes = 10;
    assertEquals(0, ledger.get(a).likes);

    ledger.update(a, r);
    assertEquals(10, ledger.get(a).likes);
  }

  @Test
  @DisplayName("out-of-range identifiers fail with NOT_FOUND")
  void notFound() {
    ContentId missing = ContentId.of(ContentType.POST, 0);
    LedgerException ex = assertThrows(LedgerException.class, () -> ledger.get(missing));
    assertEquals(FailureReason.NOT_FOUND, ex.reason());
    assertThrows(LedgerException.class, () -> ledger.update(missing, new ContentRecord()));
    assertThrows(LedgerException.class, () -> ledger.delete(missing));
    assertThrows(LedgerException.class, () -> ledger.repliesOf(missing));
    assertFalse(ledger.exists(missing));
  }

  @Test
  @DisplayName("link is symmetric and survives vote updates on either record")
  void link_symmetricAndDurable() {
    ContentId target = post("alice");
    ContentId reply =
        ledger.create(ContentRecord.newContent("bob", Digest.ZERO, Digest.ZERO), ContentType.COMMENT);

    ledger.link(reply, target);
    assertEquals(List.of(target), ledger.repliesOf(reply));
    assertEquals(List.of(reply), ledger.repliedByOf(target));

    ContentRecord t = ledger.get(target);
    t.likes++;
    ledger.update(target, t);
    ContentRecord r = ledger.get(reply);
    r.dislikes++;
    ledger.update(reply, r);

    assertEquals(List.of(target), ledger.repliesOf(reply));
    assertEquals(List.of(reply), ledger.repliedByOf(target));
  }

  @Test
  @DisplayName("link with a missing side changes nothing")
  void link_missingSide() {
    ContentId target = post("alice");
    ContentId missing = ContentId.of(ContentType.COMMENT, 5);
    assertThrows(LedgerException.class, () -> ledger.link(missing, target));
    assertThrows(LedgerException.class, () -> ledger.link(target, missing));
    assertTrue(ledger.repliedByOf(target).isEmpty());
    assertTrue(ledger.repliesOf(target).isEmpty());
  }

  @Test
  @DisplayName("discardCreated only removes the last slot")
  void discardCreated() {
    ContentId a = post("alice");
    ContentId b = post("bob");
    assertThrows(IllegalStateException.class, () -> ledger.discardCreated(a));
    ledger.discardCreated(b);
    assertEquals(1, ledger.length(ContentType.POST));
  }

  @Test
  @DisplayName("listByOwner skips tombstones and other owners")
  void listByOwner() {
    ContentId a = post("alice");
    post("bob");
    ContentId c = post("alice");
    ledger.delete(a);
    assertEquals(List.of(c), ledger.listByOwner("alice"));
  }

  @Test
  @DisplayName("validate reports asymmetric edges and impossible counters")
  void validate_findsIssues() {
    ContentId a = post("alice");
    ContentId b = post("bob");
    ledger.link(b, a);
    assertEquals(0, ledger.validate().issues);

    ContentRecord broken = ledger.get(a);
    broken.repliedByTypes.clear();
    broken.repliedByIndexes.clear();
    broken.harvestedLikes = 3;
    ledger.update(a, broken);

    ContentLedger.ValidationReport rep = ledger.validate();
    assertEquals(2, rep.totalRecords);
    assertEquals(2, rep.issues, String.valueOf(rep.messages));
  }

  @Test
  @DisplayName("a restored ledger keeps indices and replaces null slots with empty records")
  void restore() {
    post("alice");
    post("bob");
    List<List<ContentRecord>> snap = ledger.snapshot();
    snap.get(ContentType.POST.ordinal()).set(1, null);

    ContentLedger restored = new ContentLedger(snap);
    assertEquals(2, restored.length(ContentType.POST));
    assertEquals("alice", restored.get(ContentId.of(ContentType.POST, 0)).owner);
    assertTrue(restored.get(ContentId.of(ContentType.POST, 1)).isTombstone());
  }
}
