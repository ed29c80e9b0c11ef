package bulkmail.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CampaignStatusTest {

  @Test
  void forwardEdges() {
    assertTrue(CampaignStatus.DRAFT.canTransitionTo(CampaignStatus.SCHEDULED));
    assertTrue(CampaignStatus.SCHEDULED.canTransitionTo(CampaignStatus.IN_PROGRESS));
    assertTrue(CampaignStatus.IN_PROGRESS.canTransitionTo(CampaignStatus.COMPLETED));
  }

  @Test
  void cancellationOnlyBeforeDispatch() {
    assertTrue(CampaignStatus.DRAFT.canTransitionTo(CampaignStatus.CANCELLED));
    assertTrue(CampaignStatus.SCHEDULED.canTransitionTo(CampaignStatus.CANCELLED));
    assertFalse(CampaignStatus.IN_PROGRESS.canTransitionTo(CampaignStatus.CANCELLED));
    assertFalse(CampaignStatus.CANCELLED.canTransitionTo(CampaignStatus.CANCELLED));
  }

  @Test
  void terminalStatesHaveNoOutgoingEdges() {
    for (CampaignStatus next : CampaignStatus.values()) {
      assertFalse(CampaignStatus.COMPLETED.canTransitionTo(next));
      assertFalse(CampaignStatus.CANCELLED.canTransitionTo(next));
    }
    assertTrue(CampaignStatus.COMPLETED.isTerminal());
    assertTrue(CampaignStatus.CANCELLED.isTerminal());
    assertFalse(CampaignStatus.IN_PROGRESS.isTerminal());
  }

  @Test
  void noBackwardEdges() {
    assertFalse(CampaignStatus.SCHEDULED.canTransitionTo(CampaignStatus.DRAFT));
    assertFalse(CampaignStatus.IN_PROGRESS.canTransitionTo(CampaignStatus.SCHEDULED));
    assertFalse(CampaignStatus.DRAFT.canTransitionTo(CampaignStatus.IN_PROGRESS));
    assertFalse(CampaignStatus.SCHEDULED.canTransitionTo(CampaignStatus.COMPLETED));
  }

  @Test
  void predecessors() {
    assertEquals(EnumSet.of(CampaignStatus.DRAFT, CampaignStatus.SCHEDULED),
        CampaignStatus.predecessorsOf(CampaignStatus.CANCELLED));
    assertEquals(EnumSet.of(CampaignStatus.IN_PROGRESS),
        CampaignStatus.predecessorsOf(CampaignStatus.COMPLETED));
    assertTrue(CampaignStatus.predecessorsOf(CampaignStatus.DRAFT).isEmpty());
  }

  @Test
  void codesRoundTrip() {
    for (CampaignStatus status : CampaignStatus.values()) {
      assertEquals(status, CampaignStatus.fromCode(status.code()));
    }
    assertThrows(IllegalArgumentException.class, () -> CampaignStatus.fromCode(99));
  }
}
