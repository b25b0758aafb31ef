package io.b2mash.b2b.workflowengine.activity;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ActivityEventHandlerTest {

  @Mock private ActivityLogSink activityLogSink;

  private ActivityEventHandler handler;

  @BeforeEach
  void setUp() {
    handler = new ActivityEventHandler(activityLogSink);
  }

  @Test
  void onActivityLogged_forwardsToSink() {
    var event =
        ActivityLoggedEvent.forTask(
            UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), "moved");

    handler.onActivityLogged(event);

    verify(activityLogSink).logEvent(event);
  }

  @Test
  void onActivityLogged_sinkFailureIsNotPropagated() {
    var event = ActivityLoggedEvent.forFirm(UUID.randomUUID(), null, "compiled");
    doThrow(new IllegalStateException("sink down")).when(activityLogSink).logEvent(event);

    assertThatCode(() -> handler.onActivityLogged(event)).doesNotThrowAnyException();
  }
}
