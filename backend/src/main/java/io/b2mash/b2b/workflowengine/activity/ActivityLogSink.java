package io.b2mash.b2b.workflowengine.activity;

/** Destination for committed workflow activity. */
public interface ActivityLogSink {

  void logEvent(ActivityLoggedEvent event);
}
