package com.acme.achnotify.domain;

/** Stages of a notification run, in the only order they are entered. */
public enum JobStage {
  COLLECTING_INPUT,
  NORMALIZING,
  GROUPING,
  GENERATING_AND_NOTIFYING,
  SUMMARIZING,
  DONE
}
