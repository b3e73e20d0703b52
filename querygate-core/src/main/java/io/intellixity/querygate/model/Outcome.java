package io.intellixity.querygate.model;

public enum Outcome {
  ALLOW_NO_DATA,
  ALLOW_WITH_AUTH,
  DENY
}
