package com.github.adamzv.proton.domain;

public enum TaskState {
  RUNNING,
  REACHED,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
