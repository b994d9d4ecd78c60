package com.codeheadsystems.smartaccount.core.model;

/**
 * Capability tags for pluggable modules, numbered as in ERC-7579.
 */
public enum ModuleType {
  VALIDATOR(1),
  EXECUTOR(2),
  HOOK(4);

  private final int typeId;

  ModuleType(int typeId) {
    this.typeId = typeId;
  }

  public int typeId() {
    return typeId;
  }
}
