package com.flamingo.ai.studymind.service.planning;

/** Where a planned item will be attached once it is materialized. */
public sealed interface ParentRef
    permits ParentRef.Root, ParentRef.Existing, ParentRef.PendingSibling {

  /** Top level of the user's library. */
  record Root() implements ParentRef {}

  /** An item that already exists in the store. */
  record Existing(long id) implements ParentRef {}

  /** The item materialized immediately before this one in the same run. */
  record PendingSibling() implements ParentRef {}

  static ParentRef root() {
    return new Root();
  }

  static ParentRef existing(long id) {
    return new Existing(id);
  }

  static ParentRef pendingSibling() {
    return new PendingSibling();
  }
}
