package com.github.adamzv.proton.adapters.protobuf;

import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.util.JsonFormat.TypeRegistry;

public record MessageSchema(
    Descriptor descriptor,
    TypeRegistry typeRegistry
) {

  public String fullName() {
    return descriptor.getFullName();
  }
}
