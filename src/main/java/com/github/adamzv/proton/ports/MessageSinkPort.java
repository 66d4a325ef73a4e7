package com.github.adamzv.proton.ports;

import com.github.adamzv.proton.domain.DecodedResult;

public interface MessageSinkPort {

  // Called concurrently by partition tasks; each result must be written as one unit.
  void emit(DecodedResult result);
}
