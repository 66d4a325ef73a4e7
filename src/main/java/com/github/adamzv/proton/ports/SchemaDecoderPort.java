package com.github.adamzv.proton.ports;

import com.github.adamzv.proton.domain.ProblemException;

public interface SchemaDecoderPort {

  String decode(byte[] payload) throws ProblemException;
}
