package com.github.adamzv.proton.adapters.protobuf;

import com.github.adamzv.proton.domain.Problems;
import com.github.adamzv.proton.ports.SchemaDecoderPort;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat;
import java.util.Map;

public class ProtobufSchemaDecoder implements SchemaDecoderPort {

  private final MessageSchema schema;
  private final JsonFormat.Printer printer;

  public ProtobufSchemaDecoder(MessageSchema schema, boolean indent) {
    this.schema = schema;
    JsonFormat.Printer base = JsonFormat.printer().usingTypeRegistry(schema.typeRegistry());
    this.printer = indent ? base : base.omittingInsignificantWhitespace();
  }

  @Override
  public String decode(byte[] payload) {
    byte[] bytes = payload == null ? new byte[0] : payload;
    try {
      DynamicMessage message = DynamicMessage.parseFrom(schema.descriptor(), bytes);
      return printer.print(message);
    } catch (InvalidProtocolBufferException ex) {
      throw Problems.decodeFailed(
          ex.getMessage() != null ? ex.getMessage() : "Unable to decode payload",
          Map.of("messageType", schema.fullName(), "size", bytes.length),
          ex
      );
    }
  }
}
