package com.github.adamzv.proton.adapters.protobuf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.proton.domain.ProblemCodes;
import com.github.adamzv.proton.domain.ProblemException;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.DynamicMessage;
import java.io.IOException;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class ProtobufSchemaDecoderTest {

  @TempDir
  Path tempDir;

  private MessageSchema person;

  @BeforeEach
  void setUp() throws IOException {
    Path path = TestSchemas.writeAddressBook(tempDir);
    person = new DescriptorSetLoader(new DefaultResourceLoader()).load(path.toString(), "tutorial", "Person");
  }

  @Test
  void decodesToCompactJson() {
    ProtobufSchemaDecoder decoder = new ProtobufSchemaDecoder(person, false);

    String json = decoder.decode(TestSchemas.person(person.descriptor(), "ABC", 1, "abc@thebeat.co"));

    assertEquals("{\"name\":\"ABC\",\"id\":1,\"email\":\"abc@thebeat.co\"}", json);
  }

  @Test
  void indentsWhenRequested() {
    ProtobufSchemaDecoder decoder = new ProtobufSchemaDecoder(person, true);

    String json = decoder.decode(TestSchemas.person(person.descriptor(), "ABC", 1, "abc@thebeat.co"));

    assertTrue(json.contains("\n"));
    assertTrue(json.contains("\"name\": \"ABC\""));
  }

  @Test
  void rendersWellKnownTypes() {
    Descriptor descriptor = person.descriptor();
    FieldDescriptor lastUpdated = descriptor.findFieldByName("last_updated");
    Descriptor timestamp = lastUpdated.getMessageType();
    byte[] payload = DynamicMessage.newBuilder(descriptor)
        .setField(descriptor.findFieldByName("name"), "DEF")
        .setField(lastUpdated, DynamicMessage.newBuilder(timestamp)
            .setField(timestamp.findFieldByName("seconds"), 1357118520L)
            .build())
        .build()
        .toByteArray();

    String json = new ProtobufSchemaDecoder(person, false).decode(payload);

    assertEquals("{\"name\":\"DEF\",\"lastUpdated\":\"2013-01-02T09:22:00Z\"}", json);
  }

  @Test
  void emptyPayloadIsEmptyMessage() {
    assertEquals("{}", new ProtobufSchemaDecoder(person, false).decode(new byte[0]));
  }

  @Test
  void truncatedPayloadFailsToDecode() {
    ProtobufSchemaDecoder decoder = new ProtobufSchemaDecoder(person, false);

    ProblemException ex = assertThrows(ProblemException.class,
        () -> decoder.decode(new byte[] {0x0A, 0x05, 'a'}));

    assertEquals(ProblemCodes.DECODE_FAILED, ex.code());
    assertEquals("tutorial.Person", ex.problem().details().get("messageType"));
  }
}
