package com.github.adamzv.proton.adapters.protobuf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.github.adamzv.proton.domain.ProblemCodes;
import com.github.adamzv.proton.domain.ProblemException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

class DescriptorSetLoaderTest {

  private final DescriptorSetLoader loader = new DescriptorSetLoader(new DefaultResourceLoader());

  @TempDir
  Path tempDir;

  @Test
  void defaultsToFirstMessageOfTargetFilePackage() throws IOException {
    Path path = TestSchemas.writeAddressBook(tempDir);

    MessageSchema schema = loader.load(path.toString(), null, null);

    assertEquals("tutorial.Person", schema.fullName());
    assertNotNull(schema.typeRegistry().find("google.protobuf.Timestamp"));
  }

  @Test
  void findsConfiguredAndNestedTypes() throws IOException {
    Path path = TestSchemas.writeAddressBook(tempDir);

    assertEquals("tutorial.AddressBook", loader.load(path.toString(), "tutorial", "AddressBook").fullName());
    assertEquals("tutorial.Person.PhoneNumber",
        loader.load(path.toString(), "tutorial", "Person.PhoneNumber").fullName());
    assertEquals("google.protobuf.Timestamp",
        loader.load(path.toString(), "google.protobuf", "Timestamp").fullName());
  }

  @Test
  void loadsFromFileUrl() throws IOException {
    Path path = TestSchemas.writeAddressBook(tempDir);

    MessageSchema schema = loader.load(path.toUri().toString(), "", "");

    assertEquals("tutorial.Person", schema.fullName());
  }

  @Test
  void unknownTypeIsReported() throws IOException {
    Path path = TestSchemas.writeAddressBook(tempDir);

    ProblemException ex = assertThrows(ProblemException.class,
        () -> loader.load(path.toString(), "tutorial", "Nope"));

    assertEquals(ProblemCodes.SCHEMA_INVALID, ex.code());
    assertEquals("can't find Nope in tutorial package", ex.getMessage());
  }

  @Test
  void missingImportIsReported() throws IOException {
    Path path = TestSchemas.writeDescriptorSet(tempDir, TestSchemas.addressBookFile());

    ProblemException ex = assertThrows(ProblemException.class, () -> loader.load(path.toString(), null, null));

    assertEquals(ProblemCodes.SCHEMA_INVALID, ex.code());
    assertEquals(TestSchemas.TIMESTAMP_FILE, ex.problem().details().get("file"));
  }

  @Test
  void missingFileIsNotFound() {
    ProblemException ex = assertThrows(ProblemException.class,
        () -> loader.load(tempDir.resolve("absent.desc").toString(), null, null));

    assertEquals(ProblemCodes.NOT_FOUND, ex.code());
  }

  @Test
  void corruptDescriptorSetIsRejected() throws IOException {
    Path path = Files.write(tempDir.resolve("broken.desc"), new byte[] {0x0A, 0x05, 'a'});

    ProblemException ex = assertThrows(ProblemException.class, () -> loader.load(path.toString(), null, null));

    assertEquals(ProblemCodes.SCHEMA_INVALID, ex.code());
  }

  @Test
  void blankLocationIsRejected() {
    ProblemException ex = assertThrows(ProblemException.class, () -> loader.load(" ", null, null));

    assertEquals(ProblemCodes.INVALID_ARGUMENT, ex.code());
  }
}
