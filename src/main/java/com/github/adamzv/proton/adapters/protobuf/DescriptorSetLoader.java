package com.github.adamzv.proton.adapters.protobuf;

import com.github.adamzv.proton.domain.Problems;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.util.JsonFormat.TypeRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Loads a compiled protobuf schema, a binary {@code FileDescriptorSet} as written by
 * {@code protoc --include_imports --descriptor_set_out}, from a file path or a resource URL.
 *
 * <p>The last file of the set is the target file: its package and its first message type are used
 * when none are configured.
 */
@Component
public class DescriptorSetLoader {

  private static final Logger log = LoggerFactory.getLogger(DescriptorSetLoader.class);

  // two or more characters, so that Windows drive letters are read as paths
  private static final Pattern URL_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]+:.*");

  private final ResourceLoader resourceLoader;

  public DescriptorSetLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  public MessageSchema load(String location, String packageName, String messageType) {
    if (location == null || location.isBlank()) {
      throw Problems.invalidArgument("Schema descriptor set location is required", Map.of());
    }

    FileDescriptorSet descriptorSet = read(location);
    if (descriptorSet.getFileCount() == 0) {
      throw Problems.schemaInvalid("Descriptor set contains no files", Map.of("location", location));
    }

    Map<String, FileDescriptorProto> protos = new LinkedHashMap<>();
    for (FileDescriptorProto proto : descriptorSet.getFileList()) {
      protos.put(proto.getName(), proto);
    }

    Map<String, FileDescriptor> built = new LinkedHashMap<>();
    for (String name : protos.keySet()) {
      build(name, protos, built, new HashSet<>());
    }

    FileDescriptor target = built.get(descriptorSet.getFile(descriptorSet.getFileCount() - 1).getName());
    String pkg = packageName == null || packageName.isBlank() ? target.getPackage() : packageName;
    String type = messageType;
    if (type == null || type.isBlank()) {
      if (target.getMessageTypes().isEmpty()) {
        throw Problems.schemaInvalid(
            "Target file declares no message types",
            Map.of("location", location, "file", target.getName())
        );
      }
      type = target.getMessageTypes().get(0).getName();
    }

    Descriptor descriptor = find(built.values(), pkg, type);
    if (descriptor == null) {
      throw Problems.schemaInvalid(
          String.format("can't find %s in %s package", type, pkg),
          Map.of("location", location, "package", pkg, "type", type)
      );
    }

    log.debug("schema_loaded location={} files={} messageType={}", location, built.size(),
        descriptor.getFullName());
    return new MessageSchema(descriptor, typeRegistry(built.values()));
  }

  private FileDescriptorSet read(String location) {
    Resource resource = resolve(location);
    if (!resource.exists()) {
      throw Problems.notFound("Schema descriptor set not found", Map.of("location", location));
    }
    try (InputStream in = resource.getInputStream()) {
      return FileDescriptorSet.parseFrom(in);
    } catch (InvalidProtocolBufferException ex) {
      throw Problems.schemaInvalid(
          "Schema is not a protobuf descriptor set",
          Map.of("location", location, "message", String.valueOf(ex.getMessage())),
          ex
      );
    } catch (IOException ex) {
      throw Problems.operationFailed(
          "Unable to read schema descriptor set",
          Map.of("location", location, "message", String.valueOf(ex.getMessage())),
          ex
      );
    }
  }

  private Resource resolve(String location) {
    if (URL_SCHEME.matcher(location).matches()) {
      return resourceLoader.getResource(location);
    }
    return new FileSystemResource(location);
  }

  private FileDescriptor build(String name, Map<String, FileDescriptorProto> protos,
                               Map<String, FileDescriptor> built, Set<String> visiting) {
    FileDescriptor existing = built.get(name);
    if (existing != null) {
      return existing;
    }
    FileDescriptorProto proto = protos.get(name);
    if (proto == null) {
      throw Problems.schemaInvalid(
          "Descriptor set is missing an imported file; compile it with --include_imports",
          Map.of("file", name)
      );
    }
    if (!visiting.add(name)) {
      throw Problems.schemaInvalid("Cyclic import in descriptor set", Map.of("file", name));
    }

    List<FileDescriptor> dependencies = new ArrayList<>(proto.getDependencyCount());
    for (String dependency : proto.getDependencyList()) {
      dependencies.add(build(dependency, protos, built, visiting));
    }

    try {
      FileDescriptor descriptor = FileDescriptor.buildFrom(proto, dependencies.toArray(new FileDescriptor[0]));
      built.put(name, descriptor);
      return descriptor;
    } catch (DescriptorValidationException ex) {
      throw Problems.schemaInvalid(
          "Invalid file descriptor",
          Map.of("file", name, "message", String.valueOf(ex.getMessage())),
          ex
      );
    }
  }

  private static Descriptor find(Iterable<FileDescriptor> files, String pkg, String type) {
    String[] path = type.split("\\.");
    for (FileDescriptor file : files) {
      if (!file.getPackage().equals(pkg)) {
        continue;
      }
      Descriptor current = file.findMessageTypeByName(path[0]);
      for (int i = 1; current != null && i < path.length; i++) {
        current = current.findNestedTypeByName(path[i]);
      }
      if (current != null) {
        return current;
      }
    }
    return null;
  }

  private static TypeRegistry typeRegistry(Iterable<FileDescriptor> files) {
    TypeRegistry.Builder builder = TypeRegistry.newBuilder();
    for (FileDescriptor file : files) {
      builder.add(file.getMessageTypes());
    }
    return builder.build();
  }
}
