/*
 * Copyright 2026 The ext-authz Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.extauthz;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableMap;
import com.google.protobuf.AnyProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.FileDescriptorSet;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.Descriptors.MethodDescriptor;
import com.google.protobuf.Descriptors.ServiceDescriptor;
import com.google.protobuf.DurationProto;
import com.google.protobuf.EmptyProto;
import com.google.protobuf.FieldMaskProto;
import com.google.protobuf.StructProto;
import com.google.protobuf.TimestampProto;
import com.google.protobuf.WrappersProto;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Index of the services and messages found in a compiled descriptor set (the output of
 * {@code protoc --descriptor_set_out}). Used to decode binary gRPC request bodies into structured
 * form before they are handed to the policy.
 *
 * <p>Well-known types may be omitted from the set; they resolve against the copies bundled with
 * the protobuf runtime.
 */
public final class ProtoDescriptorRegistry {

  private static final ImmutableMap<String, FileDescriptor> WELL_KNOWN_FILES =
      indexByName(
          AnyProto.getDescriptor(),
          DurationProto.getDescriptor(),
          EmptyProto.getDescriptor(),
          FieldMaskProto.getDescriptor(),
          StructProto.getDescriptor(),
          TimestampProto.getDescriptor(),
          WrappersProto.getDescriptor(),
          com.google.protobuf.DescriptorProtos.getDescriptor());

  private final ImmutableMap<String, FileDescriptor> filesByName;
  private final ImmutableMap<String, MethodDescriptor> methodsByName;
  private final ImmutableMap<String, Descriptor> messagesByName;

  private ProtoDescriptorRegistry(Map<String, FileDescriptor> files) {
    this.filesByName = ImmutableMap.copyOf(files);
    Map<String, MethodDescriptor> methods = new LinkedHashMap<>();
    Map<String, Descriptor> messages = new LinkedHashMap<>();
    for (FileDescriptor file : files.values()) {
      for (ServiceDescriptor service : file.getServices()) {
        for (MethodDescriptor method : service.getMethods()) {
          methods.put(method.getFullName(), method);
        }
      }
      for (Descriptor message : file.getMessageTypes()) {
        indexMessage(message, messages);
      }
    }
    this.methodsByName = ImmutableMap.copyOf(methods);
    this.messagesByName = ImmutableMap.copyOf(messages);
  }

  /**
   * Reads a serialized {@link FileDescriptorSet} from {@code path}.
   *
   * @throws IOException if the file cannot be read, is not a descriptor set, or describes files
   *     whose dependencies cannot be resolved
   */
  public static ProtoDescriptorRegistry readFrom(Path path) throws IOException {
    checkNotNull(path, "path");
    FileDescriptorSet set;
    try (InputStream in = Files.newInputStream(path)) {
      set = FileDescriptorSet.parseFrom(in);
    }
    try {
      return fromDescriptorSet(set);
    } catch (DescriptorValidationException | IllegalArgumentException e) {
      throw new IOException("invalid descriptor set " + path + ": " + e.getMessage(), e);
    }
  }

  /** Builds a registry from an in-memory descriptor set. */
  public static ProtoDescriptorRegistry fromDescriptorSet(FileDescriptorSet set)
      throws DescriptorValidationException {
    Map<String, FileDescriptorProto> protosByName = new LinkedHashMap<>();
    for (FileDescriptorProto proto : set.getFileList()) {
      protosByName.put(proto.getName(), proto);
    }
    Map<String, FileDescriptor> built = new LinkedHashMap<>();
    for (String name : protosByName.keySet()) {
      build(name, protosByName, built, new HashSet<String>());
    }
    return new ProtoDescriptorRegistry(built);
  }

  private static FileDescriptor build(String name, Map<String, FileDescriptorProto> protosByName,
      Map<String, FileDescriptor> built, Set<String> inProgress)
      throws DescriptorValidationException {
    FileDescriptor done = built.get(name);
    if (done != null) {
      return done;
    }
    FileDescriptorProto proto = protosByName.get(name);
    if (proto == null) {
      FileDescriptor wellKnown = WELL_KNOWN_FILES.get(name);
      if (wellKnown == null) {
        throw new IllegalArgumentException("missing dependency " + name);
      }
      return wellKnown;
    }
    if (!inProgress.add(name)) {
      throw new IllegalArgumentException("cyclic dependency on " + name);
    }
    FileDescriptor[] dependencies = new FileDescriptor[proto.getDependencyCount()];
    for (int i = 0; i < dependencies.length; i++) {
      dependencies[i] = build(proto.getDependency(i), protosByName, built, inProgress);
    }
    FileDescriptor file = FileDescriptor.buildFrom(proto, dependencies);
    built.put(name, file);
    return file;
  }

  private static void indexMessage(Descriptor message, Map<String, Descriptor> messages) {
    messages.put(message.getFullName(), message);
    for (Descriptor nested : message.getNestedTypes()) {
      indexMessage(nested, messages);
    }
  }

  private static ImmutableMap<String, FileDescriptor> indexByName(FileDescriptor... files) {
    Map<String, FileDescriptor> byName = new HashMap<>();
    for (FileDescriptor file : files) {
      byName.put(file.getName(), file);
    }
    return ImmutableMap.copyOf(byName);
  }

  /**
   * Looks up a method by its fully qualified name, for example
   * {@code helloworld.Greeter.SayHello}.
   */
  @Nullable
  public MethodDescriptor findMethod(String fullName) {
    return methodsByName.get(fullName);
  }

  /** Looks up a message type by its fully qualified name. */
  @Nullable
  public Descriptor findMessageType(String fullName) {
    return messagesByName.get(fullName);
  }

  /** Names of the files in the set, excluding well-known types that were resolved implicitly. */
  public Set<String> fileNames() {
    return filesByName.keySet();
  }
}
