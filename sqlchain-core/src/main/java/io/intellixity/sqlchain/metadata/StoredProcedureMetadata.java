package io.intellixity.sqlchain.metadata;

import java.util.List;
import java.util.Objects;

public record StoredProcedureMetadata<N>(N name, List<ParameterMetadata> parameters) {
  public StoredProcedureMetadata {
    Objects.requireNonNull(name, "name");
    parameters = List.copyOf(parameters);
  }
}
