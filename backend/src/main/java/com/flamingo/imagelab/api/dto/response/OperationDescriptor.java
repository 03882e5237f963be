package com.flamingo.imagelab.api.dto.response;

import com.flamingo.imagelab.processing.ImageOperation;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** An applied operation as echoed back to clients. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationDescriptor {
  private String operation;
  private Map<String, Object> params;

  public static OperationDescriptor from(ImageOperation operation) {
    return new OperationDescriptor(operation.type().wireName(), operation.parameters());
  }
}
