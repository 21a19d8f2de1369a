package io.leadline.pipeline.exception;

import org.springframework.http.HttpStatus;

public class ResourceNotFoundException extends PipelineException {

  public ResourceNotFoundException(String resourceType, Object id) {
    super(
        HttpStatus.NOT_FOUND,
        ErrorKind.NOT_FOUND,
        resourceType + " not found",
        "No " + resourceType.toLowerCase() + " found with id " + id);
  }
}
