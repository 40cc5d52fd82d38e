package com.mk.fx.qa.latency.harness.exception;

/** An operation referenced a suite, run, baseline, client or dispatch that does not exist. */
public class ResourceNotFoundException extends RuntimeException {

  private final String resourceType;
  private final String resourceId;

  public ResourceNotFoundException(String resourceType, String resourceId) {
    super(resourceType + " not found: " + resourceId);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
  }

  public String getResourceType() {
    return resourceType;
  }

  public String getResourceId() {
    return resourceId;
  }
}
