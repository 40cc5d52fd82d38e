package com.mk.fx.qa.latency.harness.resource;

import com.mk.fx.qa.latency.harness.dto.controllerresponse.HeartbeatRequest;
import com.mk.fx.qa.latency.harness.model.ClientCapabilities;
import com.mk.fx.qa.latency.harness.model.ClientType;
import org.mapstruct.Mapper;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface ClientMapper {

  ClientCapabilities toCapabilities(HeartbeatRequest.Capabilities capabilities);

  @Named("mapClientType")
  default ClientType mapClientType(String clientType) {
    return ClientType.fromValue(clientType);
  }
}
