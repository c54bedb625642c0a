package com.al.shopsync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectionStatus {
    private String system;
    private boolean success;
    private Map<String, Object> info;
    private String error;

    public static ConnectionStatus ok(String system, Map<String, Object> info) {
        return ConnectionStatus.builder().system(system).success(true).info(info).build();
    }

    public static ConnectionStatus failed(String system, String error) {
        return ConnectionStatus.builder().system(system).success(false).error(error).build();
    }
}
