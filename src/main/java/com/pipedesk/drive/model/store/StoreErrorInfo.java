package com.pipedesk.drive.model.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StoreErrorInfo {

    private String error;

    private String message;

    private Integer status;
}
