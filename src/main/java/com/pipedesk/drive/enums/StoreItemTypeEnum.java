package com.pipedesk.drive.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum StoreItemTypeEnum {

    FOLDER("application/vnd.google-apps.folder"),

    FILE(null),
    ;

    private final String mimeType;
}
