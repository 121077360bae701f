package com.pipedesk.drive.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

@AllArgsConstructor
@Getter
public enum EntityTypeEnum {

    COMPANY("company", null),

    LEAD("lead", "01. Leads"),

    DEAL("deal", "02. Deals"),

    // sentinel type for the shared "Companies" folder
    SYSTEM_ROOT("system_root", null),
    ;

    private final String code;

    // folder grouping this type inside its company folder, null when not nested under a company
    private final String structuralFolderName;

    public boolean isBusinessEntity() {
        return this != SYSTEM_ROOT;
    }

    public static EntityTypeEnum fromCode(String code) {
        if (StringUtils.isBlank(code)) {
            return null;
        }
        for (EntityTypeEnum value : values()) {
            if (value.code.equalsIgnoreCase(code.trim())) {
                return value;
            }
        }
        return null;
    }
}
