package com.pipedesk.drive.model.entity;

import com.baomidou.mybatisplus.annotation.*;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("folder_template")
public class FolderTemplateEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long templateId;

    private String templateName;

    private String entityType;

    @TableField(fill = FieldFill.INSERT)
    private Boolean active;

    // loaded separately, not a column
    @TableField(exist = false)
    private List<FolderTemplateNodeEntity> nodes = new ArrayList<>();
}
